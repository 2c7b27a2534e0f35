package edu.kit.kastel.vads.cdetector.parser;

public class ParseException extends RuntimeException {
    public ParseException(String message) {
        super(message);
    }
}

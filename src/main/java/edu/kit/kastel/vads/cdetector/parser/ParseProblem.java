package edu.kit.kastel.vads.cdetector.parser;

/// A syntax error the parser recovered from.
public record ParseProblem(int line, String message) {
}

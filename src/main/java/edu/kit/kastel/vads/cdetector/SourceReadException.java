package edu.kit.kastel.vads.cdetector;

import java.io.IOException;
import java.nio.file.Path;

/// The source could not be read. The only condition that stops an analysis.
public class SourceReadException extends RuntimeException {
    public SourceReadException(Path path, IOException cause) {
        super("cannot read " + path + ": " + cause.getMessage(), cause);
    }
}

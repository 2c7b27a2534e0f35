package edu.kit.kastel.vads.cdetector.diagnostic;

import edu.kit.kastel.vads.cdetector.Span;

@FunctionalInterface
public interface Reporter {

    void report(Diagnostic diagnostic);

    default void report(Span span, Category category, String message) {
        report(new Diagnostic(span.line(), category, message));
    }

    default void report(int line, Category category, String message) {
        report(new Diagnostic(line, category, message));
    }
}

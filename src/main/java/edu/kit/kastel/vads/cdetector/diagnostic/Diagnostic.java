package edu.kit.kastel.vads.cdetector.diagnostic;

import java.util.Locale;

public record Diagnostic(int line, Category category, String message, String suggestion) {

    public Diagnostic(int line, Category category, String message) {
        this(line, category, message, category.suggestion());
    }

    public Severity severity() {
        return category().severity();
    }

    @Override
    public String toString() {
        return line + ": " + severity().name().toLowerCase(Locale.ROOT) + " [" + category.tag() + "] " + message;
    }
}

package edu.kit.kastel.vads.cdetector.semantic.format;

import java.util.ArrayList;
import java.util.List;

import org.jspecify.annotations.Nullable;

/// Splits the text of a format string literal into its conversion directives.
/// {@code %%} and malformed directives produce nothing.
public final class FormatString {
    private static final String FLAGS = "-+ #0'";
    private static final String CONVERSIONS = "diuoxXcsfFeEgGaApn[";

    private final String text;
    private final FormatDirection direction;
    private int position;

    private FormatString(String text, FormatDirection direction) {
        this.text = text;
        this.direction = direction;
    }

    public static List<ConversionSpecifier> parse(String text, FormatDirection direction) {
        return new FormatString(text, direction).parseAll();
    }

    private List<ConversionSpecifier> parseAll() {
        List<ConversionSpecifier> specifiers = new ArrayList<>();
        while (this.position < this.text.length()) {
            char c = this.text.charAt(this.position);
            if (c == '\\') {
                // escape sequences never start a directive
                this.position += 2;
                continue;
            }
            if (c != '%') {
                this.position++;
                continue;
            }
            if (peek(1) == '%') {
                this.position += 2;
                continue;
            }
            ConversionSpecifier specifier = parseDirective();
            if (specifier != null) {
                specifiers.add(specifier);
            }
        }
        return specifiers;
    }

    private @Nullable ConversionSpecifier parseDirective() {
        int start = this.position;
        this.position++;
        boolean suppressed = false;
        boolean starWidth = false;
        boolean starPrecision = false;
        if (this.direction == FormatDirection.INPUT && peek(0) == '*') {
            suppressed = true;
            this.position++;
        }
        while (this.direction == FormatDirection.OUTPUT && FLAGS.indexOf(peek(0)) >= 0) {
            this.position++;
        }
        if (this.direction == FormatDirection.OUTPUT && peek(0) == '*') {
            starWidth = true;
            this.position++;
        } else {
            skipDigits();
        }
        if (peek(0) == '.') {
            this.position++;
            if (this.direction == FormatDirection.OUTPUT && peek(0) == '*') {
                starPrecision = true;
                this.position++;
            } else {
                skipDigits();
            }
        }
        LengthModifier length = parseLength();
        char conversion = peek(0);
        if (conversion == 0 || CONVERSIONS.indexOf(conversion) < 0) {
            return null;
        }
        this.position++;
        if (conversion == '[') {
            skipScanSet();
        }
        String directive = this.text.substring(start, Math.min(this.position, this.text.length()));
        return new ConversionSpecifier(directive, starWidth, starPrecision, suppressed, length, conversion);
    }

    private LengthModifier parseLength() {
        char c = peek(0);
        switch (c) {
            case 'h':
                this.position++;
                if (peek(0) == 'h') {
                    this.position++;
                    return LengthModifier.CHAR;
                }
                return LengthModifier.SHORT;
            case 'l':
                this.position++;
                if (peek(0) == 'l') {
                    this.position++;
                    return LengthModifier.LONG_LONG;
                }
                return LengthModifier.LONG;
            case 'L':
                this.position++;
                return LengthModifier.LONG_DOUBLE;
            case 'z':
                this.position++;
                return LengthModifier.SIZE;
            case 'j':
                this.position++;
                return LengthModifier.INTMAX;
            case 't':
                this.position++;
                return LengthModifier.PTRDIFF;
            default:
                return LengthModifier.NONE;
        }
    }

    // a ']' right after '[' or '[^' belongs to the set
    private void skipScanSet() {
        if (peek(0) == '^') {
            this.position++;
        }
        if (peek(0) == ']') {
            this.position++;
        }
        while (this.position < this.text.length() && this.text.charAt(this.position) != ']') {
            this.position++;
        }
        this.position++;
    }

    private void skipDigits() {
        while (Character.isDigit(peek(0))) {
            this.position++;
        }
    }

    private char peek(int offset) {
        int index = this.position + offset;
        return index < this.text.length() ? this.text.charAt(index) : 0;
    }
}

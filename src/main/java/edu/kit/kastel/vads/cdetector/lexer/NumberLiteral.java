package edu.kit.kastel.vads.cdetector.lexer;

import edu.kit.kastel.vads.cdetector.Span;

/// `value` holds the digits without base prefix or suffix.
public record NumberLiteral(String value, int base, String suffix, boolean floating, Span span) implements Token {

    @Override
    public TokenKind kind() {
        return TokenKind.LITERAL;
    }

    @Override
    public String asString() {
        String prefix = switch (base()) {
            case 16 -> "0x";
            case 8 -> "0";
            default -> "";
        };
        return prefix + value() + suffix();
    }
}

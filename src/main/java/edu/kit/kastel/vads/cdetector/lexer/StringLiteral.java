package edu.kit.kastel.vads.cdetector.lexer;

import edu.kit.kastel.vads.cdetector.Span;

/// The raw text between the quotes, escape sequences left as written.
public record StringLiteral(String value, Span span) implements Token {

    @Override
    public TokenKind kind() {
        return TokenKind.LITERAL;
    }

    @Override
    public String asString() {
        return "\"" + value() + "\"";
    }
}

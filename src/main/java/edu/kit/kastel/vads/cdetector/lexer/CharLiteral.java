package edu.kit.kastel.vads.cdetector.lexer;

import edu.kit.kastel.vads.cdetector.Span;

public record CharLiteral(String value, Span span) implements Token {

    @Override
    public TokenKind kind() {
        return TokenKind.LITERAL;
    }

    @Override
    public String asString() {
        return "'" + value() + "'";
    }
}

package edu.kit.kastel.vads.cdetector.lexer;

import edu.kit.kastel.vads.cdetector.Span;

public record Keyword(KeywordType type, Span span) implements Token {

    @Override
    public TokenKind kind() {
        return TokenKind.KEYWORD;
    }

    @Override
    public boolean isKeyword(KeywordType keywordType) {
        return type() == keywordType;
    }

    @Override
    public String asString() {
        return type().keyword();
    }
}

package edu.kit.kastel.vads.cdetector.lexer;

import edu.kit.kastel.vads.cdetector.Span;
import edu.kit.kastel.vads.cdetector.lexer.Operator.OperatorType;
import edu.kit.kastel.vads.cdetector.lexer.Separator.SeparatorType;

public sealed interface Token
    permits CharLiteral, Directive, Identifier, Keyword, NumberLiteral, Operator, Separator, StringLiteral {

    Span span();

    TokenKind kind();

    default boolean isKeyword(KeywordType keywordType) {
        return false;
    }

    default boolean isOperator(OperatorType operatorType) {
        return false;
    }

    default boolean isSeparator(SeparatorType separatorType) {
        return false;
    }

    String asString();

    enum TokenKind {
        IDENTIFIER,
        KEYWORD,
        LITERAL,
        PUNCTUATION,
        OPERATOR,
        DIRECTIVE
    }
}

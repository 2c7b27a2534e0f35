package edu.kit.kastel.vads.cdetector.lexer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.intellij.lang.annotations.Language;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import edu.kit.kastel.vads.cdetector.lexer.Operator.OperatorType;

public class TestLexer {

    private static List<Token> tokens(String source) {
        Lexer lexer = Lexer.forString(source);
        List<Token> tokens = new ArrayList<>();
        Optional<Token> token;
        while ((token = lexer.nextToken()).isPresent()) {
            tokens.add(token.get());
        }
        return tokens;
    }

    @Language("C")
    private static final String COMMENTS = """
        int x; /* first
           second */
        // third
        x = 0x1Fu;
        """;

    @DisplayName("newlines inside comments still advance the line counter")
    @Test
    public void commentsKeepLineNumbers() {
        List<Token> tokens = tokens(COMMENTS);
        assertEquals(7, tokens.size());
        assertTrue(tokens.get(0).isKeyword(KeywordType.INT));
        Token assigned = tokens.get(3);
        assertInstanceOf(Identifier.class, assigned);
        assertEquals(4, assigned.span().line());

        NumberLiteral literal = assertInstanceOf(NumberLiteral.class, tokens.get(5));
        assertEquals("1F", literal.value());
        assertEquals(16, literal.base());
        assertEquals("u", literal.suffix());
        assertFalse(literal.floating());
    }

    @Language("C")
    private static final String DIRECTIVES = """
        #include <stdio.h>
        #define LIMIT 10 \\
            + 2
          #  include "graph.h"
        int limit;
        """;

    @Test
    public void onlyIncludesBecomeTokens() {
        List<Token> tokens = tokens(DIRECTIVES);
        assertEquals(5, tokens.size());
        Directive system = assertInstanceOf(Directive.class, tokens.get(0));
        assertEquals("include", system.name());
        assertEquals("<stdio.h>", system.argument());
        Directive local = assertInstanceOf(Directive.class, tokens.get(1));
        assertEquals("\"graph.h\"", local.argument());
        assertEquals(4, local.span().line());
        assertEquals(5, tokens.get(2).span().line());
    }

    @Test
    public void numberForms() {
        List<Token> tokens = tokens("017 0 1.5e3 2f 10UL .5");
        NumberLiteral octal = (NumberLiteral) tokens.get(0);
        assertEquals(8, octal.base());
        assertEquals("17", octal.value());
        NumberLiteral zero = (NumberLiteral) tokens.get(1);
        assertEquals(10, zero.base());
        assertEquals("0", zero.value());
        assertTrue(((NumberLiteral) tokens.get(2)).floating());
        assertTrue(((NumberLiteral) tokens.get(3)).floating());
        NumberLiteral unsignedLong = (NumberLiteral) tokens.get(4);
        assertEquals("UL", unsignedLong.suffix());
        assertFalse(unsignedLong.floating());
        assertTrue(((NumberLiteral) tokens.get(5)).floating());
    }

    @DisplayName("string contents keep their escapes and never produce tokens")
    @Test
    public void stringAndCharLiterals() {
        List<Token> tokens = tokens("printf(\"say \\\"hi\\\" // not a comment\\n\", '\\'');");
        StringLiteral string = assertInstanceOf(StringLiteral.class, tokens.get(2));
        assertEquals("say \\\"hi\\\" // not a comment\\n", string.value());
        CharLiteral quote = assertInstanceOf(CharLiteral.class, tokens.get(4));
        assertEquals("\\'", quote.value());
        assertEquals(7, tokens.size());
    }

    @Test
    public void longestOperatorWins() {
        List<Token> tokens = tokens("a <<= b->c && d-- != e");
        assertTrue(tokens.get(1).isOperator(OperatorType.ASSIGN_SHIFT_LEFT));
        assertTrue(tokens.get(3).isOperator(OperatorType.ARROW));
        assertTrue(tokens.get(5).isOperator(OperatorType.LOGICAL_AND));
        assertTrue(tokens.get(7).isOperator(OperatorType.DECREMENT));
        assertTrue(tokens.get(8).isOperator(OperatorType.NOT_EQUAL));
    }

    @Test
    public void unexpectedCharactersAreSkipped() {
        List<Token> tokens = tokens("a @ b");
        assertEquals(2, tokens.size());
        assertEquals("b", ((Identifier) tokens.get(1)).value());
    }
}

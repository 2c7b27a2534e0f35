package edu.kit.kastel.vads.cdetector.lexer;

import edu.kit.kastel.vads.cdetector.Span;

/// A preprocessor line the scanner keeps, currently only `#include`.
/// The argument keeps its delimiters, e.g. `<stdio.h>` or `"graph.h"`.
public record Directive(String name, String argument, Span span) implements Token {

    @Override
    public TokenKind kind() {
        return TokenKind.DIRECTIVE;
    }

    @Override
    public String asString() {
        return "#" + name() + " " + argument();
    }
}

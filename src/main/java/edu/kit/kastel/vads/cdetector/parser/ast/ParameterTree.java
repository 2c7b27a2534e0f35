package edu.kit.kastel.vads.cdetector.parser.ast;

import org.jspecify.annotations.Nullable;

import edu.kit.kastel.vads.cdetector.Span;
import edu.kit.kastel.vads.cdetector.parser.symbol.Symbol;
import edu.kit.kastel.vads.cdetector.parser.visitor.Visitor;

/// Prototype parameters may be unnamed and carry no symbol.
public record ParameterTree(TypeTree type, @Nullable NameTree name, @Nullable Symbol symbol, Span span)
    implements Tree {

    @Override
    public <T, R> R accept(Visitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }
}

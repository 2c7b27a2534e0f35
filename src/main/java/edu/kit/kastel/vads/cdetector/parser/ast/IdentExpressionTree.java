package edu.kit.kastel.vads.cdetector.parser.ast;

import org.jspecify.annotations.Nullable;

import edu.kit.kastel.vads.cdetector.Span;
import edu.kit.kastel.vads.cdetector.parser.symbol.Symbol;
import edu.kit.kastel.vads.cdetector.parser.visitor.Visitor;

/// {@code symbol} is the declaration live at this point of the parse, null for unresolved names.
public record IdentExpressionTree(NameTree name, @Nullable Symbol symbol) implements ExpressionTree {
    @Override
    public Span span() {
        return name().span();
    }

    @Override
    public <T, R> R accept(Visitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }
}

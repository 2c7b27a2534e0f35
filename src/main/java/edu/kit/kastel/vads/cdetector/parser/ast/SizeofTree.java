package edu.kit.kastel.vads.cdetector.parser.ast;

import org.jspecify.annotations.Nullable;

import edu.kit.kastel.vads.cdetector.Span;
import edu.kit.kastel.vads.cdetector.parser.visitor.Visitor;

/// Exactly one of {@code type} and {@code expression} is set.
public record SizeofTree(@Nullable TypeTree type, @Nullable ExpressionTree expression, Span span)
    implements ExpressionTree {

    @Override
    public <T, R> R accept(Visitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }
}

package edu.kit.kastel.vads.cdetector.parser.ast;

import org.jspecify.annotations.Nullable;

import edu.kit.kastel.vads.cdetector.Span;
import edu.kit.kastel.vads.cdetector.parser.visitor.Visitor;

/// {@code scope} holds the variables declared in the initializer.
public record ForTree(
    @Nullable StatementTree initializer,
    @Nullable ExpressionTree condition,
    @Nullable ExpressionTree step,
    StatementTree body,
    int scope,
    Span span
) implements StatementTree {

    @Override
    public <T, R> R accept(Visitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }
}

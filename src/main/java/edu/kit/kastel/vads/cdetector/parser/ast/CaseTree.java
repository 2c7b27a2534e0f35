package edu.kit.kastel.vads.cdetector.parser.ast;

import org.jspecify.annotations.Nullable;

import edu.kit.kastel.vads.cdetector.Span;
import edu.kit.kastel.vads.cdetector.parser.visitor.Visitor;

/// A {@code case} label, or {@code default} when the label is null. The labelled
/// statements follow as siblings in the enclosing block.
public record CaseTree(@Nullable ExpressionTree label, Span span) implements StatementTree {
    @Override
    public <T, R> R accept(Visitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }
}

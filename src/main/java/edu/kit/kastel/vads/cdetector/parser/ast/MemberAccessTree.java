package edu.kit.kastel.vads.cdetector.parser.ast;

import edu.kit.kastel.vads.cdetector.Span;
import edu.kit.kastel.vads.cdetector.parser.visitor.Visitor;

/// {@code object.member}, or {@code object->member} when {@code arrow} is set.
public record MemberAccessTree(ExpressionTree object, NameTree member, boolean arrow, Span span)
    implements ExpressionTree {

    @Override
    public <T, R> R accept(Visitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }
}

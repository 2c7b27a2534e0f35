package edu.kit.kastel.vads.cdetector.parser.ast;

import edu.kit.kastel.vads.cdetector.Span;
import edu.kit.kastel.vads.cdetector.lexer.Operator;
import edu.kit.kastel.vads.cdetector.parser.visitor.Visitor;

public record AssignmentTree(ExpressionTree lValue, Operator operator, ExpressionTree expression)
    implements ExpressionTree {

    @Override
    public Span span() {
        return lValue().span().merge(expression().span());
    }

    @Override
    public <T, R> R accept(Visitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }
}

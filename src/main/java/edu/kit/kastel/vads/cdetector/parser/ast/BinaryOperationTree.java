package edu.kit.kastel.vads.cdetector.parser.ast;

import edu.kit.kastel.vads.cdetector.Span;
import edu.kit.kastel.vads.cdetector.lexer.Operator.OperatorType;
import edu.kit.kastel.vads.cdetector.parser.visitor.Visitor;

public record BinaryOperationTree(ExpressionTree lhs, ExpressionTree rhs, OperatorType operatorType)
    implements ExpressionTree {

    @Override
    public Span span() {
        return lhs().span().merge(rhs().span());
    }

    @Override
    public <T, R> R accept(Visitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }
}

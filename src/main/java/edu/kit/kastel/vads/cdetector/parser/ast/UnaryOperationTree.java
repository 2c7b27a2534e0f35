package edu.kit.kastel.vads.cdetector.parser.ast;

import edu.kit.kastel.vads.cdetector.Span;
import edu.kit.kastel.vads.cdetector.lexer.Operator.OperatorType;
import edu.kit.kastel.vads.cdetector.parser.visitor.Visitor;

/// Arithmetic, logical and bitwise prefix operators plus prefix and postfix {@code ++}/{@code --}.
public record UnaryOperationTree(OperatorType operatorType, ExpressionTree operand, boolean postfix, Span span)
    implements ExpressionTree {

    public boolean isIncrementOrDecrement() {
        return operatorType() == OperatorType.INCREMENT || operatorType() == OperatorType.DECREMENT;
    }

    @Override
    public <T, R> R accept(Visitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }
}

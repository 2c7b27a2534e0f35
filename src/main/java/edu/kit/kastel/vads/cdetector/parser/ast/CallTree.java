package edu.kit.kastel.vads.cdetector.parser.ast;

import java.util.List;

import org.jspecify.annotations.Nullable;

import edu.kit.kastel.vads.cdetector.Span;
import edu.kit.kastel.vads.cdetector.parser.visitor.Visitor;

public record CallTree(ExpressionTree callee, List<ExpressionTree> arguments, Span span) implements ExpressionTree {

    public CallTree {
        arguments = List.copyOf(arguments);
    }

    /// The called name for direct calls, null for calls through an expression.
    public @Nullable String calleeName() {
        if (callee() instanceof IdentExpressionTree ident) {
            return ident.name().name().asString();
        }
        return null;
    }

    @Override
    public <T, R> R accept(Visitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }
}

package edu.kit.kastel.vads.cdetector.parser.ast;

import java.util.List;

import edu.kit.kastel.vads.cdetector.Span;
import edu.kit.kastel.vads.cdetector.parser.visitor.Visitor;

public record InitializerListTree(List<ExpressionTree> elements, Span span) implements ExpressionTree {

    public InitializerListTree {
        elements = List.copyOf(elements);
    }

    @Override
    public <T, R> R accept(Visitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }
}

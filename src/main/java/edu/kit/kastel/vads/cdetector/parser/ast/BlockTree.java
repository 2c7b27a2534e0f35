package edu.kit.kastel.vads.cdetector.parser.ast;

import java.util.List;

import edu.kit.kastel.vads.cdetector.Span;
import edu.kit.kastel.vads.cdetector.parser.visitor.Visitor;

public record BlockTree(List<StatementTree> statements, int scope, Span span) implements StatementTree {

    public BlockTree {
        statements = List.copyOf(statements);
    }

    @Override
    public <T, R> R accept(Visitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }
}

package edu.kit.kastel.vads.cdetector.parser.ast;

import java.util.List;

import edu.kit.kastel.vads.cdetector.Position;
import edu.kit.kastel.vads.cdetector.Span;
import edu.kit.kastel.vads.cdetector.parser.visitor.Visitor;

public record ProgramTree(List<Tree> topLevelTrees) implements Tree {
    public ProgramTree {
        topLevelTrees = List.copyOf(topLevelTrees);
    }

    @Override
    public Span span() {
        if (topLevelTrees().isEmpty()) {
            Position start = new Position.SimplePosition(1, 0);
            return new Span.SimpleSpan(start, start);
        }
        Tree first = topLevelTrees().get(0);
        Tree last = topLevelTrees().get(topLevelTrees().size() - 1);
        return first.span().merge(last.span());
    }

    @Override
    public <T, R> R accept(Visitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }
}

package edu.kit.kastel.vads.cdetector.parser.ast;

import java.util.List;

import edu.kit.kastel.vads.cdetector.Span;
import edu.kit.kastel.vads.cdetector.parser.symbol.Symbol;
import edu.kit.kastel.vads.cdetector.parser.visitor.Visitor;

public record FunctionDeclarationTree(TypeTree returnType, NameTree name, List<ParameterTree> parameters,
    Symbol symbol, Span span) implements Tree {

    public FunctionDeclarationTree {
        parameters = List.copyOf(parameters);
    }

    @Override
    public <T, R> R accept(Visitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }
}

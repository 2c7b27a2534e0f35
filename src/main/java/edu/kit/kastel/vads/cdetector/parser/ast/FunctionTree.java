package edu.kit.kastel.vads.cdetector.parser.ast;

import java.util.List;

import edu.kit.kastel.vads.cdetector.Span;
import edu.kit.kastel.vads.cdetector.parser.symbol.Symbol;
import edu.kit.kastel.vads.cdetector.parser.visitor.Visitor;

/// Parameters and the outermost block of the body share the function scope.
public record FunctionTree(TypeTree returnType, NameTree name, List<ParameterTree> parameters, BlockTree body,
    Symbol symbol, int scope) implements Tree {

    public FunctionTree {
        parameters = List.copyOf(parameters);
    }

    @Override
    public Span span() {
        return returnType().span().merge(body().span());
    }

    @Override
    public <T, R> R accept(Visitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }
}

package edu.kit.kastel.vads.cdetector.parser.ast;

import org.jspecify.annotations.Nullable;

import edu.kit.kastel.vads.cdetector.Span;
import edu.kit.kastel.vads.cdetector.parser.symbol.Symbol;
import edu.kit.kastel.vads.cdetector.parser.visitor.Visitor;

public record DeclarationTree(TypeTree type, NameTree name, @Nullable ExpressionTree initializer, Symbol symbol)
    implements StatementTree {

    @Override
    public Span span() {
        if (initializer() != null) {
            return type().span().merge(initializer().span());
        }
        return type().span().merge(name().span());
    }

    @Override
    public <T, R> R accept(Visitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }
}

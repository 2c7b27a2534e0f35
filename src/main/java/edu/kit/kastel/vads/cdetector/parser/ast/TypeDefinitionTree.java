package edu.kit.kastel.vads.cdetector.parser.ast;

import java.util.List;

import org.jspecify.annotations.Nullable;

import edu.kit.kastel.vads.cdetector.Span;
import edu.kit.kastel.vads.cdetector.parser.symbol.Symbol;
import edu.kit.kastel.vads.cdetector.parser.type.Type;
import edu.kit.kastel.vads.cdetector.parser.visitor.Visitor;

/// A struct, union or enum body. Members are struct members or enum constants,
/// {@code type} is the type the body defines.
public record TypeDefinitionTree(TagKind tagKind, @Nullable String tag, Type type, List<Symbol> members, Span span)
    implements StatementTree {

    public TypeDefinitionTree {
        members = List.copyOf(members);
    }

    @Override
    public <T, R> R accept(Visitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }

    public enum TagKind {
        STRUCT,
        UNION,
        ENUM
    }
}

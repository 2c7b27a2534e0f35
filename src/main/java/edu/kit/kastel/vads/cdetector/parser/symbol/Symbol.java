package edu.kit.kastel.vads.cdetector.parser.symbol;

import edu.kit.kastel.vads.cdetector.Span;
import edu.kit.kastel.vads.cdetector.parser.type.Type;

/// One symbol per declaration. Two declarations never share a span, so record
/// equality coincides with declaration identity.
public record Symbol(Name name, Type type, int scope, SymbolKind kind, StorageClass storage, Span span) {

    public boolean isPointer() {
        return kind() == SymbolKind.POINTER
            || kind() == SymbolKind.PARAMETER && type().isPointer();
    }

    public boolean isArray() {
        return kind() == SymbolKind.ARRAY;
    }

    @Override
    public String toString() {
        return name().asString() + "@" + span().line();
    }
}

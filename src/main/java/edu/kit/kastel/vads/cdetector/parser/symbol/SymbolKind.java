package edu.kit.kastel.vads.cdetector.parser.symbol;

public enum SymbolKind {
    VARIABLE,
    POINTER,
    ARRAY,
    STRUCT_MEMBER,
    PARAMETER,
    FUNCTION,
    ENUM_CONSTANT
}

package edu.kit.kastel.vads.cdetector.parser.symbol;

public enum ScopeKind {
    TRANSLATION_UNIT,
    FUNCTION,
    BLOCK,
    STRUCT
}

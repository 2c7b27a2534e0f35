package edu.kit.kastel.vads.cdetector.semantic.format;

public enum LengthModifier {
    NONE(""),
    CHAR("hh"),
    SHORT("h"),
    LONG("l"),
    LONG_LONG("ll"),
    LONG_DOUBLE("L"),
    SIZE("z"),
    INTMAX("j"),
    PTRDIFF("t");

    private final String spelling;

    LengthModifier(String spelling) {
        this.spelling = spelling;
    }

    public String spelling() {
        return spelling;
    }
}

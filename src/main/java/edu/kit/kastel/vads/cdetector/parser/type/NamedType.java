package edu.kit.kastel.vads.cdetector.parser.type;

/// Struct, union and typedef names whose layout is not modeled.
public record NamedType(String name) implements Type {

    @Override
    public String asString() {
        return name();
    }
}

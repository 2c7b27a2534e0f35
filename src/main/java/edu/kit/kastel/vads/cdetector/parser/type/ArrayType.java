package edu.kit.kastel.vads.cdetector.parser.type;

public record ArrayType(Type element) implements Type {

    @Override
    public Type referenced() {
        return element();
    }

    @Override
    public String asString() {
        return element().asString() + "[]";
    }
}

package edu.kit.kastel.vads.cdetector.parser.type;

public record PointerType(Type pointee) implements Type {

    @Override
    public boolean isPointer() {
        return true;
    }

    @Override
    public Type referenced() {
        return pointee();
    }

    @Override
    public String asString() {
        return pointee().asString() + "*";
    }
}

package edu.kit.kastel.vads.cdetector.parser.type;

public sealed interface Type permits ArrayType, BasicType, NamedType, PointerType {

    String asString();

    default boolean isPointer() {
        return false;
    }

    default boolean isInteger() {
        return false;
    }

    default boolean isFloating() {
        return false;
    }

    /// Pointee for pointers, element type for arrays.
    default Type referenced() {
        throw new UnsupportedOperationException(asString() + " does not reference another type");
    }

    default boolean isCharacterBuffer() {
        return (this instanceof PointerType || this instanceof ArrayType)
            && referenced() instanceof BasicType basic
            && basic.isCharacter();
    }
}

package edu.kit.kastel.vads.cdetector.parser.symbol;

import edu.kit.kastel.vads.cdetector.lexer.Identifier;

public sealed interface Name permits IdentName {

    static Name forIdentifier(Identifier identifier) {
        return new IdentName(identifier.value());
    }

    static Name forString(String name) {
        return new IdentName(name);
    }

    String asString();
}

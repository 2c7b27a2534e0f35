package edu.kit.kastel.vads.cdetector.parser.visitor;

/// A visitor result that carries no information.
public enum Unit {
    INSTANCE
}

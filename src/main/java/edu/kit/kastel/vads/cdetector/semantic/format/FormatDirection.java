package edu.kit.kastel.vads.cdetector.semantic.format;

public enum FormatDirection {
    /// scanf family, arguments are destinations.
    INPUT,
    /// printf family, arguments are values.
    OUTPUT
}

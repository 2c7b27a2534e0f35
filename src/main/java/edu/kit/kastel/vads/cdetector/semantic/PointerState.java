package edu.kit.kastel.vads.cdetector.semantic;

public enum PointerState {
    /// Declared without a value.
    UNKNOWN,
    NULL,
    /// Points to storage the function does not own: locals, arrays, parameters, results of unknown calls.
    VALID,
    /// Owns a heap block that must be released.
    ALLOCATED,
    FREED
}

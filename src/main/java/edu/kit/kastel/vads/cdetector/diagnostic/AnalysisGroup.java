package edu.kit.kastel.vads.cdetector.diagnostic;

/// Groups of categories that can be switched on and off together.
public enum AnalysisGroup {
    MEMORY_SAFETY,
    VARIABLE_STATE,
    STANDARD_LIBRARY,
    NUMERIC_CONTROL_FLOW
}

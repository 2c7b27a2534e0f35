package edu.kit.kastel.vads.cdetector.diagnostic;

public enum Severity {
    ERROR,
    WARNING
}

package edu.kit.kastel.vads.cdetector.parser.symbol;

public enum StorageClass {
    NONE,
    STATIC,
    EXTERN
}

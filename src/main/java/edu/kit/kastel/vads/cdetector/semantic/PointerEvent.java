package edu.kit.kastel.vads.cdetector.semantic;

public enum PointerEvent {
    ASSIGN_NULL,
    ASSIGN_ALLOCATION,
    ASSIGN_ADDRESS,
    FREE,
    DEREFERENCE
}

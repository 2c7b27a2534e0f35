package edu.kit.kastel.vads.cdetector.semantic;

import edu.kit.kastel.vads.cdetector.Span;
import edu.kit.kastel.vads.cdetector.parser.symbol.Symbol;

/// An allocation stored into a local pointer, pending until it is freed or handed over.
public record AllocationSite(Symbol symbol, Span span) {
    public int line() {
        return span().line();
    }
}

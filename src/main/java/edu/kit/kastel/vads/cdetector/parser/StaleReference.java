package edu.kit.kastel.vads.cdetector.parser;

import edu.kit.kastel.vads.cdetector.Span;
import edu.kit.kastel.vads.cdetector.parser.symbol.Symbol;

/// A name used after the block declaring it was closed, with no other declaration visible.
public record StaleReference(Symbol symbol, Span span) {
}

package edu.kit.kastel.vads.cdetector.semantic;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import org.jspecify.annotations.Nullable;

import edu.kit.kastel.vads.cdetector.parser.symbol.Symbol;

/// Facts about symbols that hold inside a region of code. Facts put into an entered namespace
/// shadow the enclosing ones and disappear when the region is left.
public class Namespace<T> {
    private final Map<Symbol, T> content;
    private final @Nullable Namespace<T> parent;

    public Namespace() {
        this.content = new HashMap<>();
        this.parent = null;
    }

    public Namespace(Namespace<T> parent) {
        this.content = new HashMap<>();
        this.parent = parent;
    }

    public void put(Symbol symbol, T value) {
        this.content.put(symbol, value);
    }

    // walks outwards
    public @Nullable T get(Symbol symbol) {
        T value = this.content.get(symbol);
        if (value == null && parent != null) {
            return parent.get(symbol);
        }
        return value;
    }

    public Namespace<T> enter() {
        return new Namespace<>(this);
    }

    public T getOrDefault(Symbol symbol, T defaultVal) {
        T v = get(symbol);
        return v == null ? defaultVal : v;
    }

    /// The facts put into this region itself, without the enclosing ones.
    public Map<Symbol, T> local() {
        return Collections.unmodifiableMap(this.content);
    }
}

package edu.kit.kastel.vads.cdetector.parser.symbol;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.jspecify.annotations.Nullable;

public final class Scope {
    public static final int NO_PARENT = -1;

    private final int index;
    private final int parent;
    private final ScopeKind kind;
    private final Map<String, Symbol> symbols = new LinkedHashMap<>();
    private boolean closed;

    Scope(int index, int parent, ScopeKind kind) {
        this.index = index;
        this.parent = parent;
        this.kind = kind;
    }

    public int index() {
        return index;
    }

    public int parent() {
        return parent;
    }

    public ScopeKind kind() {
        return kind;
    }

    public boolean isClosed() {
        return closed;
    }

    void close() {
        this.closed = true;
    }

    void declare(Symbol symbol) {
        this.symbols.put(symbol.name().asString(), symbol);
    }

    public @Nullable Symbol lookup(String name) {
        return this.symbols.get(name);
    }

    public Collection<Symbol> symbols() {
        return Collections.unmodifiableCollection(this.symbols.values());
    }

    @Override
    public String toString() {
        return kind + "#" + index + (closed ? " (closed)" : "");
    }
}

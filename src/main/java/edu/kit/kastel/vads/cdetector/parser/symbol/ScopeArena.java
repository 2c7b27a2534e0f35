package edu.kit.kastel.vads.cdetector.parser.symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.jspecify.annotations.Nullable;

/// All scopes of a translation unit, addressed by index. Index 0 is the translation unit itself.
public final class ScopeArena {
    private final List<Scope> scopes = new ArrayList<>();

    public ScopeArena() {
        this.scopes.add(new Scope(0, Scope.NO_PARENT, ScopeKind.TRANSLATION_UNIT));
    }

    public int root() {
        return 0;
    }

    public int open(ScopeKind kind, int parent) {
        int index = this.scopes.size();
        this.scopes.add(new Scope(index, parent, kind));
        return index;
    }

    public void close(int index) {
        get(index).close();
    }

    public void declare(Symbol symbol) {
        get(symbol.scope()).declare(symbol);
    }

    public Scope get(int index) {
        return this.scopes.get(index);
    }

    public List<Scope> scopes() {
        return Collections.unmodifiableList(this.scopes);
    }

    /// Resolves through the live chain of enclosing scopes. Struct scopes are skipped,
    /// member names are never visible as variables.
    public @Nullable Symbol resolve(String name, int from) {
        int current = from;
        while (current != Scope.NO_PARENT) {
            Scope scope = get(current);
            if (scope.kind() != ScopeKind.STRUCT) {
                Symbol symbol = scope.lookup(name);
                if (symbol != null) {
                    return symbol;
                }
            }
            current = scope.parent();
        }
        return null;
    }

    /// Finds the most recent declaration of {@code name} in an already closed block
    /// nested in the same function as {@code from}.
    public @Nullable Symbol resolveClosed(String name, int from) {
        int function = enclosing(from, ScopeKind.FUNCTION);
        if (function == Scope.NO_PARENT) {
            return null;
        }
        Symbol found = null;
        for (int i = function + 1; i < this.scopes.size(); i++) {
            Scope scope = get(i);
            if (scope.isClosed() && scope.kind() == ScopeKind.BLOCK && isWithin(i, function)) {
                Symbol symbol = scope.lookup(name);
                if (symbol != null) {
                    found = symbol;
                }
            }
        }
        return found;
    }

    public int enclosing(int from, ScopeKind kind) {
        int current = from;
        while (current != Scope.NO_PARENT && get(current).kind() != kind) {
            current = get(current).parent();
        }
        return current;
    }

    public boolean isWithin(int scope, int ancestor) {
        int current = scope;
        while (current != Scope.NO_PARENT) {
            if (current == ancestor) {
                return true;
            }
            current = get(current).parent();
        }
        return false;
    }
}

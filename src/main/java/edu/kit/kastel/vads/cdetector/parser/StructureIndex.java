package edu.kit.kastel.vads.cdetector.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import org.jspecify.annotations.Nullable;

import edu.kit.kastel.vads.cdetector.parser.ast.AssignmentTree;
import edu.kit.kastel.vads.cdetector.parser.ast.CallTree;
import edu.kit.kastel.vads.cdetector.parser.ast.DeclarationTree;
import edu.kit.kastel.vads.cdetector.parser.ast.FunctionTree;
import edu.kit.kastel.vads.cdetector.parser.ast.StatementTree;
import edu.kit.kastel.vads.cdetector.parser.ast.Tree;
import edu.kit.kastel.vads.cdetector.parser.symbol.Symbol;

/// Flat tables of the constructs the passes look up directly, each with its enclosing scope.
/// Entries are in the order the parser completed them.
public final class StructureIndex {
    private final List<Entry<CallTree>> calls = new ArrayList<>();
    private final List<Entry<DeclarationTree>> declarations = new ArrayList<>();
    private final List<Entry<AssignmentTree>> assignments = new ArrayList<>();
    private final List<Entry<StatementTree>> loops = new ArrayList<>();
    private final List<FunctionTree> functions = new ArrayList<>();
    private final Map<Symbol, DeclarationTree> declarationsBySymbol = new IdentityHashMap<>();

    void addCall(CallTree call, int scope) {
        this.calls.add(new Entry<>(call, scope));
    }

    void addDeclaration(DeclarationTree declaration, int scope) {
        this.declarations.add(new Entry<>(declaration, scope));
        this.declarationsBySymbol.put(declaration.symbol(), declaration);
    }

    void addAssignment(AssignmentTree assignment, int scope) {
        this.assignments.add(new Entry<>(assignment, scope));
    }

    void addLoop(StatementTree loop, int scope) {
        this.loops.add(new Entry<>(loop, scope));
    }

    void addFunction(FunctionTree function) {
        this.functions.add(function);
    }

    public List<Entry<CallTree>> calls() {
        return Collections.unmodifiableList(this.calls);
    }

    public List<Entry<DeclarationTree>> declarations() {
        return Collections.unmodifiableList(this.declarations);
    }

    public List<Entry<AssignmentTree>> assignments() {
        return Collections.unmodifiableList(this.assignments);
    }

    public List<Entry<StatementTree>> loops() {
        return Collections.unmodifiableList(this.loops);
    }

    public List<FunctionTree> functions() {
        return Collections.unmodifiableList(this.functions);
    }

    public @Nullable DeclarationTree declarationOf(Symbol symbol) {
        return this.declarationsBySymbol.get(symbol);
    }

    public record Entry<T extends Tree>(T tree, int scope) {
        public int line() {
            return tree().span().line();
        }
    }
}

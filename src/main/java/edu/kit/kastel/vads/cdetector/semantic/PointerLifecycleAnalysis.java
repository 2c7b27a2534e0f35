package edu.kit.kastel.vads.cdetector.semantic;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.kit.kastel.vads.cdetector.Span;
import edu.kit.kastel.vads.cdetector.diagnostic.AnalysisGroup;
import edu.kit.kastel.vads.cdetector.diagnostic.Category;
import edu.kit.kastel.vads.cdetector.diagnostic.Reporter;
import edu.kit.kastel.vads.cdetector.lexer.Operator.OperatorType;
import edu.kit.kastel.vads.cdetector.parser.TranslationUnit;
import edu.kit.kastel.vads.cdetector.parser.ast.AddressOfTree;
import edu.kit.kastel.vads.cdetector.parser.ast.AssignmentTree;
import edu.kit.kastel.vads.cdetector.parser.ast.BinaryOperationTree;
import edu.kit.kastel.vads.cdetector.parser.ast.BlockTree;
import edu.kit.kastel.vads.cdetector.parser.ast.CallTree;
import edu.kit.kastel.vads.cdetector.parser.ast.CastTree;
import edu.kit.kastel.vads.cdetector.parser.ast.DeclarationTree;
import edu.kit.kastel.vads.cdetector.parser.ast.DereferenceTree;
import edu.kit.kastel.vads.cdetector.parser.ast.DoWhileTree;
import edu.kit.kastel.vads.cdetector.parser.ast.ExpressionStatementTree;
import edu.kit.kastel.vads.cdetector.parser.ast.ExpressionTree;
import edu.kit.kastel.vads.cdetector.parser.ast.ForTree;
import edu.kit.kastel.vads.cdetector.parser.ast.FunctionTree;
import edu.kit.kastel.vads.cdetector.parser.ast.IdentExpressionTree;
import edu.kit.kastel.vads.cdetector.parser.ast.IfTree;
import edu.kit.kastel.vads.cdetector.parser.ast.IndexTree;
import edu.kit.kastel.vads.cdetector.parser.ast.InitializerListTree;
import edu.kit.kastel.vads.cdetector.parser.ast.LiteralTree;
import edu.kit.kastel.vads.cdetector.parser.ast.MemberAccessTree;
import edu.kit.kastel.vads.cdetector.parser.ast.ParameterTree;
import edu.kit.kastel.vads.cdetector.parser.ast.ReturnTree;
import edu.kit.kastel.vads.cdetector.parser.ast.SizeofTree;
import edu.kit.kastel.vads.cdetector.parser.ast.StatementTree;
import edu.kit.kastel.vads.cdetector.parser.ast.SwitchTree;
import edu.kit.kastel.vads.cdetector.parser.ast.TernaryTree;
import edu.kit.kastel.vads.cdetector.parser.ast.UnaryOperationTree;
import edu.kit.kastel.vads.cdetector.parser.ast.WhileTree;
import edu.kit.kastel.vads.cdetector.parser.symbol.ScopeArena;
import edu.kit.kastel.vads.cdetector.parser.symbol.ScopeKind;
import edu.kit.kastel.vads.cdetector.parser.symbol.StorageClass;
import edu.kit.kastel.vads.cdetector.parser.symbol.Symbol;
import edu.kit.kastel.vads.cdetector.parser.symbol.SymbolKind;
import edu.kit.kastel.vads.cdetector.parser.visitor.NoOpVisitor;
import edu.kit.kastel.vads.cdetector.parser.visitor.Unit;

/// Follows every local pointer through {@link PointerState}s, function by function in source order.
///
/// Null checks in conditions are kept as facts in a {@link Namespace} entered for each guarded
/// region. Allocations stay pending as {@link AllocationSite}s until they are freed, returned,
/// stored outside the pointer or passed to a call that is not a standard library function.
public class PointerLifecycleAnalysis implements Analysis {
    private static final Logger LOGGER = LoggerFactory.getLogger(PointerLifecycleAnalysis.class);

    private final boolean reportUncheckedAllocation;

    public PointerLifecycleAnalysis(boolean reportUncheckedAllocation) {
        this.reportUncheckedAllocation = reportUncheckedAllocation;
    }

    enum NullFact {
        NON_NULL,
        NULL,
        UNKNOWN
    }

    @Override
    public AnalysisGroup group() {
        return AnalysisGroup.MEMORY_SAFETY;
    }

    @Override
    public void analyze(TranslationUnit unit, Reporter reporter) {
        for (FunctionTree function : unit.index().functions()) {
            FunctionWalk walk = new FunctionWalk(unit.scopes(), reporter, this.reportUncheckedAllocation);
            walk.run(function);
        }
    }

    private static final class FunctionWalk implements NoOpVisitor<Namespace<NullFact>> {
        private final ScopeArena scopes;
        private final Reporter reporter;
        private final boolean reportUncheckedAllocation;
        private final Map<Symbol, PointerState> states = new HashMap<>();
        private final Map<Symbol, AllocationSite> pending = new LinkedHashMap<>();
        private final Map<Symbol, AllocationSite> unchecked = new HashMap<>();
        private final Map<Symbol, Symbol> localTargets = new HashMap<>();
        private final Set<String> reported = new HashSet<>();

        FunctionWalk(ScopeArena scopes, Reporter reporter, boolean reportUncheckedAllocation) {
            this.scopes = scopes;
            this.reporter = reporter;
            this.reportUncheckedAllocation = reportUncheckedAllocation;
        }

        void run(FunctionTree function) {
            LOGGER.debug("tracking pointers of {}", function.name().name().asString());
            for (ParameterTree parameter : function.parameters()) {
                if (parameter.symbol() != null && parameter.symbol().type().isPointer()) {
                    this.states.put(parameter.symbol(), PointerState.VALID);
                }
            }
            function.body().accept(this, new Namespace<>());
            for (AllocationSite site : this.pending.values()) {
                this.reporter.report(site.span(), Category.MEMORY_LEAK, "memory allocated to '" + name(site.symbol())
                    + "' is never freed or handed over");
            }
        }

        // statements

        @Override
        public Unit visit(BlockTree blockTree, Namespace<NullFact> data) {
            for (StatementTree statement : blockTree.statements()) {
                statement.accept(this, data);
            }
            return Unit.INSTANCE;
        }

        @Override
        public Unit visit(DeclarationTree declarationTree, Namespace<NullFact> data) {
            Symbol symbol = declarationTree.symbol();
            ExpressionTree initializer = declarationTree.initializer();
            if (initializer != null) {
                expression(initializer, data);
            }
            if (isTracked(symbol)) {
                this.states.put(symbol, PointerState.UNKNOWN);
                if (initializer != null) {
                    assignPointer(symbol, initializer, declarationTree.span(), data);
                }
            } else if (initializer != null) {
                handOver(initializer);
            }
            return Unit.INSTANCE;
        }

        @Override
        public Unit visit(ExpressionStatementTree expressionStatementTree, Namespace<NullFact> data) {
            expression(expressionStatementTree.expression(), data);
            return Unit.INSTANCE;
        }

        @Override
        public Unit visit(IfTree ifTree, Namespace<NullFact> data) {
            ExpressionTree condition = ifTree.condition();
            expression(condition, data);
            markChecked(condition);
            Snapshot before = snapshot();
            branch(ifTree.thenBranch(), data, condition, true);
            Snapshot afterThen = snapshot();
            restore(before);
            if (ifTree.elseBranch() != null) {
                branch(ifTree.elseBranch(), data, condition, false);
            } else {
                releaseNull(facts(condition, false));
            }
            Snapshot afterElse = snapshot();

            boolean thenExits = ControlFlow.alwaysExits(ifTree.thenBranch());
            boolean elseExits = ifTree.elseBranch() != null && ControlFlow.alwaysExits(ifTree.elseBranch());
            // code after the if is only reached through the other branch
            if (thenExits && !elseExits) {
                facts(condition, false).forEach(data::put);
            } else if (elseExits && !thenExits) {
                restore(afterThen);
                facts(condition, true).forEach(data::put);
            } else {
                restore(join(afterThen, afterElse));
            }
            return Unit.INSTANCE;
        }

        private void branch(StatementTree statement, Namespace<NullFact> data, ExpressionTree condition, boolean truth) {
            Map<Symbol, NullFact> facts = facts(condition, truth);
            releaseNull(facts);
            Namespace<NullFact> region = data.enter();
            facts.forEach(region::put);
            statement.accept(this, region);
        }

        /// A pointer known to be NULL holds no allocation on this path.
        private void releaseNull(Map<Symbol, NullFact> facts) {
            facts.forEach((pointer, fact) -> {
                if (fact == NullFact.NULL) {
                    this.pending.remove(pointer);
                    this.unchecked.remove(pointer);
                }
            });
        }

        @Override
        public Unit visit(WhileTree whileTree, Namespace<NullFact> data) {
            expression(whileTree.condition(), data);
            markChecked(whileTree.condition());
            Snapshot before = snapshot();
            whileTree.body().accept(this, refine(data, whileTree.condition(), true));
            // the body may not run at all
            restore(join(before, snapshot()));
            return Unit.INSTANCE;
        }

        @Override
        public Unit visit(DoWhileTree doWhileTree, Namespace<NullFact> data) {
            doWhileTree.body().accept(this, data);
            expression(doWhileTree.condition(), data);
            return Unit.INSTANCE;
        }

        @Override
        public Unit visit(ForTree forTree, Namespace<NullFact> data) {
            if (forTree.initializer() != null) {
                forTree.initializer().accept(this, data);
            }
            Namespace<NullFact> body = data.enter();
            if (forTree.condition() != null) {
                expression(forTree.condition(), data);
                markChecked(forTree.condition());
                body = refine(data, forTree.condition(), true);
            }
            Snapshot before = snapshot();
            forTree.body().accept(this, body);
            if (forTree.step() != null) {
                expression(forTree.step(), body);
            }
            restore(join(before, snapshot()));
            return Unit.INSTANCE;
        }

        @Override
        public Unit visit(SwitchTree switchTree, Namespace<NullFact> data) {
            expression(switchTree.selector(), data);
            switchTree.body().accept(this, data);
            return Unit.INSTANCE;
        }

        @Override
        public Unit visit(ReturnTree returnTree, Namespace<NullFact> data) {
            ExpressionTree returned = returnTree.expression();
            if (returned == null) {
                return Unit.INSTANCE;
            }
            expression(returned, data);
            Symbol local = localStorage(returned);
            if (local != null) {
                report(returnTree.span(), Category.DANGLING_POINTER_RETURN,
                    "returns the address of local variable '" + name(local) + "'");
            }
            Symbol pointer = pointerOf(returned);
            if (pointer != null) {
                this.pending.remove(pointer);
            }
            return Unit.INSTANCE;
        }

        // expressions

        private void expression(ExpressionTree expression, Namespace<NullFact> data) {
            if (expression instanceof SizeofTree) {
                // unevaluated
                return;
            }
            if (expression instanceof AssignmentTree assignment) {
                assignment(assignment, data);
            } else if (expression instanceof CallTree call) {
                call(call, data);
            } else if (expression instanceof DereferenceTree dereference) {
                expression(dereference.operand(), data);
                dereference(pointerOf(dereference.operand()), dereference.span(), data);
            } else if (expression instanceof IndexTree index) {
                expression(index.array(), data);
                expression(index.index(), data);
                dereference(pointerOf(index.array()), index.span(), data);
            } else if (expression instanceof MemberAccessTree access) {
                expression(access.object(), data);
                if (access.arrow()) {
                    dereference(pointerOf(access.object()), access.span(), data);
                }
            } else if (expression instanceof BinaryOperationTree binary) {
                expression(binary.lhs(), data);
                if (binary.operatorType() == OperatorType.LOGICAL_AND) {
                    markChecked(binary.lhs());
                    expression(binary.rhs(), refine(data, binary.lhs(), true));
                } else if (binary.operatorType() == OperatorType.LOGICAL_OR) {
                    markChecked(binary.lhs());
                    expression(binary.rhs(), refine(data, binary.lhs(), false));
                } else {
                    expression(binary.rhs(), data);
                }
            } else if (expression instanceof TernaryTree ternary) {
                expression(ternary.condition(), data);
                markChecked(ternary.condition());
                expression(ternary.thenExpression(), refine(data, ternary.condition(), true));
                expression(ternary.elseExpression(), refine(data, ternary.condition(), false));
            } else if (expression instanceof UnaryOperationTree unary) {
                expression(unary.operand(), data);
            } else if (expression instanceof AddressOfTree addressOf) {
                expression(addressOf.operand(), data);
            } else if (expression instanceof CastTree cast) {
                expression(cast.expression(), data);
            } else if (expression instanceof InitializerListTree list) {
                for (ExpressionTree element : list.elements()) {
                    expression(element, data);
                    handOver(element);
                }
            }
        }

        private void assignment(AssignmentTree assignment, Namespace<NullFact> data) {
            ExpressionTree target = assignment.lValue();
            expression(assignment.expression(), data);
            if (target instanceof IdentExpressionTree ident && ident.symbol() != null && isTracked(ident.symbol())) {
                if (assignment.operator().type() == OperatorType.ASSIGN) {
                    assignPointer(ident.symbol(), assignment.expression(), assignment.span(), data);
                }
                return;
            }
            expression(target, data);
            handOver(assignment.expression());
        }

        /// Moves {@code pointer} to the state its new value implies. An allocation still pending in it is lost.
        private void assignPointer(Symbol pointer, ExpressionTree value, Span span, Namespace<NullFact> data) {
            AllocationSite previous = this.pending.get(pointer);
            if (previous != null && !references(value, pointer)) {
                report(span, Category.MEMORY_LEAK, "'" + name(pointer) + "' is reassigned before the memory allocated on line "
                    + previous.line() + " is freed");
            }
            this.pending.remove(pointer);
            this.unchecked.remove(pointer);
            this.localTargets.remove(pointer);
            data.put(pointer, NullFact.UNKNOWN);

            PointerState next;
            Symbol source = pointerOf(value);
            if (isNull(value)) {
                next = transition(pointer, PointerEvent.ASSIGN_NULL);
            } else if (isAllocation(value)) {
                // realloc takes over the block it resizes
                allocationCall(value).arguments().stream()
                    .map(this::pointerOf)
                    .filter(argument -> argument != null && argument != pointer)
                    .forEach(this.pending::remove);
                next = transition(pointer, PointerEvent.ASSIGN_ALLOCATION);
                AllocationSite site = new AllocationSite(pointer, span);
                this.pending.put(pointer, site);
                this.unchecked.put(pointer, site);
            } else if (source != null && value instanceof IdentExpressionTree && source != pointer) {
                // aliasing hands the allocation over to the copy's users
                PointerState sourceState = this.states.get(source);
                next = sourceState == PointerState.NULL || sourceState == PointerState.FREED
                    ? sourceState
                    : transition(pointer, PointerEvent.ASSIGN_ADDRESS);
                this.pending.remove(source);
                Symbol target = this.localTargets.get(source);
                if (target != null) {
                    this.localTargets.put(pointer, target);
                }
            } else {
                next = transition(pointer, PointerEvent.ASSIGN_ADDRESS);
                Symbol local = localStorage(value);
                if (local != null) {
                    this.localTargets.put(pointer, local);
                }
            }
            this.states.put(pointer, next);
        }

        private PointerState transition(Symbol pointer, PointerEvent event) {
            return PointerTransitions.next(this.states.getOrDefault(pointer, PointerState.UNKNOWN), event);
        }

        private void call(CallTree call, Namespace<NullFact> data) {
            String name = call.calleeName();
            if (name == null) {
                expression(call.callee(), data);
            }
            for (ExpressionTree argument : call.arguments()) {
                expression(argument, data);
            }
            if (name != null && StandardLibrary.isDeallocator(name) && !call.arguments().isEmpty()) {
                free(call, data);
                return;
            }
            if (name != null && StandardLibrary.contains(name)) {
                if ("string.h".equals(StandardLibrary.requiredHeader(name))) {
                    for (ExpressionTree argument : call.arguments()) {
                        if (argument instanceof IdentExpressionTree) {
                            dereference(pointerOf(argument), call.span(), data);
                        }
                    }
                }
                return;
            }
            // the callee may keep or release what it is given
            for (ExpressionTree argument : call.arguments()) {
                if (argument instanceof AddressOfTree addressOf && addressOf.operand() instanceof IdentExpressionTree ident
                    && ident.symbol() != null && isTracked(ident.symbol())) {
                    this.pending.remove(ident.symbol());
                    this.states.put(ident.symbol(), PointerState.VALID);
                    data.put(ident.symbol(), NullFact.UNKNOWN);
                } else {
                    handOver(argument);
                }
            }
        }

        private void free(CallTree call, Namespace<NullFact> data) {
            Symbol pointer = pointerOf(call.arguments().get(0));
            if (pointer == null || !this.states.containsKey(pointer)) {
                return;
            }
            PointerState state = this.states.get(pointer);
            if (data.get(pointer) == NullFact.NULL) {
                return;
            }
            Category fault = PointerTransitions.fault(state, PointerEvent.FREE);
            if (fault != null) {
                report(call.span(), fault, "'" + name(pointer) + "' is freed again");
            }
            this.states.put(pointer, PointerTransitions.next(state, PointerEvent.FREE));
            this.pending.remove(pointer);
            this.unchecked.remove(pointer);
        }

        private void dereference(@Nullable Symbol pointer, Span span, Namespace<NullFact> data) {
            if (pointer == null || !this.states.containsKey(pointer)) {
                return;
            }
            PointerState state = this.states.get(pointer);
            NullFact fact = data.getOrDefault(pointer, NullFact.UNKNOWN);
            Category fault = PointerTransitions.fault(state, PointerEvent.DEREFERENCE);
            if (fact == NullFact.NON_NULL && state == PointerState.NULL) {
                // guarded region the pointer never enters
                fault = null;
            }
            if (fact == NullFact.NULL && (state == PointerState.ALLOCATED || state == PointerState.VALID)) {
                fault = Category.NULL_DEREFERENCE;
            }
            if (fault != null) {
                report(span, fault, message(fault, pointer));
                return;
            }
            AllocationSite site = this.unchecked.get(pointer);
            if (this.reportUncheckedAllocation && site != null && fact != NullFact.NON_NULL) {
                report(span, Category.UNCHECKED_ALLOCATION, "'" + name(pointer)
                    + "' is dereferenced without checking the allocation on line " + site.line() + " against NULL");
                this.unchecked.remove(pointer);
            }
        }

        private static String message(Category fault, Symbol pointer) {
            return switch (fault) {
                case WILD_POINTER -> "'" + name(pointer) + "' is dereferenced before it is assigned";
                case NULL_DEREFERENCE -> "'" + name(pointer) + "' is dereferenced while it is NULL";
                case USE_AFTER_FREE -> "'" + name(pointer) + "' is dereferenced after it was freed";
                default -> "'" + name(pointer) + "' is used in state " + fault.tag();
            };
        }

        /// A pointer value stored somewhere else no longer needs to be freed through this name.
        private void handOver(ExpressionTree value) {
            Symbol pointer = pointerOf(value);
            if (pointer != null && (value instanceof IdentExpressionTree || value instanceof CastTree)) {
                this.pending.remove(pointer);
            }
        }

        private void report(Span span, Category category, String message) {
            if (this.reported.add(span.line() + ":" + category + ":" + message)) {
                this.reporter.report(span, category, message);
            }
        }

        // null facts

        private Namespace<NullFact> refine(Namespace<NullFact> data, ExpressionTree condition, boolean truth) {
            Namespace<NullFact> region = data.enter();
            facts(condition, truth).forEach(region::put);
            return region;
        }

        /// What {@code condition} evaluating to {@code truth} tells about tracked pointers.
        private Map<Symbol, NullFact> facts(ExpressionTree condition, boolean truth) {
            Map<Symbol, NullFact> facts = new HashMap<>();
            collectFacts(condition, truth, facts);
            return facts;
        }

        private void collectFacts(ExpressionTree condition, boolean truth, Map<Symbol, NullFact> facts) {
            Symbol pointer = checkedPointer(condition);
            if (pointer != null) {
                facts.put(pointer, truth ? NullFact.NON_NULL : NullFact.NULL);
                return;
            }
            if (condition instanceof UnaryOperationTree unary && unary.operatorType() == OperatorType.LOGICAL_NOT) {
                collectFacts(unary.operand(), !truth, facts);
            } else if (condition instanceof BinaryOperationTree binary) {
                OperatorType operator = binary.operatorType();
                if (operator == OperatorType.EQUAL || operator == OperatorType.NOT_EQUAL) {
                    Symbol compared = comparedWithNull(binary);
                    if (compared != null) {
                        boolean nonNull = (operator == OperatorType.NOT_EQUAL) == truth;
                        facts.put(compared, nonNull ? NullFact.NON_NULL : NullFact.NULL);
                    }
                } else if (operator == OperatorType.LOGICAL_AND && truth || operator == OperatorType.LOGICAL_OR && !truth) {
                    collectFacts(binary.lhs(), truth, facts);
                    collectFacts(binary.rhs(), truth, facts);
                }
            }
        }

        private void markChecked(ExpressionTree condition) {
            for (Symbol pointer : facts(condition, true).keySet()) {
                this.unchecked.remove(pointer);
            }
            for (Symbol pointer : facts(condition, false).keySet()) {
                this.unchecked.remove(pointer);
            }
        }

        /// {@code p} or {@code (p = malloc(n))} used as a truth value.
        private @Nullable Symbol checkedPointer(ExpressionTree condition) {
            if (condition instanceof IdentExpressionTree || condition instanceof AssignmentTree) {
                Symbol pointer = pointerOf(condition);
                return pointer != null && this.states.containsKey(pointer) ? pointer : null;
            }
            return null;
        }

        private @Nullable Symbol comparedWithNull(BinaryOperationTree binary) {
            ExpressionTree other;
            Symbol pointer = pointerOf(binary.lhs());
            if (pointer != null && !(binary.lhs() instanceof BinaryOperationTree)) {
                other = binary.rhs();
            } else {
                pointer = pointerOf(binary.rhs());
                other = binary.lhs();
                if (binary.rhs() instanceof BinaryOperationTree) {
                    return null;
                }
            }
            if (pointer == null || !this.states.containsKey(pointer) || !isNull(other)) {
                return null;
            }
            return pointer;
        }

        // branches

        /// What the walk knows about the function's pointers at one program point.
        private record Snapshot(Map<Symbol, PointerState> states, Map<Symbol, AllocationSite> pending,
                                Map<Symbol, AllocationSite> unchecked, Map<Symbol, Symbol> localTargets) {
        }

        private Snapshot snapshot() {
            return new Snapshot(new HashMap<>(this.states), new LinkedHashMap<>(this.pending),
                new HashMap<>(this.unchecked), new HashMap<>(this.localTargets));
        }

        private void restore(Snapshot snapshot) {
            this.states.clear();
            this.states.putAll(snapshot.states());
            this.pending.clear();
            this.pending.putAll(snapshot.pending());
            this.unchecked.clear();
            this.unchecked.putAll(snapshot.unchecked());
            this.localTargets.clear();
            this.localTargets.putAll(snapshot.localTargets());
        }

        /// The point where two paths meet. A pointer whose state depends on the path is treated as valid,
        /// an allocation pending on either path stays pending.
        private static Snapshot join(Snapshot left, Snapshot right) {
            Map<Symbol, PointerState> states = new HashMap<>(left.states());
            right.states().forEach((pointer, state) ->
                states.merge(pointer, state, (a, b) -> a == b ? a : PointerState.VALID));
            Map<Symbol, AllocationSite> pending = new LinkedHashMap<>(left.pending());
            right.pending().forEach(pending::putIfAbsent);
            Map<Symbol, AllocationSite> unchecked = new HashMap<>(left.unchecked());
            right.unchecked().forEach(unchecked::putIfAbsent);
            Map<Symbol, Symbol> localTargets = new HashMap<>(left.localTargets());
            right.localTargets().forEach(localTargets::putIfAbsent);
            return new Snapshot(states, pending, unchecked, localTargets);
        }

        // expression shapes

        /// The tracked or untracked local pointer an expression evaluates through: {@code p}, {@code p + k},
        /// {@code p++}, {@code (T *) p}, {@code (p = ...)}.
        private @Nullable Symbol pointerOf(ExpressionTree expression) {
            if (expression instanceof IdentExpressionTree ident) {
                Symbol symbol = ident.symbol();
                return symbol != null && symbol.type().isPointer() ? symbol : null;
            }
            if (expression instanceof BinaryOperationTree binary
                && (binary.operatorType() == OperatorType.PLUS || binary.operatorType() == OperatorType.MINUS)) {
                Symbol lhs = pointerOf(binary.lhs());
                return lhs != null ? lhs : pointerOf(binary.rhs());
            }
            if (expression instanceof UnaryOperationTree unary && unary.isIncrementOrDecrement()) {
                return pointerOf(unary.operand());
            }
            if (expression instanceof CastTree cast) {
                return pointerOf(cast.expression());
            }
            if (expression instanceof AssignmentTree assignment) {
                return pointerOf(assignment.lValue());
            }
            return null;
        }

        /// The local object whose address {@code expression} yields, directly or through a pointer aliasing it.
        private @Nullable Symbol localStorage(ExpressionTree expression) {
            if (expression instanceof AddressOfTree addressOf) {
                Symbol root = rootObject(addressOf.operand());
                return root != null && isStackObject(root) ? root : null;
            }
            if (expression instanceof CastTree cast) {
                return localStorage(cast.expression());
            }
            if (expression instanceof IdentExpressionTree ident && ident.symbol() != null) {
                Symbol symbol = ident.symbol();
                if (symbol.isArray() && isStackObject(symbol)) {
                    return symbol;
                }
                return this.localTargets.get(symbol);
            }
            return null;
        }

        private static @Nullable Symbol rootObject(ExpressionTree expression) {
            if (expression instanceof IdentExpressionTree ident) {
                return ident.symbol();
            }
            if (expression instanceof IndexTree index && !(index.array() instanceof IdentExpressionTree ident
                && ident.symbol() != null && ident.symbol().type().isPointer())) {
                return rootObject(index.array());
            }
            if (expression instanceof MemberAccessTree access && !access.arrow()) {
                return rootObject(access.object());
            }
            return null;
        }

        private boolean isStackObject(Symbol symbol) {
            if (symbol.storage() != StorageClass.NONE) {
                return false;
            }
            SymbolKind kind = symbol.kind();
            if (kind == SymbolKind.PARAMETER) {
                return !symbol.type().isPointer();
            }
            if (kind != SymbolKind.VARIABLE && kind != SymbolKind.ARRAY && kind != SymbolKind.POINTER) {
                return false;
            }
            ScopeKind scope = this.scopes.get(symbol.scope()).kind();
            return scope == ScopeKind.FUNCTION || scope == ScopeKind.BLOCK;
        }

        private boolean isTracked(Symbol symbol) {
            if (symbol.kind() == SymbolKind.PARAMETER) {
                return symbol.type().isPointer();
            }
            return symbol.kind() == SymbolKind.POINTER && isStackObject(symbol);
        }

        private static boolean isNull(ExpressionTree expression) {
            if (expression instanceof CastTree cast) {
                return isNull(cast.expression());
            }
            if (expression instanceof LiteralTree literal) {
                return literal.isZero();
            }
            return expression instanceof IdentExpressionTree ident
                && ident.symbol() == null
                && ident.name().name().asString().equals("NULL");
        }

        private static boolean isAllocation(ExpressionTree expression) {
            if (expression instanceof CastTree cast) {
                return isAllocation(cast.expression());
            }
            if (expression instanceof CallTree call) {
                String name = call.calleeName();
                return name != null && StandardLibrary.isAllocator(name);
            }
            return false;
        }

        private static CallTree allocationCall(ExpressionTree expression) {
            if (expression instanceof CastTree cast) {
                return allocationCall(cast.expression());
            }
            return (CallTree) expression;
        }

        private static boolean references(ExpressionTree expression, Symbol symbol) {
            if (expression instanceof IdentExpressionTree ident) {
                return ident.symbol() == symbol;
            }
            if (expression instanceof CallTree call) {
                return call.arguments().stream().anyMatch(argument -> references(argument, symbol));
            }
            if (expression instanceof CastTree cast) {
                return references(cast.expression(), symbol);
            }
            if (expression instanceof MemberAccessTree access) {
                return references(access.object(), symbol);
            }
            if (expression instanceof IndexTree index) {
                return references(index.array(), symbol) || references(index.index(), symbol);
            }
            if (expression instanceof BinaryOperationTree binary) {
                return references(binary.lhs(), symbol) || references(binary.rhs(), symbol);
            }
            if (expression instanceof DereferenceTree dereference) {
                return references(dereference.operand(), symbol);
            }
            return false;
        }

        private static String name(Symbol symbol) {
            return symbol.name().asString();
        }
    }
}

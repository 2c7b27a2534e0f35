package edu.kit.kastel.vads.cdetector.semantic;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.kit.kastel.vads.cdetector.diagnostic.AnalysisGroup;
import edu.kit.kastel.vads.cdetector.diagnostic.Category;
import edu.kit.kastel.vads.cdetector.diagnostic.Reporter;
import edu.kit.kastel.vads.cdetector.lexer.Operator.OperatorType;
import edu.kit.kastel.vads.cdetector.parser.StructureIndex;
import edu.kit.kastel.vads.cdetector.parser.TranslationUnit;
import edu.kit.kastel.vads.cdetector.parser.ast.AddressOfTree;
import edu.kit.kastel.vads.cdetector.parser.ast.AssignmentTree;
import edu.kit.kastel.vads.cdetector.parser.ast.BinaryOperationTree;
import edu.kit.kastel.vads.cdetector.parser.ast.BlockTree;
import edu.kit.kastel.vads.cdetector.parser.ast.BreakTree;
import edu.kit.kastel.vads.cdetector.parser.ast.CallTree;
import edu.kit.kastel.vads.cdetector.parser.ast.CastTree;
import edu.kit.kastel.vads.cdetector.parser.ast.DeclarationTree;
import edu.kit.kastel.vads.cdetector.parser.ast.DoWhileTree;
import edu.kit.kastel.vads.cdetector.parser.ast.ExpressionStatementTree;
import edu.kit.kastel.vads.cdetector.parser.ast.ExpressionTree;
import edu.kit.kastel.vads.cdetector.parser.ast.ForTree;
import edu.kit.kastel.vads.cdetector.parser.ast.GotoTree;
import edu.kit.kastel.vads.cdetector.parser.ast.IdentExpressionTree;
import edu.kit.kastel.vads.cdetector.parser.ast.IfTree;
import edu.kit.kastel.vads.cdetector.parser.ast.IndexTree;
import edu.kit.kastel.vads.cdetector.parser.ast.LiteralTree;
import edu.kit.kastel.vads.cdetector.parser.ast.MemberAccessTree;
import edu.kit.kastel.vads.cdetector.parser.ast.ReturnTree;
import edu.kit.kastel.vads.cdetector.parser.ast.StatementTree;
import edu.kit.kastel.vads.cdetector.parser.ast.SwitchTree;
import edu.kit.kastel.vads.cdetector.parser.ast.Tree;
import edu.kit.kastel.vads.cdetector.parser.ast.UnaryOperationTree;
import edu.kit.kastel.vads.cdetector.parser.ast.WhileTree;
import edu.kit.kastel.vads.cdetector.parser.symbol.Symbol;
import edu.kit.kastel.vads.cdetector.parser.visitor.NoOpVisitor;
import edu.kit.kastel.vads.cdetector.parser.visitor.RecursivePostorderVisitor;
import edu.kit.kastel.vads.cdetector.parser.visitor.Unit;

/// Flags loops whose condition is always true and whose body has no exit that can ever be taken.
///
/// This is a syntactic heuristic, not a termination proof: an exit counts as reachable when the
/// conditions guarding it mention a variable the loop changes. Loops with a non-constant condition
/// are never reported.
public class LoopTerminationAnalysis implements Analysis {
    private static final Logger LOGGER = LoggerFactory.getLogger(LoopTerminationAnalysis.class);

    private final boolean callsSatisfyGuards;
    private final boolean proveMonotonicBounds;

    public LoopTerminationAnalysis(boolean callsSatisfyGuards, boolean proveMonotonicBounds) {
        this.callsSatisfyGuards = callsSatisfyGuards;
        this.proveMonotonicBounds = proveMonotonicBounds;
    }

    @Override
    public AnalysisGroup group() {
        return AnalysisGroup.NUMERIC_CONTROL_FLOW;
    }

    @Override
    public void analyze(TranslationUnit unit, Reporter reporter) {
        for (StructureIndex.Entry<StatementTree> entry : unit.index().loops()) {
            StatementTree loop = entry.tree();
            if (!isStaticallyTrue(guardOf(loop))) {
                continue;
            }
            Map<Symbol, Direction> mutations = mutations(loop);
            List<Exit> exits = new ArrayList<>();
            bodyOf(loop).accept(new ExitCollector(exits), new ExitContext(List.of(), true));

            boolean terminates = false;
            for (Exit exit : exits) {
                if (isTakeable(exit, loop, mutations, unit)) {
                    terminates = true;
                    break;
                }
            }
            if (terminates) {
                continue;
            }
            LOGGER.debug("line {}: none of {} exits can be taken", entry.line(), exits.size());
            if (exits.isEmpty()) {
                reporter.report(loop.span(), Category.INFINITE_LOOP,
                    "the loop condition is always true and the body has no break, return or goto");
            } else {
                reporter.report(loop.span(), Category.INFINITE_LOOP, "the loop condition is always true and "
                    + "the exit on line " + exits.get(0).line() + " can never be taken");
            }
        }
    }

    private boolean isTakeable(Exit exit, StatementTree loop, Map<Symbol, Direction> mutations,
        TranslationUnit unit) {
        for (Guard guard : exit.guards()) {
            GuardReferences references = GuardReferences.of(guard.condition());
            boolean mutated = references.symbols().stream().anyMatch(mutations::containsKey);
            if (!mutated && !(this.callsSatisfyGuards && references.hasCall())) {
                return false;
            }
            if (this.proveMonotonicBounds && !guard.negated() && neverHolds(guard.condition(), loop, mutations,
                unit)) {
                return false;
            }
        }
        return true;
    }

    /// True if the condition compares a one-way counter against a bound it has already passed.
    private static boolean neverHolds(ExpressionTree condition, StatementTree loop, Map<Symbol, Direction> mutations,
        TranslationUnit unit) {
        if (!(condition instanceof BinaryOperationTree comparison)
            || !comparison.operatorType().isComparison()) {
            return false;
        }
        OperatorType operator = comparison.operatorType();
        ExpressionTree counterSide = comparison.lhs();
        ExpressionTree boundSide = comparison.rhs();
        if (!(counterSide instanceof IdentExpressionTree)) {
            counterSide = comparison.rhs();
            boundSide = comparison.lhs();
            operator = mirror(operator);
        }
        if (!(counterSide instanceof IdentExpressionTree ident) || ident.symbol() == null) {
            return false;
        }
        BigInteger bound = IntegerLiteralRangeAnalysis.literalValue(boundSide);
        Direction direction = mutations.get(ident.symbol());
        if (bound == null || direction == null || direction == Direction.MIXED) {
            return false;
        }
        BigInteger start = startValue(ident.symbol(), loop, unit);
        if (start == null) {
            return false;
        }
        int order = bound.compareTo(start);
        if (direction == Direction.UP) {
            return switch (operator) {
                case LESS -> order <= 0;
                case LESS_EQUAL, EQUAL -> order < 0;
                default -> false;
            };
        }
        return switch (operator) {
            case GREATER -> order >= 0;
            case GREATER_EQUAL, EQUAL -> order > 0;
            default -> false;
        };
    }

    private static OperatorType mirror(OperatorType operator) {
        return switch (operator) {
            case LESS -> OperatorType.GREATER;
            case LESS_EQUAL -> OperatorType.GREATER_EQUAL;
            case GREATER -> OperatorType.LESS;
            case GREATER_EQUAL -> OperatorType.LESS_EQUAL;
            default -> operator;
        };
    }

    /// The literal a counter holds when the loop is entered, if it can be read off the source.
    private static @Nullable BigInteger startValue(Symbol symbol, StatementTree loop, TranslationUnit unit) {
        if (loop instanceof ForTree forTree && forTree.initializer() != null) {
            BigInteger fromInitializer = initializedValue(forTree.initializer(), symbol);
            if (fromInitializer != null) {
                return fromInitializer;
            }
        }
        // the declaration only counts if nothing outside the loop assigns the counter
        int first = loop.span().start().line();
        int last = loop.span().end().line();
        for (StructureIndex.Entry<AssignmentTree> assignment : unit.index().assignments()) {
            if (rootSymbol(assignment.tree().lValue()) == symbol
                && (assignment.line() < first || assignment.line() > last)) {
                return null;
            }
        }
        DeclarationTree declaration = unit.index().declarationOf(symbol);
        if (declaration == null || declaration.initializer() == null) {
            return null;
        }
        return IntegerLiteralRangeAnalysis.literalValue(declaration.initializer());
    }

    private static @Nullable BigInteger initializedValue(StatementTree initializer, Symbol symbol) {
        if (initializer instanceof DeclarationTree declaration && declaration.symbol() == symbol
            && declaration.initializer() != null) {
            return IntegerLiteralRangeAnalysis.literalValue(declaration.initializer());
        }
        if (initializer instanceof ExpressionStatementTree statement
            && statement.expression() instanceof AssignmentTree assignment
            && assignment.operator().type() == OperatorType.ASSIGN
            && rootSymbol(assignment.lValue()) == symbol) {
            return IntegerLiteralRangeAnalysis.literalValue(assignment.expression());
        }
        if (initializer instanceof BlockTree block) {
            for (StatementTree statement : block.statements()) {
                BigInteger value = initializedValue(statement, symbol);
                if (value != null) {
                    return value;
                }
            }
        }
        return null;
    }

    private static @Nullable ExpressionTree guardOf(StatementTree loop) {
        if (loop instanceof WhileTree whileTree) {
            return whileTree.condition();
        }
        if (loop instanceof DoWhileTree doWhileTree) {
            return doWhileTree.condition();
        }
        if (loop instanceof ForTree forTree) {
            return forTree.condition();
        }
        throw new SemanticException("not a loop: " + loop);
    }

    private static StatementTree bodyOf(StatementTree loop) {
        if (loop instanceof WhileTree whileTree) {
            return whileTree.body();
        }
        if (loop instanceof DoWhileTree doWhileTree) {
            return doWhileTree.body();
        }
        if (loop instanceof ForTree forTree) {
            return forTree.body();
        }
        throw new SemanticException("not a loop: " + loop);
    }

    // an omitted for condition is true
    private static boolean isStaticallyTrue(@Nullable ExpressionTree guard) {
        if (guard == null) {
            return true;
        }
        if (guard instanceof CastTree cast) {
            return isStaticallyTrue(cast.expression());
        }
        return guard instanceof LiteralTree literal && !literal.floating() && literal.parseValue() != null
            && !literal.isZero();
    }

    private static Map<Symbol, Direction> mutations(StatementTree loop) {
        Map<Symbol, Direction> mutations = new HashMap<>();
        RecursivePostorderVisitor<Map<Symbol, Direction>, Unit> collector =
            new RecursivePostorderVisitor<>(new MutationCollector());
        bodyOf(loop).accept(collector, mutations);
        if (loop instanceof ForTree forTree && forTree.step() != null) {
            forTree.step().accept(collector, mutations);
        }
        return mutations;
    }

    static @Nullable Symbol rootSymbol(ExpressionTree expression) {
        if (expression instanceof IdentExpressionTree ident) {
            return ident.symbol();
        }
        if (expression instanceof IndexTree index) {
            return rootSymbol(index.array());
        }
        if (expression instanceof MemberAccessTree member) {
            return rootSymbol(member.object());
        }
        return null;
    }

    enum Direction {
        UP,
        DOWN,
        MIXED;

        Direction merge(Direction other) {
            return this == other ? this : MIXED;
        }
    }

    /// Records every variable the loop writes and whether it only ever moves one way.
    private static final class MutationCollector implements NoOpVisitor<Map<Symbol, Direction>> {

        // declared inside the loop, so set again on every iteration
        @Override
        public Unit visit(DeclarationTree declarationTree, Map<Symbol, Direction> data) {
            if (declarationTree.initializer() != null) {
                record(declarationTree.symbol(), Direction.MIXED, data);
            }
            return Unit.INSTANCE;
        }

        @Override
        public Unit visit(AssignmentTree assignmentTree, Map<Symbol, Direction> data) {
            Symbol target = rootSymbol(assignmentTree.lValue());
            if (target != null) {
                record(target, direction(assignmentTree, target), data);
            }
            return Unit.INSTANCE;
        }

        @Override
        public Unit visit(UnaryOperationTree unaryOperationTree, Map<Symbol, Direction> data) {
            if (!unaryOperationTree.isIncrementOrDecrement()) {
                return Unit.INSTANCE;
            }
            Symbol target = rootSymbol(unaryOperationTree.operand());
            if (target != null) {
                record(target, unaryOperationTree.operatorType() == OperatorType.INCREMENT ? Direction.UP
                    : Direction.DOWN, data);
            }
            return Unit.INSTANCE;
        }

        @Override
        public Unit visit(AddressOfTree addressOfTree, Map<Symbol, Direction> data) {
            Symbol target = rootSymbol(addressOfTree.operand());
            if (target != null) {
                record(target, Direction.MIXED, data);
            }
            return Unit.INSTANCE;
        }

        private static void record(Symbol symbol, Direction direction, Map<Symbol, Direction> data) {
            data.merge(symbol, direction, Direction::merge);
        }

        private static Direction direction(AssignmentTree assignment, Symbol target) {
            OperatorType operator = assignment.operator().type();
            BigInteger step = IntegerLiteralRangeAnalysis.literalValue(assignment.expression());
            if (operator == OperatorType.ASSIGN_PLUS || operator == OperatorType.ASSIGN_MINUS) {
                if (step == null || step.signum() == 0) {
                    return Direction.MIXED;
                }
                boolean up = (step.signum() > 0) == (operator == OperatorType.ASSIGN_PLUS);
                return up ? Direction.UP : Direction.DOWN;
            }
            // i = i + 1 and i = i - 1
            if (operator == OperatorType.ASSIGN && assignment.expression() instanceof BinaryOperationTree binary
                && rootSymbol(binary.lhs()) == target && binary.lhs() instanceof IdentExpressionTree) {
                BigInteger amount = IntegerLiteralRangeAnalysis.literalValue(binary.rhs());
                if (amount != null && amount.signum() > 0) {
                    if (binary.operatorType() == OperatorType.PLUS) {
                        return Direction.UP;
                    }
                    if (binary.operatorType() == OperatorType.MINUS) {
                        return Direction.DOWN;
                    }
                }
            }
            return Direction.MIXED;
        }
    }

    record Guard(ExpressionTree condition, boolean negated) {
    }

    record Exit(Tree statement, List<Guard> guards) {
        int line() {
            return statement().span().line();
        }
    }

    /// {@code breakBinds} is false inside nested loops and switches, whose breaks do not leave the analyzed loop.
    record ExitContext(List<Guard> guards, boolean breakBinds) {
        ExitContext guardedBy(ExpressionTree condition, boolean negated) {
            List<Guard> extended = new ArrayList<>(guards());
            extended.add(new Guard(condition, negated));
            return new ExitContext(List.copyOf(extended), breakBinds());
        }

        ExitContext nested(@Nullable ExpressionTree condition) {
            ExitContext inner = condition == null ? this : guardedBy(condition, false);
            return new ExitContext(inner.guards(), false);
        }
    }

    private static final class ExitCollector implements NoOpVisitor<ExitContext> {
        private final List<Exit> exits;

        ExitCollector(List<Exit> exits) {
            this.exits = exits;
        }

        @Override
        public Unit visit(BlockTree blockTree, ExitContext data) {
            for (StatementTree statement : blockTree.statements()) {
                statement.accept(this, data);
            }
            return Unit.INSTANCE;
        }

        @Override
        public Unit visit(IfTree ifTree, ExitContext data) {
            ifTree.thenBranch().accept(this, data.guardedBy(ifTree.condition(), false));
            if (ifTree.elseBranch() != null) {
                ifTree.elseBranch().accept(this, data.guardedBy(ifTree.condition(), true));
            }
            return Unit.INSTANCE;
        }

        @Override
        public Unit visit(WhileTree whileTree, ExitContext data) {
            whileTree.body().accept(this, data.nested(whileTree.condition()));
            return Unit.INSTANCE;
        }

        @Override
        public Unit visit(DoWhileTree doWhileTree, ExitContext data) {
            // the body runs at least once
            doWhileTree.body().accept(this, data.nested(null));
            return Unit.INSTANCE;
        }

        @Override
        public Unit visit(ForTree forTree, ExitContext data) {
            forTree.body().accept(this, data.nested(forTree.condition()));
            return Unit.INSTANCE;
        }

        @Override
        public Unit visit(SwitchTree switchTree, ExitContext data) {
            switchTree.body().accept(this, data.nested(switchTree.selector()));
            return Unit.INSTANCE;
        }

        @Override
        public Unit visit(BreakTree breakTree, ExitContext data) {
            if (data.breakBinds()) {
                this.exits.add(new Exit(breakTree, data.guards()));
            }
            return Unit.INSTANCE;
        }

        @Override
        public Unit visit(ReturnTree returnTree, ExitContext data) {
            this.exits.add(new Exit(returnTree, data.guards()));
            return Unit.INSTANCE;
        }

        @Override
        public Unit visit(GotoTree gotoTree, ExitContext data) {
            this.exits.add(new Exit(gotoTree, data.guards()));
            return Unit.INSTANCE;
        }

        @Override
        public Unit visit(ExpressionStatementTree expressionStatementTree, ExitContext data) {
            if (expressionStatementTree.expression() instanceof CallTree call
                && call.callee() instanceof IdentExpressionTree ident
                && ident.symbol() == null
                && StandardLibrary.mayNotReturn(ident.name().name().asString())) {
                this.exits.add(new Exit(expressionStatementTree, data.guards()));
            }
            return Unit.INSTANCE;
        }
    }

    /// The variables a guard reads and whether it calls a function.
    record GuardReferences(Set<Symbol> symbols, boolean hasCall) {

        static GuardReferences of(ExpressionTree condition) {
            Set<Symbol> symbols = new HashSet<>();
            boolean[] hasCall = {false};
            condition.accept(new RecursivePostorderVisitor<>(new NoOpVisitor<Unit>() {
                @Override
                public Unit visit(IdentExpressionTree identExpressionTree, Unit data) {
                    if (identExpressionTree.symbol() != null) {
                        symbols.add(identExpressionTree.symbol());
                    }
                    return Unit.INSTANCE;
                }

                @Override
                public Unit visit(CallTree callTree, Unit data) {
                    hasCall[0] = true;
                    return Unit.INSTANCE;
                }
            }), Unit.INSTANCE);
            return new GuardReferences(symbols, hasCall[0]);
        }
    }
}

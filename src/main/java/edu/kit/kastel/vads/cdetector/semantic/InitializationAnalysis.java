package edu.kit.kastel.vads.cdetector.semantic;

import java.util.List;
import java.util.Map;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.kit.kastel.vads.cdetector.diagnostic.AnalysisGroup;
import edu.kit.kastel.vads.cdetector.diagnostic.Category;
import edu.kit.kastel.vads.cdetector.diagnostic.Reporter;
import edu.kit.kastel.vads.cdetector.lexer.Operator.OperatorType;
import edu.kit.kastel.vads.cdetector.parser.StaleReference;
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
import edu.kit.kastel.vads.cdetector.parser.ast.MemberAccessTree;
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
import edu.kit.kastel.vads.cdetector.semantic.format.FormatDirection;
import edu.kit.kastel.vads.cdetector.semantic.format.FormatFunction;

/// Checks that local variables are initialized before they are read.
///
/// The statements of each function are replayed in source order. Each branch of an if and each loop
/// body runs in a region of its own, and a write survives the region only when every path that falls
/// through makes it. Parameters, globals, statics and struct members are never tracked.
/// Also reports names used after the block declaring them was closed.
public class InitializationAnalysis implements Analysis {
    private static final Logger LOGGER = LoggerFactory.getLogger(InitializationAnalysis.class);

    public enum InitializationState {
        UNINITIALIZED,
        INITIALIZED
    }

    @Override
    public AnalysisGroup group() {
        return AnalysisGroup.VARIABLE_STATE;
    }

    @Override
    public void analyze(TranslationUnit unit, Reporter reporter) {
        Namespace<InitializationState> global = new Namespace<>();
        for (FunctionTree function : unit.index().functions()) {
            LOGGER.debug("replaying {}", function.name().name().asString());
            function.body().accept(new Replay(unit.scopes(), reporter), global.enter());
        }
        for (StaleReference reference : unit.staleReferences()) {
            Symbol symbol = reference.symbol();
            reporter.report(reference.span(), Category.USE_AFTER_SCOPE, "'" + symbol.name().asString()
                + "' is used outside the block that declared it on line " + symbol.span().line());
        }
    }

    private static final class Replay implements NoOpVisitor<Namespace<InitializationState>> {
        private final ScopeArena scopes;
        private final Reporter reporter;

        Replay(ScopeArena scopes, Reporter reporter) {
            this.scopes = scopes;
            this.reporter = reporter;
        }

        // statements

        @Override
        public Unit visit(BlockTree blockTree, Namespace<InitializationState> data) {
            for (StatementTree statement : blockTree.statements()) {
                statement.accept(this, data);
            }
            return Unit.INSTANCE;
        }

        @Override
        public Unit visit(DeclarationTree declarationTree, Namespace<InitializationState> data) {
            Symbol symbol = declarationTree.symbol();
            if (declarationTree.initializer() != null) {
                read(declarationTree.initializer(), data);
                if (isTracked(symbol)) {
                    data.put(symbol, InitializationState.INITIALIZED);
                }
            } else if (isTracked(symbol)) {
                data.put(symbol, InitializationState.UNINITIALIZED);
            }
            return Unit.INSTANCE;
        }

        @Override
        public Unit visit(ExpressionStatementTree expressionStatementTree, Namespace<InitializationState> data) {
            read(expressionStatementTree.expression(), data);
            return Unit.INSTANCE;
        }

        @Override
        public Unit visit(IfTree ifTree, Namespace<InitializationState> data) {
            read(ifTree.condition(), data);
            Namespace<InitializationState> thenData = data.enter();
            ifTree.thenBranch().accept(this, thenData);
            Namespace<InitializationState> elseData = data.enter();
            if (ifTree.elseBranch() != null) {
                ifTree.elseBranch().accept(this, elseData);
            }
            boolean thenExits = ControlFlow.alwaysExits(ifTree.thenBranch());
            boolean elseExits = ifTree.elseBranch() != null && ControlFlow.alwaysExits(ifTree.elseBranch());
            if (thenExits && !elseExits) {
                initialized(elseData).forEach(symbol -> data.put(symbol, InitializationState.INITIALIZED));
            } else if (elseExits && !thenExits) {
                initialized(thenData).forEach(symbol -> data.put(symbol, InitializationState.INITIALIZED));
            } else if (!thenExits) {
                // a missing else is the path that writes nothing
                for (Symbol symbol : initialized(thenData)) {
                    if (elseData.get(symbol) == InitializationState.INITIALIZED) {
                        data.put(symbol, InitializationState.INITIALIZED);
                    }
                }
            }
            return Unit.INSTANCE;
        }

        private static List<Symbol> initialized(Namespace<InitializationState> region) {
            return region.local().entrySet().stream()
                .filter(entry -> entry.getValue() == InitializationState.INITIALIZED)
                .map(Map.Entry::getKey)
                .toList();
        }

        // a loop body may run zero times, so its writes stay inside it
        @Override
        public Unit visit(WhileTree whileTree, Namespace<InitializationState> data) {
            read(whileTree.condition(), data);
            whileTree.body().accept(this, data.enter());
            return Unit.INSTANCE;
        }

        @Override
        public Unit visit(DoWhileTree doWhileTree, Namespace<InitializationState> data) {
            doWhileTree.body().accept(this, data);
            read(doWhileTree.condition(), data);
            return Unit.INSTANCE;
        }

        @Override
        public Unit visit(ForTree forTree, Namespace<InitializationState> data) {
            if (forTree.initializer() != null) {
                forTree.initializer().accept(this, data);
            }
            if (forTree.condition() != null) {
                read(forTree.condition(), data);
            }
            Namespace<InitializationState> body = data.enter();
            forTree.body().accept(this, body);
            if (forTree.step() != null) {
                read(forTree.step(), body);
            }
            return Unit.INSTANCE;
        }

        @Override
        public Unit visit(SwitchTree switchTree, Namespace<InitializationState> data) {
            read(switchTree.selector(), data);
            switchTree.body().accept(this, data);
            return Unit.INSTANCE;
        }

        @Override
        public Unit visit(ReturnTree returnTree, Namespace<InitializationState> data) {
            if (returnTree.expression() != null) {
                read(returnTree.expression(), data);
            }
            return Unit.INSTANCE;
        }

        // expressions

        private void read(ExpressionTree expression, Namespace<InitializationState> data) {
            if (expression instanceof SizeofTree) {
                // unevaluated
                return;
            }
            if (expression instanceof IdentExpressionTree ident) {
                // a bare array name is an address, not a read of its elements
                if (ident.symbol() != null && !ident.symbol().isArray()) {
                    use(ident, data);
                }
            } else if (expression instanceof AssignmentTree assignment) {
                assign(assignment, data);
            } else if (expression instanceof UnaryOperationTree unary) {
                read(unary.operand(), data);
                if (unary.isIncrementOrDecrement()) {
                    write(unary.operand(), data);
                }
            } else if (expression instanceof BinaryOperationTree binary) {
                read(binary.lhs(), data);
                read(binary.rhs(), data);
            } else if (expression instanceof TernaryTree ternary) {
                read(ternary.condition(), data);
                read(ternary.thenExpression(), data);
                read(ternary.elseExpression(), data);
            } else if (expression instanceof CallTree call) {
                call(call, data);
            } else if (expression instanceof IndexTree index) {
                readBase(index.array(), data);
                read(index.index(), data);
            } else if (expression instanceof DereferenceTree dereference) {
                readBase(dereference.operand(), data);
            } else if (expression instanceof MemberAccessTree access) {
                readLocation(access.object(), data);
            } else if (expression instanceof AddressOfTree addressOf) {
                // only a call receiving the address may fill the object
                readLocation(addressOf.operand(), data);
            } else if (expression instanceof CastTree cast) {
                read(cast.expression(), data);
            } else if (expression instanceof InitializerListTree list) {
                for (ExpressionTree element : list.elements()) {
                    read(element, data);
                }
            }
        }

        private void use(IdentExpressionTree ident, Namespace<InitializationState> data) {
            Symbol symbol = ident.symbol();
            if (symbol != null && data.get(symbol) == InitializationState.UNINITIALIZED) {
                this.reporter.report(ident.span(), Category.UNINITIALIZED_USE,
                    "'" + symbol.name().asString() + "' is read before it is initialized");
            }
        }

        /// The pointer operand of a dereference. Pointer values are checked by the pointer lifecycle pass,
        /// array contents and integer offsets are reads.
        private void readBase(ExpressionTree base, Namespace<InitializationState> data) {
            if (base instanceof IdentExpressionTree ident) {
                if (ident.symbol() == null || !ident.symbol().type().isPointer()) {
                    use(ident, data);
                }
            } else if (base instanceof BinaryOperationTree binary
                && (binary.operatorType() == OperatorType.PLUS || binary.operatorType() == OperatorType.MINUS)) {
                readBase(binary.lhs(), data);
                readBase(binary.rhs(), data);
            } else if (base instanceof CastTree cast) {
                readBase(cast.expression(), data);
            } else {
                read(base, data);
            }
        }

        /// An object designated but not read, only the expressions computing its location are.
        private void readLocation(ExpressionTree location, Namespace<InitializationState> data) {
            if (location instanceof IndexTree index) {
                readLocation(index.array(), data);
                read(index.index(), data);
            } else if (location instanceof MemberAccessTree access) {
                readLocation(access.object(), data);
            } else if (location instanceof DereferenceTree dereference) {
                readBase(dereference.operand(), data);
            } else if (!(location instanceof IdentExpressionTree)) {
                read(location, data);
            }
        }

        private void assign(AssignmentTree assignment, Namespace<InitializationState> data) {
            ExpressionTree target = assignment.lValue();
            if (assignment.operator().type() != OperatorType.ASSIGN) {
                read(target, data);
            } else {
                readLocation(target, data);
            }
            read(assignment.expression(), data);
            write(target, data);
        }

        private void call(CallTree call, Namespace<InitializationState> data) {
            String name = call.calleeName();
            FormatFunction format = name == null ? null : FormatFunction.forName(name);
            if (name == null) {
                read(call.callee(), data);
            }
            List<ExpressionTree> arguments = call.arguments();
            for (int i = 0; i < arguments.size(); i++) {
                ExpressionTree argument = arguments.get(i);
                if (format != null && format.direction() == FormatDirection.OUTPUT) {
                    if (argument instanceof IdentExpressionTree ident) {
                        use(ident, data);
                    } else {
                        read(argument, data);
                    }
                } else if (format != null && i <= format.formatIndex()) {
                    read(argument, data);
                } else if (argument instanceof AddressOfTree addressOf) {
                    readLocation(addressOf.operand(), data);
                    write(addressOf.operand(), data);
                } else if (isArrayOrDestination(argument, format)) {
                    write(argument, data);
                } else {
                    read(argument, data);
                }
            }
        }

        /// Arrays handed to a call may be filled by it, as may pointers handed to formatted input.
        private static boolean isArrayOrDestination(ExpressionTree argument, @Nullable FormatFunction format) {
            if (!(argument instanceof IdentExpressionTree ident) || ident.symbol() == null) {
                return false;
            }
            return ident.symbol().isArray() || format != null && ident.symbol().type().isPointer();
        }

        private void write(ExpressionTree target, Namespace<InitializationState> data) {
            Symbol symbol = targetSymbol(target);
            if (symbol != null && isTracked(symbol)) {
                data.put(symbol, InitializationState.INITIALIZED);
            }
        }

        /// The variable a write lands in: {@code x}, an element of array {@code x}, a member of {@code x}.
        private static @Nullable Symbol targetSymbol(ExpressionTree target) {
            if (target instanceof IdentExpressionTree ident) {
                return ident.symbol();
            }
            if (target instanceof IndexTree index && !isPointerValued(index.array())) {
                return targetSymbol(index.array());
            }
            if (target instanceof MemberAccessTree access && !access.arrow()) {
                return targetSymbol(access.object());
            }
            return null;
        }

        private static boolean isPointerValued(ExpressionTree expression) {
            return expression instanceof IdentExpressionTree ident
                && ident.symbol() != null
                && ident.symbol().type().isPointer();
        }

        private boolean isTracked(Symbol symbol) {
            if (symbol.storage() != StorageClass.NONE) {
                return false;
            }
            SymbolKind kind = symbol.kind();
            if (kind != SymbolKind.VARIABLE && kind != SymbolKind.POINTER && kind != SymbolKind.ARRAY) {
                return false;
            }
            ScopeKind scopeKind = this.scopes.get(symbol.scope()).kind();
            return scopeKind == ScopeKind.FUNCTION || scopeKind == ScopeKind.BLOCK;
        }
    }
}

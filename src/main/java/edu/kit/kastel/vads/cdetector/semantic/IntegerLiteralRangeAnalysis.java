package edu.kit.kastel.vads.cdetector.semantic;

import java.math.BigInteger;

import org.jspecify.annotations.Nullable;

import edu.kit.kastel.vads.cdetector.diagnostic.AnalysisGroup;
import edu.kit.kastel.vads.cdetector.diagnostic.Category;
import edu.kit.kastel.vads.cdetector.diagnostic.Reporter;
import edu.kit.kastel.vads.cdetector.lexer.Operator.OperatorType;
import edu.kit.kastel.vads.cdetector.parser.TranslationUnit;
import edu.kit.kastel.vads.cdetector.parser.ast.AssignmentTree;
import edu.kit.kastel.vads.cdetector.parser.ast.DeclarationTree;
import edu.kit.kastel.vads.cdetector.parser.ast.ExpressionTree;
import edu.kit.kastel.vads.cdetector.parser.ast.IdentExpressionTree;
import edu.kit.kastel.vads.cdetector.parser.ast.InitializerListTree;
import edu.kit.kastel.vads.cdetector.parser.ast.LiteralTree;
import edu.kit.kastel.vads.cdetector.parser.ast.UnaryOperationTree;
import edu.kit.kastel.vads.cdetector.parser.type.ArrayType;
import edu.kit.kastel.vads.cdetector.parser.type.BasicType;
import edu.kit.kastel.vads.cdetector.parser.type.Type;
import edu.kit.kastel.vads.cdetector.parser.visitor.NoOpVisitor;
import edu.kit.kastel.vads.cdetector.parser.visitor.RecursivePostorderVisitor;
import edu.kit.kastel.vads.cdetector.parser.visitor.Unit;

/// Checks integer literals stored directly into an integer object against the range of its type.
/// Arithmetic is never evaluated.
public class IntegerLiteralRangeAnalysis implements Analysis {

    @Override
    public AnalysisGroup group() {
        return AnalysisGroup.NUMERIC_CONTROL_FLOW;
    }

    @Override
    public void analyze(TranslationUnit unit, Reporter reporter) {
        ExpressionTypes types = new ExpressionTypes(unit);
        unit.program().accept(new RecursivePostorderVisitor<>(new LiteralStores(types)), reporter);
    }

    private static final class LiteralStores implements NoOpVisitor<Reporter> {
        private final ExpressionTypes types;

        LiteralStores(ExpressionTypes types) {
            this.types = types;
        }

        @Override
        public Unit visit(DeclarationTree declarationTree, Reporter reporter) {
            ExpressionTree initializer = declarationTree.initializer();
            if (initializer == null) {
                return Unit.INSTANCE;
            }
            String target = declarationTree.symbol().name().asString();
            Type type = declarationTree.symbol().type();
            if (type instanceof ArrayType array && initializer instanceof InitializerListTree list) {
                for (ExpressionTree element : list.elements()) {
                    check(element, array.element(), target + "[]", reporter);
                }
            } else {
                check(initializer, type, target, reporter);
            }
            return Unit.INSTANCE;
        }

        @Override
        public Unit visit(AssignmentTree assignmentTree, Reporter reporter) {
            if (assignmentTree.operator().type() != OperatorType.ASSIGN) {
                return Unit.INSTANCE;
            }
            Type type = this.types.typeOf(assignmentTree.lValue());
            if (type != null) {
                check(assignmentTree.expression(), type, describe(assignmentTree.lValue()), reporter);
            }
            return Unit.INSTANCE;
        }

        private void check(ExpressionTree value, Type type, String target, Reporter reporter) {
            // any scalar converts to _Bool
            if (!(type instanceof BasicType basic) || !basic.isInteger() || basic == BasicType.BOOL) {
                return;
            }
            BigInteger literal = literalValue(value);
            if (literal == null || basic.contains(literal)) {
                return;
            }
            reporter.report(value.span(), Category.INTEGER_LITERAL_OVERFLOW, literal + " does not fit into '"
                + target + "' of type " + basic.asString() + ", whose range is " + basic.min() + " to "
                + basic.max());
        }
    }

    /// The value of an integer literal, optionally negated, or null for anything else.
    static @Nullable BigInteger literalValue(ExpressionTree expression) {
        if (expression instanceof LiteralTree literal) {
            return literal.parseValue();
        }
        if (expression instanceof UnaryOperationTree unary && unary.operatorType() == OperatorType.MINUS
            && unary.operand() instanceof LiteralTree literal) {
            BigInteger value = literal.parseValue();
            return value == null ? null : value.negate();
        }
        return null;
    }

    private static String describe(ExpressionTree target) {
        if (target instanceof IdentExpressionTree ident) {
            return ident.name().name().asString();
        }
        return "the assigned object";
    }
}

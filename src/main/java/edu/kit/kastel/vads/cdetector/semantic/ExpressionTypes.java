package edu.kit.kastel.vads.cdetector.semantic;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

import org.jspecify.annotations.Nullable;

import edu.kit.kastel.vads.cdetector.lexer.Operator.OperatorType;
import edu.kit.kastel.vads.cdetector.parser.TranslationUnit;
import edu.kit.kastel.vads.cdetector.parser.ast.AddressOfTree;
import edu.kit.kastel.vads.cdetector.parser.ast.AssignmentTree;
import edu.kit.kastel.vads.cdetector.parser.ast.BinaryOperationTree;
import edu.kit.kastel.vads.cdetector.parser.ast.CallTree;
import edu.kit.kastel.vads.cdetector.parser.ast.CastTree;
import edu.kit.kastel.vads.cdetector.parser.ast.CharLiteralTree;
import edu.kit.kastel.vads.cdetector.parser.ast.DereferenceTree;
import edu.kit.kastel.vads.cdetector.parser.ast.ExpressionTree;
import edu.kit.kastel.vads.cdetector.parser.ast.IdentExpressionTree;
import edu.kit.kastel.vads.cdetector.parser.ast.IndexTree;
import edu.kit.kastel.vads.cdetector.parser.ast.LiteralTree;
import edu.kit.kastel.vads.cdetector.parser.ast.MemberAccessTree;
import edu.kit.kastel.vads.cdetector.parser.ast.SizeofTree;
import edu.kit.kastel.vads.cdetector.parser.ast.StringLiteralTree;
import edu.kit.kastel.vads.cdetector.parser.ast.TernaryTree;
import edu.kit.kastel.vads.cdetector.parser.ast.TypeDefinitionTree;
import edu.kit.kastel.vads.cdetector.parser.ast.UnaryOperationTree;
import edu.kit.kastel.vads.cdetector.parser.symbol.Symbol;
import edu.kit.kastel.vads.cdetector.parser.type.ArrayType;
import edu.kit.kastel.vads.cdetector.parser.type.BasicType;
import edu.kit.kastel.vads.cdetector.parser.type.NamedType;
import edu.kit.kastel.vads.cdetector.parser.type.PointerType;
import edu.kit.kastel.vads.cdetector.parser.type.Type;
import edu.kit.kastel.vads.cdetector.parser.visitor.NoOpVisitor;
import edu.kit.kastel.vads.cdetector.parser.visitor.RecursivePostorderVisitor;
import edu.kit.kastel.vads.cdetector.parser.visitor.Unit;

/// Infers the static type of expressions from declarations, literals and the usual arithmetic
/// conversions. Returns null wherever the type is not known, callers must then stay silent.
public class ExpressionTypes {
    private static final Type CHAR_POINTER = new PointerType(BasicType.CHAR);
    private static final Type VOID_POINTER = new PointerType(BasicType.VOID);
    private static final Map<String, Type> LIBRARY_RESULTS = Map.ofEntries(
        Map.entry("malloc", VOID_POINTER),
        Map.entry("calloc", VOID_POINTER),
        Map.entry("realloc", VOID_POINTER),
        Map.entry("strdup", CHAR_POINTER),
        Map.entry("strcpy", CHAR_POINTER),
        Map.entry("strcat", CHAR_POINTER),
        Map.entry("fgets", CHAR_POINTER),
        Map.entry("strlen", BasicType.UNSIGNED_LONG),
        Map.entry("strcmp", BasicType.INT),
        Map.entry("atoi", BasicType.INT),
        Map.entry("atol", BasicType.LONG),
        Map.entry("atof", BasicType.DOUBLE),
        Map.entry("rand", BasicType.INT),
        Map.entry("abs", BasicType.INT),
        Map.entry("getchar", BasicType.INT),
        Map.entry("toupper", BasicType.INT),
        Map.entry("tolower", BasicType.INT),
        Map.entry("sqrt", BasicType.DOUBLE),
        Map.entry("pow", BasicType.DOUBLE),
        Map.entry("fabs", BasicType.DOUBLE),
        Map.entry("floor", BasicType.DOUBLE),
        Map.entry("ceil", BasicType.DOUBLE),
        Map.entry("sin", BasicType.DOUBLE),
        Map.entry("cos", BasicType.DOUBLE),
        Map.entry("exp", BasicType.DOUBLE),
        Map.entry("log", BasicType.DOUBLE),
        Map.entry("time", BasicType.LONG),
        Map.entry("clock", BasicType.LONG)
    );

    private final Map<Type, Map<String, Type>> members = new HashMap<>();

    public ExpressionTypes(TranslationUnit unit) {
        unit.program().accept(new RecursivePostorderVisitor<>(new NoOpVisitor<Unit>() {
            @Override
            public Unit visit(TypeDefinitionTree typeDefinitionTree, Unit data) {
                Map<String, Type> fields = new HashMap<>();
                for (Symbol member : typeDefinitionTree.members()) {
                    fields.put(member.name().asString(), member.type());
                }
                members.put(typeDefinitionTree.type(), fields);
                return Unit.INSTANCE;
            }
        }), Unit.INSTANCE);
    }

    public @Nullable Type typeOf(ExpressionTree expression) {
        if (expression instanceof IdentExpressionTree ident) {
            Symbol symbol = ident.symbol();
            if (symbol != null) {
                return symbol.type();
            }
            return ident.name().name().asString().equals("NULL") ? VOID_POINTER : null;
        }
        if (expression instanceof LiteralTree literal) {
            return literalType(literal);
        }
        if (expression instanceof CharLiteralTree) {
            return BasicType.INT;
        }
        if (expression instanceof StringLiteralTree) {
            return CHAR_POINTER;
        }
        if (expression instanceof CastTree cast) {
            return cast.type().type();
        }
        if (expression instanceof SizeofTree) {
            return BasicType.UNSIGNED_LONG;
        }
        if (expression instanceof DereferenceTree dereference) {
            return referenced(typeOf(dereference.operand()));
        }
        if (expression instanceof IndexTree index) {
            return referenced(typeOf(index.array()));
        }
        if (expression instanceof AddressOfTree addressOf) {
            Type operand = typeOf(addressOf.operand());
            return operand == null ? null : new PointerType(operand);
        }
        if (expression instanceof MemberAccessTree access) {
            return memberType(access);
        }
        if (expression instanceof CallTree call) {
            return callResult(call);
        }
        if (expression instanceof AssignmentTree assignment) {
            return typeOf(assignment.lValue());
        }
        if (expression instanceof TernaryTree ternary) {
            Type then = typeOf(ternary.thenExpression());
            return then != null ? then : typeOf(ternary.elseExpression());
        }
        if (expression instanceof UnaryOperationTree unary) {
            Type operand = typeOf(unary.operand());
            if (unary.operatorType() == OperatorType.LOGICAL_NOT) {
                return BasicType.INT;
            }
            if (unary.isIncrementOrDecrement() || operand == null) {
                return operand;
            }
            return promote(operand);
        }
        if (expression instanceof BinaryOperationTree binary) {
            return binaryType(binary);
        }
        return null;
    }

    private static Type literalType(LiteralTree literal) {
        String suffix = literal.suffix().toLowerCase(Locale.ROOT);
        if (literal.floating()) {
            if (suffix.equals("f")) {
                return BasicType.FLOAT;
            }
            return suffix.equals("l") ? BasicType.LONG_DOUBLE : BasicType.DOUBLE;
        }
        boolean unsigned = suffix.contains("u");
        if (suffix.contains("ll")) {
            return unsigned ? BasicType.UNSIGNED_LONG_LONG : BasicType.LONG_LONG;
        }
        if (suffix.contains("l")) {
            return unsigned ? BasicType.UNSIGNED_LONG : BasicType.LONG;
        }
        BasicType type = unsigned ? BasicType.UNSIGNED_INT : BasicType.INT;
        BigInteger value = literal.parseValue();
        if (value != null && !type.contains(value)) {
            return unsigned ? BasicType.UNSIGNED_LONG : BasicType.LONG;
        }
        return type;
    }

    private static @Nullable Type referenced(@Nullable Type type) {
        if (type instanceof PointerType || type instanceof ArrayType) {
            return type.referenced();
        }
        return null;
    }

    private @Nullable Type memberType(MemberAccessTree access) {
        Type object = typeOf(access.object());
        if (access.arrow()) {
            object = referenced(object);
        }
        if (!(object instanceof NamedType)) {
            return null;
        }
        Map<String, Type> fields = this.members.get(object);
        return fields == null ? null : fields.get(access.member().name().asString());
    }

    private static @Nullable Type callResult(CallTree call) {
        if (call.callee() instanceof IdentExpressionTree ident && ident.symbol() != null) {
            return ident.symbol().type();
        }
        String name = call.calleeName();
        return name == null ? null : LIBRARY_RESULTS.get(name);
    }

    private @Nullable Type binaryType(BinaryOperationTree binary) {
        OperatorType operator = binary.operatorType();
        if (operator == OperatorType.COMMA) {
            return typeOf(binary.rhs());
        }
        if (operator.isComparison() || operator == OperatorType.LOGICAL_AND || operator == OperatorType.LOGICAL_OR) {
            return BasicType.INT;
        }
        Type lhs = typeOf(binary.lhs());
        Type rhs = typeOf(binary.rhs());
        if (lhs == null || rhs == null) {
            return null;
        }
        if (operator == OperatorType.SHIFT_LEFT || operator == OperatorType.SHIFT_RIGHT) {
            return promote(lhs);
        }
        boolean lhsAddress = lhs instanceof PointerType || lhs instanceof ArrayType;
        boolean rhsAddress = rhs instanceof PointerType || rhs instanceof ArrayType;
        if (lhsAddress && rhsAddress) {
            return operator == OperatorType.MINUS ? BasicType.LONG : null;
        }
        if (lhsAddress) {
            return new PointerType(lhs.referenced());
        }
        if (rhsAddress) {
            return new PointerType(rhs.referenced());
        }
        return arithmetic(lhs, rhs);
    }

    private static @Nullable Type arithmetic(Type lhs, Type rhs) {
        if (!(lhs instanceof BasicType left) || !(rhs instanceof BasicType right)) {
            return null;
        }
        if (left.isFloating() || right.isFloating()) {
            if (left == BasicType.LONG_DOUBLE || right == BasicType.LONG_DOUBLE) {
                return BasicType.LONG_DOUBLE;
            }
            if (left == BasicType.DOUBLE || right == BasicType.DOUBLE) {
                return BasicType.DOUBLE;
            }
            return BasicType.FLOAT;
        }
        BasicType promotedLeft = (BasicType) promote(left);
        BasicType promotedRight = (BasicType) promote(right);
        if (promotedLeft.rank() != promotedRight.rank()) {
            return promotedLeft.rank() > promotedRight.rank() ? promotedLeft : promotedRight;
        }
        return promotedLeft.isUnsigned() ? promotedLeft : promotedRight;
    }

    /// Integer promotion: everything narrower than int becomes int.
    static Type promote(Type type) {
        if (type instanceof BasicType basic && basic.isInteger() && basic.rank() < BasicType.INT.rank()) {
            return BasicType.INT;
        }
        return type;
    }
}

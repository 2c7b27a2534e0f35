package edu.kit.kastel.vads.cdetector.semantic;

import java.util.List;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.kit.kastel.vads.cdetector.diagnostic.AnalysisGroup;
import edu.kit.kastel.vads.cdetector.diagnostic.Category;
import edu.kit.kastel.vads.cdetector.diagnostic.Reporter;
import edu.kit.kastel.vads.cdetector.parser.StructureIndex;
import edu.kit.kastel.vads.cdetector.parser.TranslationUnit;
import edu.kit.kastel.vads.cdetector.parser.ast.AddressOfTree;
import edu.kit.kastel.vads.cdetector.parser.ast.CallTree;
import edu.kit.kastel.vads.cdetector.parser.ast.ExpressionTree;
import edu.kit.kastel.vads.cdetector.parser.ast.IdentExpressionTree;
import edu.kit.kastel.vads.cdetector.parser.ast.StringLiteralTree;
import edu.kit.kastel.vads.cdetector.parser.type.ArrayType;
import edu.kit.kastel.vads.cdetector.parser.type.BasicType;
import edu.kit.kastel.vads.cdetector.parser.type.PointerType;
import edu.kit.kastel.vads.cdetector.parser.type.Type;
import edu.kit.kastel.vads.cdetector.semantic.format.ConversionSpecifier;
import edu.kit.kastel.vads.cdetector.semantic.format.FormatDirection;
import edu.kit.kastel.vads.cdetector.semantic.format.FormatFunction;
import edu.kit.kastel.vads.cdetector.semantic.format.FormatString;
import edu.kit.kastel.vads.cdetector.semantic.format.LengthModifier;

/// Validates calls of the printf and scanf families against their literal format string:
/// argument count, address-of operators on input destinations and argument types.
public class FormatCallAnalysis implements Analysis {
    private static final Logger LOGGER = LoggerFactory.getLogger(FormatCallAnalysis.class);

    @Override
    public AnalysisGroup group() {
        return AnalysisGroup.STANDARD_LIBRARY;
    }

    @Override
    public void analyze(TranslationUnit unit, Reporter reporter) {
        ExpressionTypes types = new ExpressionTypes(unit);
        for (StructureIndex.Entry<CallTree> entry : unit.index().calls()) {
            CallTree call = entry.tree();
            FormatFunction function = formatFunction(call);
            if (function == null || call.arguments().size() <= function.formatIndex()) {
                continue;
            }
            if (!(call.arguments().get(function.formatIndex()) instanceof StringLiteralTree format)) {
                LOGGER.debug("line {}: computed format string of {} is not checked", entry.line(),
                    function.functionName());
                continue;
            }
            List<ConversionSpecifier> specifiers = FormatString.parse(format.value(), function.direction());
            new CallCheck(call, function, types, reporter).check(specifiers);
        }
    }

    private static @Nullable FormatFunction formatFunction(CallTree call) {
        // a local function of the same name is not the library one
        if (!(call.callee() instanceof IdentExpressionTree ident) || ident.symbol() != null) {
            return null;
        }
        return FormatFunction.forName(ident.name().name().asString());
    }

    private static final class CallCheck {
        private final CallTree call;
        private final FormatFunction function;
        private final ExpressionTypes types;
        private final Reporter reporter;

        CallCheck(CallTree call, FormatFunction function, ExpressionTypes types, Reporter reporter) {
            this.call = call;
            this.function = function;
            this.types = types;
            this.reporter = reporter;
        }

        void check(List<ConversionSpecifier> specifiers) {
            List<ExpressionTree> arguments = this.call.arguments();
            int first = this.function.formatIndex() + 1;
            int expected = specifiers.stream().mapToInt(ConversionSpecifier::argumentCount).sum();
            int actual = arguments.size() - first;
            if (expected != actual) {
                this.reporter.report(this.call.span(), Category.ARGUMENT_COUNT_MISMATCH, "'"
                    + this.function.functionName() + "' format expects " + expected + " argument"
                    + (expected == 1 ? "" : "s") + " but " + actual + (actual == 1 ? " is" : " are") + " given");
            }
            int position = first;
            for (ConversionSpecifier specifier : specifiers) {
                if (specifier.suppressed()) {
                    continue;
                }
                if (specifier.starWidth() && position < arguments.size()) {
                    checkStar(specifier, arguments.get(position), position);
                    position++;
                }
                if (specifier.starPrecision() && position < arguments.size()) {
                    checkStar(specifier, arguments.get(position), position);
                    position++;
                }
                if (position >= arguments.size()) {
                    return;
                }
                if (this.function.direction() == FormatDirection.OUTPUT) {
                    checkValue(specifier, arguments.get(position), position);
                } else {
                    checkDestination(specifier, arguments.get(position), position);
                }
                position++;
            }
        }

        private void checkStar(ConversionSpecifier specifier, ExpressionTree argument, int position) {
            Type type = this.types.typeOf(argument);
            if (type instanceof BasicType basic && !(basic.isInteger() && basic.rank() <= BasicType.INT.rank())
                || type instanceof PointerType || type instanceof ArrayType) {
                mismatch(specifier, argument, position, type, "an int field width or precision");
            }
        }

        private void checkValue(ConversionSpecifier specifier, ExpressionTree argument, int position) {
            Type type = this.types.typeOf(argument);
            if (type == null || !isModeled(type)) {
                return;
            }
            switch (specifier.conversion()) {
                case 'd', 'i', 'u', 'o', 'x', 'X', 'c' -> {
                    if (!(type instanceof BasicType basic && basic.isInteger() && fitsOutput(specifier, basic))) {
                        mismatch(specifier, argument, position, type, "an integer of matching width");
                    }
                }
                case 'f', 'F', 'e', 'E', 'g', 'G', 'a', 'A' -> {
                    boolean longDouble = specifier.length() == LengthModifier.LONG_DOUBLE;
                    if (!(type instanceof BasicType basic && basic.isFloating()
                        && (basic == BasicType.LONG_DOUBLE) == longDouble)) {
                        mismatch(specifier, argument, position, type, longDouble ? "a long double" : "a double");
                    }
                }
                case 's' -> {
                    if (!type.isCharacterBuffer()) {
                        mismatch(specifier, argument, position, type, "a character string");
                    }
                }
                case 'p' -> {
                    if (!isAddress(type)) {
                        mismatch(specifier, argument, position, type, "a pointer");
                    }
                }
                case 'n' -> {
                    if (!(isAddress(type) && type.referenced().isInteger())) {
                        mismatch(specifier, argument, position, type, "a pointer to an integer");
                    }
                }
                default -> LOGGER.debug("no value check for %{}", specifier.conversion());
            }
        }

        private void checkDestination(ConversionSpecifier specifier, ExpressionTree argument, int position) {
            Type destination;
            if (argument instanceof AddressOfTree addressOf) {
                Type operand = this.types.typeOf(addressOf.operand());
                if (operand == null) {
                    return;
                }
                if (operand instanceof ArrayType || operand.isPointer() && specifier.conversion() != 'p') {
                    this.reporter.report(argument.span(), Category.SPURIOUS_ADDRESS_OF, "argument " + (position + 1)
                        + " of '" + this.function.functionName() + "' is already an address, '&' is not needed for "
                        + specifier.text());
                    return;
                }
                destination = operand;
            } else {
                Type type = this.types.typeOf(argument);
                if (type == null) {
                    return;
                }
                if (!isAddress(type)) {
                    if (type instanceof BasicType) {
                        this.reporter.report(argument.span(), Category.MISSING_ADDRESS_OF, "argument " + (position + 1)
                            + " of '" + this.function.functionName() + "' must be an address for "
                            + specifier.text() + ", use '&'");
                    }
                    return;
                }
                destination = type.referenced();
            }
            if (!isModeled(destination) || destination == BasicType.VOID) {
                return;
            }
            if (!fitsInput(specifier, destination)) {
                mismatch(specifier, argument, position, new PointerType(destination), expectedDestination(specifier));
            }
        }

        private void mismatch(ConversionSpecifier specifier, ExpressionTree argument, int position,
            @Nullable Type actual, String expected) {
            this.reporter.report(argument.span(), Category.FORMAT_TYPE_MISMATCH, specifier.text() + " expects "
                + expected + " but argument " + (position + 1) + " of '" + this.function.functionName()
                + "' has type " + (actual == null ? "unknown" : actual.asString()));
        }
    }

    /// Default argument promotions make everything up to int acceptable without a length modifier.
    private static boolean fitsOutput(ConversionSpecifier specifier, BasicType type) {
        return switch (specifier.length()) {
            case NONE, CHAR, SHORT -> type.rank() <= BasicType.INT.rank();
            case LONG -> type.rank() == BasicType.LONG.rank();
            case LONG_LONG -> type.rank() == BasicType.LONG_LONG.rank();
            case SIZE, INTMAX, PTRDIFF -> type.rank() >= BasicType.LONG.rank();
            case LONG_DOUBLE -> false;
        };
    }

    /// Input destinations are written with the exact width the directive names.
    private static boolean fitsInput(ConversionSpecifier specifier, Type destination) {
        if (!(destination instanceof BasicType basic)) {
            return specifier.conversion() == 'p' && destination.isPointer();
        }
        char conversion = specifier.conversion();
        if (specifier.isInteger() || conversion == 'n') {
            if (!basic.isInteger()) {
                return false;
            }
            return switch (specifier.length()) {
                case NONE -> basic.rank() == BasicType.INT.rank();
                case CHAR -> basic.rank() == BasicType.CHAR.rank();
                case SHORT -> basic.rank() == BasicType.SHORT.rank();
                case LONG -> basic.rank() == BasicType.LONG.rank();
                case LONG_LONG -> basic.rank() == BasicType.LONG_LONG.rank();
                case SIZE, INTMAX, PTRDIFF -> basic.rank() >= BasicType.LONG.rank();
                case LONG_DOUBLE -> false;
            };
        }
        if (specifier.isFloating()) {
            return switch (specifier.length()) {
                case LONG -> basic == BasicType.DOUBLE;
                case LONG_DOUBLE -> basic == BasicType.LONG_DOUBLE;
                default -> basic == BasicType.FLOAT;
            };
        }
        if (specifier.isCharacter()) {
            return basic.isCharacter();
        }
        return false;
    }

    private static String expectedDestination(ConversionSpecifier specifier) {
        if (specifier.isFloating()) {
            return switch (specifier.length()) {
                case LONG -> "a double *";
                case LONG_DOUBLE -> "a long double *";
                default -> "a float *";
            };
        }
        if (specifier.isCharacter()) {
            return "a char *";
        }
        if (specifier.conversion() == 'p') {
            return "a void **";
        }
        return switch (specifier.length()) {
            case CHAR -> "a char-sized integer *";
            case SHORT -> "a short *";
            case LONG -> "a long *";
            case LONG_LONG -> "a long long *";
            case SIZE, INTMAX, PTRDIFF -> "a 64-bit integer *";
            default -> "an int *";
        };
    }

    private static boolean isAddress(Type type) {
        return type instanceof PointerType || type instanceof ArrayType;
    }

    // struct and typedef names without a known layout are never judged
    private static boolean isModeled(Type type) {
        return type instanceof BasicType || isAddress(type);
    }
}

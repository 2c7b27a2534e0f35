package edu.kit.kastel.vads.cdetector.parser.ast;

import java.math.BigInteger;

import org.jspecify.annotations.Nullable;

import edu.kit.kastel.vads.cdetector.Span;
import edu.kit.kastel.vads.cdetector.parser.visitor.Visitor;

/// A numeric literal. {@code value} holds the digits without base prefix and suffix.
public record LiteralTree(String value, int base, String suffix, boolean floating, Span span)
    implements ExpressionTree {

    public @Nullable BigInteger parseValue() {
        if (floating()) {
            return null;
        }
        try {
            return new BigInteger(value(), base());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public boolean isZero() {
        BigInteger parsed = parseValue();
        return parsed != null && parsed.signum() == 0;
    }

    @Override
    public <T, R> R accept(Visitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }
}

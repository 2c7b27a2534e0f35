package edu.kit.kastel.vads.cdetector.parser.type;

import java.math.BigInteger;
import java.util.Map;

import org.jspecify.annotations.Nullable;

/// Arithmetic types of an LP64 target.
public enum BasicType implements Type {
    VOID("void", 0, null, null),
    BOOL("_Bool", 1, BigInteger.ZERO, BigInteger.ONE),
    CHAR("char", 1, signedMin(8), signedMax(8)),
    SIGNED_CHAR("signed char", 1, signedMin(8), signedMax(8)),
    UNSIGNED_CHAR("unsigned char", 1, BigInteger.ZERO, unsignedMax(8)),
    SHORT("short", 2, signedMin(16), signedMax(16)),
    UNSIGNED_SHORT("unsigned short", 2, BigInteger.ZERO, unsignedMax(16)),
    INT("int", 3, signedMin(32), signedMax(32)),
    UNSIGNED_INT("unsigned int", 3, BigInteger.ZERO, unsignedMax(32)),
    LONG("long", 4, signedMin(64), signedMax(64)),
    UNSIGNED_LONG("unsigned long", 4, BigInteger.ZERO, unsignedMax(64)),
    LONG_LONG("long long", 5, signedMin(64), signedMax(64)),
    UNSIGNED_LONG_LONG("unsigned long long", 5, BigInteger.ZERO, unsignedMax(64)),
    FLOAT("float", 0, null, null),
    DOUBLE("double", 0, null, null),
    LONG_DOUBLE("long double", 0, null, null);

    private static final Map<String, BasicType> ALIASES = Map.ofEntries(
        Map.entry("int8_t", SIGNED_CHAR),
        Map.entry("uint8_t", UNSIGNED_CHAR),
        Map.entry("int16_t", SHORT),
        Map.entry("uint16_t", UNSIGNED_SHORT),
        Map.entry("int32_t", INT),
        Map.entry("uint32_t", UNSIGNED_INT),
        Map.entry("int64_t", LONG),
        Map.entry("uint64_t", UNSIGNED_LONG),
        Map.entry("intptr_t", LONG),
        Map.entry("uintptr_t", UNSIGNED_LONG),
        Map.entry("ptrdiff_t", LONG),
        Map.entry("size_t", UNSIGNED_LONG),
        Map.entry("ssize_t", LONG),
        Map.entry("time_t", LONG),
        Map.entry("clock_t", LONG)
    );

    private final String spelling;
    private final int rank;
    private final @Nullable BigInteger min;
    private final @Nullable BigInteger max;

    BasicType(String spelling, int rank, @Nullable BigInteger min, @Nullable BigInteger max) {
        this.spelling = spelling;
        this.rank = rank;
        this.min = min;
        this.max = max;
    }

    /// Standard library typedefs that name an arithmetic type.
    public static @Nullable BasicType forAlias(String name) {
        return ALIASES.get(name);
    }

    @Override
    public boolean isInteger() {
        return this.max != null;
    }

    @Override
    public boolean isFloating() {
        return this == FLOAT || this == DOUBLE || this == LONG_DOUBLE;
    }

    public boolean isCharacter() {
        return this == CHAR || this == SIGNED_CHAR || this == UNSIGNED_CHAR;
    }

    public boolean isUnsigned() {
        return this.min != null && this.min.signum() == 0;
    }

    /// Conversion rank, 0 for non-integer types. Signed and unsigned variants share a rank.
    public int rank() {
        return rank;
    }

    public boolean contains(BigInteger value) {
        if (this.min == null || this.max == null) {
            return true;
        }
        return value.compareTo(this.min) >= 0 && value.compareTo(this.max) <= 0;
    }

    public @Nullable BigInteger min() {
        return min;
    }

    public @Nullable BigInteger max() {
        return max;
    }

    @Override
    public String asString() {
        return spelling;
    }

    private static BigInteger signedMin(int bits) {
        return BigInteger.ONE.shiftLeft(bits - 1).negate();
    }

    private static BigInteger signedMax(int bits) {
        return BigInteger.ONE.shiftLeft(bits - 1).subtract(BigInteger.ONE);
    }

    private static BigInteger unsignedMax(int bits) {
        return BigInteger.ONE.shiftLeft(bits).subtract(BigInteger.ONE);
    }
}

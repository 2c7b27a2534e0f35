package edu.kit.kastel.vads.cdetector.lexer;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.jspecify.annotations.Nullable;

public enum KeywordType {
    AUTO("auto"),
    BREAK("break"),
    CASE("case"),
    CHAR("char"),
    CONST("const"),
    CONTINUE("continue"),
    DEFAULT("default"),
    DO("do"),
    DOUBLE("double"),
    ELSE("else"),
    ENUM("enum"),
    EXTERN("extern"),
    FLOAT("float"),
    FOR("for"),
    GOTO("goto"),
    IF("if"),
    INLINE("inline"),
    INT("int"),
    LONG("long"),
    REGISTER("register"),
    RESTRICT("restrict"),
    RETURN("return"),
    SHORT("short"),
    SIGNED("signed"),
    SIZEOF("sizeof"),
    STATIC("static"),
    STRUCT("struct"),
    SWITCH("switch"),
    TYPEDEF("typedef"),
    UNION("union"),
    UNSIGNED("unsigned"),
    VOID("void"),
    VOLATILE("volatile"),
    WHILE("while"),
    BOOL("bool"),
    BOOL_UNDERSCORE("_Bool"),
    TRUE("true"),
    FALSE("false");

    private static final Map<String, KeywordType> BY_KEYWORD = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(KeywordType::keyword, Function.identity()));

    private final String keyword;

    KeywordType(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public static @Nullable KeywordType fromString(String text) {
        return BY_KEYWORD.get(text);
    }

    /// Keywords that may start a declaration specifier sequence.
    public boolean startsDeclaration() {
        return switch (this) {
            case AUTO, CHAR, CONST, DOUBLE, ENUM, EXTERN, FLOAT, INLINE, INT, LONG, REGISTER, RESTRICT,
                 SHORT, SIGNED, STATIC, STRUCT, TYPEDEF, UNION, UNSIGNED, VOID, VOLATILE, BOOL,
                 BOOL_UNDERSCORE -> true;
            default -> false;
        };
    }

    @Override
    public String toString() {
        return keyword();
    }
}

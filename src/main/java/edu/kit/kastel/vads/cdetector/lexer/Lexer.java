package edu.kit.kastel.vads.cdetector.lexer;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.kit.kastel.vads.cdetector.Position;
import edu.kit.kastel.vads.cdetector.Span;
import edu.kit.kastel.vads.cdetector.lexer.Operator.OperatorType;
import edu.kit.kastel.vads.cdetector.lexer.Separator.SeparatorType;

/// Produces tokens on demand. Comments and literal contents are never tokenized,
/// but every newline they contain is counted.
public class Lexer {
    private static final Logger LOGGER = LoggerFactory.getLogger(Lexer.class);

    private final String source;
    private int pos;
    private int lineStart;
    private int line = 1;

    private Lexer(String source) {
        this.source = source;
    }

    public static Lexer forString(String source) {
        return new Lexer(source);
    }

    public Optional<Token> nextToken() {
        while (true) {
            skipWhitespaceAndComments();
            if (this.pos >= this.source.length()) {
                return Optional.empty();
            }
            char c = peek();
            if (c == '#' && atLineStart()) {
                Optional<Token> directive = lexDirective();
                if (directive.isPresent()) {
                    return directive;
                }
                continue;
            }
            Token token = switch (c) {
                case '(' -> separator(SeparatorType.PAREN_OPEN);
                case ')' -> separator(SeparatorType.PAREN_CLOSE);
                case '{' -> separator(SeparatorType.BRACE_OPEN);
                case '}' -> separator(SeparatorType.BRACE_CLOSE);
                case '[' -> separator(SeparatorType.BRACKET_OPEN);
                case ']' -> separator(SeparatorType.BRACKET_CLOSE);
                case ';' -> separator(SeparatorType.SEMICOLON);
                case ',' -> separator(SeparatorType.COMMA);
                case '?' -> new Operator(OperatorType.TERNARY_QUESTION, buildSpan(1));
                case ':' -> new Operator(OperatorType.TERNARY_COLON, buildSpan(1));
                case '~' -> new Operator(OperatorType.BITWISE_NOT, buildSpan(1));
                case '"' -> lexString();
                case '\'' -> lexChar();
                case '.' -> lexDot();
                case '-' -> lexMinus();
                case '+' -> lexPlus();
                case '*' -> singleOrAssign(OperatorType.MUL, OperatorType.ASSIGN_MUL);
                case '/' -> singleOrAssign(OperatorType.DIV, OperatorType.ASSIGN_DIV);
                case '%' -> singleOrAssign(OperatorType.MOD, OperatorType.ASSIGN_MOD);
                case '^' -> singleOrAssign(OperatorType.BITWISE_XOR, OperatorType.ASSIGN_XOR);
                case '=' -> singleOrAssign(OperatorType.ASSIGN, OperatorType.EQUAL);
                case '!' -> singleOrAssign(OperatorType.LOGICAL_NOT, OperatorType.NOT_EQUAL);
                case '&' -> lexDoubled('&', OperatorType.BITWISE_AND, OperatorType.ASSIGN_AND, OperatorType.LOGICAL_AND);
                case '|' -> lexDoubled('|', OperatorType.BITWISE_OR, OperatorType.ASSIGN_OR, OperatorType.LOGICAL_OR);
                case '<' -> lexAngle('<', OperatorType.LESS, OperatorType.LESS_EQUAL,
                    OperatorType.SHIFT_LEFT, OperatorType.ASSIGN_SHIFT_LEFT);
                case '>' -> lexAngle('>', OperatorType.GREATER, OperatorType.GREATER_EQUAL,
                    OperatorType.SHIFT_RIGHT, OperatorType.ASSIGN_SHIFT_RIGHT);
                default -> {
                    if (isDigit(c)) {
                        yield lexNumber();
                    }
                    if (isIdentifierStart(c)) {
                        yield lexIdentifierOrKeyword();
                    }
                    yield null;
                }
            };
            if (token != null) {
                return Optional.of(token);
            }
            LOGGER.debug("skipping unexpected character '{}' at line {}", c, this.line);
            this.pos++;
        }
    }

    private void skipWhitespaceAndComments() {
        while (hasMore(0)) {
            char c = peek();
            if (c == '\n') {
                newline();
            } else if (Character.isWhitespace(c)) {
                this.pos++;
            } else if (c == '\\' && hasMore(1) && peek(1) == '\n') {
                // line splice outside a directive
                this.pos++;
                newline();
            } else if (c == '/' && hasMore(1) && peek(1) == '/') {
                while (hasMore(0) && peek() != '\n') {
                    this.pos++;
                }
            } else if (c == '/' && hasMore(1) && peek(1) == '*') {
                this.pos += 2;
                skipBlockComment();
            } else {
                return;
            }
        }
    }

    private void skipBlockComment() {
        while (hasMore(0)) {
            if (peek() == '*' && hasMore(1) && peek(1) == '/') {
                this.pos += 2;
                return;
            }
            if (peek() == '\n') {
                newline();
            } else {
                this.pos++;
            }
        }
        LOGGER.debug("unterminated block comment runs to end of input");
    }

    private boolean atLineStart() {
        for (int i = this.lineStart; i < this.pos; i++) {
            if (!Character.isWhitespace(this.source.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private Optional<Token> lexDirective() {
        int start = this.pos;
        int startLine = this.line;
        int startColumn = start - this.lineStart;
        this.pos++;
        skipHorizontalWhitespace();
        int nameStart = this.pos;
        while (hasMore(0) && isIdentifierPart(peek())) {
            this.pos++;
        }
        String name = this.source.substring(nameStart, this.pos);
        if (!name.equals("include")) {
            skipDirectiveRemainder();
            return Optional.empty();
        }
        skipHorizontalWhitespace();
        int argumentStart = this.pos;
        if (hasMore(0) && (peek() == '<' || peek() == '"')) {
            char close = peek() == '<' ? '>' : '"';
            this.pos++;
            while (hasMore(0) && peek() != close && peek() != '\n') {
                this.pos++;
            }
            if (hasMore(0) && peek() == close) {
                this.pos++;
            }
        }
        String argument = this.source.substring(argumentStart, this.pos);
        Span span = new Span.SimpleSpan(
            new Position.SimplePosition(startLine, startColumn),
            new Position.SimplePosition(this.line, this.pos - this.lineStart)
        );
        skipDirectiveRemainder();
        if (argument.isEmpty()) {
            LOGGER.debug("include without header name at line {}", startLine);
            return Optional.empty();
        }
        return Optional.of(new Directive(name, argument, span));
    }

    private void skipDirectiveRemainder() {
        while (hasMore(0) && peek() != '\n') {
            if (peek() == '\\' && hasMore(1) && peek(1) == '\n') {
                this.pos++;
                newline();
            } else if (peek() == '/' && hasMore(1) && peek(1) == '*') {
                this.pos += 2;
                skipBlockComment();
            } else {
                this.pos++;
            }
        }
    }

    private void skipHorizontalWhitespace() {
        while (hasMore(0) && (peek() == ' ' || peek() == '\t')) {
            this.pos++;
        }
    }

    private Token lexString() {
        int startLine = this.line;
        int startColumn = this.pos - this.lineStart;
        this.pos++;
        int contentStart = this.pos;
        int contentEnd = skipQuoted('"');
        String value = this.source.substring(contentStart, contentEnd);
        return new StringLiteral(value, spanFrom(startLine, startColumn));
    }

    private Token lexChar() {
        int startLine = this.line;
        int startColumn = this.pos - this.lineStart;
        this.pos++;
        int contentStart = this.pos;
        int contentEnd = skipQuoted('\'');
        String value = this.source.substring(contentStart, contentEnd);
        return new CharLiteral(value, spanFrom(startLine, startColumn));
    }

    /// Advances past the closing quote; returns the end index of the content.
    /// An unterminated literal stops at the end of its line.
    private int skipQuoted(char quote) {
        while (hasMore(0)) {
            char c = peek();
            if (c == '\\' && hasMore(1)) {
                if (peek(1) == '\n') {
                    this.pos++;
                    newline();
                } else {
                    this.pos += 2;
                }
                continue;
            }
            if (c == quote) {
                int end = this.pos;
                this.pos++;
                return end;
            }
            if (c == '\n') {
                return this.pos;
            }
            this.pos++;
        }
        return this.pos;
    }

    private Token lexDot() {
        if (hasMore(1) && isDigit(peek(1))) {
            return lexNumber();
        }
        if (hasMore(2) && peek(1) == '.' && peek(2) == '.') {
            return separator(SeparatorType.ELLIPSIS, 3);
        }
        return new Operator(OperatorType.DOT, buildSpan(1));
    }

    private Token lexMinus() {
        if (hasMore(1)) {
            switch (peek(1)) {
                case '-':
                    return new Operator(OperatorType.DECREMENT, buildSpan(2));
                case '=':
                    return new Operator(OperatorType.ASSIGN_MINUS, buildSpan(2));
                case '>':
                    return new Operator(OperatorType.ARROW, buildSpan(2));
                default:
                    break;
            }
        }
        return new Operator(OperatorType.MINUS, buildSpan(1));
    }

    private Token lexPlus() {
        if (hasMore(1) && peek(1) == '+') {
            return new Operator(OperatorType.INCREMENT, buildSpan(2));
        }
        return singleOrAssign(OperatorType.PLUS, OperatorType.ASSIGN_PLUS);
    }

    private Token lexDoubled(char c, OperatorType single, OperatorType assign, OperatorType doubled) {
        if (hasMore(1) && peek(1) == c) {
            return new Operator(doubled, buildSpan(2));
        }
        return singleOrAssign(single, assign);
    }

    private Token lexAngle(char c, OperatorType single, OperatorType orEqual, OperatorType shift, OperatorType shiftAssign) {
        if (hasMore(1) && peek(1) == c) {
            if (hasMore(2) && peek(2) == '=') {
                return new Operator(shiftAssign, buildSpan(3));
            }
            return new Operator(shift, buildSpan(2));
        }
        return singleOrAssign(single, orEqual);
    }

    private Token lexNumber() {
        int startLine = this.line;
        int startColumn = this.pos - this.lineStart;
        int base = 10;
        boolean floating = false;
        int digitsStart;
        if (peek() == '0' && hasMore(1) && (peek(1) == 'x' || peek(1) == 'X')) {
            base = 16;
            this.pos += 2;
            digitsStart = this.pos;
            while (hasMore(0) && isHexDigit(peek())) {
                this.pos++;
            }
        } else {
            digitsStart = this.pos;
            while (hasMore(0) && isDigit(peek())) {
                this.pos++;
            }
            if (hasMore(0) && peek() == '.') {
                floating = true;
                this.pos++;
                while (hasMore(0) && isDigit(peek())) {
                    this.pos++;
                }
            }
            if (hasMore(0) && (peek() == 'e' || peek() == 'E')) {
                int exponent = this.pos + 1;
                if (exponent < this.source.length()
                    && (this.source.charAt(exponent) == '+' || this.source.charAt(exponent) == '-')) {
                    exponent++;
                }
                if (exponent < this.source.length() && isDigit(this.source.charAt(exponent))) {
                    floating = true;
                    this.pos = exponent;
                    while (hasMore(0) && isDigit(peek())) {
                        this.pos++;
                    }
                }
            }
            if (!floating && this.pos - digitsStart > 1 && this.source.charAt(digitsStart) == '0') {
                base = 8;
                digitsStart++;
            }
        }
        String value = this.source.substring(digitsStart, this.pos);
        int suffixStart = this.pos;
        while (hasMore(0) && isIdentifierPart(peek())) {
            this.pos++;
        }
        String suffix = this.source.substring(suffixStart, this.pos);
        if (base == 10 && suffix.equalsIgnoreCase("f")) {
            floating = true;
        }
        return new NumberLiteral(value, base, suffix, floating, spanFrom(startLine, startColumn));
    }

    private Token lexIdentifierOrKeyword() {
        int start = this.pos;
        while (hasMore(0) && isIdentifierPart(peek())) {
            this.pos++;
        }
        String id = this.source.substring(start, this.pos);
        Span span = spanFrom(this.line, start - this.lineStart);
        KeywordType keywordType = KeywordType.fromString(id);
        if (keywordType != null) {
            return new Keyword(keywordType, span);
        }
        return new Identifier(id, span);
    }

    private Token separator(SeparatorType type) {
        return separator(type, 1);
    }

    private Token separator(SeparatorType type, int length) {
        return new Separator(type, buildSpan(length));
    }

    private Token singleOrAssign(OperatorType single, OperatorType assign) {
        if (hasMore(1) && peek(1) == '=') {
            return new Operator(assign, buildSpan(2));
        }
        return new Operator(single, buildSpan(1));
    }

    private Span buildSpan(int proceed) {
        int start = this.pos;
        this.pos += proceed;
        Position.SimplePosition s = new Position.SimplePosition(this.line, start - this.lineStart);
        Position.SimplePosition e = new Position.SimplePosition(this.line, start - this.lineStart + proceed);
        return new Span.SimpleSpan(s, e);
    }

    private Span spanFrom(int startLine, int startColumn) {
        return new Span.SimpleSpan(
            new Position.SimplePosition(startLine, startColumn),
            new Position.SimplePosition(this.line, this.pos - this.lineStart)
        );
    }

    private void newline() {
        this.pos++;
        this.line++;
        this.lineStart = this.pos;
    }

    private static boolean isIdentifierStart(char c) {
        return c == '_' || c >= 'a' && c <= 'z' || c >= 'A' && c <= 'Z';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || c >= 'a' && c <= 'f' || c >= 'A' && c <= 'F';
    }

    private boolean hasMore(int offset) {
        return this.pos + offset < this.source.length();
    }

    private char peek() {
        return this.source.charAt(this.pos);
    }

    private char peek(int offset) {
        return this.source.charAt(this.pos + offset);
    }
}

package edu.kit.kastel.vads.cdetector.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.jspecify.annotations.Nullable;

import edu.kit.kastel.vads.cdetector.lexer.Identifier;
import edu.kit.kastel.vads.cdetector.lexer.Keyword;
import edu.kit.kastel.vads.cdetector.lexer.KeywordType;
import edu.kit.kastel.vads.cdetector.lexer.Lexer;
import edu.kit.kastel.vads.cdetector.lexer.Operator;
import edu.kit.kastel.vads.cdetector.lexer.Operator.OperatorType;
import edu.kit.kastel.vads.cdetector.lexer.Separator;
import edu.kit.kastel.vads.cdetector.lexer.Separator.SeparatorType;
import edu.kit.kastel.vads.cdetector.lexer.Token;

/// Pulls tokens from the lexer on demand and keeps the ones already seen,
/// so the parser can look a bounded distance ahead.
public class TokenSource {
    private final Lexer lexer;
    private final List<Token> tokens = new ArrayList<>();
    private boolean exhausted;
    private int idx;

    public TokenSource(Lexer lexer) {
        this.lexer = lexer;
    }

    public Token peek() {
        expectHasMore();
        return this.tokens.get(this.idx);
    }

    /// The token {@code offset} positions after the current one, or null past the end of input.
    public @Nullable Token peek(int offset) {
        if (!fill(this.idx + offset)) {
            return null;
        }
        return this.tokens.get(this.idx + offset);
    }

    public Keyword expectKeyword(KeywordType type) {
        Token token = peek();
        if (!(token instanceof Keyword kw) || kw.type() != type) {
            throw new ParseException("expected keyword '" + type + "' but got " + token.asString() + " at " + token.span());
        }
        this.idx++;
        return kw;
    }

    public Separator expectSeparator(SeparatorType type) {
        Token token = peek();
        if (!(token instanceof Separator sep) || sep.type() != type) {
            throw new ParseException("expected separator '" + type + "' but got " + token.asString() + " at " + token.span());
        }
        this.idx++;
        return sep;
    }

    public Operator expectOperator(OperatorType type) {
        Token token = peek();
        if (!(token instanceof Operator op) || op.type() != type) {
            throw new ParseException("expected operator '" + type + "' but got " + token.asString() + " at " + token.span());
        }
        this.idx++;
        return op;
    }

    public Identifier expectIdentifier() {
        Token token = peek();
        if (!(token instanceof Identifier ident)) {
            throw new ParseException("expected identifier but got " + token.asString() + " at " + token.span());
        }
        this.idx++;
        return ident;
    }

    public Token consume() {
        Token token = peek();
        this.idx++;
        return token;
    }

    public boolean hasMore() {
        return fill(this.idx);
    }

    private boolean fill(int index) {
        while (this.tokens.size() <= index && !this.exhausted) {
            Optional<Token> next = this.lexer.nextToken();
            if (next.isPresent()) {
                this.tokens.add(next.get());
            } else {
                this.exhausted = true;
            }
        }
        return index < this.tokens.size();
    }

    private void expectHasMore() {
        if (!hasMore()) {
            throw new ParseException("reached end of file");
        }
    }
}

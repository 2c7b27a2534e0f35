package edu.kit.kastel.vads.cdetector.parser;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.kit.kastel.vads.cdetector.Span;
import edu.kit.kastel.vads.cdetector.lexer.CharLiteral;
import edu.kit.kastel.vads.cdetector.lexer.Directive;
import edu.kit.kastel.vads.cdetector.lexer.Identifier;
import edu.kit.kastel.vads.cdetector.lexer.Keyword;
import edu.kit.kastel.vads.cdetector.lexer.KeywordType;
import edu.kit.kastel.vads.cdetector.lexer.NumberLiteral;
import edu.kit.kastel.vads.cdetector.lexer.Operator;
import edu.kit.kastel.vads.cdetector.lexer.Operator.OperatorType;
import edu.kit.kastel.vads.cdetector.lexer.Separator;
import edu.kit.kastel.vads.cdetector.lexer.Separator.SeparatorType;
import edu.kit.kastel.vads.cdetector.lexer.StringLiteral;
import edu.kit.kastel.vads.cdetector.lexer.Token;
import edu.kit.kastel.vads.cdetector.parser.ast.AddressOfTree;
import edu.kit.kastel.vads.cdetector.parser.ast.AssignmentTree;
import edu.kit.kastel.vads.cdetector.parser.ast.BinaryOperationTree;
import edu.kit.kastel.vads.cdetector.parser.ast.BlockTree;
import edu.kit.kastel.vads.cdetector.parser.ast.BreakTree;
import edu.kit.kastel.vads.cdetector.parser.ast.CallTree;
import edu.kit.kastel.vads.cdetector.parser.ast.CaseTree;
import edu.kit.kastel.vads.cdetector.parser.ast.CastTree;
import edu.kit.kastel.vads.cdetector.parser.ast.CharLiteralTree;
import edu.kit.kastel.vads.cdetector.parser.ast.ContinueTree;
import edu.kit.kastel.vads.cdetector.parser.ast.DeclarationTree;
import edu.kit.kastel.vads.cdetector.parser.ast.DereferenceTree;
import edu.kit.kastel.vads.cdetector.parser.ast.DoWhileTree;
import edu.kit.kastel.vads.cdetector.parser.ast.EmptyTree;
import edu.kit.kastel.vads.cdetector.parser.ast.ExpressionStatementTree;
import edu.kit.kastel.vads.cdetector.parser.ast.ExpressionTree;
import edu.kit.kastel.vads.cdetector.parser.ast.ForTree;
import edu.kit.kastel.vads.cdetector.parser.ast.FunctionDeclarationTree;
import edu.kit.kastel.vads.cdetector.parser.ast.FunctionTree;
import edu.kit.kastel.vads.cdetector.parser.ast.GotoTree;
import edu.kit.kastel.vads.cdetector.parser.ast.IdentExpressionTree;
import edu.kit.kastel.vads.cdetector.parser.ast.IfTree;
import edu.kit.kastel.vads.cdetector.parser.ast.IncludeTree;
import edu.kit.kastel.vads.cdetector.parser.ast.IndexTree;
import edu.kit.kastel.vads.cdetector.parser.ast.InitializerListTree;
import edu.kit.kastel.vads.cdetector.parser.ast.LiteralTree;
import edu.kit.kastel.vads.cdetector.parser.ast.MemberAccessTree;
import edu.kit.kastel.vads.cdetector.parser.ast.NameTree;
import edu.kit.kastel.vads.cdetector.parser.ast.ParameterTree;
import edu.kit.kastel.vads.cdetector.parser.ast.ProgramTree;
import edu.kit.kastel.vads.cdetector.parser.ast.ReturnTree;
import edu.kit.kastel.vads.cdetector.parser.ast.SizeofTree;
import edu.kit.kastel.vads.cdetector.parser.ast.StatementTree;
import edu.kit.kastel.vads.cdetector.parser.ast.StringLiteralTree;
import edu.kit.kastel.vads.cdetector.parser.ast.SwitchTree;
import edu.kit.kastel.vads.cdetector.parser.ast.TernaryTree;
import edu.kit.kastel.vads.cdetector.parser.ast.Tree;
import edu.kit.kastel.vads.cdetector.parser.ast.TypeDefinitionTree;
import edu.kit.kastel.vads.cdetector.parser.ast.TypeDefinitionTree.TagKind;
import edu.kit.kastel.vads.cdetector.parser.ast.TypeTree;
import edu.kit.kastel.vads.cdetector.parser.ast.UnaryOperationTree;
import edu.kit.kastel.vads.cdetector.parser.ast.WhileTree;
import edu.kit.kastel.vads.cdetector.parser.symbol.Name;
import edu.kit.kastel.vads.cdetector.parser.symbol.Scope;
import edu.kit.kastel.vads.cdetector.parser.symbol.ScopeArena;
import edu.kit.kastel.vads.cdetector.parser.symbol.ScopeKind;
import edu.kit.kastel.vads.cdetector.parser.symbol.StorageClass;
import edu.kit.kastel.vads.cdetector.parser.symbol.Symbol;
import edu.kit.kastel.vads.cdetector.parser.symbol.SymbolKind;
import edu.kit.kastel.vads.cdetector.parser.type.ArrayType;
import edu.kit.kastel.vads.cdetector.parser.type.BasicType;
import edu.kit.kastel.vads.cdetector.parser.type.NamedType;
import edu.kit.kastel.vads.cdetector.parser.type.PointerType;
import edu.kit.kastel.vads.cdetector.parser.type.Type;

/// Recursive descent parser for the C subset the passes understand.
///
/// Declarations are told apart from statements by looking a bounded number of tokens ahead,
/// never by backtracking. Names are resolved against the scope arena while parsing, so every
/// identifier expression carries the declaration visible at that point.
public class Parser {
    private static final Logger LOGGER = LoggerFactory.getLogger(Parser.class);

    private static final Set<String> LIBRARY_TYPES = Set.of(
        "FILE", "va_list", "jmp_buf", "fpos_t", "div_t", "ldiv_t", "pthread_t", "pthread_mutex_t", "wchar_t"
    );
    private static final Set<OperatorType> EQUALITY = Set.of(OperatorType.EQUAL, OperatorType.NOT_EQUAL);
    private static final Set<OperatorType> RELATIONAL = Set.of(
        OperatorType.LESS, OperatorType.LESS_EQUAL, OperatorType.GREATER, OperatorType.GREATER_EQUAL
    );
    private static final Set<OperatorType> SHIFT = Set.of(OperatorType.SHIFT_LEFT, OperatorType.SHIFT_RIGHT);
    private static final Set<OperatorType> ADDITIVE = Set.of(OperatorType.PLUS, OperatorType.MINUS);
    private static final Set<OperatorType> MULTIPLICATIVE = Set.of(OperatorType.MUL, OperatorType.DIV, OperatorType.MOD);

    private final TokenSource tokenSource;
    private final ScopeArena scopes = new ScopeArena();
    private final Map<String, Type> typedefs = new HashMap<>();
    private final List<IncludeTree> includes = new ArrayList<>();
    private final List<StaleReference> staleReferences = new ArrayList<>();
    private final List<ParseProblem> problems = new ArrayList<>();
    private final StructureIndex index = new StructureIndex();
    private String fileName = "<input>";
    private int currentScope;

    public Parser(TokenSource tokenSource) {
        this.tokenSource = tokenSource;
        this.currentScope = this.scopes.root();
    }

    public TranslationUnit parseTranslationUnit(String fileName) {
        this.fileName = fileName;
        ProgramTree program = parseProgram();
        return new TranslationUnit(fileName, program, this.scopes, this.includes, this.staleReferences,
            this.problems, this.index);
    }

    private ProgramTree parseProgram() {
        List<Tree> topLevelTrees = new ArrayList<>();
        while (this.tokenSource.hasMore()) {
            Token token = this.tokenSource.peek();
            if (token instanceof Directive directive) {
                this.tokenSource.consume();
                topLevelTrees.add(include(directive));
                continue;
            }
            if (token.isSeparator(SeparatorType.SEMICOLON)) {
                this.tokenSource.consume();
                continue;
            }
            try {
                topLevelTrees.addAll(parseDeclaration(true));
            } catch (ParseException e) {
                recover(e, this.scopes.root());
            }
        }
        return new ProgramTree(topLevelTrees);
    }

    private IncludeTree include(Directive directive) {
        String argument = directive.argument();
        boolean system = argument.startsWith("<");
        String header = argument.substring(1);
        if (header.endsWith(">") || header.endsWith("\"")) {
            header = header.substring(0, header.length() - 1);
        }
        IncludeTree includeTree = new IncludeTree(header.strip(), system, directive.span());
        this.includes.add(includeTree);
        return includeTree;
    }

    /// Skips to the end of the broken statement. A {@code ;} is consumed, a {@code }} closing
    /// the current block is left for the caller.
    private void recover(ParseException e, int scope) {
        int line = this.tokenSource.hasMore() ? this.tokenSource.peek().span().line() : -1;
        LOGGER.warn("{}: skipping malformed construct near line {}: {}", this.fileName, line, e.getMessage());
        this.problems.add(new ParseProblem(line, e.getMessage()));
        this.currentScope = scope;
        int depth = 0;
        boolean progressed = false;
        while (this.tokenSource.hasMore()) {
            Token token = this.tokenSource.peek();
            if (token.isSeparator(SeparatorType.BRACE_CLOSE)) {
                if (depth == 0) {
                    if (!progressed && scope == this.scopes.root()) {
                        this.tokenSource.consume();
                    }
                    return;
                }
                depth--;
            } else if (token.isSeparator(SeparatorType.BRACE_OPEN)) {
                depth++;
            } else if (token.isSeparator(SeparatorType.SEMICOLON) && depth == 0) {
                this.tokenSource.consume();
                return;
            }
            this.tokenSource.consume();
            progressed = true;
        }
    }

    // declarations

    private List<Tree> parseDeclaration(boolean topLevel) {
        Specifiers specifiers = parseSpecifiers();
        List<Tree> trees = new ArrayList<>(specifiers.definitions());
        if (this.tokenSource.peek().isSeparator(SeparatorType.SEMICOLON)) {
            this.tokenSource.consume();
            return trees;
        }
        boolean first = true;
        while (true) {
            Declarator declarator = parseDeclarator(specifiers.type(), false);
            if (declarator.isFunction()) {
                Symbol function = declareFunction(specifiers, declarator);
                if (first && topLevel && this.tokenSource.peek().isSeparator(SeparatorType.BRACE_OPEN)) {
                    trees.add(parseFunctionBody(specifiers, declarator, function));
                    return trees;
                }
                this.scopes.close(declarator.parameterScope());
                if (topLevel) {
                    trees.add(new FunctionDeclarationTree(specifiers.typeTree(), name(declarator.name()),
                        declarator.parameters(), function, specifiers.span().merge(declarator.name().span())));
                }
            } else if (specifiers.typedef()) {
                this.typedefs.put(declarator.name().value(), declarator.type());
            } else {
                trees.add(parseVariable(specifiers, declarator));
            }
            first = false;
            if (this.tokenSource.peek().isSeparator(SeparatorType.COMMA)) {
                this.tokenSource.consume();
                continue;
            }
            this.tokenSource.expectSeparator(SeparatorType.SEMICOLON);
            return trees;
        }
    }

    private Symbol declareFunction(Specifiers specifiers, Declarator declarator) {
        Scope scope = this.scopes.get(this.currentScope);
        Symbol existing = scope.lookup(declarator.name().value());
        if (existing != null && existing.kind() == SymbolKind.FUNCTION) {
            return existing;
        }
        Symbol function = new Symbol(Name.forIdentifier(declarator.name()), declarator.type(), this.currentScope,
            SymbolKind.FUNCTION, specifiers.storage(), declarator.name().span());
        this.scopes.declare(function);
        return function;
    }

    private FunctionTree parseFunctionBody(Specifiers specifiers, Declarator declarator, Symbol function) {
        int outer = this.currentScope;
        int scope = declarator.parameterScope();
        BlockTree body = parseBlockBody(scope);
        this.currentScope = outer;
        FunctionTree functionTree = new FunctionTree(specifiers.typeTree(), name(declarator.name()),
            declarator.parameters(), body, function, scope);
        this.index.addFunction(functionTree);
        return functionTree;
    }

    private DeclarationTree parseVariable(Specifiers specifiers, Declarator declarator) {
        Type type = declarator.type();
        SymbolKind kind;
        if (type instanceof ArrayType) {
            kind = SymbolKind.ARRAY;
        } else if (type instanceof PointerType) {
            kind = SymbolKind.POINTER;
        } else {
            kind = SymbolKind.VARIABLE;
        }
        Symbol symbol = new Symbol(Name.forIdentifier(declarator.name()), type, this.currentScope, kind,
            specifiers.storage(), declarator.name().span());
        // visible inside its own initializer
        this.scopes.declare(symbol);
        ExpressionTree initializer = null;
        if (this.tokenSource.peek().isOperator(OperatorType.ASSIGN)) {
            this.tokenSource.expectOperator(OperatorType.ASSIGN);
            initializer = parseInitializer();
        }
        DeclarationTree declaration = new DeclarationTree(
            new TypeTree(type, specifiers.span()), name(declarator.name()), initializer, symbol);
        this.index.addDeclaration(declaration, this.currentScope);
        return declaration;
    }

    private ExpressionTree parseInitializer() {
        if (!this.tokenSource.peek().isSeparator(SeparatorType.BRACE_OPEN)) {
            return parseAssignment();
        }
        Separator open = this.tokenSource.expectSeparator(SeparatorType.BRACE_OPEN);
        List<ExpressionTree> elements = new ArrayList<>();
        while (!this.tokenSource.peek().isSeparator(SeparatorType.BRACE_CLOSE)) {
            skipDesignator();
            elements.add(parseInitializer());
            if (!this.tokenSource.peek().isSeparator(SeparatorType.COMMA)) {
                break;
            }
            this.tokenSource.consume();
        }
        Separator close = this.tokenSource.expectSeparator(SeparatorType.BRACE_CLOSE);
        return new InitializerListTree(elements, open.span().merge(close.span()));
    }

    private void skipDesignator() {
        boolean designated = false;
        while (true) {
            Token token = this.tokenSource.peek();
            if (token.isOperator(OperatorType.DOT)) {
                this.tokenSource.consume();
                this.tokenSource.expectIdentifier();
                designated = true;
            } else if (token.isSeparator(SeparatorType.BRACKET_OPEN)) {
                this.tokenSource.consume();
                parseConditional();
                this.tokenSource.expectSeparator(SeparatorType.BRACKET_CLOSE);
                designated = true;
            } else {
                break;
            }
        }
        if (designated) {
            this.tokenSource.expectOperator(OperatorType.ASSIGN);
        }
    }

    private Specifiers parseSpecifiers() {
        Span start = this.tokenSource.peek().span();
        Span end = start;
        StorageClass storage = StorageClass.NONE;
        boolean typedef = false;
        boolean signed = false;
        boolean unsigned = false;
        int longs = 0;
        KeywordType base = null;
        Type named = null;
        List<Tree> definitions = new ArrayList<>();
        while (this.tokenSource.hasMore()) {
            Token token = this.tokenSource.peek();
            if (token instanceof Keyword keyword) {
                KeywordType type = keyword.type();
                if (type == KeywordType.STRUCT || type == KeywordType.UNION || type == KeywordType.ENUM) {
                    named = parseTagSpecifier(definitions);
                    end = keyword.span();
                    continue;
                }
                if (!type.startsDeclaration()) {
                    break;
                }
                this.tokenSource.consume();
                end = keyword.span();
                switch (type) {
                    case STATIC -> storage = StorageClass.STATIC;
                    case EXTERN -> storage = StorageClass.EXTERN;
                    case TYPEDEF -> typedef = true;
                    case SIGNED -> signed = true;
                    case UNSIGNED -> unsigned = true;
                    case LONG -> longs++;
                    case VOID, CHAR, SHORT, INT, FLOAT, DOUBLE, BOOL, BOOL_UNDERSCORE -> base = type;
                    default -> {
                        // qualifiers and auto, register, inline do not change the model
                    }
                }
                continue;
            }
            boolean hasType = base != null || named != null || signed || unsigned || longs > 0;
            if (token instanceof Identifier ident && !hasType && isTypeNameInSpecifiers(ident)) {
                this.tokenSource.consume();
                end = ident.span();
                named = typeNamed(ident.value());
                continue;
            }
            break;
        }
        Type type = named != null ? named : basicType(base, signed, unsigned, longs);
        return new Specifiers(type, storage, typedef, definitions, start.merge(end));
    }

    private boolean isTypeNameInSpecifiers(Identifier ident) {
        if (isKnownTypeName(ident.value())) {
            return true;
        }
        Token next = this.tokenSource.peek(1);
        return next instanceof Identifier || next != null && next.isOperator(OperatorType.MUL);
    }

    private Type typeNamed(String name) {
        Type typedef = this.typedefs.get(name);
        if (typedef != null) {
            return typedef;
        }
        BasicType alias = BasicType.forAlias(name);
        if (alias != null) {
            return alias;
        }
        return new NamedType(name);
    }

    private static BasicType basicType(@Nullable KeywordType base, boolean signed, boolean unsigned, int longs) {
        if (base == null) {
            base = KeywordType.INT;
        }
        return switch (base) {
            case VOID -> BasicType.VOID;
            case BOOL, BOOL_UNDERSCORE -> BasicType.BOOL;
            case CHAR -> unsigned ? BasicType.UNSIGNED_CHAR : signed ? BasicType.SIGNED_CHAR : BasicType.CHAR;
            case SHORT -> unsigned ? BasicType.UNSIGNED_SHORT : BasicType.SHORT;
            case FLOAT -> BasicType.FLOAT;
            case DOUBLE -> longs > 0 ? BasicType.LONG_DOUBLE : BasicType.DOUBLE;
            default -> {
                if (longs >= 2) {
                    yield unsigned ? BasicType.UNSIGNED_LONG_LONG : BasicType.LONG_LONG;
                }
                if (longs == 1) {
                    yield unsigned ? BasicType.UNSIGNED_LONG : BasicType.LONG;
                }
                yield unsigned ? BasicType.UNSIGNED_INT : BasicType.INT;
            }
        };
    }

    private Type parseTagSpecifier(List<Tree> definitions) {
        Keyword keyword = (Keyword) this.tokenSource.consume();
        TagKind tagKind = switch (keyword.type()) {
            case STRUCT -> TagKind.STRUCT;
            case UNION -> TagKind.UNION;
            default -> TagKind.ENUM;
        };
        String tag = null;
        if (this.tokenSource.peek() instanceof Identifier ident) {
            this.tokenSource.consume();
            tag = ident.value();
        }
        Type type;
        if (tagKind == TagKind.ENUM) {
            type = BasicType.INT;
        } else {
            // anonymous bodies get a name unique to their position
            String name = tag != null ? tag : "<anonymous " + keyword.span().start() + ">";
            type = new NamedType(keyword.type().keyword() + " " + name);
        }
        if (this.tokenSource.peek().isSeparator(SeparatorType.BRACE_OPEN)) {
            definitions.add(tagKind == TagKind.ENUM
                ? parseEnumBody(tag, keyword.span())
                : parseStructBody(tagKind, tag, type, keyword.span()));
        }
        return type;
    }

    private TypeDefinitionTree parseStructBody(TagKind tagKind, @Nullable String tag, Type type, Span start) {
        int outer = this.currentScope;
        int scope = this.scopes.open(ScopeKind.STRUCT, outer);
        this.currentScope = scope;
        this.tokenSource.expectSeparator(SeparatorType.BRACE_OPEN);
        List<Symbol> members = new ArrayList<>();
        while (!this.tokenSource.peek().isSeparator(SeparatorType.BRACE_CLOSE)) {
            Specifiers specifiers = parseSpecifiers();
            while (!this.tokenSource.peek().isSeparator(SeparatorType.SEMICOLON)) {
                Declarator declarator = parseDeclarator(specifiers.type(), true);
                if (this.tokenSource.peek().isOperator(OperatorType.TERNARY_COLON)) {
                    // bit-field width
                    this.tokenSource.consume();
                    parseConditional();
                }
                if (declarator.isFunction()) {
                    this.scopes.close(declarator.parameterScope());
                }
                if (declarator.name() != null) {
                    Symbol member = new Symbol(Name.forIdentifier(declarator.name()), declarator.type(), scope,
                        SymbolKind.STRUCT_MEMBER, StorageClass.NONE, declarator.name().span());
                    this.scopes.declare(member);
                    members.add(member);
                }
                if (!this.tokenSource.peek().isSeparator(SeparatorType.COMMA)) {
                    break;
                }
                this.tokenSource.consume();
            }
            this.tokenSource.expectSeparator(SeparatorType.SEMICOLON);
        }
        Separator close = this.tokenSource.expectSeparator(SeparatorType.BRACE_CLOSE);
        this.scopes.close(scope);
        this.currentScope = outer;
        return new TypeDefinitionTree(tagKind, tag, type, members, start.merge(close.span()));
    }

    private TypeDefinitionTree parseEnumBody(@Nullable String tag, Span start) {
        this.tokenSource.expectSeparator(SeparatorType.BRACE_OPEN);
        List<Symbol> constants = new ArrayList<>();
        while (!this.tokenSource.peek().isSeparator(SeparatorType.BRACE_CLOSE)) {
            Identifier ident = this.tokenSource.expectIdentifier();
            Symbol constant = new Symbol(Name.forIdentifier(ident), BasicType.INT, this.currentScope,
                SymbolKind.ENUM_CONSTANT, StorageClass.NONE, ident.span());
            this.scopes.declare(constant);
            constants.add(constant);
            if (this.tokenSource.peek().isOperator(OperatorType.ASSIGN)) {
                this.tokenSource.consume();
                parseConditional();
            }
            if (!this.tokenSource.peek().isSeparator(SeparatorType.COMMA)) {
                break;
            }
            this.tokenSource.consume();
        }
        Separator close = this.tokenSource.expectSeparator(SeparatorType.BRACE_CLOSE);
        return new TypeDefinitionTree(TagKind.ENUM, tag, BasicType.INT, constants, start.merge(close.span()));
    }

    /// Parses pointer stars, the declared name and array or parameter suffixes.
    /// For a function declarator the parameters are declared in a fresh function scope that is
    /// left open, the caller either parses the body into it or closes it.
    private Declarator parseDeclarator(Type base, boolean nameOptional) {
        Type type = parsePointers(base);
        if (this.tokenSource.peek().isSeparator(SeparatorType.PAREN_OPEN) && isOperatorAt(1, OperatorType.MUL)) {
            // function pointer, modeled as a plain pointer
            this.tokenSource.consume();
            while (this.tokenSource.peek().isOperator(OperatorType.MUL)) {
                this.tokenSource.consume();
            }
            Identifier name = null;
            if (this.tokenSource.peek() instanceof Identifier ident) {
                this.tokenSource.consume();
                name = ident;
            }
            Type pointer = parseArraySuffixes(new PointerType(type));
            this.tokenSource.expectSeparator(SeparatorType.PAREN_CLOSE);
            if (this.tokenSource.peek().isSeparator(SeparatorType.PAREN_OPEN)) {
                skipBalanced(SeparatorType.PAREN_OPEN, SeparatorType.PAREN_CLOSE);
            }
            return new Declarator(name, parseArraySuffixes(pointer), null, Scope.NO_PARENT);
        }
        Identifier name = null;
        if (this.tokenSource.peek() instanceof Identifier ident) {
            this.tokenSource.consume();
            name = ident;
        } else if (!nameOptional) {
            throw new ParseException("expected identifier but got " + this.tokenSource.peek().asString()
                + " at " + this.tokenSource.peek().span());
        }
        if (name != null && this.tokenSource.peek().isSeparator(SeparatorType.PAREN_OPEN)) {
            int parameterScope = this.scopes.open(ScopeKind.FUNCTION, this.currentScope);
            List<ParameterTree> parameters = parseParameters(parameterScope);
            return new Declarator(name, type, parameters, parameterScope);
        }
        return new Declarator(name, parseArraySuffixes(type), null, Scope.NO_PARENT);
    }

    private Type parsePointers(Type base) {
        Type type = base;
        while (this.tokenSource.peek().isOperator(OperatorType.MUL)) {
            this.tokenSource.consume();
            type = new PointerType(type);
            while (this.tokenSource.peek() instanceof Keyword keyword && isQualifier(keyword.type())) {
                this.tokenSource.consume();
            }
        }
        return type;
    }

    private static boolean isQualifier(KeywordType type) {
        return type == KeywordType.CONST || type == KeywordType.VOLATILE || type == KeywordType.RESTRICT;
    }

    private Type parseArraySuffixes(Type type) {
        int dimensions = 0;
        while (this.tokenSource.peek().isSeparator(SeparatorType.BRACKET_OPEN)) {
            this.tokenSource.consume();
            if (!this.tokenSource.peek().isSeparator(SeparatorType.BRACKET_CLOSE)) {
                parseAssignment();
            }
            this.tokenSource.expectSeparator(SeparatorType.BRACKET_CLOSE);
            dimensions++;
        }
        Type result = type;
        for (int i = 0; i < dimensions; i++) {
            result = new ArrayType(result);
        }
        return result;
    }

    private List<ParameterTree> parseParameters(int parameterScope) {
        int outer = this.currentScope;
        this.currentScope = parameterScope;
        this.tokenSource.expectSeparator(SeparatorType.PAREN_OPEN);
        List<ParameterTree> parameters = new ArrayList<>();
        if (this.tokenSource.peek().isKeyword(KeywordType.VOID) && isSeparatorAt(1, SeparatorType.PAREN_CLOSE)) {
            this.tokenSource.consume();
        }
        while (!this.tokenSource.peek().isSeparator(SeparatorType.PAREN_CLOSE)) {
            if (this.tokenSource.peek().isSeparator(SeparatorType.ELLIPSIS)) {
                this.tokenSource.consume();
                break;
            }
            parameters.add(parseParameter(parameterScope));
            if (!this.tokenSource.peek().isSeparator(SeparatorType.COMMA)) {
                break;
            }
            this.tokenSource.consume();
        }
        this.tokenSource.expectSeparator(SeparatorType.PAREN_CLOSE);
        this.currentScope = outer;
        return parameters;
    }

    private ParameterTree parseParameter(int parameterScope) {
        Specifiers specifiers = parseSpecifiers();
        Declarator declarator = parseDeclarator(specifiers.type(), true);
        if (declarator.isFunction()) {
            this.scopes.close(declarator.parameterScope());
        }
        Type type = declarator.type();
        if (type instanceof ArrayType array) {
            type = new PointerType(array.element());
        }
        TypeTree typeTree = new TypeTree(type, specifiers.span());
        if (declarator.name() == null) {
            return new ParameterTree(typeTree, null, null, specifiers.span());
        }
        Symbol symbol = new Symbol(Name.forIdentifier(declarator.name()), type, parameterScope,
            SymbolKind.PARAMETER, StorageClass.NONE, declarator.name().span());
        this.scopes.declare(symbol);
        return new ParameterTree(typeTree, name(declarator.name()), symbol,
            specifiers.span().merge(declarator.name().span()));
    }

    private TypeTree parseTypeName() {
        Specifiers specifiers = parseSpecifiers();
        Type type = parsePointers(specifiers.type());
        Span span = specifiers.span();
        if (this.tokenSource.peek().isSeparator(SeparatorType.PAREN_OPEN) && isOperatorAt(1, OperatorType.MUL)) {
            skipBalanced(SeparatorType.PAREN_OPEN, SeparatorType.PAREN_CLOSE);
            if (this.tokenSource.peek().isSeparator(SeparatorType.PAREN_OPEN)) {
                skipBalanced(SeparatorType.PAREN_OPEN, SeparatorType.PAREN_CLOSE);
            }
            type = new PointerType(type);
        }
        type = parseArraySuffixes(type);
        return new TypeTree(type, span);
    }

    private void skipBalanced(SeparatorType open, SeparatorType close) {
        this.tokenSource.expectSeparator(open);
        int depth = 1;
        while (depth > 0) {
            Token token = this.tokenSource.consume();
            if (token.isSeparator(open)) {
                depth++;
            } else if (token.isSeparator(close)) {
                depth--;
            }
        }
    }

    // statements

    private BlockTree parseBlock() {
        int outer = this.currentScope;
        int scope = this.scopes.open(ScopeKind.BLOCK, outer);
        BlockTree block = parseBlockBody(scope);
        this.currentScope = outer;
        return block;
    }

    private BlockTree parseBlockBody(int scope) {
        this.currentScope = scope;
        Separator bodyOpen = this.tokenSource.expectSeparator(SeparatorType.BRACE_OPEN);
        List<StatementTree> statements = new ArrayList<>();
        while (this.tokenSource.hasMore() && !this.tokenSource.peek().isSeparator(SeparatorType.BRACE_CLOSE)) {
            try {
                statements.addAll(parseBlockItem());
            } catch (ParseException e) {
                recover(e, scope);
            }
        }
        Span end;
        if (this.tokenSource.hasMore()) {
            end = this.tokenSource.expectSeparator(SeparatorType.BRACE_CLOSE).span();
        } else {
            // keep what was parsed of a block cut off by the end of input
            int line = bodyOpen.span().line();
            LOGGER.warn("{}: block opened on line {} is not closed", this.fileName, line);
            this.problems.add(new ParseProblem(line, "block is not closed before the end of input"));
            end = statements.isEmpty() ? bodyOpen.span() : statements.get(statements.size() - 1).span();
        }
        this.scopes.close(scope);
        return new BlockTree(statements, scope, bodyOpen.span().merge(end));
    }

    private List<StatementTree> parseBlockItem() {
        if (isDeclarationStart()) {
            List<StatementTree> statements = new ArrayList<>();
            for (Tree tree : parseDeclaration(false)) {
                if (tree instanceof StatementTree statement) {
                    statements.add(statement);
                }
            }
            return statements;
        }
        return List.of(parseStatement());
    }

    /// The lookahead classifier telling declarations from statements inside a block.
    private boolean isDeclarationStart() {
        Token token = this.tokenSource.peek();
        if (token instanceof Keyword keyword) {
            return keyword.type().startsDeclaration();
        }
        if (!(token instanceof Identifier ident) || isLiveVariable(ident.value())) {
            return false;
        }
        if (isKnownTypeName(ident.value())) {
            return true;
        }
        Token next = this.tokenSource.peek(1);
        if (next instanceof Identifier) {
            return true;
        }
        int offset = 1;
        while (isOperatorAt(offset, OperatorType.MUL)) {
            offset++;
        }
        if (offset == 1 || !(this.tokenSource.peek(offset) instanceof Identifier)) {
            return false;
        }
        Token after = this.tokenSource.peek(offset + 1);
        return after != null && (after.isSeparator(SeparatorType.SEMICOLON)
            || after.isSeparator(SeparatorType.COMMA)
            || after.isSeparator(SeparatorType.BRACKET_OPEN)
            || after.isOperator(OperatorType.ASSIGN));
    }

    private boolean isKnownTypeName(String name) {
        return this.typedefs.containsKey(name) || BasicType.forAlias(name) != null || LIBRARY_TYPES.contains(name);
    }

    private boolean isLiveVariable(String name) {
        Symbol symbol = this.scopes.resolve(name, this.currentScope);
        return symbol != null;
    }

    private StatementTree parseStatement() {
        Token token = this.tokenSource.peek();
        if (token instanceof Directive directive) {
            this.tokenSource.consume();
            return include(directive);
        }
        if (token.isSeparator(SeparatorType.BRACE_OPEN)) {
            return parseBlock();
        }
        if (token.isSeparator(SeparatorType.SEMICOLON)) {
            return new EmptyTree(this.tokenSource.consume().span());
        }
        if (token instanceof Keyword keyword) {
            switch (keyword.type()) {
                case IF:
                    return parseIf();
                case WHILE:
                    return parseWhile();
                case DO:
                    return parseDoWhile();
                case FOR:
                    return parseFor();
                case SWITCH:
                    return parseSwitch();
                case CASE:
                case DEFAULT:
                    return parseCase();
                case BREAK: {
                    Keyword breakKeyword = this.tokenSource.expectKeyword(KeywordType.BREAK);
                    this.tokenSource.expectSeparator(SeparatorType.SEMICOLON);
                    return new BreakTree(breakKeyword.span());
                }
                case CONTINUE: {
                    Keyword continueKeyword = this.tokenSource.expectKeyword(KeywordType.CONTINUE);
                    this.tokenSource.expectSeparator(SeparatorType.SEMICOLON);
                    return new ContinueTree(continueKeyword.span());
                }
                case RETURN:
                    return parseReturn();
                case GOTO: {
                    Keyword gotoKeyword = this.tokenSource.expectKeyword(KeywordType.GOTO);
                    Identifier label = this.tokenSource.expectIdentifier();
                    this.tokenSource.expectSeparator(SeparatorType.SEMICOLON);
                    return new GotoTree(name(label), gotoKeyword.span().merge(label.span()));
                }
                default:
                    break;
            }
        }
        if (token instanceof Identifier && isOperatorAt(1, OperatorType.TERNARY_COLON)) {
            // labels carry no meaning for the passes
            this.tokenSource.consume();
            Operator colon = this.tokenSource.expectOperator(OperatorType.TERNARY_COLON);
            if (this.tokenSource.peek().isSeparator(SeparatorType.BRACE_CLOSE)) {
                return new EmptyTree(colon.span());
            }
            return parseStatement();
        }
        ExpressionTree expression = parseExpression();
        this.tokenSource.expectSeparator(SeparatorType.SEMICOLON);
        return new ExpressionStatementTree(expression);
    }

    private StatementTree parseIf() {
        Keyword ifKeyword = this.tokenSource.expectKeyword(KeywordType.IF);
        this.tokenSource.expectSeparator(SeparatorType.PAREN_OPEN);
        ExpressionTree condition = parseExpression();
        this.tokenSource.expectSeparator(SeparatorType.PAREN_CLOSE);
        StatementTree thenBranch = parseStatement();
        StatementTree elseBranch = null;
        if (this.tokenSource.hasMore() && this.tokenSource.peek().isKeyword(KeywordType.ELSE)) {
            this.tokenSource.expectKeyword(KeywordType.ELSE);
            elseBranch = parseStatement();
        }
        Span end = elseBranch != null ? elseBranch.span() : thenBranch.span();
        return new IfTree(condition, thenBranch, elseBranch, ifKeyword.span().merge(end));
    }

    private StatementTree parseWhile() {
        Keyword whileKeyword = this.tokenSource.expectKeyword(KeywordType.WHILE);
        this.tokenSource.expectSeparator(SeparatorType.PAREN_OPEN);
        ExpressionTree condition = parseExpression();
        this.tokenSource.expectSeparator(SeparatorType.PAREN_CLOSE);
        StatementTree body = parseStatement();
        WhileTree whileTree = new WhileTree(condition, body, whileKeyword.span().merge(body.span()));
        this.index.addLoop(whileTree, this.currentScope);
        return whileTree;
    }

    private StatementTree parseDoWhile() {
        Keyword doKeyword = this.tokenSource.expectKeyword(KeywordType.DO);
        StatementTree body = parseStatement();
        this.tokenSource.expectKeyword(KeywordType.WHILE);
        this.tokenSource.expectSeparator(SeparatorType.PAREN_OPEN);
        ExpressionTree condition = parseExpression();
        this.tokenSource.expectSeparator(SeparatorType.PAREN_CLOSE);
        Separator end = this.tokenSource.expectSeparator(SeparatorType.SEMICOLON);
        DoWhileTree doWhileTree = new DoWhileTree(body, condition, doKeyword.span().merge(end.span()));
        this.index.addLoop(doWhileTree, this.currentScope);
        return doWhileTree;
    }

    private StatementTree parseFor() {
        Keyword forKeyword = this.tokenSource.expectKeyword(KeywordType.FOR);
        int outer = this.currentScope;
        int scope = this.scopes.open(ScopeKind.BLOCK, outer);
        this.currentScope = scope;
        this.tokenSource.expectSeparator(SeparatorType.PAREN_OPEN);
        StatementTree initializer = parseForInitializer(scope);
        ExpressionTree condition = null;
        if (!this.tokenSource.peek().isSeparator(SeparatorType.SEMICOLON)) {
            condition = parseExpression();
        }
        this.tokenSource.expectSeparator(SeparatorType.SEMICOLON);
        ExpressionTree step = null;
        if (!this.tokenSource.peek().isSeparator(SeparatorType.PAREN_CLOSE)) {
            step = parseExpression();
        }
        this.tokenSource.expectSeparator(SeparatorType.PAREN_CLOSE);
        StatementTree body = parseStatement();
        this.scopes.close(scope);
        this.currentScope = outer;
        ForTree forTree = new ForTree(initializer, condition, step, body, scope, forKeyword.span().merge(body.span()));
        this.index.addLoop(forTree, outer);
        return forTree;
    }

    private @Nullable StatementTree parseForInitializer(int scope) {
        Token token = this.tokenSource.peek();
        if (token.isSeparator(SeparatorType.SEMICOLON)) {
            this.tokenSource.consume();
            return null;
        }
        if (isDeclarationStart()) {
            List<StatementTree> declarations = new ArrayList<>();
            for (Tree tree : parseDeclaration(false)) {
                if (tree instanceof StatementTree statement) {
                    declarations.add(statement);
                }
            }
            if (declarations.size() == 1) {
                return declarations.get(0);
            }
            Span span = declarations.isEmpty() ? token.span()
                : declarations.get(0).span().merge(declarations.get(declarations.size() - 1).span());
            return new BlockTree(declarations, scope, span);
        }
        ExpressionTree expression = parseExpression();
        this.tokenSource.expectSeparator(SeparatorType.SEMICOLON);
        return new ExpressionStatementTree(expression);
    }

    private StatementTree parseSwitch() {
        Keyword switchKeyword = this.tokenSource.expectKeyword(KeywordType.SWITCH);
        this.tokenSource.expectSeparator(SeparatorType.PAREN_OPEN);
        ExpressionTree selector = parseExpression();
        this.tokenSource.expectSeparator(SeparatorType.PAREN_CLOSE);
        StatementTree body = parseStatement();
        return new SwitchTree(selector, body, switchKeyword.span().merge(body.span()));
    }

    private StatementTree parseCase() {
        Keyword keyword = (Keyword) this.tokenSource.consume();
        ExpressionTree label = null;
        if (keyword.type() == KeywordType.CASE) {
            label = parseConditional();
        }
        Operator colon = this.tokenSource.expectOperator(OperatorType.TERNARY_COLON);
        return new CaseTree(label, keyword.span().merge(colon.span()));
    }

    private StatementTree parseReturn() {
        Keyword ret = this.tokenSource.expectKeyword(KeywordType.RETURN);
        ExpressionTree expression = null;
        if (!this.tokenSource.peek().isSeparator(SeparatorType.SEMICOLON)) {
            expression = parseExpression();
        }
        Separator end = this.tokenSource.expectSeparator(SeparatorType.SEMICOLON);
        return new ReturnTree(expression, ret.span().merge(end.span()));
    }

    // expressions

    private ExpressionTree parseExpression() {
        ExpressionTree lhs = parseAssignment();
        while (this.tokenSource.peek().isSeparator(SeparatorType.COMMA)) {
            this.tokenSource.consume();
            lhs = new BinaryOperationTree(lhs, parseAssignment(), OperatorType.COMMA);
        }
        return lhs;
    }

    private ExpressionTree parseAssignment() {
        ExpressionTree lhs = parseConditional();
        if (this.tokenSource.peek() instanceof Operator op && op.type().isAssignment()) {
            this.tokenSource.consume();
            ExpressionTree rhs = parseAssignment();
            AssignmentTree assignment = new AssignmentTree(lhs, op, rhs);
            this.index.addAssignment(assignment, this.currentScope);
            return assignment;
        }
        return lhs;
    }

    private ExpressionTree parseConditional() {
        ExpressionTree condition = parseLogicalOr();
        if (this.tokenSource.peek().isOperator(OperatorType.TERNARY_QUESTION)) {
            this.tokenSource.expectOperator(OperatorType.TERNARY_QUESTION);
            ExpressionTree thenExpr = parseExpression();
            this.tokenSource.expectOperator(OperatorType.TERNARY_COLON);
            ExpressionTree elseExpr = parseConditional();
            return new TernaryTree(condition, thenExpr, elseExpr, condition.span().merge(elseExpr.span()));
        }
        return condition;
    }

    private ExpressionTree parseLogicalOr() {
        ExpressionTree lhs = parseLogicalAnd();
        while (this.tokenSource.peek().isOperator(OperatorType.LOGICAL_OR)) {
            Operator op = this.tokenSource.expectOperator(OperatorType.LOGICAL_OR);
            ExpressionTree rhs = parseLogicalAnd();
            lhs = new BinaryOperationTree(lhs, rhs, op.type());
        }
        return lhs;
    }

    private ExpressionTree parseLogicalAnd() {
        ExpressionTree lhs = parseBitwiseOr();
        while (this.tokenSource.peek().isOperator(OperatorType.LOGICAL_AND)) {
            Operator op = this.tokenSource.expectOperator(OperatorType.LOGICAL_AND);
            ExpressionTree rhs = parseBitwiseOr();
            lhs = new BinaryOperationTree(lhs, rhs, op.type());
        }
        return lhs;
    }

    private ExpressionTree parseBitwiseOr() {
        return parseLeftAssociative(this::parseBitwiseXor, Set.of(OperatorType.BITWISE_OR));
    }

    private ExpressionTree parseBitwiseXor() {
        return parseLeftAssociative(this::parseBitwiseAnd, Set.of(OperatorType.BITWISE_XOR));
    }

    private ExpressionTree parseBitwiseAnd() {
        return parseLeftAssociative(this::parseEquality, Set.of(OperatorType.BITWISE_AND));
    }

    private ExpressionTree parseEquality() {
        return parseLeftAssociative(this::parseRelational, EQUALITY);
    }

    private ExpressionTree parseRelational() {
        return parseLeftAssociative(this::parseShift, RELATIONAL);
    }

    private ExpressionTree parseShift() {
        return parseLeftAssociative(this::parseAdditive, SHIFT);
    }

    private ExpressionTree parseAdditive() {
        return parseLeftAssociative(this::parseMultiplicative, ADDITIVE);
    }

    private ExpressionTree parseMultiplicative() {
        return parseLeftAssociative(this::parseUnary, MULTIPLICATIVE);
    }

    private ExpressionTree parseLeftAssociative(Supplier<ExpressionTree> operand, Set<OperatorType> operators) {
        ExpressionTree lhs = operand.get();
        while (this.tokenSource.peek() instanceof Operator op && operators.contains(op.type())) {
            this.tokenSource.consume();
            lhs = new BinaryOperationTree(lhs, operand.get(), op.type());
        }
        return lhs;
    }

    private ExpressionTree parseUnary() {
        Token token = this.tokenSource.peek();
        if (token instanceof Operator op) {
            switch (op.type()) {
                case INCREMENT, DECREMENT -> {
                    this.tokenSource.consume();
                    ExpressionTree operand = parseUnary();
                    return new UnaryOperationTree(op.type(), operand, false, op.span().merge(operand.span()));
                }
                case MINUS, PLUS, LOGICAL_NOT, BITWISE_NOT -> {
                    this.tokenSource.consume();
                    ExpressionTree operand = parseUnary();
                    return new UnaryOperationTree(op.type(), operand, false, op.span().merge(operand.span()));
                }
                case MUL -> {
                    this.tokenSource.consume();
                    ExpressionTree operand = parseUnary();
                    return new DereferenceTree(operand, op.span().merge(operand.span()));
                }
                case BITWISE_AND -> {
                    this.tokenSource.consume();
                    ExpressionTree operand = parseUnary();
                    return new AddressOfTree(operand, op.span().merge(operand.span()));
                }
                default -> {
                    return parsePostfix();
                }
            }
        }
        if (token.isKeyword(KeywordType.SIZEOF)) {
            return parseSizeof();
        }
        if (token.isSeparator(SeparatorType.PAREN_OPEN) && isTypeNameStart(1)) {
            Separator open = this.tokenSource.expectSeparator(SeparatorType.PAREN_OPEN);
            TypeTree type = parseTypeName();
            this.tokenSource.expectSeparator(SeparatorType.PAREN_CLOSE);
            if (this.tokenSource.peek().isSeparator(SeparatorType.BRACE_OPEN)) {
                // compound literal
                ExpressionTree list = parseInitializer();
                return new CastTree(type, list, open.span().merge(list.span()));
            }
            ExpressionTree operand = parseUnary();
            return new CastTree(type, operand, open.span().merge(operand.span()));
        }
        return parsePostfix();
    }

    private ExpressionTree parseSizeof() {
        Keyword sizeof = this.tokenSource.expectKeyword(KeywordType.SIZEOF);
        if (this.tokenSource.peek().isSeparator(SeparatorType.PAREN_OPEN) && isTypeNameStart(1)) {
            this.tokenSource.consume();
            TypeTree type = parseTypeName();
            Separator close = this.tokenSource.expectSeparator(SeparatorType.PAREN_CLOSE);
            return new SizeofTree(type, null, sizeof.span().merge(close.span()));
        }
        ExpressionTree operand = parseUnary();
        return new SizeofTree(null, operand, sizeof.span().merge(operand.span()));
    }

    /// Whether the token at {@code offset} starts a type name inside parentheses.
    private boolean isTypeNameStart(int offset) {
        Token token = this.tokenSource.peek(offset);
        if (token instanceof Keyword keyword) {
            return keyword.type().startsDeclaration();
        }
        if (!(token instanceof Identifier ident) || isLiveVariable(ident.value())) {
            return false;
        }
        if (isKnownTypeName(ident.value())) {
            return true;
        }
        int next = offset + 1;
        if (!isOperatorAt(next, OperatorType.MUL)) {
            return false;
        }
        while (isOperatorAt(next, OperatorType.MUL)) {
            next++;
        }
        return isSeparatorAt(next, SeparatorType.PAREN_CLOSE);
    }

    private ExpressionTree parsePostfix() {
        ExpressionTree expression = parsePrimary();
        while (this.tokenSource.hasMore()) {
            Token token = this.tokenSource.peek();
            if (token.isSeparator(SeparatorType.BRACKET_OPEN)) {
                this.tokenSource.consume();
                ExpressionTree indexExpression = parseExpression();
                Separator close = this.tokenSource.expectSeparator(SeparatorType.BRACKET_CLOSE);
                expression = new IndexTree(expression, indexExpression, expression.span().merge(close.span()));
            } else if (token.isSeparator(SeparatorType.PAREN_OPEN)) {
                expression = parseCall(expression);
            } else if (token.isOperator(OperatorType.DOT) || token.isOperator(OperatorType.ARROW)) {
                this.tokenSource.consume();
                Identifier member = this.tokenSource.expectIdentifier();
                expression = new MemberAccessTree(expression, name(member), token.isOperator(OperatorType.ARROW),
                    expression.span().merge(member.span()));
            } else if (token.isOperator(OperatorType.INCREMENT) || token.isOperator(OperatorType.DECREMENT)) {
                Operator op = (Operator) this.tokenSource.consume();
                expression = new UnaryOperationTree(op.type(), expression, true, expression.span().merge(op.span()));
            } else {
                break;
            }
        }
        return expression;
    }

    private CallTree parseCall(ExpressionTree callee) {
        this.tokenSource.expectSeparator(SeparatorType.PAREN_OPEN);
        List<ExpressionTree> arguments = new ArrayList<>();
        while (!this.tokenSource.peek().isSeparator(SeparatorType.PAREN_CLOSE)) {
            arguments.add(parseAssignment());
            if (!this.tokenSource.peek().isSeparator(SeparatorType.COMMA)) {
                break;
            }
            this.tokenSource.consume();
        }
        Separator close = this.tokenSource.expectSeparator(SeparatorType.PAREN_CLOSE);
        CallTree call = new CallTree(callee, arguments, callee.span().merge(close.span()));
        this.index.addCall(call, this.currentScope);
        return call;
    }

    private ExpressionTree parsePrimary() {
        Token token = this.tokenSource.peek();
        if (token.isSeparator(SeparatorType.PAREN_OPEN)) {
            this.tokenSource.consume();
            ExpressionTree expression = parseExpression();
            this.tokenSource.expectSeparator(SeparatorType.PAREN_CLOSE);
            return expression;
        }
        if (token instanceof Identifier ident) {
            this.tokenSource.consume();
            return identifier(ident);
        }
        if (token instanceof NumberLiteral literal) {
            this.tokenSource.consume();
            return new LiteralTree(literal.value(), literal.base(), literal.suffix(), literal.floating(), literal.span());
        }
        if (token instanceof CharLiteral literal) {
            this.tokenSource.consume();
            return new CharLiteralTree(literal.value(), literal.span());
        }
        if (token instanceof StringLiteral literal) {
            this.tokenSource.consume();
            StringBuilder value = new StringBuilder(literal.value());
            Span span = literal.span();
            while (this.tokenSource.hasMore() && this.tokenSource.peek() instanceof StringLiteral next) {
                this.tokenSource.consume();
                value.append(next.value());
                span = span.merge(next.span());
            }
            return new StringLiteralTree(value.toString(), span);
        }
        if (token.isKeyword(KeywordType.TRUE) || token.isKeyword(KeywordType.FALSE)) {
            this.tokenSource.consume();
            return new LiteralTree(token.isKeyword(KeywordType.TRUE) ? "1" : "0", 10, "", false, token.span());
        }
        throw new ParseException("expected expression but got " + token.asString() + " at " + token.span());
    }

    private IdentExpressionTree identifier(Identifier ident) {
        String name = ident.value();
        Symbol symbol = this.scopes.resolve(name, this.currentScope);
        if (symbol == null) {
            Symbol stale = this.scopes.resolveClosed(name, this.currentScope);
            if (stale != null) {
                this.staleReferences.add(new StaleReference(stale, ident.span()));
            }
        }
        return new IdentExpressionTree(name(ident), symbol);
    }

    private boolean isOperatorAt(int offset, OperatorType type) {
        Token token = this.tokenSource.peek(offset);
        return token != null && token.isOperator(type);
    }

    private boolean isSeparatorAt(int offset, SeparatorType type) {
        Token token = this.tokenSource.peek(offset);
        return token != null && token.isSeparator(type);
    }

    private static NameTree name(Identifier ident) {
        return new NameTree(Name.forIdentifier(ident), ident.span());
    }

    private record Specifiers(Type type, StorageClass storage, boolean typedef, List<Tree> definitions, Span span) {
        TypeTree typeTree() {
            return new TypeTree(type(), span());
        }
    }

    private record Declarator(@Nullable Identifier name, Type type, @Nullable List<ParameterTree> parameters,
        int parameterScope) {

        boolean isFunction() {
            return parameters() != null;
        }
    }
}

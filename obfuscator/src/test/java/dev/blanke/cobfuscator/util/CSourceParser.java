package dev.blanke.cobfuscator.util;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import org.jetbrains.annotations.Nullable;

import dev.blanke.cobfuscator.ast.ArrayType;
import dev.blanke.cobfuscator.ast.AssignmentExpression;
import dev.blanke.cobfuscator.ast.AssignmentOperator;
import dev.blanke.cobfuscator.ast.BinaryExpression;
import dev.blanke.cobfuscator.ast.BinaryOperator;
import dev.blanke.cobfuscator.ast.BlockItem;
import dev.blanke.cobfuscator.ast.BreakStatement;
import dev.blanke.cobfuscator.ast.CType;
import dev.blanke.cobfuscator.ast.CallExpression;
import dev.blanke.cobfuscator.ast.CaseStatement;
import dev.blanke.cobfuscator.ast.CastExpression;
import dev.blanke.cobfuscator.ast.CharacterConstant;
import dev.blanke.cobfuscator.ast.CommaExpression;
import dev.blanke.cobfuscator.ast.CompoundLiteral;
import dev.blanke.cobfuscator.ast.CompoundStatement;
import dev.blanke.cobfuscator.ast.ConditionalExpression;
import dev.blanke.cobfuscator.ast.ContinueStatement;
import dev.blanke.cobfuscator.ast.Declaration;
import dev.blanke.cobfuscator.ast.DefaultStatement;
import dev.blanke.cobfuscator.ast.DesignatedInitializer;
import dev.blanke.cobfuscator.ast.Designator;
import dev.blanke.cobfuscator.ast.DoWhileStatement;
import dev.blanke.cobfuscator.ast.EnumType;
import dev.blanke.cobfuscator.ast.Enumerator;
import dev.blanke.cobfuscator.ast.Expression;
import dev.blanke.cobfuscator.ast.ExpressionStatement;
import dev.blanke.cobfuscator.ast.ExternalDeclaration;
import dev.blanke.cobfuscator.ast.FloatingConstant;
import dev.blanke.cobfuscator.ast.ForStatement;
import dev.blanke.cobfuscator.ast.FunctionDefinition;
import dev.blanke.cobfuscator.ast.FunctionType;
import dev.blanke.cobfuscator.ast.GotoStatement;
import dev.blanke.cobfuscator.ast.Identifier;
import dev.blanke.cobfuscator.ast.IfStatement;
import dev.blanke.cobfuscator.ast.IndexDesignator;
import dev.blanke.cobfuscator.ast.Initializer;
import dev.blanke.cobfuscator.ast.InitializerList;
import dev.blanke.cobfuscator.ast.IntegerConstant;
import dev.blanke.cobfuscator.ast.LabeledStatement;
import dev.blanke.cobfuscator.ast.MemberDesignator;
import dev.blanke.cobfuscator.ast.MemberExpression;
import dev.blanke.cobfuscator.ast.Node;
import dev.blanke.cobfuscator.ast.Parameter;
import dev.blanke.cobfuscator.ast.PointerType;
import dev.blanke.cobfuscator.ast.Primitive;
import dev.blanke.cobfuscator.ast.PrimitiveType;
import dev.blanke.cobfuscator.ast.QualifiedType;
import dev.blanke.cobfuscator.ast.Qualifier;
import dev.blanke.cobfuscator.ast.ReturnStatement;
import dev.blanke.cobfuscator.ast.SizeofTypeExpression;
import dev.blanke.cobfuscator.ast.SourceUnit;
import dev.blanke.cobfuscator.ast.Statement;
import dev.blanke.cobfuscator.ast.StorageClass;
import dev.blanke.cobfuscator.ast.StringLiteral;
import dev.blanke.cobfuscator.ast.StructType;
import dev.blanke.cobfuscator.ast.SubscriptExpression;
import dev.blanke.cobfuscator.ast.SwitchStatement;
import dev.blanke.cobfuscator.ast.TagDeclaration;
import dev.blanke.cobfuscator.ast.TypedefDeclaration;
import dev.blanke.cobfuscator.ast.TypedefName;
import dev.blanke.cobfuscator.ast.UnaryExpression;
import dev.blanke.cobfuscator.ast.UnaryOperator;
import dev.blanke.cobfuscator.ast.WhileStatement;

/**
 * A recursive descent parser for the subset of C used by the test sources.
 * <p>
 * Preprocessor lines are skipped, and typedef names are tracked without regard to scope, so a test source must not
 * reuse a typedef name for anything else. Bit-fields, {@code _Generic} and K&amp;R style definitions are not supported.
 */
public final class CSourceParser {

    private static final Set<String> TYPE_KEYWORDS = Set.of("void", "char", "short", "int", "long", "float",
        "double", "signed", "unsigned", "_Bool", "struct", "union", "enum");

    private static final Set<String> SPECIFIER_KEYWORDS = Set.of("typedef", "static", "extern", "auto", "register",
        "const", "volatile", "restrict", "inline");

    private static final Map<String, AssignmentOperator> ASSIGNMENT_OPERATORS = Map.ofEntries(
        Map.entry("=",   AssignmentOperator.ASSIGN),
        Map.entry("*=",  AssignmentOperator.MULTIPLY_ASSIGN),
        Map.entry("/=",  AssignmentOperator.DIVIDE_ASSIGN),
        Map.entry("%=",  AssignmentOperator.MODULO_ASSIGN),
        Map.entry("+=",  AssignmentOperator.ADD_ASSIGN),
        Map.entry("-=",  AssignmentOperator.SUBTRACT_ASSIGN),
        Map.entry("<<=", AssignmentOperator.SHIFT_LEFT_ASSIGN),
        Map.entry(">>=", AssignmentOperator.SHIFT_RIGHT_ASSIGN),
        Map.entry("&=",  AssignmentOperator.AND_ASSIGN),
        Map.entry("^=",  AssignmentOperator.XOR_ASSIGN),
        Map.entry("|=",  AssignmentOperator.OR_ASSIGN));

    private final List<Token> tokens;

    private final Set<String> typedefNames = new HashSet<>();

    private int position;

    private CSourceParser(final String source) {
        this.tokens = new Lexer(source).tokenize();
    }

    /**
     * @throws IllegalArgumentException If the source cannot be parsed.
     */
    public static SourceUnit parse(final String source) {
        return new CSourceParser(source).sourceUnit();
    }

    /**
     * Parses the source and returns its first function definition.
     */
    public static FunctionDefinition parseFunction(final String source) {
        for (final var declaration : parse(source).declarations())
            if (declaration instanceof FunctionDefinition function)
                return function;
        throw new IllegalArgumentException("No function definition in source");
    }

    public static Expression parseExpression(final String source) {
        final var parser = new CSourceParser(source);
        final var expression = parser.expression();
        parser.expectEnd();
        return expression;
    }

    //region Tokens
    private enum TokenKind {
        IDENTIFIER, NUMBER, CHARACTER, STRING, PUNCTUATOR, END
    }

    private record Token(TokenKind kind, String text, int line) {
    }

    private static final class Lexer {

        private static final List<String> PUNCTUATORS = List.of("<<=", ">>=", "...", "->", "++", "--", "<<", ">>",
            "<=", ">=", "==", "!=", "&&", "||", "+=", "-=", "*=", "/=", "%=", "&=", "^=", "|=");

        private final String source;

        private final List<Token> tokens = new ArrayList<>();

        private int index;

        private int line = 1;

        Lexer(final String source) {
            this.source = source;
        }

        List<Token> tokenize() {
            while (true) {
                skipWhitespaceAndComments();
                if (index >= source.length())
                    break;
                tokens.add(next());
            }
            tokens.add(new Token(TokenKind.END, "<end>", line));
            return tokens;
        }

        private void skipWhitespaceAndComments() {
            boolean lineStart = index == 0 || source.charAt(index - 1) == '\n';
            while (index < source.length()) {
                final char c = source.charAt(index);
                if (c == '\n') {
                    ++line;
                    ++index;
                    lineStart = true;
                } else if (Character.isWhitespace(c))
                    ++index;
                else if (c == '#' && lineStart) {
                    while (index < source.length() && source.charAt(index) != '\n')
                        ++index;
                } else if (source.startsWith("//", index)) {
                    while (index < source.length() && source.charAt(index) != '\n')
                        ++index;
                } else if (source.startsWith("/*", index)) {
                    final int end = source.indexOf("*/", index + 2);
                    if (end < 0)
                        throw new IllegalArgumentException("Unterminated comment in line " + line);
                    for (int i = index; i < end; ++i)
                        if (source.charAt(i) == '\n')
                            ++line;
                    index = end + 2;
                } else
                    return;
            }
        }

        private Token next() {
            final char c = source.charAt(index);
            final int start = index;
            if (Character.isLetter(c) || c == '_') {
                while (index < source.length()
                        && (Character.isLetterOrDigit(source.charAt(index)) || source.charAt(index) == '_'))
                    ++index;
                return new Token(TokenKind.IDENTIFIER, source.substring(start, index), line);
            }
            if (Character.isDigit(c) || (c == '.' && index + 1 < source.length()
                    && Character.isDigit(source.charAt(index + 1)))) {
                while (index < source.length()) {
                    final char d = source.charAt(index);
                    if (Character.isLetterOrDigit(d) || d == '.')
                        ++index;
                    else if ((d == '+' || d == '-') && "eEpP".indexOf(source.charAt(index - 1)) >= 0
                            && !source.substring(start, index).startsWith("0x"))
                        ++index;
                    else
                        break;
                }
                return new Token(TokenKind.NUMBER, source.substring(start, index), line);
            }
            if (c == '\'' || c == '"') {
                ++index;
                while (source.charAt(index) != c) {
                    if (source.charAt(index) == '\\')
                        ++index;
                    ++index;
                }
                ++index;
                return new Token((c == '"') ? TokenKind.STRING : TokenKind.CHARACTER,
                    source.substring(start, index), line);
            }
            for (final var punctuator : PUNCTUATORS) {
                if (source.startsWith(punctuator, index)) {
                    index += punctuator.length();
                    return new Token(TokenKind.PUNCTUATOR, punctuator, line);
                }
            }
            ++index;
            return new Token(TokenKind.PUNCTUATOR, String.valueOf(c), line);
        }
    }

    private Token peek() {
        return tokens.get(position);
    }

    private Token peek(final int offset) {
        return tokens.get(Math.min(position + offset, tokens.size() - 1));
    }

    private boolean at(final String text) {
        final var token = peek();
        return token.kind() != TokenKind.STRING && token.kind() != TokenKind.CHARACTER && token.text().equals(text);
    }

    private boolean accept(final String text) {
        if (!at(text))
            return false;
        ++position;
        return true;
    }

    private Token expect(final String text) {
        if (!at(text))
            throw error("Expected '" + text + "'");
        return tokens.get(position++);
    }

    private String identifier() {
        final var token = peek();
        if (token.kind() != TokenKind.IDENTIFIER)
            throw error("Expected identifier");
        ++position;
        return token.text();
    }

    private void expectEnd() {
        if (peek().kind() != TokenKind.END)
            throw error("Expected end of input");
    }

    private IllegalArgumentException error(final String message) {
        final var token = peek();
        return new IllegalArgumentException(message + " but found '" + token.text() + "' in line " + token.line());
    }
    //endregion

    //region Declarations
    private SourceUnit sourceUnit() {
        final var declarations = new ArrayList<ExternalDeclaration>();
        while (peek().kind() != TokenKind.END) {
            for (final var item : declaration(true))
                declarations.add((ExternalDeclaration) item);
        }
        return new SourceUnit(declarations);
    }

    private boolean startsDeclaration() {
        final var token = peek();
        if (token.kind() != TokenKind.IDENTIFIER)
            return false;
        if (TYPE_KEYWORDS.contains(token.text()) || SPECIFIER_KEYWORDS.contains(token.text()))
            return true;
        return typedefNames.contains(token.text()) && !peek(1).text().equals(":");
    }

    private record Specifiers(CType type, StorageClass storage, boolean typedef, @Nullable BlockItem definition) {
    }

    /**
     * Parses declaration specifiers. A struct, union or enum definition with a tag is split off into
     * {@link Specifiers#definition()}, and the returned type refers to it by its tag.
     */
    private Specifiers specifiers() {
        var storage = StorageClass.NONE;
        var typedef = false;
        final var qualifiers = EnumSet.noneOf(Qualifier.class);
        final var keywords = new ArrayList<String>();
        CType specified = null;
        BlockItem definition = null;

        while (peek().kind() == TokenKind.IDENTIFIER) {
            final var text = peek().text();
            switch (text) {
                case "typedef" -> typedef = true;
                case "static" -> storage = StorageClass.STATIC;
                case "extern" -> storage = StorageClass.EXTERN;
                case "auto" -> storage = StorageClass.AUTO;
                case "register" -> storage = StorageClass.REGISTER;
                case "const" -> qualifiers.add(Qualifier.CONST);
                case "volatile" -> qualifiers.add(Qualifier.VOLATILE);
                case "restrict" -> qualifiers.add(Qualifier.RESTRICT);
                case "inline" -> { }
                case "void", "char", "short", "int", "long", "float", "double", "signed", "unsigned", "_Bool" ->
                    keywords.add(text);
                case "struct", "union", "enum" -> {
                    ++position;
                    final var aggregate = text.equals("enum") ? enumSpecifier() : structSpecifier(text.equals("union"));
                    specified = aggregate;
                    if (aggregate instanceof StructType struct && struct.tag() != null && struct.isDefinition()) {
                        definition = new TagDeclaration(struct);
                        specified  = new StructType(struct.union(), struct.tag(), null);
                    } else if (aggregate instanceof EnumType enumType && enumType.tag() != null
                            && enumType.isDefinition()) {
                        definition = new TagDeclaration(enumType);
                        specified  = new EnumType(enumType.tag(), null);
                    }
                    continue;
                }
                default -> {
                    if (specified == null && keywords.isEmpty() && typedefNames.contains(text)) {
                        specified = new TypedefName(text);
                        break;
                    }
                    return finish(specified, keywords, qualifiers, storage, typedef, definition);
                }
            }
            ++position;
        }
        return finish(specified, keywords, qualifiers, storage, typedef, definition);
    }

    private Specifiers finish(final @Nullable CType           specified,
                              final List<String>              keywords,
                              final Set<Qualifier>            qualifiers,
                              final StorageClass              storage,
                              final boolean                   typedef,
                              final @Nullable BlockItem       definition) {
        CType type = (specified != null) ? specified : PrimitiveType.of(primitive(keywords));
        if (!qualifiers.isEmpty())
            type = new QualifiedType(qualifiers, type);
        return new Specifiers(type, storage, typedef, definition);
    }

    private Primitive primitive(final List<String> keywords) {
        final boolean unsigned = keywords.contains("unsigned");
        final long longs = keywords.stream().filter("long"::equals).count();
        if (keywords.contains("void"))
            return Primitive.VOID;
        if (keywords.contains("_Bool"))
            return Primitive.BOOL;
        if (keywords.contains("char"))
            return unsigned ? Primitive.UNSIGNED_CHAR
                : keywords.contains("signed") ? Primitive.SIGNED_CHAR : Primitive.CHAR;
        if (keywords.contains("short"))
            return unsigned ? Primitive.UNSIGNED_SHORT : Primitive.SHORT;
        if (keywords.contains("float"))
            return Primitive.FLOAT;
        if (keywords.contains("double"))
            return (longs > 0) ? Primitive.LONG_DOUBLE : Primitive.DOUBLE;
        if (longs >= 2)
            return unsigned ? Primitive.UNSIGNED_LONG_LONG : Primitive.LONG_LONG;
        if (longs == 1)
            return unsigned ? Primitive.UNSIGNED_LONG : Primitive.LONG;
        if (keywords.isEmpty())
            throw error("Expected type specifier");
        return unsigned ? Primitive.UNSIGNED_INT : Primitive.INT;
    }

    private StructType structSpecifier(final boolean union) {
        String tag = null;
        if (peek().kind() == TokenKind.IDENTIFIER)
            tag = identifier();
        if (!accept("{"))
            return new StructType(union, tag, null);

        final var members = new ArrayList<Declaration>();
        while (!accept("}")) {
            final var specifiers = specifiers();
            do {
                final var declarator = declarator();
                members.add(new Declaration(declarator.name(), declarator.apply(specifiers.type())));
            } while (accept(","));
            expect(";");
        }
        return new StructType(union, tag, members);
    }

    private EnumType enumSpecifier() {
        String tag = null;
        if (peek().kind() == TokenKind.IDENTIFIER)
            tag = identifier();
        if (!accept("{"))
            return new EnumType(tag, null);

        final var enumerators = new ArrayList<Enumerator>();
        while (!accept("}")) {
            final var name = identifier();
            enumerators.add(new Enumerator(name, accept("=") ? conditional() : null));
            if (!at("}"))
                expect(",");
        }
        return new EnumType(tag, enumerators);
    }

    private record Declarator(@Nullable String name, Function<CType, CType> derivation) {

        CType apply(final CType base) {
            return derivation.apply(base);
        }
    }

    private Declarator declarator() {
        final var pointers = new ArrayList<Set<Qualifier>>();
        while (accept("*")) {
            final var qualifiers = EnumSet.noneOf(Qualifier.class);
            while (true) {
                if (accept("const"))
                    qualifiers.add(Qualifier.CONST);
                else if (accept("volatile"))
                    qualifiers.add(Qualifier.VOLATILE);
                else if (accept("restrict"))
                    qualifiers.add(Qualifier.RESTRICT);
                else
                    break;
            }
            pointers.add(qualifiers);
        }

        String name = null;
        Declarator nested = null;
        if (at("(") && (peek(1).text().equals("*") || peek(1).text().equals("("))) {
            ++position;
            nested = declarator();
            expect(")");
        } else if (peek().kind() == TokenKind.IDENTIFIER && !typedefNames.contains(peek().text())
                && !TYPE_KEYWORDS.contains(peek().text()) && !SPECIFIER_KEYWORDS.contains(peek().text()))
            name = identifier();

        final var suffixes = new ArrayList<Function<CType, CType>>();
        while (true) {
            if (accept("[")) {
                final Expression size = at("]") ? null : assignment();
                expect("]");
                suffixes.add(element -> new ArrayType(element, size));
            } else if (accept("(")) {
                final var parameters = parameters();
                suffixes.add(returnType -> new FunctionType(returnType, parameters.parameters(),
                    parameters.variadic(), parameters.prototype()));
            } else
                break;
        }

        final var inner = nested;
        return new Declarator((nested != null) ? nested.name() : name, base -> {
            var type = base;
            for (final var qualifiers : pointers) {
                type = new PointerType(type);
                if (!qualifiers.isEmpty())
                    type = new QualifiedType(qualifiers, type);
            }
            for (int i = suffixes.size() - 1; i >= 0; --i)
                type = suffixes.get(i).apply(type);
            return (inner != null) ? inner.apply(type) : type;
        });
    }

    private record ParameterList(List<Parameter> parameters, boolean variadic, boolean prototype) {
    }

    private ParameterList parameters() {
        if (accept(")"))
            return new ParameterList(List.of(), false, false);
        if (at("void") && peek(1).text().equals(")")) {
            position += 2;
            return new ParameterList(List.of(), false, true);
        }
        final var parameters = new ArrayList<Parameter>();
        var variadic = false;
        do {
            if (accept("...")) {
                variadic = true;
                break;
            }
            final var specifiers = specifiers();
            final var declarator = declarator();
            parameters.add(new Parameter(declarator.name(), declarator.apply(specifiers.type())));
        } while (accept(","));
        expect(")");
        return new ParameterList(parameters, variadic, true);
    }

    private CType typeName() {
        final var specifiers = specifiers();
        return declarator().apply(specifiers.type());
    }

    /**
     * Parses a declaration, or at file scope also a function definition, into one item per declarator.
     */
    private List<Node> declaration(final boolean fileScope) {
        final var specifiers = specifiers();
        final var items = new ArrayList<Node>();
        if (specifiers.definition() != null)
            items.add(specifiers.definition());

        if (accept(";")) {
            if (specifiers.definition() == null)
                items.add(new TagDeclaration(specifiers.type()));
            return items;
        }
        do {
            final var declarator = declarator();
            final var type = declarator.apply(specifiers.type());
            if (declarator.name() == null)
                throw error("Expected declarator name");

            if (fileScope && type instanceof FunctionType function && at("{")) {
                items.add(new FunctionDefinition(declarator.name(), function, specifiers.storage(),
                    compoundStatement()));
                return items;
            }
            if (specifiers.typedef()) {
                typedefNames.add(declarator.name());
                items.add(new TypedefDeclaration(declarator.name(), type));
            } else {
                final Initializer initializer = accept("=") ? initializer() : null;
                items.add(new Declaration(declarator.name(), type, specifiers.storage(), initializer));
            }
        } while (accept(","));
        expect(";");
        return items;
    }

    private Initializer initializer() {
        if (!accept("{"))
            return assignment();

        final var items = new ArrayList<Initializer>();
        while (!accept("}")) {
            final var designators = new ArrayList<Designator>();
            while (true) {
                if (accept(".")) {
                    designators.add(new MemberDesignator(identifier()));
                } else if (accept("[")) {
                    designators.add(new IndexDesignator(conditional()));
                    expect("]");
                } else
                    break;
            }
            if (!designators.isEmpty()) {
                expect("=");
                items.add(new DesignatedInitializer(designators, initializer()));
            } else
                items.add(initializer());
            if (!at("}"))
                expect(",");
        }
        return new InitializerList(items);
    }
    //endregion

    //region Statements
    private CompoundStatement compoundStatement() {
        expect("{");
        final var items = new ArrayList<BlockItem>();
        while (!accept("}")) {
            if (startsDeclaration()) {
                for (final var item : declaration(false))
                    items.add((BlockItem) item);
            } else
                items.add(statement());
        }
        return new CompoundStatement(items);
    }

    private Statement statement() {
        if (at("{"))
            return compoundStatement();
        if (peek().kind() == TokenKind.IDENTIFIER && peek(1).text().equals(":") && !at("default")) {
            final var label = identifier();
            expect(":");
            return new LabeledStatement(label, statement());
        }
        if (accept(";"))
            return ExpressionStatement.empty();
        if (accept("if")) {
            expect("(");
            final var condition = expression();
            expect(")");
            final var thenStatement = statement();
            return new IfStatement(condition, thenStatement, accept("else") ? statement() : null);
        }
        if (accept("while")) {
            expect("(");
            final var condition = expression();
            expect(")");
            return new WhileStatement(condition, statement());
        }
        if (accept("do")) {
            final var body = statement();
            expect("while");
            expect("(");
            final var condition = expression();
            expect(")");
            expect(";");
            return new DoWhileStatement(body, condition);
        }
        if (accept("for"))
            return forStatement();
        if (accept("switch")) {
            expect("(");
            final var selector = expression();
            expect(")");
            return new SwitchStatement(selector, statement());
        }
        if (accept("case")) {
            final var value = conditional();
            expect(":");
            return new CaseStatement(value, statement());
        }
        if (accept("default")) {
            expect(":");
            return new DefaultStatement(statement());
        }
        if (accept("goto")) {
            final var label = identifier();
            expect(";");
            return new GotoStatement(label);
        }
        if (accept("return")) {
            final Expression value = at(";") ? null : expression();
            expect(";");
            return new ReturnStatement(value);
        }
        if (accept("break")) {
            expect(";");
            return new BreakStatement();
        }
        if (accept("continue")) {
            expect(";");
            return new ContinueStatement();
        }
        final var expression = expression();
        expect(";");
        return new ExpressionStatement(expression);
    }

    private ForStatement forStatement() {
        expect("(");
        final var declarations = new ArrayList<Declaration>();
        Expression initializer = null;
        if (startsDeclaration()) {
            for (final var item : declaration(false))
                declarations.add((Declaration) item);
        } else {
            if (!at(";"))
                initializer = expression();
            expect(";");
        }
        final Expression condition = at(";") ? null : expression();
        expect(";");
        final Expression step = at(")") ? null : expression();
        expect(")");
        return new ForStatement(declarations, initializer, condition, step, statement());
    }
    //endregion

    //region Expressions
    private Expression expression() {
        final var first = assignment();
        if (!at(","))
            return first;
        final var expressions = new ArrayList<Expression>();
        expressions.add(first);
        while (accept(","))
            expressions.add(assignment());
        return new CommaExpression(expressions);
    }

    private Expression assignment() {
        final var target = conditional();
        final var operator = ASSIGNMENT_OPERATORS.get(peek().text());
        if (operator == null || peek().kind() != TokenKind.PUNCTUATOR)
            return target;
        ++position;
        return new AssignmentExpression(operator, target, assignment());
    }

    private Expression conditional() {
        final var condition = binary(BinaryOperator.LOGICAL_OR.getPrecedence());
        if (!accept("?"))
            return condition;
        final var whenTrue = expression();
        expect(":");
        return new ConditionalExpression(condition, whenTrue, conditional());
    }

    private @Nullable BinaryOperator binaryOperator() {
        if (peek().kind() != TokenKind.PUNCTUATOR)
            return null;
        for (final var operator : BinaryOperator.values())
            if (operator.getToken().equals(peek().text()))
                return operator;
        return null;
    }

    private Expression binary(final int minimumPrecedence) {
        var left = cast();
        while (true) {
            final var operator = binaryOperator();
            if (operator == null || operator.getPrecedence() < minimumPrecedence)
                return left;
            ++position;
            left = new BinaryExpression(operator, left, binary(operator.getPrecedence() + 1));
        }
    }

    private boolean atParenthesizedTypeName() {
        if (!at("("))
            return false;
        final var next = peek(1);
        return next.kind() == TokenKind.IDENTIFIER
            && (TYPE_KEYWORDS.contains(next.text()) || typedefNames.contains(next.text())
                || next.text().equals("const") || next.text().equals("volatile"));
    }

    private Expression cast() {
        if (atParenthesizedTypeName()) {
            ++position;
            final var type = typeName();
            expect(")");
            if (at("{"))
                return postfix(new CompoundLiteral(type, (InitializerList) initializer()));
            return new CastExpression(type, cast());
        }
        return unary();
    }

    private Expression unary() {
        if (accept("++"))
            return new UnaryExpression(UnaryOperator.PRE_INCREMENT, unary());
        if (accept("--"))
            return new UnaryExpression(UnaryOperator.PRE_DECREMENT, unary());
        if (accept("sizeof")) {
            if (atParenthesizedTypeName()) {
                ++position;
                final var type = typeName();
                expect(")");
                return new SizeofTypeExpression(type);
            }
            return new UnaryExpression(UnaryOperator.SIZEOF, unary());
        }
        final UnaryOperator operator = switch (peek().text()) {
            case "&" -> UnaryOperator.ADDRESS_OF;
            case "*" -> UnaryOperator.DEREFERENCE;
            case "+" -> UnaryOperator.PLUS;
            case "-" -> UnaryOperator.NEGATE;
            case "~" -> UnaryOperator.BITWISE_NOT;
            case "!" -> UnaryOperator.LOGICAL_NOT;
            default -> null;
        };
        if (operator != null && peek().kind() == TokenKind.PUNCTUATOR) {
            ++position;
            return new UnaryExpression(operator, cast());
        }
        return postfix(primary());
    }

    private Expression postfix(final Expression primary) {
        var expression = primary;
        while (true) {
            if (accept("[")) {
                final var index = expression();
                expect("]");
                expression = new SubscriptExpression(expression, index);
            } else if (accept("(")) {
                final var arguments = new ArrayList<Expression>();
                if (!at(")")) {
                    do {
                        arguments.add(assignment());
                    } while (accept(","));
                }
                expect(")");
                expression = new CallExpression(expression, arguments);
            } else if (accept("."))
                expression = new MemberExpression(expression, identifier(), false);
            else if (accept("->"))
                expression = new MemberExpression(expression, identifier(), true);
            else if (accept("++"))
                expression = new UnaryExpression(UnaryOperator.POST_INCREMENT, expression);
            else if (accept("--"))
                expression = new UnaryExpression(UnaryOperator.POST_DECREMENT, expression);
            else
                return expression;
        }
    }

    private Expression primary() {
        final var token = peek();
        switch (token.kind()) {
            case IDENTIFIER -> {
                ++position;
                return new Identifier(token.text());
            }
            case NUMBER -> {
                ++position;
                final var text = token.text();
                final boolean hexadecimal = text.startsWith("0x") || text.startsWith("0X");
                if (text.contains(".") || (!hexadecimal && (text.contains("e") || text.contains("E")))
                        || (hexadecimal && (text.contains("p") || text.contains("P"))))
                    return new FloatingConstant(text);
                return new IntegerConstant(text);
            }
            case CHARACTER -> {
                ++position;
                return new CharacterConstant(token.text());
            }
            case STRING -> {
                ++position;
                return new StringLiteral(token.text());
            }
            default -> {
                if (accept("(")) {
                    final var expression = expression();
                    expect(")");
                    return expression;
                }
                throw error("Expected expression");
            }
        }
    }
    //endregion
}

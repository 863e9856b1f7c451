package com.jsunparser.testing;

import com.jsunparser.ast.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Small parser for the ES3 subset the node model covers, used by tests to read
 * rendered text back into trees.
 *
 * <p>No automatic semicolon insertion, no getters/setters. Parentheses become
 * {@link Paren} nodes so grouping survives a round trip.</p>
 */
public final class ScriptParser {
    // Binding powers, higher binds tighter
    private static final int BP_NONE = 0;
    private static final int BP_OR = 5;             // ||
    private static final int BP_AND = 6;            // &&
    private static final int BP_BIT_OR = 7;         // |
    private static final int BP_BIT_XOR = 8;        // ^
    private static final int BP_BIT_AND = 9;        // &
    private static final int BP_EQUALITY = 10;      // == != === !==
    private static final int BP_RELATIONAL = 11;    // < > <= >= instanceof in
    private static final int BP_SHIFT = 12;         // << >> >>>
    private static final int BP_ADDITIVE = 13;      // + -
    private static final int BP_MULTIPLICATIVE = 14;// * / %

    private static final Map<String, Integer> BINARY = Map.ofEntries(
        Map.entry("||", BP_OR),
        Map.entry("&&", BP_AND),
        Map.entry("|", BP_BIT_OR),
        Map.entry("^", BP_BIT_XOR),
        Map.entry("&", BP_BIT_AND),
        Map.entry("==", BP_EQUALITY),
        Map.entry("!=", BP_EQUALITY),
        Map.entry("===", BP_EQUALITY),
        Map.entry("!==", BP_EQUALITY),
        Map.entry("<", BP_RELATIONAL),
        Map.entry(">", BP_RELATIONAL),
        Map.entry("<=", BP_RELATIONAL),
        Map.entry(">=", BP_RELATIONAL),
        Map.entry("instanceof", BP_RELATIONAL),
        Map.entry("in", BP_RELATIONAL),
        Map.entry("<<", BP_SHIFT),
        Map.entry(">>", BP_SHIFT),
        Map.entry(">>>", BP_SHIFT),
        Map.entry("+", BP_ADDITIVE),
        Map.entry("-", BP_ADDITIVE),
        Map.entry("*", BP_MULTIPLICATIVE),
        Map.entry("/", BP_MULTIPLICATIVE),
        Map.entry("%", BP_MULTIPLICATIVE)
    );

    private static final Set<String> ASSIGNMENT_OPERATORS = Set.of(
        "=", "+=", "-=", "*=", "/=", "%=", "<<=", ">>=", ">>>=", "&=", "|=", "^=");

    private static final Set<String> PREFIX_OPERATORS = Set.of(
        "!", "~", "+", "-", "++", "--", "typeof", "void", "delete");

    private static final Set<String> RESERVED = Set.of(
        "break", "case", "catch", "continue", "debugger", "default", "delete", "do", "else",
        "finally", "for", "function", "if", "in", "instanceof", "new", "return", "switch",
        "this", "throw", "try", "typeof", "var", "void", "while", "with", "null", "true", "false");

    // Longest first
    private static final String[] PUNCTUATORS = {
        ">>>=", "===", "!==", ">>>", "<<=", ">>=",
        "==", "!=", "<=", ">=", "&&", "||", "++", "--", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=",
        "<<", ">>",
        "{", "}", "(", ")", "[", "]", ";", ",", "<", ">", "+", "-", "*", "/", "%", "&", "|", "^",
        "!", "~", "?", ":", "=", "."
    };

    private enum Kind { NAME, NUMBER, STRING, REGEX, PUNCT, EOF }

    private record Token(Kind kind, String text, int offset) {}

    private final List<Token> tokens;
    private int current = 0;
    private boolean allowIn = true;

    private ScriptParser(String source) {
        this.tokens = tokenize(source);
    }

    public static Program parse(String source) {
        ScriptParser parser = new ScriptParser(source);
        List<Statement> body = new ArrayList<>();
        while (parser.peek().kind() != Kind.EOF) {
            body.add(parser.statement());
        }
        return new Program(body);
    }

    public static Expression parseExpression(String source) {
        ScriptParser parser = new ScriptParser(source);
        Expression expr = parser.expression();
        if (parser.peek().kind() != Kind.EOF) {
            throw parser.error("end of input");
        }
        return expr;
    }

    // ========================================================================
    // Statements
    // ========================================================================

    private Statement statement() {
        Token t = peek();
        if (t.kind() == Kind.PUNCT) {
            if (t.text().equals("{")) {
                return block();
            }
            if (t.text().equals(";")) {
                advance();
                return new EmptyStatement(";");
            }
        }
        if (t.kind() == Kind.NAME) {
            switch (t.text()) {
                case "var": {
                    advance();
                    VarStatement statement = new VarStatement(declarations());
                    expect(";");
                    return statement;
                }
                case "if":
                    return ifStatement();
                case "for":
                    return forStatement();
                case "do": {
                    advance();
                    Statement body = statement();
                    expectName("while");
                    Expression predicate = parenthesized();
                    expect(";");
                    return new DoWhile(body, predicate);
                }
                case "while": {
                    advance();
                    Expression predicate = parenthesized();
                    return new While(predicate, statement());
                }
                case "continue": {
                    advance();
                    Identifier label = optionalLabel();
                    expect(";");
                    return new Continue(label);
                }
                case "break": {
                    advance();
                    Identifier label = optionalLabel();
                    expect(";");
                    return new Break(label);
                }
                case "return": {
                    advance();
                    Expression value = check(";") ? null : expression();
                    expect(";");
                    return new Return(value);
                }
                case "with": {
                    advance();
                    Expression object = parenthesized();
                    return new With(object, statement());
                }
                case "switch":
                    return switchStatement();
                case "throw": {
                    advance();
                    Expression value = expression();
                    expect(";");
                    return new Throw(value);
                }
                case "try":
                    return tryStatement();
                case "debugger":
                    advance();
                    expect(";");
                    return new Debugger();
                case "function": {
                    advance();
                    Identifier name = identifier();
                    return new FuncDecl(name, parameters(), functionBody());
                }
                default:
                    if (!RESERVED.contains(t.text()) && peekAt(1).kind() == Kind.PUNCT
                            && peekAt(1).text().equals(":")) {
                        Identifier name = identifier();
                        expect(":");
                        return new Label(name, statement());
                    }
            }
        }
        Expression expr = expression();
        expect(";");
        return new ExprStatement(expr);
    }

    private Block block() {
        expect("{");
        List<Statement> children = new ArrayList<>();
        while (!check("}")) {
            children.add(statement());
        }
        expect("}");
        return new Block(children);
    }

    private List<VarDecl> declarations() {
        List<VarDecl> declarations = new ArrayList<>();
        do {
            Identifier name = identifier();
            Expression init = null;
            if (check("=")) {
                advance();
                init = assignment();
            }
            declarations.add(new VarDecl(name, init));
        } while (match(","));
        return declarations;
    }

    private Statement ifStatement() {
        expectName("if");
        Expression predicate = parenthesized();
        Statement consequent = statement();
        Statement alternative = null;
        if (checkName("else")) {
            advance();
            alternative = statement();
        }
        return new If(predicate, consequent, alternative);
    }

    private Statement forStatement() {
        expectName("for");
        expect("(");
        Node init = null;
        boolean savedAllowIn = allowIn;
        if (checkName("var")) {
            advance();
            allowIn = false;
            List<VarDecl> declarations = declarations();
            allowIn = savedAllowIn;
            if (declarations.size() == 1 && checkName("in")) {
                advance();
                Expression iterable = expression();
                expect(")");
                return new ForIn(declarations.get(0), iterable, statement());
            }
            init = new VarStatement(declarations);
        } else if (!check(";")) {
            allowIn = false;
            Expression expr = expression();
            allowIn = savedAllowIn;
            if (checkName("in")) {
                advance();
                Expression iterable = expression();
                expect(")");
                return new ForIn(expr, iterable, statement());
            }
            init = expr;
        }
        expect(";");
        Expression cond = check(";") ? null : expression();
        expect(";");
        Expression count = check(")") ? null : expression();
        expect(")");
        return new For(init, cond, count, statement());
    }

    private Identifier optionalLabel() {
        Token t = peek();
        if (t.kind() == Kind.NAME && !RESERVED.contains(t.text())) {
            return identifier();
        }
        return null;
    }

    private Statement switchStatement() {
        expectName("switch");
        Expression discriminant = parenthesized();
        expect("{");
        List<Case> cases = new ArrayList<>();
        Default defaultClause = null;
        while (!check("}")) {
            if (checkName("case")) {
                advance();
                Expression test = expression();
                expect(":");
                cases.add(new Case(test, clauseStatements()));
            } else if (checkName("default")) {
                advance();
                expect(":");
                defaultClause = new Default(clauseStatements());
            } else {
                throw error("case or default");
            }
        }
        expect("}");
        return new Switch(discriminant, cases, defaultClause);
    }

    private List<Statement> clauseStatements() {
        List<Statement> statements = new ArrayList<>();
        while (!check("}") && !checkName("case") && !checkName("default")) {
            statements.add(statement());
        }
        return statements;
    }

    private Statement tryStatement() {
        expectName("try");
        Block body = block();
        Catch handler = null;
        Finally finalizer = null;
        if (checkName("catch")) {
            advance();
            expect("(");
            Identifier param = identifier();
            expect(")");
            handler = new Catch(param, block());
        }
        if (checkName("finally")) {
            advance();
            finalizer = new Finally(block());
        }
        return new Try(body, handler, finalizer);
    }

    private List<Identifier> parameters() {
        expect("(");
        List<Identifier> params = new ArrayList<>();
        if (!check(")")) {
            do {
                params.add(identifier());
            } while (match(","));
        }
        expect(")");
        return params;
    }

    private List<Statement> functionBody() {
        boolean savedAllowIn = allowIn;
        allowIn = true;
        expect("{");
        List<Statement> body = new ArrayList<>();
        while (!check("}")) {
            body.add(statement());
        }
        expect("}");
        allowIn = savedAllowIn;
        return body;
    }

    // ========================================================================
    // Expressions
    // ========================================================================

    private Expression expression() {
        Expression left = assignment();
        while (match(",")) {
            left = new Comma(left, assignment());
        }
        return left;
    }

    private Expression assignment() {
        Expression left = conditional();
        Token t = peek();
        if (t.kind() == Kind.PUNCT && ASSIGNMENT_OPERATORS.contains(t.text())) {
            advance();
            return new Assign(t.text(), left, assignment());
        }
        return left;
    }

    private Expression conditional() {
        Expression predicate = binary(BP_NONE);
        if (!match("?")) {
            return predicate;
        }
        boolean savedAllowIn = allowIn;
        allowIn = true;
        Expression consequent = assignment();
        allowIn = savedAllowIn;
        expect(":");
        return new Conditional(predicate, consequent, assignment());
    }

    private Expression binary(int minBp) {
        Expression left = unary();
        while (true) {
            Token t = peek();
            int bp = binaryPower(t);
            if (bp <= minBp) {
                break;
            }
            advance();
            left = new BinOp(t.text(), left, binary(bp));
        }
        return left;
    }

    private int binaryPower(Token t) {
        if (t.kind() == Kind.PUNCT || (t.kind() == Kind.NAME && (t.text().equals("instanceof") || t.text().equals("in")))) {
            if (t.text().equals("in") && !allowIn) {
                return BP_NONE;
            }
            return BINARY.getOrDefault(t.text(), BP_NONE);
        }
        return BP_NONE;
    }

    private Expression unary() {
        Token t = peek();
        if ((t.kind() == Kind.PUNCT || t.kind() == Kind.NAME) && PREFIX_OPERATORS.contains(t.text())) {
            advance();
            return new UnaryOp(t.text(), unary(), false);
        }
        Expression expr = leftHandSide();
        if (check("++") || check("--")) {
            return new UnaryOp(advance().text(), expr, true);
        }
        return expr;
    }

    private Expression leftHandSide() {
        Expression expr = checkName("new") ? newExpression() : primary();
        return accessors(expr, true);
    }

    private Expression newExpression() {
        expectName("new");
        Expression callee = checkName("new") ? newExpression() : primary();
        callee = accessors(callee, false);
        List<Expression> args = check("(") ? arguments() : null;
        return new NewExpr(callee, args);
    }

    private Expression accessors(Expression expr, boolean allowCall) {
        while (true) {
            if (match(".")) {
                expr = new DotAccessor(expr, identifierName());
            } else if (check("[")) {
                advance();
                boolean savedAllowIn = allowIn;
                allowIn = true;
                Expression property = expression();
                allowIn = savedAllowIn;
                expect("]");
                expr = new BracketAccessor(expr, property);
            } else if (allowCall && check("(")) {
                expr = new FunctionCall(expr, arguments());
            } else {
                return expr;
            }
        }
    }

    private List<Expression> arguments() {
        expect("(");
        boolean savedAllowIn = allowIn;
        allowIn = true;
        List<Expression> args = new ArrayList<>();
        if (!check(")")) {
            do {
                args.add(assignment());
            } while (match(","));
        }
        allowIn = savedAllowIn;
        expect(")");
        return args;
    }

    private Expression primary() {
        Token t = advance();
        switch (t.kind()) {
            case NUMBER:
                return new NumberLiteral(t.text());
            case STRING:
                return new StringLiteral(t.text());
            case REGEX:
                return new RegexLiteral(t.text());
            case NAME:
                switch (t.text()) {
                    case "this":
                        return new This();
                    case "null":
                        return new NullLiteral();
                    case "true":
                    case "false":
                        return new BooleanLiteral(t.text());
                    case "function": {
                        Identifier name = checkParameterListStart() ? null : identifier();
                        return new FuncExpr(name, parameters(), functionBody());
                    }
                    default:
                        if (RESERVED.contains(t.text())) {
                            throw error(t, "expression");
                        }
                        return new Identifier(t.text());
                }
            case PUNCT:
                switch (t.text()) {
                    case "(": {
                        boolean savedAllowIn = allowIn;
                        allowIn = true;
                        Expression inner = expression();
                        allowIn = savedAllowIn;
                        expect(")");
                        return new Paren(inner);
                    }
                    case "[":
                        return arrayLiteral();
                    case "{":
                        return objectLiteral();
                    default:
                        throw error(t, "expression");
                }
            default:
                throw error(t, "expression");
        }
    }

    private boolean checkParameterListStart() {
        return check("(");
    }

    private Expression arrayLiteral() {
        boolean savedAllowIn = allowIn;
        allowIn = true;
        List<Expression> items = new ArrayList<>();
        while (!check("]")) {
            if (match(",")) {
                items.add(null);
                continue;
            }
            items.add(assignment());
            if (!check("]")) {
                expect(",");
            }
        }
        expect("]");
        allowIn = savedAllowIn;
        return new ArrayLiteral(items);
    }

    private Expression objectLiteral() {
        boolean savedAllowIn = allowIn;
        allowIn = true;
        List<PropAssign> properties = new ArrayList<>();
        while (!check("}")) {
            Token key = advance();
            Expression left;
            if (key.kind() == Kind.NAME) {
                left = new Identifier(key.text());
            } else if (key.kind() == Kind.STRING) {
                left = new StringLiteral(key.text());
            } else if (key.kind() == Kind.NUMBER) {
                left = new NumberLiteral(key.text());
            } else {
                throw error(key, "property name");
            }
            expect(":");
            properties.add(new PropAssign(left, assignment()));
            if (!check("}")) {
                expect(",");
            }
        }
        expect("}");
        allowIn = savedAllowIn;
        return new ObjectLiteral(properties);
    }

    private Expression parenthesized() {
        expect("(");
        Expression expr = expression();
        expect(")");
        return expr;
    }

    private Identifier identifier() {
        Token t = advance();
        if (t.kind() != Kind.NAME || RESERVED.contains(t.text())) {
            throw error(t, "identifier");
        }
        return new Identifier(t.text());
    }

    // After '.', reserved words are allowed as property names
    private Identifier identifierName() {
        Token t = advance();
        if (t.kind() != Kind.NAME) {
            throw error(t, "property name");
        }
        return new Identifier(t.text());
    }

    // ========================================================================
    // Token helpers
    // ========================================================================

    private Token peek() {
        return tokens.get(current);
    }

    private Token peekAt(int distance) {
        return tokens.get(Math.min(current + distance, tokens.size() - 1));
    }

    private Token advance() {
        Token t = tokens.get(current);
        if (t.kind() != Kind.EOF) {
            current++;
        }
        return t;
    }

    private boolean check(String punct) {
        Token t = peek();
        return t.kind() == Kind.PUNCT && t.text().equals(punct);
    }

    private boolean checkName(String name) {
        Token t = peek();
        return t.kind() == Kind.NAME && t.text().equals(name);
    }

    private boolean match(String punct) {
        if (check(punct)) {
            advance();
            return true;
        }
        return false;
    }

    private void expect(String punct) {
        if (!match(punct)) {
            throw error("'" + punct + "'");
        }
    }

    private void expectName(String name) {
        if (!checkName(name)) {
            throw error("'" + name + "'");
        }
        advance();
    }

    private IllegalArgumentException error(String expected) {
        return error(peek(), expected);
    }

    private IllegalArgumentException error(Token t, String expected) {
        String found = t.kind() == Kind.EOF ? "end of input" : "'" + t.text() + "'";
        return new IllegalArgumentException("Expected " + expected + " but found " + found + " at offset " + t.offset());
    }

    // ========================================================================
    // Lexer
    // ========================================================================

    private static List<Token> tokenize(String source) {
        List<Token> tokens = new ArrayList<>();
        int pos = 0;
        int length = source.length();
        while (pos < length) {
            char c = source.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
                continue;
            }
            if (source.startsWith("//", pos)) {
                while (pos < length && source.charAt(pos) != '\n') {
                    pos++;
                }
                continue;
            }
            if (source.startsWith("/*", pos)) {
                int close = source.indexOf("*/", pos + 2);
                if (close < 0) {
                    throw new IllegalArgumentException("Unterminated comment at offset " + pos);
                }
                pos = close + 2;
                continue;
            }
            int start = pos;
            if (Character.isJavaIdentifierStart(c)) {
                while (pos < length && Character.isJavaIdentifierPart(source.charAt(pos))) {
                    pos++;
                }
                tokens.add(new Token(Kind.NAME, source.substring(start, pos), start));
            } else if (Character.isDigit(c) || (c == '.' && pos + 1 < length && Character.isDigit(source.charAt(pos + 1)))) {
                pos = scanNumber(source, pos);
                tokens.add(new Token(Kind.NUMBER, source.substring(start, pos), start));
            } else if (c == '"' || c == '\'') {
                pos = scanString(source, pos);
                tokens.add(new Token(Kind.STRING, source.substring(start, pos), start));
            } else if (c == '/' && regexAllowed(tokens)) {
                pos = scanRegex(source, pos);
                tokens.add(new Token(Kind.REGEX, source.substring(start, pos), start));
            } else {
                String punct = null;
                for (String candidate : PUNCTUATORS) {
                    if (source.startsWith(candidate, pos)) {
                        punct = candidate;
                        break;
                    }
                }
                if (punct == null) {
                    throw new IllegalArgumentException("Unexpected character '" + c + "' at offset " + pos);
                }
                pos += punct.length();
                tokens.add(new Token(Kind.PUNCT, punct, start));
            }
        }
        tokens.add(new Token(Kind.EOF, "", length));
        return tokens;
    }

    private static int scanNumber(String source, int pos) {
        int length = source.length();
        if (source.startsWith("0x", pos) || source.startsWith("0X", pos)) {
            pos += 2;
            while (pos < length && Character.digit(source.charAt(pos), 16) >= 0) {
                pos++;
            }
            return pos;
        }
        while (pos < length && (Character.isDigit(source.charAt(pos)) || source.charAt(pos) == '.')) {
            pos++;
        }
        if (pos < length && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
            pos++;
            if (pos < length && (source.charAt(pos) == '+' || source.charAt(pos) == '-')) {
                pos++;
            }
            while (pos < length && Character.isDigit(source.charAt(pos))) {
                pos++;
            }
        }
        return pos;
    }

    private static int scanString(String source, int pos) {
        char quote = source.charAt(pos++);
        while (pos < source.length()) {
            char c = source.charAt(pos++);
            if (c == '\\') {
                pos++;
            } else if (c == quote) {
                return pos;
            }
        }
        throw new IllegalArgumentException("Unterminated string literal");
    }

    private static int scanRegex(String source, int pos) {
        pos++;
        boolean inClass = false;
        while (pos < source.length()) {
            char c = source.charAt(pos++);
            if (c == '\\') {
                pos++;
            } else if (c == '[') {
                inClass = true;
            } else if (c == ']') {
                inClass = false;
            } else if (c == '/' && !inClass) {
                while (pos < source.length() && Character.isJavaIdentifierPart(source.charAt(pos))) {
                    pos++;
                }
                return pos;
            }
        }
        throw new IllegalArgumentException("Unterminated regular expression literal");
    }

    private static boolean regexAllowed(List<Token> tokens) {
        if (tokens.isEmpty()) {
            return true;
        }
        Token last = tokens.get(tokens.size() - 1);
        switch (last.kind()) {
            case PUNCT:
                return !last.text().equals(")") && !last.text().equals("]") && !last.text().equals("}");
            case NAME:
                return Set.of("return", "typeof", "case", "do", "else", "in", "instanceof", "new", "delete",
                    "void", "throw").contains(last.text());
            default:
                return false;
        }
    }
}

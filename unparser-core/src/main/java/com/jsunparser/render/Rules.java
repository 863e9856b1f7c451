package com.jsunparser.render;

import com.jsunparser.ast.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The built-in formatting rules.
 *
 * <p>Statement-list contexts (program, blocks, switch clauses, function bodies,
 * object literals) own indentation: they prefix each child line with the
 * current level, so statement and expression rules never indent themselves.</p>
 */
public final class Rules {

    private static final Logger log = LoggerFactory.getLogger(Rules.class);

    // Prefix operators that are words and need a space before the operand
    private static final Set<String> WORD_OPERATORS = Set.of("typeof", "void", "delete");

    private static final RuleSet STANDARD = createStandard();
    private static final RuleSet COMPACT = createCompact();

    private Rules() {
        // Utility class
    }

    /**
     * House style: two-space indentation with one statement per line.
     */
    public static RuleSet standard() {
        return STANDARD;
    }

    /**
     * Minifying style, meant for {@link RenderOptions#compact()}. It shares every
     * rule with {@link #standard()} except the ones that put optional spaces
     * around punctuation.
     */
    public static RuleSet compact() {
        return COMPACT;
    }

    private static RuleSet createStandard() {
        return RuleSet.builder()
            .rule(Program.class, Rules::program)
            .rule(Block.class, Rules::block)
            .rule(VarStatement.class, Rules::varStatement)
            .rule(VarDecl.class, Rules::varDecl)
            .rule(Identifier.class, (node, r) -> literal(node, node.value()))
            .rule(Assign.class, Rules::assign)
            .rule(NumberLiteral.class, (node, r) -> literal(node, node.value()))
            .rule(Comma.class, Rules::comma)
            .rule(EmptyStatement.class, (node, r) -> literal(node, node.value()))
            .rule(If.class, Rules::ifStatement)
            .rule(BooleanLiteral.class, (node, r) -> literal(node, node.value()))
            .rule(For.class, Rules::forStatement)
            .rule(ForIn.class, Rules::forIn)
            .rule(BinOp.class, Rules::binOp)
            .rule(UnaryOp.class, Rules::unaryOp)
            .rule(ExprStatement.class, (node, r) -> r.render(required(node, node.expr(), "expr")) + ";")
            .rule(DoWhile.class, Rules::doWhile)
            .rule(While.class, Rules::whileStatement)
            .rule(NullLiteral.class, (node, r) -> "null")
            .rule(StringLiteral.class, (node, r) -> literal(node, node.value()))
            .rule(Continue.class, (node, r) -> jump("continue", node.identifier(), r))
            .rule(Break.class, (node, r) -> jump("break", node.identifier(), r))
            .rule(Return.class, Rules::returnStatement)
            .rule(With.class, Rules::with)
            .rule(Label.class, Rules::label)
            .rule(Switch.class, Rules::switchStatement)
            .rule(Case.class, Rules::caseClause)
            .rule(Default.class, (node, r) -> "default:" + clauseBody(node, required(node, node.elements(), "elements"), r))
            .rule(Throw.class, (node, r) -> "throw " + r.render(required(node, node.expr(), "expr")) + ";")
            .rule(Debugger.class, (node, r) -> "debugger;")
            .rule(Try.class, Rules::tryStatement)
            .rule(Catch.class, Rules::catchClause)
            .rule(Finally.class, (node, r) -> "finally " + r.render(required(node, node.elements(), "elements")))
            .rule(This.class, (node, r) -> "this")
            .rule(RegexLiteral.class, (node, r) -> literal(node, node.value()))
            .rule(Paren.class, (node, r) -> "(" + r.render(required(node, node.expr(), "expr")) + ")")
            .rule(ArrayLiteral.class, (node, r) -> array(node, ", ", r))
            .rule(ObjectLiteral.class, Rules::object)
            .rule(PropAssign.class, (node, r) -> pair(node, ": ", r))
            .rule(DotAccessor.class, Rules::dotAccessor)
            .rule(BracketAccessor.class, Rules::bracketAccessor)
            .rule(FunctionCall.class, (node, r) -> call(node, ", ", r))
            .rule(NewExpr.class, Rules::newExpr)
            .rule(Conditional.class, (node, r) -> conditional(node, " ? ", " : ", r))
            .rule(FuncDecl.class, Rules::funcDecl)
            .rule(FuncExpr.class, Rules::funcExpr)
            .rule(UnknownNode.class, Rules::fallback)
            .build();
    }

    private static RuleSet createCompact() {
        return STANDARD.toBuilder()
            .rule(VarStatement.class, (node, r) -> "var " + declarations(node, ",", r) + ";")
            .rule(VarDecl.class, (node, r) -> varDecl(node, "=", r))
            .rule(Assign.class, (node, r) -> assign(node, "", r))
            .rule(Comma.class, (node, r) -> comma(node, ",", r))
            .rule(If.class, (node, r) -> ifStatement(node, "", r))
            .rule(While.class, (node, r) -> whileStatement(node, "", r))
            .rule(ArrayLiteral.class, (node, r) -> array(node, ",", r))
            .rule(PropAssign.class, (node, r) -> pair(node, ":", r))
            .rule(FunctionCall.class, (node, r) -> call(node, ",", r))
            .rule(Conditional.class, (node, r) -> conditional(node, "?", ":", r))
            .build();
    }

    // ==================== Helpers ====================

    /**
     * Returns a field the kind cannot do without, or fails with the kind and
     * field name.
     */
    public static <T> T required(Node owner, T value, String field) {
        if (value == null) {
            throw RenderException.missing(owner, field);
        }
        return value;
    }

    private static String literal(Node node, String value) {
        return required(node, value, "value");
    }

    /**
     * Renders a statement list as a braced body: the statements one level
     * deeper, the closing brace back at the current level.
     */
    public static String body(Node owner, List<? extends Node> statements, Renderer r) {
        StringBuilder sb = new StringBuilder("{").append(r.newline());
        try (Indentation.Scope scope = r.indentation().deeper()) {
            if (!statements.isEmpty()) {
                sb.append(r.statements(owner, statements)).append(r.newline());
            }
        }
        return sb.append(r.indent()).append('}').toString();
    }

    // Case and default bodies: one line per element, one level deeper
    private static String clauseBody(Node owner, List<Statement> elements, Renderer r) {
        StringBuilder sb = new StringBuilder();
        try (Indentation.Scope scope = r.indentation().deeper()) {
            for (int i = 0; i < elements.size(); i++) {
                sb.append(r.newline()).append(r.indent()).append(r.render(Renderer.element(owner, elements, i)));
            }
        }
        return sb.toString();
    }

    private static String declarations(VarStatement node, String separator, Renderer r) {
        List<VarDecl> children = required(node, node.children(), "children");
        if (children.isEmpty()) {
            throw RenderException.malformed(node, "no declarations");
        }
        return r.join(node, children, separator);
    }

    // ==================== Statements ====================

    private static String program(Program node, Renderer r) {
        return r.statements(node, required(node, node.children(), "children"));
    }

    private static String block(Block node, Renderer r) {
        return body(node, required(node, node.children(), "children"), r);
    }

    private static String varStatement(VarStatement node, Renderer r) {
        return "var " + declarations(node, ", ", r) + ";";
    }

    private static String varDecl(VarDecl node, Renderer r) {
        return varDecl(node, " = ", r);
    }

    private static String varDecl(VarDecl node, String assign, Renderer r) {
        String s = r.render(required(node, node.identifier(), "identifier"));
        if (node.initializer() != null) {
            s += assign + r.render(node.initializer());
        }
        return s;
    }

    private static String ifStatement(If node, Renderer r) {
        return ifStatement(node, " ", r);
    }

    private static String ifStatement(If node, String space, Renderer r) {
        StringBuilder sb = new StringBuilder("if").append(space).append('(');
        if (node.predicate() != null) {
            sb.append(r.render(node.predicate()));
        }
        sb.append(')').append(space).append(r.render(required(node, node.consequent(), "consequent")));
        if (node.alternative() != null) {
            sb.append(space).append("else ").append(r.render(node.alternative()));
        }
        return sb.toString();
    }

    private static String forStatement(For node, Renderer r) {
        StringBuilder sb = new StringBuilder("for (");
        Node init = node.init();
        if (init instanceof VarStatement vars) {
            sb.append(headDeclaration(vars, r));
        } else if (init != null) {
            sb.append(r.render(init));
        }
        sb.append(';');
        if (node.cond() != null) {
            sb.append(' ').append(r.render(node.cond()));
        }
        sb.append(';');
        if (node.count() != null) {
            sb.append(' ').append(r.render(node.count()));
        }
        sb.append(") ").append(r.render(required(node, node.statement(), "statement")));
        return sb.toString();
    }

    private static String forIn(ForIn node, Renderer r) {
        Node item = required(node, node.item(), "item");
        String target;
        if (item instanceof VarDecl) {
            target = "var " + r.render(item);
        } else if (item instanceof VarStatement vars) {
            target = headDeclaration(vars, r);
        } else {
            target = r.render(item);
        }
        return "for (" + target + " in " + r.render(required(node, node.iterable(), "iterable")) + ") "
            + r.render(required(node, node.statement(), "statement"));
    }

    // The VarStatement rule in effect, without the terminator the loop head supplies
    private static String headDeclaration(VarStatement vars, Renderer r) {
        String declaration = r.render(vars);
        return declaration.endsWith(";") ? declaration.substring(0, declaration.length() - 1) : declaration;
    }

    private static String doWhile(DoWhile node, Renderer r) {
        return "do " + r.render(required(node, node.statement(), "statement"))
            + " while (" + r.render(required(node, node.predicate(), "predicate")) + ");";
    }

    private static String whileStatement(While node, Renderer r) {
        return whileStatement(node, " ", r);
    }

    private static String whileStatement(While node, String space, Renderer r) {
        return "while" + space + "(" + r.render(required(node, node.predicate(), "predicate")) + ")" + space
            + r.render(required(node, node.statement(), "statement"));
    }

    private static String jump(String keyword, Identifier label, Renderer r) {
        if (label == null) {
            return keyword + ";";
        }
        return keyword + " " + r.render(label) + ";";
    }

    private static String returnStatement(Return node, Renderer r) {
        if (node.expr() == null) {
            return "return;";
        }
        return "return " + r.render(node.expr()) + ";";
    }

    private static String with(With node, Renderer r) {
        return "with (" + r.render(required(node, node.expr(), "expr")) + ") "
            + r.render(required(node, node.statement(), "statement"));
    }

    private static String label(Label node, Renderer r) {
        return r.render(required(node, node.identifier(), "identifier")) + ": "
            + r.render(required(node, node.statement(), "statement"));
    }

    private static String switchStatement(Switch node, Renderer r) {
        List<Case> cases = required(node, node.cases(), "cases");
        List<Node> clauses = new ArrayList<>(cases.size() + 1);
        for (int i = 0; i < cases.size(); i++) {
            clauses.add(Renderer.element(node, cases, i));
        }
        if (node.defaultClause() != null) {
            clauses.add(node.defaultClause());
        }
        StringBuilder sb = new StringBuilder("switch (")
            .append(r.render(required(node, node.expr(), "expr")))
            .append(") {");
        try (Indentation.Scope scope = r.indentation().deeper()) {
            for (Node clause : clauses) {
                sb.append(r.newline()).append(r.indent()).append(r.render(clause));
            }
        }
        return sb.append(r.newline()).append(r.indent()).append('}').toString();
    }

    private static String caseClause(Case node, Renderer r) {
        return "case " + r.render(required(node, node.expr(), "expr")) + ":"
            + clauseBody(node, required(node, node.elements(), "elements"), r);
    }

    private static String tryStatement(Try node, Renderer r) {
        StringBuilder sb = new StringBuilder("try ")
            .append(r.render(required(node, node.statements(), "statements")));
        if (node.catchClause() != null) {
            sb.append(' ').append(r.render(node.catchClause()));
        }
        if (node.fin() != null) {
            sb.append(' ').append(r.render(node.fin()));
        }
        return sb.toString();
    }

    private static String catchClause(Catch node, Renderer r) {
        return "catch (" + r.render(required(node, node.identifier(), "identifier")) + ") "
            + r.render(required(node, node.elements(), "elements"));
    }

    private static String funcDecl(FuncDecl node, Renderer r) {
        return function(node, required(node, node.identifier(), "identifier"), node.parameters(), node.elements(), r);
    }

    private static String funcExpr(FuncExpr node, Renderer r) {
        return function(node, node.identifier(), node.parameters(), node.elements(), r);
    }

    private static String function(Node node, Identifier name, List<Identifier> parameters,
                                   List<Statement> elements, Renderer r) {
        StringBuilder sb = new StringBuilder("function ");
        if (name != null) {
            sb.append(r.render(name));
        }
        sb.append('(').append(r.join(node, required(node, parameters, "parameters"), ", ")).append(") ");
        return sb.append(body(node, required(node, elements, "elements"), r)).toString();
    }

    // ==================== Expressions ====================

    private static String assign(Assign node, Renderer r) {
        return assign(node, " ", r);
    }

    private static String assign(Assign node, String space, Renderer r) {
        return r.render(required(node, node.left(), "left")) + space + required(node, node.op(), "op") + space
            + r.render(required(node, node.right(), "right"));
    }

    private static String comma(Comma node, Renderer r) {
        return comma(node, ", ", r);
    }

    private static String comma(Comma node, String separator, Renderer r) {
        return r.render(required(node, node.left(), "left")) + separator
            + r.render(required(node, node.right(), "right"));
    }

    private static String binOp(BinOp node, Renderer r) {
        return r.render(required(node, node.left(), "left")) + " " + required(node, node.op(), "op") + " "
            + r.render(required(node, node.right(), "right"));
    }

    private static String unaryOp(UnaryOp node, Renderer r) {
        String op = required(node, node.op(), "op");
        String operand = r.render(required(node, node.value(), "value"));
        if (node.postfix()) {
            return operand + op;
        }
        if (WORD_OPERATORS.contains(op) || mergesWith(op, operand)) {
            return op + " " + operand;
        }
        return op + operand;
    }

    // "-" followed by "-x" would read back as a decrement
    private static boolean mergesWith(String op, String operand) {
        return (op.endsWith("+") && operand.startsWith("+"))
            || (op.endsWith("-") && operand.startsWith("-"));
    }

    private static String array(ArrayLiteral node, String separator, Renderer r) {
        List<Expression> items = required(node, node.items(), "items");
        List<String> parts = new ArrayList<>(items.size());
        for (Expression item : items) {
            parts.add(item == null ? "" : r.render(item));
        }
        String s = String.join(separator, parts);
        if (!items.isEmpty() && items.get(items.size() - 1) == null) {
            // A trailing comma alone is not a hole
            s += ",";
        }
        return "[" + s + "]";
    }

    private static String object(ObjectLiteral node, Renderer r) {
        List<PropAssign> properties = required(node, node.properties(), "properties");
        if (properties.isEmpty()) {
            return "{}";
        }
        StringBuilder sb = new StringBuilder("{");
        try (Indentation.Scope scope = r.indentation().deeper()) {
            for (int i = 0; i < properties.size(); i++) {
                sb.append(r.newline()).append(r.indent()).append(r.render(Renderer.element(node, properties, i)));
                if (i < properties.size() - 1) {
                    sb.append(',');
                }
            }
        }
        return sb.append(r.newline()).append(r.indent()).append('}').toString();
    }

    private static String pair(PropAssign node, String separator, Renderer r) {
        return r.render(required(node, node.left(), "left")) + separator
            + r.render(required(node, node.right(), "right"));
    }

    private static String dotAccessor(DotAccessor node, Renderer r) {
        return r.render(required(node, node.node(), "node")) + "."
            + r.render(required(node, node.identifier(), "identifier"));
    }

    private static String bracketAccessor(BracketAccessor node, Renderer r) {
        return r.render(required(node, node.node(), "node")) + "["
            + r.render(required(node, node.expr(), "expr")) + "]";
    }

    private static String call(FunctionCall node, String separator, Renderer r) {
        return r.render(required(node, node.identifier(), "identifier"))
            + "(" + r.join(node, required(node, node.args(), "args"), separator) + ")";
    }

    private static String newExpr(NewExpr node, Renderer r) {
        String s = "new " + r.render(required(node, node.identifier(), "identifier"));
        if (node.args() != null) {
            s += "(" + r.join(node, node.args(), ", ") + ")";
        }
        return s;
    }

    private static String conditional(Conditional node, String question, String colon, Renderer r) {
        return r.render(required(node, node.predicate(), "predicate")) + question
            + r.render(required(node, node.consequent(), "consequent")) + colon
            + r.render(required(node, node.alternative(), "alternative"));
    }

    // ==================== Fallback ====================

    private static String fallback(UnknownNode node, Renderer r) {
        log.debug("No formatting rule for node type '{}', emitting placeholder", node.type());
        return "GEN: " + node.type() + " " + node.raw();
    }
}

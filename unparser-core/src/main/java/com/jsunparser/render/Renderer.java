package com.jsunparser.render;

import com.jsunparser.ast.*;

import java.util.List;
import java.util.StringJoiner;

/**
 * Renders syntax trees to source text by dispatching every node to the rule
 * registered for its kind.
 *
 * <p>A renderer carries the indentation state of one traversal and is not
 * thread-safe. Use one instance per concurrent render; {@link Unparser}
 * creates a fresh one for every call.</p>
 */
public class Renderer implements NodeVisitor<String> {

    private final RuleSet rules;
    private final RenderOptions options;
    private final Indentation indentation;

    public Renderer(RuleSet rules, RenderOptions options) {
        if (rules == null || options == null) {
            throw new IllegalArgumentException("rules and options must not be null");
        }
        this.rules = rules;
        this.options = options;
        this.indentation = new Indentation(options.indentStep());
    }

    /**
     * Renders a node with the rule for its kind.
     *
     * @throws RenderException if the node or one of its descendants is malformed
     */
    public String render(Node node) {
        if (node == null) {
            throw new IllegalArgumentException("Cannot render a null node");
        }
        return node.accept(this);
    }

    public Indentation indentation() {
        return indentation;
    }

    public RenderOptions options() {
        return options;
    }

    public RuleSet rules() {
        return rules;
    }

    /**
     * Returns the prefix for a line at the current indentation level.
     */
    public String indent() {
        return indentation.prefix();
    }

    public String newline() {
        return options.lineSeparator();
    }

    /**
     * Renders a statement list at the current level: each statement prefixed by
     * the indentation, joined by the line separator.
     *
     * @param owner the node the list belongs to, named when an entry is null
     */
    public String statements(Node owner, List<? extends Node> nodes) {
        StringJoiner joiner = new StringJoiner(newline());
        for (int i = 0; i < nodes.size(); i++) {
            joiner.add(indent() + render(element(owner, nodes, i)));
        }
        return joiner.toString();
    }

    /**
     * Renders nodes in order, joined by a separator.
     */
    public String join(Node owner, List<? extends Node> nodes, String separator) {
        StringJoiner joiner = new StringJoiner(separator);
        for (int i = 0; i < nodes.size(); i++) {
            joiner.add(render(element(owner, nodes, i)));
        }
        return joiner.toString();
    }

    /**
     * Returns the entry at {@code index} of a child list of {@code owner}.
     *
     * @throws RenderException if the entry is null
     */
    public static Node element(Node owner, List<? extends Node> nodes, int index) {
        Node node = nodes.get(index);
        if (node == null) {
            throw RenderException.malformed(owner, "null entry at index " + index);
        }
        return node;
    }

    private <N extends Node> String apply(Class<N> kind, N node) {
        return rules.rule(kind).apply(node, this);
    }

    // ==================== Dispatch ====================

    @Override
    public String visitProgram(Program node) {
        return apply(Program.class, node);
    }

    @Override
    public String visitBlock(Block node) {
        return apply(Block.class, node);
    }

    @Override
    public String visitVarStatement(VarStatement node) {
        return apply(VarStatement.class, node);
    }

    @Override
    public String visitVarDecl(VarDecl node) {
        return apply(VarDecl.class, node);
    }

    @Override
    public String visitIdentifier(Identifier node) {
        return apply(Identifier.class, node);
    }

    @Override
    public String visitAssign(Assign node) {
        return apply(Assign.class, node);
    }

    @Override
    public String visitNumber(NumberLiteral node) {
        return apply(NumberLiteral.class, node);
    }

    @Override
    public String visitComma(Comma node) {
        return apply(Comma.class, node);
    }

    @Override
    public String visitEmptyStatement(EmptyStatement node) {
        return apply(EmptyStatement.class, node);
    }

    @Override
    public String visitIf(If node) {
        return apply(If.class, node);
    }

    @Override
    public String visitBoolean(BooleanLiteral node) {
        return apply(BooleanLiteral.class, node);
    }

    @Override
    public String visitFor(For node) {
        return apply(For.class, node);
    }

    @Override
    public String visitForIn(ForIn node) {
        return apply(ForIn.class, node);
    }

    @Override
    public String visitBinOp(BinOp node) {
        return apply(BinOp.class, node);
    }

    @Override
    public String visitUnaryOp(UnaryOp node) {
        return apply(UnaryOp.class, node);
    }

    @Override
    public String visitExprStatement(ExprStatement node) {
        return apply(ExprStatement.class, node);
    }

    @Override
    public String visitDoWhile(DoWhile node) {
        return apply(DoWhile.class, node);
    }

    @Override
    public String visitWhile(While node) {
        return apply(While.class, node);
    }

    @Override
    public String visitNull(NullLiteral node) {
        return apply(NullLiteral.class, node);
    }

    @Override
    public String visitString(StringLiteral node) {
        return apply(StringLiteral.class, node);
    }

    @Override
    public String visitContinue(Continue node) {
        return apply(Continue.class, node);
    }

    @Override
    public String visitBreak(Break node) {
        return apply(Break.class, node);
    }

    @Override
    public String visitReturn(Return node) {
        return apply(Return.class, node);
    }

    @Override
    public String visitWith(With node) {
        return apply(With.class, node);
    }

    @Override
    public String visitLabel(Label node) {
        return apply(Label.class, node);
    }

    @Override
    public String visitSwitch(Switch node) {
        return apply(Switch.class, node);
    }

    @Override
    public String visitCase(Case node) {
        return apply(Case.class, node);
    }

    @Override
    public String visitDefault(Default node) {
        return apply(Default.class, node);
    }

    @Override
    public String visitThrow(Throw node) {
        return apply(Throw.class, node);
    }

    @Override
    public String visitDebugger(Debugger node) {
        return apply(Debugger.class, node);
    }

    @Override
    public String visitTry(Try node) {
        return apply(Try.class, node);
    }

    @Override
    public String visitCatch(Catch node) {
        return apply(Catch.class, node);
    }

    @Override
    public String visitFinally(Finally node) {
        return apply(Finally.class, node);
    }

    @Override
    public String visitThis(This node) {
        return apply(This.class, node);
    }

    @Override
    public String visitRegex(RegexLiteral node) {
        return apply(RegexLiteral.class, node);
    }

    @Override
    public String visitParen(Paren node) {
        return apply(Paren.class, node);
    }

    @Override
    public String visitArray(ArrayLiteral node) {
        return apply(ArrayLiteral.class, node);
    }

    @Override
    public String visitObject(ObjectLiteral node) {
        return apply(ObjectLiteral.class, node);
    }

    @Override
    public String visitPropAssign(PropAssign node) {
        return apply(PropAssign.class, node);
    }

    @Override
    public String visitDotAccessor(DotAccessor node) {
        return apply(DotAccessor.class, node);
    }

    @Override
    public String visitBracketAccessor(BracketAccessor node) {
        return apply(BracketAccessor.class, node);
    }

    @Override
    public String visitFunctionCall(FunctionCall node) {
        return apply(FunctionCall.class, node);
    }

    @Override
    public String visitNewExpr(NewExpr node) {
        return apply(NewExpr.class, node);
    }

    @Override
    public String visitConditional(Conditional node) {
        return apply(Conditional.class, node);
    }

    @Override
    public String visitFuncDecl(FuncDecl node) {
        return apply(FuncDecl.class, node);
    }

    @Override
    public String visitFuncExpr(FuncExpr node) {
        return apply(FuncExpr.class, node);
    }

    @Override
    public String visitUnknown(UnknownNode node) {
        return apply(UnknownNode.class, node);
    }
}

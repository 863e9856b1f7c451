package com.jsunparser.ast;

/**
 * Visitor over the closed set of node kinds.
 *
 * <p>Adding a record to the {@link Node} hierarchy means adding a method here,
 * so every implementation has to decide how to handle the new kind.
 * {@link #visitUnknown(UnknownNode)} is the one arm for constructs that have no
 * kind of their own yet.</p>
 *
 * @param <R> result type
 */
public interface NodeVisitor<R> {
    R visitProgram(Program node);
    R visitBlock(Block node);
    R visitVarStatement(VarStatement node);
    R visitVarDecl(VarDecl node);
    R visitIdentifier(Identifier node);
    R visitAssign(Assign node);
    R visitNumber(NumberLiteral node);
    R visitComma(Comma node);
    R visitEmptyStatement(EmptyStatement node);
    R visitIf(If node);
    R visitBoolean(BooleanLiteral node);
    R visitFor(For node);
    R visitForIn(ForIn node);
    R visitBinOp(BinOp node);
    R visitUnaryOp(UnaryOp node);
    R visitExprStatement(ExprStatement node);
    R visitDoWhile(DoWhile node);
    R visitWhile(While node);
    R visitNull(NullLiteral node);
    R visitString(StringLiteral node);
    R visitContinue(Continue node);
    R visitBreak(Break node);
    R visitReturn(Return node);
    R visitWith(With node);
    R visitLabel(Label node);
    R visitSwitch(Switch node);
    R visitCase(Case node);
    R visitDefault(Default node);
    R visitThrow(Throw node);
    R visitDebugger(Debugger node);
    R visitTry(Try node);
    R visitCatch(Catch node);
    R visitFinally(Finally node);
    R visitThis(This node);
    R visitRegex(RegexLiteral node);
    R visitParen(Paren node);
    R visitArray(ArrayLiteral node);
    R visitObject(ObjectLiteral node);
    R visitPropAssign(PropAssign node);
    R visitDotAccessor(DotAccessor node);
    R visitBracketAccessor(BracketAccessor node);
    R visitFunctionCall(FunctionCall node);
    R visitNewExpr(NewExpr node);
    R visitConditional(Conditional node);
    R visitFuncDecl(FuncDecl node);
    R visitFuncExpr(FuncExpr node);
    R visitUnknown(UnknownNode node);
}

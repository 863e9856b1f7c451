package com.jsunparser.ast;

/**
 * Nodes that can appear in a statement list.
 */
public sealed interface Statement extends Node permits
    Block,
    VarStatement,
    EmptyStatement,
    If,
    For,
    ForIn,
    ExprStatement,
    DoWhile,
    While,
    Continue,
    Break,
    Return,
    With,
    Label,
    Switch,
    Throw,
    Debugger,
    Try,
    FuncDecl,
    UnknownNode {
}

package com.jsunparser.ast;

public sealed interface Expression extends Node permits
    Identifier,
    Assign,
    NumberLiteral,
    Comma,
    BooleanLiteral,
    BinOp,
    UnaryOp,
    NullLiteral,
    StringLiteral,
    This,
    RegexLiteral,
    Paren,
    ArrayLiteral,
    ObjectLiteral,
    DotAccessor,
    BracketAccessor,
    FunctionCall,
    NewExpr,
    Conditional,
    FuncExpr,
    UnknownNode {
}

package com.jsunparser.ast;

import java.util.Collection;
import java.util.Map;

/**
 * Registry of node kind names and the records that implement them.
 */
public final class NodeKinds {

    private static final Map<String, Class<? extends Node>> TYPES = Map.ofEntries(
        Map.entry("Program", Program.class),
        Map.entry("Block", Block.class),
        Map.entry("VarStatement", VarStatement.class),
        Map.entry("VarDecl", VarDecl.class),
        Map.entry("Identifier", Identifier.class),
        Map.entry("Assign", Assign.class),
        Map.entry("Number", NumberLiteral.class),
        Map.entry("Comma", Comma.class),
        Map.entry("EmptyStatement", EmptyStatement.class),
        Map.entry("If", If.class),
        Map.entry("Boolean", BooleanLiteral.class),
        Map.entry("For", For.class),
        Map.entry("ForIn", ForIn.class),
        Map.entry("BinOp", BinOp.class),
        Map.entry("UnaryOp", UnaryOp.class),
        Map.entry("ExprStatement", ExprStatement.class),
        Map.entry("DoWhile", DoWhile.class),
        Map.entry("While", While.class),
        Map.entry("Null", NullLiteral.class),
        Map.entry("String", StringLiteral.class),
        Map.entry("Continue", Continue.class),
        Map.entry("Break", Break.class),
        Map.entry("Return", Return.class),
        Map.entry("With", With.class),
        Map.entry("Label", Label.class),
        Map.entry("Switch", Switch.class),
        Map.entry("Case", Case.class),
        Map.entry("Default", Default.class),
        Map.entry("Throw", Throw.class),
        Map.entry("Debugger", Debugger.class),
        Map.entry("Try", Try.class),
        Map.entry("Catch", Catch.class),
        Map.entry("Finally", Finally.class),
        Map.entry("This", This.class),
        Map.entry("Regex", RegexLiteral.class),
        Map.entry("Paren", Paren.class),
        Map.entry("Array", ArrayLiteral.class),
        Map.entry("Object", ObjectLiteral.class),
        Map.entry("PropAssign", PropAssign.class),
        Map.entry("DotAccessor", DotAccessor.class),
        Map.entry("BracketAccessor", BracketAccessor.class),
        Map.entry("FunctionCall", FunctionCall.class),
        Map.entry("NewExpr", NewExpr.class),
        Map.entry("Conditional", Conditional.class),
        Map.entry("FuncDecl", FuncDecl.class),
        Map.entry("FuncExpr", FuncExpr.class)
    );

    private NodeKinds() {
        // Utility class
    }

    /**
     * Looks up the record for a kind name.
     *
     * @param type the kind name, as returned by {@link Node#type()}
     * @return the record class, or null if no kind has that name
     */
    public static Class<? extends Node> forType(String type) {
        return TYPES.get(type);
    }

    public static boolean isKnown(String type) {
        return TYPES.containsKey(type);
    }

    /**
     * Returns every named kind. {@link UnknownNode} is not included.
     */
    public static Collection<Class<? extends Node>> all() {
        return TYPES.values();
    }

    public static Map<String, Class<? extends Node>> byName() {
        return TYPES;
    }
}

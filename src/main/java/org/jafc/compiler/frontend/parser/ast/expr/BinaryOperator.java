package org.jafc.compiler.frontend.parser.ast.expr;

public enum BinaryOperator {
    MUL("*", Kind.ARITHMETIC),
    DIV("/", Kind.ARITHMETIC),
    MOD("%", Kind.INTEGER),
    ADD("+", Kind.ARITHMETIC),
    SUB("-", Kind.ARITHMETIC),
    LSHIFT("<<", Kind.INTEGER),
    RSHIFT(">>", Kind.INTEGER),
    LT("<", Kind.COMPARISON),
    GT(">", Kind.COMPARISON),
    LTE("<=", Kind.COMPARISON),
    GTE(">=", Kind.COMPARISON),
    EQ("==", Kind.EQUALITY),
    NEQ("!=", Kind.EQUALITY),
    BIT_AND("&", Kind.INTEGER),
    BIT_XOR("^", Kind.INTEGER),
    BIT_IOR("|", Kind.INTEGER),
    LOGICAL_AND("&&", Kind.LOGICAL),
    LOGICAL_OR("||", Kind.LOGICAL);

    /**
     * Groups operators by their typing rule.
     */
    public enum Kind {
        /** int or float operands, the wider type wins. */
        ARITHMETIC,
        /** int operands only. */
        INTEGER,
        /** numeric operands, int result. */
        COMPARISON,
        /** numeric or string operands, int result. */
        EQUALITY,
        /** numeric operands, int result. */
        LOGICAL
    }

    private final String symbol;
    private final Kind kind;

    BinaryOperator(String symbol, Kind kind) {
        this.symbol = symbol;
        this.kind = kind;
    }

    public String symbol() {
        return symbol;
    }

    public Kind kind() {
        return kind;
    }
}

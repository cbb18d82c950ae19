package org.jafc.compiler.frontend.parser.ast.expr;

public enum AssignmentOperator {
    ASSIGN("=", null),
    MUL_ASSIGN("*=", BinaryOperator.MUL),
    DIV_ASSIGN("/=", BinaryOperator.DIV),
    MOD_ASSIGN("%=", BinaryOperator.MOD),
    ADD_ASSIGN("+=", BinaryOperator.ADD),
    SUB_ASSIGN("-=", BinaryOperator.SUB),
    LSHIFT_ASSIGN("<<=", BinaryOperator.LSHIFT),
    RSHIFT_ASSIGN(">>=", BinaryOperator.RSHIFT),
    AND_ASSIGN("&=", BinaryOperator.BIT_AND),
    XOR_ASSIGN("^=", BinaryOperator.BIT_XOR),
    OR_ASSIGN("|=", BinaryOperator.BIT_IOR);

    private final String symbol;
    private final BinaryOperator binaryOperator;

    AssignmentOperator(String symbol, BinaryOperator binaryOperator) {
        this.symbol = symbol;
        this.binaryOperator = binaryOperator;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * @return The operator applied before storing, or null for plain assignment.
     */
    public BinaryOperator binaryOperator() {
        return binaryOperator;
    }
}

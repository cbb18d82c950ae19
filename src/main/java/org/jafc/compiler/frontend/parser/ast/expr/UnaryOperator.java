package org.jafc.compiler.frontend.parser.ast.expr;

public enum UnaryOperator {
    PLUS("+"),
    MINUS("-"),
    BIT_NOT("~"),
    LOGICAL_NOT("!"),
    PRE_INC("++"),
    PRE_DEC("--"),
    POST_INC("++"),
    POST_DEC("--");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * @return {@code true} for the increment and decrement operators, which need an lvalue.
     */
    public boolean modifiesOperand() {
        return this == PRE_INC || this == PRE_DEC || this == POST_INC || this == POST_DEC;
    }
}

package org.jafc.compiler.frontend.parser.ast.expr;

public final class BinaryExpression extends Expression {

    private final BinaryOperator operator;
    private Expression lhs;
    private Expression rhs;

    public BinaryExpression(BinaryOperator operator, Expression lhs, Expression rhs) {
        this.operator = operator;
        this.lhs = lhs;
        this.rhs = rhs;
    }

    public BinaryOperator operator() {
        return operator;
    }

    public Expression lhs() {
        return lhs;
    }

    public void setLhs(Expression lhs) {
        this.lhs = lhs;
    }

    public Expression rhs() {
        return rhs;
    }

    public void setRhs(Expression rhs) {
        this.rhs = rhs;
    }

    @Override
    public String toString() {
        return "(" + lhs + " " + operator.symbol() + " " + rhs + ")";
    }
}

package org.jafc.compiler.frontend.parser.ast.expr;

public final class UnaryExpression extends Expression {

    private final UnaryOperator operator;
    private Expression operand;

    public UnaryExpression(UnaryOperator operator, Expression operand) {
        this.operator = operator;
        this.operand = operand;
    }

    public UnaryOperator operator() {
        return operator;
    }

    public Expression operand() {
        return operand;
    }

    public void setOperand(Expression operand) {
        this.operand = operand;
    }

    @Override
    public String toString() {
        return operator == UnaryOperator.POST_INC || operator == UnaryOperator.POST_DEC
                ? "(" + operand + operator.symbol() + ")"
                : "(" + operator.symbol() + operand + ")";
    }
}

package org.jafc.compiler.frontend.parser.ast.expr;

import org.jafc.compiler.frontend.parser.ast.JafType;

/**
 * {@code (target) operand}, where target is one of int, float or string.
 */
public final class CastExpression extends Expression {

    private final JafType target;
    private Expression operand;

    public CastExpression(JafType target, Expression operand) {
        this.target = target;
        this.operand = operand;
    }

    public JafType target() {
        return target;
    }

    public Expression operand() {
        return operand;
    }

    public void setOperand(Expression operand) {
        this.operand = operand;
    }

    @Override
    public String toString() {
        return "((" + target.name().toLowerCase() + ") " + operand + ")";
    }
}

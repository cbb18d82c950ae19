package org.jafc.compiler.frontend.parser.ast.expr;

/**
 * {@code test ? consequent : alternative}
 */
public final class TernaryExpression extends Expression {

    private Expression test;
    private Expression consequent;
    private Expression alternative;

    public TernaryExpression(Expression test, Expression consequent, Expression alternative) {
        this.test = test;
        this.consequent = consequent;
        this.alternative = alternative;
    }

    public Expression test() {
        return test;
    }

    public void setTest(Expression test) {
        this.test = test;
    }

    public Expression consequent() {
        return consequent;
    }

    public void setConsequent(Expression consequent) {
        this.consequent = consequent;
    }

    public Expression alternative() {
        return alternative;
    }

    public void setAlternative(Expression alternative) {
        this.alternative = alternative;
    }

    @Override
    public String toString() {
        return "(" + test + " ? " + consequent + " : " + alternative + ")";
    }
}

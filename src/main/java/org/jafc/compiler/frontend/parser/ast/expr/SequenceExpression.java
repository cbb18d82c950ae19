package org.jafc.compiler.frontend.parser.ast.expr;

/**
 * The comma operator: evaluates {@code head}, then yields {@code tail}.
 */
public final class SequenceExpression extends Expression {

    private Expression head;
    private Expression tail;

    public SequenceExpression(Expression head, Expression tail) {
        this.head = head;
        this.tail = tail;
    }

    public Expression head() {
        return head;
    }

    public void setHead(Expression head) {
        this.head = head;
    }

    public Expression tail() {
        return tail;
    }

    public void setTail(Expression tail) {
        this.tail = tail;
    }

    @Override
    public String toString() {
        return "(" + head + ", " + tail + ")";
    }
}

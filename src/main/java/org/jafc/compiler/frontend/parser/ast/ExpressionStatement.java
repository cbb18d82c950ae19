package org.jafc.compiler.frontend.parser.ast;

import org.jafc.compiler.frontend.parser.ast.expr.Expression;

/**
 * An expression evaluated for its side effects. The expression is replaced by its
 * simplified form during analysis.
 */
public final class ExpressionStatement implements BlockItem {

    private Expression expression;

    public ExpressionStatement(Expression expression) {
        this.expression = expression;
    }

    public Expression expression() {
        return expression;
    }

    public void setExpression(Expression expression) {
        this.expression = expression;
    }
}

package org.jafc.compiler.frontend.parser.ast;

import org.jafc.compiler.frontend.parser.ast.expr.Expression;

/**
 * {@code switch (expression) { body }}
 */
public final class SwitchStatement implements BlockItem {

    private Expression expression;
    private final Block body;

    public SwitchStatement(Expression expression, Block body) {
        this.expression = expression;
        this.body = body;
    }

    public Expression expression() {
        return expression;
    }

    public void setExpression(Expression expression) {
        this.expression = expression;
    }

    public Block body() {
        return body;
    }
}

package org.jafc.compiler.frontend.parser.ast;

import org.jafc.compiler.frontend.parser.ast.expr.Expression;

/**
 * {@code while (test) body}
 */
public final class WhileStatement implements BlockItem {

    private Expression test;
    private final BlockItem body;

    public WhileStatement(Expression test, BlockItem body) {
        this.test = test;
        this.body = body;
    }

    public Expression test() {
        return test;
    }

    public void setTest(Expression test) {
        this.test = test;
    }

    public BlockItem body() {
        return body;
    }
}

package org.jafc.compiler.frontend.parser.ast;

import org.jafc.compiler.frontend.parser.ast.expr.Expression;

/**
 * {@code if (test) consequent else alternative}; the alternative may be null.
 */
public final class IfStatement implements BlockItem {

    private Expression test;
    private final BlockItem consequent;
    private final BlockItem alternative;

    public IfStatement(Expression test, BlockItem consequent, BlockItem alternative) {
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

    public BlockItem consequent() {
        return consequent;
    }

    public BlockItem alternative() {
        return alternative;
    }
}

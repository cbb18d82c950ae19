package org.jafc.compiler.frontend.parser.ast;

import org.jafc.compiler.frontend.parser.ast.expr.Expression;

/**
 * {@code for (init; test; after) body}. The init clause is a block of its own;
 * test and after may be null.
 */
public final class ForStatement implements BlockItem {

    private final Block init;
    private Expression test;
    private Expression after;
    private final BlockItem body;

    public ForStatement(Block init, Expression test, Expression after, BlockItem body) {
        this.init = init == null ? Block.empty() : init;
        this.test = test;
        this.after = after;
        this.body = body;
    }

    public Block init() {
        return init;
    }

    public Expression test() {
        return test;
    }

    public void setTest(Expression test) {
        this.test = test;
    }

    public Expression after() {
        return after;
    }

    public void setAfter(Expression after) {
        this.after = after;
    }

    public BlockItem body() {
        return body;
    }
}

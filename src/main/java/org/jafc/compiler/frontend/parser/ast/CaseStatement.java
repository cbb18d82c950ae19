package org.jafc.compiler.frontend.parser.ast;

import org.jafc.compiler.frontend.parser.ast.expr.Expression;

/**
 * {@code case value: statement} inside a switch body.
 */
public final class CaseStatement implements BlockItem {

    private Expression value;
    private final BlockItem statement;

    public CaseStatement(Expression value, BlockItem statement) {
        this.value = value;
        this.statement = statement;
    }

    public Expression value() {
        return value;
    }

    public void setValue(Expression value) {
        this.value = value;
    }

    public BlockItem statement() {
        return statement;
    }
}

package org.jafc.compiler.frontend.parser.ast;

import org.jafc.compiler.api.SourceInfo;
import org.jafc.compiler.frontend.parser.ast.expr.Expression;

/**
 * {@code return;} or {@code return expression;}
 */
public final class ReturnStatement implements BlockItem {

    private Expression expression;
    private final SourceInfo sourceInfo;

    public ReturnStatement(Expression expression, SourceInfo sourceInfo) {
        this.expression = expression;
        this.sourceInfo = sourceInfo;
    }

    public ReturnStatement(Expression expression) {
        this(expression, null);
    }

    /**
     * @return The returned value, or null for a bare {@code return;}.
     */
    public Expression expression() {
        return expression;
    }

    public void setExpression(Expression expression) {
        this.expression = expression;
    }

    @Override
    public SourceInfo sourceInfo() {
        return sourceInfo != null ? sourceInfo : (expression != null ? expression.sourceInfo() : null);
    }
}

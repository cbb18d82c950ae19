package org.jafc.compiler.frontend.parser.ast.expr;

import org.jafc.ain.AinType;
import org.jafc.compiler.api.SourceInfo;
import org.jafc.compiler.frontend.parser.ast.AstNode;

/**
 * Base class of all expressions. After analysis every expression carries its derived type.
 * Analysis may replace an expression by a simpler equivalent one; the parent then stores
 * the replacement in its own slot.
 */
public abstract class Expression implements AstNode {

    private AinType valueType;
    private SourceInfo sourceInfo;

    /**
     * @return The derived type, or null if the expression has not been analyzed yet.
     */
    public AinType valueType() {
        return valueType;
    }

    public void setValueType(AinType valueType) {
        this.valueType = valueType;
    }

    /**
     * @return {@code true} if this expression is an int, float or string literal.
     */
    public boolean isLiteral() {
        return false;
    }

    /**
     * Records the source position of this expression.
     * @param sourceInfo The position.
     * @return This expression.
     */
    public Expression at(SourceInfo sourceInfo) {
        this.sourceInfo = sourceInfo;
        return this;
    }

    @Override
    public SourceInfo sourceInfo() {
        return sourceInfo;
    }
}

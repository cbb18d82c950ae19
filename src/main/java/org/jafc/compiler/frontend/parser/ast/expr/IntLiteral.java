package org.jafc.compiler.frontend.parser.ast.expr;

import org.jafc.ain.AinType;

public final class IntLiteral extends Expression {

    private final int value;

    public IntLiteral(int value) {
        this.value = value;
        setValueType(AinType.INT);
    }

    public int value() {
        return value;
    }

    @Override
    public boolean isLiteral() {
        return true;
    }

    @Override
    public String toString() {
        return Integer.toString(value);
    }
}

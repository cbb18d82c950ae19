package org.jafc.compiler.frontend.parser.ast.expr;

import org.jafc.ain.AinType;

public final class FloatLiteral extends Expression {

    private final float value;

    public FloatLiteral(float value) {
        this.value = value;
        setValueType(AinType.FLOAT);
    }

    public float value() {
        return value;
    }

    @Override
    public boolean isLiteral() {
        return true;
    }

    @Override
    public String toString() {
        return Float.toString(value);
    }
}

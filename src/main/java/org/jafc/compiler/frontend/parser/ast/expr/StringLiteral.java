package org.jafc.compiler.frontend.parser.ast.expr;

import org.jafc.ain.AinType;

public final class StringLiteral extends Expression {

    private final String value;

    public StringLiteral(String value) {
        this.value = value;
        setValueType(AinType.STRING);
    }

    public String value() {
        return value;
    }

    @Override
    public boolean isLiteral() {
        return true;
    }

    @Override
    public String toString() {
        return '"' + value + '"';
    }
}

package org.jafc.compiler.frontend.parser.ast.expr;

import java.util.ArrayList;
import java.util.List;

/**
 * A call of a function by name. Analysis binds it to the function index.
 */
public final class CallExpression extends Expression {

    private final String functionName;
    private final List<Expression> arguments;
    private int funcNo = -1;

    public CallExpression(String functionName, List<Expression> arguments) {
        this.functionName = functionName;
        this.arguments = arguments == null ? new ArrayList<>() : new ArrayList<>(arguments);
    }

    public String functionName() {
        return functionName;
    }

    /**
     * @return The argument list; entries are replaced in place during analysis.
     */
    public List<Expression> arguments() {
        return arguments;
    }

    public int funcNo() {
        return funcNo;
    }

    public void setFuncNo(int funcNo) {
        this.funcNo = funcNo;
    }

    @Override
    public String toString() {
        return functionName + arguments;
    }
}

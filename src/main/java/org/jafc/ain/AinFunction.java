package org.jafc.ain;

import java.util.List;

/**
 * A function record. The first {@link #getNrArgs()} entries of the variable table
 * are the arguments, the rest are locals in first-occurrence order.
 */
public class AinFunction {

    private final String name;
    private final AinType returnType;
    private final int nrArgs;
    private final List<AinVariable> vars;

    public AinFunction(String name, AinType returnType, int nrArgs, List<AinVariable> vars) {
        if (nrArgs < 0 || nrArgs > vars.size()) {
            throw new IllegalArgumentException("Invalid argument count " + nrArgs + " for " + vars.size() + " variables");
        }
        this.name = name;
        this.returnType = returnType;
        this.nrArgs = nrArgs;
        this.vars = List.copyOf(vars);
    }

    public String getName() {
        return name;
    }

    public AinType getReturnType() {
        return returnType;
    }

    public int getNrArgs() {
        return nrArgs;
    }

    public int getNrVars() {
        return vars.size();
    }

    public List<AinVariable> getVars() {
        return vars;
    }
}

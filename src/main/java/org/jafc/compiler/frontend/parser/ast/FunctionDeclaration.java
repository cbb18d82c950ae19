package org.jafc.compiler.frontend.parser.ast;

import org.jafc.compiler.api.SourceInfo;

import java.util.List;

/**
 * A function definition with its parameters and body.
 */
public final class FunctionDeclaration implements BlockItem {

    private final String name;
    private final TypeSpecifier returnType;
    private final List<Declaration> parameters;
    private final Block body;
    private final SourceInfo sourceInfo;
    private int funcNo = Declaration.UNASSIGNED;

    public FunctionDeclaration(String name, TypeSpecifier returnType, List<Declaration> parameters, Block body, SourceInfo sourceInfo) {
        this.name = name;
        this.returnType = returnType;
        this.parameters = parameters == null ? List.of() : List.copyOf(parameters);
        this.body = body == null ? Block.empty() : body;
        this.sourceInfo = sourceInfo;
    }

    public FunctionDeclaration(String name, TypeSpecifier returnType, List<Declaration> parameters, Block body) {
        this(name, returnType, parameters, body, null);
    }

    public String name() {
        return name;
    }

    public TypeSpecifier returnType() {
        return returnType;
    }

    public List<Declaration> parameters() {
        return parameters;
    }

    public Block body() {
        return body;
    }

    public int funcNo() {
        return funcNo;
    }

    /**
     * @param funcNo The function index in the object model.
     * @throws IllegalStateException if an index was already assigned.
     */
    public void assignFuncNo(int funcNo) {
        if (this.funcNo != Declaration.UNASSIGNED) {
            throw new IllegalStateException("Function '" + name + "' already has index " + this.funcNo);
        }
        this.funcNo = funcNo;
    }

    @Override
    public SourceInfo sourceInfo() {
        return sourceInfo;
    }
}

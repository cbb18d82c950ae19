package org.jafc.compiler.frontend.parser.ast;

import org.jafc.compiler.api.SourceInfo;
import org.jafc.compiler.frontend.parser.ast.expr.Expression;

/**
 * A variable, member, parameter or typedef declaration.
 * <p>
 * The variable index is assigned exactly once: a local slot for declarations inside a
 * function, a global slot for top-level declarations. A declaration without a name only
 * introduces a type (e.g. {@code struct Foo { ... };}).
 */
public final class Declaration implements BlockItem {

    /** Marker for an index that has not been assigned yet. */
    public static final int UNASSIGNED = -1;

    private final String name;
    private final TypeSpecifier type;
    private final boolean typedef;
    private final SourceInfo sourceInfo;
    private Expression initializer;
    private int varNo = UNASSIGNED;

    public Declaration(String name, TypeSpecifier type, Expression initializer, boolean typedef, SourceInfo sourceInfo) {
        this.name = name;
        this.type = type;
        this.initializer = initializer;
        this.typedef = typedef;
        this.sourceInfo = sourceInfo;
    }

    public Declaration(String name, TypeSpecifier type, Expression initializer) {
        this(name, type, initializer, false, null);
    }

    public Declaration(String name, TypeSpecifier type) {
        this(name, type, null, false, null);
    }

    /**
     * Creates {@code typedef <type> <alias>;}.
     */
    public static Declaration typedef(String alias, TypeSpecifier type) {
        return new Declaration(alias, type, null, true, null);
    }

    public String name() {
        return name;
    }

    public boolean hasName() {
        return name != null;
    }

    public TypeSpecifier type() {
        return type;
    }

    public boolean isTypedef() {
        return typedef;
    }

    public Expression initializer() {
        return initializer;
    }

    public void setInitializer(Expression initializer) {
        this.initializer = initializer;
    }

    public int varNo() {
        return varNo;
    }

    /**
     * @param varNo The local or global index of this variable.
     * @throws IllegalStateException if an index was already assigned.
     */
    public void assignVarNo(int varNo) {
        if (this.varNo != UNASSIGNED) {
            throw new IllegalStateException("Variable '" + name + "' already has index " + this.varNo);
        }
        this.varNo = varNo;
    }

    @Override
    public SourceInfo sourceInfo() {
        return sourceInfo;
    }

    @Override
    public String toString() {
        return (typedef ? "typedef " : "") + type + " " + name;
    }
}

package org.jafc.compiler.frontend.parser.ast.expr;

/**
 * A reference to a variable by name. Analysis binds it to a local or global index.
 */
public final class Identifier extends Expression {

    /**
     * What an identifier was bound to.
     */
    public enum Binding {
        UNRESOLVED,
        LOCAL,
        GLOBAL
    }

    private final String name;
    private Binding binding = Binding.UNRESOLVED;
    private int index = -1;

    public Identifier(String name) {
        this.name = name;
    }

    public String name() {
        return name;
    }

    public Binding binding() {
        return binding;
    }

    /**
     * @return The local variable index or global index, depending on {@link #binding()}.
     */
    public int index() {
        return index;
    }

    public void bind(Binding binding, int index) {
        this.binding = binding;
        this.index = index;
    }

    @Override
    public String toString() {
        return name;
    }
}

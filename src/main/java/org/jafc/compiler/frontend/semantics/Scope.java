package org.jafc.compiler.frontend.semantics;

import org.jafc.ain.AinFunction;
import org.jafc.ain.AinVariable;
import org.jafc.compiler.ain.IObjectModel;
import org.jafc.compiler.frontend.parser.ast.FunctionDeclaration;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A lexical scope of the analysis pass: the global scope, a function scope or a block scope.
 * <p>
 * A scope holds a lookup-only reference to its parent and the bindings introduced at its
 * own nesting level. Bindings point at entries of the enclosing function's variable table,
 * so the scope never owns variables; discarding a scope only ends their visibility.
 */
public final class Scope {

    /**
     * A visible local variable.
     *
     * @param varNo The index in the function's variable table.
     * @param variable The variable table entry.
     */
    public record Binding(int varNo, AinVariable variable) {}

    private final IObjectModel model;
    private final Scope parent;
    private final FunctionContext function;
    private final List<Binding> locals = new ArrayList<>();

    private Scope(IObjectModel model, Scope parent, FunctionContext function) {
        this.model = model;
        this.parent = parent;
        this.function = function;
    }

    /**
     * @param model The object model.
     * @return The outermost scope, in which declarations are globals.
     */
    public static Scope global(IObjectModel model) {
        return new Scope(model, null, null);
    }

    /**
     * Creates the scope of a function body, seeded with the function's arguments.
     * @param declaration A function that has been registered in the object model.
     * @return The new child scope.
     */
    public Scope enterFunction(FunctionDeclaration declaration) {
        int funcNo = declaration.funcNo();
        if (funcNo < 0 || funcNo >= model.getFunctionCount()) {
            throw new IllegalStateException("Invalid function index " + funcNo + " for '" + declaration.name() + "'");
        }
        AinFunction record = model.getFunction(funcNo);
        Scope scope = new Scope(model, this, new FunctionContext(funcNo, declaration, record));
        for (int i = 0; i < record.getNrArgs(); i++) {
            scope.locals.add(new Binding(i, record.getVars().get(i)));
        }
        return scope;
    }

    /**
     * @return A child scope for a nested block, inheriting the enclosing function.
     */
    public Scope enterBlock() {
        return new Scope(model, this, function);
    }

    /**
     * @return {@code true} for the outermost scope.
     */
    public boolean isGlobal() {
        return parent == null;
    }

    public Scope parent() {
        return parent;
    }

    public IObjectModel model() {
        return model;
    }

    /**
     * @return The enclosing function, or empty at global scope.
     */
    public Optional<FunctionContext> function() {
        return Optional.ofNullable(function);
    }

    /**
     * Makes a pre-assigned local variable visible in this scope.
     * @param varNo The index in the enclosing function's variable table.
     */
    public void bindLocal(int varNo) {
        if (function == null) {
            throw new IllegalStateException("Local variable outside of a function");
        }
        List<AinVariable> vars = function.record().getVars();
        if (varNo < 0 || varNo >= vars.size()) {
            throw new IllegalStateException("Invalid variable index " + varNo + " in function '"
                    + function.record().getName() + "' with " + vars.size() + " variable(s)");
        }
        locals.add(new Binding(varNo, vars.get(varNo)));
    }

    /**
     * @return The bindings introduced at this level, in declaration order.
     */
    public List<Binding> locals() {
        return List.copyOf(locals);
    }

    /**
     * Looks up a local by name, from this scope outwards; later declarations shadow earlier ones.
     * @param name The variable name.
     * @return The innermost visible binding, or empty.
     */
    public Optional<Binding> resolveLocal(String name) {
        for (Scope scope = this; scope != null; scope = scope.parent) {
            for (int i = scope.locals.size() - 1; i >= 0; i--) {
                Binding binding = scope.locals.get(i);
                if (binding.variable().getName().equals(name)) {
                    return Optional.of(binding);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * State shared by a function scope and all block scopes nested in it.
     */
    public static final class FunctionContext {
        private final int funcNo;
        private final FunctionDeclaration declaration;
        private final AinFunction record;
        private int localsSeen;

        FunctionContext(int funcNo, FunctionDeclaration declaration, AinFunction record) {
            this.funcNo = funcNo;
            this.declaration = declaration;
            this.record = record;
        }

        public int funcNo() {
            return funcNo;
        }

        public FunctionDeclaration declaration() {
            return declaration;
        }

        public AinFunction record() {
            return record;
        }

        /**
         * Advances the count of local declarations seen by the analysis pass.
         * @return The variable index the next local declaration must carry.
         */
        int nextExpectedVarNo() {
            return record.getNrArgs() + localsSeen++;
        }

        /**
         * @return The number of variables accounted for so far.
         */
        int variablesSeen() {
            return record.getNrArgs() + localsSeen;
        }
    }
}

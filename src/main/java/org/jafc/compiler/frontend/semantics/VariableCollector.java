package org.jafc.compiler.frontend.semantics;

import org.jafc.ain.AinVariable;
import org.jafc.compiler.api.CompilerErrorCode;
import org.jafc.compiler.diagnostics.SemanticException;
import org.jafc.compiler.frontend.BlockWalker;
import org.jafc.compiler.frontend.parser.ast.Declaration;
import org.jafc.compiler.frontend.parser.ast.FunctionDeclaration;

import java.util.List;

/**
 * Collects every variable declared in a function body, in first-occurrence order,
 * and assigns each declaration its index in the function's variable table.
 * Declarations in nested blocks and for-loop init clauses are flattened into the same table.
 */
class VariableCollector extends BlockWalker {

    private final List<AinVariable> vars;
    private final int version;

    /**
     * @param vars The variable table, already holding the function's arguments.
     * @param version The object version.
     */
    VariableCollector(List<AinVariable> vars, int version) {
        this.vars = vars;
        this.version = version;
    }

    @Override
    protected void visitDeclaration(Declaration decl) {
        if (!decl.hasName() || decl.isTypedef()) {
            return;
        }
        vars.add(TypeConversions.toVariable(decl, version));
        decl.assignVarNo(vars.size() - 1);
    }

    @Override
    protected void visitFunction(FunctionDeclaration function) {
        throw new SemanticException(CompilerErrorCode.NESTED_FUNCTION,
                "Nested functions not supported: '" + function.name() + "'", function.sourceInfo());
    }
}

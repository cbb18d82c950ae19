package org.jafc.compiler.frontend.semantics;

import org.jafc.ain.AinFunction;
import org.jafc.ain.AinType;
import org.jafc.ain.AinVariable;
import org.jafc.compiler.ain.IObjectModel;
import org.jafc.compiler.api.CompilerErrorCode;
import org.jafc.compiler.diagnostics.CompilerLogger;
import org.jafc.compiler.diagnostics.SemanticException;
import org.jafc.compiler.frontend.parser.ast.Block;
import org.jafc.compiler.frontend.parser.ast.BlockItem;
import org.jafc.compiler.frontend.parser.ast.Declaration;
import org.jafc.compiler.frontend.parser.ast.FunctionDeclaration;

import java.util.ArrayList;
import java.util.List;

/**
 * Pass 2: registers the top-level declarations in the object model.
 * <p>
 * Every function gets a record whose variable table lists the arguments followed by
 * all locals of the body in first-occurrence order; every named global gets a global
 * slot. The assigned indices are written back into the declaration nodes.
 */
public class DeclarationRegistrar {

    private final IObjectModel model;

    public DeclarationRegistrar(IObjectModel model) {
        this.model = model;
    }

    /**
     * Registers the top-level functions and globals of the given root block.
     * @param root The translation unit.
     */
    public void register(Block root) {
        for (BlockItem item : root.items()) {
            if (item instanceof FunctionDeclaration function) {
                addFunction(function);
            } else if (item instanceof Declaration decl && decl.hasName() && !decl.isTypedef()) {
                addGlobal(decl);
            }
        }
        CompilerLogger.debug("DeclarationRegistrar: " + model.getFunctionCount() + " function(s), "
                + model.getGlobalCount() + " global(s)");
    }

    private void addFunction(FunctionDeclaration function) {
        if (function.name() == null) {
            throw new SemanticException(CompilerErrorCode.MALFORMED_DECLARATION, "Function without name", function.sourceInfo());
        }
        AinType returnType = TypeConversions.toAinType(function.returnType(), function.sourceInfo());

        List<AinVariable> vars = new ArrayList<>();
        for (Declaration param : function.parameters()) {
            if (!param.hasName() || param.isTypedef()) {
                throw new SemanticException(CompilerErrorCode.MALFORMED_DECLARATION,
                        "Invalid parameter in function '" + function.name() + "'", param.sourceInfo());
            }
            vars.add(TypeConversions.toVariable(param, model.getVersion()));
            param.assignVarNo(vars.size() - 1);
        }
        int nrArgs = vars.size();
        new VariableCollector(vars, model.getVersion()).walk(function.body());

        int funcNo = model.addFunction(new AinFunction(function.name(), returnType, nrArgs, vars));
        function.assignFuncNo(funcNo);
        CompilerLogger.trace("DeclarationRegistrar: function " + function.name() + " #" + funcNo
                + " (" + nrArgs + " arg(s), " + (vars.size() - nrArgs) + " local(s))");
    }

    private void addGlobal(Declaration decl) {
        AinType type = TypeConversions.toAinType(decl.type(), decl.sourceInfo());
        int globalNo = model.addGlobal(decl.name());
        model.getGlobal(globalNo).setType(type);
        decl.assignVarNo(globalNo);
        CompilerLogger.trace("DeclarationRegistrar: global " + decl.name() + " #" + globalNo);
    }
}

package org.jafc.compiler.frontend.semantics;

import org.jafc.ain.AinDataType;
import org.jafc.ain.AinFunction;
import org.jafc.ain.AinInitval;
import org.jafc.ain.AinType;
import org.jafc.compiler.ain.IObjectModel;
import org.jafc.compiler.api.CompilerErrorCode;
import org.jafc.compiler.diagnostics.CompilerLogger;
import org.jafc.compiler.diagnostics.SemanticException;
import org.jafc.compiler.frontend.BlockWalker;
import org.jafc.compiler.frontend.parser.ast.Block;
import org.jafc.compiler.frontend.parser.ast.Declaration;
import org.jafc.compiler.frontend.parser.ast.FunctionDeclaration;
import org.jafc.compiler.frontend.parser.ast.ReturnStatement;
import org.jafc.compiler.frontend.parser.ast.expr.Expression;
import org.jafc.compiler.frontend.parser.ast.expr.FloatLiteral;
import org.jafc.compiler.frontend.parser.ast.expr.IntLiteral;
import org.jafc.compiler.frontend.parser.ast.expr.StringLiteral;

/**
 * Pass 3: scope-aware analysis of all statements and expressions.
 * <p>
 * Function bodies and nested blocks get their own {@link Scope}. Global initializers
 * must reduce to a literal and are recorded as initial values; local initializers are
 * analyzed before the new variable becomes visible. The variable index of every local
 * declaration is cross-checked against the order in which this pass encounters it.
 */
public class AnalysisDriver extends BlockWalker {

    private final IObjectModel model;
    private final ExpressionAnalyzer expressions;
    private final TypeChecker checker;
    private Scope scope;

    public AnalysisDriver(IObjectModel model, ExpressionAnalyzer expressions, TypeChecker checker) {
        this.model = model;
        this.expressions = expressions;
        this.checker = checker;
        this.scope = Scope.global(model);
    }

    /**
     * Analyzes the translation unit.
     * @param root The root block, after type resolution and declaration registration.
     */
    public void analyze(Block root) {
        walk(root);
        CompilerLogger.debug("AnalysisDriver: " + model.getInitvalCount() + " initval(s)");
    }

    @Override
    protected void walkNestedBlock(Block block) {
        Scope outer = scope;
        scope = outer.enterBlock();
        try {
            walk(block);
        } finally {
            scope = outer;
        }
    }

    @Override
    protected void visitDeclaration(Declaration decl) {
        if (!decl.hasName() || decl.isTypedef()) {
            return;
        }
        if (scope.isGlobal()) {
            analyzeGlobal(decl);
        } else {
            analyzeLocal(decl);
        }
    }

    private void analyzeGlobal(Declaration decl) {
        if (decl.initializer() == null) {
            return;
        }
        AinType type = model.getGlobal(decl.varNo()).getType();
        Expression init = analyzeInitializer(decl, type);
        model.addInitval(toInitval(decl, init));
    }

    private void analyzeLocal(Declaration decl) {
        Scope.FunctionContext function = scope.function()
                .orElseThrow(() -> new IllegalStateException("Local declaration '" + decl.name() + "' outside of a function"));
        int expected = function.nextExpectedVarNo();
        if (decl.varNo() != expected) {
            throw new IllegalStateException("Variable index mismatch for '" + decl.name() + "' in function '"
                    + function.record().getName() + "': registered " + decl.varNo() + ", analyzed as " + expected);
        }
        if (decl.initializer() != null) {
            analyzeInitializer(decl, function.record().getVars().get(decl.varNo()).getType());
        }
        scope.bindLocal(decl.varNo());
    }

    private Expression analyzeInitializer(Declaration decl, AinType type) {
        Expression init = expressions.analyze(scope, decl.initializer());
        checker.check(init, type);
        init = checker.coerce(init, type);
        decl.setInitializer(init);
        return init;
    }

    private static AinInitval toInitval(Declaration decl, Expression init) {
        int globalNo = decl.varNo();
        if (init instanceof IntLiteral literal) {
            return AinInitval.ofInt(globalNo, literal.value());
        }
        if (init instanceof FloatLiteral literal) {
            return AinInitval.ofFloat(globalNo, literal.value());
        }
        if (init instanceof StringLiteral literal) {
            return AinInitval.ofString(globalNo, literal.value());
        }
        throw new SemanticException(CompilerErrorCode.NON_CONSTANT_INITIALIZER,
                "Initializer of global '" + decl.name() + "' is not a constant: " + init, decl.sourceInfo());
    }

    @Override
    protected void visitFunction(FunctionDeclaration function) {
        Scope outer = scope;
        scope = outer.enterFunction(function);
        try {
            Scope.FunctionContext context = scope.function().orElseThrow();
            walk(function.body());
            AinFunction record = context.record();
            if (context.variablesSeen() != record.getNrVars()) {
                throw new IllegalStateException("Function '" + record.getName() + "' registered with "
                        + record.getNrVars() + " variable(s), analysis found " + context.variablesSeen());
            }
        } finally {
            scope = outer;
        }
    }

    @Override
    protected Expression visitExpression(Expression expr) {
        return expressions.analyze(scope, expr);
    }

    @Override
    protected void visitReturn(ReturnStatement stmt) {
        Scope.FunctionContext function = scope.function().orElseThrow(() -> new SemanticException(
                CompilerErrorCode.RETURN_OUTSIDE_FUNCTION, "Return statement outside of a function", stmt.sourceInfo()));
        AinType returnType = function.record().getReturnType();
        Expression value = stmt.expression();
        if (value == null) {
            if (returnType.data() != AinDataType.VOID) {
                throw new SemanticException(CompilerErrorCode.TYPE_MISMATCH,
                        "Function '" + function.record().getName() + "' must return " + returnType, stmt.sourceInfo());
            }
            return;
        }
        if (returnType.data() == AinDataType.VOID) {
            throw new SemanticException(CompilerErrorCode.TYPE_MISMATCH,
                    "Void function '" + function.record().getName() + "' cannot return a value", stmt.sourceInfo());
        }
        checker.check(value, returnType);
        stmt.setExpression(checker.coerce(value, returnType));
    }
}

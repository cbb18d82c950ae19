package org.jafc.compiler;

import org.jafc.ain.Ain;
import org.jafc.compiler.ain.AinObjectModelAdapter;
import org.jafc.compiler.ain.IObjectModel;
import org.jafc.compiler.api.CompilationException;
import org.jafc.compiler.api.CompilerErrorCode;
import org.jafc.compiler.diagnostics.CompilerLogger;
import org.jafc.compiler.diagnostics.DiagnosticsEngine;
import org.jafc.compiler.diagnostics.SemanticException;
import org.jafc.compiler.frontend.parser.ast.Block;
import org.jafc.compiler.frontend.semantics.AnalysisDriver;
import org.jafc.compiler.frontend.semantics.ConstantFolder;
import org.jafc.compiler.frontend.semantics.DeclarationRegistrar;
import org.jafc.compiler.frontend.semantics.ExpressionAnalyzer;
import org.jafc.compiler.frontend.semantics.TypeChecker;
import org.jafc.compiler.frontend.semantics.TypeResolver;
import org.jafc.compiler.util.DebugDump;

/**
 * Entry point of the static analysis stage. Runs the three passes over a parsed
 * translation unit and populates the object model:
 * <ol>
 *     <li>type resolution: structures and typedefs</li>
 *     <li>declaration registration: functions with their variable tables, and globals</li>
 *     <li>analysis: scoping, type checking, constant folding and global initial values</li>
 * </ol>
 * The first error aborts the analysis. This class is not thread-safe.
 */
public class StaticAnalyzer {

    private final AnalyzerOptions options;
    private DiagnosticsEngine diagnostics = new DiagnosticsEngine();

    public StaticAnalyzer(AnalyzerOptions options) {
        this.options = options;
    }

    public StaticAnalyzer() {
        this(AnalyzerOptions.defaults());
    }

    /**
     * Analyzes a translation unit into the given object.
     *
     * @param root The root block produced by the parser.
     * @param ain The object to populate.
     * @param programName The program name, used for diagnostics and dumps.
     * @return The annotated root block.
     * @throws CompilationException if the program is not valid.
     */
    public Block analyze(Block root, Ain ain, String programName) throws CompilationException {
        Block result = analyze(root, new AinObjectModelAdapter(ain), programName);
        if (options.dumpEnabled()) {
            DebugDump.dumpObjectModel(options.dumpDirectory(), programName, ain);
        }
        return result;
    }

    /**
     * Analyzes a translation unit into the given object model.
     *
     * @param root The root block produced by the parser.
     * @param model The object model to populate.
     * @param programName The program name, used for diagnostics.
     * @return The annotated root block.
     * @throws CompilationException if the program is not valid.
     */
    public Block analyze(Block root, IObjectModel model, String programName) throws CompilationException {
        diagnostics = new DiagnosticsEngine();
        CompilerLogger.setLevel(options.verbosity());
        CompilerLogger.info("StaticAnalyzer: " + programName);
        if (root == null) {
            throw new CompilationException(CompilerErrorCode.MALFORMED_DECLARATION, "No translation unit for " + programName);
        }
        try {
            // Pass 1: structures and typedefs
            new TypeResolver(model).resolve(root);

            // Pass 2: functions and globals
            new DeclarationRegistrar(model).register(root);

            // Pass 3: scopes, types, folding, initial values
            TypeChecker checker = new TypeChecker(options.implicitFloatConversion());
            ConstantFolder folder = options.foldConstants() ? new ConstantFolder() : null;
            new AnalysisDriver(model, new ExpressionAnalyzer(checker, folder), checker).analyze(root);
        } catch (SemanticException e) {
            diagnostics.reportError(e.getCode(), e.getMessage(), e.getSourceInfo());
            CompilerLogger.error(diagnostics.summary());
            throw new CompilationException(e.getCode(), diagnostics.summary(), e);
        } catch (RuntimeException e) {
            diagnostics.reportError(CompilerErrorCode.INTERNAL_ERROR, String.valueOf(e.getMessage()), null);
            CompilerLogger.error(diagnostics.summary());
            throw new CompilationException(CompilerErrorCode.INTERNAL_ERROR, diagnostics.summary(), e);
        }
        CompilerLogger.debug("StaticAnalyzer: " + programName + " done: " + model.getStructCount() + " struct(s), "
                + model.getFunctionCount() + " function(s), " + model.getGlobalCount() + " global(s)");
        return root;
    }

    /**
     * @return The diagnostics of the most recent {@code analyze} call.
     */
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }
}

package org.jafc.compiler;

import org.jafc.ain.Ain;
import org.jafc.ain.AinDataType;
import org.jafc.ain.AinInitval;
import org.jafc.ain.AinType;
import org.jafc.compiler.ain.AinObjectModelAdapter;
import org.jafc.compiler.api.CompilationException;
import org.jafc.compiler.api.CompilerErrorCode;
import org.jafc.compiler.api.SourceInfo;
import org.jafc.compiler.diagnostics.Diagnostic;
import org.jafc.compiler.frontend.parser.ast.Block;
import org.jafc.compiler.frontend.parser.ast.Declaration;
import org.jafc.compiler.frontend.parser.ast.TypeSpecifier;
import org.jafc.compiler.frontend.parser.ast.expr.BinaryOperator;
import org.jafc.compiler.frontend.parser.ast.expr.MemberExpression;
import org.jafc.compiler.frontend.parser.ast.expr.UnaryExpression;
import org.jafc.compiler.frontend.parser.ast.expr.UnaryOperator;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.jafc.compiler.frontend.AstBuilder.bin;
import static org.jafc.compiler.frontend.AstBuilder.block;
import static org.jafc.compiler.frontend.AstBuilder.floatType;
import static org.jafc.compiler.frontend.AstBuilder.function;
import static org.jafc.compiler.frontend.AstBuilder.id;
import static org.jafc.compiler.frontend.AstBuilder.intType;
import static org.jafc.compiler.frontend.AstBuilder.lit;
import static org.jafc.compiler.frontend.AstBuilder.ret;
import static org.jafc.compiler.frontend.AstBuilder.str;
import static org.jafc.compiler.frontend.AstBuilder.stringType;
import static org.jafc.compiler.frontend.AstBuilder.structDef;
import static org.jafc.compiler.frontend.AstBuilder.var;
import static org.jafc.compiler.frontend.AstBuilder.voidType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

/**
 * Contains tests for the {@link StaticAnalyzer} running all three passes over hand-built
 * translation units. These are unit tests; they do not touch the file system except for
 * the debug dump test, which writes into a temporary directory.
 */
@Tag("unit")
class StaticAnalyzerTest {

    private static final SourceInfo LINE_3 = new SourceInfo("test.jaf", 3, 5);

    private final StaticAnalyzer analyzer = new StaticAnalyzer(
            new AnalyzerOptions(true, true, 1, false, Path.of("build", "compiler-dumps")));

    /**
     * Verifies that a global with a constant initializer produces an initial value.
     */
    @Test
    void testGlobalInitializerProducesInitval() throws CompilationException {
        // Arrange
        Ain ain = new Ain(4);

        // Act
        analyzer.analyze(block(var(intType(), "global_x", lit(10))), ain, "test");

        // Assert
        assertThat(ain.getGlobals()).hasSize(1);
        assertThat(ain.getGlobals().get(0).getType()).isEqualTo(AinType.INT);
        assertThat(ain.getInitvals()).containsExactly(AinInitval.ofInt(0, 10));
    }

    @Test
    void testIntInitializerOfFloatGlobalIsConverted() throws CompilationException {
        Ain ain = new Ain(4);

        analyzer.analyze(block(var(floatType(), "f", lit(1))), ain, "test");

        AinInitval initval = ain.getInitvals().get(0);
        assertThat(initval.dataType()).isEqualTo(AinDataType.FLOAT);
        assertThat(initval.floatValue()).isEqualTo(1.0f);
    }

    @Test
    void testFoldedGlobalInitializers() throws CompilationException {
        Ain ain = new Ain(4);
        Block root = block(
                var(intType(), "neg", new UnaryExpression(UnaryOperator.MINUS, lit(5))),
                var(stringType(), "greeting", bin(BinaryOperator.ADD, str("hello, "), str("world"))),
                var(intType(), "uninitialized"),
                var(floatType(), "ratio", bin(BinaryOperator.DIV, lit(1), lit(4.0f))));

        analyzer.analyze(root, ain, "test");

        assertThat(ain.getInitvals()).extracting(AinInitval::globalIndex).containsExactly(0, 1, 3);
        assertThat(ain.getInitvals()).extracting(AinInitval::value).containsExactly(-5, "hello, world", 0.25f);
    }

    /**
     * Verifies that a simple function passes and yields a function record with its arguments.
     */
    @Test
    void testSimpleFunctionIsAccepted() throws CompilationException {
        // Arrange
        Ain ain = new Ain(4);
        Block root = block(function(intType(), "f", List.of(var(intType(), "a")), ret(id("a"))));

        // Act
        Block result = analyzer.analyze(root, ain, "test");

        // Assert
        assertThat(result).isSameAs(root);
        assertThat(ain.getFunctions()).hasSize(1);
        assertThat(ain.getFunctions().get(0).getNrArgs()).isEqualTo(1);
        assertThat(analyzer.getDiagnostics().hasErrors()).isFalse();
    }

    @Test
    void testStructGlobalAndFunctionTogether() throws CompilationException {
        Ain ain = new Ain(12);
        Block root = block(
                structDef("Point", var(intType(), "x"), var(intType(), "y")),
                var(TypeSpecifier.struct("Point"), "origin"),
                function(intType(), "getX", List.of(),
                        ret(new MemberExpression(id("origin"), "x"))));

        analyzer.analyze(root, ain, "test");

        assertThat(ain.getStructures()).hasSize(1);
        assertThat(ain.getGlobals().get(0).getType()).isEqualTo(AinType.struct(0));
        assertThat(ain.getGlobals().get(0).getName2()).isEmpty();
    }

    /**
     * Verifies that returning a value of the wrong type is reported with its error code and location.
     */
    @Test
    void testReturnTypeMismatchIsReported() {
        // Arrange
        Block root = block(function(intType(), "f", List.of(), ret(str("x").at(LINE_3))));

        // Act & Assert
        assertThatThrownBy(() -> analyzer.analyze(root, new Ain(4), "test"))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("TYPE_MISMATCH")
                .hasMessageContaining("test.jaf:3")
                .extracting(e -> ((CompilationException) e).getErrorCode())
                .isEqualTo(CompilerErrorCode.TYPE_MISMATCH);
        List<Diagnostic> errors = analyzer.getDiagnostics().getDiagnostics();
        assertThat(errors).hasSize(1);
        assertThat(errors.get(0).lineNumber()).isEqualTo(3);
    }

    @Test
    void testReturnValueRulesForVoidFunctions() {
        Block valueFromVoid = block(function(voidType(), "f", List.of(), ret(lit(1))));
        Block bareFromInt = block(function(intType(), "g", List.of(), ret(null)));
        Block bareFromVoid = block(function(voidType(), "h", List.of(), ret(null)));

        assertThatThrownBy(() -> analyzer.analyze(valueFromVoid, new Ain(4), "test"))
                .isInstanceOf(CompilationException.class);
        assertThatThrownBy(() -> analyzer.analyze(bareFromInt, new Ain(4), "test"))
                .isInstanceOf(CompilationException.class);
        assertDoesNotThrow(() -> analyzer.analyze(bareFromVoid, new Ain(4), "test"));
    }

    /**
     * Verifies that a reused analyzer reports only the error of the program it is analyzing.
     */
    @Test
    void testEachRunReportsOnlyItsOwnError() {
        // Arrange
        Block first = block(function(intType(), "f", List.of(), ret(str("x"))));
        Block second = block(function(voidType(), "g", List.of(), ret(lit(1))));

        // Act & Assert
        assertThatThrownBy(() -> analyzer.analyze(first, new Ain(4), "one"))
                .isInstanceOf(CompilationException.class);
        assertThat(analyzer.getDiagnostics().getDiagnostics()).hasSize(1);

        assertThatThrownBy(() -> analyzer.analyze(second, new Ain(4), "two"))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("Void function 'g' cannot return a value")
                .hasMessageNotContaining("expected int, got string");
        assertThat(analyzer.getDiagnostics().getDiagnostics()).hasSize(1);
    }

    @Test
    void testNonConstantGlobalInitializerIsRejected() {
        Block root = block(var(intType(), "a", lit(1)), var(intType(), "b", id("a")));

        assertThatThrownBy(() -> analyzer.analyze(root, new Ain(4), "test"))
                .isInstanceOf(CompilationException.class)
                .extracting(e -> ((CompilationException) e).getErrorCode())
                .isEqualTo(CompilerErrorCode.NON_CONSTANT_INITIALIZER);
    }

    @Test
    void testFoldingCanBeDisabled() {
        StaticAnalyzer strict = new StaticAnalyzer(new AnalyzerOptions(false, true, 1, false, Path.of("unused")));
        Block root = block(var(intType(), "a", bin(BinaryOperator.ADD, lit(1), lit(2))));

        assertThatThrownBy(() -> strict.analyze(root, new Ain(4), "test"))
                .isInstanceOf(CompilationException.class)
                .extracting(e -> ((CompilationException) e).getErrorCode())
                .isEqualTo(CompilerErrorCode.NON_CONSTANT_INITIALIZER);
    }

    /**
     * Verifies that a failure in the first pass stops the analysis before any function or global is registered.
     */
    @Test
    void testTypedefFailureStopsBeforeRegistration() {
        // Arrange
        AinObjectModelAdapter model = spy(new AinObjectModelAdapter(new Ain(4)));
        Block root = block(
                Declaration.typedef("Bar", TypeSpecifier.struct("Foo")),
                var(TypeSpecifier.typedef("Bar"), "v"),
                structDef("Foo", var(intType(), "a")),
                function(intType(), "f", List.of(), ret(lit(0))));

        // Act & Assert
        assertThatThrownBy(() -> analyzer.analyze(root, model, "test"))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("Failed to resolve typedef \"Bar\"")
                .extracting(e -> ((CompilationException) e).getErrorCode())
                .isEqualTo(CompilerErrorCode.UNRESOLVED_TYPEDEF);
        verify(model, never()).addFunction(any());
        verify(model, never()).addGlobal(anyString());
    }

    @Test
    void testInternalErrorsAreWrapped() {
        Declaration shared = var(intType(), "x");
        // the same node twice cannot receive two variable indices
        Block root = block(function(voidType(), "f", List.of(), shared, shared));

        assertThatThrownBy(() -> analyzer.analyze(root, new Ain(4), "test"))
                .isInstanceOf(CompilationException.class)
                .hasCauseInstanceOf(IllegalStateException.class)
                .extracting(e -> ((CompilationException) e).getErrorCode())
                .isEqualTo(CompilerErrorCode.INTERNAL_ERROR);
    }

    @Test
    void testObjectModelIsDumpedWhenEnabled(@TempDir Path dumpDir) throws CompilationException {
        StaticAnalyzer dumping = new StaticAnalyzer(new AnalyzerOptions(true, true, 1, true, dumpDir));

        dumping.analyze(block(var(intType(), "g", lit(7))), new Ain(4), "prog/main.jaf");

        Path dump = dumpDir.resolve("prog_main.jaf").resolve("object_model.json");
        assertThat(dump).exists();
        assertThat(dump).content().contains("\"g\"");
    }
}

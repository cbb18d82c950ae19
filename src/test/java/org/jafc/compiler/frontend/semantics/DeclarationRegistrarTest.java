package org.jafc.compiler.frontend.semantics;

import org.jafc.ain.Ain;
import org.jafc.ain.AinFunction;
import org.jafc.ain.AinType;
import org.jafc.ain.AinVariable;
import org.jafc.compiler.ain.AinObjectModelAdapter;
import org.jafc.compiler.ain.IObjectModel;
import org.jafc.compiler.api.CompilerErrorCode;
import org.jafc.compiler.diagnostics.SemanticException;
import org.jafc.compiler.frontend.parser.ast.BreakStatement;
import org.jafc.compiler.frontend.parser.ast.CaseStatement;
import org.jafc.compiler.frontend.parser.ast.CompoundStatement;
import org.jafc.compiler.frontend.parser.ast.Declaration;
import org.jafc.compiler.frontend.parser.ast.DefaultStatement;
import org.jafc.compiler.frontend.parser.ast.DoWhileStatement;
import org.jafc.compiler.frontend.parser.ast.ForStatement;
import org.jafc.compiler.frontend.parser.ast.FunctionDeclaration;
import org.jafc.compiler.frontend.parser.ast.IfStatement;
import org.jafc.compiler.frontend.parser.ast.LabeledStatement;
import org.jafc.compiler.frontend.parser.ast.SwitchStatement;
import org.jafc.compiler.frontend.parser.ast.TypeSpecifier;
import org.jafc.compiler.frontend.parser.ast.WhileStatement;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.jafc.compiler.frontend.AstBuilder.block;
import static org.jafc.compiler.frontend.AstBuilder.floatType;
import static org.jafc.compiler.frontend.AstBuilder.function;
import static org.jafc.compiler.frontend.AstBuilder.id;
import static org.jafc.compiler.frontend.AstBuilder.intType;
import static org.jafc.compiler.frontend.AstBuilder.lit;
import static org.jafc.compiler.frontend.AstBuilder.stringType;
import static org.jafc.compiler.frontend.AstBuilder.var;
import static org.jafc.compiler.frontend.AstBuilder.voidType;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;

/**
 * Contains unit tests for the {@link DeclarationRegistrar}, focusing on the layout of
 * function variable tables and the registration of globals.
 */
@Tag("unit")
@ExtendWith(MockitoExtension.class)
class DeclarationRegistrarTest {

    @Mock
    private IObjectModel mockModel;

    /**
     * Verifies that a function is handed to the object model as one complete record
     * and that the returned index is written back.
     */
    @Test
    void testFunctionRecordIsAddedOnceComplete() {
        // Arrange
        when(mockModel.getVersion()).thenReturn(4);
        when(mockModel.addFunction(any())).thenReturn(7);
        FunctionDeclaration f = function(voidType(), "main", List.of(), var(intType(), "local"));

        // Act
        new DeclarationRegistrar(mockModel).register(block(f));

        // Assert
        ArgumentCaptor<AinFunction> captor = ArgumentCaptor.forClass(AinFunction.class);
        verify(mockModel).addFunction(captor.capture());
        assertThat(captor.getValue().getName()).isEqualTo("main");
        assertThat(captor.getValue().getVars()).extracting(AinVariable::getName).containsExactly("local");
        assertThat(f.funcNo()).isEqualTo(7);
        verify(mockModel, never()).addGlobal(anyString());
    }

    /**
     * Verifies that arguments come first, followed by all locals of nested statements
     * in the order they appear in the source.
     */
    @Test
    void testVariableTableListsArgumentsThenLocalsInSourceOrder() {
        // Arrange
        Declaration a = var(intType(), "a");
        Declaration b = var(floatType(), "b");
        Declaration x = var(intType(), "x");
        Declaration y = var(intType(), "y");
        Declaration z = var(stringType(), "z");
        Declaration i = var(intType(), "i", lit(0));
        Declaration w = var(intType(), "w");
        Declaration s = var(intType(), "s");
        Declaration u = var(floatType(), "u");
        FunctionDeclaration f = function(intType(), "f", List.of(a, b),
                x,
                new IfStatement(id("a"), new CompoundStatement(block(y)), new CompoundStatement(block(z))),
                new ForStatement(block(i), null, null, new CompoundStatement(block(w))),
                new SwitchStatement(id("a"), block(s, new CaseStatement(lit(1), new BreakStatement()))),
                new WhileStatement(id("a"), new CompoundStatement(block(u))));
        Ain ain = new Ain(4);

        // Act
        new DeclarationRegistrar(new AinObjectModelAdapter(ain)).register(block(f));

        // Assert
        assertThat(ain.getFunctions()).hasSize(1);
        AinFunction record = ain.getFunctions().get(0);
        assertThat(record.getNrArgs()).isEqualTo(2);
        assertThat(record.getNrVars()).isEqualTo(9);
        assertThat(record.getReturnType()).isEqualTo(AinType.INT);
        assertThat(record.getVars()).extracting(AinVariable::getName)
                .containsExactly("a", "b", "x", "y", "z", "i", "w", "s", "u");
        assertThat(List.of(a, b, x, y, z, i, w, s, u)).extracting(Declaration::varNo)
                .containsExactly(0, 1, 2, 3, 4, 5, 6, 7, 8);
        assertThat(f.funcNo()).isZero();
    }

    /**
     * Verifies that locals under labels, do-while bodies, default clauses and bare if branches
     * are collected in source order.
     */
    @Test
    void testLocalsUnderEveryStatementKindAreCollected() {
        // Arrange
        Declaration labeled = var(intType(), "l");
        Declaration then = var(intType(), "t");
        Declaration otherwise = var(floatType(), "e");
        Declaration loop = var(intType(), "d");
        Declaration fallback = var(stringType(), "f");
        FunctionDeclaration f = function(voidType(), "g", List.of(),
                new LabeledStatement("start", labeled),
                new IfStatement(id("l"), then, otherwise),
                new DoWhileStatement(id("l"), new CompoundStatement(block(loop))),
                new SwitchStatement(id("l"), block(new DefaultStatement(fallback))));
        Ain ain = new Ain(4);

        // Act
        new DeclarationRegistrar(new AinObjectModelAdapter(ain)).register(block(f));

        // Assert
        AinFunction record = ain.getFunctions().get(0);
        assertThat(record.getNrArgs()).isZero();
        assertThat(record.getVars()).extracting(AinVariable::getName)
                .containsExactly("l", "t", "e", "d", "f");
        assertThat(List.of(labeled, then, otherwise, loop, fallback)).extracting(Declaration::varNo)
                .containsExactly(0, 1, 2, 3, 4);
    }

    @Test
    void testShadowingLocalsGetSeparateSlots() {
        Declaration outer = var(intType(), "v");
        Declaration inner = var(floatType(), "v");
        FunctionDeclaration f = function(voidType(), "f", List.of(), outer, new CompoundStatement(block(inner)));
        Ain ain = new Ain(4);

        new DeclarationRegistrar(new AinObjectModelAdapter(ain)).register(block(f));

        assertThat(ain.getFunctions().get(0).getVars())
                .extracting(AinVariable::getType)
                .containsExactly(AinType.INT, AinType.FLOAT);
        assertThat(inner.varNo()).isEqualTo(1);
    }

    /**
     * Verifies that a function defined inside another function is rejected and nothing is registered.
     */
    @Test
    void testNestedFunctionIsRejected() {
        // Arrange
        FunctionDeclaration inner = function(voidType(), "inner", List.of());
        FunctionDeclaration outer = function(voidType(), "outer", List.of(), inner);
        Ain ain = new Ain(4);

        // Act & Assert
        assertThatThrownBy(() -> new DeclarationRegistrar(new AinObjectModelAdapter(ain)).register(block(outer)))
                .isInstanceOf(SemanticException.class)
                .extracting(e -> ((SemanticException) e).getCode())
                .isEqualTo(CompilerErrorCode.NESTED_FUNCTION);
        assertThat(ain.getFunctions()).isEmpty();
    }

    @Test
    void testGlobalsAreRegisteredInOrderSkippingTypedefs() {
        Declaration g = var(intType(), "g", lit(1));
        Declaration h = var(stringType(), "h");
        Ain ain = new Ain(4);

        new DeclarationRegistrar(new AinObjectModelAdapter(ain))
                .register(block(g, Declaration.typedef("Alias", TypeSpecifier.struct(0)), h));

        assertThat(ain.getGlobals()).extracting(AinVariable::getName).containsExactly("g", "h");
        assertThat(ain.getGlobals()).extracting(AinVariable::getType).containsExactly(AinType.INT, AinType.STRING);
        assertThat(g.varNo()).isZero();
        assertThat(h.varNo()).isEqualTo(1);
    }

    /**
     * Verifies that version 12 objects carry an empty secondary name and older ones none.
     */
    @Test
    void testSecondaryNameDependsOnVersion() {
        // Arrange
        Ain v12 = new Ain(12);
        Ain v11 = new Ain(11);

        // Act
        new DeclarationRegistrar(new AinObjectModelAdapter(v12))
                .register(block(var(intType(), "g"), function(voidType(), "f", List.of(var(intType(), "p")))));
        new DeclarationRegistrar(new AinObjectModelAdapter(v11))
                .register(block(var(intType(), "g"), function(voidType(), "f", List.of(var(intType(), "p")))));

        // Assert
        assertThat(v12.getGlobals().get(0).getName2()).isEmpty();
        assertThat(v12.getFunctions().get(0).getVars().get(0).getName2()).isEmpty();
        assertThat(v11.getGlobals().get(0).getName2()).isNull();
        assertThat(v11.getFunctions().get(0).getVars().get(0).getName2()).isNull();
    }

    @Test
    void testUnnamedParameterIsRejected() {
        FunctionDeclaration f = function(voidType(), "f", List.of(new Declaration(null, intType())));

        assertThatThrownBy(() -> new DeclarationRegistrar(new AinObjectModelAdapter(new Ain(4))).register(block(f)))
                .isInstanceOf(SemanticException.class)
                .extracting(e -> ((SemanticException) e).getCode())
                .isEqualTo(CompilerErrorCode.MALFORMED_DECLARATION);
    }
}

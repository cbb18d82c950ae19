package org.jafc.compiler.frontend.semantics;

import org.jafc.ain.Ain;
import org.jafc.ain.AinStruct;
import org.jafc.ain.AinType;
import org.jafc.ain.AinVariable;
import org.jafc.compiler.ain.AinObjectModelAdapter;
import org.jafc.compiler.api.CompilerErrorCode;
import org.jafc.compiler.diagnostics.SemanticException;
import org.jafc.compiler.frontend.parser.ast.Block;
import org.jafc.compiler.frontend.parser.ast.Declaration;
import org.jafc.compiler.frontend.parser.ast.JafType;
import org.jafc.compiler.frontend.parser.ast.TypeSpecifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.jafc.compiler.frontend.AstBuilder.block;
import static org.jafc.compiler.frontend.AstBuilder.function;
import static org.jafc.compiler.frontend.AstBuilder.intType;
import static org.jafc.compiler.frontend.AstBuilder.stringType;
import static org.jafc.compiler.frontend.AstBuilder.structDef;
import static org.jafc.compiler.frontend.AstBuilder.var;

/**
 * Contains unit tests for the {@link TypeResolver}: structure definitions, typedef
 * aliases and the errors for unsupported or unresolvable types.
 */
@Tag("unit")
class TypeResolverTest {

    private Ain ain;
    private TypeResolver resolver;

    @BeforeEach
    void setUp() {
        ain = new Ain(4);
        resolver = new TypeResolver(new AinObjectModelAdapter(ain));
    }

    /**
     * Verifies that an inline structure definition creates the structure with its members in order.
     */
    @Test
    void testStructDefinitionCreatesMembersInOrder() {
        // Arrange
        Block root = block(structDef("Foo", var(intType(), "a"), var(stringType(), "b")));

        // Act
        resolver.resolve(root);

        // Assert
        assertThat(ain.getStructures()).hasSize(1);
        assertThat(ain.getStructures().get(0).getName()).isEqualTo("Foo");
        assertThat(ain.getStructures().get(0).getMembers())
                .extracting(AinVariable::getName, AinVariable::getType)
                .containsExactly(tuple("a", AinType.INT), tuple("b", AinType.STRING));
    }

    @Test
    void testStructMemberOfStructType() {
        Block root = block(
                structDef("Inner", var(intType(), "x")),
                structDef("Outer", var(TypeSpecifier.struct("Inner"), "inner")));

        resolver.resolve(root);

        assertThat(ain.getStructures().get(1).getMembers().get(0).getType()).isEqualTo(AinType.struct(0));
    }

    /**
     * Verifies that the enclosing structure is numbered before a structure defined among its members.
     */
    @Test
    void testNestedStructDefinitionIsNumberedAfterEnclosingStruct() {
        // Arrange
        Declaration nested = new Declaration("b", TypeSpecifier.struct("B", block(var(intType(), "x"))));
        Block root = block(structDef("A", nested, var(intType(), "y")));

        // Act
        resolver.resolve(root);

        // Assert
        assertThat(ain.getStructures()).extracting(AinStruct::getName).containsExactly("A", "B");
        assertThat(ain.getStructures().get(0).getMembers())
                .extracting(AinVariable::getName, AinVariable::getType)
                .containsExactly(tuple("b", AinType.struct(1)), tuple("y", AinType.INT));
        assertThat(ain.getStructures().get(1).getMembers())
                .extracting(AinVariable::getName)
                .containsExactly("x");
    }

    /**
     * Verifies that defining a structure twice fails and keeps only the first definition.
     */
    @Test
    void testRedefinedStructIsRejected() {
        // Arrange
        Block root = block(structDef("Foo", var(intType(), "a")), structDef("Foo", var(intType(), "b")));

        // Act & Assert
        assertThatThrownBy(() -> resolver.resolve(root))
                .isInstanceOf(SemanticException.class)
                .extracting(e -> ((SemanticException) e).getCode())
                .isEqualTo(CompilerErrorCode.STRUCT_REDEFINED);
        assertThat(ain.getStructures()).hasSize(1);
        assertThat(ain.getStructures().get(0).getMembers()).extracting(AinVariable::getName).containsExactly("a");
    }

    @Test
    void testAnonymousStructIsRejected() {
        Block root = block(new Declaration("v", TypeSpecifier.struct(null, block(var(intType(), "a")))));

        assertThatThrownBy(() -> resolver.resolve(root))
                .isInstanceOf(SemanticException.class)
                .extracting(e -> ((SemanticException) e).getCode())
                .isEqualTo(CompilerErrorCode.ANONYMOUS_STRUCT);
        assertThat(ain.getStructures()).isEmpty();
    }

    @Test
    void testEnumIsRejected() {
        Block root = block(var(TypeSpecifier.enumeration("Color"), "c"));

        assertThatThrownBy(() -> resolver.resolve(root))
                .isInstanceOf(SemanticException.class)
                .extracting(e -> ((SemanticException) e).getCode())
                .isEqualTo(CompilerErrorCode.ENUM_NOT_SUPPORTED);
    }

    /**
     * Verifies that a typedef alias resolves to the structure it names, including chained aliases.
     */
    @Test
    void testTypedefAliasResolvesToStruct() {
        // Arrange
        TypeSpecifier viaAlias = TypeSpecifier.typedef("Bar");
        TypeSpecifier viaChain = TypeSpecifier.typedef("Baz");
        Block root = block(
                structDef("Foo", var(intType(), "a")),
                Declaration.typedef("Bar", TypeSpecifier.struct("Foo")),
                Declaration.typedef("Baz", TypeSpecifier.typedef("Bar")),
                var(viaAlias, "v"),
                var(viaChain, "w"));

        // Act
        resolver.resolve(root);

        // Assert
        assertThat(viaAlias.type()).isEqualTo(JafType.STRUCT);
        assertThat(viaAlias.structNo()).isZero();
        assertThat(viaChain.structNo()).isZero();
    }

    @Test
    void testTypedefWithInlineDefinitionCreatesStruct() {
        TypeSpecifier use = TypeSpecifier.typedef("Point");
        Block root = block(
                Declaration.typedef("Point", TypeSpecifier.struct("point_s", block(var(intType(), "x"), var(intType(), "y")))),
                var(use, "p"));

        resolver.resolve(root);

        assertThat(ain.getStructures()).extracting(s -> s.getName()).containsExactly("point_s");
        assertThat(use.structNo()).isZero();
    }

    @Test
    void testTypedefNamedLikeStructResolvesWithoutAlias() {
        TypeSpecifier use = TypeSpecifier.typedef("Foo");
        Block root = block(structDef("Foo", var(intType(), "a")), var(use, "f"));

        resolver.resolve(root);

        assertThat(use.isResolved()).isTrue();
        assertThat(use.structNo()).isZero();
    }

    /**
     * Verifies that using an alias before its structure is defined fails with the typedef's name in the message.
     */
    @Test
    void testTypedefUsedBeforeStructDefinitionFails() {
        // Arrange
        Block root = block(
                Declaration.typedef("Bar", TypeSpecifier.struct("Foo")),
                var(TypeSpecifier.typedef("Bar"), "v"),
                structDef("Foo", var(intType(), "a")));

        // Act & Assert
        assertThatThrownBy(() -> resolver.resolve(root))
                .isInstanceOf(SemanticException.class)
                .hasMessageContaining("Failed to resolve typedef \"Bar\"")
                .extracting(e -> ((SemanticException) e).getCode())
                .isEqualTo(CompilerErrorCode.UNRESOLVED_TYPEDEF);
        assertThat(ain.getStructures()).isEmpty();
    }

    @Test
    void testUndefinedStructReferenceFails() {
        Block root = block(var(TypeSpecifier.struct("Missing"), "m"));

        assertThatThrownBy(() -> resolver.resolve(root))
                .isInstanceOf(SemanticException.class)
                .extracting(e -> ((SemanticException) e).getCode())
                .isEqualTo(CompilerErrorCode.UNRESOLVED_STRUCT);
    }

    @Test
    void testStructsInsideFunctionBodiesAreDefined() {
        Block root = block(function(intType(), "f", List.of(), structDef("Local", var(intType(), "a"))));

        resolver.resolve(root);

        assertThat(ain.getStructures()).extracting(s -> s.getName()).containsExactly("Local");
    }
}

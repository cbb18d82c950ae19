package org.jafc.compiler.frontend.semantics;

import org.jafc.ain.AinDataType;
import org.jafc.ain.AinType;
import org.jafc.ain.AinVariable;
import org.jafc.compiler.api.CompilerErrorCode;
import org.jafc.compiler.api.SourceInfo;
import org.jafc.compiler.diagnostics.SemanticException;
import org.jafc.compiler.frontend.parser.ast.Declaration;
import org.jafc.compiler.frontend.parser.ast.JafType;
import org.jafc.compiler.frontend.parser.ast.TypeSpecifier;

/**
 * Maps resolved syntax tree types onto object model types.
 */
public final class TypeConversions {

    /** Object versions from this one on carry a secondary variable name. */
    public static final int NAME2_VERSION = 12;

    private TypeConversions() {}

    /**
     * @param type A type tag.
     * @param where The location used for error reporting, may be null.
     * @return The matching object model data type.
     * @throws SemanticException for enums and unresolved typedefs.
     */
    public static AinDataType toDataType(JafType type, SourceInfo where) {
        return switch (type) {
            case VOID -> AinDataType.VOID;
            case INT -> AinDataType.INT;
            case FLOAT -> AinDataType.FLOAT;
            case STRING -> AinDataType.STRING;
            case STRUCT -> AinDataType.STRUCT;
            case ENUM -> throw new SemanticException(CompilerErrorCode.ENUM_NOT_SUPPORTED, "Enums not supported", where);
            case TYPEDEF -> throw new SemanticException(CompilerErrorCode.UNKNOWN_TYPE, "Unresolved type: " + type, where);
        };
    }

    /**
     * @param spec A type specifier that has been through type resolution.
     * @param where The location used for error reporting, may be null.
     * @return The object model type.
     */
    public static AinType toAinType(TypeSpecifier spec, SourceInfo where) {
        if (spec == null) {
            throw new SemanticException(CompilerErrorCode.MALFORMED_DECLARATION, "Declaration without type", where);
        }
        AinDataType data = toDataType(spec.type(), where);
        if (data != AinDataType.STRUCT) {
            return AinType.of(data);
        }
        if (spec.structNo() == TypeSpecifier.UNRESOLVED) {
            throw new SemanticException(CompilerErrorCode.UNRESOLVED_STRUCT,
                    "Unresolved struct type '" + spec.name() + "'", where);
        }
        return AinType.struct(spec.structNo());
    }

    /**
     * Creates the object model entry for a declared variable.
     * @param decl The named declaration.
     * @param version The object version.
     * @return A new variable.
     */
    public static AinVariable toVariable(Declaration decl, int version) {
        if (!decl.hasName()) {
            throw new SemanticException(CompilerErrorCode.MALFORMED_DECLARATION, "Declaration without name", decl.sourceInfo());
        }
        return new AinVariable(decl.name(), version >= NAME2_VERSION ? "" : null, toAinType(decl.type(), decl.sourceInfo()));
    }
}

package org.jafc.compiler.frontend.semantics;

import org.jafc.ain.AinVariable;
import org.jafc.compiler.ain.IObjectModel;
import org.jafc.compiler.api.CompilerErrorCode;
import org.jafc.compiler.api.SourceInfo;
import org.jafc.compiler.diagnostics.CompilerLogger;
import org.jafc.compiler.diagnostics.SemanticException;
import org.jafc.compiler.frontend.BlockWalker;
import org.jafc.compiler.frontend.parser.ast.Block;
import org.jafc.compiler.frontend.parser.ast.BlockItem;
import org.jafc.compiler.frontend.parser.ast.Declaration;
import org.jafc.compiler.frontend.parser.ast.FunctionDeclaration;
import org.jafc.compiler.frontend.parser.ast.JafType;
import org.jafc.compiler.frontend.parser.ast.TypeSpecifier;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Pass 1: resolves typedef and structure names to structure indices and creates
 * the structures defined inline in declarations.
 * <p>
 * Typedef declarations only record an alias; the aliased structure is looked up when
 * the alias is used, so the structure has to be defined before its first use.
 * A structure is created, and gets its index, before its member types are resolved,
 * so structures defined among its members are numbered after it.
 */
public class TypeResolver extends BlockWalker {

    private final IObjectModel model;
    private final Map<String, String> typedefAliases = new HashMap<>();

    public TypeResolver(IObjectModel model) {
        this.model = model;
    }

    /**
     * Resolves all types reachable from the given root block.
     * @param root The translation unit.
     */
    public void resolve(Block root) {
        walk(root);
        CompilerLogger.debug("TypeResolver: " + model.getStructCount() + " struct(s), "
                + typedefAliases.size() + " typedef(s)");
    }

    @Override
    protected void visitDeclaration(Declaration decl) {
        if (decl.isTypedef()) {
            defineTypedef(decl);
        } else {
            resolveType(decl.type(), decl.sourceInfo());
        }
    }

    @Override
    protected void visitFunction(FunctionDeclaration function) {
        resolveType(function.returnType(), function.sourceInfo());
        for (Declaration param : function.parameters()) {
            visitDeclaration(param);
        }
        walk(function.body());
    }

    private void defineTypedef(Declaration decl) {
        TypeSpecifier type = decl.type();
        if (type == null || !decl.hasName()) {
            throw new SemanticException(CompilerErrorCode.MALFORMED_DECLARATION, "Malformed typedef", decl.sourceInfo());
        }
        String target;
        if (type.type() == JafType.STRUCT) {
            if (type.hasDefinition()) {
                defineStruct(type, decl.sourceInfo());
            }
            target = type.name();
        } else if (type.type() == JafType.TYPEDEF) {
            target = typedefAliases.getOrDefault(type.name(), type.name());
        } else if (type.type() == JafType.ENUM) {
            throw new SemanticException(CompilerErrorCode.ENUM_NOT_SUPPORTED, "Enums not supported", decl.sourceInfo());
        } else {
            throw new SemanticException(CompilerErrorCode.UNKNOWN_TYPE,
                    "Typedef '" + decl.name() + "' must name a struct, not " + type, decl.sourceInfo());
        }
        if (target == null) {
            throw new SemanticException(CompilerErrorCode.ANONYMOUS_STRUCT, "Anonymous structs not supported", decl.sourceInfo());
        }
        typedefAliases.put(decl.name(), target);
        CompilerLogger.trace("TypeResolver: typedef " + decl.name() + " -> " + target);
    }

    private void resolveType(TypeSpecifier type, SourceInfo where) {
        if (type == null) {
            throw new SemanticException(CompilerErrorCode.MALFORMED_DECLARATION, "Declaration without type", where);
        }
        switch (type.type()) {
            case TYPEDEF -> resolveTypedef(type, where);
            case STRUCT -> {
                if (type.hasDefinition()) {
                    defineStruct(type, where);
                } else if (!type.isResolved()) {
                    int structNo = model.getStructNo(type.name()).orElseThrow(() -> new SemanticException(
                            CompilerErrorCode.UNRESOLVED_STRUCT, "Undefined struct '" + type.name() + "'", where));
                    type.resolveToStruct(structNo);
                }
            }
            case ENUM -> throw new SemanticException(CompilerErrorCode.ENUM_NOT_SUPPORTED, "Enums not supported", where);
            default -> {
                // primitive types need no resolution
            }
        }
    }

    private void resolveTypedef(TypeSpecifier type, SourceInfo where) {
        String structName = typedefAliases.getOrDefault(type.name(), type.name());
        Optional<Integer> structNo = structName == null ? Optional.empty() : model.getStructNo(structName);
        if (structNo.isEmpty()) {
            throw new SemanticException(CompilerErrorCode.UNRESOLVED_TYPEDEF,
                    "Failed to resolve typedef \"" + type.name() + "\"", where);
        }
        type.resolveToStruct(structNo.get());
    }

    private void defineStruct(TypeSpecifier type, SourceInfo where) {
        if (type.name() == null) {
            throw new SemanticException(CompilerErrorCode.ANONYMOUS_STRUCT, "Anonymous structs not supported", where);
        }
        checkNotDefined(type.name(), where);
        int structNo = model.addStruct(type.name());
        type.resolveToStruct(structNo);

        // nested definitions among the members get later indices
        List<AinVariable> members = new ArrayList<>();
        for (BlockItem item : type.definition().items()) {
            if (!(item instanceof Declaration member) || !member.hasName()) {
                throw new SemanticException(CompilerErrorCode.MALFORMED_DECLARATION,
                        "Invalid member declaration in struct '" + type.name() + "'", where);
            }
            resolveType(member.type(), member.sourceInfo());
            members.add(TypeConversions.toVariable(member, model.getVersion()));
        }
        model.getStruct(structNo).setMembers(members);
        CompilerLogger.trace("TypeResolver: struct " + type.name() + " #" + structNo + " with " + members.size() + " member(s)");
    }

    private void checkNotDefined(String structName, SourceInfo where) {
        if (model.hasStruct(structName)) {
            throw new SemanticException(CompilerErrorCode.STRUCT_REDEFINED,
                    "Redefining struct '" + structName + "' not supported", where);
        }
    }
}

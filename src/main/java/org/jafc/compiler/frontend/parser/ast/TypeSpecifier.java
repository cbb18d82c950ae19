package org.jafc.compiler.frontend.parser.ast;

/**
 * The type part of a declaration.
 * <p>
 * A structure type may carry an inline member definition, in which case the declaration
 * defines a new structure. A {@link JafType#TYPEDEF} specifier is rewritten to a resolved
 * {@link JafType#STRUCT} by the type resolver, which also fills in the structure index.
 */
public final class TypeSpecifier {

    /** Marker for a structure index that has not been resolved yet. */
    public static final int UNRESOLVED = -1;

    private JafType type;
    private final String name;
    private final Block definition;
    private int structNo = UNRESOLVED;

    private TypeSpecifier(JafType type, String name, Block definition) {
        if (type == null) {
            throw new IllegalArgumentException("type tag must not be null");
        }
        this.type = type;
        this.name = name;
        this.definition = definition;
    }

    public static TypeSpecifier of(JafType type) {
        return new TypeSpecifier(type, null, null);
    }

    /**
     * A reference to a structure by name, without a member definition.
     */
    public static TypeSpecifier struct(String name) {
        return new TypeSpecifier(JafType.STRUCT, name, null);
    }

    /**
     * A structure definition. {@code name} may be null for an anonymous structure.
     */
    public static TypeSpecifier struct(String name, Block definition) {
        return new TypeSpecifier(JafType.STRUCT, name, definition);
    }

    /**
     * A structure that an earlier stage already resolved to an index.
     */
    public static TypeSpecifier struct(int structNo) {
        TypeSpecifier specifier = new TypeSpecifier(JafType.STRUCT, null, null);
        specifier.structNo = structNo;
        return specifier;
    }

    public static TypeSpecifier typedef(String name) {
        return new TypeSpecifier(JafType.TYPEDEF, name, null);
    }

    public static TypeSpecifier enumeration(String name) {
        return new TypeSpecifier(JafType.ENUM, name, null);
    }

    public JafType type() {
        return type;
    }

    /**
     * @return The structure or typedef name, or null.
     */
    public String name() {
        return name;
    }

    /**
     * @return The inline member definitions, or null if this specifier does not define a structure.
     */
    public Block definition() {
        return definition;
    }

    public boolean hasDefinition() {
        return definition != null;
    }

    public int structNo() {
        return structNo;
    }

    public boolean isResolved() {
        return type != JafType.TYPEDEF && (type != JafType.STRUCT || structNo != UNRESOLVED);
    }

    /**
     * Binds this specifier to a structure. The index can only be assigned once.
     *
     * @param structNo The structure index in the object model.
     * @throws IllegalStateException if a different index was already assigned.
     */
    public void resolveToStruct(int structNo) {
        if (structNo < 0) {
            throw new IllegalArgumentException("Invalid struct index: " + structNo);
        }
        if (this.structNo != UNRESOLVED && this.structNo != structNo) {
            throw new IllegalStateException("Struct index of '" + name + "' already assigned: " + this.structNo);
        }
        this.type = JafType.STRUCT;
        this.structNo = structNo;
    }

    @Override
    public String toString() {
        return switch (type) {
            case STRUCT -> "struct " + (name != null ? name : "#" + structNo);
            case TYPEDEF, ENUM -> type.name().toLowerCase() + " " + name;
            default -> type.name().toLowerCase();
        };
    }
}

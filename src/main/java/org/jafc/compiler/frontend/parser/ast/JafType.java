package org.jafc.compiler.frontend.parser.ast;

/**
 * The type tags a {@link TypeSpecifier} can carry.
 */
public enum JafType {
    VOID,
    INT,
    FLOAT,
    STRING,
    STRUCT,
    /** Enumerated types are parsed but rejected by the analyzer. */
    ENUM,
    /** An alias name; replaced by {@link #STRUCT} during type resolution. */
    TYPEDEF
}

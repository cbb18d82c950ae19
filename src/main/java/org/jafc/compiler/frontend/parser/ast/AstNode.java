package org.jafc.compiler.frontend.parser.ast;

import org.jafc.compiler.api.SourceInfo;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 */
public interface AstNode {
    /**
     * Returns the position of this node in the source.
     *
     * @return The source position, or null if the parser did not record one.
     */
    default SourceInfo sourceInfo() {
        return null;
    }
}

package org.jafc.compiler.frontend.parser.ast;

/**
 * A nested block {@code { ... }} that opens its own scope.
 *
 * @param block The items of the block.
 */
public record CompoundStatement(Block block) implements BlockItem {
}

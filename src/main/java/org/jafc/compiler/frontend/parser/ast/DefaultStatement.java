package org.jafc.compiler.frontend.parser.ast;

/**
 * {@code default: statement} inside a switch body.
 *
 * @param statement The statement following the label.
 */
public record DefaultStatement(BlockItem statement) implements BlockItem {
}

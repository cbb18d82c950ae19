package org.jafc.compiler.frontend.parser.ast;

/**
 * {@code label: statement}
 *
 * @param label The label name.
 * @param statement The labeled statement.
 */
public record LabeledStatement(String label, BlockItem statement) implements BlockItem {
}

package org.jafc.compiler.frontend.parser.ast;

/**
 * {@code goto label;}
 *
 * @param label The target label.
 */
public record GotoStatement(String label) implements BlockItem {
}

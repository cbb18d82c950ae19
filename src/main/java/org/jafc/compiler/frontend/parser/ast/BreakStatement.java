package org.jafc.compiler.frontend.parser.ast;

public record BreakStatement() implements BlockItem {
}

package org.jafc.compiler.frontend.parser.ast;

public record ContinueStatement() implements BlockItem {
}

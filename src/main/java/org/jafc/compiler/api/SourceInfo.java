package org.jafc.compiler.api;

/**
 * A pure data class representing a position in the source code.
 * It is part of the public compiler API and free of implementation details.
 *
 * @param fileName The file where the code is located.
 * @param lineNumber The line number.
 * @param columnNumber The column number, or 0 if unknown.
 */
public record SourceInfo(String fileName, int lineNumber, int columnNumber) {

    @Override
    public String toString() {
        return columnNumber > 0
                ? String.format("%s:%d:%d", fileName, lineNumber, columnNumber)
                : String.format("%s:%d", fileName, lineNumber);
    }
}

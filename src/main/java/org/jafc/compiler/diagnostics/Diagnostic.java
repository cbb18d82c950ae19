package org.jafc.compiler.diagnostics;

import org.jafc.compiler.api.CompilerErrorCode;

/**
 * Represents a single diagnostic message that occurs during the compilation process.
 * Analysis stops at its first error, so this stage only ever reports errors.
 *
 * @param type The type of the diagnostic.
 * @param code The error code.
 * @param message The diagnostic message.
 * @param fileName The name of the file where the issue occurred.
 * @param lineNumber The line number of the issue.
 */
public record Diagnostic(
        Type type,
        CompilerErrorCode code,
        String message,
        String fileName,
        int lineNumber
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that prevents compilation. */
        ERROR
    }

    @Override
    public String toString() {
        String prefix = code != null ? String.format("[%s] %s: ", type, code) : String.format("[%s] ", type);
        return String.format("%s%s:%d: %s", prefix, fileName, lineNumber, message);
    }
}

package org.jafc.compiler.diagnostics;

import org.jafc.compiler.api.CompilerErrorCode;
import org.jafc.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting and managing diagnostic messages
 * that occur during the compilation process.
 * <p>
 * This decouples error reporting from the actual compiler logic.
 */
public class DiagnosticsEngine {

    private static final String UNKNOWN_FILE = "<unknown>";

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param code       The error code.
     * @param message    The error message.
     * @param sourceInfo Where the error occurred, may be null.
     */
    public void reportError(CompilerErrorCode code, String message, SourceInfo sourceInfo) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, code, message, fileOf(sourceInfo), lineOf(sourceInfo)));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }

    private static String fileOf(SourceInfo sourceInfo) {
        return sourceInfo != null && sourceInfo.fileName() != null ? sourceInfo.fileName() : UNKNOWN_FILE;
    }

    private static int lineOf(SourceInfo sourceInfo) {
        return sourceInfo != null ? sourceInfo.lineNumber() : 0;
    }
}

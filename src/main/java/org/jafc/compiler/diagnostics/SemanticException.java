package org.jafc.compiler.diagnostics;

import org.jafc.compiler.api.CompilerErrorCode;
import org.jafc.compiler.api.SourceInfo;

/**
 * Raised by the analysis passes on the first semantic error. Analysis is fail-fast:
 * the exception unwinds the whole pass and is converted into a diagnostic by the
 * {@link org.jafc.compiler.StaticAnalyzer}.
 */
public class SemanticException extends RuntimeException {

    private final CompilerErrorCode code;
    private final transient SourceInfo sourceInfo;

    public SemanticException(CompilerErrorCode code, String message, SourceInfo sourceInfo) {
        super(message);
        this.code = code;
        this.sourceInfo = sourceInfo;
    }

    public SemanticException(CompilerErrorCode code, String message) {
        this(code, message, null);
    }

    public CompilerErrorCode getCode() {
        return code;
    }

    /**
     * @return The location of the offending construct, or null if the parser did not record one.
     */
    public SourceInfo getSourceInfo() {
        return sourceInfo;
    }
}

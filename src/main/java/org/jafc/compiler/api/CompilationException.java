package org.jafc.compiler.api;

/**
 * An exception that is thrown when an error occurs during static analysis.
 * <p>
 * It is part of the public API and hides the internal exception types of the compiler.
 */
public class CompilationException extends Exception {

    private final CompilerErrorCode errorCode;

    /**
     * Constructs a new compilation exception with the specified error code and detail message.
     * @param errorCode The error code.
     * @param message The detail message.
     */
    public CompilationException(CompilerErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    /**
     * Constructs a new compilation exception with the specified error code, detail message and cause.
     * @param errorCode The error code.
     * @param message The detail message.
     * @param cause The cause.
     */
    public CompilationException(CompilerErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * @return The code identifying the kind of error.
     */
    public CompilerErrorCode getErrorCode() {
        return errorCode;
    }
}

package org.fluxgen.compiler.api;

/**
 * Thrown when generating source text for a definition fails.
 * <p>
 * It is part of the public API and hides the internal exception types of the generator.
 */
public class CodegenException extends Exception {

    private final CodegenErrorCode errorCode;

    /**
     * Constructs a new exception with the specified error kind and detail message.
     * @param errorCode The kind of failure.
     * @param message The detail message.
     */
    public CodegenException(CodegenErrorCode errorCode, String message) {
        super(message, null);
        this.errorCode = errorCode;
    }

    /**
     * Constructs a new exception with the specified error kind, detail message and cause.
     * @param errorCode The kind of failure.
     * @param message The detail message.
     * @param cause The cause.
     */
    public CodegenException(CodegenErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * @return The kind of failure.
     */
    public CodegenErrorCode errorCode() {
        return errorCode;
    }
}

package org.fluxgen.compiler.api;

/**
 * Failure of the external type resolver (lookup or I/O error). The generator never retries.
 */
public class ResolverException extends CodegenException {

    public ResolverException(String message) {
        super(CodegenErrorCode.RESOLVER_FAILURE, message);
    }

    public ResolverException(String message, Throwable cause) {
        super(CodegenErrorCode.RESOLVER_FAILURE, message, cause);
    }
}

package org.fluxgen.compiler.api;

/**
 * Coarse, testable kinds of code generation failures.
 */
public enum CodegenErrorCode {
    /** The data and sequence edges of a block form a cycle. */
    CYCLIC_BLOCK,
    /** A definition refers to a type or symbol that could not be resolved. */
    UNRESOLVED_REFERENCE,
    /** The external type resolver failed with a lookup or I/O error. */
    RESOLVER_FAILURE,
    /** A generated unit could not be persisted. */
    IO_ERROR_WRITING_UNIT,
    /** An unknown or unexpected error occurred. */
    UNKNOWN_ERROR
}

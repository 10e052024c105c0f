package org.fluxgen.compiler.types;

/**
 * Pointer to {@code elem}.
 */
public record PointerType(Type elem) implements Type {}

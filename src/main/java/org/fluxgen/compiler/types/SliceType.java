package org.fluxgen.compiler.types;

/**
 * Growable sequence of {@code elem}.
 */
public record SliceType(Type elem) implements Type {}

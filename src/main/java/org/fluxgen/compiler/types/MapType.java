package org.fluxgen.compiler.types;

/**
 * Hash map from {@code key} to {@code elem}.
 */
public record MapType(Type key, Type elem) implements Type {}

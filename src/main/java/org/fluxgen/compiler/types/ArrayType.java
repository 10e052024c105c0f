package org.fluxgen.compiler.types;

/**
 * Fixed-length array.
 *
 * @param length The number of elements.
 * @param elem   The element type.
 */
public record ArrayType(long length, Type elem) implements Type {}

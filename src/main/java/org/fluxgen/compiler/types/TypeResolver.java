package org.fluxgen.compiler.types;

import org.fluxgen.compiler.api.ResolverException;

/**
 * The external type-resolution authority consumed by the graph and the emitter.
 * <p>
 * Implementations may memoize across many graphs and sessions. They are not required to be
 * thread-safe; callers needing concurrent access must serialize externally.
 */
public interface TypeResolver {

    /**
     * Resolves a reference to its structural type.
     *
     * @param reference A type expression or a qualified name, e.g. {@code "map[string]fmt.Stringer"}.
     * @return The resolved type, or {@link WildcardType#INSTANCE} if the reference is unknown.
     * @throws ResolverException if the lookup itself fails (I/O, malformed source).
     */
    Type resolve(String reference) throws ResolverException;

    /**
     * @return {@code true} if both types are identical.
     */
    boolean isIdentical(Type a, Type b);

    /**
     * Hash consistent with {@link #isIdentical(Type, Type)}: identical types hash equal.
     */
    int hash(Type type);
}

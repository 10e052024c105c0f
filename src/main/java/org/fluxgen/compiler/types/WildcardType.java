package org.fluxgen.compiler.types;

/**
 * Placeholder type of a port whose concrete type cannot be derived yet.
 */
public enum WildcardType implements Type {
    INSTANCE;

    @Override
    public String toString() {
        return "?";
    }
}

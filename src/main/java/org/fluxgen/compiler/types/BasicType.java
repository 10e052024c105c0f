package org.fluxgen.compiler.types;

/**
 * A predeclared scalar type such as {@code int}, {@code bool} or {@code string}.
 *
 * @param name The predeclared name.
 * @param kind The category the type belongs to.
 */
public record BasicType(String name, Kind kind) implements Type {

    /**
     * Category of a basic type.
     */
    public enum Kind {
        BOOL,
        INTEGER,
        FLOAT,
        COMPLEX,
        STRING
    }

    @Override
    public String toString() {
        return name;
    }
}

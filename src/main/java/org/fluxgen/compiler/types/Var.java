package org.fluxgen.compiler.types;

/**
 * A named, typed slot: a parameter, a result or a struct field.
 *
 * @param name The name, possibly empty.
 * @param type The type.
 */
public record Var(String name, Type type) {

    public Var {
        name = name == null ? "" : name;
        type = type == null ? WildcardType.INSTANCE : type;
    }
}

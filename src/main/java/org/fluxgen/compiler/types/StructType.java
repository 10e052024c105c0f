package org.fluxgen.compiler.types;

import java.util.List;
import java.util.Optional;

/**
 * Record type given by its ordered fields.
 */
public record StructType(List<Field> fields) implements Type {

    public StructType {
        fields = List.copyOf(fields);
    }

    public Optional<Field> field(String name) {
        return fields.stream().filter(f -> f.name().equals(name)).findFirst();
    }

    /**
     * A struct field. Embedded fields carry the type name as their name.
     */
    public record Field(String name, Type type, boolean embedded) {}
}

package org.fluxgen.compiler.semantics;

import org.fluxgen.compiler.types.GoPackage;
import org.fluxgen.compiler.types.Type;

/**
 * A struct field accessed through a record value or a pointer to one.
 *
 * @param name The field name.
 * @param type The field type.
 */
public record FieldSymbol(String name, Type type) implements Symbol {

    @Override
    public GoPackage pkg() {
        return null;
    }
}

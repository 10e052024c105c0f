package org.fluxgen.compiler.semantics;

import org.fluxgen.compiler.types.GoPackage;
import org.fluxgen.compiler.types.NamedType;

/**
 * The declaration of a named type.
 */
public record TypeNameSymbol(NamedType type) implements Symbol {

    @Override
    public GoPackage pkg() {
        return type.pkg();
    }

    @Override
    public String name() {
        return type.name();
    }
}

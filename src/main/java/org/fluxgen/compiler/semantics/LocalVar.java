package org.fluxgen.compiler.semantics;

import org.fluxgen.compiler.types.GoPackage;
import org.fluxgen.compiler.types.Type;

/**
 * A variable declared at the top of a block and read or written by value nodes inside it.
 */
public record LocalVar(String name, Type type) implements Symbol {

    @Override
    public GoPackage pkg() {
        return null;
    }
}

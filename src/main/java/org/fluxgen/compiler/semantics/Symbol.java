package org.fluxgen.compiler.semantics;

import org.fluxgen.compiler.types.GoPackage;
import org.fluxgen.compiler.types.Type;

/**
 * A named entity a node can refer to: a function, variable, constant, field, type name
 * or block-local variable.
 */
public sealed interface Symbol permits FuncSymbol, VarSymbol, ConstSymbol, FieldSymbol, TypeNameSymbol, LocalVar {

    /**
     * @return The declaring package, or {@code null} for fields, locals and predeclared names.
     */
    GoPackage pkg();

    String name();

    Type type();

    default boolean isExported() {
        String n = name();
        return !n.isEmpty() && Character.isUpperCase(n.charAt(0));
    }
}

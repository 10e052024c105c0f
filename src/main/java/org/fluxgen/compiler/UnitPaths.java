package org.fluxgen.compiler;

import org.fluxgen.compiler.semantics.FuncSymbol;
import org.fluxgen.compiler.types.NamedType;

/**
 * Derives file names of generated units from qualified definition names.
 * <p>
 * Unexported names get a {@code -} suffix so that {@code foo} and {@code Foo} never map to
 * the same file on case-insensitive file systems. Methods are prefixed with their
 * receiver's type name.
 */
public final class UnitPaths {

    private UnitPaths() {
    }

    /**
     * @param function The function or method.
     * @param suffix   The configured file suffix, e.g. {@code .flux.go}.
     * @return The file name.
     */
    public static String fileName(FuncSymbol function, String suffix) {
        String name = part(function.name(), function.isExported());
        if (function.isMethod()) {
            NamedType recv = function.receiverType()
                    .orElseThrow(() -> new IllegalArgumentException("Receiver of " + function.name() + " is not a named type"));
            name = part(recv.name(), recv.isExported()) + "." + name;
        }
        return name + suffix;
    }

    public static String fileName(NamedType type, String suffix) {
        return part(type.name(), type.isExported()) + suffix;
    }

    private static String part(String name, boolean exported) {
        return exported ? name : name + "-";
    }
}

package org.fluxgen.compiler.semantics;

import org.fluxgen.compiler.types.GoPackage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The top-level scope of the package being edited. Its names are reserved in every
 * emission session so that generated identifiers never shadow them.
 */
public class PackageScope {

    private final GoPackage pkg;
    private final Map<String, Symbol> symbols = new LinkedHashMap<>();

    public PackageScope(GoPackage pkg) {
        this.pkg = pkg;
    }

    public GoPackage pkg() {
        return pkg;
    }

    /**
     * Declares a symbol. Methods are keyed by {@code Recv.Name} and do not occupy a
     * package-level name.
     *
     * @param symbol The symbol to declare.
     * @throws IllegalArgumentException if the name is already declared.
     */
    public void declare(Symbol symbol) {
        String key = key(symbol);
        if (symbols.containsKey(key)) {
            throw new IllegalArgumentException("'" + key + "' is already declared in package " + pkg.path());
        }
        symbols.put(key, symbol);
    }

    public Optional<Symbol> lookup(String name) {
        return Optional.ofNullable(symbols.get(name));
    }

    /**
     * @return Every package-level name in declaration order, methods excluded.
     */
    public List<String> names() {
        List<String> out = new ArrayList<>();
        for (Map.Entry<String, Symbol> e : symbols.entrySet()) {
            if (!(e.getValue() instanceof FuncSymbol f && f.isMethod())) {
                out.add(e.getKey());
            }
        }
        return out;
    }

    public Map<String, Symbol> symbols() {
        return Collections.unmodifiableMap(symbols);
    }

    private static String key(Symbol symbol) {
        if (symbol instanceof FuncSymbol f && f.isMethod()) {
            String recv = f.receiverType().map(t -> t.name()).orElse("?");
            return recv + "." + f.name();
        }
        return symbol.name();
    }
}

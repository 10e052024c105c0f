package org.fluxgen.compiler.types;

import org.fluxgen.compiler.api.ResolverException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * In-memory {@link TypeResolver} backed by registered declarations.
 * <p>
 * References are type expressions parsed by {@link TypeExpressionParser}. Declared names
 * are looked up by their qualified name ({@code path.Name}) or, for the local package,
 * by their bare name. Parsed expressions are memoized. Not thread-safe.
 */
public class StructuralTypeResolver implements TypeResolver {

    private static final Logger LOG = LoggerFactory.getLogger(StructuralTypeResolver.class);

    private final GoPackage localPackage;
    private final Map<String, NamedType> declarations = new LinkedHashMap<>();
    private final Map<String, GoPackage> packagesByName = new HashMap<>();
    private final Map<String, Type> cache = new HashMap<>();
    private final TypeHasher hasher = new TypeHasher();

    /**
     * @param localPackage The package whose declarations may be referenced unqualified.
     */
    public StructuralTypeResolver(GoPackage localPackage) {
        this.localPackage = localPackage;
        if (localPackage != null) {
            packagesByName.put(localPackage.name(), localPackage);
        }
    }

    /**
     * Registers a declared type. Re-declaring a name replaces the previous declaration
     * and clears the memoized expressions.
     *
     * @param type The declaration.
     * @return The same type for chaining.
     */
    public NamedType declare(NamedType type) {
        declarations.put(type.qualifiedName(), type);
        if (type.pkg() != null) {
            packagesByName.putIfAbsent(type.pkg().name(), type.pkg());
        }
        cache.clear();
        return type;
    }

    /**
     * Makes a package known so that {@code name.Type} references can be resolved.
     */
    public void registerPackage(GoPackage pkg) {
        packagesByName.putIfAbsent(pkg.name(), pkg);
        packagesByName.putIfAbsent(pkg.path(), pkg);
    }

    /**
     * @return The declaration registered under the qualified name, or {@code null}.
     */
    public NamedType declaration(String qualifiedName) {
        return declarations.get(qualifiedName);
    }

    @Override
    public Type resolve(String reference) throws ResolverException {
        if (reference == null || reference.isBlank()) {
            return WildcardType.INSTANCE;
        }
        Type cached = cache.get(reference);
        if (cached != null) {
            return cached;
        }
        Type t = TypeExpressionParser.parse(reference, this::lookup);
        cache.put(reference, t);
        return t;
    }

    private Type lookup(String name) {
        int dot = name.lastIndexOf('.');
        NamedType found;
        if (dot < 0) {
            found = localPackage == null ? null : declarations.get(localPackage.path() + "." + name);
        } else {
            String qualifier = name.substring(0, dot);
            GoPackage pkg = packagesByName.get(qualifier);
            String path = pkg == null ? qualifier : pkg.path();
            found = declarations.get(path + "." + name.substring(dot + 1));
        }
        if (found == null) {
            LOG.debug("Unknown type name '{}', resolving to wildcard", name);
            return WildcardType.INSTANCE;
        }
        return found;
    }

    @Override
    public boolean isIdentical(Type a, Type b) {
        return TypeIdentity.identical(a, b);
    }

    @Override
    public int hash(Type type) {
        return hasher.hash(type);
    }
}

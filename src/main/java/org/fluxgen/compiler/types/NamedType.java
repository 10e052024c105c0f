package org.fluxgen.compiler.types;

import java.util.Objects;

/**
 * A declared type. Two named types are identical when they are declared in the same
 * package under the same name. The underlying type can be bound after construction,
 * which is what makes self-referencing declarations possible.
 */
public final class NamedType implements Type {

    private final GoPackage pkg;
    private final String name;
    private Type underlying;

    /**
     * @param pkg        The declaring package, {@code null} for predeclared names such as {@code error}.
     * @param name       The type name.
     * @param underlying The underlying type, may be {@code null} until bound.
     */
    public NamedType(GoPackage pkg, String name, Type underlying) {
        this.pkg = pkg;
        this.name = Objects.requireNonNull(name, "name");
        this.underlying = underlying;
    }

    public GoPackage pkg() {
        return pkg;
    }

    public String name() {
        return name;
    }

    /**
     * @return The underlying type, or the wildcard while it is unbound.
     */
    public Type underlying() {
        return underlying == null ? WildcardType.INSTANCE : underlying;
    }

    public void bindUnderlying(Type type) {
        this.underlying = type;
    }

    public boolean isExported() {
        return !name.isEmpty() && Character.isUpperCase(name.charAt(0));
    }

    public String qualifiedName() {
        return pkg == null ? name : pkg.path() + "." + name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NamedType that)) return false;
        return Objects.equals(pkg == null ? null : pkg.path(), that.pkg == null ? null : that.pkg.path())
                && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pkg == null ? null : pkg.path(), name);
    }

    @Override
    public String toString() {
        return qualifiedName();
    }
}

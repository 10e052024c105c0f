package org.fluxgen.compiler.types;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Predeclared types and structural helpers shared by propagation and emission.
 */
public final class Types {

    public static final BasicType BOOL = new BasicType("bool", BasicType.Kind.BOOL);
    public static final BasicType INT = new BasicType("int", BasicType.Kind.INTEGER);
    public static final BasicType INT8 = new BasicType("int8", BasicType.Kind.INTEGER);
    public static final BasicType INT16 = new BasicType("int16", BasicType.Kind.INTEGER);
    public static final BasicType INT32 = new BasicType("int32", BasicType.Kind.INTEGER);
    public static final BasicType INT64 = new BasicType("int64", BasicType.Kind.INTEGER);
    public static final BasicType UINT = new BasicType("uint", BasicType.Kind.INTEGER);
    public static final BasicType UINT8 = new BasicType("uint8", BasicType.Kind.INTEGER);
    public static final BasicType UINT16 = new BasicType("uint16", BasicType.Kind.INTEGER);
    public static final BasicType UINT32 = new BasicType("uint32", BasicType.Kind.INTEGER);
    public static final BasicType UINT64 = new BasicType("uint64", BasicType.Kind.INTEGER);
    public static final BasicType UINTPTR = new BasicType("uintptr", BasicType.Kind.INTEGER);
    public static final BasicType BYTE = new BasicType("byte", BasicType.Kind.INTEGER);
    public static final BasicType RUNE = new BasicType("rune", BasicType.Kind.INTEGER);
    public static final BasicType FLOAT32 = new BasicType("float32", BasicType.Kind.FLOAT);
    public static final BasicType FLOAT64 = new BasicType("float64", BasicType.Kind.FLOAT);
    public static final BasicType COMPLEX64 = new BasicType("complex64", BasicType.Kind.COMPLEX);
    public static final BasicType COMPLEX128 = new BasicType("complex128", BasicType.Kind.COMPLEX);
    public static final BasicType STRING = new BasicType("string", BasicType.Kind.STRING);

    /** The predeclared {@code error} interface. */
    public static final NamedType ERROR = new NamedType(null, "error", new InterfaceType(java.util.List.of(
            new InterfaceType.Method("Error", new SignatureType(java.util.List.of(), java.util.List.of(new Var("", STRING)))))));

    private static final Map<String, Type> PREDECLARED = new LinkedHashMap<>();

    static {
        for (BasicType t : new BasicType[]{BOOL, INT, INT8, INT16, INT32, INT64, UINT, UINT8, UINT16, UINT32,
                UINT64, UINTPTR, BYTE, RUNE, FLOAT32, FLOAT64, COMPLEX64, COMPLEX128, STRING}) {
            PREDECLARED.put(t.name(), t);
        }
        PREDECLARED.put("error", ERROR);
    }

    private Types() {}

    /**
     * Looks up a predeclared type name.
     *
     * @param name The name, e.g. {@code "int"}.
     * @return The type if the name is predeclared.
     */
    public static Optional<Type> predeclared(String name) {
        return Optional.ofNullable(PREDECLARED.get(name));
    }

    public static boolean isWildcard(Type t) {
        return t == null || t == WildcardType.INSTANCE;
    }

    /**
     * @return The underlying type of a named type, or the type itself.
     */
    public static Type underlying(Type t) {
        Type u = t;
        // bounded to survive malformed self-referencing declarations
        for (int i = 0; i < 32 && u instanceof NamedType n; i++) {
            u = n.underlying();
        }
        return u instanceof NamedType ? WildcardType.INSTANCE : u;
    }

    /**
     * Strips one level of pointer indirection.
     *
     * @param t The type to inspect.
     * @return The pointee and whether a pointer was stripped.
     */
    public static Indirection indirect(Type t) {
        if (t instanceof PointerType p) {
            return new Indirection(p.elem(), true);
        }
        return new Indirection(t, false);
    }

    /**
     * A type with at most one pointer level removed.
     *
     * @param base    The pointee or the original type.
     * @param pointer Whether a pointer level was removed.
     */
    public record Indirection(Type base, boolean pointer) {}

    /**
     * Reference-like types have {@code nil} as their zero value.
     */
    public static boolean isReferenceLike(Type t) {
        Type u = underlying(t);
        return u instanceof SliceType || u instanceof MapType || u instanceof SignatureType
                || u instanceof PointerType || u instanceof ChanType || u instanceof InterfaceType;
    }

    /**
     * Comparison and logical operators yield a boolean regardless of their operands.
     */
    public static boolean isBooleanOperator(String op) {
        return switch (op) {
            case "==", "!=", "<", "<=", ">", ">=", "&&", "||", "!" -> true;
            default -> false;
        };
    }

    /**
     * Loose assignability used to decide whether a connection needs a dereference.
     * Wildcards are assignable in both directions.
     *
     * @param resolver The identity authority.
     * @param src      The type of the value.
     * @param dst      The type of the slot.
     * @return {@code true} if a value of {@code src} can be stored in {@code dst} directly.
     */
    public static boolean assignable(TypeResolver resolver, Type src, Type dst) {
        if (isWildcard(src) || isWildcard(dst)) {
            return true;
        }
        if (resolver.isIdentical(src, dst)) {
            return true;
        }
        Type su = underlying(src);
        Type du = underlying(dst);
        if (du instanceof InterfaceType) {
            return true;
        }
        boolean oneUnnamed = !(src instanceof NamedType) || !(dst instanceof NamedType);
        return oneUnnamed && resolver.isIdentical(su, du);
    }

    /**
     * @return {@code true} when {@code src} is a pointer whose element, but not the pointer
     * itself, can be stored in {@code dst}.
     */
    public static boolean needsDereference(TypeResolver resolver, Type src, Type dst) {
        if (assignable(resolver, src, dst)) {
            return false;
        }
        return src instanceof PointerType p && assignable(resolver, p.elem(), dst);
    }
}

package org.fluxgen.compiler.types;

import java.util.Comparator;
import java.util.List;

/**
 * Structural identity of types. Parameter names, receivers and interface method order
 * are irrelevant; {@code byte} and {@code rune} are aliases of {@code uint8} and {@code int32}.
 */
public final class TypeIdentity {

    private TypeIdentity() {}

    public static String canonicalBasicName(String name) {
        return switch (name) {
            case "byte" -> "uint8";
            case "rune" -> "int32";
            default -> name;
        };
    }

    /**
     * @return {@code true} if both types are identical.
     */
    public static boolean identical(Type a, Type b) {
        if (a == b) {
            return true;
        }
        if (a == null || b == null) {
            return false;
        }
        if (a instanceof BasicType x && b instanceof BasicType y) {
            return canonicalBasicName(x.name()).equals(canonicalBasicName(y.name()));
        }
        if (a instanceof NamedType x && b instanceof NamedType y) {
            return x.equals(y);
        }
        if (a instanceof PointerType x && b instanceof PointerType y) {
            return identical(x.elem(), y.elem());
        }
        if (a instanceof ArrayType x && b instanceof ArrayType y) {
            return x.length() == y.length() && identical(x.elem(), y.elem());
        }
        if (a instanceof SliceType x && b instanceof SliceType y) {
            return identical(x.elem(), y.elem());
        }
        if (a instanceof MapType x && b instanceof MapType y) {
            return identical(x.key(), y.key()) && identical(x.elem(), y.elem());
        }
        if (a instanceof ChanType x && b instanceof ChanType y) {
            return x.direction() == y.direction() && identical(x.elem(), y.elem());
        }
        if (a instanceof SignatureType x && b instanceof SignatureType y) {
            return identicalSignatures(x, y);
        }
        if (a instanceof InterfaceType x && b instanceof InterfaceType y) {
            return identicalMethodSets(x.methods(), y.methods());
        }
        if (a instanceof StructType x && b instanceof StructType y) {
            return identicalFields(x.fields(), y.fields());
        }
        return false;
    }

    private static boolean identicalSignatures(SignatureType x, SignatureType y) {
        return x.variadic() == y.variadic()
                && identicalVars(x.params(), y.params())
                && identicalVars(x.results(), y.results());
    }

    private static boolean identicalVars(List<Var> xs, List<Var> ys) {
        if (xs.size() != ys.size()) {
            return false;
        }
        for (int i = 0; i < xs.size(); i++) {
            if (!identical(xs.get(i).type(), ys.get(i).type())) {
                return false;
            }
        }
        return true;
    }

    private static boolean identicalMethodSets(List<InterfaceType.Method> xs, List<InterfaceType.Method> ys) {
        if (xs.size() != ys.size()) {
            return false;
        }
        List<InterfaceType.Method> sx = xs.stream().sorted(Comparator.comparing(InterfaceType.Method::name)).toList();
        List<InterfaceType.Method> sy = ys.stream().sorted(Comparator.comparing(InterfaceType.Method::name)).toList();
        for (int i = 0; i < sx.size(); i++) {
            if (!sx.get(i).name().equals(sy.get(i).name())
                    || !identicalSignatures(sx.get(i).signature(), sy.get(i).signature())) {
                return false;
            }
        }
        return true;
    }

    private static boolean identicalFields(List<StructType.Field> xs, List<StructType.Field> ys) {
        if (xs.size() != ys.size()) {
            return false;
        }
        for (int i = 0; i < xs.size(); i++) {
            StructType.Field fx = xs.get(i);
            StructType.Field fy = ys.get(i);
            if (!fx.name().equals(fy.name()) || fx.embedded() != fy.embedded() || !identical(fx.type(), fy.type())) {
                return false;
            }
        }
        return true;
    }
}

package org.fluxgen.compiler.backend.emit;

import org.fluxgen.compiler.types.ArrayType;
import org.fluxgen.compiler.types.BasicType;
import org.fluxgen.compiler.types.ChanType;
import org.fluxgen.compiler.types.GoPackage;
import org.fluxgen.compiler.types.InterfaceType;
import org.fluxgen.compiler.types.MapType;
import org.fluxgen.compiler.types.NamedType;
import org.fluxgen.compiler.types.PointerType;
import org.fluxgen.compiler.types.SignatureType;
import org.fluxgen.compiler.types.SliceType;
import org.fluxgen.compiler.types.StructType;
import org.fluxgen.compiler.types.Type;
import org.fluxgen.compiler.types.Var;
import org.fluxgen.compiler.types.WildcardType;

import java.util.List;
import java.util.function.Function;

/**
 * Writes types in target-language syntax. Named types from foreign packages are
 * qualified with the local package name returned by the namer, which also registers the
 * import.
 */
public final class TypeFormatter {

    private final Function<GoPackage, String> packageNamer;

    /**
     * @param packageNamer Returns the local name of a foreign package, or {@code null} for
     *                     the package being generated.
     */
    public TypeFormatter(Function<GoPackage, String> packageNamer) {
        this.packageNamer = packageNamer;
    }

    /**
     * @return {@code true} if the type has no wildcard component and can be written.
     */
    public static boolean isComplete(Type t) {
        if (t == null || t instanceof WildcardType) {
            return false;
        }
        if (t instanceof PointerType p) {
            return isComplete(p.elem());
        }
        if (t instanceof ArrayType a) {
            return isComplete(a.elem());
        }
        if (t instanceof SliceType s) {
            return isComplete(s.elem());
        }
        if (t instanceof MapType m) {
            return isComplete(m.key()) && isComplete(m.elem());
        }
        if (t instanceof ChanType c) {
            return isComplete(c.elem());
        }
        if (t instanceof SignatureType s) {
            return (s.receiver() == null || isComplete(s.receiver().type()))
                    && s.params().stream().allMatch(v -> isComplete(v.type()))
                    && s.results().stream().allMatch(v -> isComplete(v.type()));
        }
        if (t instanceof InterfaceType i) {
            return i.methods().stream().allMatch(m -> isComplete(m.signature()));
        }
        if (t instanceof StructType s) {
            return s.fields().stream().allMatch(f -> isComplete(f.type()));
        }
        return true;
    }

    /**
     * @param t A complete type.
     * @return The type text.
     * @throws IllegalStateException if the type contains a wildcard.
     */
    public String format(Type t) {
        if (t == null || t instanceof WildcardType) {
            throw new IllegalStateException("Cannot write an unresolved type");
        }
        if (t instanceof BasicType b) {
            return b.name();
        }
        if (t instanceof NamedType n) {
            return qualify(n.pkg(), n.name());
        }
        if (t instanceof PointerType p) {
            return "*" + format(p.elem());
        }
        if (t instanceof ArrayType a) {
            return "[" + a.length() + "]" + format(a.elem());
        }
        if (t instanceof SliceType s) {
            return "[]" + format(s.elem());
        }
        if (t instanceof MapType m) {
            return "map[" + format(m.key()) + "]" + format(m.elem());
        }
        if (t instanceof ChanType c) {
            String prefix = switch (c.direction()) {
                case SEND_ONLY -> "chan<- ";
                case RECV_ONLY -> "<-chan ";
                case SEND_RECV -> "chan ";
            };
            return prefix + format(c.elem());
        }
        if (t instanceof SignatureType s) {
            return "func" + signature(s);
        }
        if (t instanceof InterfaceType i) {
            StringBuilder sb = new StringBuilder("interface{");
            for (int k = 0; k < i.methods().size(); k++) {
                if (k > 0) {
                    sb.append("; ");
                }
                InterfaceType.Method m = i.methods().get(k);
                sb.append(m.name()).append(signature(m.signature()));
            }
            return sb.append('}').toString();
        }
        StructType st = (StructType) t;
        StringBuilder sb = new StringBuilder("struct{");
        for (int k = 0; k < st.fields().size(); k++) {
            if (k > 0) {
                sb.append("; ");
            }
            StructType.Field f = st.fields().get(k);
            if (!f.embedded() && !f.name().isEmpty()) {
                sb.append(f.name()).append(' ');
            }
            sb.append(format(f.type()));
        }
        return sb.append('}').toString();
    }

    /**
     * @return {@code (params) results} without the {@code func} keyword or receiver.
     */
    public String signature(SignatureType s) {
        String text = vars(s.params(), s.variadic());
        if (s.results().isEmpty()) {
            return text;
        }
        if (s.results().size() == 1 && s.results().get(0).name().isEmpty()) {
            return text + " " + format(s.results().get(0).type());
        }
        return text + " " + vars(s.results(), false);
    }

    /**
     * Writes the element type of a variadic parameter prefixed with {@code ...}.
     */
    public String variadic(Type sliceType) {
        if (sliceType instanceof SliceType s) {
            return "..." + format(s.elem());
        }
        throw new IllegalStateException("Variadic parameter is not a slice: " + sliceType);
    }

    /**
     * @return The name as seen from the package being generated.
     */
    public String qualify(GoPackage pkg, String name) {
        String local = pkg == null ? null : packageNamer.apply(pkg);
        return local == null ? name : local + "." + name;
    }

    private String vars(List<Var> vars, boolean variadic) {
        boolean named = vars.stream().anyMatch(v -> !v.name().isEmpty());
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < vars.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            Var v = vars.get(i);
            if (named) {
                sb.append(v.name().isEmpty() ? "_" : v.name()).append(' ');
            }
            sb.append(variadic && i == vars.size() - 1 ? variadic(v.type()) : format(v.type()));
        }
        return sb.append(')').toString();
    }
}

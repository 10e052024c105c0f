package org.fluxgen.compiler.types;

import java.util.List;

/**
 * Shape markers used while a structural node's type is still being chosen
 * interactively. Each prototype yields an incomplete type whose components are wildcards.
 */
public enum TypePrototype {
    POINTER,
    ARRAY,
    SLICE,
    MAP,
    CHAN,
    FUNC,
    INTERFACE,
    STRUCT;

    /**
     * @return A fresh incomplete type of this shape.
     */
    public Type instantiate() {
        Type w = WildcardType.INSTANCE;
        return switch (this) {
            case POINTER -> new PointerType(w);
            case ARRAY -> new ArrayType(0, w);
            case SLICE -> new SliceType(w);
            case MAP -> new MapType(w, w);
            case CHAN -> new ChanType(ChanType.Direction.SEND_RECV, w);
            case FUNC -> new SignatureType(List.of(), List.of());
            case INTERFACE -> new InterfaceType(List.of());
            case STRUCT -> new StructType(List.of());
        };
    }

    /**
     * @return {@code true} if the type still contains a wildcard component.
     */
    public static boolean isIncomplete(Type t) {
        if (Types.isWildcard(t)) {
            return true;
        }
        if (t instanceof PointerType p) {
            return isIncomplete(p.elem());
        }
        if (t instanceof ArrayType a) {
            return isIncomplete(a.elem());
        }
        if (t instanceof SliceType s) {
            return isIncomplete(s.elem());
        }
        if (t instanceof MapType m) {
            return isIncomplete(m.key()) || isIncomplete(m.elem());
        }
        if (t instanceof ChanType c) {
            return isIncomplete(c.elem());
        }
        return false;
    }
}

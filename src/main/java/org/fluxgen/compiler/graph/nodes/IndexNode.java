package org.fluxgen.compiler.graph.nodes;

import org.fluxgen.compiler.graph.Node;
import org.fluxgen.compiler.graph.NodeContext;
import org.fluxgen.compiler.graph.NodeKind;
import org.fluxgen.compiler.graph.PortId;
import org.fluxgen.compiler.graph.TypeDerivation;
import org.fluxgen.compiler.types.ArrayType;
import org.fluxgen.compiler.types.MapType;
import org.fluxgen.compiler.types.PointerType;
import org.fluxgen.compiler.types.SliceType;
import org.fluxgen.compiler.types.Type;
import org.fluxgen.compiler.types.Types;
import org.fluxgen.compiler.types.WildcardType;

/**
 * Reads ({@code x[key]}) or writes ({@code x[key] = v}) an element of an array, slice or map.
 * <p>
 * Reads from a slice, or from an array behind a pointer, yield a pointer to the element
 * and mark the output addressable. Map reads gain an {@code ok} output.
 */
public final class IndexNode extends Node {

    private final boolean set;
    private PortId container;
    private PortId key;
    private PortId value;
    private PortId ok;

    /**
     * @param set {@code true} for a write access.
     */
    public IndexNode(boolean set) {
        this.set = set;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.INDEX;
    }

    @Override
    protected void assemble(NodeContext ctx) {
        container = ctx.input("x", WildcardType.INSTANCE);
        key = ctx.input("key", Types.INT);
        value = set ? ctx.input("elem", WildcardType.INSTANCE) : ctx.output("elem", WildcardType.INSTANCE);
    }

    @Override
    protected void deriveTypes(TypeDerivation d) {
        boolean addressable = false;
        boolean map = false;
        Type source = d.sourceType(container);
        Type keyType;
        Type elemType = WildcardType.INSTANCE;
        if (Types.isWildcard(source)) {
            keyType = d.isConnected(key) ? d.sourceType(key) : Types.INT;
            if (set && d.isConnected(value)) {
                elemType = d.sourceType(value);
            }
        } else {
            keyType = Types.INT;
            Types.Indirection ind = Types.indirect(Types.underlying(source));
            Type u = Types.underlying(ind.base());
            if (u instanceof ArrayType a) {
                elemType = a.elem();
                if (ind.pointer() && !set) {
                    elemType = new PointerType(elemType);
                    addressable = true;
                }
            } else if (u instanceof SliceType s && !ind.pointer()) {
                elemType = s.elem();
                if (!set) {
                    elemType = new PointerType(elemType);
                    addressable = true;
                }
            } else if (u instanceof MapType m && !ind.pointer()) {
                keyType = m.key();
                elemType = m.elem();
                map = true;
            }
        }
        if (!set) {
            if (map && ok == null) {
                ok = d.addOutput(this, "ok", Types.BOOL);
            } else if (!map && ok != null) {
                d.removePort(ok);
                ok = null;
            }
        }
        d.setType(container, source);
        d.setType(key, keyType);
        d.setType(value, elemType);
        if (!set) {
            d.setAddressable(value, addressable);
        }
    }

    public boolean isSet() {
        return set;
    }

    public PortId container() {
        return container;
    }

    public PortId key() {
        return key;
    }

    /**
     * @return The element output for reads, the element input for writes.
     */
    public PortId value() {
        return value;
    }

    /**
     * @return The presence output of a map read, or {@code null}.
     */
    public PortId ok() {
        return ok;
    }
}

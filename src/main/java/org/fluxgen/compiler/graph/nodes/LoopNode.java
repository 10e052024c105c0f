package org.fluxgen.compiler.graph.nodes;

import org.fluxgen.compiler.graph.BlockId;
import org.fluxgen.compiler.graph.Node;
import org.fluxgen.compiler.graph.NodeContext;
import org.fluxgen.compiler.graph.NodeKind;
import org.fluxgen.compiler.graph.PortId;
import org.fluxgen.compiler.graph.TypeDerivation;
import org.fluxgen.compiler.types.ArrayType;
import org.fluxgen.compiler.types.BasicType;
import org.fluxgen.compiler.types.ChanType;
import org.fluxgen.compiler.types.MapType;
import org.fluxgen.compiler.types.PointerType;
import org.fluxgen.compiler.types.SliceType;
import org.fluxgen.compiler.types.Type;
import org.fluxgen.compiler.types.Types;
import org.fluxgen.compiler.types.WildcardType;

/**
 * Iteration over the value on its single input. The body block starts with a boundary
 * node whose outputs are the key and value bindings.
 * <p>
 * Arrays, slices, pointers to arrays and maps offer two bindings. Channels offer one (the
 * received element) and scalars one (the counter). Without a connected input the loop
 * is endless and its single binding counts iterations.
 */
public final class LoopNode extends Node {

    /**
     * The loop form chosen for the current input type.
     */
    public enum Form {
        /** {@code for i := T(0); i < n; i++} */
        COUNT,
        /** {@code for i := range x} with an element pointer for the value binding. */
        INDEXED_RANGE,
        /** {@code for k, v := range x} */
        KEY_VALUE_RANGE,
        /** {@code for i := 0;; i++} */
        ENDLESS
    }

    private PortId input;
    private BlockId body;
    private PortsNode bindings;
    private PortId key;
    private PortId value;

    @Override
    public NodeKind kind() {
        return NodeKind.LOOP;
    }

    @Override
    protected void assemble(NodeContext ctx) {
        input = ctx.input("x", WildcardType.INSTANCE);
        body = ctx.block();
        bindings = ctx.add(body, new PortsNode(PortsNode.Role.PARAMETERS));
        key = ctx.forChild(bindings).output("i", Types.INT);
    }

    /**
     * @return The loop form for the given input type.
     */
    public static Form formFor(Type inputType) {
        Type u = Types.underlying(inputType);
        if (u instanceof BasicType) {
            return Form.COUNT;
        }
        if (u instanceof ArrayType || u instanceof SliceType
                || (u instanceof PointerType p && Types.underlying(p.elem()) instanceof ArrayType)) {
            return Form.INDEXED_RANGE;
        }
        if (u instanceof MapType || u instanceof ChanType) {
            return Form.KEY_VALUE_RANGE;
        }
        return Form.ENDLESS;
    }

    @Override
    protected void deriveTypes(TypeDerivation d) {
        Type t = d.sourceType(input);
        d.setType(input, t);
        Type u = Types.underlying(t);
        Type keyType = Types.INT;
        Type valueType = null;
        String keyName = "i";
        if (u instanceof BasicType) {
            keyType = t;
        } else if (u instanceof ArrayType a) {
            valueType = a.elem();
        } else if (u instanceof SliceType s) {
            valueType = new PointerType(s.elem());
        } else if (u instanceof PointerType p && Types.underlying(p.elem()) instanceof ArrayType a) {
            valueType = new PointerType(a.elem());
        } else if (u instanceof MapType m) {
            keyType = m.key();
            valueType = m.elem();
            keyName = "k";
        } else if (u instanceof ChanType c) {
            keyType = c.elem();
            keyName = "v";
        }
        d.setType(key, keyType);
        if (valueType == null && value != null) {
            d.removePort(value);
            value = null;
        } else if (valueType != null) {
            if (value == null) {
                value = d.addOutput(bindings, "v", valueType);
            }
            d.setType(value, valueType);
        }
        d.rename(key, keyName);
    }

    public PortId input() {
        return input;
    }

    public BlockId body() {
        return body;
    }

    public PortsNode bindingsNode() {
        return bindings;
    }

    /**
     * @return The first binding: index, map key, received element or counter.
     */
    public PortId keyBinding() {
        return key;
    }

    /**
     * @return The value binding, or {@code null} if the input type offers none.
     */
    public PortId valueBinding() {
        return value;
    }
}

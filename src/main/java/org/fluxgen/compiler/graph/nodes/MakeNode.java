package org.fluxgen.compiler.graph.nodes;

import org.fluxgen.compiler.graph.Node;
import org.fluxgen.compiler.graph.NodeContext;
import org.fluxgen.compiler.graph.NodeKind;
import org.fluxgen.compiler.graph.PortId;
import org.fluxgen.compiler.types.ChanType;
import org.fluxgen.compiler.types.MapType;
import org.fluxgen.compiler.types.SliceType;
import org.fluxgen.compiler.types.Type;
import org.fluxgen.compiler.types.Types;

/**
 * Allocates a slice ({@code len}, {@code cap}), map ({@code size}) or channel ({@code size}).
 * The last size input is optional and dropped from the call when unconnected.
 */
public final class MakeNode extends Node {

    private final Type type;
    private PortId result;

    /**
     * @param type A slice, map or channel type, possibly named.
     */
    public MakeNode(Type type) {
        Type u = Types.underlying(type);
        if (!(u instanceof SliceType || u instanceof MapType || u instanceof ChanType)) {
            throw new IllegalArgumentException("make requires a slice, map or channel type, got " + type);
        }
        this.type = type;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.MAKE;
    }

    @Override
    protected void assemble(NodeContext ctx) {
        if (Types.underlying(type) instanceof SliceType) {
            ctx.input("len", Types.INT);
            ctx.input("cap", Types.INT);
        } else {
            ctx.input("size", Types.INT);
        }
        result = ctx.output("", type);
    }

    public Type type() {
        return type;
    }

    /**
     * @return The size input that may be left out of the call.
     */
    public PortId optionalInput() {
        return inputs().get(inputs().size() - 1);
    }

    public PortId result() {
        return result;
    }
}

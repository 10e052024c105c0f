package org.fluxgen.compiler.graph.nodes;

import org.fluxgen.compiler.graph.Node;
import org.fluxgen.compiler.graph.NodeContext;
import org.fluxgen.compiler.graph.NodeKind;
import org.fluxgen.compiler.graph.PortId;
import org.fluxgen.compiler.graph.TypeDerivation;
import org.fluxgen.compiler.types.SliceType;
import org.fluxgen.compiler.types.Type;
import org.fluxgen.compiler.types.Types;
import org.fluxgen.compiler.types.WildcardType;

import java.util.List;

/**
 * Appends elements to a slice. With the ellipsis flag the last element input takes a
 * whole slice that is spread.
 */
public final class AppendNode extends Node {

    private final int elements;
    private final boolean ellipsis;
    private PortId slice;
    private PortId result;

    /**
     * @param elements Number of element inputs, at least one.
     * @param ellipsis Whether the last element input is spread.
     */
    public AppendNode(int elements, boolean ellipsis) {
        if (elements < 1) {
            throw new IllegalArgumentException("append needs at least one element input");
        }
        this.elements = elements;
        this.ellipsis = ellipsis;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.APPEND;
    }

    @Override
    protected void assemble(NodeContext ctx) {
        slice = ctx.input("s", WildcardType.INSTANCE);
        for (int i = 0; i < elements; i++) {
            ctx.input("x", WildcardType.INSTANCE);
        }
        result = ctx.output("s", WildcardType.INSTANCE);
    }

    @Override
    protected void deriveTypes(TypeDerivation d) {
        Type t = d.sourceType(slice);
        Type elem = Types.underlying(t) instanceof SliceType s ? s.elem() : WildcardType.INSTANCE;
        d.setType(slice, t);
        List<PortId> elems = elements();
        for (int i = 0; i < elems.size(); i++) {
            boolean spread = ellipsis && i == elems.size() - 1;
            d.setType(elems.get(i), spread ? (Types.isWildcard(t) ? t : new SliceType(elem)) : elem);
        }
        d.setType(result, t);
    }

    public boolean isEllipsis() {
        return ellipsis;
    }

    public PortId slice() {
        return slice;
    }

    public List<PortId> elements() {
        return inputs().subList(1, inputs().size());
    }

    public PortId result() {
        return result;
    }
}

package org.fluxgen.compiler.graph.nodes;

import org.fluxgen.compiler.graph.Node;
import org.fluxgen.compiler.graph.NodeContext;
import org.fluxgen.compiler.graph.NodeKind;
import org.fluxgen.compiler.graph.PortId;
import org.fluxgen.compiler.graph.TypeDerivation;
import org.fluxgen.compiler.types.MapType;
import org.fluxgen.compiler.types.Type;
import org.fluxgen.compiler.types.Types;
import org.fluxgen.compiler.types.WildcardType;

/**
 * Deletes a key from a map.
 */
public final class DeleteNode extends Node {

    private PortId map;
    private PortId key;

    @Override
    public NodeKind kind() {
        return NodeKind.DELETE;
    }

    @Override
    protected void assemble(NodeContext ctx) {
        map = ctx.input("m", WildcardType.INSTANCE);
        key = ctx.input("key", WildcardType.INSTANCE);
    }

    @Override
    protected void deriveTypes(TypeDerivation d) {
        Type t = d.sourceType(map);
        d.setType(map, t);
        d.setType(key, Types.underlying(t) instanceof MapType m ? m.key() : d.sourceType(key));
    }

    public PortId map() {
        return map;
    }

    public PortId key() {
        return key;
    }
}

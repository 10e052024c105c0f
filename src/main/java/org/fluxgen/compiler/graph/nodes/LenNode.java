package org.fluxgen.compiler.graph.nodes;

import org.fluxgen.compiler.graph.Node;
import org.fluxgen.compiler.graph.NodeContext;
import org.fluxgen.compiler.graph.NodeKind;
import org.fluxgen.compiler.graph.PortId;
import org.fluxgen.compiler.graph.TypeDerivation;
import org.fluxgen.compiler.types.Types;
import org.fluxgen.compiler.types.WildcardType;

/**
 * Length of a string, array, slice, map or channel.
 */
public final class LenNode extends Node {

    private PortId input;
    private PortId result;

    @Override
    public NodeKind kind() {
        return NodeKind.LEN;
    }

    @Override
    protected void assemble(NodeContext ctx) {
        input = ctx.input("x", WildcardType.INSTANCE);
        result = ctx.output("n", Types.INT);
    }

    @Override
    protected void deriveTypes(TypeDerivation d) {
        d.setType(input, d.sourceType(input));
    }

    public PortId input() {
        return input;
    }

    public PortId result() {
        return result;
    }
}

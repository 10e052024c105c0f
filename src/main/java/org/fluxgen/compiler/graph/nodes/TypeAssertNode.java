package org.fluxgen.compiler.graph.nodes;

import org.fluxgen.compiler.graph.Node;
import org.fluxgen.compiler.graph.NodeContext;
import org.fluxgen.compiler.graph.NodeKind;
import org.fluxgen.compiler.graph.PortId;
import org.fluxgen.compiler.graph.TypeDerivation;
import org.fluxgen.compiler.types.Type;
import org.fluxgen.compiler.types.Types;
import org.fluxgen.compiler.types.WildcardType;

/**
 * Type assertion {@code v, ok := x.(T)}.
 */
public final class TypeAssertNode extends Node {

    private final Type type;
    private PortId input;
    private PortId result;
    private PortId ok;

    public TypeAssertNode(Type type) {
        this.type = type;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TYPE_ASSERT;
    }

    @Override
    protected void assemble(NodeContext ctx) {
        input = ctx.input("x", WildcardType.INSTANCE);
        result = ctx.output("", type);
        ok = ctx.output("ok", Types.BOOL);
    }

    @Override
    protected void deriveTypes(TypeDerivation d) {
        d.setType(input, d.sourceType(input));
    }

    public Type type() {
        return type;
    }

    public PortId input() {
        return input;
    }

    public PortId result() {
        return result;
    }

    public PortId ok() {
        return ok;
    }
}

package org.fluxgen.compiler.backend.emit.features;

import org.fluxgen.compiler.backend.emit.EmissionContext;
import org.fluxgen.compiler.backend.emit.INodeEmissionRule;
import org.fluxgen.compiler.graph.nodes.DeleteNode;

import java.util.List;

public class DeleteRule implements INodeEmissionRule<DeleteNode> {

    @Override
    public Class<DeleteNode> nodeType() {
        return DeleteNode.class;
    }

    @Override
    public void emit(DeleteNode node, EmissionContext ctx) {
        if (!ctx.isConnected(node.map()) || !ctx.resolvable(node.inputs())) {
            ctx.omit(node, "map is unconnected or the key has no known type");
            return;
        }
        List<String> args = ctx.args(node.inputs());
        ctx.indent("delete(" + args.get(0) + ", " + args.get(1) + ")");
        ctx.endStatement(node);
    }
}

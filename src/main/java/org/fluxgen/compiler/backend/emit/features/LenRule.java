package org.fluxgen.compiler.backend.emit.features;

import org.fluxgen.compiler.backend.emit.EmissionContext;
import org.fluxgen.compiler.backend.emit.INodeEmissionRule;
import org.fluxgen.compiler.graph.nodes.LenNode;

public class LenRule implements INodeEmissionRule<LenNode> {

    @Override
    public Class<LenNode> nodeType() {
        return LenNode.class;
    }

    @Override
    public void emit(LenNode node, EmissionContext ctx) {
        if (!ctx.hasConnectedOutput(node)) {
            return;
        }
        if (!ctx.isConnected(node.input())) {
            ctx.omit(node, "operand is unconnected");
            return;
        }
        String x = ctx.arg(node.input());
        EmissionContext.Results results = ctx.results(node);
        ctx.indent(results.first() + " := len(" + x + ")");
        ctx.endStatement(node);
        ctx.assignExisting(results);
    }
}

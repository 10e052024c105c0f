package org.fluxgen.compiler.backend.emit.features;

import org.fluxgen.compiler.backend.emit.EmissionContext;
import org.fluxgen.compiler.backend.emit.INodeEmissionRule;
import org.fluxgen.compiler.backend.emit.TypeFormatter;
import org.fluxgen.compiler.graph.nodes.TypeAssertNode;

public class TypeAssertRule implements INodeEmissionRule<TypeAssertNode> {

    @Override
    public Class<TypeAssertNode> nodeType() {
        return TypeAssertNode.class;
    }

    @Override
    public void emit(TypeAssertNode node, EmissionContext ctx) {
        if (!ctx.hasConnectedOutput(node)) {
            return;
        }
        if (!ctx.isConnected(node.input()) || !TypeFormatter.isComplete(node.type())) {
            ctx.omit(node, "operand is unconnected or the asserted type is not resolved");
            return;
        }
        String x = ctx.arg(node.input());
        EmissionContext.Results results = ctx.results(node);
        ctx.indent(results.joined() + " := " + x + ".(" + ctx.type(node.type()) + ")");
        ctx.endStatement(node);
        ctx.assignExisting(results);
    }
}

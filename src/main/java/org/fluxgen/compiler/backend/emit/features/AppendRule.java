package org.fluxgen.compiler.backend.emit.features;

import org.fluxgen.compiler.backend.emit.EmissionContext;
import org.fluxgen.compiler.backend.emit.INodeEmissionRule;
import org.fluxgen.compiler.graph.nodes.AppendNode;

import java.util.List;

public class AppendRule implements INodeEmissionRule<AppendNode> {

    @Override
    public Class<AppendNode> nodeType() {
        return AppendNode.class;
    }

    @Override
    public void emit(AppendNode node, EmissionContext ctx) {
        if (!ctx.hasConnectedOutput(node)) {
            return;
        }
        if (!ctx.isConnected(node.slice()) || !ctx.resolvable(node.inputs())) {
            ctx.omit(node, "slice is unconnected or an element has no known type");
            return;
        }
        List<String> args = ctx.args(node.inputs());
        String argText = String.join(", ", args);
        if (node.isEllipsis() && args.size() > 1) {
            argText += "...";
        }
        EmissionContext.Results results = ctx.results(node);
        ctx.indent(results.first() + " := append(" + argText + ")");
        ctx.endStatement(node);
        ctx.assignExisting(results);
    }
}

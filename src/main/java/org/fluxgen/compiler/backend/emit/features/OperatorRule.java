package org.fluxgen.compiler.backend.emit.features;

import org.fluxgen.compiler.backend.emit.EmissionContext;
import org.fluxgen.compiler.backend.emit.INodeEmissionRule;
import org.fluxgen.compiler.graph.PortId;
import org.fluxgen.compiler.graph.nodes.OperatorNode;

import java.util.List;

/**
 * Writes {@code r := x op y} or {@code r := op x}.
 */
public class OperatorRule implements INodeEmissionRule<OperatorNode> {

    @Override
    public Class<OperatorNode> nodeType() {
        return OperatorNode.class;
    }

    @Override
    public void emit(OperatorNode node, EmissionContext ctx) {
        if (!ctx.hasConnectedOutput(node)) {
            return;
        }
        boolean anyInput = false;
        for (PortId in : node.inputs()) {
            anyInput |= ctx.isConnected(in);
        }
        if (!anyInput || !ctx.resolvable(node.inputs())) {
            ctx.omit(node, "operands are unconnected or of unknown type");
            return;
        }
        List<String> args = ctx.args(node.inputs());
        EmissionContext.Results results = ctx.results(node);
        String expr = node.isUnary()
                ? node.operator() + args.get(0)
                : args.get(0) + " " + node.operator() + " " + args.get(1);
        ctx.indent(results.first() + " := " + expr);
        ctx.endStatement(node);
        ctx.assignExisting(results);
    }
}

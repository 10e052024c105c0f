package org.fluxgen.compiler.backend.emit.features;

import org.fluxgen.compiler.backend.emit.EmissionContext;
import org.fluxgen.compiler.backend.emit.INodeEmissionRule;
import org.fluxgen.compiler.backend.emit.TypeFormatter;
import org.fluxgen.compiler.graph.nodes.ConvertNode;

/**
 * Writes {@code r := (T)(x)}. The parenthesized type keeps conversions recognizable
 * when generated text is read back.
 */
public class ConvertRule implements INodeEmissionRule<ConvertNode> {

    @Override
    public Class<ConvertNode> nodeType() {
        return ConvertNode.class;
    }

    @Override
    public void emit(ConvertNode node, EmissionContext ctx) {
        if (!ctx.hasConnectedOutput(node)) {
            return;
        }
        if (!ctx.isConnected(node.input()) || !TypeFormatter.isComplete(node.type())) {
            ctx.omit(node, "operand is unconnected or the target type is not resolved");
            return;
        }
        String x = ctx.arg(node.input());
        EmissionContext.Results results = ctx.results(node);
        ctx.indent(results.first() + " := (" + ctx.type(node.type()) + ")(" + x + ")");
        ctx.endStatement(node);
        ctx.assignExisting(results);
    }
}

package org.fluxgen.compiler.backend.emit.features;

import org.fluxgen.compiler.backend.emit.EmissionContext;
import org.fluxgen.compiler.backend.emit.INodeEmissionRule;
import org.fluxgen.compiler.backend.emit.TypeFormatter;
import org.fluxgen.compiler.graph.PortId;
import org.fluxgen.compiler.graph.nodes.MakeNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Writes {@code m := make(T, args)}. An unconnected capacity or size input is left out
 * instead of being filled with a zero value.
 */
public class MakeRule implements INodeEmissionRule<MakeNode> {

    @Override
    public Class<MakeNode> nodeType() {
        return MakeNode.class;
    }

    @Override
    public void emit(MakeNode node, EmissionContext ctx) {
        if (!ctx.hasConnectedOutput(node)) {
            return;
        }
        if (!TypeFormatter.isComplete(node.type())) {
            ctx.omit(node, "allocated type is not resolved");
            return;
        }
        List<PortId> ins = new ArrayList<>(node.inputs());
        if (!ctx.isConnected(node.optionalInput())) {
            ins.remove(node.optionalInput());
        }
        if (!ctx.resolvable(ins)) {
            ctx.omit(node, "size has no known type");
            return;
        }
        List<String> args = new ArrayList<>();
        args.add(ctx.type(node.type()));
        args.addAll(ctx.args(ins));
        EmissionContext.Results results = ctx.results(node);
        ctx.indent(results.first() + " := make(" + String.join(", ", args) + ")");
        ctx.endStatement(node);
        ctx.assignExisting(results);
    }
}

package org.fluxgen.compiler.backend.emit.features;

import org.fluxgen.compiler.backend.emit.EmissionContext;
import org.fluxgen.compiler.backend.emit.INodeEmissionRule;
import org.fluxgen.compiler.graph.PortId;
import org.fluxgen.compiler.graph.nodes.IndexNode;

import java.util.List;

/**
 * Writes {@code x[k] = v}, or {@code e[, ok] := x[k]} with the address taken when the
 * element output is addressable.
 */
public class IndexRule implements INodeEmissionRule<IndexNode> {

    @Override
    public Class<IndexNode> nodeType() {
        return IndexNode.class;
    }

    @Override
    public void emit(IndexNode node, EmissionContext ctx) {
        if (!ctx.isConnected(node.container())) {
            ctx.omit(node, "container is unconnected");
            return;
        }
        if (node.isSet()) {
            List<PortId> ins = List.of(node.container(), node.key(), node.value());
            if (!ctx.resolvable(ins)) {
                ctx.omit(node, "key or value has no known type");
                return;
            }
            List<String> args = ctx.args(ins);
            ctx.indent(args.get(0) + "[" + args.get(1) + "] = " + args.get(2));
            ctx.endStatement(node);
            return;
        }
        if (!ctx.hasConnectedOutput(node)) {
            return;
        }
        List<PortId> ins = List.of(node.container(), node.key());
        if (!ctx.resolvable(ins)) {
            ctx.omit(node, "key has no known type");
            return;
        }
        List<String> args = ctx.args(ins);
        EmissionContext.Results results = ctx.results(node);
        String amp = ctx.port(node.value()).isAddressable() ? "&" : "";
        ctx.indent(results.joined() + " := " + amp + args.get(0) + "[" + args.get(1) + "]");
        ctx.endStatement(node);
        ctx.assignExisting(results);
    }
}

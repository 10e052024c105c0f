package org.fluxgen.compiler.backend.emit.features;

import org.fluxgen.compiler.backend.emit.EmissionContext;
import org.fluxgen.compiler.backend.emit.INodeEmissionRule;
import org.fluxgen.compiler.graph.nodes.PortsNode;

/**
 * Boundary nodes write no statement of their own. Their outputs (parameters and loop
 * bindings) are already named by the enclosing construct; this rule hands those names to
 * the consumers and assigns them to variables of wider scopes.
 */
public class PortsRule implements INodeEmissionRule<PortsNode> {

    @Override
    public Class<PortsNode> nodeType() {
        return PortsNode.class;
    }

    @Override
    public void emit(PortsNode node, EmissionContext ctx) {
        ctx.assignExisting(ctx.results(node));
    }
}

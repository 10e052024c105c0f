package org.fluxgen.compiler.backend.emit.features;

import org.fluxgen.compiler.backend.emit.EmissionContext;
import org.fluxgen.compiler.backend.emit.INodeEmissionRule;
import org.fluxgen.compiler.graph.nodes.BranchNode;

public class BranchRule implements INodeEmissionRule<BranchNode> {

    @Override
    public Class<BranchNode> nodeType() {
        return BranchNode.class;
    }

    @Override
    public void emit(BranchNode node, EmissionContext ctx) {
        ctx.indent(node.text());
        ctx.endStatement(node);
    }
}

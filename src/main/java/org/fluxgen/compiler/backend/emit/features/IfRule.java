package org.fluxgen.compiler.backend.emit.features;

import org.fluxgen.compiler.api.CodegenException;
import org.fluxgen.compiler.backend.emit.EmissionContext;
import org.fluxgen.compiler.backend.emit.INodeEmissionRule;
import org.fluxgen.compiler.graph.BlockId;
import org.fluxgen.compiler.graph.PortId;
import org.fluxgen.compiler.graph.nodes.IfNode;

import java.util.List;

/**
 * Writes an {@code if / else if / else} chain, one branch per block.
 * <p>
 * A branch without a connected condition reads {@code false}, except the last one which
 * becomes the {@code else} branch. A trailing {@code else} with an empty block is left out.
 */
public class IfRule implements INodeEmissionRule<IfNode> {

    @Override
    public Class<IfNode> nodeType() {
        return IfNode.class;
    }

    @Override
    public void emit(IfNode node, EmissionContext ctx) throws CodegenException {
        List<BlockId> branches = node.branches();
        List<PortId> conditions = node.conditions();
        int count = branches.size();
        if (count > 1 && !ctx.isConnected(conditions.get(count - 1))
                && ctx.graph().block(branches.get(count - 1)).isEmpty()) {
            count--;
        }
        if (count == 0) {
            ctx.omit(node, "no branches");
            return;
        }
        ctx.indent("");
        for (int i = 0; i < count; i++) {
            if (i > 0) {
                ctx.write(" else ");
            }
            PortId cond = conditions.get(i);
            if (i == 0 || i < count - 1 || ctx.isConnected(cond)) {
                String value = ctx.binding(cond);
                ctx.write("if " + (value == null ? "false" : value) + " ");
            }
            ctx.write("{\n");
            ctx.emitBlock(branches.get(i));
            ctx.indent("}");
        }
        ctx.endStatement(node);
    }
}

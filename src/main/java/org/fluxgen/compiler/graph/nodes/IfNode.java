package org.fluxgen.compiler.graph.nodes;

import org.fluxgen.compiler.graph.BlockId;
import org.fluxgen.compiler.graph.Node;
import org.fluxgen.compiler.graph.NodeContext;
import org.fluxgen.compiler.graph.NodeKind;
import org.fluxgen.compiler.graph.PortId;
import org.fluxgen.compiler.types.Types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A conditional chain. Branch {@code i} runs its block when its condition holds and no
 * earlier condition did. A last branch whose condition is unconnected is the
 * {@code else} arm.
 */
public final class IfNode extends Node {

    private final int initialBranches;
    private final List<PortId> conditions = new ArrayList<>();

    /**
     * @param branches Number of condition/block pairs to start with, at least one.
     */
    public IfNode(int branches) {
        if (branches < 1) {
            throw new IllegalArgumentException("A conditional needs at least one branch");
        }
        this.initialBranches = branches;
    }

    public IfNode() {
        this(1);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.IF;
    }

    @Override
    protected void assemble(NodeContext ctx) {
        for (int i = 0; i < initialBranches; i++) {
            newBranch(ctx);
        }
    }

    /**
     * Appends a branch. Called during assembly and through {@code Graph.addBranch}.
     *
     * @param ctx Context bound to this node.
     * @return The branch block.
     */
    public BlockId newBranch(NodeContext ctx) {
        conditions.add(ctx.input("cond", Types.BOOL));
        return ctx.block();
    }

    public List<PortId> conditions() {
        return Collections.unmodifiableList(conditions);
    }

    /**
     * @return The branch blocks, parallel to {@link #conditions()}.
     */
    public List<BlockId> branches() {
        return blocks();
    }
}

package org.fluxgen.compiler.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A polymorphic operation inside a block.
 * <p>
 * Ports and child blocks are created by the owning {@link Graph} through
 * {@link #assemble(NodeContext)} when the node is added. Variants whose port types depend
 * on their connections override {@link #deriveTypes(TypeDerivation)}, which the
 * {@link TypePropagator} calls whenever an input of the node changes.
 */
public abstract class Node {

    private NodeId id;
    private BlockId block;
    final List<PortId> inputs = new ArrayList<>();
    final List<PortId> outputs = new ArrayList<>();
    final List<BlockId> blocks = new ArrayList<>();
    PortId sequenceIn;
    PortId sequenceOut;

    /**
     * @return The variant of this node.
     */
    public abstract NodeKind kind();

    /**
     * Creates the initial ports and child blocks.
     *
     * @param ctx The assembly context bound to this node.
     */
    protected abstract void assemble(NodeContext ctx);

    /**
     * Re-derives port types from the current connections. The default does nothing,
     * which suits nodes whose port types are fixed at creation.
     *
     * @param d Access to connected source types and port mutation.
     */
    protected void deriveTypes(TypeDerivation d) {
    }

    void attach(NodeId id, BlockId block) {
        if (this.id != null) {
            throw new IllegalStateException("Node " + this.id + " is already part of a graph");
        }
        this.id = id;
        this.block = block;
    }

    void moveTo(BlockId block) {
        this.block = block;
    }

    public NodeId id() {
        return id;
    }

    public BlockId block() {
        return block;
    }

    /**
     * @return The data inputs in declaration order.
     */
    public List<PortId> inputs() {
        return Collections.unmodifiableList(inputs);
    }

    /**
     * @return The data outputs in declaration order.
     */
    public List<PortId> outputs() {
        return Collections.unmodifiableList(outputs);
    }

    /**
     * @return The nested blocks owned by this node.
     */
    public List<BlockId> blocks() {
        return Collections.unmodifiableList(blocks);
    }

    /**
     * @return The sequence-in port, or {@code null} if this kind has none.
     */
    public PortId sequenceIn() {
        return sequenceIn;
    }

    public PortId sequenceOut() {
        return sequenceOut;
    }

    @Override
    public String toString() {
        return kind() + "#" + (id == null ? "?" : id.value());
    }
}

package org.fluxgen.compiler.api;

import org.fluxgen.compiler.graph.BlockId;
import org.fluxgen.compiler.graph.NodeId;

import java.util.List;

/**
 * Thrown when the data and sequence edges of a block form a cycle.
 */
public class CyclicBlockException extends CodegenException {

    private final BlockId block;
    private final List<NodeId> participants;

    /**
     * @param block        The cyclic block.
     * @param participants The nodes on or between the cycles, in block order.
     */
    public CyclicBlockException(BlockId block, List<NodeId> participants) {
        super(CodegenErrorCode.CYCLIC_BLOCK, "Block " + block + " is cyclic; involved nodes: " + participants);
        this.block = block;
        this.participants = List.copyOf(participants);
    }

    public BlockId block() {
        return block;
    }

    public List<NodeId> participants() {
        return participants;
    }
}

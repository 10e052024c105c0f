package org.fluxgen.compiler.graph.nodes;

import org.fluxgen.compiler.graph.Node;
import org.fluxgen.compiler.graph.NodeContext;
import org.fluxgen.compiler.graph.NodeKind;

/**
 * Synthetic boundary node exposing a block's parameters (as outputs) or results
 * (as inputs) to the nodes inside the block. Its ports are created by the owner.
 */
public final class PortsNode extends Node {

    /**
     * Which side of the boundary the node represents.
     */
    public enum Role {
        /** Outputs carry parameters, receivers or loop bindings into the block. */
        PARAMETERS,
        /** Inputs collect the results of a function body. */
        RESULTS
    }

    private final Role role;

    public PortsNode(Role role) {
        this.role = role;
    }

    public Role role() {
        return role;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.PORTS;
    }

    @Override
    protected void assemble(NodeContext ctx) {
    }
}

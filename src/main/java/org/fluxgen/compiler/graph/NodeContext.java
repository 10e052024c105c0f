package org.fluxgen.compiler.graph;

import org.fluxgen.compiler.semantics.Symbol;
import org.fluxgen.compiler.types.Type;

/**
 * Gives a node access to port and block creation while it is being assembled.
 */
public final class NodeContext {

    private final Graph graph;
    private final Node node;

    NodeContext(Graph graph, Node node) {
        this.graph = graph;
        this.node = node;
    }

    public PortId input(String name, Type type) {
        return graph.createPort(node, Port.Direction.INPUT, name, type);
    }

    public PortId output(String name, Type type) {
        return graph.createPort(node, Port.Direction.OUTPUT, name, type);
    }

    /**
     * Binds the identity a port represents, e.g. the parameter a boundary output stands for.
     */
    public void bind(PortId port, Symbol symbol) {
        graph.port(port).bind(symbol);
    }

    /**
     * Creates a nested block owned by the node.
     */
    public BlockId block() {
        return graph.createBlock(node);
    }

    /**
     * @return A context creating ports on a node that sits in one of this node's blocks.
     */
    public NodeContext forChild(Node inner) {
        if (inner.block() == null || !node.blocks().contains(inner.block())) {
            throw new IllegalArgumentException(inner + " is not nested in " + node);
        }
        return new NodeContext(graph, inner);
    }

    /**
     * Adds a node into one of the node's own nested blocks.
     */
    public <T extends Node> T add(BlockId child, T inner) {
        if (!node.blocks.contains(child)) {
            throw new IllegalArgumentException(child + " is not owned by " + node);
        }
        return graph.addNode(child, inner);
    }
}

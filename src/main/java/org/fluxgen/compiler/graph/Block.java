package org.fluxgen.compiler.graph;

import org.fluxgen.compiler.semantics.LocalVar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * An ordered scope. Node order is creation order and serves as the scheduling tie-break.
 */
public final class Block {

    private final BlockId id;
    private final NodeId owner;
    private final List<NodeId> nodes = new ArrayList<>();
    private final Set<ConnectionId> connections = new LinkedHashSet<>();
    private final List<LocalVar> locals = new ArrayList<>();

    Block(BlockId id, NodeId owner) {
        this.id = id;
        this.owner = owner;
    }

    public BlockId id() {
        return id;
    }

    /**
     * @return The node owning this block, or {@code null} for the package block.
     */
    public NodeId owner() {
        return owner;
    }

    public List<NodeId> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    /**
     * @return The connections whose innermost enclosing block is this one.
     */
    public Set<ConnectionId> connections() {
        return Collections.unmodifiableSet(connections);
    }

    public List<LocalVar> locals() {
        return Collections.unmodifiableList(locals);
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    int indexOf(NodeId node) {
        return nodes.indexOf(node);
    }

    void add(NodeId node) {
        nodes.add(node);
    }

    void remove(NodeId node) {
        nodes.remove(node);
    }

    void own(ConnectionId c) {
        connections.add(c);
    }

    void disown(ConnectionId c) {
        connections.remove(c);
    }

    void declare(LocalVar v) {
        locals.add(v);
    }

    @Override
    public String toString() {
        return id + "(owner=" + owner + ", nodes=" + nodes + ")";
    }
}

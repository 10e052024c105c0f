package org.fluxgen.compiler.graph;

/**
 * A directed edge from an output port to an input port. The owner block is the innermost
 * block enclosing both endpoints.
 */
public final class Connection {

    private final ConnectionId id;
    private final PortId source;
    private final PortId destination;
    private final boolean sequence;
    private BlockId owner;
    private boolean hidden;
    private String label = "";

    Connection(ConnectionId id, PortId source, PortId destination, boolean sequence, BlockId owner) {
        this.id = id;
        this.source = source;
        this.destination = destination;
        this.sequence = sequence;
        this.owner = owner;
    }

    public ConnectionId id() {
        return id;
    }

    public PortId source() {
        return source;
    }

    public PortId destination() {
        return destination;
    }

    public boolean isSequence() {
        return sequence;
    }

    public BlockId owner() {
        return owner;
    }

    void setOwner(BlockId owner) {
        this.owner = owner;
    }

    /**
     * @return {@code true} if the destination needs an implicit conversion or dereference
     * that is not drawn in the editor.
     */
    public boolean isHidden() {
        return hidden;
    }

    /**
     * @return The text shown in place of a hidden connection, possibly empty.
     */
    public String label() {
        return label;
    }

    void setHidden(boolean hidden, String label) {
        this.hidden = hidden;
        this.label = label == null ? "" : label;
    }

    @Override
    public String toString() {
        return id + "(" + source + " -> " + destination + ")";
    }
}

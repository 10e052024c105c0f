package org.fluxgen.compiler.graph;

import org.fluxgen.compiler.semantics.Symbol;
import org.fluxgen.compiler.types.Type;
import org.fluxgen.compiler.types.WildcardType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A typed endpoint owned by exactly one node.
 * <p>
 * A data input holds at most one connection. Outputs fan out to any number of inputs.
 * Sequence ports carry ordering only and have no type.
 */
public final class Port {

    /**
     * Direction of a port relative to its owner.
     */
    public enum Direction {
        INPUT,
        OUTPUT
    }

    private final PortId id;
    private final NodeId owner;
    private final Direction direction;
    private final boolean sequence;
    private String name;
    private Type type = WildcardType.INSTANCE;
    private boolean addressable;
    private Symbol binding;
    private final List<ConnectionId> connections = new ArrayList<>();

    Port(PortId id, NodeId owner, Direction direction, boolean sequence, String name) {
        this.id = id;
        this.owner = owner;
        this.direction = direction;
        this.sequence = sequence;
        this.name = name == null ? "" : name;
    }

    public PortId id() {
        return id;
    }

    public NodeId owner() {
        return owner;
    }

    public Direction direction() {
        return direction;
    }

    public boolean isInput() {
        return direction == Direction.INPUT;
    }

    public boolean isOutput() {
        return direction == Direction.OUTPUT;
    }

    public boolean isSequence() {
        return sequence;
    }

    /**
     * @return The name hint used when allocating an identifier for this port.
     */
    public String name() {
        return name;
    }

    void rename(String name) {
        this.name = name == null ? "" : name;
    }

    public Type type() {
        return type;
    }

    void setType(Type type) {
        this.type = type == null ? WildcardType.INSTANCE : type;
    }

    /**
     * @return {@code true} if reading this output must take the address of its storage.
     */
    public boolean isAddressable() {
        return addressable;
    }

    void setAddressable(boolean addressable) {
        this.addressable = addressable;
    }

    /**
     * @return The variable, constant or field this port represents, or {@code null}.
     */
    public Symbol binding() {
        return binding;
    }

    void bind(Symbol binding) {
        this.binding = binding;
    }

    public List<ConnectionId> connections() {
        return Collections.unmodifiableList(connections);
    }

    public boolean isConnected() {
        return !connections.isEmpty();
    }

    void attach(ConnectionId c) {
        connections.add(c);
    }

    void detach(ConnectionId c) {
        connections.remove(c);
    }

    @Override
    public String toString() {
        return id + "(" + owner + (sequence ? ".seq" : "." + name) + ":" + direction + ")";
    }
}

package org.fluxgen.compiler.graph;

import org.fluxgen.compiler.types.Type;
import org.fluxgen.compiler.types.TypeResolver;
import org.fluxgen.compiler.types.Types;
import org.fluxgen.compiler.types.WildcardType;

/**
 * The view a node gets during one propagation pass. Changing the type of an output
 * schedules every downstream node for re-derivation.
 */
public final class TypeDerivation {

    private final Graph graph;
    private final TypePropagator propagator;

    TypeDerivation(Graph graph, TypePropagator propagator) {
        this.graph = graph;
        this.propagator = propagator;
    }

    public Graph graph() {
        return graph;
    }

    public TypeResolver resolver() {
        return graph.resolver();
    }

    public boolean isConnected(PortId port) {
        return port != null && graph.port(port).isConnected();
    }

    /**
     * @return The type of the output feeding the given input, or the wildcard if unconnected.
     */
    public Type sourceType(PortId input) {
        Port p = graph.port(input);
        if (!p.isConnected()) {
            return WildcardType.INSTANCE;
        }
        Connection c = graph.connection(p.connections().get(0));
        return graph.port(c.source()).type();
    }

    public Type type(PortId port) {
        return graph.port(port).type();
    }

    public void setType(PortId port, Type type) {
        Port p = graph.port(port);
        Type old = p.type();
        Type t = type == null ? WildcardType.INSTANCE : type;
        boolean changed = Types.isWildcard(old) != Types.isWildcard(t) || !resolver().isIdentical(old, t);
        p.setType(t);
        if (changed && p.isOutput()) {
            propagator.invalidateDownstream(p);
        }
    }

    /**
     * Changes the name hint of a port.
     */
    public void rename(PortId port, String name) {
        graph.port(port).rename(name);
    }

    public void setAddressable(PortId port, boolean addressable) {
        graph.port(port).setAddressable(addressable);
    }

    public PortId addInput(Node owner, String name, Type type) {
        return graph.createPort(owner, Port.Direction.INPUT, name, type);
    }

    public PortId addOutput(Node owner, String name, Type type) {
        return graph.createPort(owner, Port.Direction.OUTPUT, name, type);
    }

    /**
     * Disconnects and deletes a port of the given node.
     */
    public void removePort(PortId port) {
        graph.deletePort(port);
    }
}

package org.fluxgen.compiler.graph;

import org.fluxgen.compiler.graph.nodes.FuncNode;
import org.fluxgen.compiler.graph.nodes.IfNode;
import org.fluxgen.compiler.semantics.FuncSymbol;
import org.fluxgen.compiler.semantics.LocalVar;
import org.fluxgen.compiler.semantics.PackageScope;
import org.fluxgen.compiler.types.Type;
import org.fluxgen.compiler.types.TypeResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Arena holding the blocks, nodes, ports and connections of one package.
 * <p>
 * Entities refer to each other by handle only. Every structural edit validates its
 * arguments before mutating anything, so a failed edit leaves the graph unchanged, and
 * re-derives the affected port types synchronously before returning.
 * <p>
 * Top-level definitions are {@link FuncNode}s in the package block. This class is not
 * thread-safe.
 */
public class Graph {

    private static final Logger LOG = LoggerFactory.getLogger(Graph.class);

    private final PackageScope scope;
    private final TypeResolver resolver;
    private final TypePropagator propagator;
    private final Map<NodeId, Node> nodes = new LinkedHashMap<>();
    private final Map<PortId, Port> ports = new LinkedHashMap<>();
    private final Map<BlockId, Block> blocks = new LinkedHashMap<>();
    private final Map<ConnectionId, Connection> connections = new LinkedHashMap<>();
    private final List<NodeId> definitions = new ArrayList<>();
    private final BlockId packageBlock;
    private int nextId;

    public Graph(PackageScope scope, TypeResolver resolver) {
        this(scope, resolver, TypePropagator.DEFAULT_MAX_PASSES);
    }

    /**
     * @param scope            The package being edited.
     * @param resolver         The type authority used for propagation.
     * @param maxPassesPerNode Cap on derivation passes per node and edit.
     */
    public Graph(PackageScope scope, TypeResolver resolver, int maxPassesPerNode) {
        this.scope = scope;
        this.resolver = resolver;
        this.propagator = new TypePropagator(this, maxPassesPerNode);
        BlockId id = new BlockId(nextId++);
        blocks.put(id, new Block(id, null));
        this.packageBlock = id;
    }

    public PackageScope scope() {
        return scope;
    }

    public TypeResolver resolver() {
        return resolver;
    }

    public BlockId packageBlock() {
        return packageBlock;
    }

    // ---------------------------------------------------------------- structural edits

    /**
     * Creates a top-level function definition and declares it in the package scope
     * unless a symbol of that name exists already.
     *
     * @param symbol The function symbol.
     * @return The definition node.
     */
    public FuncNode newFunction(FuncSymbol symbol) {
        if (scope.lookup(symbol.name()).isEmpty() && !symbol.isMethod()) {
            scope.declare(symbol);
        }
        FuncNode f = addNode(packageBlock, new FuncNode(symbol));
        definitions.add(f.id());
        return f;
    }

    /**
     * Adds a node to a block and assembles its ports and nested blocks.
     *
     * @param block The block receiving the node.
     * @param node  A fresh node instance.
     * @return The same node, now attached.
     */
    public <T extends Node> T addNode(BlockId block, T node) {
        Block b = block(block);
        node.attach(new NodeId(nextId++), block);
        nodes.put(node.id(), node);
        b.add(node.id());
        if (node.kind().hasSequencePorts()) {
            node.sequenceIn = newPort(node, Port.Direction.INPUT, true, "");
            node.sequenceOut = newPort(node, Port.Direction.OUTPUT, true, "");
        }
        node.assemble(new NodeContext(this, node));
        LOG.debug("Added {} to {}", node, block);
        propagator.invalidate(node.id());
        propagator.run();
        return node;
    }

    /**
     * Removes a node together with its nested blocks and every connection touching them.
     *
     * @throws IllegalArgumentException if the node is the parameter, result or binding
     *                                  boundary of a function or loop.
     */
    public void removeNode(NodeId id) {
        Node node = node(id);
        rejectBoundary(node, "removed");
        Set<NodeId> affected = new LinkedHashSet<>();
        removeRecursively(node, affected);
        definitions.remove(id);
        affected.forEach(propagator::invalidate);
        propagator.run();
    }

    // boundaries live and die with their owning function or loop
    private static void rejectBoundary(Node node, String action) {
        if (node.kind() == NodeKind.PORTS) {
            throw new IllegalArgumentException("Boundary node " + node + " cannot be " + action + " on its own");
        }
    }

    private void removeRecursively(Node node, Set<NodeId> affected) {
        for (BlockId b : List.copyOf(node.blocks)) {
            for (NodeId inner : List.copyOf(block(b).nodes())) {
                removeRecursively(node(inner), affected);
            }
            blocks.remove(b);
        }
        for (PortId p : allPorts(node)) {
            for (ConnectionId c : List.copyOf(port(p).connections())) {
                Connection conn = connection(c);
                affected.add(port(conn.destination()).owner());
                unlink(conn);
            }
            ports.remove(p);
        }
        block(node.block()).remove(node.id());
        nodes.remove(node.id());
        affected.remove(node.id());
        LOG.debug("Removed {}", node);
    }

    /**
     * Connects an output to an input. A data input that is already connected has its old
     * connection replaced. Sequence ports connect only to sequence ports.
     *
     * @param source      An output port.
     * @param destination An input port.
     * @return The new connection.
     * @throws IllegalArgumentException if the ports cannot be connected.
     */
    public Connection connect(PortId source, PortId destination) {
        Port src = port(source);
        Port dst = port(destination);
        if (!src.isOutput() || !dst.isInput()) {
            throw new IllegalArgumentException("Connections run from an output to an input: " + src + " -> " + dst);
        }
        if (src.isSequence() != dst.isSequence()) {
            throw new IllegalArgumentException("Cannot connect a sequence port to a data port: " + src + " -> " + dst);
        }
        if (src.owner().equals(dst.owner())) {
            throw new IllegalArgumentException("Cannot connect " + src.owner() + " to itself");
        }
        for (ConnectionId existing : dst.connections()) {
            if (connection(existing).source().equals(source)) {
                return connection(existing);
            }
        }
        if (!dst.isSequence()) {
            for (ConnectionId old : List.copyOf(dst.connections())) {
                unlink(connection(old));
            }
        }
        BlockId owner = commonBlock(node(src.owner()).block(), node(dst.owner()).block());
        ConnectionId id = new ConnectionId(nextId++);
        Connection c = new Connection(id, source, destination, src.isSequence(), owner);
        connections.put(id, c);
        src.attach(id);
        dst.attach(id);
        block(owner).own(id);
        LOG.debug("Connected {} in {}", c, owner);
        propagator.invalidate(dst.owner());
        propagator.run();
        return c;
    }

    public void disconnect(ConnectionId id) {
        Connection c = connection(id);
        unlink(c);
        LOG.debug("Disconnected {}", c);
        propagator.invalidate(port(c.destination()).owner());
        propagator.run();
    }

    /**
     * Moves a node, with everything nested in it, into another block.
     *
     * @throws IllegalArgumentException if the target block is nested inside the node, or
     *                                  the node is a function or loop boundary.
     */
    public void reparent(NodeId id, BlockId target) {
        Node node = node(id);
        block(target);
        rejectBoundary(node, "moved");
        if (target.equals(packageBlock) != node.block().equals(packageBlock)) {
            throw new IllegalArgumentException("Definitions cannot be moved in or out of the package block");
        }
        for (BlockId b = target; b != null; b = parentOf(b)) {
            if (node.blocks.contains(b)) {
                throw new IllegalArgumentException("Cannot move " + node + " into its own nested " + target);
            }
        }
        block(node.block()).remove(id);
        block(target).add(id);
        node.moveTo(target);
        Set<NodeId> subtree = new HashSet<>();
        collectSubtree(node, subtree);
        for (NodeId n : subtree) {
            for (PortId p : allPorts(node(n))) {
                for (ConnectionId cid : port(p).connections()) {
                    Connection c = connection(cid);
                    BlockId owner = commonBlock(node(port(c.source()).owner()).block(),
                            node(port(c.destination()).owner()).block());
                    if (!owner.equals(c.owner())) {
                        block(c.owner()).disown(cid);
                        block(owner).own(cid);
                        c.setOwner(owner);
                    }
                }
            }
        }
        LOG.debug("Moved {} to {}", node, target);
    }

    /**
     * Declares a block-local variable.
     */
    public void declareLocal(BlockId block, LocalVar variable) {
        block(block).declare(variable);
    }

    /**
     * Appends a condition and branch block to a conditional.
     *
     * @return The new branch block.
     */
    public BlockId addBranch(IfNode node) {
        node(node.id());
        BlockId b = node.newBranch(new NodeContext(this, node));
        propagator.invalidate(node.id());
        propagator.run();
        return b;
    }

    /**
     * Flags a connection whose destination needs an implicit conversion that is not drawn.
     */
    public void setHidden(ConnectionId id, boolean hidden, String label) {
        connection(id).setHidden(hidden, label);
    }

    // ---------------------------------------------------------------- queries

    public Node node(NodeId id) {
        Node n = nodes.get(id);
        if (n == null) {
            throw new IllegalArgumentException("Unknown node " + id);
        }
        return n;
    }

    Node findNode(NodeId id) {
        return nodes.get(id);
    }

    /**
     * @return The node cast to the requested variant.
     */
    public <T extends Node> T node(NodeId id, Class<T> type) {
        return type.cast(node(id));
    }

    public Port port(PortId id) {
        Port p = ports.get(id);
        if (p == null) {
            throw new IllegalArgumentException("Unknown port " + id);
        }
        return p;
    }

    public Block block(BlockId id) {
        Block b = blocks.get(id);
        if (b == null) {
            throw new IllegalArgumentException("Unknown block " + id);
        }
        return b;
    }

    public Connection connection(ConnectionId id) {
        Connection c = connections.get(id);
        if (c == null) {
            throw new IllegalArgumentException("Unknown connection " + id);
        }
        return c;
    }

    public boolean contains(NodeId id) {
        return nodes.containsKey(id);
    }

    /**
     * @return The top-level function definitions in creation order.
     */
    public List<FuncNode> definitions() {
        List<FuncNode> out = new ArrayList<>();
        for (NodeId id : definitions) {
            out.add(node(id, FuncNode.class));
        }
        return Collections.unmodifiableList(out);
    }

    /**
     * @return Connections arriving at the node's data and sequence inputs.
     */
    public List<Connection> incoming(NodeId id) {
        Node n = node(id);
        List<Connection> out = new ArrayList<>();
        for (PortId p : n.inputs) {
            port(p).connections().forEach(c -> out.add(connection(c)));
        }
        if (n.sequenceIn != null) {
            port(n.sequenceIn).connections().forEach(c -> out.add(connection(c)));
        }
        return out;
    }

    /**
     * @return Connections leaving the node's data and sequence outputs.
     */
    public List<Connection> outgoing(NodeId id) {
        Node n = node(id);
        List<Connection> out = new ArrayList<>();
        for (PortId p : n.outputs) {
            port(p).connections().forEach(c -> out.add(connection(c)));
        }
        if (n.sequenceOut != null) {
            port(n.sequenceOut).connections().forEach(c -> out.add(connection(c)));
        }
        return out;
    }

    /**
     * @return The block enclosing the given block, or {@code null} for the package block.
     */
    public BlockId parentOf(BlockId id) {
        NodeId owner = block(id).owner();
        return owner == null ? null : node(owner).block();
    }

    /**
     * @return {@code true} if {@code inner} is {@code outer} or nested inside it.
     */
    public boolean isWithin(BlockId inner, BlockId outer) {
        for (BlockId b = inner; b != null; b = parentOf(b)) {
            if (b.equals(outer)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Lifts a node to the block: returns the node itself or the ancestor node that sits
     * directly in the block.
     *
     * @return The lifted node, or {@code null} if the node is not inside the block.
     */
    public NodeId liftTo(NodeId id, BlockId block) {
        NodeId current = id;
        while (current != null) {
            Node n = node(current);
            if (n.block().equals(block)) {
                return current;
            }
            current = block(n.block()).owner();
        }
        return null;
    }

    /**
     * @return The innermost block enclosing both blocks.
     */
    public BlockId commonBlock(BlockId a, BlockId b) {
        Set<BlockId> chain = new HashSet<>();
        for (BlockId x = a; x != null; x = parentOf(x)) {
            chain.add(x);
        }
        for (BlockId y = b; y != null; y = parentOf(y)) {
            if (chain.contains(y)) {
                return y;
            }
        }
        return packageBlock;
    }

    // ---------------------------------------------------------------- internals

    PortId createPort(Node owner, Port.Direction direction, String name, Type type) {
        PortId id = newPort(owner, direction, false, name);
        ports.get(id).setType(type);
        if (direction == Port.Direction.INPUT) {
            owner.inputs.add(id);
        } else {
            owner.outputs.add(id);
        }
        return id;
    }

    private PortId newPort(Node owner, Port.Direction direction, boolean sequence, String name) {
        PortId id = new PortId(nextId++);
        ports.put(id, new Port(id, owner.id(), direction, sequence, name));
        return id;
    }

    BlockId createBlock(Node owner) {
        BlockId id = new BlockId(nextId++);
        blocks.put(id, new Block(id, owner.id()));
        owner.blocks.add(id);
        return id;
    }

    void deletePort(PortId id) {
        Port p = port(id);
        Node owner = node(p.owner());
        for (ConnectionId c : List.copyOf(p.connections())) {
            Connection conn = connection(c);
            propagator.invalidate(port(conn.destination()).owner());
            unlink(conn);
        }
        owner.inputs.remove(id);
        owner.outputs.remove(id);
        ports.remove(id);
    }

    private void unlink(Connection c) {
        port(c.source()).detach(c.id());
        port(c.destination()).detach(c.id());
        Block owner = blocks.get(c.owner());
        if (owner != null) {
            owner.disown(c.id());
        }
        connections.remove(c.id());
    }

    private List<PortId> allPorts(Node n) {
        List<PortId> all = new ArrayList<>(n.inputs);
        all.addAll(n.outputs);
        if (n.sequenceIn != null) {
            all.add(n.sequenceIn);
            all.add(n.sequenceOut);
        }
        return all;
    }

    private void collectSubtree(Node n, Set<NodeId> out) {
        out.add(n.id());
        for (BlockId b : n.blocks) {
            for (NodeId inner : block(b).nodes()) {
                collectSubtree(node(inner), out);
            }
        }
    }
}

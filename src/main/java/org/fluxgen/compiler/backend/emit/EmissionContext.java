package org.fluxgen.compiler.backend.emit;

import org.fluxgen.compiler.api.CodegenException;
import org.fluxgen.compiler.diagnostics.DiagnosticsEngine;
import org.fluxgen.compiler.graph.BlockId;
import org.fluxgen.compiler.graph.Connection;
import org.fluxgen.compiler.graph.ConnectionId;
import org.fluxgen.compiler.graph.Graph;
import org.fluxgen.compiler.graph.Node;
import org.fluxgen.compiler.graph.NodeId;
import org.fluxgen.compiler.graph.Port;
import org.fluxgen.compiler.graph.PortId;
import org.fluxgen.compiler.graph.nodes.FuncNode;
import org.fluxgen.compiler.semantics.LocalVar;
import org.fluxgen.compiler.semantics.Symbol;
import org.fluxgen.compiler.types.GoPackage;
import org.fluxgen.compiler.types.Type;
import org.fluxgen.compiler.types.Types;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * State of one emission session: the output buffer, the name allocator, imported
 * packages, sequence ids and the scoped bindings from ports to identifiers.
 * <p>
 * Bindings are copied when a block is entered and discarded when it is left, so a name
 * bound inside a branch is never visible after it.
 */
public final class EmissionContext {

    private static final Logger LOG = LoggerFactory.getLogger(EmissionContext.class);

    private final Emitter emitter;
    private final Graph graph;
    private final GoPackage pkg;
    private final String definition;
    private final String indentUnit;
    private final NameAllocator names;
    private final DiagnosticsEngine diagnostics;
    private final TypeFormatter types;
    private final Map<GoPackage, String> packageNames = new LinkedHashMap<>();
    private final Map<NodeId, Integer> sequenceIds = new HashMap<>();
    private final Deque<Scope> scopes = new ArrayDeque<>();
    private StringBuilder out = new StringBuilder();
    private int depth;
    private int nextSequenceId;

    private record Scope(Map<PortId, String> ports, Map<LocalVar, String> locals) {
        Scope copy() {
            return new Scope(new HashMap<>(ports), new HashMap<>(locals));
        }
    }

    EmissionContext(Emitter emitter, Graph graph, String definition, String indentUnit,
                    NameAllocator names, DiagnosticsEngine diagnostics) {
        this.emitter = emitter;
        this.graph = graph;
        this.pkg = graph.scope().pkg();
        this.definition = definition;
        this.indentUnit = indentUnit;
        this.names = names;
        this.diagnostics = diagnostics;
        this.types = new TypeFormatter(this::packageName);
        scopes.push(new Scope(new HashMap<>(), new HashMap<>()));
    }

    public Graph graph() {
        return graph;
    }

    public Port port(PortId id) {
        return graph.port(id);
    }

    public <T extends Node> T node(NodeId id, Class<T> type) {
        return graph.node(id, type);
    }

    // ---------------------------------------------------------------- text

    /**
     * Writes text at the current position.
     */
    public void write(String text) {
        out.append(text);
    }

    /**
     * Starts a new line at the current indentation and writes text.
     */
    public void indent(String text) {
        out.append(indentUnit.repeat(depth)).append(text);
    }

    /**
     * Writes a complete line that carries no sequence annotation.
     */
    public void line(String text) {
        indent(text);
        out.append('\n');
    }

    /**
     * @return The text of one indentation level.
     */
    public String indentUnit() {
        return indentUnit;
    }

    void enter() {
        depth++;
    }

    void leave() {
        depth--;
    }

    /**
     * Redirects output into a fresh buffer and returns the previous one.
     */
    StringBuilder swapBuffer(StringBuilder replacement) {
        StringBuilder previous = out;
        out = replacement;
        return previous;
    }

    // ---------------------------------------------------------------- names and types

    /**
     * @return A fresh identifier based on the hint.
     */
    public String name(String hint) {
        return names.name(hint);
    }

    /**
     * @return The type text; foreign packages are imported as a side effect.
     */
    public String type(Type t) {
        return types.format(t);
    }

    public TypeFormatter formatter() {
        return types;
    }

    /**
     * @return The symbol name, qualified with its package's local name when foreign.
     */
    public String qualifiedName(Symbol symbol) {
        if (symbol instanceof LocalVar v) {
            return localName(v);
        }
        return types.qualify(symbol.pkg(), symbol.name());
    }

    /**
     * @return The local name of a foreign package, or {@code null} for the package itself.
     */
    public String packageName(GoPackage p) {
        if (p == null || p.path().equals(pkg.path())) {
            return null;
        }
        return packageNames.computeIfAbsent(p, k -> names.name(k.name()));
    }

    /**
     * @return Imported packages sorted by path, mapped to their local names.
     */
    public List<Map.Entry<GoPackage, String>> imports() {
        List<Map.Entry<GoPackage, String>> list = new ArrayList<>(packageNames.entrySet());
        list.sort(Comparator.comparing(e -> e.getKey().path()));
        return Collections.unmodifiableList(list);
    }

    // ---------------------------------------------------------------- bindings

    void pushScope() {
        scopes.push(scopes.peek().copy());
    }

    void popScope() {
        scopes.pop();
    }

    public String binding(PortId port) {
        return scopes.peek().ports().get(port);
    }

    public boolean isBound(PortId port) {
        return binding(port) != null;
    }

    public void bind(PortId port, String name) {
        scopes.peek().ports().put(port, name);
    }

    public void bindLocal(LocalVar v, String name) {
        scopes.peek().locals().put(v, name);
    }

    /**
     * @return The identifier declared for a block-local variable or parameter.
     */
    public String localName(LocalVar v) {
        String n = scopes.peek().locals().get(v);
        if (n == null) {
            LOG.debug("Local '{}' used outside its declaring block in {}", v.name(), definition);
            return v.name();
        }
        return n;
    }

    // ---------------------------------------------------------------- statements

    public boolean isConnected(PortId port) {
        return port(port).isConnected();
    }

    /**
     * @return {@code true} if any data output of the node feeds another node.
     */
    public boolean hasConnectedOutput(Node node) {
        for (PortId out : node.outputs()) {
            if (isConnected(out)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return {@code true} if {@link #arg(PortId)} yields a value for every input.
     */
    public boolean resolvable(List<PortId> inputs) {
        for (PortId in : inputs) {
            if (!isBound(in) && !TypeFormatter.isComplete(port(in).type())) {
                return false;
            }
        }
        return true;
    }

    /**
     * Resolves the values of the given inputs. Unbound inputs of reference-like type read
     * {@code nil}; other unbound inputs of known type read a freshly declared zero value;
     * unbound inputs of unknown type yield {@code null}.
     *
     * @param inputs The inputs in argument order.
     * @return One entry per input, {@code null} where no value can be derived.
     */
    public List<String> args(List<PortId> inputs) {
        List<String> args = new ArrayList<>(inputs.size());
        for (PortId in : inputs) {
            args.add(arg(in));
        }
        return args;
    }

    /**
     * @see #args(List)
     */
    public String arg(PortId in) {
        String bound = binding(in);
        if (bound != null) {
            return bound;
        }
        Type t = port(in).type();
        if (!TypeFormatter.isComplete(t)) {
            return null;
        }
        if (Types.isReferenceLike(t)) {
            return "nil";
        }
        String zero = name("v");
        line("var " + zero + " " + type(t));
        return zero;
    }

    /**
     * Allocates the result names of a node and binds its consumers. A consumer already
     * bound elsewhere, typically a variable declared in a wider scope, is recorded as an
     * assignment to make after the statement.
     *
     * @param node The producing node.
     * @return The result names, {@code _} for unconnected outputs, empty if none is connected.
     */
    public Results results(Node node) {
        List<String> names = new ArrayList<>();
        List<String> assignments = new ArrayList<>();
        Set<String> assigned = new HashSet<>();
        boolean any = false;
        for (PortId out : node.outputs()) {
            Port p = port(out);
            if (!p.isConnected()) {
                names.add("_");
                continue;
            }
            any = true;
            String name = binding(out);
            if (name == null) {
                name = name(p.name());
                bind(out, name);
            }
            for (ConnectionId cid : p.connections()) {
                Connection c = graph.connection(cid);
                String value = name;
                if (Types.needsDereference(graph.resolver(), p.type(), port(c.destination()).type())) {
                    value = "*" + value;
                }
                String existing = binding(c.destination());
                if (existing != null) {
                    if (!assigned.add(existing)) {
                        continue;
                    }
                    String label = c.isHidden() && !c.label().isEmpty() ? "//" + c.label() : "";
                    assignments.add(existing + " = " + value + label);
                } else {
                    bind(c.destination(), value);
                }
            }
            names.add(name);
        }
        if (!any) {
            return Results.NONE;
        }
        return new Results(names, assignments);
    }

    /**
     * Writes the assignments that copy fresh results into names of wider scopes.
     */
    public void assignExisting(Results results) {
        for (String a : results.assignments()) {
            line(a);
        }
    }

    /**
     * Ends the current statement, appending the sequence annotation if the node takes part
     * in explicit ordering.
     */
    public void endStatement(Node node) {
        List<Integer> predecessors = new ArrayList<>();
        boolean in = node.sequenceIn() != null && port(node.sequenceIn()).isConnected();
        boolean outgoing = node.sequenceOut() != null && port(node.sequenceOut()).isConnected();
        if (in) {
            for (ConnectionId cid : port(node.sequenceIn()).connections()) {
                Integer id = sequenceIds.get(port(graph.connection(cid).source()).owner());
                if (id != null) {
                    predecessors.add(id);
                }
            }
        }
        if (!predecessors.isEmpty() || outgoing) {
            int id = -1;
            if (outgoing) {
                id = nextSequenceId++;
                sequenceIds.put(node.id(), id);
            }
            out.append(new SequenceAnnotation(predecessors, id).format());
        }
        out.append('\n');
    }

    /**
     * Records that a node produced no statement.
     */
    public void omit(Node node, String reason) {
        LOG.debug("Omitting {} in {}: {}", node, definition, reason);
        diagnostics.reportWarning("statement omitted: " + reason, definition, node.id().value());
    }

    // ---------------------------------------------------------------- nesting

    /**
     * Emits a nested block one level deeper, with a copy of the current bindings.
     */
    public void emitBlock(BlockId block) throws CodegenException {
        emitter.emitBlock(block, this);
    }

    /**
     * Emits a function literal starting at the current position.
     */
    public void emitFunctionLiteral(FuncNode literal) throws CodegenException {
        emitter.emitFunction(literal, this);
    }

    public DiagnosticsEngine diagnostics() {
        return diagnostics;
    }

    public String definition() {
        return definition;
    }

    /**
     * Result names of a statement and the assignments that follow it.
     *
     * @param names       One name per output, {@code _} where unconnected.
     * @param assignments Statements of the form {@code existing = fresh}.
     */
    public record Results(List<String> names, List<String> assignments) {

        static final Results NONE = new Results(List.of(), List.of());

        public boolean isEmpty() {
            return names.isEmpty();
        }

        /**
         * @return The names joined for the left-hand side of a declaration.
         */
        public String joined() {
            return String.join(", ", names);
        }

        public String first() {
            return names.get(0);
        }
    }
}

package org.fluxgen.compiler.backend.emit;

import org.fluxgen.compiler.api.CodegenErrorCode;
import org.fluxgen.compiler.api.CodegenException;
import org.fluxgen.compiler.api.CyclicBlockException;
import org.fluxgen.compiler.backend.schedule.Scheduler;
import org.fluxgen.compiler.diagnostics.DiagnosticsEngine;
import org.fluxgen.compiler.graph.Block;
import org.fluxgen.compiler.graph.BlockId;
import org.fluxgen.compiler.graph.Connection;
import org.fluxgen.compiler.graph.ConnectionId;
import org.fluxgen.compiler.graph.Graph;
import org.fluxgen.compiler.graph.Node;
import org.fluxgen.compiler.graph.NodeId;
import org.fluxgen.compiler.graph.NodeKind;
import org.fluxgen.compiler.graph.Port;
import org.fluxgen.compiler.graph.PortId;
import org.fluxgen.compiler.graph.nodes.FuncNode;
import org.fluxgen.compiler.semantics.LocalVar;
import org.fluxgen.compiler.semantics.Universe;
import org.fluxgen.compiler.types.GoPackage;
import org.fluxgen.compiler.types.NamedType;
import org.fluxgen.compiler.types.SignatureType;
import org.fluxgen.compiler.types.Type;
import org.fluxgen.config.CodegenSettings;
import org.fluxgen.config.CyclePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns top-level definitions of a graph into source text.
 * <p>
 * Each call to {@link #emitDefinition} or {@link #emitType} is one emission session with
 * its own {@link NameAllocator}, seeded with every name visible in the package. Blocks are
 * written in the order computed by the {@link Scheduler}; each node is written by the
 * rule the {@link EmissionRegistry} holds for its kind.
 */
public class Emitter {

    private static final Logger LOG = LoggerFactory.getLogger(Emitter.class);

    private final Graph graph;
    private final CodegenSettings settings;
    private final EmissionRegistry registry;
    private final Scheduler scheduler;

    public Emitter(Graph graph, CodegenSettings settings) {
        this(graph, settings, EmissionRegistry.initializeWithDefaults());
    }

    /**
     * @param graph    The graph to emit from.
     * @param settings Indentation, naming and cycle policy.
     * @param registry Rules for every node kind.
     * @throws IllegalStateException if the registry lacks a rule for some node kind.
     */
    public Emitter(Graph graph, CodegenSettings settings, EmissionRegistry registry) {
        Set<NodeKind> missing = registry.missingKinds();
        if (!missing.isEmpty()) {
            throw new IllegalStateException("No emission rule for node kinds " + missing);
        }
        this.graph = graph;
        this.settings = settings;
        this.registry = registry;
        this.scheduler = new Scheduler(graph);
    }

    /**
     * Emits a function or method definition as a complete unit.
     *
     * @param definition  A definition from {@link Graph#definitions()}.
     * @param diagnostics Collects omitted statements and skipped blocks.
     * @return The unit text, starting with the package clause.
     * @throws CodegenException if a header type is unresolved, or a block is cyclic under
     *                          the abort policy.
     */
    public String emitDefinition(FuncNode definition, DiagnosticsEngine diagnostics) throws CodegenException {
        if (definition.isLiteral()) {
            throw new IllegalArgumentException("Not a top-level definition: " + definition);
        }
        String name = definitionName(definition);
        LOG.debug("Emitting definition {}", name);
        EmissionContext ctx = newSession(name, diagnostics);
        emitFunction(definition, ctx);
        return unit(ctx, ctx.swapBuffer(new StringBuilder()).toString());
    }

    /**
     * Emits a named type declaration as a complete unit.
     *
     * @param type        A type declared in the graph's package.
     * @param diagnostics Session diagnostics.
     * @return The unit text.
     * @throws CodegenException if the underlying type is not fully resolved.
     */
    public String emitType(NamedType type, DiagnosticsEngine diagnostics) throws CodegenException {
        LOG.debug("Emitting type {}", type.name());
        EmissionContext ctx = newSession(type.name(), diagnostics);
        if (!TypeFormatter.isComplete(type.underlying())) {
            throw new CodegenException(CodegenErrorCode.UNRESOLVED_REFERENCE,
                    "Underlying type of " + type.name() + " is not resolved");
        }
        String body = "type " + type.name() + " " + ctx.type(type.underlying()) + "\n";
        return unit(ctx, body);
    }

    private EmissionContext newSession(String definition, DiagnosticsEngine diagnostics) {
        List<String> reserved = new ArrayList<>(Universe.names());
        reserved.addAll(Universe.keywords());
        reserved.addAll(graph.scope().names());
        NameAllocator names = new NameAllocator(reserved, settings.defaultBase());
        return new EmissionContext(this, graph, definition, settings.indent(), names, diagnostics);
    }

    private String unit(EmissionContext ctx, String body) {
        StringBuilder sb = new StringBuilder();
        sb.append("package ").append(graph.scope().pkg().name()).append("\n\n");
        List<Map.Entry<GoPackage, String>> imports = ctx.imports();
        if (!imports.isEmpty()) {
            sb.append("import (\n");
            for (Map.Entry<GoPackage, String> e : imports) {
                sb.append(settings.indent());
                if (!e.getValue().equals(e.getKey().name())) {
                    sb.append(e.getValue()).append(' ');
                }
                sb.append('"').append(e.getKey().path()).append("\"\n");
            }
            sb.append(")\n\n");
        }
        return sb.append(body).toString();
    }

    /**
     * @return {@code Name} for functions, {@code Recv.Name} for methods.
     */
    static String definitionName(FuncNode definition) {
        return definition.symbol().receiverType()
                .map(r -> r.name() + "." + definition.symbol().name())
                .orElse(definition.symbol().name());
    }

    /**
     * Writes a function header and body. Literals are written without a name, starting
     * at the current position; the closing brace ends the line.
     */
    void emitFunction(FuncNode f, EmissionContext ctx) throws CodegenException {
        SignatureType sig = f.signature();
        if (!TypeFormatter.isComplete(sig)) {
            throw new CodegenException(CodegenErrorCode.UNRESOLVED_REFERENCE,
                    "Signature of " + (f.isLiteral() ? "function literal" : ctx.definition()) + " is not resolved");
        }
        ctx.pushScope();
        List<PortId> params = f.parameterPorts();
        int first = 0;
        if (f.isLiteral()) {
            ctx.write("func(");
        } else {
            ctx.write("func ");
            if (sig.isMethod()) {
                PortId recv = params.get(0);
                ctx.write("(" + declareParameter(recv, ctx) + " " + ctx.type(ctx.port(recv).type()) + ") ");
                first = 1;
            }
            ctx.write(f.symbol().name() + "(");
        }
        for (int i = first; i < params.size(); i++) {
            if (i > first) {
                ctx.write(", ");
            }
            PortId p = params.get(i);
            Type t = ctx.port(p).type();
            String text = sig.variadic() && i == params.size() - 1 ? ctx.formatter().variadic(t) : ctx.type(t);
            ctx.write(declareParameter(p, ctx) + " " + text);
        }
        ctx.write(")");
        List<String> existing = new ArrayList<>();
        List<PortId> results = f.resultPorts();
        if (!results.isEmpty()) {
            ctx.write(" (");
            for (int i = 0; i < results.size(); i++) {
                if (i > 0) {
                    ctx.write(", ");
                }
                PortId r = results.get(i);
                Port port = ctx.port(r);
                String name = ctx.name(port.name());
                String outer = ctx.binding(r);
                if (outer != null) {
                    // fed from an enclosing scope
                    existing.add(name + " = " + outer);
                }
                ctx.bind(r, name);
                bindLocal(port, name, ctx);
                ctx.write(name + " " + ctx.type(port.type()));
            }
            ctx.write(")");
        }
        ctx.write(" {\n");
        ctx.enter();
        for (String a : existing) {
            ctx.line(a);
        }
        ctx.leave();
        ctx.emitBlock(f.body());
        if (!results.isEmpty()) {
            ctx.enter();
            ctx.line("return");
            ctx.leave();
        }
        ctx.indent("}\n");
        ctx.popScope();
    }

    private static String declareParameter(PortId p, EmissionContext ctx) {
        Port port = ctx.port(p);
        String name = ctx.name(port.name());
        ctx.bind(p, name);
        bindLocal(port, name, ctx);
        return name;
    }

    private static void bindLocal(Port port, String name, EmissionContext ctx) {
        if (port.binding() instanceof LocalVar v) {
            ctx.bindLocal(v, name);
        }
    }

    /**
     * Writes the statements of a block one level deeper than the current position.
     * <p>
     * Block-local variables are declared first, then one variable for every connection
     * whose value is produced in a nested block but consumed outside of it. The producer
     * assigns to that variable once its own statement is written.
     */
    void emitBlock(BlockId blockId, EmissionContext ctx) throws CodegenException {
        List<NodeId> order;
        try {
            order = scheduler.order(blockId);
        } catch (CyclicBlockException e) {
            LOG.warn("Cyclic block {} in {} involving {}", blockId, ctx.definition(), e.participants());
            if (settings.cyclePolicy() == CyclePolicy.ABORT) {
                throw e;
            }
            int nodeId = e.participants().isEmpty() ? -1 : e.participants().get(0).value();
            ctx.diagnostics().reportError("cyclic block " + blockId + " skipped", ctx.definition(), nodeId);
            return;
        }
        LOG.debug("Block {} of {} in order {}", blockId, ctx.definition(), order);
        Block block = graph.block(blockId);
        ctx.pushScope();
        ctx.enter();
        for (LocalVar v : block.locals()) {
            if (!TypeFormatter.isComplete(v.type())) {
                ctx.diagnostics().reportWarning("local '" + v.name() + "' has no resolved type", ctx.definition(), -1);
                continue;
            }
            String name = ctx.name(v.name());
            ctx.bindLocal(v, name);
            ctx.line("var " + name + " " + ctx.type(v.type()));
        }
        // one variable per producing port and declared type, shared by all its consumers here
        Map<String, String> crossing = new HashMap<>();
        for (ConnectionId cid : block.connections()) {
            Connection c = graph.connection(cid);
            if (c.isSequence() || ctx.isBound(c.destination())) {
                continue;
            }
            Node producer = graph.node(ctx.port(c.source()).owner());
            if (producer.block().equals(blockId)) {
                continue;
            }
            Type t = ctx.port(c.destination()).type();
            if (!TypeFormatter.isComplete(t)) {
                t = ctx.port(c.source()).type();
            }
            if (!TypeFormatter.isComplete(t)) {
                ctx.diagnostics().reportInfo("value leaving a nested block has no resolved type",
                        ctx.definition(), producer.id().value());
                continue;
            }
            String typeText = ctx.type(t);
            String key = c.source().value() + " " + typeText;
            String name = crossing.get(key);
            if (name == null) {
                name = ctx.name("v");
                ctx.line("var " + name + " " + typeText);
                crossing.put(key, name);
            }
            ctx.bind(c.destination(), name);
        }
        for (NodeId id : order) {
            Node node = graph.node(id);
            registry.resolve(node).emit(node, ctx);
        }
        ctx.leave();
        ctx.popScope();
    }
}

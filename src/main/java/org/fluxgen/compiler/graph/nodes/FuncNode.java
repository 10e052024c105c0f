package org.fluxgen.compiler.graph.nodes;

import org.fluxgen.compiler.graph.BlockId;
import org.fluxgen.compiler.graph.Node;
import org.fluxgen.compiler.graph.NodeContext;
import org.fluxgen.compiler.graph.NodeKind;
import org.fluxgen.compiler.graph.PortId;
import org.fluxgen.compiler.semantics.FuncSymbol;
import org.fluxgen.compiler.semantics.LocalVar;
import org.fluxgen.compiler.types.SignatureType;
import org.fluxgen.compiler.types.Var;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A function: either a top-level definition named by a {@link FuncSymbol}, or a function
 * literal with an output carrying the function value.
 * <p>
 * The body holds a parameter boundary node (receiver first for methods) and a result
 * boundary node.
 */
public final class FuncNode extends Node {

    private final FuncSymbol symbol;
    private final SignatureType signature;
    private BlockId body;
    private PortsNode parameters;
    private PortsNode results;
    private PortId value;
    private final List<PortId> parameterPorts = new ArrayList<>();
    private final List<PortId> resultPorts = new ArrayList<>();

    /**
     * Creates a top-level definition.
     */
    public FuncNode(FuncSymbol symbol) {
        this.symbol = symbol;
        this.signature = symbol.signature();
    }

    /**
     * Creates a function literal.
     */
    public FuncNode(SignatureType signature) {
        if (signature.isMethod()) {
            throw new IllegalArgumentException("Function literals have no receiver");
        }
        this.symbol = null;
        this.signature = signature;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FUNC;
    }

    @Override
    protected void assemble(NodeContext ctx) {
        if (symbol == null) {
            value = ctx.output("f", signature);
        }
        body = ctx.block();
        parameters = ctx.add(body, new PortsNode(PortsNode.Role.PARAMETERS));
        results = ctx.add(body, new PortsNode(PortsNode.Role.RESULTS));
        List<Var> params = new ArrayList<>();
        if (signature.isMethod()) {
            params.add(signature.receiver());
        }
        params.addAll(signature.params());
        NodeContext in = ctx.forChild(parameters);
        for (Var v : params) {
            PortId p = in.output(v.name(), v.type());
            in.bind(p, new LocalVar(v.name(), v.type()));
            parameterPorts.add(p);
        }
        NodeContext out = ctx.forChild(results);
        for (Var v : signature.results()) {
            PortId p = out.input(v.name(), v.type());
            out.bind(p, new LocalVar(v.name(), v.type()));
            resultPorts.add(p);
        }
    }

    /**
     * @return The definition symbol, or {@code null} for a literal.
     */
    public FuncSymbol symbol() {
        return symbol;
    }

    public boolean isLiteral() {
        return symbol == null;
    }

    public SignatureType signature() {
        return signature;
    }

    public BlockId body() {
        return body;
    }

    public PortsNode parametersNode() {
        return parameters;
    }

    public PortsNode resultsNode() {
        return results;
    }

    /**
     * @return The outputs of the parameter boundary, receiver first for methods.
     */
    public List<PortId> parameterPorts() {
        return Collections.unmodifiableList(parameterPorts);
    }

    public List<PortId> resultPorts() {
        return Collections.unmodifiableList(resultPorts);
    }

    /**
     * @return The function value output of a literal, or {@code null} for a definition.
     */
    public PortId valueOutput() {
        return value;
    }
}

package org.fluxgen.compiler.graph.nodes;

import org.fluxgen.compiler.graph.Node;
import org.fluxgen.compiler.graph.NodeContext;
import org.fluxgen.compiler.graph.NodeKind;
import org.fluxgen.compiler.graph.PortId;
import org.fluxgen.compiler.graph.TypeDerivation;
import org.fluxgen.compiler.semantics.FuncSymbol;
import org.fluxgen.compiler.types.SignatureType;
import org.fluxgen.compiler.types.Type;
import org.fluxgen.compiler.types.Types;
import org.fluxgen.compiler.types.Var;
import org.fluxgen.compiler.types.WildcardType;

import java.util.ArrayList;
import java.util.List;

/**
 * Calls a declared function or method, or a function value arriving on the first input.
 * <p>
 * For function values the argument and result ports follow the signature of the
 * connected value and are rebuilt whenever it changes.
 */
public final class CallNode extends Node {

    private final FuncSymbol symbol;
    private final boolean ellipsis;
    private PortId function;
    private SignatureType shape;

    /**
     * @param symbol   The callee, or {@code null} to call a function value.
     * @param ellipsis Whether the last argument of a variadic call is spread.
     */
    public CallNode(FuncSymbol symbol, boolean ellipsis) {
        this.symbol = symbol;
        this.ellipsis = ellipsis;
    }

    public CallNode(FuncSymbol symbol) {
        this(symbol, false);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CALL;
    }

    @Override
    protected void assemble(NodeContext ctx) {
        if (symbol == null) {
            function = ctx.input("f", WildcardType.INSTANCE);
            return;
        }
        SignatureType sig = symbol.signature();
        if (sig.isMethod()) {
            ctx.input(sig.receiver().name(), sig.receiver().type());
        }
        for (Var p : sig.params()) {
            ctx.input(p.name(), p.type());
        }
        for (Var r : sig.results()) {
            ctx.output(r.name(), r.type());
        }
        shape = sig;
    }

    @Override
    protected void deriveTypes(TypeDerivation d) {
        if (symbol != null) {
            return;
        }
        Type t = d.sourceType(function);
        d.setType(function, t);
        SignatureType sig = Types.underlying(t) instanceof SignatureType s ? s : null;
        if (shape != null && sig != null && d.resolver().isIdentical(shape, sig)) {
            return;
        }
        for (PortId p : List.copyOf(inputs())) {
            if (!p.equals(function)) {
                d.removePort(p);
            }
        }
        for (PortId p : List.copyOf(outputs())) {
            d.removePort(p);
        }
        shape = sig;
        if (sig == null) {
            return;
        }
        for (Var p : sig.params()) {
            d.addInput(this, p.name(), p.type());
        }
        for (Var r : sig.results()) {
            d.addOutput(this, r.name(), r.type());
        }
    }

    /**
     * @return The callee, or {@code null} when calling a function value.
     */
    public FuncSymbol symbol() {
        return symbol;
    }

    public boolean isEllipsis() {
        return ellipsis;
    }

    /**
     * @return The function value input, or {@code null} for declared callees.
     */
    public PortId functionInput() {
        return function;
    }

    /**
     * @return The argument inputs, receiver first for methods, excluding the function value.
     */
    public List<PortId> arguments() {
        List<PortId> out = new ArrayList<>(inputs());
        out.remove(function);
        return out;
    }

    /**
     * @return The signature the ports currently follow, or {@code null}.
     */
    public SignatureType signature() {
        return shape;
    }
}

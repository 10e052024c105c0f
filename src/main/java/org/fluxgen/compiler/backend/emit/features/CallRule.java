package org.fluxgen.compiler.backend.emit.features;

import org.fluxgen.compiler.backend.emit.EmissionContext;
import org.fluxgen.compiler.backend.emit.INodeEmissionRule;
import org.fluxgen.compiler.graph.nodes.CallNode;
import org.fluxgen.compiler.semantics.FuncSymbol;

import java.util.List;

/**
 * Writes {@code results := f(args)}. Methods are selected from the first argument and
 * function values are called through it.
 */
public class CallRule implements INodeEmissionRule<CallNode> {

    @Override
    public Class<CallNode> nodeType() {
        return CallNode.class;
    }

    @Override
    public void emit(CallNode node, EmissionContext ctx) {
        if (!ctx.resolvable(node.inputs())) {
            ctx.omit(node, "an unconnected argument has no known type");
            return;
        }
        List<String> args = ctx.args(node.inputs());
        EmissionContext.Results results = ctx.results(node);
        FuncSymbol symbol = node.symbol();
        String callee;
        if (symbol == null) {
            callee = args.get(0);
            args = args.subList(1, args.size());
        } else if (symbol.isMethod()) {
            callee = args.get(0) + "." + symbol.name();
            args = args.subList(1, args.size());
        } else {
            callee = ctx.qualifiedName(symbol);
        }
        String argText = String.join(", ", args);
        if (node.isEllipsis() && !args.isEmpty()) {
            argText += "...";
        }
        ctx.indent(results.isEmpty() ? "" : results.joined() + " := ");
        ctx.write(callee + "(" + argText + ")");
        ctx.endStatement(node);
        ctx.assignExisting(results);
    }
}

package org.fluxgen.compiler.backend.emit.features;

import org.fluxgen.compiler.api.CodegenException;
import org.fluxgen.compiler.backend.emit.EmissionContext;
import org.fluxgen.compiler.backend.emit.INodeEmissionRule;
import org.fluxgen.compiler.backend.emit.TypeFormatter;
import org.fluxgen.compiler.graph.nodes.FuncNode;

/**
 * Writes {@code f := func(...) {...}} with the literal's body emitted in place.
 */
public class FuncLiteralRule implements INodeEmissionRule<FuncNode> {

    @Override
    public Class<FuncNode> nodeType() {
        return FuncNode.class;
    }

    @Override
    public void emit(FuncNode node, EmissionContext ctx) throws CodegenException {
        if (!ctx.hasConnectedOutput(node)) {
            return;
        }
        if (!TypeFormatter.isComplete(node.signature())) {
            ctx.omit(node, "signature is not resolved");
            return;
        }
        EmissionContext.Results results = ctx.results(node);
        ctx.indent(results.first() + " := ");
        ctx.emitFunctionLiteral(node);
        ctx.assignExisting(results);
    }
}

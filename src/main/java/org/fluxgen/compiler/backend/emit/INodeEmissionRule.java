package org.fluxgen.compiler.backend.emit;

import org.fluxgen.compiler.api.CodegenException;
import org.fluxgen.compiler.graph.Node;

/**
 * Writes the statement of one node variant.
 * <p>
 * Implementations are stateless. A rule that cannot produce a valid statement, because a
 * required input has no value, writes nothing and reports the omission through
 * {@link EmissionContext#omit(Node, String)}.
 *
 * @param <T> The node class handled by this rule.
 */
public interface INodeEmissionRule<T extends Node> {

    /**
     * @return The node class this rule accepts.
     */
    Class<T> nodeType();

    /**
     * Emits the node.
     *
     * @param node The node to emit.
     * @param ctx  The emission session.
     * @throws CodegenException if a nested block fails under the abort policy.
     */
    void emit(T node, EmissionContext ctx) throws CodegenException;
}

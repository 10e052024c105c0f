package org.fluxgen.compiler.api;

import org.fluxgen.compiler.graph.Graph;
import org.fluxgen.compiler.graph.nodes.FuncNode;
import org.fluxgen.compiler.types.NamedType;

import java.util.List;

/**
 * Defines the public interface of the source generator.
 */
public interface ICodeGenerator {

    /**
     * Generates one unit per function definition of the graph, followed by one unit per
     * named type declared in its package.
     *
     * @param graph The graph to generate from.
     * @return The units in a stable order.
     * @throws CodegenException if any definition fails.
     */
    List<GeneratedUnit> generate(Graph graph) throws CodegenException;

    /**
     * Generates the unit of a single function or method definition.
     *
     * @param graph      The graph holding the definition.
     * @param definition The definition node.
     * @return The generated unit.
     * @throws CodegenException if the definition fails.
     */
    GeneratedUnit generate(Graph graph, FuncNode definition) throws CodegenException;

    /**
     * Generates the unit declaring a named type.
     *
     * @param graph The graph whose package declares the type.
     * @param type  The type.
     * @return The generated unit.
     * @throws CodegenException if the underlying type is not resolved.
     */
    GeneratedUnit generate(Graph graph, NamedType type) throws CodegenException;
}

package org.fluxgen.compiler;

import org.fluxgen.compiler.api.CodegenException;
import org.fluxgen.compiler.api.GeneratedUnit;
import org.fluxgen.compiler.api.ICodeGenerator;
import org.fluxgen.compiler.backend.emit.EmissionRegistry;
import org.fluxgen.compiler.backend.emit.Emitter;
import org.fluxgen.compiler.diagnostics.DiagnosticsEngine;
import org.fluxgen.compiler.graph.Graph;
import org.fluxgen.compiler.graph.nodes.FuncNode;
import org.fluxgen.compiler.semantics.Symbol;
import org.fluxgen.compiler.semantics.TypeNameSymbol;
import org.fluxgen.compiler.types.NamedType;
import org.fluxgen.config.CodegenSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * The main generator implementation. It orchestrates scheduling and emission of every
 * definition of a graph. It is not thread-safe; graphs must not be edited while a
 * generation runs.
 */
public class CodeGenerator implements ICodeGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(CodeGenerator.class);

    private final CodegenSettings settings;
    private final EmissionRegistry registry;

    public CodeGenerator(CodegenSettings settings) {
        this(settings, EmissionRegistry.initializeWithDefaults());
    }

    public CodeGenerator(CodegenSettings settings, EmissionRegistry registry) {
        this.settings = settings;
        this.registry = registry;
    }

    @Override
    public List<GeneratedUnit> generate(Graph graph) throws CodegenException {
        List<GeneratedUnit> units = new ArrayList<>();
        for (FuncNode definition : graph.definitions()) {
            units.add(generate(graph, definition));
        }
        for (NamedType type : declaredTypes(graph)) {
            units.add(generate(graph, type));
        }
        LOG.debug("Generated {} units for package {}", units.size(), graph.scope().pkg());
        return units;
    }

    @Override
    public GeneratedUnit generate(Graph graph, FuncNode definition) throws CodegenException {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        String source = new Emitter(graph, settings, registry).emitDefinition(definition, diagnostics);
        return new GeneratedUnit(UnitPaths.fileName(definition.symbol(), settings.fileSuffix()),
                source, diagnostics.getDiagnostics());
    }

    @Override
    public GeneratedUnit generate(Graph graph, NamedType type) throws CodegenException {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        String source = new Emitter(graph, settings, registry).emitType(type, diagnostics);
        return new GeneratedUnit(UnitPaths.fileName(type, settings.fileSuffix()), source, diagnostics.getDiagnostics());
    }

    private static List<NamedType> declaredTypes(Graph graph) {
        List<NamedType> types = new ArrayList<>();
        for (Symbol s : graph.scope().symbols().values()) {
            if (s instanceof TypeNameSymbol t && graph.scope().pkg().equals(t.type().pkg())) {
                types.add(t.type());
            }
        }
        types.sort(Comparator.comparing(NamedType::name));
        return types;
    }
}

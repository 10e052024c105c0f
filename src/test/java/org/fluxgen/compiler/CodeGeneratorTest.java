package org.fluxgen.compiler;

import org.fluxgen.compiler.api.CodegenException;
import org.fluxgen.compiler.api.GeneratedUnit;
import org.fluxgen.compiler.graph.GraphFixture;
import org.fluxgen.compiler.graph.nodes.CallNode;
import org.fluxgen.compiler.graph.nodes.FuncNode;
import org.fluxgen.compiler.semantics.FuncSymbol;
import org.fluxgen.compiler.semantics.TypeNameSymbol;
import org.fluxgen.compiler.types.NamedType;
import org.fluxgen.compiler.types.SliceType;
import org.fluxgen.compiler.types.Types;
import org.fluxgen.config.CodegenSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.fluxgen.compiler.graph.GraphFixture.var;

@Tag("unit")
class CodeGeneratorTest {

    private GraphFixture fx;
    private CodeGenerator generator;

    @BeforeEach
    void setUp() {
        fx = new GraphFixture();
        generator = new CodeGenerator(CodegenSettings.defaults());
    }

    @Test
    void generatesDefinitionsThenLocalTypesByName() throws CodegenException {
        fx.scope.declare(new TypeNameSymbol(new NamedType(GraphFixture.PKG, "Names", new SliceType(Types.STRING))));
        fx.scope.declare(new TypeNameSymbol(new NamedType(GraphFixture.PKG, "Id", Types.INT)));
        FuncSymbol tick = fx.declareFunc("tick", List.of(), List.of());
        FuncNode run = fx.define("Run", List.of(), List.of());
        fx.add(run.body(), new CallNode(tick));
        fx.define("helper", List.of(var("n", Types.INT)), List.of());

        List<GeneratedUnit> units = generator.generate(fx.graph);

        assertThat(units).extracting(GeneratedUnit::fileName)
                .containsExactly("Run.flux.go", "helper-.flux.go", "Id.flux.go", "Names.flux.go");
        assertThat(units.get(0).source()).isEqualTo("package demo\n\nfunc Run() {\n\ttick()\n}\n");
        assertThat(units.get(3).source()).isEqualTo("package demo\n\ntype Names []string\n");
        assertThat(units).noneMatch(GeneratedUnit::hasErrors);
    }

    @Test
    void foreignTypesAreNotGenerated() throws CodegenException {
        NamedType foreign = new NamedType(new org.fluxgen.compiler.types.GoPackage("example.com/other", "other"),
                "Thing", Types.INT);
        fx.scope.declare(new TypeNameSymbol(foreign));

        assertThat(generator.generate(fx.graph)).isEmpty();
    }

    @Test
    void repeatedGenerationYieldsIdenticalUnits() throws CodegenException {
        FuncSymbol source = fx.declareFunc("source", List.of(), List.of(var("n", Types.INT)));
        FuncSymbol sink = fx.declareFunc("sink", List.of(var("n", Types.INT)), List.of());
        FuncNode run = fx.define("Run", List.of(), List.of());
        CallNode producer = fx.add(run.body(), new CallNode(source));
        for (int i = 0; i < 3; i++) {
            CallNode c = fx.add(run.body(), new CallNode(sink));
            fx.connect(producer.outputs().get(0), c.inputs().get(0));
        }

        assertThat(generator.generate(fx.graph)).isEqualTo(generator.generate(fx.graph));
    }
}

package org.fluxgen.compiler;

import org.fluxgen.compiler.graph.GraphFixture;
import org.fluxgen.compiler.semantics.FuncSymbol;
import org.fluxgen.compiler.types.NamedType;
import org.fluxgen.compiler.types.PointerType;
import org.fluxgen.compiler.types.SignatureType;
import org.fluxgen.compiler.types.StructType;
import org.fluxgen.compiler.types.Types;
import org.fluxgen.compiler.types.Var;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class UnitPathsTest {

    private static final SignatureType NO_ARGS = new SignatureType(List.of(), List.of());

    @Test
    void exportedAndUnexportedNamesNeverCollide() {
        String upper = UnitPaths.fileName(new FuncSymbol(GraphFixture.PKG, "Run", NO_ARGS), ".flux.go");
        String lower = UnitPaths.fileName(new FuncSymbol(GraphFixture.PKG, "run", NO_ARGS), ".flux.go");

        assertThat(upper).isEqualTo("Run.flux.go");
        assertThat(lower).isEqualTo("run-.flux.go");
        assertThat(upper).isNotEqualToIgnoringCase(lower);
    }

    @Test
    void methodsArePrefixedWithTheirReceiverType() {
        NamedType counter = new NamedType(GraphFixture.PKG, "counter", new StructType(List.of()));
        SignatureType sig = new SignatureType(new Var("c", new PointerType(counter)), List.of(), List.of(), false);

        assertThat(UnitPaths.fileName(new FuncSymbol(GraphFixture.PKG, "Add", sig), ".go"))
                .isEqualTo("counter-.Add.go");
    }

    @Test
    void methodOnUnnamedReceiverIsRejected() {
        SignatureType sig = new SignatureType(new Var("x", Types.INT), List.of(), List.of(), false);

        assertThatThrownBy(() -> UnitPaths.fileName(new FuncSymbol(GraphFixture.PKG, "Add", sig), ".go"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void typeUnitsUseTheTypeName() {
        NamedType point = new NamedType(GraphFixture.PKG, "Point", new StructType(List.of()));

        assertThat(UnitPaths.fileName(point, ".flux.go")).isEqualTo("Point.flux.go");
    }
}

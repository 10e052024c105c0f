package org.fluxgen.compiler.graph;

import org.fluxgen.compiler.graph.nodes.FuncNode;
import org.fluxgen.compiler.graph.nodes.IndexNode;
import org.fluxgen.compiler.graph.nodes.LoopNode;
import org.fluxgen.compiler.graph.nodes.MakeNode;
import org.fluxgen.compiler.graph.nodes.ValueNode;
import org.fluxgen.compiler.semantics.ConstSymbol;
import org.fluxgen.compiler.semantics.FieldSymbol;
import org.fluxgen.compiler.semantics.TypeNameSymbol;
import org.fluxgen.compiler.types.ArrayType;
import org.fluxgen.compiler.types.ChanType;
import org.fluxgen.compiler.types.MapType;
import org.fluxgen.compiler.types.NamedType;
import org.fluxgen.compiler.types.PointerType;
import org.fluxgen.compiler.types.SliceType;
import org.fluxgen.compiler.types.StructType;
import org.fluxgen.compiler.types.Type;
import org.fluxgen.compiler.types.Types;
import org.fluxgen.compiler.types.WildcardType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.fluxgen.compiler.graph.GraphFixture.var;

/**
 * Port types derived by the node variants whose ports depend on their connections.
 */
@Tag("unit")
class NodeDerivationTest {

    private GraphFixture fx;

    @BeforeEach
    void setUp() {
        fx = new GraphFixture();
    }

    private FuncNode defineWith(Type param) {
        return fx.define("F", List.of(var("x", param)), List.of());
    }

    @Test
    void indexReadFromSliceYieldsAddressableElementPointer() {
        FuncNode f = defineWith(new SliceType(Types.STRING));
        IndexNode idx = fx.add(f.body(), new IndexNode(false));

        fx.connect(f.parameterPorts().get(0), idx.container());

        Port elem = fx.port(idx.value());
        assertThat(elem.type()).isEqualTo(new PointerType(Types.STRING));
        assertThat(elem.isAddressable()).isTrue();
        assertThat(fx.port(idx.key()).type()).isEqualTo(Types.INT);
        assertThat(fx.port(idx.key()).isConnected()).isFalse();
        assertThat(idx.ok()).isNull();
    }

    @Test
    void indexReadFromArrayIsAddressableOnlyBehindAPointer() {
        FuncNode byValue = defineWith(new ArrayType(4, Types.INT));
        IndexNode direct = fx.add(byValue.body(), new IndexNode(false));
        fx.connect(byValue.parameterPorts().get(0), direct.container());

        FuncNode byPointer = fx.define("G", List.of(var("p", new PointerType(new ArrayType(4, Types.INT)))), List.of());
        IndexNode indirect = fx.add(byPointer.body(), new IndexNode(false));
        fx.connect(byPointer.parameterPorts().get(0), indirect.container());

        assertThat(fx.port(direct.value()).type()).isEqualTo(Types.INT);
        assertThat(fx.port(direct.value()).isAddressable()).isFalse();
        assertThat(fx.port(indirect.value()).type()).isEqualTo(new PointerType(Types.INT));
        assertThat(fx.port(indirect.value()).isAddressable()).isTrue();
    }

    @Test
    void indexReadFromMapGainsAndLosesOkOutput() {
        NamedType counts = new NamedType(GraphFixture.PKG, "Counts", new MapType(Types.STRING, Types.INT));
        FuncNode f = defineWith(counts);
        IndexNode idx = fx.add(f.body(), new IndexNode(false));

        Connection c = fx.connect(f.parameterPorts().get(0), idx.container());

        assertThat(idx.ok()).isNotNull();
        assertThat(fx.port(idx.ok()).type()).isEqualTo(Types.BOOL);
        assertThat(fx.port(idx.key()).type()).isEqualTo(Types.STRING);
        assertThat(fx.port(idx.value()).type()).isEqualTo(Types.INT);

        fx.graph.disconnect(c.id());

        assertThat(idx.ok()).isNull();
        assertThat(idx.outputs()).containsExactly(idx.value());
    }

    @Test
    void indexWriteTakesElementTypeForItsValueInput() {
        FuncNode f = defineWith(new MapType(Types.STRING, new SliceType(Types.BYTE)));
        IndexNode idx = fx.add(f.body(), new IndexNode(true));

        fx.connect(f.parameterPorts().get(0), idx.container());

        assertThat(fx.port(idx.value()).isInput()).isTrue();
        assertThat(fx.port(idx.value()).type()).isEqualTo(new SliceType(Types.BYTE));
        assertThat(idx.ok()).isNull();
    }

    @Test
    void loopOverMapBindsKeyAndValue() {
        FuncNode f = defineWith(new MapType(Types.STRING, Types.FLOAT64));
        LoopNode loop = fx.add(f.body(), new LoopNode());

        fx.connect(f.parameterPorts().get(0), loop.input());

        assertThat(fx.port(loop.keyBinding()).name()).isEqualTo("k");
        assertThat(fx.port(loop.keyBinding()).type()).isEqualTo(Types.STRING);
        assertThat(loop.valueBinding()).isNotNull();
        assertThat(fx.port(loop.valueBinding()).type()).isEqualTo(Types.FLOAT64);
        assertThat(LoopNode.formFor(fx.port(loop.input()).type())).isEqualTo(LoopNode.Form.KEY_VALUE_RANGE);
    }

    @Test
    void loopOverSliceBindsIndexAndElementPointer() {
        FuncNode f = defineWith(new SliceType(Types.STRING));
        LoopNode loop = fx.add(f.body(), new LoopNode());

        fx.connect(f.parameterPorts().get(0), loop.input());

        assertThat(fx.port(loop.keyBinding()).name()).isEqualTo("i");
        assertThat(fx.port(loop.valueBinding()).type()).isEqualTo(new PointerType(Types.STRING));
        assertThat(LoopNode.formFor(new SliceType(Types.STRING))).isEqualTo(LoopNode.Form.INDEXED_RANGE);
    }

    @Test
    void loopOverChannelHasASingleBinding() {
        FuncNode f = defineWith(new ChanType(ChanType.Direction.RECV_ONLY, Types.INT));
        LoopNode loop = fx.add(f.body(), new LoopNode());

        fx.connect(f.parameterPorts().get(0), loop.input());

        assertThat(fx.port(loop.keyBinding()).name()).isEqualTo("v");
        assertThat(fx.port(loop.keyBinding()).type()).isEqualTo(Types.INT);
        assertThat(loop.valueBinding()).isNull();
    }

    @Test
    void loopOverCountUsesTheCountType() {
        FuncNode f = defineWith(Types.UINT8);
        LoopNode loop = fx.add(f.body(), new LoopNode());

        Connection c = fx.connect(f.parameterPorts().get(0), loop.input());

        assertThat(fx.port(loop.keyBinding()).type()).isEqualTo(Types.UINT8);
        assertThat(LoopNode.formFor(Types.UINT8)).isEqualTo(LoopNode.Form.COUNT);

        fx.graph.disconnect(c.id());

        assertThat(fx.port(loop.keyBinding()).type()).isEqualTo(Types.INT);
        assertThat(LoopNode.formFor(WildcardType.INSTANCE)).isEqualTo(LoopNode.Form.ENDLESS);
    }

    @Test
    void disconnectingAMapLoopDropsItsValueBinding() {
        FuncNode f = defineWith(new MapType(Types.STRING, Types.INT));
        LoopNode loop = fx.add(f.body(), new LoopNode());
        Connection c = fx.connect(f.parameterPorts().get(0), loop.input());

        fx.graph.disconnect(c.id());

        assertThat(loop.valueBinding()).isNull();
        assertThat(fx.port(loop.keyBinding()).name()).isEqualTo("i");
    }

    @Test
    void fieldReadThroughPointerIsAddressable() {
        NamedType point = new NamedType(GraphFixture.PKG, "Point", new StructType(List.of(
                new StructType.Field("X", Types.INT, false))));
        FuncNode f = fx.define("F", List.of(var("p", new PointerType(point)), var("v", point)), List.of());
        ValueNode viaPointer = fx.add(f.body(), new ValueNode(new FieldSymbol("X", WildcardType.INSTANCE), false));
        ValueNode viaValue = fx.add(f.body(), new ValueNode(new FieldSymbol("X", WildcardType.INSTANCE), false));

        fx.connect(f.parameterPorts().get(0), viaPointer.operand());
        fx.connect(f.parameterPorts().get(1), viaValue.operand());

        assertThat(fx.port(viaPointer.value()).type()).isEqualTo(new PointerType(Types.INT));
        assertThat(fx.port(viaPointer.value()).isAddressable()).isTrue();
        assertThat(fx.port(viaValue.value()).type()).isEqualTo(Types.INT);
        assertThat(fx.port(viaValue.value()).isAddressable()).isFalse();
    }

    @Test
    void dereferenceYieldsThePointee() {
        FuncNode f = defineWith(new PointerType(Types.STRING));
        ValueNode deref = fx.add(f.body(), new ValueNode(null, false));

        fx.connect(f.parameterPorts().get(0), deref.operand());

        assertThat(deref.isDereference()).isTrue();
        assertThat(fx.port(deref.value()).type()).isEqualTo(Types.STRING);
    }

    @Test
    void invalidConstructionsAreRejected() {
        NamedType t = new NamedType(GraphFixture.PKG, "T", Types.INT);

        assertThatThrownBy(() -> new ValueNode(new TypeNameSymbol(t), false)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ValueNode(new ConstSymbol(GraphFixture.PKG, "Max", Types.INT), true))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new MakeNode(Types.INT)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void makeOfSliceHasLengthAndOptionalCapacity() {
        FuncNode f = fx.define("F", List.of(), List.of());
        MakeNode make = fx.add(f.body(), new MakeNode(new SliceType(Types.INT)));

        assertThat(make.inputs()).extracting(p -> fx.port(p).name()).containsExactly("len", "cap");
        assertThat(make.optionalInput()).isEqualTo(make.inputs().get(1));
        assertThat(fx.port(make.result()).type()).isEqualTo(new SliceType(Types.INT));
    }
}

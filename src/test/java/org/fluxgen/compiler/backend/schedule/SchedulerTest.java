package org.fluxgen.compiler.backend.schedule;

import org.fluxgen.compiler.api.CodegenErrorCode;
import org.fluxgen.compiler.api.CyclicBlockException;
import org.fluxgen.compiler.graph.GraphFixture;
import org.fluxgen.compiler.graph.NodeId;
import org.fluxgen.compiler.graph.nodes.CallNode;
import org.fluxgen.compiler.graph.nodes.FuncNode;
import org.fluxgen.compiler.graph.nodes.IfNode;
import org.fluxgen.compiler.semantics.FuncSymbol;
import org.fluxgen.compiler.types.Types;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.fluxgen.compiler.graph.GraphFixture.var;

@Tag("unit")
class SchedulerTest {

    private GraphFixture fx;
    private Scheduler scheduler;
    private FuncSymbol source;
    private FuncSymbol sink;
    private FuncSymbol step;
    private FuncSymbol tick;
    private FuncNode run;

    @BeforeEach
    void setUp() {
        fx = new GraphFixture();
        scheduler = new Scheduler(fx.graph);
        source = fx.declareFunc("source", List.of(), List.of(var("n", Types.INT)));
        sink = fx.declareFunc("sink", List.of(var("n", Types.INT)), List.of());
        step = fx.declareFunc("step", List.of(var("n", Types.INT)), List.of(var("m", Types.INT)));
        tick = fx.declareFunc("tick", List.of(), List.of());
        run = fx.define("Run", List.of(), List.of());
    }

    private List<NodeId> order() throws CyclicBlockException {
        return scheduler.order(run.body());
    }

    @Test
    void producerPrecedesEveryConsumerOfAFanOut() throws CyclicBlockException {
        // consumers are created before the producer
        CallNode first = fx.add(run.body(), new CallNode(sink));
        CallNode second = fx.add(run.body(), new CallNode(sink));
        CallNode producer = fx.add(run.body(), new CallNode(source));
        fx.connect(producer.outputs().get(0), first.inputs().get(0));
        fx.connect(producer.outputs().get(0), second.inputs().get(0));

        List<NodeId> order = order();

        assertThat(order).hasSize(5);
        assertThat(order.indexOf(producer.id()))
                .isLessThan(order.indexOf(first.id()))
                .isLessThan(order.indexOf(second.id()));
    }

    @Test
    void independentNodesKeepCreationOrder() throws CyclicBlockException {
        CallNode a = fx.add(run.body(), new CallNode(tick));
        CallNode b = fx.add(run.body(), new CallNode(tick));
        CallNode c = fx.add(run.body(), new CallNode(tick));

        assertThat(order()).containsExactly(run.parametersNode().id(), run.resultsNode().id(), a.id(), b.id(), c.id());
    }

    @Test
    void sequenceConnectionOrdersNodesWithoutDataFlow() throws CyclicBlockException {
        CallNode y = fx.add(run.body(), new CallNode(tick));
        CallNode x = fx.add(run.body(), new CallNode(tick));
        fx.connect(x.sequenceOut(), y.sequenceIn());

        List<NodeId> order = order();

        assertThat(order.indexOf(x.id())).isLessThan(order.indexOf(y.id()));
    }

    @Test
    void nestedConsumerLiftsToItsControlNode() throws CyclicBlockException {
        IfNode branch = fx.add(run.body(), new IfNode());
        CallNode inner = fx.add(branch.branches().get(0), new CallNode(sink));
        CallNode producer = fx.add(run.body(), new CallNode(source));
        fx.connect(producer.outputs().get(0), inner.inputs().get(0));

        List<NodeId> order = order();

        assertThat(order).doesNotContain(inner.id());
        assertThat(order.indexOf(producer.id())).isLessThan(order.indexOf(branch.id()));
        assertThat(scheduler.order(branch.branches().get(0))).containsExactly(inner.id());
    }

    @Test
    void orderIsDeterministic() throws CyclicBlockException {
        CallNode producer = fx.add(run.body(), new CallNode(source));
        for (int i = 0; i < 5; i++) {
            CallNode c = fx.add(run.body(), new CallNode(sink));
            fx.connect(producer.outputs().get(0), c.inputs().get(0));
        }

        List<NodeId> first = order();

        for (int i = 0; i < 10; i++) {
            assertThat(new Scheduler(fx.graph).order(run.body())).isEqualTo(first);
        }
    }

    @Test
    void cycleIsReportedWithItsParticipants() {
        CallNode independent = fx.add(run.body(), new CallNode(tick));
        CallNode a = fx.add(run.body(), new CallNode(step));
        CallNode b = fx.add(run.body(), new CallNode(step));
        CallNode downstream = fx.add(run.body(), new CallNode(sink));
        fx.connect(a.outputs().get(0), b.inputs().get(0));
        fx.connect(b.outputs().get(0), a.inputs().get(0));
        fx.connect(b.outputs().get(0), downstream.inputs().get(0));

        CyclicBlockException e = catchThrowableOfType(this::order, CyclicBlockException.class);

        assertThat(e).isNotNull();
        assertThat(e.errorCode()).isEqualTo(CodegenErrorCode.CYCLIC_BLOCK);
        assertThat(e.block()).isEqualTo(run.body());
        assertThat(e.participants()).containsExactly(a.id(), b.id());
        assertThat(e.participants()).doesNotContain(independent.id(), downstream.id());
    }

    @Test
    void connectionFromInsideAControlNodeBackToItIsACycle() {
        FuncSymbol flag = fx.declareFunc("flag", List.of(), List.of(var("b", Types.BOOL)));
        IfNode branch = fx.add(run.body(), new IfNode());
        CallNode inner = fx.add(branch.branches().get(0), new CallNode(flag));
        fx.connect(inner.outputs().get(0), branch.conditions().get(0));

        CyclicBlockException e = catchThrowableOfType(this::order, CyclicBlockException.class);

        assertThat(e).isNotNull();
        assertThat(e.participants()).containsExactly(branch.id());
    }
}

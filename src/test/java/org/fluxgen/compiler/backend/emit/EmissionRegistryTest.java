package org.fluxgen.compiler.backend.emit;

import org.fluxgen.compiler.backend.emit.features.CallRule;
import org.fluxgen.compiler.backend.emit.features.IndexRule;
import org.fluxgen.compiler.graph.NodeKind;
import org.fluxgen.compiler.graph.nodes.CallNode;
import org.fluxgen.compiler.graph.nodes.IndexNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class EmissionRegistryTest {

    @Test
    void defaultsCoverEveryNodeKind() {
        assertThat(EmissionRegistry.initializeWithDefaults().missingKinds()).isEmpty();
    }

    @Test
    void resolvesTheRuleRegisteredForTheKind() {
        EmissionRegistry registry = new EmissionRegistry();
        CallRule rule = new CallRule();
        registry.register(NodeKind.CALL, rule);

        assertThat(registry.resolve(new CallNode(null))).isSameAs(rule);
    }

    @Test
    void rejectsARuleForAnotherNodeType() {
        EmissionRegistry registry = new EmissionRegistry();
        registry.register(NodeKind.CALL, new IndexRule());

        assertThatThrownBy(() -> registry.resolve(new CallNode(null)))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> registry.resolve(new IndexNode(false)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("No emission rule");
    }
}

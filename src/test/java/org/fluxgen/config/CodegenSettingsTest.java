package org.fluxgen.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class CodegenSettingsTest {

    private static Config withOverride(String hocon) {
        return ConfigFactory.parseString(hocon)
                .withFallback(ConfigFactory.parseResources("reference.conf"))
                .resolve();
    }

    @Test
    void defaultsMatchReferenceConf() {
        CodegenSettings settings = CodegenSettings.defaults();

        assertThat(settings.outputDirectory()).isEqualTo(Path.of("generated"));
        assertThat(settings.fileSuffix()).isEqualTo(".flux.go");
        assertThat(settings.cyclePolicy()).isEqualTo(CyclePolicy.ABORT);
        assertThat(settings.defaultBase()).isEqualTo("x");
    }

    @Test
    void unknownCyclePolicyIsABadValue() {
        Config config = withOverride("fluxgen.cycle-policy = ignore");

        assertThatThrownBy(() -> CodegenSettings.fromConfig(config))
                .isInstanceOf(ConfigException.BadValue.class)
                .hasMessageContaining("cycle-policy");
    }

    @Test
    void wrongTypeIsAConfigError() {
        Config config = withOverride("fluxgen.propagation.max-passes-per-node = many");

        assertThatThrownBy(() -> CodegenSettings.fromConfig(config)).isInstanceOf(ConfigException.class);
    }

    @Test
    void rejectsUnusableValues() {
        assertThatThrownBy(() -> CodegenSettings.fromConfig(withOverride("fluxgen.naming.default-base = \"_\"")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CodegenSettings.fromConfig(withOverride("fluxgen.propagation.max-passes-per-node = 0")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CodegenSettings.fromConfig(withOverride("fluxgen.file-suffix = \"\"")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void withersReplaceOneField() {
        CodegenSettings base = CodegenSettings.defaults();

        CodegenSettings changed = base.withCyclePolicy(CyclePolicy.SKIP_BLOCK).withOutputDirectory(Path.of("out"));

        assertThat(changed.cyclePolicy()).isEqualTo(CyclePolicy.SKIP_BLOCK);
        assertThat(changed.outputDirectory()).isEqualTo(Path.of("out"));
        assertThat(changed.indent()).isEqualTo(base.indent());
    }
}

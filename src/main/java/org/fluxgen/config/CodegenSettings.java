package org.fluxgen.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Typed view of the {@code fluxgen} configuration block.
 *
 * @param outputDirectory  Where generated units are written.
 * @param fileSuffix       Suffix of generated file names.
 * @param indent           One level of indentation.
 * @param cyclePolicy      Handling of cyclic blocks.
 * @param maxPassesPerNode Type propagation passes a node may take per edit.
 * @param defaultBase      Identifier used for empty or blank name hints.
 */
public record CodegenSettings(
        Path outputDirectory,
        String fileSuffix,
        String indent,
        CyclePolicy cyclePolicy,
        int maxPassesPerNode,
        String defaultBase
) {

    /** Root path of the generator settings. */
    public static final String ROOT = "fluxgen";

    public CodegenSettings {
        if (fileSuffix == null || fileSuffix.isEmpty()) {
            throw new IllegalArgumentException("file-suffix must not be empty");
        }
        if (maxPassesPerNode < 1) {
            throw new IllegalArgumentException("propagation.max-passes-per-node must be positive: " + maxPassesPerNode);
        }
        if (defaultBase == null || defaultBase.isEmpty() || defaultBase.equals("_")) {
            throw new IllegalArgumentException("naming.default-base must be a usable identifier");
        }
    }

    /**
     * @return The settings of {@code reference.conf} without any overrides.
     */
    public static CodegenSettings defaults() {
        return fromConfig(com.typesafe.config.ConfigFactory.parseResources("reference.conf").resolve());
    }

    /**
     * Reads the settings below {@value #ROOT}.
     *
     * @param config The merged configuration.
     * @return The typed settings.
     * @throws ConfigException if a key is missing or has the wrong type.
     */
    public static CodegenSettings fromConfig(final Config config) {
        final Config c = config.getConfig(ROOT);
        final String policy = c.getString("cycle-policy").trim().toUpperCase(Locale.ROOT).replace('-', '_');
        final CyclePolicy cyclePolicy;
        try {
            cyclePolicy = CyclePolicy.valueOf(policy);
        } catch (IllegalArgumentException e) {
            throw new ConfigException.BadValue(ROOT + ".cycle-policy", "expected ABORT or SKIP_BLOCK, got " + policy, e);
        }
        return new CodegenSettings(
                Path.of(c.getString("output-directory")),
                c.getString("file-suffix"),
                c.getString("indent"),
                cyclePolicy,
                c.getInt("propagation.max-passes-per-node"),
                c.getString("naming.default-base"));
    }

    public CodegenSettings withCyclePolicy(CyclePolicy policy) {
        return new CodegenSettings(outputDirectory, fileSuffix, indent, policy, maxPassesPerNode, defaultBase);
    }

    public CodegenSettings withOutputDirectory(Path directory) {
        return new CodegenSettings(directory, fileSuffix, indent, cyclePolicy, maxPassesPerNode, defaultBase);
    }
}

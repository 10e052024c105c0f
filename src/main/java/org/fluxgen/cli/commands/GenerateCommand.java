package org.fluxgen.cli.commands;

import com.typesafe.config.ConfigException;
import org.fluxgen.cli.CommandLineInterface;
import org.fluxgen.cli.document.GraphDocumentLoader;
import org.fluxgen.compiler.ArtifactWriter;
import org.fluxgen.compiler.CodeGenerator;
import org.fluxgen.compiler.api.CodegenException;
import org.fluxgen.compiler.api.GeneratedUnit;
import org.fluxgen.compiler.api.ResolverException;
import org.fluxgen.compiler.diagnostics.Diagnostic;
import org.fluxgen.compiler.graph.Graph;
import org.fluxgen.config.CodegenSettings;
import org.fluxgen.config.CyclePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "generate", description = "Generates one source unit per definition of a graph document.")
public class GenerateCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(GenerateCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Option(names = {"-g", "--graph"}, required = true, description = "The JSON graph document.")
    private File graphFile;

    @Option(names = {"-o", "--out"}, description = "Output directory (overrides fluxgen.output-directory).")
    private File outputDirectory;

    @Option(names = {"--cycle-policy"}, description = "ABORT or SKIP_BLOCK (overrides fluxgen.cycle-policy).")
    private CyclePolicy cyclePolicy;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        CodegenSettings settings;
        try {
            settings = CodegenSettings.fromConfig(parent.getConfig());
        } catch (ConfigException | IllegalArgumentException e) {
            LOG.error("Invalid configuration: {}", e.getMessage());
            return 2;
        }
        if (outputDirectory != null) {
            settings = settings.withOutputDirectory(outputDirectory.toPath());
        }
        if (cyclePolicy != null) {
            settings = settings.withCyclePolicy(cyclePolicy);
        }
        try {
            Graph graph = new GraphDocumentLoader(settings.maxPassesPerNode()).load(graphFile.toPath());
            List<GeneratedUnit> units = new CodeGenerator(settings).generate(graph);
            List<Path> written = new ArtifactWriter(settings.outputDirectory()).writeAll(units);
            for (int i = 0; i < units.size(); i++) {
                out.println(written.get(i));
                for (Diagnostic d : units.get(i).diagnostics()) {
                    out.println("  " + d);
                }
            }
            out.flush();
            return 0;
        } catch (ResolverException e) {
            LOG.error("Cannot read graph document {}: {}", graphFile, e.getMessage());
            return 2;
        } catch (CodegenException e) {
            LOG.error("Generation failed [{}]: {}", e.errorCode(), e.getMessage());
            return 1;
        } catch (IOException | IllegalArgumentException e) {
            LOG.error("Cannot read graph document {}: {}", graphFile, e.getMessage());
            return 2;
        }
    }
}

package org.fluxgen.compiler;

import org.fluxgen.compiler.api.CodegenErrorCode;
import org.fluxgen.compiler.api.CodegenException;
import org.fluxgen.compiler.api.GeneratedUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Persists generated units into an output directory.
 */
public class ArtifactWriter {

    private static final Logger LOG = LoggerFactory.getLogger(ArtifactWriter.class);

    private final Path outputDirectory;

    public ArtifactWriter(Path outputDirectory) {
        this.outputDirectory = outputDirectory;
    }

    /**
     * Writes a unit, replacing any previous version of it.
     *
     * @param unit The unit to write.
     * @return The path written.
     * @throws CodegenException with {@link CodegenErrorCode#IO_ERROR_WRITING_UNIT} if writing fails.
     */
    public Path write(GeneratedUnit unit) throws CodegenException {
        Path target = outputDirectory.resolve(unit.fileName());
        try {
            Files.createDirectories(outputDirectory);
            Files.writeString(target, unit.source(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CodegenException(CodegenErrorCode.IO_ERROR_WRITING_UNIT,
                    "Failed to write " + target + ": " + e.getMessage(), e);
        }
        LOG.info("Wrote {} ({} diagnostics)", target, unit.diagnostics().size());
        return target;
    }

    public List<Path> writeAll(List<GeneratedUnit> units) throws CodegenException {
        List<Path> paths = new ArrayList<>(units.size());
        for (GeneratedUnit unit : units) {
            paths.add(write(unit));
        }
        return paths;
    }
}

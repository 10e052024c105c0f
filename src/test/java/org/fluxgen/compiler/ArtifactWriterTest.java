package org.fluxgen.compiler;

import org.fluxgen.compiler.api.CodegenErrorCode;
import org.fluxgen.compiler.api.CodegenException;
import org.fluxgen.compiler.api.GeneratedUnit;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("integration")
class ArtifactWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void writesUnitsIntoNewDirectory() throws Exception {
        Path out = tempDir.resolve("gen/demo");
        ArtifactWriter writer = new ArtifactWriter(out);

        List<Path> paths = writer.writeAll(List.of(
                new GeneratedUnit("Run.flux.go", "package demo\n", List.of()),
                new GeneratedUnit("run-.flux.go", "package demo\n\n", List.of())));

        assertThat(paths).containsExactly(out.resolve("Run.flux.go"), out.resolve("run-.flux.go"));
        assertThat(Files.readString(paths.get(0))).isEqualTo("package demo\n");
    }

    @Test
    void replacesPreviousVersion() throws Exception {
        ArtifactWriter writer = new ArtifactWriter(tempDir);
        writer.write(new GeneratedUnit("A.flux.go", "old and longer\n", List.of()));

        Path p = writer.write(new GeneratedUnit("A.flux.go", "new\n", List.of()));

        assertThat(Files.readString(p)).isEqualTo("new\n");
    }

    @Test
    void reportsWriteFailuresWithErrorCode() throws IOException {
        Path blocker = Files.writeString(tempDir.resolve("file"), "x");
        ArtifactWriter writer = new ArtifactWriter(blocker.resolve("sub"));

        assertThatThrownBy(() -> writer.write(new GeneratedUnit("A.flux.go", "", List.of())))
                .isInstanceOf(CodegenException.class)
                .satisfies(e -> assertThat(((CodegenException) e).errorCode())
                        .isEqualTo(CodegenErrorCode.IO_ERROR_WRITING_UNIT));
    }
}

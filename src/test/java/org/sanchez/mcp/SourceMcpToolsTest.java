package org.sanchez.mcp;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.sanchez.render.RenderOptionFactory;
import org.sanchez.render.TintColor;
import org.sanchez.source.SourceResolver;
import org.sanchez.source.dto.OutputPrepareResult;
import org.sanchez.source.dto.ResolvedFile;
import org.sanchez.source.dto.SourceResolutionResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SourceMcpToolsTest {

    @TempDir
    Path tempDir;

    private SourceMcpTools tools;

    @BeforeEach
    void setUp() {
        tools = new SourceMcpTools(new SourceResolver(tempDir), new RenderOptionFactory(1.0f, 0.7f, "5ebfff"));
    }

    @Test
    void resolveSources_batchGlobReturnsSortedFilesWithOutputs() throws IOException {
        createFile(tempDir.resolve("source/y/z/2IR.jpg"));
        createFile(tempDir.resolve("source/x/1IR.jpg"));
        createFile(tempDir.resolve("source/y/z/2VIS.jpg"));

        SourceResolutionResult result = tools.resolveSources("source/**/*IR.jpg", "out", true, null, null, null, null);

        Path out = tempDir.resolve("out");
        assertThat(result.batch()).isTrue();
        assertThat(result.fileCount()).isEqualTo(2);
        assertThat(result.files()).containsExactly(
                new ResolvedFile(tempDir.resolve("source/x/1IR.jpg").toString(), out.resolve("1IR-fc.jpg").toString()),
                new ResolvedFile(tempDir.resolve("source/y/z/2IR.jpg").toString(), out.resolve("2IR-fc.jpg").toString())
        );
        assertThat(result.warnings()).isNull();
        assertThat(result.outputPrepared()).isFalse();
        assertThat(out).doesNotExist();
    }

    @Test
    void resolveSources_reportsOutputCollisionsWithoutRenaming() throws IOException {
        createFile(tempDir.resolve("source/a/IR.jpg"));
        createFile(tempDir.resolve("source/b/IR.jpg"));

        SourceResolutionResult result = tools.resolveSources("source", "out", true, null, null, null, null);

        assertThat(result.files()).extracting(ResolvedFile::outputPath).containsOnly(tempDir.resolve("out/IR-fc.jpg").toString());
        assertThat(result.warnings()).hasSize(1);
        assertThat(result.warnings().get(0)).contains("IR-fc.jpg");
    }

    @Test
    void resolveSources_prepareOutputCreatesDirectory() throws IOException {
        createFile(tempDir.resolve("source/a.jpg"));

        SourceResolutionResult result = tools.resolveSources("source", "out/batch", true, true, null, null, null);

        assertThat(result.outputPrepared()).isTrue();
        assertThat(tempDir.resolve("out/batch")).isDirectory();
    }

    @Test
    void resolveSources_singleModeUsesOutputPathAndRenderOptions() {
        SourceResolutionResult result = tools.resolveSources("photo.jpg", "result.jpg", null, null, 1.5f, null, "#ff0000");

        assertThat(result.batch()).isFalse();
        assertThat(result.files()).containsExactly(
                new ResolvedFile(tempDir.resolve("photo.jpg").toString(), tempDir.resolve("result.jpg").toString())
        );
        assertThat(result.renderOptions().brightness()).isEqualTo(1.5f);
        assertThat(result.renderOptions().saturation()).isEqualTo(0.7f);
        assertThat(result.renderOptions().tint()).isEqualTo(new TintColor(255, 0, 0, 255));
    }

    @Test
    void resolveSources_missingSourceDirectoryIsReportedAsInvalidArgument() {
        assertThatThrownBy(() -> tools.resolveSources("missing/*.jpg", "out", true, null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("源目录不存在");
    }

    @Test
    void resolveSources_batchWithoutOutputIsRejected() {
        assertThatThrownBy(() -> tools.resolveSources("source", null, true, null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("outputPath");
    }

    @Test
    void prepareOutput_isIdempotent() {
        OutputPrepareResult first = tools.prepareOutput("out/nested", null);
        OutputPrepareResult second = tools.prepareOutput("out/nested", null);

        assertThat(first.existedBefore()).isFalse();
        assertThat(first.directory()).isTrue();
        assertThat(second.existedBefore()).isTrue();
        assertThat(second.directory()).isTrue();
    }

    @Test
    void prepareOutput_singleModeLeavesFileSystemUntouched() {
        OutputPrepareResult result = tools.prepareOutput("out/result.jpg", false);

        assertThat(result.directory()).isFalse();
        assertThat(tempDir.resolve("out")).doesNotExist();
    }

    @Test
    void prepareOutput_failureIsWrappedAsIllegalState() throws IOException {
        createFile(tempDir.resolve("blocker"));

        assertThatThrownBy(() -> tools.prepareOutput("blocker", true))
                .isInstanceOf(IllegalStateException.class)
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void collisionWarnings_emptyWhenOutputsAreDistinct() {
        List<String> warnings = SourceMcpTools.collisionWarnings(List.of(
                new ResolvedFile("/in/a.jpg", "/out/a-fc.jpg"),
                new ResolvedFile("/in/b.jpg", "/out/b-fc.jpg")
        ));

        assertThat(warnings).isEmpty();
    }

    private static void createFile(Path file) throws IOException {
        Files.createDirectories(file.getParent());
        Files.writeString(file, file.getFileName().toString());
    }
}

package com.sysdiagram.core.renderer.impl;

import com.sysdiagram.core.renderer.GeneratedFile;
import com.sysdiagram.core.renderer.GeneratedOutput;
import com.sysdiagram.core.renderer.RenderContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FileSystemRenderer}.
 */
class FileSystemRendererTest {

    private FileSystemRenderer renderer;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        renderer = new FileSystemRenderer();
    }

    @Test
    void getId_returnsFilesystem() {
        assertThat(renderer.getId()).isEqualTo("filesystem");
    }

    @Test
    void render_withMultipleFiles_writesAllFiles() throws IOException {
        // Given
        GeneratedOutput output = new GeneratedOutput(List.of(
            new GeneratedFile("drone.mmd", "flowchart TD", "flowchart"),
            new GeneratedFile("drone.dot", "digraph G {\n}", "cluster-graph")));
        Path outputDir = tempDir.resolve("diagrams");

        // When
        renderer.render(output, new RenderContext(outputDir.toString(), Map.of()));

        // Then
        assertThat(Files.readString(outputDir.resolve("drone.mmd"))).isEqualTo("flowchart TD");
        assertThat(Files.readString(outputDir.resolve("drone.dot"))).isEqualTo("digraph G {\n}");
    }

    @Test
    void render_withNestedPath_createsSubdirectories() {
        GeneratedOutput output = new GeneratedOutput(List.of(new GeneratedFile("a/b/model.json", "{}", "model")));

        renderer.render(output, new RenderContext(tempDir.toString(), Map.of()));

        assertThat(tempDir.resolve("a/b/model.json")).exists();
    }

    @Test
    void render_existingFile_isOverwrittenByDefault() throws IOException {
        Files.writeString(tempDir.resolve("drone.puml"), "old");
        GeneratedOutput output = new GeneratedOutput(List.of(new GeneratedFile("drone.puml", "new", null)));

        renderer.render(output, new RenderContext(tempDir.toString(), Map.of()));

        assertThat(Files.readString(tempDir.resolve("drone.puml"))).isEqualTo("new");
    }

    @Test
    void render_existingFileWithOverwriteDisabled_keepsFile() throws IOException {
        Files.writeString(tempDir.resolve("drone.puml"), "old");
        GeneratedOutput output = new GeneratedOutput(List.of(new GeneratedFile("drone.puml", "new", null)));

        renderer.render(output, new RenderContext(tempDir.toString(),
            Map.of(FileSystemRenderer.SETTING_OVERWRITE, "false")));

        assertThat(Files.readString(tempDir.resolve("drone.puml"))).isEqualTo("old");
    }

    @Test
    void render_pathEscapingOutputDirectory_throwsException() {
        GeneratedOutput output = new GeneratedOutput(List.of(new GeneratedFile("../evil.txt", "x", null)));
        Path outputDir = tempDir.resolve("out");

        assertThatThrownBy(() -> renderer.render(output, new RenderContext(outputDir.toString(), Map.of())))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("escapes output directory");
        assertThat(tempDir.resolve("evil.txt")).doesNotExist();
    }

    @Test
    void render_emptyOutput_createsDirectoryOnly() {
        Path outputDir = tempDir.resolve("empty");

        renderer.render(new GeneratedOutput(List.of()), new RenderContext(outputDir.toString(), Map.of()));

        assertThat(outputDir).isDirectory().isEmptyDirectory();
    }
}

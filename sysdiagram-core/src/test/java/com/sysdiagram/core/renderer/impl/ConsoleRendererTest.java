package com.sysdiagram.core.renderer.impl;

import com.sysdiagram.core.renderer.GeneratedFile;
import com.sysdiagram.core.renderer.GeneratedOutput;
import com.sysdiagram.core.renderer.RenderContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ConsoleRenderer}.
 */
class ConsoleRendererTest {

    private ByteArrayOutputStream outputStream;
    private ConsoleRenderer renderer;

    @BeforeEach
    void setUp() {
        outputStream = new ByteArrayOutputStream();
        renderer = new ConsoleRenderer(new PrintStream(outputStream, true, StandardCharsets.UTF_8));
    }

    private String printed() {
        return outputStream.toString(StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    @Test
    void getId_returnsConsole() {
        assertThat(renderer.getId()).isEqualTo("console");
    }

    @Test
    void render_withSingleFile_printsHeaderAndContent() {
        GeneratedOutput output = new GeneratedOutput(List.of(new GeneratedFile("drone.mmd", "flowchart TD", "flowchart")));

        renderer.render(output, new RenderContext(".", Map.of()));

        assertThat(printed()).isEqualTo("File 1/1: drone.mmd\n\nflowchart TD\n");
    }

    @Test
    void render_withMultipleFiles_separatesFiles() {
        GeneratedOutput output = new GeneratedOutput(List.of(
            new GeneratedFile("a.mmd", "A", null),
            new GeneratedFile("b.dot", "B", null)));

        renderer.render(output, new RenderContext(".", Map.of()));

        assertThat(printed()).isEqualTo("File 1/2: a.mmd\n\nA\n---\nFile 2/2: b.dot\n\nB\n");
    }

    @Test
    void render_withHeadersDisabled_printsContentOnly() {
        GeneratedOutput output = new GeneratedOutput(List.of(new GeneratedFile("drone.dot", "digraph G {\n}", null)));

        renderer.render(output, new RenderContext(".", Map.of(ConsoleRenderer.SETTING_SHOW_HEADERS, "false")));

        assertThat(printed()).isEqualTo("digraph G {\n}\n");
    }

    @Test
    void render_withCustomSeparator_usesIt() {
        GeneratedOutput output = new GeneratedOutput(List.of(
            new GeneratedFile("a.mmd", "A", null),
            new GeneratedFile("b.dot", "B", null)));

        renderer.render(output, new RenderContext(".", Map.of(
            ConsoleRenderer.SETTING_SHOW_HEADERS, "false",
            ConsoleRenderer.SETTING_SEPARATOR, "%%")));

        assertThat(printed()).isEqualTo("A\n%%\nB\n");
    }

    @Test
    void constructor_withNullStream_throwsException() {
        assertThatThrownBy(() -> new ConsoleRenderer(null))
            .isInstanceOf(NullPointerException.class);
    }
}

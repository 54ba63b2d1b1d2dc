package com.sysdiagram.core.renderer;

import com.sysdiagram.core.generator.GeneratedDiagram;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link GeneratedFile}, {@link GeneratedOutput} and {@link RenderContext}.
 */
class GeneratedFileTest {

    @Test
    void of_namesFileAfterBaseNameAndExtension() {
        GeneratedFile file = GeneratedFile.of("drone", new GeneratedDiagram("containment", "@startuml", "puml"));

        assertThat(file.relativePath()).isEqualTo("drone.puml");
        assertThat(file.content()).isEqualTo("@startuml");
        assertThat(file.contentType()).isEqualTo("containment");
    }

    @Test
    void constructor_withBlankPath_throwsException() {
        assertThatThrownBy(() -> new GeneratedFile("  ", "x", null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void constructor_withNullContent_throwsException() {
        assertThatThrownBy(() -> new GeneratedFile("a.mmd", null, null))
            .isInstanceOf(NullPointerException.class);
    }

    @Test
    void generatedOutput_copiesFiles() {
        List<GeneratedFile> files = new ArrayList<>(List.of(new GeneratedFile("a.mmd", "A", null)));
        GeneratedOutput output = new GeneratedOutput(files);

        files.clear();

        assertThat(output.files()).hasSize(1);
        assertThat(output.isEmpty()).isFalse();
        assertThat(new GeneratedOutput(List.of()).isEmpty()).isTrue();
    }

    @Test
    void renderContext_returnsSettingsAndDefaults() {
        RenderContext context = new RenderContext("out", Map.of("console.separator", "==="));

        assertThat(context.getSetting("console.separator")).isEqualTo("===");
        assertThat(context.getSetting("missing")).isNull();
        assertThat(context.getSettingOrDefault("missing", "dflt")).isEqualTo("dflt");
        assertThat(new RenderContext("out", null).settings()).isEmpty();
    }

    @Test
    void renderContext_isEnabled_parsesBooleanFlags() {
        RenderContext context = new RenderContext("out", Map.of("a", "TRUE", "b", "no"));

        assertThat(context.isEnabled("a", false)).isTrue();
        assertThat(context.isEnabled("b", true)).isFalse();
        assertThat(context.isEnabled("missing", true)).isTrue();
        assertThat(RenderContext.of("out").outputPath()).isEqualTo(java.nio.file.Paths.get("out"));
    }

    @Test
    void renderContext_withNullDirectory_throwsException() {
        assertThatThrownBy(() -> new RenderContext(null, Map.of()))
            .isInstanceOf(NullPointerException.class);
    }
}

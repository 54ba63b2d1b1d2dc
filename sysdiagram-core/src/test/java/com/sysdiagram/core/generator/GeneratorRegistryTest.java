package com.sysdiagram.core.generator;

import com.sysdiagram.core.generator.impl.GraphvizClusterGenerator;
import com.sysdiagram.core.generator.impl.MermaidFlowchartGenerator;
import com.sysdiagram.core.generator.impl.PlantUmlContainmentGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link GeneratorRegistry} service discovery.
 */
class GeneratorRegistryTest {

    private GeneratorRegistry registry;

    @BeforeEach
    void setUp() {
        registry = GeneratorRegistry.load();
    }

    @Test
    void load_discoversAllBundledGenerators() {
        assertThat(registry.ids()).containsExactly("mermaid", "plantuml", "graphviz");
    }

    @Test
    void find_isCaseInsensitive() {
        assertThat(registry.find("PlantUML")).get().isInstanceOf(PlantUmlContainmentGenerator.class);
        assertThat(registry.find("GRAPHVIZ")).get().isInstanceOf(GraphvizClusterGenerator.class);
    }

    @Test
    void find_withUnknownId_returnsEmpty() {
        assertThat(registry.find("svg")).isEmpty();
    }

    @Test
    void require_withKnownId_returnsGenerator() {
        assertThat(registry.require("mermaid")).isInstanceOf(MermaidFlowchartGenerator.class);
    }

    @Test
    void require_withUnknownId_listsAvailableGenerators() {
        assertThatThrownBy(() -> registry.require("svg"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Unknown generator: svg. Available: [mermaid, plantuml, graphviz]");
    }

    @Test
    void all_isUnmodifiable() {
        assertThatThrownBy(() -> registry.all().clear())
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void generators_haveUniqueIdsAndExtensions() {
        assertThat(registry.all()).extracting(DiagramGenerator::getFileExtension)
            .doesNotHaveDuplicates();
        assertThat(registry.ids()).doesNotHaveDuplicates();
    }
}

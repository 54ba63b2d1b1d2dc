package com.sysdiagram.core.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ElementKind}.
 */
class ElementKindTest {

    @ParameterizedTest
    @CsvSource({
        "Root, OTHER",
        "Package, PACKAGE",
        "LogicalComponent, LOGICAL_COMPONENT",
        "LogicalFunction, LOGICAL_FUNCTION",
        "LogicalActor, LOGICAL_ACTOR",
        "Battery, OTHER",
        "logicalfunction, OTHER"
    })
    void fromTypeName_mapsTagsCaseSensitively(String typeName, ElementKind expected) {
        assertThat(ElementKind.fromTypeName(typeName)).isEqualTo(expected);
    }

    @Test
    void fromTypeName_withNull_returnsOther() {
        assertThat(ElementKind.fromTypeName(null)).isEqualTo(ElementKind.OTHER);
    }

    @Test
    void isScope_onlyOtherIsLeaf() {
        assertThat(ElementKind.values())
            .filteredOn(kind -> !kind.isScope())
            .containsExactly(ElementKind.OTHER);
    }
}

package com.sysdiagram.core.parser;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ScopePolicy}.
 */
class ScopePolicyTest {

    @Test
    void indentation_opensScopeForEveryDeclaration() {
        assertThat(ScopePolicy.INDENTATION.opensScope("package A")).isTrue();
        assertThat(ScopePolicy.INDENTATION.opensScope("package A {")).isTrue();
    }

    @Test
    void indentation_treatsNothingAsStructural() {
        assertThat(ScopePolicy.INDENTATION.isStructural("}")).isFalse();
    }

    @Test
    void explicitBrace_opensScopeOnlyWithTrailingBrace() {
        assertThat(ScopePolicy.EXPLICIT_BRACE.opensScope("package A {  ")).isTrue();
        assertThat(ScopePolicy.EXPLICIT_BRACE.opensScope("package A")).isFalse();
        assertThat(ScopePolicy.EXPLICIT_BRACE.opensScope("part x : T {}")).isFalse();
    }

    @Test
    void explicitBrace_treatsLoneClosingBraceAsStructural() {
        assertThat(ScopePolicy.EXPLICIT_BRACE.isStructural("    }")).isTrue();
        assertThat(ScopePolicy.EXPLICIT_BRACE.isStructural("} // end")).isFalse();
    }
}

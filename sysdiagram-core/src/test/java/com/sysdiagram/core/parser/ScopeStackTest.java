package com.sysdiagram.core.parser;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ScopeStack}.
 */
class ScopeStackTest {

    private NodeDraft root;
    private ScopeStack stack;

    @BeforeEach
    void setUp() {
        root = NodeDraft.root();
        stack = new ScopeStack(root);
    }

    @Test
    void newStack_holdsOnlyRoot() {
        assertThat(stack.depth()).isEqualTo(1);
        assertThat(stack.indents()).containsExactly(0);
        assertThat(stack.innermost()).isSameAs(root);
    }

    @Test
    void closeScopesFor_neverRemovesRoot() {
        assertThat(stack.closeScopesFor(0)).isZero();
        assertThat(stack.depth()).isEqualTo(1);
    }

    @Test
    void closeScopesFor_deeperLine_closesNothing() {
        stack.open(0, new NodeDraft("Package", "A", null));

        assertThat(stack.closeScopesFor(2)).isZero();
        assertThat(stack.depth()).isEqualTo(2);
    }

    @Test
    void closeScopesFor_sameWidth_closesSibling() {
        stack.open(0, new NodeDraft("Package", "A", null));
        stack.open(2, new NodeDraft("LogicalFunction", "f", null));

        assertThat(stack.closeScopesFor(2)).isEqualTo(1);
        assertThat(stack.indents()).containsExactly(0, 0);
    }

    @Test
    void closeScopesFor_unmatchedDedent_closesEveryDeeperOrEqualScope() {
        // Given widths 0, 4 and 8 are open
        stack.open(0, new NodeDraft("Package", "A", null));
        stack.open(4, new NodeDraft("Package", "B", null));
        stack.open(8, new NodeDraft("Package", "C", null));

        // When a line arrives at width 3, which no scope recorded
        int closed = stack.closeScopesFor(3);

        // Then both 8 and 4 close, A stays open
        assertThat(closed).isEqualTo(2);
        assertThat(stack.indents()).containsExactly(0, 0);
        assertThat(stack.innermost().name()).isEqualTo("A");
    }

    @Test
    void innermostScope_skipsLeafEntries() {
        NodeDraft pkg = new NodeDraft("Package", "A", null);
        NodeDraft leaf = new NodeDraft("Battery", "battery", null);
        stack.open(0, pkg);
        stack.open(2, leaf);

        assertThat(stack.innermost()).isSameAs(leaf);
        assertThat(stack.innermostScope()).isSameAs(pkg);
    }

    @Test
    void innermostScope_withOnlyLeaves_returnsRoot() {
        stack.open(0, new NodeDraft("Battery", "battery", null));

        assertThat(stack.innermostScope()).isSameAs(root);
    }
}

package com.sysdiagram.core.parser;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * Stack of open scopes keyed by indentation width.
 *
 * <p>The bottom entry is the synthetic root at width 0 and is never removed. A line at
 * width {@code w} closes every open scope whose recorded width is {@code >= w}, however
 * many levels that spans; a dedent does not need to match a previously seen width.
 */
public final class ScopeStack {

    private record Entry(int indent, NodeDraft node) {}

    private final Deque<Entry> entries = new ArrayDeque<>();

    ScopeStack(NodeDraft root) {
        entries.addLast(new Entry(0, root));
    }

    /**
     * Closes the scopes a line at the given width cannot nest under.
     *
     * @param width leading-whitespace width of the incoming line
     * @return number of scopes closed
     */
    public int closeScopesFor(int width) {
        int closed = 0;
        while (entries.size() > 1 && entries.peekLast().indent() >= width) {
            entries.removeLast();
            closed++;
        }
        return closed;
    }

    /**
     * Returns the number of open entries, the root included.
     *
     * @return stack depth, at least 1
     */
    public int depth() {
        return entries.size();
    }

    /**
     * Returns the indentation widths of the open entries, innermost last.
     *
     * @return recorded widths
     */
    public int[] indents() {
        return entries.stream().mapToInt(Entry::indent).toArray();
    }

    void open(int indent, NodeDraft node) {
        entries.addLast(new Entry(indent, node));
    }

    /**
     * Innermost open node of any kind; descriptions attach here.
     */
    NodeDraft innermost() {
        return entries.peekLast().node();
    }

    /**
     * Innermost open node able to own children. Leaf parts stay open so their
     * descriptions land on them, but never receive children.
     */
    NodeDraft innermostScope() {
        Iterator<Entry> it = entries.descendingIterator();
        while (it.hasNext()) {
            NodeDraft node = it.next().node();
            if (node.kind().isScope()) {
                return node;
            }
        }
        return entries.peekFirst().node();
    }
}

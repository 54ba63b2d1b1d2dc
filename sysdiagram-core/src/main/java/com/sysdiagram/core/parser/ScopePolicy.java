package com.sysdiagram.core.parser;

/**
 * Decides which declarations open a scope that later, deeper lines nest under.
 *
 * <p>Both policies close scopes purely by indentation (see {@link ScopeStack}); they differ
 * only in when a declaration is pushed. The two diverge on inputs whose declarations have
 * nested lines but no explicit opening brace.
 */
public enum ScopePolicy {

    /**
     * Every declaration opens a scope at its own indentation. Braces are ignored.
     */
    INDENTATION {
        @Override
        public boolean opensScope(String line) {
            return true;
        }

        @Override
        public boolean isStructural(String line) {
            return false;
        }
    },

    /**
     * A declaration opens a scope only when its line ends with an opening brace. Lines holding
     * nothing but a closing brace are accepted silently.
     */
    EXPLICIT_BRACE {
        @Override
        public boolean opensScope(String line) {
            return line.stripTrailing().endsWith("{");
        }

        @Override
        public boolean isStructural(String line) {
            return "}".equals(line.strip());
        }
    };

    /**
     * Returns whether the declaration on the given line opens a scope.
     *
     * @param line raw declaration line
     * @return true if the new node should be pushed onto the scope stack
     */
    public abstract boolean opensScope(String line);

    /**
     * Returns whether an otherwise unrecognised line is expected punctuation that must not
     * produce a warning.
     *
     * @param line raw line
     * @return true if the line should be skipped silently
     */
    public abstract boolean isStructural(String line);
}

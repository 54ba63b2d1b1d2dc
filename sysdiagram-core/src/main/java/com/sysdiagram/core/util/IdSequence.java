package com.sysdiagram.core.util;

import java.util.Objects;

/**
 * Monotonically increasing identifier sequence owned by a single generation pass.
 *
 * <p>Identifiers are {@code prefix + n} with {@code n} starting at 1. A new sequence is
 * created for every {@code generate} call, so repeated or concurrent generations never
 * share counters.
 *
 * <pre>{@code
 * IdSequence ids = new IdSequence("id");
 * ids.next(); // "id1"
 * ids.next(); // "id2"
 * }</pre>
 */
public final class IdSequence {

    private final String prefix;
    private int counter;

    /**
     * Creates a sequence.
     *
     * @param prefix identifier prefix, must start with a letter
     * @throws IllegalArgumentException if the prefix is empty or does not start with a letter
     */
    public IdSequence(String prefix) {
        Objects.requireNonNull(prefix, "prefix must not be null");
        if (prefix.isEmpty() || !Character.isLetter(prefix.charAt(0))) {
            throw new IllegalArgumentException("Prefix must start with a letter: '" + prefix + "'");
        }
        this.prefix = prefix;
    }

    /**
     * Returns the next identifier.
     *
     * @return fresh identifier
     */
    public String next() {
        counter++;
        return prefix + counter;
    }

    /**
     * Returns how many identifiers have been issued.
     *
     * @return issued count
     */
    public int issued() {
        return counter;
    }
}

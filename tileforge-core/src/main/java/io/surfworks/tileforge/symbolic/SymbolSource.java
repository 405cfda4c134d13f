package io.surfworks.tileforge.symbolic;

import java.util.Objects;

/**
 * Generates fresh, never-repeating symbols: {@code prefix0}, {@code prefix1}, ...
 *
 * <p>Each GraphContext owns its own sources, so names restart per trace.
 * Not thread-safe.
 */
public final class SymbolSource {

    private final String prefix;
    private int count;

    public SymbolSource(String prefix) {
        this.prefix = Objects.requireNonNull(prefix, "prefix cannot be null");
        if (prefix.isBlank()) {
            throw new IllegalArgumentException("prefix cannot be blank");
        }
    }

    /**
     * Returns the next fresh symbol and advances the counter.
     */
    public SymbolicInt.Symbol next() {
        return new SymbolicInt.Symbol(prefix + count++);
    }

    public String prefix() {
        return prefix;
    }

    /**
     * Returns how many symbols this source has produced.
     */
    public int issued() {
        return count;
    }

    @Override
    public String toString() {
        return String.format("SymbolSource[prefix=%s, issued=%d]", prefix, count);
    }
}

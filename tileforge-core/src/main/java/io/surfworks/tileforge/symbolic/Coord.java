package io.surfworks.tileforge.symbolic;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Tree-shaped coordinate tagging a node with its position in the iteration space.
 *
 * <p>A coordinate is one of:
 * <ul>
 *   <li>{@link Unbound} - a hole to be filled as nested scopes open</li>
 *   <li>{@link Bound} - a single {@link SymbolicInt}</li>
 *   <li>{@link Composite} - an ordered list of child coordinates</li>
 * </ul>
 *
 * <p>Coordinates are immutable with structural equality. Use {@link Coords#bind}
 * to derive a new coordinate with its first hole filled.
 *
 * <p>Example:
 * <pre>{@code
 * Coord tag = Coord.of("tile_m", "tile_n", null);   // (tile_m, tile_n, _)
 * tag.rank();          // 3
 * tag.get(2);          // Unbound
 * Coords.bind(tag, SymbolicInt.symbol("tile_k"));   // (tile_m, tile_n, tile_k)
 * }</pre>
 */
public sealed interface Coord permits Coord.Unbound, Coord.Bound, Coord.Composite {

    /**
     * The canonical unbound slot.
     */
    enum Unbound implements Coord {
        INSTANCE;

        @Override
        public int rank() {
            return 1;
        }

        @Override
        public int unboundCount() {
            return 1;
        }

        @Override
        public String toText() {
            return "_";
        }

        @Override
        public String toString() {
            return "Unbound";
        }
    }

    /**
     * A slot bound to a symbolic value.
     */
    record Bound(SymbolicInt value) implements Coord {
        public Bound {
            Objects.requireNonNull(value, "value cannot be null");
        }

        @Override
        public int rank() {
            return 1;
        }

        @Override
        public int unboundCount() {
            return 0;
        }

        @Override
        public String toText() {
            return value.toText();
        }
    }

    /**
     * An ordered tuple of child coordinates.
     */
    record Composite(List<Coord> items) implements Coord {
        public Composite {
            Objects.requireNonNull(items, "items cannot be null");
            items = List.copyOf(items);
        }

        @Override
        public int rank() {
            return items.size();
        }

        @Override
        public int unboundCount() {
            int count = 0;
            for (Coord item : items) {
                count += item.unboundCount();
            }
            return count;
        }

        @Override
        public Coord get(int index) {
            return items.get(index);
        }

        @Override
        public String toText() {
            StringBuilder sb = new StringBuilder("(");
            for (int i = 0; i < items.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(items.get(i).toText());
            }
            return sb.append(")").toString();
        }
    }

    // ==================== Factories ====================

    static Coord unbound() {
        return Unbound.INSTANCE;
    }

    static Coord bound(SymbolicInt value) {
        return new Bound(value);
    }

    static Coord bound(long value) {
        return new Bound(SymbolicInt.of(value));
    }

    static Coord symbol(String name) {
        return new Bound(SymbolicInt.symbol(name));
    }

    static Coord composite(Coord... items) {
        return new Composite(Arrays.asList(items));
    }

    static Coord composite(List<Coord> items) {
        return new Composite(items);
    }

    /**
     * Builds a composite from loosely typed items.
     *
     * <p>Accepted items: {@link Coord}, {@link SymbolicInt}, {@link Integer} or
     * {@link Long} (concrete), {@link String} (symbol), {@code null} (unbound),
     * and {@code Object[]} or {@link List} (nested composite).
     *
     * @throws IllegalArgumentException if an item has an unsupported type
     */
    static Coord of(Object... items) {
        List<Coord> coords = new ArrayList<>(items.length);
        for (Object item : items) {
            coords.add(from(item));
        }
        return new Composite(coords);
    }

    /**
     * Converts a single loosely typed value into a coordinate.
     *
     * @see #of(Object...)
     */
    static Coord from(Object item) {
        if (item == null) {
            return Unbound.INSTANCE;
        }
        if (item instanceof Coord coord) {
            return coord;
        }
        if (item instanceof SymbolicInt value) {
            return new Bound(value);
        }
        if (item instanceof Integer || item instanceof Long) {
            return bound(((Number) item).longValue());
        }
        if (item instanceof String name) {
            return symbol(name);
        }
        if (item instanceof Object[] nested) {
            return of(nested);
        }
        if (item instanceof List<?> nested) {
            return of(nested.toArray());
        }
        throw new IllegalArgumentException("Cannot convert " + item.getClass().getName() + " to a coordinate");
    }

    // ==================== Queries ====================

    /**
     * Number of top-level components; leaves have rank 1.
     */
    int rank();

    /**
     * Number of unbound slots anywhere in this tree.
     */
    int unboundCount();

    /**
     * Renders this coordinate as deterministic, parenthesized, comma-separated text.
     */
    String toText();

    /**
     * Returns the component at the given index. Leaves only have index 0, themselves.
     *
     * @throws IndexOutOfBoundsException if the index is out of range
     */
    default Coord get(int index) {
        if (index != 0) {
            throw new IndexOutOfBoundsException("Index " + index + " out of bounds for rank 1");
        }
        return this;
    }

    default boolean isFullyBound() {
        return unboundCount() == 0;
    }
}

package io.surfworks.tileforge.symbolic;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Operations over {@link Coord} trees.
 *
 * <p>The central operation is {@link #bind(Coord, Coord)}, which fills the first
 * unbound slot of a coordinate. Loops use it to grow their tag as scopes nest:
 * <pre>{@code
 * Coord tag = Coord.of(null, null, null);
 * tag = Coords.bind(tag, SymbolicInt.symbol("m"));   // (m, _, _)
 * tag = Coords.bind(tag, SymbolicInt.symbol("n"));   // (m, n, _)
 * tag = Coords.bind(tag, SymbolicInt.symbol("k"));   // (m, n, k)
 * tag = Coords.bind(tag, SymbolicInt.symbol("x"));   // (m, n, k), unchanged
 * }</pre>
 */
public final class Coords {

    private Coords() {}

    /**
     * Returns a copy of {@code coord} with its first unbound slot replaced by {@code value}.
     *
     * <p>The search is depth-first, left-to-right and pre-order: each composite's
     * children are scanned in order, descending into a composite child before moving
     * on to its later siblings. Subtrees that are not on the path to the filled slot
     * are shared with the input.
     *
     * <p>If {@code coord} is itself unbound the result is {@code value}, so the rank
     * of the tree may change. If no unbound slot exists, {@code coord} is returned
     * unchanged.
     *
     * @param coord the coordinate to fill
     * @param value the coordinate to place into the first hole
     * @return the bound coordinate, or {@code coord} itself when fully bound
     */
    public static Coord bind(Coord coord, Coord value) {
        Objects.requireNonNull(coord, "coord cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        Coord result = bindFirst(coord, value);
        return result != null ? result : coord;
    }

    /**
     * Binds a single symbolic value into the first unbound slot.
     *
     * @see #bind(Coord, Coord)
     */
    public static Coord bind(Coord coord, SymbolicInt value) {
        return bind(coord, Coord.bound(value));
    }

    // Returns null when no slot was found.
    private static Coord bindFirst(Coord coord, Coord value) {
        if (coord instanceof Coord.Unbound) {
            return value;
        }
        if (coord instanceof Coord.Composite composite) {
            List<Coord> items = composite.items();
            for (int i = 0; i < items.size(); i++) {
                Coord replaced = bindFirst(items.get(i), value);
                if (replaced != null) {
                    List<Coord> updated = new ArrayList<>(items);
                    updated.set(i, replaced);
                    return new Coord.Composite(updated);
                }
            }
        }
        return null;
    }

    /**
     * Renders a coordinate as text; same as {@link Coord#toText()}.
     */
    public static String toText(Coord coord) {
        return coord.toText();
    }

    /**
     * Converts a coordinate into a backend-neutral expression tree.
     */
    public static ExprTree toExprTree(Coord coord) {
        if (coord instanceof Coord.Bound bound) {
            return toExprTree(bound.value());
        }
        if (coord instanceof Coord.Composite composite) {
            List<ExprTree> elements = new ArrayList<>(composite.rank());
            for (Coord item : composite.items()) {
                elements.add(toExprTree(item));
            }
            return new ExprTree.Tuple(elements);
        }
        return new ExprTree.Constant(null);
    }

    /**
     * Converts a symbolic value into a backend-neutral expression tree.
     */
    public static ExprTree toExprTree(SymbolicInt value) {
        if (value instanceof SymbolicInt.Concrete c) {
            return new ExprTree.Constant(c.value());
        }
        if (value instanceof SymbolicInt.Symbol s) {
            return new ExprTree.Name(s.name());
        }
        if (value instanceof SymbolicInt.Binary b) {
            return new ExprTree.BinaryOp(b.op().symbol(), toExprTree(b.left()), toExprTree(b.right()));
        }
        SymbolicInt.Negated n = (SymbolicInt.Negated) value;
        return new ExprTree.UnaryOp("-", toExprTree(n.operand()));
    }
}

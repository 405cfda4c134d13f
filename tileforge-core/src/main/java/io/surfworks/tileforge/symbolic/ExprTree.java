package io.surfworks.tileforge.symbolic;

import java.util.List;
import java.util.Objects;

/**
 * Backend-neutral expression tree for coordinates and symbolic values.
 *
 * <p>Produced by {@link Coords#toExprTree(Coord)} and {@link Coords#toExprTree(SymbolicInt)};
 * an unbound slot becomes a {@link Constant} with a {@code null} value.
 */
public sealed interface ExprTree
        permits ExprTree.Constant, ExprTree.Name, ExprTree.Tuple, ExprTree.BinaryOp, ExprTree.UnaryOp {

    /**
     * Literal integer, or {@code null} for an unbound slot.
     */
    record Constant(Long value) implements ExprTree {
    }

    record Name(String id) implements ExprTree {
        public Name {
            Objects.requireNonNull(id, "id cannot be null");
        }
    }

    record Tuple(List<ExprTree> elements) implements ExprTree {
        public Tuple {
            elements = List.copyOf(elements);
        }
    }

    /**
     * @param op operator token, e.g. {@code "+"} or {@code "//"}
     */
    record BinaryOp(String op, ExprTree left, ExprTree right) implements ExprTree {
        public BinaryOp {
            Objects.requireNonNull(op, "op cannot be null");
            Objects.requireNonNull(left, "left cannot be null");
            Objects.requireNonNull(right, "right cannot be null");
        }
    }

    record UnaryOp(String op, ExprTree operand) implements ExprTree {
        public UnaryOp {
            Objects.requireNonNull(op, "op cannot be null");
            Objects.requireNonNull(operand, "operand cannot be null");
        }
    }
}

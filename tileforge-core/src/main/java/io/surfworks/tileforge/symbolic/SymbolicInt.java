package io.surfworks.tileforge.symbolic;

import java.util.Objects;

/**
 * Symbolic integer used as a coordinate component.
 *
 * <p>A SymbolicInt is one of:
 * <ul>
 *   <li>{@link Concrete} - a known integer value</li>
 *   <li>{@link Symbol} - a named variable such as {@code tile_m} or {@code coord0}</li>
 *   <li>{@link Binary} / {@link Negated} - an expression built from the above</li>
 * </ul>
 *
 * <p>Arithmetic on two concrete operands always folds to a {@link Concrete}.
 * Any symbolic operand produces an expression node; no further simplification
 * is attempted, so {@code x + 0} stays {@code (x + 0)}.
 *
 * <p>Example:
 * <pre>{@code
 * SymbolicInt m = SymbolicInt.symbol("tile_m");
 * SymbolicInt offset = m.multiply(128).add(SymbolicInt.symbol("tid"));
 * offset.toText();   // "((tile_m * 128) + tid)"
 *
 * SymbolicInt.of(7).floorDiv(2);   // Concrete(3)
 * }</pre>
 */
public sealed interface SymbolicInt
        permits SymbolicInt.Concrete, SymbolicInt.Symbol, SymbolicInt.Binary, SymbolicInt.Negated {

    /**
     * Binary operators supported by the algebra.
     */
    enum Op {
        ADD("+"),
        SUBTRACT("-"),
        MULTIPLY("*"),
        FLOOR_DIV("//"),
        MOD("%"),
        POW("**");

        private final String symbol;

        Op(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    /**
     * A known integer value.
     */
    record Concrete(long value) implements SymbolicInt {
        @Override
        public String toText() {
            return Long.toString(value);
        }
    }

    /**
     * A named symbolic variable.
     */
    record Symbol(String name) implements SymbolicInt {
        public Symbol {
            Objects.requireNonNull(name, "name cannot be null");
            if (name.isBlank()) {
                throw new IllegalArgumentException("symbol name cannot be blank");
            }
        }

        @Override
        public String toText() {
            return name;
        }
    }

    /**
     * A binary expression over two symbolic operands.
     */
    record Binary(Op op, SymbolicInt left, SymbolicInt right) implements SymbolicInt {
        public Binary {
            Objects.requireNonNull(op, "op cannot be null");
            Objects.requireNonNull(left, "left cannot be null");
            Objects.requireNonNull(right, "right cannot be null");
        }

        @Override
        public String toText() {
            return "(" + left.toText() + " " + op.symbol() + " " + right.toText() + ")";
        }
    }

    /**
     * Arithmetic negation of a symbolic operand.
     */
    record Negated(SymbolicInt operand) implements SymbolicInt {
        public Negated {
            Objects.requireNonNull(operand, "operand cannot be null");
        }

        @Override
        public String toText() {
            return "(-" + operand.toText() + ")";
        }
    }

    // ==================== Factories ====================

    static SymbolicInt of(long value) {
        return new Concrete(value);
    }

    static SymbolicInt symbol(String name) {
        return new Symbol(name);
    }

    // ==================== Queries ====================

    /**
     * Renders this value as deterministic source-like text.
     */
    String toText();

    /**
     * Returns true if this value is a folded integer.
     */
    default boolean isConcrete() {
        return this instanceof Concrete;
    }

    // ==================== Arithmetic ====================

    default SymbolicInt add(SymbolicInt other) {
        return combine(Op.ADD, this, other);
    }

    default SymbolicInt add(long other) {
        return add(of(other));
    }

    default SymbolicInt subtract(SymbolicInt other) {
        return combine(Op.SUBTRACT, this, other);
    }

    default SymbolicInt subtract(long other) {
        return subtract(of(other));
    }

    default SymbolicInt multiply(SymbolicInt other) {
        return combine(Op.MULTIPLY, this, other);
    }

    default SymbolicInt multiply(long other) {
        return multiply(of(other));
    }

    /**
     * Floor division, rounding toward negative infinity when folded.
     *
     * @throws ArithmeticException if both operands are concrete and the divisor is zero
     */
    default SymbolicInt floorDiv(SymbolicInt other) {
        return combine(Op.FLOOR_DIV, this, other);
    }

    default SymbolicInt floorDiv(long other) {
        return floorDiv(of(other));
    }

    /**
     * Floor modulo; the folded result takes the sign of the divisor.
     *
     * @throws ArithmeticException if both operands are concrete and the divisor is zero
     */
    default SymbolicInt mod(SymbolicInt other) {
        return combine(Op.MOD, this, other);
    }

    default SymbolicInt mod(long other) {
        return mod(of(other));
    }

    /**
     * Exponentiation.
     *
     * @throws IllegalArgumentException if both operands are concrete and the exponent is negative
     */
    default SymbolicInt pow(SymbolicInt other) {
        return combine(Op.POW, this, other);
    }

    default SymbolicInt pow(long other) {
        return pow(of(other));
    }

    default SymbolicInt negate() {
        if (this instanceof Concrete c) {
            return of(Math.negateExact(c.value()));
        }
        return new Negated(this);
    }

    private static SymbolicInt combine(Op op, SymbolicInt left, SymbolicInt right) {
        Objects.requireNonNull(right, "operand cannot be null");
        if (left instanceof Concrete l && right instanceof Concrete r) {
            return of(fold(op, l.value(), r.value()));
        }
        return new Binary(op, left, right);
    }

    private static long fold(Op op, long a, long b) {
        return switch (op) {
            case ADD -> Math.addExact(a, b);
            case SUBTRACT -> Math.subtractExact(a, b);
            case MULTIPLY -> Math.multiplyExact(a, b);
            case FLOOR_DIV -> Math.floorDiv(a, b);
            case MOD -> Math.floorMod(a, b);
            case POW -> power(a, b);
        };
    }

    private static long power(long base, long exponent) {
        if (exponent < 0) {
            throw new IllegalArgumentException("negative exponent cannot fold to an integer: " + exponent);
        }
        if (base == 0 || base == 1) {
            return exponent == 0 ? 1 : base;
        }
        if (base == -1) {
            return (exponent & 1) == 0 ? 1 : -1;
        }
        // |base| >= 2, so any overflow shows up within 63 squarings
        long result = 1;
        long square = base;
        long remaining = exponent;
        while (true) {
            if ((remaining & 1) != 0) {
                result = Math.multiplyExact(result, square);
            }
            remaining >>= 1;
            if (remaining == 0) {
                return result;
            }
            square = Math.multiplyExact(square, square);
        }
    }
}

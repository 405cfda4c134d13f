package io.surfworks.tileforge.symbolic;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("SymbolicInt")
class SymbolicIntTest {

    @Nested
    @DisplayName("Folding")
    class Folding {

        @Test
        @DisplayName("concrete operands fold arithmetically")
        void concreteFolds() {
            SymbolicInt result = SymbolicInt.of(6).multiply(7).add(SymbolicInt.of(-2));
            assertEquals(SymbolicInt.of(40), result);
            assertTrue(result.isConcrete());
        }

        @Test
        @DisplayName("floorDiv and mod round toward negative infinity")
        void floorSemantics() {
            assertEquals(SymbolicInt.of(-4), SymbolicInt.of(-7).floorDiv(2));
            assertEquals(SymbolicInt.of(1), SymbolicInt.of(-7).mod(2));
            assertEquals(SymbolicInt.of(-1), SymbolicInt.of(7).mod(-2));
        }

        @Test
        @DisplayName("pow folds non-negative exponents")
        void powFolds() {
            assertEquals(SymbolicInt.of(1024), SymbolicInt.of(2).pow(10));
            assertEquals(SymbolicInt.of(1), SymbolicInt.of(5).pow(0));
            assertEquals(SymbolicInt.of(-27), SymbolicInt.of(-3).pow(3));
        }

        @Test
        @DisplayName("pow with a huge exponent returns promptly for 0, 1 and -1")
        void powHugeExponent() {
            assertTimeoutPreemptively(Duration.ofSeconds(5), () -> {
                assertEquals(SymbolicInt.of(1), SymbolicInt.of(1).pow(Long.MAX_VALUE));
                assertEquals(SymbolicInt.of(0), SymbolicInt.of(0).pow(Long.MAX_VALUE));
                assertEquals(SymbolicInt.of(-1), SymbolicInt.of(-1).pow(Long.MAX_VALUE));
                assertEquals(SymbolicInt.of(1), SymbolicInt.of(-1).pow(Long.MAX_VALUE - 1));
            });
        }

        @Test
        @DisplayName("pow folds up to the long range and raises past it")
        void powAtLongLimits() {
            assertEquals(SymbolicInt.of(1L << 62), SymbolicInt.of(2).pow(62));
            assertEquals(SymbolicInt.of(Long.MIN_VALUE), SymbolicInt.of(-2).pow(63));
            assertThrows(ArithmeticException.class, () -> SymbolicInt.of(2).pow(63));
            assertTimeoutPreemptively(Duration.ofSeconds(5),
                    () -> assertThrows(ArithmeticException.class, () -> SymbolicInt.of(3).pow(Long.MAX_VALUE)));
        }

        @Test
        @DisplayName("division by zero raises ArithmeticException")
        void divisionByZero() {
            assertThrows(ArithmeticException.class, () -> SymbolicInt.of(3).floorDiv(0));
            assertThrows(ArithmeticException.class, () -> SymbolicInt.of(3).mod(0));
        }

        @Test
        @DisplayName("negative exponent raises IllegalArgumentException")
        void negativeExponent() {
            assertThrows(IllegalArgumentException.class, () -> SymbolicInt.of(2).pow(-1));
        }

        @Test
        @DisplayName("negating a concrete value folds")
        void negateConcrete() {
            assertEquals(SymbolicInt.of(-3), SymbolicInt.of(3).negate());
        }
    }

    @Nested
    @DisplayName("Symbolic expressions")
    class SymbolicExpressions {

        @Test
        @DisplayName("symbol operands build a binary expression")
        void symbolBuildsBinary() {
            SymbolicInt m = SymbolicInt.symbol("m");
            SymbolicInt sum = m.add(SymbolicInt.symbol("n"));

            assertInstanceOf(SymbolicInt.Binary.class, sum);
            assertFalse(sum.isConcrete());
            assertEquals("(m + n)", sum.toText());
        }

        @Test
        @DisplayName("mixed operands are not simplified")
        void mixedNotSimplified() {
            SymbolicInt m = SymbolicInt.symbol("m");
            assertEquals("(m + 0)", m.add(0).toText());
            assertEquals("(m * 1)", m.multiply(1).toText());
        }

        @Test
        @DisplayName("rendering is fully parenthesized with Python-style operators")
        void rendering() {
            SymbolicInt tile = SymbolicInt.symbol("tile0");
            SymbolicInt expr = tile.multiply(128).add(SymbolicInt.symbol("coord0")).floorDiv(4);

            assertEquals("(((tile0 * 128) + coord0) // 4)", expr.toText());
            assertEquals("(k ** 2)", SymbolicInt.symbol("k").pow(2).toText());
            assertEquals("(i % 8)", SymbolicInt.symbol("i").mod(8).toText());
            assertEquals("(-i)", SymbolicInt.symbol("i").negate().toText());
        }

        @Test
        @DisplayName("structurally equal expressions are equal")
        void structuralEquality() {
            SymbolicInt a = SymbolicInt.symbol("x").subtract(1);
            SymbolicInt b = SymbolicInt.symbol("x").subtract(1);
            assertEquals(a, b);
            assertEquals(a.hashCode(), b.hashCode());
        }

        @Test
        @DisplayName("blank symbol names are rejected")
        void blankSymbolRejected() {
            assertThrows(IllegalArgumentException.class, () -> SymbolicInt.symbol(" "));
            assertThrows(NullPointerException.class, () -> SymbolicInt.symbol(null));
        }
    }

    @Nested
    @DisplayName("SymbolSource")
    class SymbolSourceTests {

        @Test
        @DisplayName("issues monotonically numbered names")
        void monotonicNames() {
            SymbolSource source = new SymbolSource("coord");

            assertEquals("coord0", source.next().name());
            assertEquals("coord1", source.next().name());
            assertEquals(2, source.issued());
        }

        @Test
        @DisplayName("independent sources do not share counters")
        void independentSources() {
            SymbolSource tiles = new SymbolSource("tile");
            SymbolSource coords = new SymbolSource("coord");

            tiles.next();
            assertEquals("coord0", coords.next().name());
            assertEquals("tile1", tiles.next().name());
        }
    }
}

// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.smelt.primitives.rlp;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import sh.smelt.primitives.Hex;

/**
 * Tests for {@link RlpNumeric} boundary values and error cases.
 */
class RlpNumericTest {

    @Nested
    @DisplayName("long scalars")
    class LongScalars {

        @Test
        @DisplayName("0 encodes as empty string (0x80)")
        void testZero() {
            assertEquals("80", Hex.encodeNoPrefix(RlpNumeric.encodeLongUnsigned(0L)));
        }

        @Test
        @DisplayName("127 and 128 straddle the single-byte boundary")
        void testSingleByteBoundary() {
            assertEquals("7f", Hex.encodeNoPrefix(RlpNumeric.encodeLongUnsigned(127L)));
            assertEquals("8180", Hex.encodeNoPrefix(RlpNumeric.encodeLongUnsigned(128L)));
        }

        @Test
        @DisplayName("Long.MAX_VALUE encodes as 8-byte string")
        void testLongMaxValue() {
            assertEquals("887fffffffffffffff", Hex.encodeNoPrefix(RlpNumeric.encodeLongUnsigned(Long.MAX_VALUE)));
        }

        @Test
        @DisplayName("Negative value throws IllegalArgumentException")
        void testNegativeValue() {
            IllegalArgumentException ex = assertThrows(
                    IllegalArgumentException.class,
                    () -> RlpNumeric.encodeLongUnsignedItem(-1L));
            assertTrue(ex.getMessage().contains("non-negative"));
        }
    }

    @Nested
    @DisplayName("BigInteger scalars")
    class BigIntegerScalars {

        @Test
        @DisplayName("0 encodes as empty string (0x80)")
        void testZero() {
            assertEquals("80", Hex.encodeNoPrefix(RlpNumeric.encodeBigIntegerUnsignedItem(BigInteger.ZERO).encode()));
        }

        @Test
        @DisplayName("Sign byte is stripped")
        void testSignByteStripped() {
            // 0x80..00 needs a leading 0x00 in two's complement
            BigInteger beyondMax = BigInteger.valueOf(Long.MAX_VALUE).add(BigInteger.ONE);
            assertEquals("888000000000000000", Hex.encodeNoPrefix(RlpNumeric.encodeBigIntegerUnsignedItem(beyondMax).encode()));
        }

        @Test
        @DisplayName("Values wider than a long")
        void testWideValue() {
            BigInteger twoTo72 = BigInteger.ONE.shiftLeft(72);
            assertEquals("8a01000000000000000000",
                    Hex.encodeNoPrefix(RlpNumeric.encodeBigIntegerUnsignedItem(twoTo72).encode()));
        }

        @Test
        @DisplayName("Agrees with long encoding")
        void testAgreesWithLong() {
            for (long v : new long[] {1L, 55L, 255L, 256L, 65_535L, 1_000_000_007L}) {
                assertArrayEquals(
                        RlpNumeric.encodeLongUnsigned(v),
                        RlpNumeric.encodeBigIntegerUnsignedItem(BigInteger.valueOf(v)).encode());
            }
        }

        @Test
        @DisplayName("Negative value throws IllegalArgumentException")
        void testNegativeValue() {
            assertThrows(
                    IllegalArgumentException.class,
                    () -> RlpNumeric.encodeBigIntegerUnsignedItem(BigInteger.valueOf(-5)));
        }
    }
}

// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.smelt.core.types;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;

import org.junit.jupiter.api.Test;

import sh.smelt.primitives.rlp.RlpString;

class WeiTest {

    @Test
    void gweiConversion() {
        assertEquals(BigInteger.valueOf(20_000_000_000L), Wei.gwei(20).value());
    }

    @Test
    void rejectsNegative() {
        assertThrows(IllegalArgumentException.class, () -> Wei.of(-1L));
    }

    @Test
    void zeroEncodesAsEmptyString() {
        assertArrayEquals(new byte[] { (byte) 0x80 }, Wei.ZERO.toRlp().encode());
    }

    @Test
    void encodesMinimalBigEndian() {
        assertArrayEquals(new byte[] { 0x04, (byte) 0xa8, 0x17, (byte) 0xc8, 0x00 },
                ((RlpString) Wei.gwei(20).toRlp()).bytes());
    }

    @Test
    void hexString() {
        assertEquals("0x0", Wei.ZERO.toHexString());
        assertEquals("0x3e8", Wei.of(1000L).toHexString());
    }
}

// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.smelt.core.model;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import sh.smelt.core.types.Address;
import sh.smelt.primitives.rlp.Rlp;
import sh.smelt.primitives.rlp.RlpItem;
import sh.smelt.primitives.rlp.RlpString;

class WithdrawalTest {

    private static final Address RECIPIENT = new Address("0x" + "d".repeat(40));

    @Test
    void encodesFourFieldsInOrder() {
        final Withdrawal withdrawal = new Withdrawal(1L, 300L, RECIPIENT, 32_000_000_000L);

        final List<RlpItem> fields = Rlp.decodeList(withdrawal.encode());

        assertEquals(4, fields.size());
        assertEquals(1L, ((RlpString) fields.get(0)).asLong());
        assertEquals(300L, ((RlpString) fields.get(1)).asLong());
        assertArrayEquals(RECIPIENT.toBytes(), ((RlpString) fields.get(2)).bytes());
        assertEquals(32_000_000_000L, ((RlpString) fields.get(3)).asLong());
    }

    @Test
    void zeroValuesEncodeAsEmptyStrings() {
        final byte[] encoded = new Withdrawal(0L, 0L, RECIPIENT, 0L).encode();

        assertEquals((byte) 0x80, encoded[1]);
        assertEquals((byte) 0x80, encoded[2]);
        assertEquals((byte) 0x80, encoded[encoded.length - 1]);
    }

    @Test
    void rejectsNegativeValues() {
        assertThrows(IllegalArgumentException.class, () -> new Withdrawal(-1L, 0L, RECIPIENT, 0L));
        assertThrows(IllegalArgumentException.class, () -> new Withdrawal(0L, 0L, RECIPIENT, -5L));
    }

    @Test
    void requiresAddress() {
        assertThrows(NullPointerException.class, () -> new Withdrawal(0L, 0L, null, 0L));
    }
}

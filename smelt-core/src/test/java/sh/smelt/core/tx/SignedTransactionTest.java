// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.smelt.core.tx;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import sh.smelt.core.crypto.Keccak256;
import sh.smelt.core.crypto.Signature;
import sh.smelt.core.model.AccessListEntry;
import sh.smelt.core.types.Address;
import sh.smelt.core.types.Hash;
import sh.smelt.core.types.HexData;
import sh.smelt.core.types.Wei;
import sh.smelt.primitives.Hex;
import sh.smelt.primitives.rlp.Rlp;
import sh.smelt.primitives.rlp.RlpList;
import sh.smelt.primitives.rlp.RlpString;

class SignedTransactionTest {

    private static final Address RECIPIENT = new Address("0x3535353535353535353535353535353535353535");

    private static Signature signature(final long v) {
        final byte[] r = new byte[32];
        final byte[] s = new byte[32];
        Arrays.fill(r, (byte) 0x01);
        Arrays.fill(s, (byte) 0x02);
        return new Signature(r, s, v);
    }

    private static Eip1559Transaction eip1559() {
        return new Eip1559Transaction(1L, 0L, Wei.gwei(1), Wei.gwei(30), 21_000L, RECIPIENT, Wei.of(1L),
                HexData.EMPTY, List.of(new AccessListEntry(RECIPIENT, List.of(Hash.ZERO))));
    }

    @Nested
    class Legacy {

        @Test
        @DisplayName("EIP-155 example transaction")
        void eip155Vector() {
            final LegacyTransaction tx = new LegacyTransaction(
                    9L,
                    Wei.gwei(20),
                    21_000L,
                    RECIPIENT,
                    Wei.of(new BigInteger("1000000000000000000")),
                    HexData.EMPTY);
            final Signature sig = new Signature(
                    Hex.decode("0x28ef61340bd939bc2195fe537567866003e1a15d3c71ff63e1590620aa636276"),
                    Hex.decode("0x67cbe9d8997f761aecb703304b3800ccf555c9f3dc64214b297fb1966a3b6d83"),
                    37L);

            final SignedTransaction signed = new SignedTransaction(tx, sig);

            assertEquals(
                    "0xf86c098504a817c800825208943535353535353535353535353535353535353535880de0b6b3a76400008025a0"
                            + "28ef61340bd939bc2195fe537567866003e1a15d3c71ff63e1590620aa636276a0"
                            + "67cbe9d8997f761aecb703304b3800ccf555c9f3dc64214b297fb1966a3b6d83",
                    Hex.encode(signed.encode()));
            assertEquals(Keccak256.digest(signed.encode()), signed.hash());
        }

        @Test
        void blockItemIsTheRlpList() {
            final SignedTransaction signed = new SignedTransaction(
                    new LegacyTransaction(0L, Wei.gwei(1), 21_000L, null, Wei.ZERO, new HexData("0x6000")),
                    signature(27));

            assertEquals(0, signed.type());
            assertInstanceOf(RlpList.class, signed.toRlp());
            assertArrayEquals(signed.encode(), signed.toRlp().encode());
        }

        @Test
        void rejectsBareParity() {
            final LegacyTransaction tx = new LegacyTransaction(0L, Wei.ZERO, 21_000L, RECIPIENT, Wei.ZERO,
                    HexData.EMPTY);
            assertThrows(IllegalArgumentException.class, () -> new SignedTransaction(tx, signature(1)));
        }
    }

    @Nested
    class Typed {

        @Test
        void envelopeStartsWithTypeByte() {
            final SignedTransaction signed = new SignedTransaction(eip1559(), signature(0));
            final byte[] encoded = signed.encode();

            assertEquals(2, signed.type());
            assertEquals(0x02, encoded[0]);
            final List<?> fields = Rlp.decodeList(Arrays.copyOfRange(encoded, 1, encoded.length));
            assertEquals(12, fields.size());
        }

        @Test
        void blockItemWrapsEnvelope() {
            final SignedTransaction signed = new SignedTransaction(eip1559(), signature(1));

            final RlpString item = assertInstanceOf(RlpString.class, signed.toRlp());
            assertArrayEquals(signed.encode(), item.bytes());
            assertEquals(Keccak256.digest(signed.encode()), signed.hash());
        }

        @Test
        void rejectsEip155StyleV() {
            assertThrows(IllegalArgumentException.class, () -> new SignedTransaction(eip1559(), signature(37)));
        }
    }

    @Test
    void encodeReturnsCopy() {
        final SignedTransaction signed = new SignedTransaction(eip1559(), signature(0));
        final byte[] first = signed.encode();
        first[0] = 0x7f;

        assertEquals(0x02, signed.encode()[0]);
    }

    @Test
    void equalityFollowsEncoding() {
        assertEquals(new SignedTransaction(eip1559(), signature(0)), new SignedTransaction(eip1559(), signature(0)));
        assertNotEquals(new SignedTransaction(eip1559(), signature(0)), new SignedTransaction(eip1559(), signature(1)));
    }
}

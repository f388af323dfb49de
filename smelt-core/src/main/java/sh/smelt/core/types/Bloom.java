// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.smelt.core.types;

import java.util.Arrays;
import java.util.Collection;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonValue;

import sh.smelt.core.crypto.Keccak256;
import sh.smelt.core.model.Log;
import sh.smelt.primitives.Hex;
import sh.smelt.primitives.rlp.RlpString;

/**
 * 2048-bit logs bloom filter as carried by receipts and block headers.
 *
 * <p>
 * Each added element sets three bits: the low 11 bits of the first three
 * big-endian byte pairs of its Keccak-256 hash. A log contributes its address and
 * each of its topics.
 *
 * <p>
 * Instances are immutable; {@link #accrue(Log)} and {@link #or(Bloom)} return
 * new filters.
 */
public final class Bloom {

    public static final int BYTE_LENGTH = 256;

    public static final Bloom EMPTY = new Bloom(new byte[BYTE_LENGTH]);

    private final byte[] bits;

    private Bloom(final byte[] bits) {
        this.bits = bits;
    }

    public static Bloom fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != BYTE_LENGTH) {
            throw new IllegalArgumentException("Bloom must be exactly " + BYTE_LENGTH + " bytes");
        }
        return new Bloom(Arrays.copyOf(bytes, BYTE_LENGTH));
    }

    /**
     * Builds the bloom of a set of logs, as a receipt carries it.
     */
    public static Bloom of(final Collection<Log> logs) {
        Objects.requireNonNull(logs, "logs");
        final byte[] bits = new byte[BYTE_LENGTH];
        for (final Log log : logs) {
            set(bits, log.address().toBytes());
            for (final Hash topic : log.topics()) {
                set(bits, topic.toBytes());
            }
        }
        return new Bloom(bits);
    }

    public Bloom accrue(final Log log) {
        Objects.requireNonNull(log, "log");
        final byte[] copy = Arrays.copyOf(bits, BYTE_LENGTH);
        set(copy, log.address().toBytes());
        for (final Hash topic : log.topics()) {
            set(copy, topic.toBytes());
        }
        return new Bloom(copy);
    }

    public Bloom or(final Bloom other) {
        Objects.requireNonNull(other, "other");
        final byte[] merged = new byte[BYTE_LENGTH];
        for (int i = 0; i < BYTE_LENGTH; i++) {
            merged[i] = (byte) (bits[i] | other.bits[i]);
        }
        return new Bloom(merged);
    }

    /**
     * @return false if {@code input} was certainly never added, true if it may have been
     */
    public boolean mayContain(final byte[] input) {
        final byte[] probe = new byte[BYTE_LENGTH];
        set(probe, input);
        for (int i = 0; i < BYTE_LENGTH; i++) {
            if ((bits[i] & probe[i]) != probe[i]) {
                return false;
            }
        }
        return true;
    }

    public boolean isEmpty() {
        for (final byte b : bits) {
            if (b != 0) {
                return false;
            }
        }
        return true;
    }

    public byte[] toBytes() {
        return Arrays.copyOf(bits, BYTE_LENGTH);
    }

    public RlpString toRlp() {
        return new RlpString(toBytes());
    }

    @JsonValue
    public String value() {
        return Hex.encode(bits);
    }

    private static void set(final byte[] bits, final byte[] input) {
        final byte[] hash = Keccak256.hash(input);
        for (int i = 0; i < 6; i += 2) {
            final int bit = (((hash[i] & 0xFF) << 8) | (hash[i + 1] & 0xFF)) & 0x7FF;
            bits[BYTE_LENGTH - 1 - bit / 8] |= (byte) (1 << (bit % 8));
        }
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Bloom other && Arrays.equals(bits, other.bits);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bits);
    }

    @Override
    public String toString() {
        return isEmpty() ? "Bloom[empty]" : "Bloom[" + value() + "]";
    }
}

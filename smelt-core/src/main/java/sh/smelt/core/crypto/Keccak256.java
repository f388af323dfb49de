// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.smelt.core.crypto;

import java.util.Objects;

import org.bouncycastle.jcajce.provider.digest.Keccak;

import sh.smelt.core.types.Hash;

/**
 * Keccak-256 as Ethereum uses it (original Keccak padding, which differs from
 * FIPS SHA3-256). Block hashes, the ommers hash and trie node references all go
 * through here.
 *
 * <p>
 * Each thread reuses one BouncyCastle digest. Threads borrowed from a long-lived
 * pool can drop theirs with {@link #cleanup()}.
 */
public final class Keccak256 {

    private static final ThreadLocal<Keccak.Digest256> PER_THREAD = ThreadLocal.withInitial(Keccak.Digest256::new);

    private Keccak256() {
    }

    /**
     * @return the 32-byte digest of {@code input}
     */
    public static byte[] hash(final byte[] input) {
        return hash(new byte[][] {Objects.requireNonNull(input, "input cannot be null")});
    }

    /**
     * Hashes the concatenation of {@code parts} without building it.
     *
     * @throws NullPointerException if {@code parts} or any part is null
     */
    public static byte[] hash(final byte[]... parts) {
        Objects.requireNonNull(parts, "parts cannot be null");
        final Keccak.Digest256 keccak = PER_THREAD.get();
        keccak.reset();
        for (final byte[] part : parts) {
            keccak.update(Objects.requireNonNull(part, "part cannot be null"));
        }
        return keccak.digest();
    }

    public static Hash digest(final byte[] input) {
        return Hash.fromBytes(hash(input));
    }

    public static void cleanup() {
        PER_THREAD.remove();
    }
}

// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.smelt.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import sh.smelt.core.types.Address;
import sh.smelt.core.types.Hash;
import sh.smelt.primitives.rlp.RlpItem;
import sh.smelt.primitives.rlp.RlpList;

/**
 * Entry in a transaction's access list, as defined by EIP-2930: an account and
 * the storage slots the transaction pre-declares.
 *
 * @param address     the account to access
 * @param storageKeys the storage slot keys to access
 * @see <a href="https://eips.ethereum.org/EIPS/eip-2930">EIP-2930</a>
 */
public record AccessListEntry(Address address, List<Hash> storageKeys) {

    public AccessListEntry {
        Objects.requireNonNull(address, "address");
        storageKeys = List.copyOf(Objects.requireNonNull(storageKeys, "storageKeys"));
    }

    /**
     * {@code [address, [key...]]}
     */
    public RlpList toRlp() {
        final List<RlpItem> keys = new ArrayList<>(storageKeys.size());
        for (Hash key : storageKeys) {
            keys.add(key.toRlp());
        }
        return RlpList.of(address.toRlp(), new RlpList(keys));
    }
}

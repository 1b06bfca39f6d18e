package com.goerdes.minhash.hashing;

/**
 * The hash front ends a sketch can be fed through. Used to select a
 * {@link HashFamily} from configuration.
 */
public enum HashFamilyType {

    /** SipHash-1-3 with fixed zero keys. */
    SIPHASH13,

    /** SipHash-1-3 with two caller-supplied 64-bit keys. */
    KEYED_SIPHASH13,

    /** FNV from the standard offset basis. */
    FNV,

    /** FNV from one caller-supplied 64-bit key. */
    KEYED_FNV;

    /**
     * Builds the family for this type. Unkeyed types ignore the keys, keyed
     * FNV uses only {@code key0}.
     */
    public HashFamily create(long key0, long key1) {
        return switch (this) {
            case SIPHASH13 -> HashFamily.sipHash13();
            case KEYED_SIPHASH13 -> HashFamily.sipHash13(key0, key1);
            case FNV -> HashFamily.fnv();
            case KEYED_FNV -> HashFamily.fnv(key0);
        };
    }
}

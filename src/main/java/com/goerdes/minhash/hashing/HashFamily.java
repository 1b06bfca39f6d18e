package com.goerdes.minhash.hashing;

import com.google.common.hash.Funnel;

/**
 * Maps an arbitrary value to the 64-bit digest that seeds a sketch's
 * permutation stream. Implementations are immutable and create a fresh
 * hasher for every value, so a family can be shared freely between threads.
 * <p>
 * The same family (including its keys) must be used for inserting into and
 * querying a sketch, and for all sketches that are merged or compared.
 */
public interface HashFamily {

    HashFamilyType type();

    StreamingHasher newHasher();

    default <T> long hash(T value, Funnel<? super T> funnel) {
        StreamingHasher hasher = newHasher();
        funnel.funnel(value, hasher);
        return hasher.finish();
    }

    default long hashLong(long value) {
        return newHasher().putLong(value).finish();
    }

    static HashFamily sipHash13() {
        return new SipHash13(0L, 0L);
    }

    static HashFamily sipHash13(long key0, long key1) {
        return new SipHash13(key0, key1);
    }

    static HashFamily fnv() {
        return new Fnv(FnvHasher.OFFSET_BASIS);
    }

    static HashFamily fnv(long key) {
        return new Fnv(key);
    }

    /**
     * SipHash-1-3; the unkeyed variant uses two zero keys.
     */
    record SipHash13(long key0, long key1) implements HashFamily {

        @Override
        public HashFamilyType type() {
            return key0 == 0L && key1 == 0L ? HashFamilyType.SIPHASH13 : HashFamilyType.KEYED_SIPHASH13;
        }

        @Override
        public StreamingHasher newHasher() {
            return SipHasher.sip13(key0, key1);
        }
    }

    /**
     * FNV starting from {@code key}; the unkeyed variant starts from the
     * standard 64-bit offset basis.
     */
    record Fnv(long key) implements HashFamily {

        @Override
        public HashFamilyType type() {
            return key == FnvHasher.OFFSET_BASIS ? HashFamilyType.FNV : HashFamilyType.KEYED_FNV;
        }

        @Override
        public StreamingHasher newHasher() {
            return new FnvHasher(key);
        }
    }
}

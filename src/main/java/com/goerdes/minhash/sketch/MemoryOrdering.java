package com.goerdes.minhash.sketch;

import java.util.concurrent.atomic.AtomicLongArray;

/**
 * Memory ordering of the load and compare-and-set pair that makes up one
 * atomic fetch-min on a sketch slot.
 * <p>
 * Every mode keeps each slot update atomic, so {@link #RELAXED} is enough for
 * the min-reduction itself. Stronger modes only matter when other program
 * state must be ordered around the sketch updates.
 */
public enum MemoryOrdering {

    RELAXED {
        @Override
        long load(AtomicLongArray slots, int index) {
            return slots.getOpaque(index);
        }

        @Override
        boolean weakCompareAndSet(AtomicLongArray slots, int index, long expected, long value) {
            return slots.weakCompareAndSetPlain(index, expected, value);
        }
    },

    ACQUIRE {
        @Override
        long load(AtomicLongArray slots, int index) {
            return slots.getAcquire(index);
        }

        @Override
        boolean weakCompareAndSet(AtomicLongArray slots, int index, long expected, long value) {
            return slots.weakCompareAndSetAcquire(index, expected, value);
        }
    },

    RELEASE {
        @Override
        long load(AtomicLongArray slots, int index) {
            return slots.getOpaque(index);
        }

        @Override
        boolean weakCompareAndSet(AtomicLongArray slots, int index, long expected, long value) {
            return slots.weakCompareAndSetRelease(index, expected, value);
        }
    },

    SEQ_CST {
        @Override
        long load(AtomicLongArray slots, int index) {
            return slots.get(index);
        }

        @Override
        boolean weakCompareAndSet(AtomicLongArray slots, int index, long expected, long value) {
            return slots.weakCompareAndSetVolatile(index, expected, value);
        }
    };

    abstract long load(AtomicLongArray slots, int index);

    abstract boolean weakCompareAndSet(AtomicLongArray slots, int index, long expected, long value);
}

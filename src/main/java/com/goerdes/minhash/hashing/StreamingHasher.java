package com.goerdes.minhash.hashing;

import com.google.common.base.Preconditions;
import com.google.common.hash.PrimitiveSink;

import java.nio.ByteBuffer;
import java.nio.charset.Charset;

/**
 * Byte-at-a-time hasher that accepts values through Guava's
 * {@link PrimitiveSink}, so any {@link com.google.common.hash.Funnel} can feed
 * it. Multi-byte primitives are written in little-endian order. A hasher is
 * single-use: {@link #finish()} may be called once.
 */
public abstract class StreamingHasher implements PrimitiveSink {

    protected abstract void update(byte b);

    /**
     * @return the 64-bit digest of everything written so far
     */
    public abstract long finish();

    @Override
    public StreamingHasher putByte(byte b) {
        update(b);
        return this;
    }

    @Override
    public StreamingHasher putBytes(byte[] bytes) {
        return putBytes(bytes, 0, bytes.length);
    }

    @Override
    public StreamingHasher putBytes(byte[] bytes, int off, int len) {
        Preconditions.checkPositionIndexes(off, off + len, bytes.length);
        for (int i = off; i < off + len; i++) {
            update(bytes[i]);
        }
        return this;
    }

    @Override
    public StreamingHasher putBytes(ByteBuffer bytes) {
        while (bytes.hasRemaining()) {
            update(bytes.get());
        }
        return this;
    }

    @Override
    public StreamingHasher putShort(short s) {
        return putLittleEndian(s, Short.BYTES);
    }

    @Override
    public StreamingHasher putInt(int i) {
        return putLittleEndian(i, Integer.BYTES);
    }

    @Override
    public StreamingHasher putLong(long l) {
        return putLittleEndian(l, Long.BYTES);
    }

    @Override
    public StreamingHasher putFloat(float f) {
        return putInt(Float.floatToRawIntBits(f));
    }

    @Override
    public StreamingHasher putDouble(double d) {
        return putLong(Double.doubleToRawLongBits(d));
    }

    @Override
    public StreamingHasher putBoolean(boolean b) {
        return putByte(b ? (byte) 1 : (byte) 0);
    }

    @Override
    public StreamingHasher putChar(char c) {
        return putLittleEndian(c, Character.BYTES);
    }

    @Override
    public StreamingHasher putUnencodedChars(CharSequence charSequence) {
        for (int i = 0; i < charSequence.length(); i++) {
            putChar(charSequence.charAt(i));
        }
        return this;
    }

    @Override
    public StreamingHasher putString(CharSequence charSequence, Charset charset) {
        return putBytes(charSequence.toString().getBytes(charset));
    }

    private StreamingHasher putLittleEndian(long value, int bytes) {
        for (int i = 0; i < bytes; i++) {
            update((byte) (value >>> (i * Byte.SIZE)));
        }
        return this;
    }
}

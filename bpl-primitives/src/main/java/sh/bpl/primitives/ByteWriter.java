// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bpl.primitives;

import java.util.Arrays;
import java.util.Objects;

/**
 * Append-only, growable byte writer with little-endian integer encoding.
 *
 * <p>Nothing written can be removed or overwritten; {@link #toBytes()} returns a copy,
 * so callers never observe a buffer that is still being filled.
 *
 * <pre>{@code
 * ByteWriter w = new ByteWriter();
 * w.writeByte(0);
 * w.writeInt(10_000_000L);
 * w.writeLong(100_000_000L);
 * byte[] out = w.toBytes(); // 13 bytes
 * }</pre>
 *
 * <p>Not thread-safe.
 *
 * @since 1.0
 */
public final class ByteWriter {

    private static final int DEFAULT_CAPACITY = 256;
    private static final long MAX_UINT32 = 0xFFFF_FFFFL;

    private byte[] buffer;
    private int size;

    public ByteWriter() {
        this(DEFAULT_CAPACITY);
    }

    public ByteWriter(final int initialCapacity) {
        if (initialCapacity < 0) {
            throw new IllegalArgumentException("initialCapacity must be >= 0, got " + initialCapacity);
        }
        this.buffer = new byte[initialCapacity];
    }

    /**
     * Appends the low 8 bits of {@code value}.
     *
     * @param value byte value in {@code 0..255} (or {@code -128..127})
     * @return this writer
     * @throws IllegalArgumentException if the value does not fit in one byte
     */
    public ByteWriter writeByte(final int value) {
        if (value < Byte.MIN_VALUE || value > 0xFF) {
            throw new IllegalArgumentException("value does not fit in a byte: " + value);
        }
        ensureCapacity(1);
        buffer[size++] = (byte) value;
        return this;
    }

    /**
     * Appends a 4-byte little-endian unsigned integer.
     *
     * @param value integer in {@code 0..2^32-1}
     * @return this writer
     * @throws IllegalArgumentException if the value is out of the unsigned 32-bit range
     */
    public ByteWriter writeInt(final long value) {
        if (value < 0 || value > MAX_UINT32) {
            throw new IllegalArgumentException("value out of uint32 range: " + value);
        }
        ensureCapacity(4);
        for (int i = 0; i < 4; i++) {
            buffer[size++] = (byte) (value >>> (8 * i));
        }
        return this;
    }

    /**
     * Appends an 8-byte little-endian integer.
     *
     * @param value the value to write
     * @return this writer
     */
    public ByteWriter writeLong(final long value) {
        ensureCapacity(8);
        for (int i = 0; i < 8; i++) {
            buffer[size++] = (byte) (value >>> (8 * i));
        }
        return this;
    }

    /**
     * Appends {@code bytes} verbatim.
     *
     * @param bytes the bytes to append
     * @return this writer
     * @throws NullPointerException if bytes is null
     */
    public ByteWriter writeBytes(final byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        ensureCapacity(bytes.length);
        System.arraycopy(bytes, 0, buffer, size, bytes.length);
        size += bytes.length;
        return this;
    }

    /**
     * Appends {@code bytes} followed by zero bytes up to {@code width}.
     *
     * @param bytes the bytes to append
     * @param width total number of bytes written
     * @return this writer
     * @throws IllegalArgumentException if {@code bytes} is longer than {@code width}
     */
    public ByteWriter writePadded(final byte[] bytes, final int width) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        if (bytes.length > width) {
            throw new IllegalArgumentException(
                    "input of " + bytes.length + " bytes exceeds padded width " + width);
        }
        ensureCapacity(width);
        System.arraycopy(bytes, 0, buffer, size, bytes.length);
        // tail is already zero: the buffer only grows and is never rewound
        size += width;
        return this;
    }

    public int size() {
        return size;
    }

    /**
     * Returns a copy of everything written so far.
     *
     * @return a new array of length {@link #size()}
     */
    public byte[] toBytes() {
        return Arrays.copyOf(buffer, size);
    }

    private void ensureCapacity(final int extra) {
        final int required = size + extra;
        if (required > buffer.length) {
            buffer = Arrays.copyOf(buffer, Math.max(required, buffer.length * 2));
        }
    }
}

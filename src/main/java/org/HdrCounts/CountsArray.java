/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 *
 * @author Gil Tene
 */

package org.HdrCounts;

import java.nio.ByteBuffer;
import java.nio.IntBuffer;
import java.nio.LongBuffer;
import java.nio.ShortBuffer;

/**
 * <h3>A fixed length view over a caller owned array of unsigned counts</h3>
 * <p>
 * Each slot of a {@link CountsArray} holds an unsigned count of a fixed word size of 2, 4 or 8 bytes.
 * Counts are exchanged as {@code long} values: for 8 byte words, a negative {@code long} stands for an
 * unsigned count at or above 2^63.
 * <p>
 * A {@link CountsArray} never owns or copies the memory it views. It can be built over a
 * {@code short[]}, {@code int[]} or {@code long[]} array, or over the remaining bytes of a
 * {@link ByteBuffer} (in that buffer's byte order). Writes through the view are range checked
 * against the word size: a count that does not fit is rejected with a {@link CountOverflowException}
 * and the slot is left as it was.
 * <p>
 * The word size is resolved once, when the view is built. {@link CountsArray} instances are not
 * thread safe.
 */
public abstract class CountsArray {
    final int wordSizeInBytes;

    CountsArray(final int wordSizeInBytes) {
        this.wordSizeInBytes = wordSizeInBytes;
    }

    /**
     * Construct a view over an array of 16 bit unsigned counts.
     * @param counts the counts (read as unsigned)
     * @return a view over {@code counts}
     */
    public static CountsArray wrap(final short[] counts) {
        checkNotNull(counts);
        return new ShortCountsArray(ShortBuffer.wrap(counts));
    }

    /**
     * Construct a view over an array of 32 bit unsigned counts.
     * @param counts the counts (read as unsigned)
     * @return a view over {@code counts}
     */
    public static CountsArray wrap(final int[] counts) {
        checkNotNull(counts);
        return new IntCountsArray(IntBuffer.wrap(counts));
    }

    /**
     * Construct a view over an array of 64 bit unsigned counts.
     * @param counts the counts (read as unsigned)
     * @return a view over {@code counts}
     */
    public static CountsArray wrap(final long[] counts) {
        checkNotNull(counts);
        return new LongCountsArray(LongBuffer.wrap(counts));
    }

    /**
     * Construct a view over the remaining bytes of a buffer. The view spans
     * {@code buffer.remaining() / wordSizeInBytes} slots starting at the buffer's current position,
     * and uses the buffer's byte order. The buffer's position and limit are not changed.
     *
     * @param buffer The buffer holding the counts
     * @param wordSizeInBytes The size of each count, 2, 4 or 8 bytes
     * @return a view over the buffer's remaining bytes
     */
    public static CountsArray wrap(final ByteBuffer buffer, final int wordSizeInBytes) {
        checkNotNull(buffer);
        final ByteBuffer slice = buffer.slice().order(buffer.order());
        switch (wordSizeInBytes) {
            case 2:
                return new ShortCountsArray(slice.asShortBuffer());
            case 4:
                return new IntCountsArray(slice.asIntBuffer());
            case 8:
                return new LongCountsArray(slice.asLongBuffer());
            default:
                throw new IllegalArgumentException("word size must be 2, 4, or 8 bytes");
        }
    }

    /**
     * Allocate a new zeroed counts array.
     * @param length The number of slots
     * @param wordSizeInBytes The size of each count, 2, 4 or 8 bytes
     * @return a view over the newly allocated array
     */
    public static CountsArray allocate(final int length, final int wordSizeInBytes) {
        if (length < 0) {
            throw new IllegalArgumentException("Negative length " + length);
        }
        switch (wordSizeInBytes) {
            case 2:
                return wrap(new short[length]);
            case 4:
                return wrap(new int[length]);
            case 8:
                return wrap(new long[length]);
            default:
                throw new IllegalArgumentException("word size must be 2, 4, or 8 bytes");
        }
    }

    /**
     * @return The size of each count in bytes (2, 4 or 8)
     */
    public int getWordSizeInBytes() {
        return wordSizeInBytes;
    }

    /**
     * @return The number of slots in this array
     */
    public abstract int length();

    /**
     * @return The largest count a slot can hold, to be read as an unsigned value
     */
    public abstract long getMaxCountValue();

    /**
     * Get the count at a given index, widened to a {@code long} (to be read as unsigned for 8 byte words)
     * @param index the slot index
     * @return the count at {@code index}
     * @throws IndexOutOfBoundsException if index is outside of [0, length())
     */
    public abstract long getCountAtIndex(int index);

    /**
     * Set the count at a given index.
     * @param index the slot index
     * @param value the count (read as unsigned)
     * @throws CountOverflowException if value does not fit in the slot's word size. The slot
     * is left unmodified.
     * @throws IndexOutOfBoundsException if index is outside of [0, length())
     */
    public abstract void setCountAtIndex(int index, long value) throws CountOverflowException;

    /**
     * Get the number of slots up to and including the last nonzero count
     * @return the index of the last nonzero count plus one, or 0 if all counts are zero
     */
    public int getRelevantLength() {
        for (int index = length() - 1; index >= 0; index--) {
            if (getCountAtIndex(index) != 0) {
                return index + 1;
            }
        }
        return 0;
    }

    static void checkWordSize(final int wordSizeInBytes) {
        if ((wordSizeInBytes != 2) && (wordSizeInBytes != 4) && (wordSizeInBytes != 8)) {
            throw new IllegalArgumentException("word size must be 2, 4, or 8 bytes");
        }
    }

    private static void checkNotNull(final Object counts) {
        if (counts == null) {
            throw new IllegalArgumentException("NULL counts array");
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[length=" + length() + ", wordSizeInBytes=" + wordSizeInBytes + "]";
    }
}

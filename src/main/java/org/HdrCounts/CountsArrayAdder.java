/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 *
 * @author Gil Tene
 */

package org.HdrCounts;

import java.nio.IntBuffer;
import java.nio.LongBuffer;
import java.nio.ShortBuffer;

/**
 * Adds the counts of one counts array into another of the same word size.
 * <p>
 * Additions are all or nothing: every slot is checked for unsigned overflow before any slot is
 * modified, so an addition that would overflow leaves the destination exactly as it was.
 */
public final class CountsArrayAdder {

    private CountsArrayAdder() {
    }

    /**
     * Add the counts at indexes [0, maxIndex) of {@code source} into {@code destination}.
     *
     * @param destination The counts array to add into
     * @param source The counts array to add (not modified)
     * @param maxIndex The number of slots to add
     * @return The sum of all the counts added, modulo 2^64
     * @throws CountOverflowException if any slot's sum would not fit the word size. The destination is
     * left unmodified.
     */
    public static long add(final CountsArray destination, final CountsArray source, final int maxIndex)
            throws CountOverflowException {
        if (source == null) {
            throw new IllegalArgumentException("NULL source array");
        }
        if (destination == null) {
            throw new IllegalArgumentException("NULL destination array");
        }
        if (maxIndex < 0) {
            throw new IllegalArgumentException("Negative max index");
        }
        if (source.getWordSizeInBytes() != destination.getWordSizeInBytes()) {
            throw new IllegalArgumentException("source word size (" + source.getWordSizeInBytes() +
                    ") does not match destination word size (" + destination.getWordSizeInBytes() + ")");
        }
        if ((maxIndex > source.length()) || (maxIndex > destination.length())) {
            throw new IllegalArgumentException("max index " + maxIndex + " exceeds array lengths (source = " +
                    source.length() + ", destination = " + destination.length() + ")");
        }
        switch (destination.getWordSizeInBytes()) {
            case 2:
                return addShorts(((ShortCountsArray) destination).counts, ((ShortCountsArray) source).counts,
                        maxIndex);
            case 4:
                return addInts(((IntCountsArray) destination).counts, ((IntCountsArray) source).counts,
                        maxIndex);
            case 8:
                return addLongs(((LongCountsArray) destination).counts, ((LongCountsArray) source).counts,
                        maxIndex);
            default:
                throw new IllegalArgumentException("word size must be 2, 4, or 8 bytes");
        }
    }

    private static long addShorts(final ShortBuffer dst, final ShortBuffer src, final int maxIndex) {
        for (int index = 0; index < maxIndex; index++) {
            final int value = src.get(index) & 0xFFFF;
            if ((value != 0) && ((dst.get(index) & 0xFFFF) + value > 0xFFFF)) {
                throw new CountOverflowException("16-bit overflow at index " + index);
            }
        }
        long totalCount = 0;
        for (int index = 0; index < maxIndex; index++) {
            final int value = src.get(index) & 0xFFFF;
            if (value != 0) {
                dst.put(index, (short) (dst.get(index) + value));
                totalCount += value;
            }
        }
        return totalCount;
    }

    private static long addInts(final IntBuffer dst, final IntBuffer src, final int maxIndex) {
        for (int index = 0; index < maxIndex; index++) {
            final long value = src.get(index) & 0xFFFFFFFFL;
            if ((value != 0) && ((dst.get(index) & 0xFFFFFFFFL) + value > 0xFFFFFFFFL)) {
                throw new CountOverflowException("32-bit overflow at index " + index);
            }
        }
        long totalCount = 0;
        for (int index = 0; index < maxIndex; index++) {
            final long value = src.get(index) & 0xFFFFFFFFL;
            if (value != 0) {
                dst.put(index, (int) (dst.get(index) + value));
                totalCount += value;
            }
        }
        return totalCount;
    }

    private static long addLongs(final LongBuffer dst, final LongBuffer src, final int maxIndex) {
        for (int index = 0; index < maxIndex; index++) {
            final long value = src.get(index);
            if ((value != 0) && (Long.compareUnsigned(dst.get(index) + value, dst.get(index)) < 0)) {
                throw new CountOverflowException("64-bit overflow at index " + index);
            }
        }
        long totalCount = 0;
        for (int index = 0; index < maxIndex; index++) {
            final long value = src.get(index);
            if (value != 0) {
                dst.put(index, dst.get(index) + value);
                totalCount += value;
            }
        }
        return totalCount;
    }
}

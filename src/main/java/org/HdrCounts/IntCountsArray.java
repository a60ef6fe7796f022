/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 *
 * @author Gil Tene
 */

package org.HdrCounts;

import java.nio.IntBuffer;

/**
 * A {@link CountsArray} of 32 bit unsigned counts.
 */
final class IntCountsArray extends CountsArray {
    private static final long MAX_COUNT = 0xFFFFFFFFL;

    final IntBuffer counts;

    IntCountsArray(final IntBuffer counts) {
        super(4);
        this.counts = counts;
    }

    @Override
    public int length() {
        return counts.limit();
    }

    @Override
    public long getMaxCountValue() {
        return MAX_COUNT;
    }

    @Override
    public long getCountAtIndex(final int index) {
        return counts.get(index) & MAX_COUNT;
    }

    @Override
    public void setCountAtIndex(final int index, final long value) {
        if ((value < 0) || (value > MAX_COUNT)) {
            throw new CountOverflowException("Value " + Long.toUnsignedString(value) +
                    " overflows 32-bit counter at index " + index);
        }
        counts.put(index, (int) value);
    }
}

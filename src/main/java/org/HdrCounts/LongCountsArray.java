/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 *
 * @author Gil Tene
 */

package org.HdrCounts;

import java.nio.LongBuffer;

/**
 * A {@link CountsArray} of 64 bit unsigned counts. Every {@code long} value fits.
 */
final class LongCountsArray extends CountsArray {
    final LongBuffer counts;

    LongCountsArray(final LongBuffer counts) {
        super(8);
        this.counts = counts;
    }

    @Override
    public int length() {
        return counts.limit();
    }

    @Override
    public long getMaxCountValue() {
        return -1L;
    }

    @Override
    public long getCountAtIndex(final int index) {
        return counts.get(index);
    }

    @Override
    public void setCountAtIndex(final int index, final long value) {
        counts.put(index, value);
    }
}

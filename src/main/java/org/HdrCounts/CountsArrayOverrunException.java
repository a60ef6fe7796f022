/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 *
 * @author Gil Tene
 */

package org.HdrCounts;

/**
 * Thrown when a varint stream still has bytes left once it has already reached or
 * passed the end of the counts array it is being decoded into.
 */
public class CountsArrayOverrunException extends ArrayIndexOutOfBoundsException {
    private final long index;
    private final int maxIndex;

    CountsArrayOverrunException(final long index, final int maxIndex) {
        super("Destination array overrun index=" + index + " max index=" + maxIndex);
        this.index = index;
        this.maxIndex = maxIndex;
    }

    /**
     * @return the decode cursor at the time of the overrun
     */
    public long getIndex() {
        return index;
    }

    /**
     * @return the number of slots the destination was decoded with
     */
    public int getMaxIndex() {
        return maxIndex;
    }
}

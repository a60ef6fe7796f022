/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 *
 * @author Gil Tene
 */

package org.HdrCounts;

/**
 * The aggregate values established while decoding a V2 varint stream into a counts array.
 */
public final class DecodedCounts {
    private final long totalCount;
    private final int minNonZeroIndex;
    private final int maxNonZeroIndex;
    private final int bytesRead;

    DecodedCounts(final long totalCount, final int minNonZeroIndex, final int maxNonZeroIndex,
                  final int bytesRead) {
        this.totalCount = totalCount;
        this.minNonZeroIndex = minNonZeroIndex;
        this.maxNonZeroIndex = maxNonZeroIndex;
        this.bytesRead = bytesRead;
    }

    /**
     * @return The sum of all counts written into the destination
     */
    public long getTotalCount() {
        return totalCount;
    }

    /**
     * @return The lowest index a nonzero count was written to, or -1 if no nonzero count was decoded
     */
    public int getMinNonZeroIndex() {
        return minNonZeroIndex;
    }

    /**
     * @return The highest index a nonzero count was written to, or 0 if no nonzero count was decoded
     */
    public int getMaxNonZeroIndex() {
        return maxNonZeroIndex;
    }

    /**
     * @return The number of stream bytes consumed
     */
    public int getBytesRead() {
        return bytesRead;
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof DecodedCounts)) {
            return false;
        }
        DecodedCounts that = (DecodedCounts) other;
        return (totalCount == that.totalCount) &&
                (minNonZeroIndex == that.minNonZeroIndex) &&
                (maxNonZeroIndex == that.maxNonZeroIndex) &&
                (bytesRead == that.bytesRead);
    }

    @Override
    public int hashCode() {
        int h = Long.hashCode(totalCount);
        h = 31 * h + minNonZeroIndex;
        h = 31 * h + maxNonZeroIndex;
        return 31 * h + bytesRead;
    }

    @Override
    public String toString() {
        return "DecodedCounts{total=" + totalCount +
                ", min_nonzero_index=" + minNonZeroIndex +
                ", max_nonzero_index=" + maxNonZeroIndex +
                ", bytes_read=" + bytesRead + "}";
    }
}

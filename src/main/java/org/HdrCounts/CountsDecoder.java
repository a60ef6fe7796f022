/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 *
 * @author Gil Tene
 */

package org.HdrCounts;

import java.nio.ByteBuffer;

/**
 * Decodes V2 varint streams (as produced by {@link CountsEncoder}) into counts arrays.
 * <p>
 * Counts are written into the destination as they are decoded. A decode that fails part way may
 * therefore leave the destination holding the counts decoded before the failure. Slots covered by
 * zero runs are skipped, not cleared: decoding into a destination that already holds counts
 * overwrites only the slots that carry a nonzero count in the stream.
 */
public final class CountsDecoder {

    private CountsDecoder() {
    }

    /**
     * Decode the bytes of a buffer from an absolute offset up to the buffer's limit. The buffer's position
     * is not used and not changed.
     *
     * @param sourceBuffer The buffer holding the stream
     * @param startOffset The absolute offset at which the stream starts
     * @param destination The counts array to decode into
     * @param maxIndex The number of destination slots the stream may cover
     * @return The total, lowest and highest nonzero indexes of the decoded counts
     * @throws TruncatedVarintException if the stream ends in the middle of a varint
     * @throws VarintOverflowException if a zero run is longer than any counts array can be
     * @throws CountOverflowException if a count does not fit the destination's word size
     * @throws CountsArrayOverrunException if the stream still has bytes left once {@code maxIndex} is reached
     */
    public static DecodedCounts decode(final ByteBuffer sourceBuffer,
                                       final int startOffset,
                                       final CountsArray destination,
                                       final int maxIndex) {
        if (sourceBuffer == null) {
            throw new IllegalArgumentException("NULL source buffer");
        }
        if ((startOffset < 0) || (startOffset > sourceBuffer.limit())) {
            throw new IllegalArgumentException("Starting read index " + startOffset +
                    " outside of source range [0, " + sourceBuffer.limit() + "]");
        }
        final ByteBuffer source = sourceBuffer.duplicate();
        source.position(startOffset);
        return decodeFromByteBuffer(source, destination, maxIndex);
    }

    /**
     * Decode the bytes of a buffer from its position up to its limit. On success the buffer's position is
     * advanced to its limit.
     *
     * @param source The buffer holding the stream
     * @param destination The counts array to decode into
     * @param maxIndex The number of destination slots the stream may cover
     * @return The total, lowest and highest nonzero indexes of the decoded counts
     * @throws TruncatedVarintException if the stream ends in the middle of a varint
     * @throws VarintOverflowException if a zero run is longer than any counts array can be
     * @throws CountOverflowException if a count does not fit the destination's word size
     * @throws CountsArrayOverrunException if the stream still has bytes left once {@code maxIndex} is reached
     */
    public static DecodedCounts decodeFromByteBuffer(final ByteBuffer source,
                                                     final CountsArray destination,
                                                     final int maxIndex) {
        if (source == null) {
            throw new IllegalArgumentException("NULL source buffer");
        }
        if (destination == null) {
            throw new IllegalArgumentException("NULL destination array");
        }
        if (maxIndex <= 0) {
            throw new IllegalArgumentException("Negative or null max index");
        }
        if (maxIndex > destination.length()) {
            throw new IllegalArgumentException("max index " + maxIndex +
                    " exceeds destination length " + destination.length());
        }

        final int initialPosition = source.position();
        long totalCount = 0;
        int minNonZeroIndex = -1;
        int maxNonZeroIndex = 0;

        long dstIndex = 0;
        while (source.hasRemaining()) {
            // dstIndex < maxIndex holds here
            final long value = ZigZagEncoding.getLong(source);
            if (value < 0) {
                if (value < Integer.MIN_VALUE) {
                    throw new VarintOverflowException("Zero run of " + Long.toUnsignedString(-value) +
                            " counts does not fit in a counts array index", value);
                }
                dstIndex -= value;
            } else {
                if (value != 0) {
                    destination.setCountAtIndex((int) dstIndex, value);
                    totalCount += value;
                    maxNonZeroIndex = (int) dstIndex;
                    if (minNonZeroIndex < 0) {
                        minNonZeroIndex = (int) dstIndex;
                    }
                }
                dstIndex++;
            }
            if (source.hasRemaining() && (dstIndex >= maxIndex)) {
                throw new CountsArrayOverrunException(dstIndex, maxIndex);
            }
        }
        return new DecodedCounts(totalCount, minNonZeroIndex, maxNonZeroIndex,
                source.position() - initialPosition);
    }
}

/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 *
 * @author Gil Tene
 */

package org.HdrCounts;

import java.nio.ByteBuffer;

/**
 * Encodes counts arrays into the V2 varint stream format.
 * <p>
 * The stream is a plain concatenation of {@link ZigZagEncoding} varints. A positive value is the count
 * of the bucket at the current index. A negative value {@code -n} stands for a run of {@code n} buckets
 * holding a zero count. The stream carries no length or terminator of its own: callers keep track of the
 * number of bytes returned by the encoder.
 * <p>
 * Only counts below 2^63 can be encoded.
 */
public final class CountsEncoder {

    private CountsEncoder() {
    }

    /**
     * Get the capacity that is always sufficient to encode {@code maxIndex} counts of a given word size.
     * Every count takes at most one byte more than its word size, and a run of zeros never takes more
     * than the counts it replaces.
     *
     * @param maxIndex The number of counts to encode
     * @param wordSizeInBytes The word size of the counts (2, 4 or 8)
     * @return the capacity needed to encode {@code maxIndex} counts
     * @throws IllegalArgumentException if the capacity exceeds {@link Integer#MAX_VALUE}
     */
    public static int getNeededByteBufferCapacity(final int maxIndex, final int wordSizeInBytes) {
        final long neededCapacity = getNeededCapacity(maxIndex, wordSizeInBytes);
        if (neededCapacity > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("encoding " + maxIndex + " counts of " + wordSizeInBytes +
                    " bytes may need " + neededCapacity + " bytes, more than a ByteBuffer can hold");
        }
        return (int) neededCapacity;
    }

    static long getNeededCapacity(final int maxIndex, final int wordSizeInBytes) {
        CountsArray.checkWordSize(wordSizeInBytes);
        if (maxIndex < 0) {
            throw new IllegalArgumentException("Negative max index");
        }
        return (wordSizeInBytes + 1L) * maxIndex;
    }

    /**
     * Encode the first {@code maxIndex} counts of a counts array into a ByteBuffer, starting at the buffer's
     * position. On success the buffer's position is advanced past the encoded stream.
     *
     * @param counts The counts to encode
     * @param maxIndex Encode counts at indexes [0, maxIndex)
     * @param targetBuffer The buffer to encode into. Must have at least
     *                     {@link #getNeededByteBufferCapacity(int, int)} bytes remaining.
     * @return The number of bytes written to the buffer
     * @throws CountOverflowException if a count is at or above 2^63. Nothing is considered written: the
     * buffer's position is restored to where encoding started.
     */
    public static int encodeIntoByteBuffer(final CountsArray counts, final int maxIndex, final ByteBuffer targetBuffer)
            throws CountOverflowException {
        if (counts == null) {
            throw new IllegalArgumentException("NULL source array");
        }
        if (targetBuffer == null) {
            throw new IllegalArgumentException("Destination buffer is NULL");
        }
        if ((maxIndex < 0) || (maxIndex > counts.length())) {
            throw new IllegalArgumentException("max index " + maxIndex +
                    " outside of counts array range [0, " + counts.length() + "]");
        }
        if (maxIndex == 0) {
            return 0;
        }
        final long neededCapacity = getNeededCapacity(maxIndex, counts.getWordSizeInBytes());
        if ((long) targetBuffer.remaining() < neededCapacity) {
            throw new IllegalArgumentException("buffer does not have capacity for " + neededCapacity + " bytes");
        }

        final int initialPosition = targetBuffer.position();
        int index = 0;
        while (index < maxIndex) {
            final long count = counts.getCountAtIndex(index++);
            if (count == 0) {
                long zerosCount = 1;
                while ((index < maxIndex) && (counts.getCountAtIndex(index) == 0)) {
                    zerosCount++;
                    index++;
                }
                ZigZagEncoding.putLong(targetBuffer, -zerosCount);
            } else if (count < 0) {
                targetBuffer.position(initialPosition);
                throw new CountOverflowException("Count " + Long.toUnsignedString(count) + " at index " +
                        (index - 1) + " exceeds the 63-bit limit of the zigzag encoding");
            } else {
                ZigZagEncoding.putLong(targetBuffer, count);
            }
        }
        return targetBuffer.position() - initialPosition;
    }

    /**
     * Encode the first {@code maxIndex} counts of a counts array into a new byte array
     * @param counts The counts to encode
     * @param maxIndex Encode counts at indexes [0, maxIndex)
     * @return The encoded stream, sized to its exact length
     * @throws CountOverflowException if a count is at or above 2^63
     * @throws IllegalArgumentException if the capacity needed for {@code maxIndex} counts exceeds
     * {@link Integer#MAX_VALUE}
     */
    public static byte[] encode(final CountsArray counts, final int maxIndex) throws CountOverflowException {
        if (counts == null) {
            throw new IllegalArgumentException("NULL source array");
        }
        final ByteBuffer buffer =
                ByteBuffer.allocate(getNeededByteBufferCapacity(maxIndex, counts.getWordSizeInBytes()));
        final int length = encodeIntoByteBuffer(counts, maxIndex, buffer);
        final byte[] encoded = new byte[length];
        buffer.flip();
        buffer.get(encoded);
        return encoded;
    }
}

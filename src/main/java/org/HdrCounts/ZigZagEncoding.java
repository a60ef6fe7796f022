/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 *
 * @author Gil Tene
 */

package org.HdrCounts;

import java.nio.ByteBuffer;

/**
 * This class provides encoding and decoding methods for writing and reading
 * ZigZag-encoded LEB128-64b9B-variant (Little Endian Base 128) values to/from a
 * {@link ByteBuffer}. LEB128's variable length encoding provides for using a
 * smaller number of bytes for smaller values, and the use of ZigZag encoding
 * allows small (closer to zero) negative values to use fewer bytes. Details
 * on both LEB128 and ZigZag can be readily found elsewhere.
 * <p>
 * The LEB128-64b9B-variant encoding used here diverges from the "original"
 * LEB128 as it extends to 64 bit values: In the original LEB128, a 64 bit
 * value can take up to 10 bytes in the stream, where this variant's encoding
 * of a 64 bit values will max out at 9 bytes. The 9th byte is always a full
 * byte and never carries a continuation bit.
 */
public final class ZigZagEncoding {

    /** The largest number of bytes a single encoded value can take. */
    public static final int MAX_ENCODED_LENGTH = 9;

    private ZigZagEncoding() {
    }

    /**
     * Map a signed value onto the unsigned ZigZag space (0 to 0, -1 to 1, 1 to 2, -2 to 3, ...)
     * @param value the signed value
     * @return the ZigZag mapped value (to be read as unsigned)
     */
    public static long encode(final long value) {
        return (value << 1) ^ (value >> 63);
    }

    /**
     * Reverse {@link #encode(long)}.
     * @param zigZagValue a ZigZag mapped value
     * @return the signed value it stands for
     */
    public static long decode(final long zigZagValue) {
        if ((zigZagValue & 0x1) == 0) {
            return zigZagValue >>> 1;
        }
        return ~(zigZagValue >>> 1);
    }

    /**
     * Get the number of bytes {@link #putLong(ByteBuffer, long)} would use for a value
     * @param value the signed value
     * @return the encoded length, between 1 and {@value #MAX_ENCODED_LENGTH}
     */
    public static int getEncodedLength(final long value) {
        long zigZagValue = encode(value);
        int length = 1;
        while ((length < MAX_ENCODED_LENGTH) && ((zigZagValue >>> (7 * length)) != 0)) {
            length++;
        }
        return length;
    }

    /**
     * Writes a long value to the given buffer in LEB128 ZigZag encoded format
     * @param buffer the buffer to write to
     * @param value  the value to write to the buffer
     * @return the number of bytes written
     */
    public static int putLong(final ByteBuffer buffer, final long value) {
        final long v = encode(value);
        if (v >>> 7 == 0) {
            buffer.put((byte) v);
            return 1;
        }
        buffer.put((byte) ((v & 0x7F) | 0x80));
        if (v >>> 14 == 0) {
            buffer.put((byte) (v >>> 7));
            return 2;
        }
        buffer.put((byte) (v >>> 7 | 0x80));
        if (v >>> 21 == 0) {
            buffer.put((byte) (v >>> 14));
            return 3;
        }
        buffer.put((byte) (v >>> 14 | 0x80));
        if (v >>> 28 == 0) {
            buffer.put((byte) (v >>> 21));
            return 4;
        }
        buffer.put((byte) (v >>> 21 | 0x80));
        if (v >>> 35 == 0) {
            buffer.put((byte) (v >>> 28));
            return 5;
        }
        buffer.put((byte) (v >>> 28 | 0x80));
        if (v >>> 42 == 0) {
            buffer.put((byte) (v >>> 35));
            return 6;
        }
        buffer.put((byte) (v >>> 35 | 0x80));
        if (v >>> 49 == 0) {
            buffer.put((byte) (v >>> 42));
            return 7;
        }
        buffer.put((byte) (v >>> 42 | 0x80));
        if (v >>> 56 == 0) {
            buffer.put((byte) (v >>> 49));
            return 8;
        }
        buffer.put((byte) (v >>> 49 | 0x80));
        buffer.put((byte) (v >>> 56));
        return 9;
    }

    /**
     * Read an LEB128-64b9B ZigZag encoded long value from the given buffer, advancing the
     * buffer's position past the bytes consumed.
     * @param buffer the buffer to read from
     * @return the value read from the buffer
     * @throws TruncatedVarintException if the buffer ends before the value is terminated. The
     * buffer's position is left unchanged in that case.
     */
    public static long getLong(final ByteBuffer buffer) throws TruncatedVarintException {
        final int initialPosition = buffer.position();
        final int limit = buffer.limit();
        long value = 0;
        int shift = 0;
        int index = initialPosition;
        while (index < limit) {
            final long b = buffer.get(index++) & 0xFF;
            if (index - initialPosition == MAX_ENCODED_LENGTH) {
                // 8 * 7 + 8 = 64 bits, the 9th byte is taken whole:
                value |= b << shift;
                buffer.position(index);
                return decode(value);
            }
            value |= (b & 0x7F) << shift;
            if ((b & 0x80) == 0) {
                buffer.position(index);
                return decode(value);
            }
            shift += 7;
        }
        throw new TruncatedVarintException(initialPosition, limit - initialPosition);
    }
}

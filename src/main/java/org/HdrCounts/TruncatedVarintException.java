/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 *
 * @author Gil Tene
 */

package org.HdrCounts;

/**
 * Thrown when a varint stream ends before the value being read is terminated.
 */
public class TruncatedVarintException extends IllegalArgumentException {
    private final int offset;

    TruncatedVarintException(final int offset, final int bytesAvailable) {
        super("varint at offset " + offset + " is truncated after " + bytesAvailable + " bytes");
        this.offset = offset;
    }

    /**
     * @return the buffer offset at which the truncated value starts
     */
    public int getOffset() {
        return offset;
    }
}

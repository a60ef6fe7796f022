/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 *
 * @author Gil Tene
 */

package org.HdrCounts;

/**
 * Thrown when a decoded varint does not fit the range it is used in.
 */
public class VarintOverflowException extends IllegalArgumentException {
    private final long value;

    VarintOverflowException(final String message, final long value) {
        super(message);
        this.value = value;
    }

    public long getValue() {
        return value;
    }
}

/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 *
 * @author Gil Tene
 */

package org.HdrCounts;

/**
 * Thrown when a count does not fit where it is being put: a counts array slot of a
 * given word size, the 63 bits a ZigZag varint can carry, or the result of adding
 * two counts.
 */
public class CountOverflowException extends ArithmeticException {
    CountOverflowException(final String message) {
        super(message);
    }
}

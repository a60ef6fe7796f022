/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 *
 * @author Gil Tene
 */

package org.HdrCounts;

import java.io.PrintStream;
import java.util.Locale;

/**
 * Human readable output of counts arrays and encoded streams, meant for debugging.
 */
public final class CountsDump {

    private CountsDump() {
    }

    /**
     * Produce a listing of the first {@code maxIndex} counts of a counts array, collapsing every
     * series of consecutive identical counts into a single line.
     *
     * @param counts The counts to list
     * @param maxIndex List counts at indexes [0, maxIndex)
     * @param printStream Stream into which the listing should be output
     */
    public static void outputCountsSeries(final CountsArray counts, final int maxIndex,
                                          final PrintStream printStream) {
        if ((maxIndex < 0) || (maxIndex > counts.length())) {
            throw new IllegalArgumentException("max index " + maxIndex +
                    " outside of counts array range [0, " + counts.length() + "]");
        }
        printStream.format(Locale.US, "counts array size = %d entries\n", maxIndex);
        if (maxIndex == 0) {
            return;
        }
        int seriesStartIndex = 0;
        long seriesCount = counts.getCountAtIndex(0);
        for (int index = 1; index < maxIndex; index++) {
            final long count = counts.getCountAtIndex(index);
            if (count != seriesCount) {
                outputSeries(printStream, seriesStartIndex, index, seriesCount);
                seriesCount = count;
                seriesStartIndex = index;
            }
        }
        // There is always a last series:
        outputSeries(printStream, seriesStartIndex, maxIndex, seriesCount);
        printStream.format(Locale.US, "[%06d] --END--\n", maxIndex);
    }

    private static void outputSeries(final PrintStream printStream, final int start, final int stop,
                                     final long count) {
        if (stop <= start + 1) {
            printStream.format(Locale.US, "[%06d] %s\n", start, Long.toUnsignedString(count));
        } else {
            printStream.format(Locale.US, "[%06d] %s (%d identical)\n", start, Long.toUnsignedString(count),
                    stop - start);
        }
    }

    /**
     * Output a label line followed by a line of colon separated hex bytes (e.g. {@code 0a:03:06}).
     *
     * @param label The label line
     * @param bytes The bytes to dump
     * @param offset The offset of the first byte to dump
     * @param length The number of bytes to dump
     * @param printStream Stream into which the dump should be output
     */
    public static void outputHexDump(final String label, final byte[] bytes, final int offset, final int length,
                                     final PrintStream printStream) {
        printStream.println(label);
        printStream.println(toHexString(bytes, offset, length));
    }

    static String toHexString(final byte[] bytes, final int offset, final int length) {
        StringBuilder sb = new StringBuilder(length * 3);
        for (int i = offset; i < offset + length; i++) {
            if (i > offset) {
                sb.append(':');
            }
            sb.append(String.format(Locale.US, "%02x", bytes[i] & 0xFF));
        }
        return sb.toString();
    }

    /**
     * Parse a hex string into bytes. Pairs of hex digits may be separated by colons, whitespace or
     * commas, and may carry a {@code 0x} prefix.
     *
     * @param hex The hex string
     * @return The parsed bytes
     * @throws IllegalArgumentException if the string is not valid hex
     */
    static byte[] parseHexString(final String hex) {
        String digits = hex.replaceAll("0[xX]([0-9a-fA-F]{2})", "$1").replaceAll("[:,\\s]", "");
        if ((digits.length() & 1) != 0) {
            throw new IllegalArgumentException("odd number of hex digits in \"" + hex + "\"");
        }
        byte[] bytes = new byte[digits.length() / 2];
        for (int i = 0; i < bytes.length; i++) {
            int high = Character.digit(digits.charAt(2 * i), 16);
            int low = Character.digit(digits.charAt(2 * i + 1), 16);
            if ((high < 0) || (low < 0)) {
                throw new IllegalArgumentException("invalid hex digits in \"" + hex + "\"");
            }
            bytes[i] = (byte) ((high << 4) | low);
        }
        return bytes;
    }
}

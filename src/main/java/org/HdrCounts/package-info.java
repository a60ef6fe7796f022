/*
 * package-info.java
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 */

/**
 * <h3>HdrCounts: the V2 encoding of HdrHistogram counts arrays</h3>
 * <p>
 * An HdrHistogram keeps its recorded data as a fixed length array of per-bucket counts. Most buckets of a
 * typical histogram are empty, and most non-empty buckets hold small counts. The V2 encoding takes advantage
 * of both: every count is written as a ZigZag LEB128 varint, and every run of consecutive empty buckets
 * collapses into a single negative varint holding the (negated) length of the run.
 * <p>
 * This package holds the encoding and nothing around it: no histogram statistics, no headers, no compression.
 * Counts arrays are caller owned. A {@link org.HdrCounts.CountsArray} is a view over a caller's
 * {@code short[]}, {@code int[]}, {@code long[]} or {@link java.nio.ByteBuffer} holding unsigned counts of 2, 4
 * or 8 bytes each:
 * <ul>
 * <li>{@link org.HdrCounts.CountsEncoder} encodes a counts array into a varint stream.</li>
 * <li>{@link org.HdrCounts.CountsDecoder} decodes a varint stream into a counts array, and reports the total
 * count and the lowest and highest nonzero indexes as a {@link org.HdrCounts.DecodedCounts}.</li>
 * <li>{@link org.HdrCounts.CountsArrayAdder} adds one counts array into another, leaving the destination
 * untouched if any slot would overflow.</li>
 * <li>{@link org.HdrCounts.ZigZagEncoding} reads and writes the individual varints.</li>
 * </ul>
 * <p>
 * The following example encodes a small 16 bit counts array and decodes it back:
 * <br>
 * <pre><code>
 * short[] counts = { 5, 0, 0, 3 };
 * byte[] encoded = CountsEncoder.encode(CountsArray.wrap(counts), counts.length); // { 0x0a, 0x03, 0x06 }
 *
 * short[] decodedCounts = new short[4];
 * DecodedCounts decoded = CountsDecoder.decode(ByteBuffer.wrap(encoded), 0,
 *         CountsArray.wrap(decodedCounts), decodedCounts.length);
 * decoded.getTotalCount();      // 8
 * decoded.getMinNonZeroIndex(); // 0
 * decoded.getMaxNonZeroIndex(); // 3
 * </code></pre>
 * <h3>Errors</h3>
 * All errors are reported with unchecked exceptions. A stream that ends in the middle of a varint throws a
 * {@link org.HdrCounts.TruncatedVarintException}. A count that does not fit where it goes throws a
 * {@link org.HdrCounts.CountOverflowException}. A stream that runs past the end of the destination throws a
 * {@link org.HdrCounts.CountsArrayOverrunException}. Invalid arguments throw
 * {@link java.lang.IllegalArgumentException}.
 * <p>
 * None of the classes in this package are synchronized. Calls on disjoint arrays may run concurrently; calls
 * that write the same array must be serialized by the caller.
 */

package org.HdrCounts;

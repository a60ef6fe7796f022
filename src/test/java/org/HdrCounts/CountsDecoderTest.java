/**
 * CountsDecoderTest.java
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 *
 * @author Gil Tene
 */

package org.HdrCounts;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.ByteBuffer;
import java.util.Random;

/**
 * JUnit test for {@link CountsDecoder}
 */
public class CountsDecoderTest {

    static ByteBuffer streamOf(final long... values) {
        ByteBuffer buffer = ByteBuffer.allocate(values.length * ZigZagEncoding.MAX_ENCODED_LENGTH);
        for (long value : values) {
            ZigZagEncoding.putLong(buffer, value);
        }
        buffer.flip();
        return buffer;
    }

    @Test
    public void testDecodeMixedCounts() {
        short[] counts = new short[4];
        DecodedCounts decoded = CountsDecoder.decode(ByteBuffer.wrap(new byte[] {0x0A, 0x03, 0x06}), 0,
                CountsArray.wrap(counts), 4);
        Assertions.assertArrayEquals(new short[] {5, 0, 0, 3}, counts);
        Assertions.assertEquals(8, decoded.getTotalCount());
        Assertions.assertEquals(0, decoded.getMinNonZeroIndex());
        Assertions.assertEquals(3, decoded.getMaxNonZeroIndex());
        Assertions.assertEquals(3, decoded.getBytesRead());
        Assertions.assertEquals(new DecodedCounts(8, 0, 3, 3), decoded);
    }

    @Test
    public void testDecodeSingleZeroRun() {
        int[] counts = new int[1000];
        DecodedCounts decoded = CountsDecoder.decode(streamOf(-1000), 0, CountsArray.wrap(counts), 1000);
        Assertions.assertArrayEquals(new int[1000], counts);
        Assertions.assertEquals(0, decoded.getTotalCount());
        Assertions.assertEquals(-1, decoded.getMinNonZeroIndex());
        Assertions.assertEquals(0, decoded.getMaxNonZeroIndex());
        Assertions.assertEquals(2, decoded.getBytesRead());
    }

    @Test
    public void testDecodeEmptyStream() {
        ByteBuffer source = ByteBuffer.wrap(new byte[] {0x0A, 0x0A});
        DecodedCounts decoded = CountsDecoder.decode(source, 2, CountsArray.allocate(4, 8), 4);
        Assertions.assertEquals(new DecodedCounts(0, -1, 0, 0), decoded);
    }

    @Test
    public void testZeroRunsSkipRatherThanClear() {
        long[] counts = {7, 7, 7, 7};
        DecodedCounts decoded = CountsDecoder.decode(streamOf(-2, 4), 0, CountsArray.wrap(counts), 4);
        Assertions.assertArrayEquals(new long[] {7, 7, 4, 7}, counts);
        Assertions.assertEquals(4, decoded.getTotalCount());
        Assertions.assertEquals(2, decoded.getMinNonZeroIndex());
        Assertions.assertEquals(2, decoded.getMaxNonZeroIndex());
    }

    @Test
    public void testLiteralZeroIsAcceptedAndConsumesASlot() {
        // The encoder never writes a literal zero, but the decoder accepts one.
        short[] counts = {9, 9};
        DecodedCounts decoded = CountsDecoder.decode(streamOf(0, 7), 0, CountsArray.wrap(counts), 2);
        Assertions.assertArrayEquals(new short[] {9, 7}, counts);
        Assertions.assertEquals(new DecodedCounts(7, 1, 1, 2), decoded);
    }

    @Test
    public void testStartOffset() {
        ByteBuffer source = ByteBuffer.allocate(16);
        source.put((byte) 0x55).put((byte) 0x55);
        ZigZagEncoding.putLong(source, 2);
        ZigZagEncoding.putLong(source, -1);
        ZigZagEncoding.putLong(source, 1000);
        source.flip();

        CountsArray counts = CountsArray.allocate(3, 2);
        DecodedCounts decoded = CountsDecoder.decode(source, 2, counts, 3);
        Assertions.assertEquals(0, source.position());
        Assertions.assertEquals(2, counts.getCountAtIndex(0));
        Assertions.assertEquals(0, counts.getCountAtIndex(1));
        Assertions.assertEquals(1000, counts.getCountAtIndex(2));
        Assertions.assertEquals(new DecodedCounts(1002, 0, 2, 4), decoded);
    }

    @Test
    public void testDecodeFromByteBufferAdvancesPosition() {
        ByteBuffer source = streamOf(3, -2, 1);
        DecodedCounts decoded = CountsDecoder.decodeFromByteBuffer(source, CountsArray.allocate(8, 4), 8);
        Assertions.assertEquals(source.limit(), source.position());
        Assertions.assertEquals(3, decoded.getBytesRead());
        Assertions.assertEquals(3, decoded.getMaxNonZeroIndex());
    }

    @Test
    public void testOverrunByCountsLeavesPartialResults() {
        short[] counts = new short[4];
        CountsArrayOverrunException ex = Assertions.assertThrows(CountsArrayOverrunException.class,
                () -> CountsDecoder.decode(streamOf(5, -2, 3, 7), 0, CountsArray.wrap(counts), 4));
        Assertions.assertEquals(4, ex.getIndex());
        Assertions.assertEquals(4, ex.getMaxIndex());
        // Decoding is not atomic:
        Assertions.assertArrayEquals(new short[] {5, 0, 0, 3}, counts);
    }

    @Test
    public void testOverrunByZeroRun() {
        CountsArrayOverrunException ex = Assertions.assertThrows(CountsArrayOverrunException.class,
                () -> CountsDecoder.decode(streamOf(-5, 1), 0, CountsArray.allocate(4, 8), 4));
        Assertions.assertEquals(5, ex.getIndex());
        Assertions.assertTrue(ex instanceof ArrayIndexOutOfBoundsException);
    }

    @Test
    public void testZeroRunPastEndIsAcceptedWhenStreamEnds() {
        DecodedCounts decoded = CountsDecoder.decode(streamOf(1, -2000), 0, CountsArray.allocate(4, 2), 4);
        Assertions.assertEquals(new DecodedCounts(1, 0, 0, 3), decoded);

        decoded = CountsDecoder.decode(streamOf(Integer.MIN_VALUE), 0, CountsArray.allocate(4, 2), 4);
        Assertions.assertEquals(-1, decoded.getMinNonZeroIndex());
    }

    @Test
    public void testZeroRunBeyondIndexRange() {
        long tooLong = (long) Integer.MIN_VALUE - 1;
        VarintOverflowException ex = Assertions.assertThrows(VarintOverflowException.class,
                () -> CountsDecoder.decode(streamOf(tooLong), 0, CountsArray.allocate(4, 8), 4));
        Assertions.assertEquals(tooLong, ex.getValue());
        Assertions.assertThrows(VarintOverflowException.class,
                () -> CountsDecoder.decode(streamOf(Long.MIN_VALUE), 0, CountsArray.allocate(4, 8), 4));
    }

    @Test
    public void testTruncatedStream() {
        short[] counts = new short[4];
        Assertions.assertThrows(TruncatedVarintException.class,
                () -> CountsDecoder.decode(ByteBuffer.wrap(new byte[] {0x0A, (byte) 0x80}), 0,
                        CountsArray.wrap(counts), 4));
        Assertions.assertEquals(5, counts[0]);
    }

    @Test
    public void testCountTooLargeForWordSize() {
        short[] counts = new short[4];
        Assertions.assertThrows(CountOverflowException.class,
                () -> CountsDecoder.decode(streamOf(1, 65536), 0, CountsArray.wrap(counts), 4));
        Assertions.assertArrayEquals(new short[] {1, 0, 0, 0}, counts);

        int[] ints = new int[2];
        Assertions.assertThrows(CountOverflowException.class,
                () -> CountsDecoder.decode(streamOf(1L << 32), 0, CountsArray.wrap(ints), 2));

        short[] fits = new short[1];
        CountsDecoder.decode(streamOf(65535), 0, CountsArray.wrap(fits), 1);
        Assertions.assertEquals((short) 0xFFFF, fits[0]);
    }

    @Test
    public void testInvalidArguments() {
        CountsArray counts = CountsArray.allocate(4, 2);
        ByteBuffer source = streamOf(1);
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> CountsDecoder.decode(source, 0, counts, 0));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> CountsDecoder.decode(source, 0, counts, 5));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> CountsDecoder.decode(source, -1, counts, 4));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> CountsDecoder.decode(source, 2, counts, 4));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> CountsDecoder.decode(null, 0, counts, 4));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> CountsDecoder.decode(source, 0, null, 4));
    }

    @ParameterizedTest
    @ValueSource(ints = {2, 4, 8})
    public void testRoundTrip(final int wordSizeInBytes) {
        Random random = new Random(42 + wordSizeInBytes);
        CountsArray original = CountsArray.allocate(20000, wordSizeInBytes);
        long maxCount = Math.min(original.getMaxCountValue() >>> 1, Long.MAX_VALUE / 20000);
        long expectedTotal = 0;
        for (int i = 0; i < original.length(); i++) {
            int pick = random.nextInt(10);
            long count;
            if (pick < 6) {
                count = 0;
            } else if (pick < 9) {
                count = 1 + random.nextInt(100);
            } else {
                count = 1 + (long) (random.nextDouble() * maxCount);
            }
            original.setCountAtIndex(i, count);
            expectedTotal += count;
        }
        original.setCountAtIndex(original.length() - 1, 0);
        original.setCountAtIndex(original.length() - 2, 0);

        byte[] encoded = CountsEncoder.encode(original, original.length());
        CountsArray decodedCounts = CountsArray.allocate(original.length(), wordSizeInBytes);
        DecodedCounts decoded = CountsDecoder.decode(ByteBuffer.wrap(encoded), 0, decodedCounts,
                decodedCounts.length());

        long total = 0;
        int minNonZeroIndex = -1;
        int maxNonZeroIndex = 0;
        for (int i = 0; i < original.length(); i++) {
            long count = original.getCountAtIndex(i);
            Assertions.assertEquals(count, decodedCounts.getCountAtIndex(i), "count at index " + i);
            if (count != 0) {
                total += count;
                maxNonZeroIndex = i;
                if (minNonZeroIndex < 0) {
                    minNonZeroIndex = i;
                }
            }
        }
        Assertions.assertEquals(total, decoded.getTotalCount());
        Assertions.assertEquals(minNonZeroIndex, decoded.getMinNonZeroIndex());
        Assertions.assertEquals(maxNonZeroIndex, decoded.getMaxNonZeroIndex());
        Assertions.assertEquals(encoded.length, decoded.getBytesRead());
        Assertions.assertTrue(expectedTotal >= total);
    }

    @Test
    public void testRoundTripThroughByteBufferViews() {
        ByteBuffer backing = ByteBuffer.allocate(4 * 6);
        CountsArray original = CountsArray.wrap(backing, 4);
        long[] values = {0, 4000000000L, 0, 0, 17, 1};
        for (int i = 0; i < values.length; i++) {
            original.setCountAtIndex(i, values[i]);
        }
        ByteBuffer stream = ByteBuffer.allocate(CountsEncoder.getNeededByteBufferCapacity(6, 4));
        CountsEncoder.encodeIntoByteBuffer(original, 6, stream);
        stream.flip();

        CountsArray decodedCounts = CountsArray.wrap(ByteBuffer.allocateDirect(4 * 6), 4);
        DecodedCounts decoded = CountsDecoder.decodeFromByteBuffer(stream, decodedCounts, 6);
        for (int i = 0; i < values.length; i++) {
            Assertions.assertEquals(values[i], decodedCounts.getCountAtIndex(i));
        }
        Assertions.assertEquals(4000000018L, decoded.getTotalCount());
        Assertions.assertEquals(1, decoded.getMinNonZeroIndex());
        Assertions.assertEquals(5, decoded.getMaxNonZeroIndex());
    }
}

/**
 * SimpleCountsCodecExample.java
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 *
 * @author Gil Tene
 */

import org.HdrCounts.*;

import java.nio.ByteBuffer;
import java.util.Random;

/**
 * A simple example of using HdrCounts: fill a sparse counts array with a
 * latency-like distribution, encode it, decode it into a fresh array, merge the
 * two and report the sizes and totals involved.
 */

public class SimpleCountsCodecExample {
    static final int COUNTS_LENGTH = 23552;

    public static void main(final String[] args) {
        Random random = new Random();
        int[] counts = new int[COUNTS_LENGTH];
        for (int i = 0; i < 100000; i++) {
            // Most samples land in a narrow band of low buckets, with a long tail:
            int index = (int) Math.min(COUNTS_LENGTH - 1, Math.abs(random.nextGaussian()) * 200 +
                    (random.nextInt(100) == 0 ? random.nextInt(COUNTS_LENGTH) : 1000));
            counts[index]++;
        }
        CountsArray countsArray = CountsArray.wrap(counts);

        byte[] encoded = CountsEncoder.encode(countsArray, COUNTS_LENGTH);
        System.out.println("Raw counts size:     " + (COUNTS_LENGTH * 4) + " bytes");
        System.out.println("Encoded counts size: " + encoded.length + " bytes");

        CountsArray decodedCounts = CountsArray.allocate(COUNTS_LENGTH, 4);
        DecodedCounts decoded = CountsDecoder.decode(ByteBuffer.wrap(encoded), 0, decodedCounts, COUNTS_LENGTH);
        System.out.println("Decoded: " + decoded);

        long added = CountsArrayAdder.add(countsArray, decodedCounts, COUNTS_LENGTH);
        System.out.println("Merged " + added + " counts, total is now " + (decoded.getTotalCount() + added));
    }
}

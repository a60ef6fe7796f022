/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 *
 * @author Gil Tene
 */

package bench;

import org.HdrCounts.*;
import org.openjdk.jmh.annotations.*;

import java.nio.ByteBuffer;
import java.util.Random;
import java.util.concurrent.TimeUnit;

/*
  Run all benchmarks:
    $ java -jar target/benchmarks.jar

  Run selected benchmarks:
    $ java -jar target/benchmarks.jar (regexp)

  Run the profiling (Linux only):
     $ java -Djmh.perfasm.events=cycles,cache-misses -jar target/benchmarks.jar -f 1 -prof perfasm
 */
@Warmup(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@Fork(3)
@State(Scope.Thread)

public class CountsCodecBench {

    // Roughly the counts array length of a 3 digit histogram covering 1 usec to 1 hour:
    static final int countsLength = 23552;

    @Param({ "2", "4", "8" })
    int wordSizeInBytes;

    // Percentage of buckets holding a nonzero count
    @Param({ "1", "10", "50" })
    int nonZeroPercentage;

    CountsArray counts;
    CountsArray decodedCounts;
    CountsArray otherCounts;

    ByteBuffer buffer;
    ByteBuffer encoded;

    int addCount;

    @Setup
    public void setup() {
        Random random = new Random(42);
        counts = CountsArray.allocate(countsLength, wordSizeInBytes);
        otherCounts = CountsArray.allocate(countsLength, wordSizeInBytes);
        decodedCounts = CountsArray.allocate(countsLength, wordSizeInBytes);
        for (int i = 0; i < countsLength; i++) {
            if (random.nextInt(100) < nonZeroPercentage) {
                counts.setCountAtIndex(i, 1 + random.nextInt(1000));
            }
        }
        buffer = ByteBuffer.allocate(CountsEncoder.getNeededByteBufferCapacity(countsLength, wordSizeInBytes));
        encoded = ByteBuffer.wrap(CountsEncoder.encode(counts, countsLength));
    }

    @Benchmark
    public int encodeIntoByteBuffer() {
        buffer.clear();
        return CountsEncoder.encodeIntoByteBuffer(counts, countsLength, buffer);
    }

    @Benchmark
    public DecodedCounts decode() {
        return CountsDecoder.decode(encoded, 0, decodedCounts, countsLength);
    }

    @Benchmark
    public DecodedCounts roundtrip() {
        buffer.clear();
        CountsEncoder.encodeIntoByteBuffer(counts, countsLength, buffer);
        buffer.flip();
        return CountsDecoder.decodeFromByteBuffer(buffer, decodedCounts, countsLength);
    }

    @Benchmark
    public long addCounts() {
        // Every count is at most 1000, so 65 additions always fit in 16 bits:
        if (++addCount > 65) {
            otherCounts = CountsArray.allocate(countsLength, wordSizeInBytes);
            addCount = 1;
        }
        return CountsArrayAdder.add(otherCounts, counts, countsLength);
    }
}

/**
 * Written by Gil Tene of Azul Systems, and released to the public domain,
 * as explained at http://creativecommons.org/publicdomain/zero/1.0/
 *
 * @author Gil Tene
 */

package org.HdrCounts;

import java.io.PrintStream;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * {@link org.HdrCounts.CountsStreamDumper} decodes V2 varint streams given on the command
 * line and lists the counts they hold.
 * <p>
 * Streams are given as hex strings (the default, e.g. {@code 0a:03:06}) or, with the {@code -base64}
 * option, as base64 strings. Each stream is decoded into a fresh counts array of {@code -n maxIndex}
 * slots of {@code -w wordSize} bytes, and the counts are listed as series of identical counts.
 * <p>
 * For example, {@code java -jar HdrCounts.jar -w 2 -n 4 0a:03:06} lists the counts
 * {@code [5, 0, 0, 3]}.
 */
public class CountsStreamDumper implements Runnable {
    static final String versionString = "CountsStreamDumper version 1.0.0";

    /** The largest {@code -n maxIndex} accepted, 16M slots (128MB of 8 byte counts). */
    static final int MAX_INDEX_LIMIT = 1 << 24;

    private final CountsStreamDumperConfiguration config;
    private final PrintStream out;
    private final PrintStream err;
    private int failedStreamCount = 0;

    private static class CountsStreamDumperConfiguration {
        public int wordSizeInBytes = 8;
        public int maxIndex = 65536;
        public boolean base64 = false;
        public boolean dumpStreamBytes = false;
        public List<String> encodedStreams = new ArrayList<String>();

        public boolean error = false;
        public String errorMessage = "";

        public CountsStreamDumperConfiguration(final String[] args, final PrintStream err) {
            boolean askedForHelp = false;
            try {
                for (int i = 0; i < args.length; ++i) {
                    if (args[i].equals("-w")) {
                        wordSizeInBytes = Integer.parseInt(args[++i]);
                        CountsArray.checkWordSize(wordSizeInBytes);
                    } else if (args[i].equals("-n")) {
                        maxIndex = Integer.parseInt(args[++i]);
                        if ((maxIndex <= 0) || (maxIndex > MAX_INDEX_LIMIT)) {
                            throw new Exception("max index must be in [1, " + MAX_INDEX_LIMIT + "]: " + maxIndex);
                        }
                    } else if (args[i].equals("-base64")) {
                        base64 = true;
                    } else if (args[i].equals("-hex")) {
                        base64 = false;
                    } else if (args[i].equals("-x")) {
                        dumpStreamBytes = true;
                    } else if (args[i].equals("-h")) {
                        askedForHelp = true;
                        throw new Exception("Help: " + args[i]);
                    } else if (args[i].startsWith("-") && (args[i].length() > 1)) {
                        throw new Exception("Invalid args: " + args[i]);
                    } else {
                        encodedStreams.add(args[i]);
                    }
                }
                if (encodedStreams.isEmpty()) {
                    throw new Exception("No encoded stream to dump");
                }
            } catch (Exception e) {
                error = true;
                errorMessage = "Error: " + versionString + " launched with the following args:\n";

                for (String arg : args) {
                    errorMessage += arg + " ";
                }
                if (!askedForHelp) {
                    errorMessage += "\nWhich was parsed as an error, indicated by the following exception:\n" + e;
                    err.println(errorMessage);
                }

                final String validArgs =
                        "\"[-w wordSize] [-n maxIndex] [-hex | -base64] [-x] <encodedStream>...";

                err.println("valid arguments = " + validArgs);

                err.println(
                        " [-h]                        help\n" +
                                " [-w wordSize]               Word size of the counts in bytes: 2, 4 or 8 (default 8)\n" +
                                " [-n maxIndex]               Number of counts to decode into, at most 16777216 (default 65536)\n" +
                                " [-hex]                      Encoded streams are hex strings, e.g. 0a:03:06 (default)\n" +
                                " [-base64]                   Encoded streams are base64 strings\n" +
                                " [-x]                        Also output a hex dump of each stream's bytes\n"
                );
            }
        }
    }

    /**
     * Construct a {@link org.HdrCounts.CountsStreamDumper} with the given arguments, writing
     * listings to {@code System.out} and errors to {@code System.err}.
     * @param args command line arguments
     */
    public CountsStreamDumper(final String[] args) {
        this(args, System.out, System.err);
    }

    CountsStreamDumper(final String[] args, final PrintStream out, final PrintStream err) {
        this.out = out;
        this.err = err;
        config = new CountsStreamDumperConfiguration(args, err);
    }

    /**
     * @return true if the arguments this dumper was constructed with were parsed without error
     */
    public boolean isConfigured() {
        return !config.error;
    }

    /**
     * @return the number of streams that could not be decoded in the last {@link #run()}
     */
    public int getFailedStreamCount() {
        return failedStreamCount;
    }

    /**
     * Decode and list every stream given in the arguments.
     */
    @Override
    public void run() {
        failedStreamCount = 0;
        if (config.error) {
            return;
        }
        for (String encodedStream : config.encodedStreams) {
            out.println();
            out.println("Dumping counts stream: " + encodedStream);
            out.println();
            try {
                final byte[] streamBytes = config.base64 ?
                        Base64.getDecoder().decode(encodedStream.trim()) :
                        CountsDump.parseHexString(encodedStream);
                if (config.dumpStreamBytes) {
                    CountsDump.outputHexDump("stream bytes (" + streamBytes.length + "):",
                            streamBytes, 0, streamBytes.length, out);
                }
                final CountsArray counts = CountsArray.allocate(config.maxIndex, config.wordSizeInBytes);
                final DecodedCounts decoded =
                        CountsDecoder.decode(ByteBuffer.wrap(streamBytes), 0, counts, config.maxIndex);
                out.println(decoded);
                CountsDump.outputCountsSeries(counts, Math.max(counts.getRelevantLength(), 1), out);
            } catch (IllegalArgumentException | ArithmeticException | IndexOutOfBoundsException ex) {
                failedStreamCount++;
                err.println("Failed to decode stream \"" + encodedStream + "\": " + ex.getMessage());
            }
        }
    }

    /**
     * main() method.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        final CountsStreamDumper dumper = new CountsStreamDumper(args);
        if (!dumper.isConfigured()) {
            System.exit(1);
        }
        dumper.run();
        if (dumper.getFailedStreamCount() > 0) {
            System.exit(1);
        }
    }
}

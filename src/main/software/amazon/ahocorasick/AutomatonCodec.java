package software.amazon.ahocorasick;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.FilterInputStream;
import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Objects;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;
import java.util.zip.ZipException;

import static software.amazon.ahocorasick.Constants.ALPHABET_SIZE;
import static software.amazon.ahocorasick.Constants.MAX_STATES;
import static software.amazon.ahocorasick.Constants.NIL_STATE;
import static software.amazon.ahocorasick.Constants.ROOT_STATE;

/**
 * Reads and writes compiled automata, so that compilation can be skipped on later runs.
 * <p>
 * The format is a gzip stream. All integers are signed 64-bit little-endian values; counts are never negative.
 * <pre>
 *   header  u64 dictLength count
 *           u64 transition row count
 *           u64 dictLink count
 *           u64 patternIndex count
 *   body    dictLength     count x i64
 *           transitions    rows x 256 x i64, row-major
 *           dictLink       count x i64
 *           patternIndex   count x i64
 * </pre>
 * All four counts equal the number of states. Nothing follows the body. Failure links and the sparse trie edges are
 * not stored: the transition table already contains them.
 */
public class AutomatonCodec {

    private static final Logger log = LoggerFactory.getLogger(AutomatonCodec.class);

    static final int HEADER_FIELDS = 4;

    private static final int LONG_BYTES = Long.BYTES;

    // longs per read or write of a flat section
    private static final int CHUNK = 1024;

    private static final int INITIAL_SECTION_CAPACITY = 1 << 16;

    private AutomatonCodec() { }

    /**
     * Writes the automaton to the stream. The stream is flushed but not closed.
     *
     * @param automaton the automaton to persist
     * @param out destination
     * @throws IOException if writing fails
     */
    public static void encode(@Nonnull final Automaton automaton, @Nonnull final OutputStream out)
            throws IOException {
        Objects.requireNonNull(automaton, "automaton");
        Objects.requireNonNull(out, "out");

        final int stateCount = automaton.getStateCount();
        try (GZIPOutputStream gzip = new GZIPOutputStream(new NonClosingOutputStream(out))) {
            final ByteBuffer buffer = newBuffer(Math.max(HEADER_FIELDS, ALPHABET_SIZE));

            for (int i = 0; i < HEADER_FIELDS; i++) {
                buffer.putLong(stateCount);
            }
            flush(buffer, gzip);

            writeInts(automaton.getDictLength(), buffer, gzip);
            writeInts(automaton.getTransitions(), buffer, gzip);
            writeInts(automaton.getDictLink(), buffer, gzip);
            writeInts(automaton.getPatternIndex(), buffer, gzip);
        }
        log.debug("Encoded automaton with {} states", stateCount);
    }

    public static void encode(@Nonnull final Automaton automaton, @Nonnull final Path path) throws IOException {
        try (OutputStream out = Files.newOutputStream(path)) {
            encode(automaton, out);
        }
    }

    public static byte[] toByteArray(@Nonnull final Automaton automaton) throws IOException {
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        encode(automaton, out);
        return out.toByteArray();
    }

    public static Automaton decode(@Nonnull final InputStream in) throws IOException {
        return decode(in, AutomatonConfiguration.defaults());
    }

    /**
     * Reads an automaton written by {@link #encode(Automaton, OutputStream)}. The whole gzip stream is consumed; the
     * underlying stream is not closed. Runtime settings such as the buffer pool come from the configuration, since
     * they are not persisted.
     *
     * @param in source
     * @param configuration runtime settings for the decoded automaton
     * @return the automaton
     * @throws CorruptAutomatonException if the stream does not hold a valid automaton
     * @throws IOException if reading fails
     */
    public static Automaton decode(@Nonnull final InputStream in, @Nonnull final AutomatonConfiguration configuration)
            throws IOException {
        Objects.requireNonNull(in, "in");
        Objects.requireNonNull(configuration, "configuration");

        try (GZIPInputStream gzip = openGzip(in)) {
            final ByteBuffer buffer = newBuffer(Math.max(HEADER_FIELDS, ALPHABET_SIZE));
            fill(buffer, HEADER_FIELDS, gzip);
            final long dictLengthCount = buffer.getLong();
            final long rowCount = buffer.getLong();
            final long dictLinkCount = buffer.getLong();
            final long patternIndexCount = buffer.getLong();

            if (rowCount != dictLengthCount || dictLinkCount != dictLengthCount ||
                    patternIndexCount != dictLengthCount) {
                throw new CorruptAutomatonException("Section counts disagree: dictLength=" + dictLengthCount +
                        " transitions=" + rowCount + " dictLink=" + dictLinkCount + " patternIndex=" +
                        patternIndexCount);
            }
            if (dictLengthCount <= ROOT_STATE || dictLengthCount > MAX_STATES) {
                throw new CorruptAutomatonException("Invalid state count " + Long.toUnsignedString(dictLengthCount));
            }
            final int stateCount = (int) dictLengthCount;

            final int[] dictLength = readInts(stateCount, 0, Integer.MAX_VALUE, "dictLength", buffer, gzip);
            final int[] transitions = readInts(stateCount * ALPHABET_SIZE, ROOT_STATE, stateCount - 1,
                    "transition", buffer, gzip);
            final int[] dictLink = readInts(stateCount, NIL_STATE, stateCount - 1, "dictLink", buffer, gzip);
            final int[] patternIndex = readInts(stateCount, 0, Integer.MAX_VALUE, "patternIndex", buffer, gzip);

            if (gzip.read() != -1) {
                throw new CorruptAutomatonException("Unexpected bytes after the patternIndex section");
            }
            checkDictionaryLinks(dictLength, dictLink);

            log.debug("Decoded automaton with {} states", stateCount);
            return new Automaton(transitions, dictLength, patternIndex, dictLink, configuration);
        } catch (EOFException e) {
            throw new CorruptAutomatonException("Unexpected end of stream", e);
        } catch (ZipException e) {
            throw new CorruptAutomatonException("Malformed gzip data", e);
        }
    }

    public static Automaton decode(@Nonnull final Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return decode(in);
        }
    }

    public static Automaton fromByteArray(@Nonnull final byte[] bytes) throws IOException {
        return decode(new ByteArrayInputStream(bytes));
    }

    private static GZIPInputStream openGzip(final InputStream in) throws IOException {
        try {
            return new GZIPInputStream(new NonClosingInputStream(in));
        } catch (ZipException | EOFException e) {
            throw new CorruptAutomatonException("Not a gzip stream", e);
        }
    }

    /* A dictionary link must point at an accepting state, and lengths must strictly decrease along a chain. That keeps
     * every chain finite, so a corrupted file can't send a scan into a loop.
     */
    private static void checkDictionaryLinks(final int[] dictLength, final int[] dictLink)
            throws CorruptAutomatonException {
        for (int state = 0; state < dictLink.length; state++) {
            final int link = dictLink[state];
            if (link == NIL_STATE) {
                continue;
            }
            if (dictLength[link] == 0) {
                throw new CorruptAutomatonException("State " + state + " links to non-accepting state " + link);
            }
            if (dictLength[state] != 0 && dictLength[link] >= dictLength[state]) {
                throw new CorruptAutomatonException("State " + state + " links to state " + link +
                        " whose match is not shorter");
            }
        }
    }

    // the caller owns the stream; closing the gzip wrapper must only release its own resources
    private static class NonClosingOutputStream extends FilterOutputStream {

        NonClosingOutputStream(final OutputStream out) {
            super(out);
        }

        @Override
        public void write(final byte[] b, final int off, final int len) throws IOException {
            out.write(b, off, len);
        }

        @Override
        public void close() throws IOException {
            out.flush();
        }
    }

    private static class NonClosingInputStream extends FilterInputStream {

        NonClosingInputStream(final InputStream in) {
            super(in);
        }

        @Override
        public void close() {
        }
    }

    private static void writeInts(final int[] values, final ByteBuffer buffer, final OutputStream out)
            throws IOException {
        for (int i = 0; i < values.length; i++) {
            if (!buffer.hasRemaining()) {
                flush(buffer, out);
            }
            buffer.putLong(values[i]);
        }
        flush(buffer, out);
    }

    private static int[] readInts(final int count, final int min, final int max, final String section,
                                  final ByteBuffer buffer, final InputStream in) throws IOException {
        // grown as data arrives, so a forged count fails on end of stream rather than on a huge allocation
        int[] values = new int[Math.min(count, INITIAL_SECTION_CAPACITY)];
        final int capacity = buffer.capacity() / LONG_BYTES;
        int i = 0;
        while (i < count) {
            final int n = Math.min(capacity, count - i);
            if (i + n > values.length) {
                values = Arrays.copyOf(values, (int) Math.min(count, Math.max(i + n, 2L * values.length)));
            }
            fill(buffer, n, in);
            for (int end = i + n; i < end; i++) {
                final long value = buffer.getLong();
                if (value < min || value > max) {
                    throw new CorruptAutomatonException("Value " + value + " at " + section + "[" + i +
                            "] is outside [" + min + ", " + max + "]");
                }
                values[i] = (int) value;
            }
        }
        return values;
    }

    private static ByteBuffer newBuffer(final int longs) {
        return ByteBuffer.allocate(Math.max(longs, CHUNK) * LONG_BYTES).order(ByteOrder.LITTLE_ENDIAN);
    }

    private static void flush(final ByteBuffer buffer, final OutputStream out) throws IOException {
        out.write(buffer.array(), 0, buffer.position());
        buffer.clear();
    }

    // reads exactly n longs into the buffer and flips it for reading
    private static void fill(final ByteBuffer buffer, final int n, final InputStream in) throws IOException {
        buffer.clear();
        final byte[] bytes = buffer.array();
        final int length = n * LONG_BYTES;
        int read = 0;
        while (read < length) {
            final int r = in.read(bytes, read, length - read);
            if (r < 0) {
                throw new EOFException("Needed " + length + " bytes, got " + read);
            }
            read += r;
        }
        buffer.limit(length);
    }
}

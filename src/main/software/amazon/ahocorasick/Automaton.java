package software.amazon.ahocorasick;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static software.amazon.ahocorasick.Constants.BYTE_MASK;
import static software.amazon.ahocorasick.Constants.NIL_STATE;
import static software.amazon.ahocorasick.Constants.ROOT_STATE;
import static software.amazon.ahocorasick.Constants.ROW_SHIFT;

/**
 * A compiled Aho-Corasick automaton over the byte alphabet. It finds every occurrence of every pattern, overlapping
 * ones included, in a single left-to-right pass whose cost depends only on the input length.
 * <p>
 * The automaton is a set of parallel arrays indexed by state id. State 0 is a sentinel that never appears during a
 * scan and state 1 is the root. The transition table is total, so the scan loop has no failure branch. Nothing is
 * mutated after construction, so any number of threads may scan with one instance.
 * <p>
 * Instances come from {@link AutomatonBuilder#build()} or {@link AutomatonCodec#decode(java.io.InputStream)}.
 */
@ThreadSafe
@Immutable
public class Automaton {

    // stateCount rows of 256 successors, row-major
    private final int[] transitions;

    // 0, or the length of the pattern ending at the state
    private final int[] dictLength;

    // meaningful only where dictLength > 0
    private final int[] patternIndex;

    // next accepting state on the suffix chain, or NIL_STATE
    private final int[] dictLink;

    private final MatchBufferPool bufferPool;

    Automaton(final int[] transitions, final int[] dictLength, final int[] patternIndex, final int[] dictLink,
              final AutomatonConfiguration configuration) {
        this.transitions = transitions;
        this.dictLength = dictLength;
        this.patternIndex = patternIndex;
        this.dictLink = dictLink;
        this.bufferPool = new MatchBufferPool(configuration.getMatchBufferPoolSize(),
                configuration.getMatchBufferCapacity());
    }

    /**
     * Scans the input and reports every occurrence to the listener, by ascending end position. Occurrences ending at
     * the same position are reported longest first. The walk stops as soon as the listener returns {@code false}.
     *
     * @param input the bytes to scan
     * @param listener receives each occurrence
     */
    public void walk(@Nonnull final byte[] input, @Nonnull final MatchListener listener) {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(listener, "listener");

        int state = ROOT_STATE;
        for (int i = 0; i < input.length; i++) {
            state = transitions[(state << ROW_SHIFT) | (input[i] & BYTE_MASK)];

            if (dictLength[state] != 0 && !listener.onMatch(i, dictLength[state], patternIndex[state])) {
                return;
            }
            for (int link = dictLink[state]; link != NIL_STATE; link = dictLink[link]) {
                if (!listener.onMatch(i, dictLength[link], patternIndex[link])) {
                    return;
                }
            }
        }
    }

    public void walk(@Nonnull final String input, @Nonnull final MatchListener listener) {
        walk(toBytes(input), listener);
    }

    /**
     * Returns all occurrences in the order {@link #walk(byte[], MatchListener)} reports them.
     *
     * @param input the bytes to scan
     * @return list of matches. The list may be empty but never null.
     */
    public List<Match> match(@Nonnull final byte[] input) {
        final List<Match> matches = new ArrayList<>();
        collect(input, matches);
        return matches;
    }

    /**
     * Same as {@link #match(byte[])} on the UTF-8 bytes of the input.
     */
    public List<Match> match(@Nonnull final String input) {
        return match(toBytes(input));
    }

    /**
     * Returns the first occurrence {@link #match(byte[])} would return, without scanning further.
     *
     * @param input the bytes to scan
     * @return the first match, or empty if the input contains no pattern
     */
    public Optional<Match> matchFirst(@Nonnull final byte[] input) {
        final Match[] first = new Match[1];
        walk(input, (end, length, index) -> {
            first[0] = Match.ofEnd(input, end, length, index);
            return false;
        });
        return Optional.ofNullable(first[0]);
    }

    public Optional<Match> matchFirst(@Nonnull final String input) {
        return matchFirst(toBytes(input));
    }

    /**
     * Like {@link #match(byte[])}, but collects into a buffer borrowed from this automaton's pool. The result must be
     * closed once consumed.
     *
     * @param input the bytes to scan
     * @return the matches, backed by a pooled buffer
     */
    public PooledMatches matchPooled(@Nonnull final byte[] input) {
        final List<Match> buffer = bufferPool.acquire();
        try {
            collect(input, buffer);
        } catch (RuntimeException e) {
            bufferPool.release(buffer);
            throw e;
        }
        return new PooledMatches(bufferPool, buffer);
    }

    public int getStateCount() {
        return dictLength.length;
    }

    private void collect(final byte[] input, final List<Match> sink) {
        walk(input, (end, length, index) -> {
            sink.add(Match.ofEnd(input, end, length, index));
            return true;
        });
    }

    private static byte[] toBytes(final String input) {
        return Objects.requireNonNull(input, "input").getBytes(StandardCharsets.UTF_8);
    }

    // The arrays below are shared, not copied. Callers must treat them as read-only.

    int[] getTransitions() {
        return transitions;
    }

    int[] getDictLength() {
        return dictLength;
    }

    int[] getPatternIndex() {
        return patternIndex;
    }

    int[] getDictLink() {
        return dictLink;
    }

    MatchBufferPool getBufferPool() {
        return bufferPool;
    }

    int transition(final int state, final byte b) {
        return transitions[(state << ROW_SHIFT) | (b & BYTE_MASK)];
    }
}

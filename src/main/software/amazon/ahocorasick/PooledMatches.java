package software.amazon.ahocorasick;

import javax.annotation.concurrent.NotThreadSafe;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Matches collected into a pooled buffer. Use in a try-with-resources block; closing returns the buffer to the
 * automaton's pool, after which the matches can no longer be read.
 *
 * <pre>
 * try (PooledMatches matches = automaton.matchPooled(input)) {
 *     for (Match match : matches) {
 *         ...
 *     }
 * }
 * </pre>
 */
@NotThreadSafe
public final class PooledMatches implements Iterable<Match>, AutoCloseable {

    private final MatchBufferPool pool;
    private List<Match> buffer;

    PooledMatches(final MatchBufferPool pool, final List<Match> buffer) {
        this.pool = pool;
        this.buffer = buffer;
    }

    public int size() {
        return open().size();
    }

    public boolean isEmpty() {
        return open().isEmpty();
    }

    public Match get(final int index) {
        return open().get(index);
    }

    @Override
    public Iterator<Match> iterator() {
        return Collections.unmodifiableList(open()).iterator();
    }

    @Override
    public void close() {
        if (buffer != null) {
            final List<Match> released = buffer;
            buffer = null;
            pool.release(released);
        }
    }

    private List<Match> open() {
        if (buffer == null) {
            throw new IllegalStateException("Matches were already released to the pool.");
        }
        return buffer;
    }
}

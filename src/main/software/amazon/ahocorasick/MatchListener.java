package software.amazon.ahocorasick;

/**
 * Receives every occurrence reported by {@link Automaton#walk(byte[], MatchListener)}.
 */
@FunctionalInterface
public interface MatchListener {

    /**
     * Called once per occurrence.
     *
     * @param end the index of the last byte of the occurrence in the scanned input
     * @param length the length of the matched pattern
     * @param patternIndex the index the pattern received when it was added
     * @return {@code true} to continue scanning, {@code false} to stop the walk immediately
     */
    boolean onMatch(int end, int length, int patternIndex);
}

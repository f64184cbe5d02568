package software.amazon.ahocorasick;

/**
 * Decides which pattern index a terminal state keeps when a byte-identical pattern is added more than once. Every
 * addition still consumes the next pattern index, so the index that is not kept is never reported.
 */
public enum DuplicatePatternPolicy {

    /**
     * The most recently added copy wins. The earlier index is orphaned.
     */
    OVERWRITE,

    /**
     * The first added copy wins. Later indexes are orphaned.
     */
    KEEP_FIRST
}

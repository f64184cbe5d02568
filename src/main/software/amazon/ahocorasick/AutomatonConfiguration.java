package software.amazon.ahocorasick;

import javax.annotation.concurrent.Immutable;
import java.util.Objects;

import static software.amazon.ahocorasick.Constants.DEFAULT_MATCH_BUFFER_CAPACITY;
import static software.amazon.ahocorasick.Constants.DEFAULT_MATCH_BUFFER_POOL_SIZE;

/**
 * Configuration for building and decoding an Automaton.
 */
@Immutable
public class AutomatonConfiguration {

    private static final AutomatonConfiguration DEFAULT = new Builder().build();

    /**
     * What to do with the pattern index of a terminal state that is reached by a pattern added before. See
     * {@link DuplicatePatternPolicy}.
     */
    private final DuplicatePatternPolicy duplicatePatternPolicy;

    /**
     * Number of scratch match buffers created up front and retained by an Automaton's buffer pool. This is runtime
     * state only, it is never persisted.
     */
    private final int matchBufferPoolSize;

    /**
     * Initial capacity of each scratch match buffer.
     */
    private final int matchBufferCapacity;

    private AutomatonConfiguration(DuplicatePatternPolicy duplicatePatternPolicy, int matchBufferPoolSize,
                                   int matchBufferCapacity) {
        this.duplicatePatternPolicy = duplicatePatternPolicy;
        this.matchBufferPoolSize = matchBufferPoolSize;
        this.matchBufferCapacity = matchBufferCapacity;
    }

    public static AutomatonConfiguration defaults() {
        return DEFAULT;
    }

    public DuplicatePatternPolicy getDuplicatePatternPolicy() {
        return duplicatePatternPolicy;
    }

    public int getMatchBufferPoolSize() {
        return matchBufferPoolSize;
    }

    public int getMatchBufferCapacity() {
        return matchBufferCapacity;
    }

    @Override
    public String toString() {
        return "AutomatonConfiguration{duplicatePatternPolicy=" + duplicatePatternPolicy +
                ", matchBufferPoolSize=" + matchBufferPoolSize +
                ", matchBufferCapacity=" + matchBufferCapacity + '}';
    }

    public static class Builder {

        private DuplicatePatternPolicy duplicatePatternPolicy = DuplicatePatternPolicy.OVERWRITE;
        private int matchBufferPoolSize = DEFAULT_MATCH_BUFFER_POOL_SIZE;
        private int matchBufferCapacity = DEFAULT_MATCH_BUFFER_CAPACITY;

        public Builder withDuplicatePatternPolicy(DuplicatePatternPolicy duplicatePatternPolicy) {
            this.duplicatePatternPolicy = Objects.requireNonNull(duplicatePatternPolicy, "duplicatePatternPolicy");
            return this;
        }

        public Builder withMatchBufferPoolSize(int matchBufferPoolSize) {
            if (matchBufferPoolSize < 0) {
                throw new IllegalArgumentException("matchBufferPoolSize must not be negative");
            }
            this.matchBufferPoolSize = matchBufferPoolSize;
            return this;
        }

        public Builder withMatchBufferCapacity(int matchBufferCapacity) {
            if (matchBufferCapacity < 0) {
                throw new IllegalArgumentException("matchBufferCapacity must not be negative");
            }
            this.matchBufferCapacity = matchBufferCapacity;
            return this;
        }

        public AutomatonConfiguration build() {
            return new AutomatonConfiguration(duplicatePatternPolicy, matchBufferPoolSize, matchBufferCapacity);
        }
    }
}

package software.amazon.ahocorasick;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.NotThreadSafe;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static software.amazon.ahocorasick.Constants.MAX_STATES;
import static software.amazon.ahocorasick.Constants.NIL_STATE;
import static software.amazon.ahocorasick.Constants.ROOT_STATE;

/**
 * Collects patterns into a trie and compiles them into an {@link Automaton}.
 * <p>
 * Each added pattern receives a 0-based index equal to the number of patterns added before it. A builder is
 * single-use: once {@link #build()} has run, its trie is discarded and it accepts no more patterns.
 *
 * <pre>
 * Automaton automaton = new AutomatonBuilder()
 *         .addStrings("he", "she", "his", "hers")
 *         .build();
 * List&lt;Match&gt; matches = automaton.match("ushers");
 * </pre>
 */
@NotThreadSafe
public class AutomatonBuilder {

    private static final Logger log = LoggerFactory.getLogger(AutomatonBuilder.class);

    private final AutomatonConfiguration configuration;

    /**
     * Every state ever created, indexed by id. Slot 0 holds the nil sentinel and slot 1 the root.
     */
    private List<TrieState> states = new ArrayList<>();

    private int patternCount = 0;

    public AutomatonBuilder() {
        this(AutomatonConfiguration.defaults());
    }

    public AutomatonBuilder(@Nonnull final AutomatonConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        addState((byte) 0, NIL_STATE);
        addState((byte) 0, NIL_STATE);
    }

    /**
     * Adds a byte pattern. The pattern receives the next pattern index.
     *
     * @param pattern the bytes to search for, not empty
     * @return this builder
     * @throws IllegalArgumentException if the pattern is empty
     * @throws IllegalStateException if {@link #build()} was already called
     */
    public AutomatonBuilder addPattern(@Nonnull final byte[] pattern) {
        Objects.requireNonNull(pattern, "pattern");
        checkNotBuilt();
        if (pattern.length == 0) {
            throw new IllegalArgumentException("Empty pattern at index " + patternCount + " would never be reported");
        }

        TrieState state = states.get(ROOT_STATE);
        for (byte c : pattern) {
            int next = state.getChild(c);
            if (next == NIL_STATE) {
                next = addState(c, state.getId()).getId();
                state.putChild(c, next);
            }
            state = states.get(next);
        }

        if (!state.isAccepting() || configuration.getDuplicatePatternPolicy() == DuplicatePatternPolicy.OVERWRITE) {
            state.accept(pattern.length, patternCount);
        } else {
            log.debug("Pattern {} duplicates pattern {}, keeping the first", patternCount, state.getPatternIndex());
        }
        patternCount++;
        return this;
    }

    public AutomatonBuilder addPatterns(@Nonnull final Iterable<byte[]> patterns) {
        for (byte[] pattern : patterns) {
            addPattern(pattern);
        }
        return this;
    }

    public AutomatonBuilder addPatterns(@Nonnull final byte[]... patterns) {
        for (byte[] pattern : patterns) {
            addPattern(pattern);
        }
        return this;
    }

    /**
     * Adds the UTF-8 bytes of a string as a pattern.
     *
     * @param pattern the string to search for, not empty
     * @return this builder
     */
    public AutomatonBuilder addString(@Nonnull final String pattern) {
        return addPattern(Objects.requireNonNull(pattern, "pattern").getBytes(StandardCharsets.UTF_8));
    }

    public AutomatonBuilder addStrings(@Nonnull final Iterable<String> patterns) {
        for (String pattern : patterns) {
            addString(pattern);
        }
        return this;
    }

    public AutomatonBuilder addStrings(@Nonnull final String... patterns) {
        for (String pattern : patterns) {
            addString(pattern);
        }
        return this;
    }

    /**
     * @return the number of patterns added so far, which is also the index the next pattern will receive
     */
    public int getPatternCount() {
        return patternCount;
    }

    /**
     * Computes failure and dictionary links, then flattens the trie into an immutable automaton. The trie is released
     * afterwards.
     *
     * @return the compiled automaton
     * @throws IllegalStateException if called more than once
     */
    public Automaton build() {
        checkNotBuilt();
        final long startNanos = System.nanoTime();

        final IntArrayList order = FailureLinks.compute(states);
        DictionaryLinks.compute(states, order);
        final Automaton automaton = AutomatonCompiler.compile(states, order, configuration);

        log.debug("Compiled {} patterns into {} states in {} ms", patternCount, states.size(),
                (System.nanoTime() - startNanos) / 1_000_000);
        states = null;
        return automaton;
    }

    // for tests, which inspect the trie before it is compiled
    List<TrieState> getStates() {
        checkNotBuilt();
        return states;
    }

    private TrieState addState(final byte value, final int parent) {
        if (states.size() >= MAX_STATES) {
            throw new IllegalStateException("Pattern set needs more than " + MAX_STATES + " states");
        }
        final TrieState state = new TrieState(states.size(), value, parent);
        states.add(state);
        return state;
    }

    private void checkNotBuilt() {
        if (states == null) {
            throw new IllegalStateException("Can't modify or build an AutomatonBuilder after build() is called.");
        }
    }
}

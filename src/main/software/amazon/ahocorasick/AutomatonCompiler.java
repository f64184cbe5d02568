package software.amazon.ahocorasick;

import it.unimi.dsi.fastutil.ints.IntList;

import java.util.Arrays;
import java.util.List;

import static software.amazon.ahocorasick.Constants.ALPHABET_SIZE;
import static software.amazon.ahocorasick.Constants.NIL_STATE;
import static software.amazon.ahocorasick.Constants.ROOT_STATE;
import static software.amazon.ahocorasick.Constants.ROW_SHIFT;

/**
 * Flattens a linked trie into the dense arrays backing an {@link Automaton}. The transition table is total: for every
 * state and byte it holds the state reached by the goto-else-follow-failure rule, so matching never chases failure
 * links.
 */
class AutomatonCompiler {

    private AutomatonCompiler() { }

    /**
     * Compiles the trie. Requires failure and dictionary links to be in place.
     *
     * @param states the arena, indexed by state id
     * @param breadthFirstOrder the order returned by {@link FailureLinks#compute(List)}
     * @param configuration runtime settings handed to the automaton
     * @return the compiled automaton, holding no reference to the arena
     */
    static Automaton compile(final List<TrieState> states, final IntList breadthFirstOrder,
                             final AutomatonConfiguration configuration) {
        final int stateCount = states.size();
        final int[] transitions = new int[stateCount << ROW_SHIFT];
        final int[] dictLength = new int[stateCount];
        final int[] patternIndex = new int[stateCount];
        final int[] dictLink = new int[stateCount];

        // Row of the nil state: everything goes to the root. The root fails to nil, so missing root edges resolve to
        // the root through this row.
        Arrays.fill(transitions, 0, ALPHABET_SIZE, ROOT_STATE);

        // A state's failure target has a shorter string, so its row is complete by the time the state is reached.
        for (int i = 0; i < breadthFirstOrder.size(); i++) {
            final TrieState state = states.get(breadthFirstOrder.getInt(i));
            final int row = state.getId() << ROW_SHIFT;
            final int failRow = state.getFailureLink() << ROW_SHIFT;

            if (state.hasChildren()) {
                for (int c = 0; c < ALPHABET_SIZE; c++) {
                    final int child = state.getChild((byte) c);
                    transitions[row + c] = child != NIL_STATE ? child : transitions[failRow + c];
                }
            } else {
                System.arraycopy(transitions, failRow, transitions, row, ALPHABET_SIZE);
            }

            dictLength[state.getId()] = state.getDictLength();
            patternIndex[state.getId()] = state.getPatternIndex();
            dictLink[state.getId()] = state.getDictionaryLink();
        }

        return new Automaton(transitions, dictLength, patternIndex, dictLink, configuration);
    }
}

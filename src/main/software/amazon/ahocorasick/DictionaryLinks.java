package software.amazon.ahocorasick;

import it.unimi.dsi.fastutil.ints.IntList;

import java.util.List;

import static software.amazon.ahocorasick.Constants.ROOT_STATE;

/**
 * Computes dictionary links: for each state, the nearest state on its failure chain that ends a pattern. Following
 * dictionary links from a state enumerates every shorter pattern ending at the same input position, in strictly
 * decreasing length.
 */
class DictionaryLinks {

    private DictionaryLinks() { }

    /**
     * Sets the dictionary link of every non-root state. Requires failure links to be in place.
     *
     * @param states the arena, indexed by state id
     * @param breadthFirstOrder the order returned by {@link FailureLinks#compute(List)}
     */
    static void compute(final List<TrieState> states, final IntList breadthFirstOrder) {
        for (int i = 0; i < breadthFirstOrder.size(); i++) {
            final int id = breadthFirstOrder.getInt(i);
            if (id == ROOT_STATE) {
                continue;
            }
            final TrieState state = states.get(id);
            final TrieState fail = states.get(state.getFailureLink());

            // the failure target was visited earlier, so its own dictionary link already covers the rest of the chain
            if (fail.isAccepting()) {
                state.setDictionaryLink(fail.getId());
            } else {
                state.setDictionaryLink(fail.getDictionaryLink());
            }
        }
    }
}

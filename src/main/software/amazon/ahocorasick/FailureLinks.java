package software.amazon.ahocorasick;

import it.unimi.dsi.fastutil.bytes.Byte2IntMap;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.List;

import static software.amazon.ahocorasick.Constants.NIL_STATE;
import static software.amazon.ahocorasick.Constants.ROOT_STATE;

/**
 * Computes the Aho-Corasick failure function over a trie. The failure link of a state points at the state spelling
 * the longest proper suffix of its own string that is also a prefix in the trie.
 */
class FailureLinks {

    private FailureLinks() { }

    /**
     * Sets the failure link of every state reachable from the root, breadth first. The root keeps
     * {@link Constants#NIL_STATE} as its failure link; its children fail to the root.
     *
     * @param states the arena, indexed by state id
     * @return the ids of all reachable states in breadth-first order, root first. A state's failure target always
     *         comes before the state itself in this order.
     */
    static IntArrayList compute(final List<TrieState> states) {
        final IntArrayList order = new IntArrayList(states.size());
        final IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        queue.enqueue(ROOT_STATE);

        while (!queue.isEmpty()) {
            final int id = queue.dequeueInt();
            order.add(id);
            final TrieState state = states.get(id);

            for (Byte2IntMap.Entry edge : state.children()) {
                final byte c = edge.getByteKey();
                final TrieState child = states.get(edge.getIntValue());

                // walk up the failure chain until some state can move on c
                int fail = state.getFailureLink();
                while (fail != NIL_STATE && states.get(fail).getChild(c) == NIL_STATE) {
                    fail = states.get(fail).getFailureLink();
                }
                child.setFailureLink(fail == NIL_STATE ? ROOT_STATE : states.get(fail).getChild(c));
                queue.enqueue(child.getId());
            }
        }
        return order;
    }
}

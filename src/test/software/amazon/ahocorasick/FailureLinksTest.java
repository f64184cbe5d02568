package software.amazon.ahocorasick;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static software.amazon.ahocorasick.Constants.NIL_STATE;
import static software.amazon.ahocorasick.Constants.ROOT_STATE;

/**
 * Uses the trie of "he", "she", "his", "hers". State ids follow insertion:
 * 2=h 3=he 4=s 5=sh 6=she 7=hi 8=his 9=her 10=hers.
 */
public class FailureLinksTest {

    private List<TrieState> states;

    @Before
    public void setUp() {
        states = new AutomatonBuilder().addStrings("he", "she", "his", "hers").getStates();
    }

    @Test
    public void failureLinksPointAtLongestProperSuffix() {
        FailureLinks.compute(states);

        assertEquals(NIL_STATE, failureOf(ROOT_STATE));
        assertEquals(ROOT_STATE, failureOf(2));
        assertEquals(ROOT_STATE, failureOf(3));
        assertEquals(ROOT_STATE, failureOf(4));
        assertEquals(2, failureOf(5));
        assertEquals(3, failureOf(6));
        assertEquals(ROOT_STATE, failureOf(7));
        assertEquals(4, failureOf(8));
        assertEquals(ROOT_STATE, failureOf(9));
        assertEquals(4, failureOf(10));
    }

    @Test
    public void orderIsBreadthFirstAndCoversEveryState() {
        IntArrayList order = FailureLinks.compute(states);

        assertEquals(states.size() - 1, order.size());
        assertEquals(ROOT_STATE, order.getInt(0));
        int previousDepth = 0;
        for (int i = 0; i < order.size(); i++) {
            int depth = depthOf(order.getInt(i));
            assertTrue("depth never decreases", depth >= previousDepth);
            previousDepth = depth;
        }
    }

    @Test
    public void failureTargetPrecedesStateInOrder() {
        IntArrayList order = FailureLinks.compute(states);

        for (int i = 1; i < order.size(); i++) {
            int id = order.getInt(i);
            assertTrue(order.indexOf(failureOf(id)) < i);
        }
    }

    @Test
    public void deepChainFallsBackThroughSeveralLinks() {
        states = new AutomatonBuilder().addStrings("aaaa", "aab").getStates();
        FailureLinks.compute(states);

        // 2=a 3=aa 4=aaa 5=aaaa 6=aab
        assertEquals(ROOT_STATE, failureOf(2));
        assertEquals(2, failureOf(3));
        assertEquals(3, failureOf(4));
        assertEquals(4, failureOf(5));
        assertEquals(ROOT_STATE, failureOf(6));
    }

    @Test
    public void veryDeepPatternDoesNotOverflowStack() {
        byte[] pattern = new byte[200_000];
        states = new AutomatonBuilder().addPattern(pattern).getStates();

        IntArrayList order = FailureLinks.compute(states);

        assertEquals(pattern.length + 1, order.size());
        assertEquals(pattern.length, failureOf(states.size() - 1));
    }

    private int failureOf(int id) {
        return states.get(id).getFailureLink();
    }

    private int depthOf(int id) {
        int depth = 0;
        for (int s = id; s != ROOT_STATE; s = states.get(s).getParent()) {
            depth++;
        }
        return depth;
    }
}

package software.amazon.ahocorasick;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.junit.Test;

import java.util.List;
import java.util.Random;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static software.amazon.ahocorasick.Constants.ALPHABET_SIZE;
import static software.amazon.ahocorasick.Constants.NIL_STATE;
import static software.amazon.ahocorasick.Constants.ROOT_STATE;

public class AutomatonCompilerTest {

    @Test
    public void transitionTableIsTotalAndNeverReachesSentinel() {
        Automaton automaton = compile(new AutomatonBuilder().addStrings("he", "she", "his", "hers").getStates());

        for (int state = 0; state < automaton.getStateCount(); state++) {
            for (int c = 0; c < ALPHABET_SIZE; c++) {
                int next = automaton.transition(state, (byte) c);
                assertNotEquals(NIL_STATE, next);
                assertTrue(next < automaton.getStateCount());
            }
        }
    }

    @Test
    public void rootLoopsOnBytesThatStartNoPattern() {
        Automaton automaton = compile(new AutomatonBuilder().addStrings("ab").getStates());

        for (int c = 0; c < ALPHABET_SIZE; c++) {
            if (c != 'a') {
                assertEquals(ROOT_STATE, automaton.transition(ROOT_STATE, (byte) c));
            }
        }
        assertEquals(2, automaton.transition(ROOT_STATE, (byte) 'a'));
    }

    @Test
    public void failureTransitionsAreFoldedIntoTable() {
        // 2=h 3=he 4=s 5=sh 6=she 7=hi 8=his 9=her 10=hers
        Automaton automaton = compile(new AutomatonBuilder().addStrings("he", "she", "his", "hers").getStates());

        assertEquals(9, automaton.transition(6, (byte) 'r'));
        assertEquals(7, automaton.transition(5, (byte) 'i'));
        assertEquals(4, automaton.transition(8, (byte) 's'));
        // hers + h ends in sh
        assertEquals(5, automaton.transition(10, (byte) 'h'));
    }

    @Test
    public void tableMatchesNaiveFailureChasing() {
        Random random = new Random(20241019L);
        for (int round = 0; round < 20; round++) {
            AutomatonBuilder builder = new AutomatonBuilder();
            int patterns = 1 + random.nextInt(30);
            for (int i = 0; i < patterns; i++) {
                byte[] pattern = new byte[1 + random.nextInt(6)];
                for (int j = 0; j < pattern.length; j++) {
                    // a small alphabet, plus the occasional high byte to exercise sign handling
                    pattern[j] = random.nextInt(10) == 0 ? (byte) 0xF0 : (byte) ('a' + random.nextInt(3));
                }
                builder.addPattern(pattern);
            }
            List<TrieState> states = builder.getStates();
            Automaton automaton = compile(states);

            for (int state = 0; state < states.size(); state++) {
                for (int c = 0; c < ALPHABET_SIZE; c++) {
                    assertEquals("state " + state + " byte " + c, naiveTransition(states, state, (byte) c),
                            automaton.transition(state, (byte) c));
                }
            }
        }
    }

    @Test
    public void acceptingArraysMirrorTrie() {
        List<TrieState> states = new AutomatonBuilder().addStrings("a", "ab", "b").getStates();
        Automaton automaton = compile(states);

        // nil, root, a, ab, b
        assertArrayEquals(new int[] { 0, 0, 1, 2, 1 }, automaton.getDictLength());
        assertArrayEquals(new int[] { 0, 0, 0, 1, 2 }, automaton.getPatternIndex());
        assertArrayEquals(new int[] { 0, 0, 0, 4, 0 }, automaton.getDictLink());
    }

    private static Automaton compile(List<TrieState> states) {
        IntArrayList order = FailureLinks.compute(states);
        DictionaryLinks.compute(states, order);
        return AutomatonCompiler.compile(states, order, AutomatonConfiguration.defaults());
    }

    private static int naiveTransition(List<TrieState> states, int state, byte c) {
        for (int s = state; s != NIL_STATE; s = states.get(s).getFailureLink()) {
            int next = states.get(s).getChild(c);
            if (next != NIL_STATE) {
                return next;
            }
        }
        return ROOT_STATE;
    }
}

package software.amazon.ahocorasick;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;

public class AutomatonConfigurationTest {

    @Test
    public void defaultsMatchBuilderDefaults() {
        AutomatonConfiguration configuration = AutomatonConfiguration.defaults();

        assertSame(configuration, AutomatonConfiguration.defaults());
        assertEquals(DuplicatePatternPolicy.OVERWRITE, configuration.getDuplicatePatternPolicy());
        assertEquals(Constants.DEFAULT_MATCH_BUFFER_POOL_SIZE, configuration.getMatchBufferPoolSize());
        assertEquals(Constants.DEFAULT_MATCH_BUFFER_CAPACITY, configuration.getMatchBufferCapacity());
    }

    @Test
    public void builderSetsEveryOption() {
        AutomatonConfiguration configuration = new AutomatonConfiguration.Builder()
                .withDuplicatePatternPolicy(DuplicatePatternPolicy.KEEP_FIRST)
                .withMatchBufferPoolSize(0)
                .withMatchBufferCapacity(128)
                .build();

        assertEquals(DuplicatePatternPolicy.KEEP_FIRST, configuration.getDuplicatePatternPolicy());
        assertEquals(0, configuration.getMatchBufferPoolSize());
        assertEquals(128, configuration.getMatchBufferCapacity());
        assertEquals("AutomatonConfiguration{duplicatePatternPolicy=KEEP_FIRST, matchBufferPoolSize=0, " +
                "matchBufferCapacity=128}", configuration.toString());
    }

    @Test(expected = IllegalArgumentException.class)
    public void negativePoolSizeIsRejected() {
        new AutomatonConfiguration.Builder().withMatchBufferPoolSize(-1);
    }

    @Test(expected = IllegalArgumentException.class)
    public void negativeBufferCapacityIsRejected() {
        new AutomatonConfiguration.Builder().withMatchBufferCapacity(-1);
    }

    @Test(expected = NullPointerException.class)
    public void nullPolicyIsRejected() {
        new AutomatonConfiguration.Builder().withDuplicatePatternPolicy(null);
    }
}

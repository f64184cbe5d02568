package software.amazon.ahocorasick;

import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class AutomatonConcurrencyTest {

    private static final int SCANS = 400;
    private static final int THREADS = 32;

    @Test
    public void concurrentScansMatchSequentialScans() throws Exception {
        Random random = new Random(7L);
        AutomatonBuilder builder = new AutomatonBuilder();
        for (int i = 0; i < 200; i++) {
            builder.addString(AutomatonTest.randomString(random, 2 + random.nextInt(5)));
        }
        Automaton automaton = builder.build();

        List<String> inputs = new ArrayList<>();
        List<List<Match>> sequential = new ArrayList<>();
        for (int i = 0; i < SCANS; i++) {
            String input = AutomatonTest.randomString(random, 500 + random.nextInt(500));
            inputs.add(input);
            sequential.add(automaton.match(input));
        }

        CountDownLatch latch = new CountDownLatch(1);
        ExecutorService exec = Executors.newFixedThreadPool(THREADS);
        List<Future<List<Match>>> futures = new ArrayList<>();
        for (String input : inputs) {
            futures.add(exec.submit(new Callable<List<Match>>() {
                @Override
                public List<Match> call() throws Exception {
                    latch.await();
                    // alternate between the plain and the pooled path, both share the automaton
                    List<Match> plain = automaton.match(input);
                    try (PooledMatches pooled = automaton.matchPooled(input.getBytes(StandardCharsets.UTF_8))) {
                        List<Match> copy = new ArrayList<>();
                        for (Match match : pooled) {
                            copy.add(match);
                        }
                        assertEquals(plain, copy);
                    }
                    return plain;
                }
            }));
        }

        // release threads to let them work
        latch.countDown();
        exec.shutdown();
        assertTrue(exec.awaitTermination(5, TimeUnit.MINUTES));

        for (int i = 0; i < SCANS; i++) {
            assertEquals(sequential.get(i), futures.get(i).get());
        }
    }
}

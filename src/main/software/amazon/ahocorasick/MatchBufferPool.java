package software.amazon.ahocorasick;

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Recycles the scratch buffers that collect matches during a scan. A buffer handed out by {@link #acquire()} belongs
 * to the caller until it is passed to {@link #release(List)}, after which the caller must not touch it again. Acquire
 * and release may race freely between threads.
 */
@ThreadSafe
class MatchBufferPool {

    // buffers that grew past this are dropped on release so one huge scan doesn't pin memory
    static final int MAX_RETAINED_BUFFER_SIZE = 4096;

    private final Queue<List<Match>> buffers = new ConcurrentLinkedQueue<>();
    private final AtomicInteger retained = new AtomicInteger();
    private final int maxRetained;
    private final int bufferCapacity;

    MatchBufferPool(final int maxRetained, final int bufferCapacity) {
        this.maxRetained = maxRetained;
        this.bufferCapacity = bufferCapacity;
        for (int i = 0; i < maxRetained; i++) {
            buffers.add(new ArrayList<>(bufferCapacity));
        }
        retained.set(maxRetained);
    }

    /**
     * Returns an empty buffer, recycled if one is available.
     *
     * @return an empty buffer owned by the caller
     */
    List<Match> acquire() {
        final List<Match> buffer = buffers.poll();
        if (buffer == null) {
            return new ArrayList<>(bufferCapacity);
        }
        retained.decrementAndGet();
        return buffer;
    }

    /**
     * Hands a buffer back. The buffer is cleared; it is kept for reuse only if the pool has room.
     *
     * @param buffer a buffer previously obtained from {@link #acquire()}
     */
    void release(final List<Match> buffer) {
        Objects.requireNonNull(buffer, "buffer");
        final int size = buffer.size();
        buffer.clear();
        if (size > MAX_RETAINED_BUFFER_SIZE) {
            return;
        }
        if (retained.incrementAndGet() <= maxRetained) {
            buffers.offer(buffer);
        } else {
            retained.decrementAndGet();
        }
    }

    int retainedCount() {
        return retained.get();
    }
}

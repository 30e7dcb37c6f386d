package im.arun.hoteltree.util;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates the thread pools that run remote store writes off the editing thread. Each pool belongs
 * to whoever asked for it; a {@code HotelSession} shuts its own pool down on close.
 */
public final class ExecutorProvider {
    private static final AtomicInteger POOLS = new AtomicInteger(0);

    private ExecutorProvider() {}

    /**
     * Saves for one document never overlap, so a small pool is enough: two daemon threads, one for
     * the running save and one spare for a flush issued while the session switches hotels.
     */
    public static ExecutorService newIoExecutor() {
        int pool = POOLS.incrementAndGet();
        return Executors.newFixedThreadPool(2, new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger(0);

            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "hoteltree-io-" + pool + "-" + counter.incrementAndGet());
                t.setDaemon(true);
                return t;
            }
        });
    }
}

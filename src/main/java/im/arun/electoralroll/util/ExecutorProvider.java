package im.arun.electoralroll.util;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates the bounded worker pools page tasks run on.
 * Threads are daemons so a stuck recognition call never keeps the JVM alive.
 */
public final class ExecutorProvider {
    private static final AtomicInteger POOL_COUNTER = new AtomicInteger(0);

    private ExecutorProvider() {}

    /**
     * Returns a new fixed-size pool. The caller owns it and must shut it down.
     */
    public static ExecutorService newWorkerPool(int poolSize) {
        if (poolSize < 1) {
            throw new IllegalArgumentException("pool size must be at least 1, got " + poolSize);
        }
        int pool = POOL_COUNTER.incrementAndGet();
        return Executors.newFixedThreadPool(poolSize, new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger(0);
            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "electoralroll-worker-" + pool + "-" + counter.incrementAndGet());
                t.setDaemon(true);
                return t;
            }
        });
    }
}

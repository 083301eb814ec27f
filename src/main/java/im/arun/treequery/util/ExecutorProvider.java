package im.arun.treequery.util;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared bounded thread pool for batch work over sentences. Threads are daemons, so an
 * application that never calls {@link #shutdown()} still exits.
 */
public final class ExecutorProvider {
    private static volatile ExecutorService instance;
    private static volatile int poolSize;
    private static final Object LOCK = new Object();

    private ExecutorProvider() {}

    /**
     * Sets the pool size used when the pool is next created. Zero or less sizes the pool
     * from the CPU count. Has no effect on a pool that already exists.
     */
    public static void configure(int workerThreads) {
        synchronized (LOCK) {
            poolSize = workerThreads;
        }
    }

    /**
     * Returns the shared executor. Tree queries are CPU-bound, so the default size is the
     * number of available processors.
     */
    public static ExecutorService getExecutor() {
        if (instance == null) {
            synchronized (LOCK) {
                if (instance == null) {
                    int size = poolSize > 0 ? poolSize : Runtime.getRuntime().availableProcessors();
                    instance = Executors.newFixedThreadPool(size, new ThreadFactory() {
                        private final AtomicInteger counter = new AtomicInteger(0);
                        @Override
                        public Thread newThread(Runnable r) {
                            Thread t = new Thread(r, "treequery-worker-" + counter.incrementAndGet());
                            t.setDaemon(true);
                            return t;
                        }
                    });
                }
            }
        }
        return instance;
    }

    /**
     * Shuts down the shared executor. The next {@link #getExecutor()} creates a new one.
     */
    public static void shutdown() {
        synchronized (LOCK) {
            if (instance != null) {
                instance.shutdown();
                instance = null;
            }
        }
    }
}

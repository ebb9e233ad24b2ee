package ai.texdocx.converter.render;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools used while rendering. All threads are daemons so an abandoned renderer process never keeps the JVM
 * alive.
 */
public final class RenderExecutors {

    private static volatile ExecutorService streamReaders;
    private static final Object LOCK = new Object();

    private RenderExecutors() {
    }

    /**
     * Fixed pool for rendering formulas concurrently; the caller owns it and must shut it down.
     */
    public static ExecutorService newRenderPool(int size) {
        if (size < 1) {
            throw new IllegalArgumentException("size must be at least 1");
        }
        return Executors.newFixedThreadPool(size, daemonFactory("render-worker-"));
    }

    /**
     * Shared pool draining the output streams of external processes.
     */
    static ExecutorService streamReaders() {
        if (streamReaders == null) {
            synchronized (LOCK) {
                if (streamReaders == null) {
                    streamReaders = Executors.newCachedThreadPool(daemonFactory("render-stream-"));
                }
            }
        }
        return streamReaders;
    }

    private static ThreadFactory daemonFactory(String prefix) {
        return new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger(0);

            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, prefix + counter.incrementAndGet());
                t.setDaemon(true);
                return t;
            }
        };
    }
}

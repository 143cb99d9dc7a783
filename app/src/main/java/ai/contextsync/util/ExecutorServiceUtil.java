package ai.contextsync.util;

import ai.contextsync.exception.GlobalExceptionHandler;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;

public final class ExecutorServiceUtil {

    private ExecutorServiceUtil() {}

    public static ExecutorService newFixedThreadExecutor(int parallelism, String threadPrefix) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1, got " + parallelism);
        }
        return Executors.newFixedThreadPool(parallelism, createNamedThreadFactory(threadPrefix));
    }

    /** Daemon threads named {@code <prefix>-N} that report uncaught exceptions to {@link GlobalExceptionHandler}. */
    public static ThreadFactory createNamedThreadFactory(String prefix) {
        return new ThreadFactory() {
            private final ThreadFactory delegate = Executors.defaultThreadFactory();
            private int count = 0;

            @Override
            public synchronized Thread newThread(Runnable r) {
                var t = delegate.newThread(r);
                t.setName(prefix + "-" + ++count);
                t.setDaemon(true);
                t.setUncaughtExceptionHandler(GlobalExceptionHandler::handle);
                return t;
            }
        };
    }
}

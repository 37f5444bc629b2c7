package com.eainde.expedition.thread;

import org.slf4j.MDC;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Thread pool that runs every task with the MDC of the thread that submitted it, so that the record id
 * and channel keys follow a run onto worker and call threads.
 */
public class MdcAwareThreadPoolExecutor extends ThreadPoolExecutor {

    public MdcAwareThreadPoolExecutor(int core, int max, long keepAliveSeconds,
                                      BlockingQueue<Runnable> queue, String threadNamePrefix) {
        super(core, max, keepAliveSeconds, TimeUnit.SECONDS, queue, daemonFactory(threadNamePrefix));
    }

    /** Bounded pool: at most {@code workers} tasks run at once, the rest queue. */
    public static MdcAwareThreadPoolExecutor fixed(int workers, String threadNamePrefix) {
        return new MdcAwareThreadPoolExecutor(workers, workers, 0L, new LinkedBlockingQueue<>(), threadNamePrefix);
    }

    /** Unbounded pool for blocking external calls; concurrency is already bounded by the callers. */
    public static MdcAwareThreadPoolExecutor cached(String threadNamePrefix) {
        return new MdcAwareThreadPoolExecutor(0, Integer.MAX_VALUE, 60L, new SynchronousQueue<>(), threadNamePrefix);
    }

    @Override
    public void execute(Runnable command) {
        // Capture MDC context from the submitting thread
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();

        super.execute(() -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            if (parentMdc != null) {
                MDC.setContextMap(parentMdc);
            } else {
                MDC.clear();
            }
            try {
                command.run();
            } finally {
                if (previous != null) {
                    MDC.setContextMap(previous);
                } else {
                    MDC.clear();
                }
            }
        });
    }

    private static CustomizableThreadFactory daemonFactory(String prefix) {
        CustomizableThreadFactory factory = new CustomizableThreadFactory(prefix);
        factory.setDaemon(true);
        return factory;
    }
}

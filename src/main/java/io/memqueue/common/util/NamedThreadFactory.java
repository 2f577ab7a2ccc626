package io.memqueue.common.util;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Daemon thread factory producing {@code prefix-role-N} names.
 */
public final class NamedThreadFactory implements ThreadFactory {

    private final AtomicInteger threadIndex = new AtomicInteger(0);
    private final String threadNamePrefix;
    private final boolean daemon;

    public NamedThreadFactory(final String threadNamePrefix) {
        this(threadNamePrefix, true);
    }

    public NamedThreadFactory(final String threadNamePrefix, final boolean daemon) {
        this.threadNamePrefix = threadNamePrefix;
        this.daemon = daemon;
    }

    @Override
    public Thread newThread(final Runnable r) {
        final Thread thread = new Thread(r, threadNamePrefix + "-" + threadIndex.incrementAndGet());
        thread.setDaemon(daemon);
        return thread;
    }
}

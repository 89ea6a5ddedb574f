package com.questrail.socket.core;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executors for handler tasks. Threads are daemons named after their owner,
 * e.g. {@code tcp-handler-3}.
 */
public final class HandlerThreads
{
    private HandlerThreads() {
    }

    /** One thread per task; idle threads are reclaimed. */
    public static ExecutorService perTask(String name) {
        return Executors.newCachedThreadPool(factory(name));
    }

    public static ExecutorService single(String name) {
        return Executors.newSingleThreadExecutor(factory(name));
    }

    private static ThreadFactory factory(String name) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, name + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}

package fr.lapetina.forwarder.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread factory for named threads: {@code <prefix>0}, {@code <prefix>1}, ...
 */
public final class NamedThreadFactory implements ThreadFactory {

    private final String namePrefix;
    private final boolean daemon;
    private final AtomicInteger counter = new AtomicInteger(0);

    public NamedThreadFactory(String namePrefix, boolean daemon) {
        this.namePrefix = Objects.requireNonNull(namePrefix, "namePrefix");
        this.daemon = daemon;
    }

    public static NamedThreadFactory daemon(String namePrefix) {
        return new NamedThreadFactory(namePrefix, true);
    }

    @Override
    public Thread newThread(Runnable r) {
        Thread t = new Thread(r, namePrefix + counter.getAndIncrement());
        t.setDaemon(daemon);
        return t;
    }
}

package fr.lapetina.tgbot.dispatch;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Names dispatcher threads {@code <prefix>-<n>}.
 */
class DispatcherThreadFactory implements ThreadFactory {

    private final String namePrefix;
    private final boolean daemon;
    private final AtomicInteger counter = new AtomicInteger(0);

    DispatcherThreadFactory(String namePrefix, boolean daemon) {
        this.namePrefix = namePrefix;
        this.daemon = daemon;
    }

    @Override
    public Thread newThread(Runnable r) {
        Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
        t.setDaemon(daemon);
        return t;
    }
}

package io.github.hongjungwan.auditlog.core.internal;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 파이프라인 스레드 팩토리. 데몬 스레드, 이름 접두사 + 순번.
 */
public class NamedThreadFactory implements ThreadFactory {

    private final String prefix;
    private final boolean numbered;
    private final AtomicInteger counter = new AtomicInteger(1);

    private NamedThreadFactory(String prefix, boolean numbered) {
        this.prefix = prefix;
        this.numbered = numbered;
    }

    /** 단일 스레드용 (이름 고정) */
    public static NamedThreadFactory single(String name) {
        return new NamedThreadFactory(name, false);
    }

    /** 풀용 (name-1, name-2, ...) */
    public static NamedThreadFactory pool(String prefix) {
        return new NamedThreadFactory(prefix, true);
    }

    @Override
    public Thread newThread(Runnable runnable) {
        String name = numbered ? prefix + "-" + counter.getAndIncrement() : prefix;
        Thread thread = new Thread(runnable, name);
        thread.setDaemon(true);
        return thread;
    }
}

package com.ryuqq.fanout.adapter.runner;

import com.ryuqq.fanout.application.identity.SessionCache;
import com.ryuqq.fanout.core.identity.IdentitySession;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * 스레드마다 새 {@link SessionCache}를 붙여 worker 스레드를 생성하는 ThreadFactory.
 *
 * <p>캐시는 스레드 키로 보관되며 스레드가 종료되면 제거됩니다.</p>
 *
 * @param <S> 세션 타입
 *
 * @author FanOut Team
 * @since 1.0.0
 */
final class FanOutWorkerFactory<S extends IdentitySession> implements ThreadFactory {

    private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger(1);

    private final Supplier<SessionCache<S>> cacheSupplier;
    private final Map<Thread, SessionCache<S>> caches = new ConcurrentHashMap<>();
    private final String namePrefix;
    private final AtomicInteger threadSequence = new AtomicInteger(1);

    FanOutWorkerFactory(Supplier<SessionCache<S>> cacheSupplier) {
        this.cacheSupplier = cacheSupplier;
        this.namePrefix = "fanout-" + POOL_SEQUENCE.getAndIncrement() + "-worker-";
    }

    @Override
    public Thread newThread(Runnable task) {
        Thread worker = new Thread(() -> {
            try {
                task.run();
            } finally {
                caches.remove(Thread.currentThread());
            }
        }, namePrefix + threadSequence.getAndIncrement());
        caches.put(worker, cacheSupplier.get());
        worker.setDaemon(true);
        return worker;
    }

    /**
     * 주어진 worker 스레드가 소유한 캐시.
     *
     * @param thread worker 스레드
     * @return 해당 스레드의 캐시
     * @throws IllegalStateException 이 factory가 만든 스레드가 아니거나 이미 종료된 경우
     */
    SessionCache<S> cacheFor(Thread thread) {
        SessionCache<S> cache = caches.get(thread);
        if (cache == null) {
            throw new IllegalStateException("Account task must run on a fan-out worker thread: " + thread.getName());
        }
        return cache;
    }
}

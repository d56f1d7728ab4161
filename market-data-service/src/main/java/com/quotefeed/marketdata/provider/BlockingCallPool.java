package com.quotefeed.marketdata.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.concurrent.Callable;

/**
 * The single bounded worker pool for synchronous third-party clients.
 *
 * <p>At most {@code threadCap} blocking calls run at once; up to {@code queueCap} more wait.
 * Everything submitted here runs off the scheduling path, so a slow call only ties up one
 * pool thread. Constructed once and shared by every fetcher.
 */
public class BlockingCallPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BlockingCallPool.class);

    private final Scheduler scheduler;
    private final int threadCap;

    public BlockingCallPool(int threadCap, int queueCap) {
        this.threadCap = threadCap;
        this.scheduler = Schedulers.newBoundedElastic(threadCap, queueCap, "provider-blocking");
        log.info("Blocking call pool created. threadCap={} queueCap={}", threadCap, queueCap);
    }

    public <T> Mono<T> submit(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(scheduler);
    }

    public int threadCap() {
        return threadCap;
    }

    @Override
    public void close() {
        scheduler.dispose();
        log.info("Blocking call pool disposed");
    }
}

package com.jreinhal.bastion.config;

import com.jreinhal.bastion.retrieval.Sleeper;
import java.time.Clock;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Worker pool, retry sleeper and clock for calls to the vector and model backends.
 *
 * <p>The pool rejects instead of running work on the caller, so a saturated backend
 * surfaces as a retrieval or generation error rather than a stalled request thread.</p>
 */
@Configuration
public class UpstreamConfig {
    private static final Logger log = LoggerFactory.getLogger(UpstreamConfig.class);

    @Bean(name = {"upstreamExecutor"}, destroyMethod = "shutdown")
    public ThreadPoolExecutor upstreamExecutor(
            @Value("${bastion.upstream.core-threads:8}") int coreThreads,
            @Value("${bastion.upstream.max-threads:32}") int maxThreads,
            @Value("${bastion.upstream.queue-capacity:200}") int queueCapacity) {
        int core = Math.max(1, coreThreads);
        int max = Math.max(core, maxThreads);
        int queue = Math.max(10, queueCapacity);
        ThreadPoolExecutor executor = new ThreadPoolExecutor(core, max, 30L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(queue), new NamedThreadFactory("upstream-"), new MonitoredRejectionHandler("upstream-"));
        executor.allowCoreThreadTimeOut(true);
        log.info("Thread pool 'upstream-' initialized: core={}, max={}, queue={}", core, max, queue);
        return executor;
    }

    @Bean
    public Sleeper retrySleeper() {
        return Sleeper.THREAD;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    static final class MonitoredRejectionHandler implements RejectedExecutionHandler {
        private final String poolName;
        private final AtomicLong rejectionCount = new AtomicLong(0);

        MonitoredRejectionHandler(String poolName) {
            this.poolName = poolName;
        }

        @Override
        public void rejectedExecution(Runnable r, ThreadPoolExecutor executor) {
            long count = this.rejectionCount.incrementAndGet();
            log.warn("Task rejected from pool '{}': queue full. active={}, poolSize={}, queueSize={}, totalRejections={}",
                    this.poolName, executor.getActiveCount(), executor.getPoolSize(), executor.getQueue().size(), count);
            throw new RejectedExecutionException("Thread pool '" + this.poolName + "' overloaded (rejected " + count + " tasks)");
        }
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable);
            thread.setName(this.prefix + this.counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}

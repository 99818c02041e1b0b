package com.jreinhal.bastion.budget;

import com.jreinhal.bastion.exception.DependencyUnavailableException;
import com.jreinhal.bastion.exception.QuotaExceededException;
import com.jreinhal.bastion.util.LogSanitizer;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Daily request budgets per origin and across all origins.
 *
 * <p>Counters are keyed by scope and UTC date, so a new day starts from zero without a
 * reset job. Every check increments before comparing: rejected requests still count.
 */
@Service
public class BudgetLimiter {
    private static final Logger log = LoggerFactory.getLogger(BudgetLimiter.class);
    static final long DAY_SECONDS = 86400L;
    private static final DateTimeFormatter DAY_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;
    private final CounterStore counterStore;
    private final Clock clock;
    @Value("${bastion.budget.ip-daily-limit:200}")
    private long ipDailyLimit = 200L;
    @Value("${bastion.budget.global-daily-limit:2000}")
    private long globalDailyLimit = 2000L;
    @Value("${bastion.budget.fail-open:false}")
    private boolean failOpen;

    public BudgetLimiter(CounterStore counterStore, Clock clock) {
        this.counterStore = counterStore;
        this.clock = clock;
    }

    public void checkOriginDaily(String originId) {
        String origin = originId == null || originId.isBlank() ? "unknown" : originId;
        long current = this.incrementToday("ip:" + origin);
        if (current > this.ipDailyLimit) {
            log.warn("Origin daily limit exceeded: origin={} count={} limit={}", LogSanitizer.sanitize(origin), current, this.ipDailyLimit);
            throw new QuotaExceededException("ip", this.ipDailyLimit,
                    "Günlük istek limitinize ulaştınız (" + this.ipDailyLimit + " istek/gün). Yarın tekrar deneyebilirsiniz.");
        }
    }

    public void checkGlobalDaily() {
        long current = this.incrementToday("global");
        if (current > this.globalDailyLimit) {
            log.error("GLOBAL daily limit exceeded: count={} limit={}", current, this.globalDailyLimit);
            throw new QuotaExceededException("global", this.globalDailyLimit,
                    "Sistem günlük kapasiteye ulaştı. Lütfen yarın tekrar deneyin.");
        }
    }

    public UsageStats usage() {
        try {
            long globalToday = this.counterStore.get(this.todayKey("global")).orElse(0L);
            return new UsageStats(globalToday, this.globalDailyLimit, this.ipDailyLimit);
        } catch (CounterStoreException e) {
            throw new DependencyUnavailableException("counter-store", e);
        }
    }

    private long incrementToday(String scope) {
        String key = this.todayKey(scope);
        try {
            long current = this.counterStore.increment(key);
            if (current == 1L) {
                this.counterStore.expire(key, DAY_SECONDS);
            }
            return current;
        } catch (CounterStoreException e) {
            if (this.failOpen) {
                log.warn("Counter store unavailable, admitting request without budget check: {}", e.getMessage());
                return 0L;
            }
            log.error("Counter store unavailable, rejecting request: {}", e.getMessage());
            throw new DependencyUnavailableException("counter-store", e);
        }
    }

    String todayKey(String scope) {
        String today = LocalDate.now(this.clock.withZone(ZoneOffset.UTC)).format(DAY_FORMAT);
        return "budget:" + scope + ":" + today;
    }
}

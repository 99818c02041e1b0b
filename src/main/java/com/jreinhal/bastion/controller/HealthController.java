package com.jreinhal.bastion.controller;

import com.jreinhal.bastion.budget.BudgetLimiter;
import com.jreinhal.bastion.budget.CounterStore;
import com.jreinhal.bastion.budget.UsageStats;
import com.jreinhal.bastion.cache.ResponseCache;
import com.jreinhal.bastion.dto.HealthResponse;
import com.jreinhal.bastion.dto.UsageResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.time.Clock;
import java.time.Instant;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "System")
public class HealthController {
    private final CounterStore counterStore;
    private final ResponseCache responseCache;
    private final BudgetLimiter budgetLimiter;
    private final Clock clock;
    private final Instant startedAt;
    @Value("${bastion.version:1.0.0}")
    private String version;

    public HealthController(CounterStore counterStore, ResponseCache responseCache, BudgetLimiter budgetLimiter, Clock clock) {
        this.counterStore = counterStore;
        this.responseCache = responseCache;
        this.budgetLimiter = budgetLimiter;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    /**
     * Unhealthy (503) when the counter store is down, since no chat request can be admitted;
     * degraded (200) when only the cache is down.
     */
    @GetMapping("/health")
    @Operation(summary = "Liveness and store connectivity")
    public ResponseEntity<HealthResponse> health() {
        boolean countersUp = this.counterStore.isAvailable();
        boolean cacheUp = this.responseCache.isAvailable();
        String status = !countersUp ? "unhealthy" : (cacheUp ? "healthy" : "degraded");
        double uptime = Math.round((this.clock.millis() - this.startedAt.toEpochMilli()) / 100.0) / 10.0;
        HealthResponse body = new HealthResponse(status, this.version,
                countersUp ? "connected" : "unavailable",
                cacheUp ? "connected" : "unavailable",
                uptime);
        return ResponseEntity.status(countersUp ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    @GetMapping("/usage")
    @Operation(summary = "Today's global request count and configured daily limits")
    public UsageResponse usage() {
        UsageStats stats = this.budgetLimiter.usage();
        return new UsageResponse(stats.globalToday(), stats.globalLimit(), stats.ipLimit());
    }
}

package com.jreinhal.bastion.controller;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jreinhal.bastion.budget.BudgetLimiter;
import com.jreinhal.bastion.budget.CounterStore;
import com.jreinhal.bastion.budget.UsageStats;
import com.jreinhal.bastion.cache.ResponseCache;
import com.jreinhal.bastion.exception.GlobalExceptionHandler;
import java.time.Clock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class HealthControllerTest {
    private CounterStore counterStore;
    private ResponseCache responseCache;
    private BudgetLimiter budgetLimiter;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.counterStore = mock(CounterStore.class);
        this.responseCache = mock(ResponseCache.class);
        this.budgetLimiter = mock(BudgetLimiter.class);
        HealthController controller = new HealthController(this.counterStore, this.responseCache, this.budgetLimiter, Clock.systemUTC());
        ReflectionTestUtils.setField(controller, "version", "1.0.0");
        this.mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void healthyWhenBothStoresAnswer() throws Exception {
        when(this.counterStore.isAvailable()).thenReturn(true);
        when(this.responseCache.isAvailable()).thenReturn(true);

        this.mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.version").value("1.0.0"))
                .andExpect(jsonPath("$.counter_store").value("connected"))
                .andExpect(jsonPath("$.uptime_seconds").isNumber());
    }

    @Test
    void degradedWhenOnlyCacheIsDown() throws Exception {
        when(this.counterStore.isAvailable()).thenReturn(true);
        when(this.responseCache.isAvailable()).thenReturn(false);

        this.mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("degraded"))
                .andExpect(jsonPath("$.cache_store").value("unavailable"));
    }

    @Test
    void unhealthyWhenCountersAreDown() throws Exception {
        when(this.counterStore.isAvailable()).thenReturn(false);
        when(this.responseCache.isAvailable()).thenReturn(true);

        this.mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("unhealthy"));
    }

    @Test
    void usageReportsTodaysCount() throws Exception {
        when(this.budgetLimiter.usage()).thenReturn(new UsageStats(42L, 2000L, 200L));

        this.mockMvc.perform(get("/api/v1/usage"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.global_today").value(42))
                .andExpect(jsonPath("$.global_limit").value(2000))
                .andExpect(jsonPath("$.ip_limit").value(200));
    }
}

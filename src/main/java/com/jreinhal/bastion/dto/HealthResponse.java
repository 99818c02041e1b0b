package com.jreinhal.bastion.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record HealthResponse(
        String status,
        String version,
        @JsonProperty("counter_store") String counterStore,
        @JsonProperty("cache_store") String cacheStore,
        @JsonProperty("uptime_seconds") double uptimeSeconds) {
}

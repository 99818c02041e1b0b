package com.jreinhal.bastion.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record UsageResponse(
        @JsonProperty("global_today") long globalToday,
        @JsonProperty("global_limit") long globalLimit,
        @JsonProperty("ip_limit") long ipLimit) {
}

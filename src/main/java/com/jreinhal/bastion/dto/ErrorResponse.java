package com.jreinhal.bastion.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        String error,
        String message,
        @JsonProperty("request_id") String requestId,
        @JsonProperty("retry_after") Long retryAfter) {
}

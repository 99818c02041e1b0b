package com.jreinhal.bastion.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

public record ChatRequest(
        @NotNull
        @Schema(description = "User question, 2-1000 characters after whitespace normalization", example = "Pepsi ürünleri nelerdir?")
        String query) {
}

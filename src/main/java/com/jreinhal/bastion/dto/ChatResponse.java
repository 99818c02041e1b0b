package com.jreinhal.bastion.dto;

import java.util.List;

public record ChatResponse(String response, List<String> sources, boolean cached) {
}

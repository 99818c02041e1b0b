package com.jreinhal.bastion.service;

import java.util.List;

public record ChatResult(String response, List<String> sources, boolean cached) {
    public ChatResult {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }
}

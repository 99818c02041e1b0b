package com.jreinhal.bastion.cache;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record CacheEntry(
        String response,
        List<String> sources,
        @JsonProperty("written_at") long writtenAt) {

    public CacheEntry {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }
}

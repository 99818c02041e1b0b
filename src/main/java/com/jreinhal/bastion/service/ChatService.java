package com.jreinhal.bastion.service;

import com.jreinhal.bastion.cache.CacheEntry;
import com.jreinhal.bastion.cache.ResponseCache;
import com.jreinhal.bastion.retrieval.RetrievalService;
import com.jreinhal.bastion.retrieval.SearchResult;
import com.jreinhal.bastion.security.InputGuard;
import com.jreinhal.bastion.util.ContextFormatter;
import com.jreinhal.bastion.util.LogSanitizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Cache-augmented retrieval and generation for one admitted query.
 *
 * <p>The cache is read first and written at most once, only on a miss and only after
 * generation succeeded (bulk) or the stream completed normally. Failed, partial and
 * cancelled generations are never cached.
 */
@Service
public class ChatService {
    private static final Logger log = LoggerFactory.getLogger(ChatService.class);
    public static final String REFUSAL = "Bu sorguyu işleyemiyorum. Lütfen farklı bir soru sorun.";
    static final int TOP_K = 3;
    private final InputGuard inputGuard;
    private final ResponseCache responseCache;
    private final RetrievalService retrievalService;
    private final GenerationService generationService;

    public ChatService(InputGuard inputGuard, ResponseCache responseCache, RetrievalService retrievalService, GenerationService generationService) {
        this.inputGuard = inputGuard;
        this.responseCache = responseCache;
        this.retrievalService = retrievalService;
        this.generationService = generationService;
    }

    public ChatResult getResponse(String query) {
        if (this.inputGuard.detectInjection(query)) {
            return new ChatResult(REFUSAL, List.of(), false);
        }
        Optional<CacheEntry> cached = this.responseCache.lookup(query);
        if (cached.isPresent()) {
            log.info("Cache HIT for query: '{}'", LogSanitizer.preview(query));
            return new ChatResult(cached.get().response(), cached.get().sources(), true);
        }
        log.info("Cache MISS for query: '{}'", LogSanitizer.preview(query));
        List<SearchResult> results = this.retrievalService.search(query, TOP_K);
        String context = ContextFormatter.format(results);
        List<String> sources = ContextFormatter.sources(results);
        String response = this.generationService.generate(query, context);
        this.responseCache.store(query, response, sources);
        return new ChatResult(response, sources, false);
    }

    public Flux<String> streamResponse(String query) {
        return Flux.defer(() -> {
            if (this.inputGuard.detectInjection(query)) {
                return Flux.just(REFUSAL);
            }
            Optional<CacheEntry> cached = this.responseCache.lookup(query);
            if (cached.isPresent()) {
                log.info("Stream cache HIT for query: '{}'", LogSanitizer.preview(query));
                return Flux.fromIterable(wordFragments(cached.get().response()));
            }
            log.info("Stream cache MISS for query: '{}'", LogSanitizer.preview(query));
            return Mono.fromCallable(() -> this.retrievalService.search(query, TOP_K))
                    .subscribeOn(Schedulers.boundedElastic())
                    .flatMapMany(results -> this.streamAndCache(query, results));
        });
    }

    private Flux<String> streamAndCache(String query, List<SearchResult> results) {
        String context = ContextFormatter.format(results);
        List<String> sources = ContextFormatter.sources(results);
        StringBuilder buffer = new StringBuilder();
        Mono<String> cacheOnCompletion = Mono.<String>fromRunnable(() -> {
            if (buffer.length() == 0) {
                log.warn("Stream completed without content; not cached: query='{}'", LogSanitizer.preview(query));
                return;
            }
            this.responseCache.store(query, buffer.toString(), sources);
            log.info("Stream response cached: query='{}'", LogSanitizer.preview(query));
        }).subscribeOn(Schedulers.boundedElastic());
        return this.generationService.generateStream(query, context)
                .doOnNext(buffer::append)
                .concatWith(cacheOnCompletion);
    }

    /**
     * Splits on single spaces, keeping each separator on the preceding fragment so the
     * fragments concatenate back to the input exactly.
     */
    static List<String> wordFragments(String answer) {
        List<String> fragments = new ArrayList<>();
        if (answer == null || answer.isEmpty()) {
            return fragments;
        }
        int start = 0;
        int space;
        while ((space = answer.indexOf(' ', start)) >= 0) {
            fragments.add(answer.substring(start, space + 1));
            start = space + 1;
        }
        if (start < answer.length()) {
            fragments.add(answer.substring(start));
        }
        return fragments;
    }
}

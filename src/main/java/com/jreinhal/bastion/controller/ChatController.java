package com.jreinhal.bastion.controller;

import com.jreinhal.bastion.budget.BudgetLimiter;
import com.jreinhal.bastion.dto.ChatRequest;
import com.jreinhal.bastion.dto.ChatResponse;
import com.jreinhal.bastion.exception.ErrorCategory;
import com.jreinhal.bastion.exception.GatewayException;
import com.jreinhal.bastion.exception.InvalidQueryException;
import com.jreinhal.bastion.security.OriginResolver;
import com.jreinhal.bastion.security.InputGuard;
import com.jreinhal.bastion.security.QueryNormalizer;
import com.jreinhal.bastion.service.ChatResult;
import com.jreinhal.bastion.service.ChatService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Chat")
public class ChatController {
    private static final Logger log = LoggerFactory.getLogger(ChatController.class);
    static final String DONE_FRAME = "[DONE]";
    static final String ERROR_FRAME_PREFIX = "[ERROR] Bir hata oluştu: ";
    private final BudgetLimiter budgetLimiter;
    private final InputGuard inputGuard;
    private final ChatService chatService;
    private final OriginResolver originResolver;

    public ChatController(BudgetLimiter budgetLimiter, InputGuard inputGuard, ChatService chatService, OriginResolver originResolver) {
        this.budgetLimiter = budgetLimiter;
        this.inputGuard = inputGuard;
        this.chatService = chatService;
        this.originResolver = originResolver;
    }

    @PostMapping(value = "/chat", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Answer a question in one response")
    public ChatResponse chat(@Valid @RequestBody ChatRequest body, HttpServletRequest request) {
        String query = this.admit(body, request);
        ChatResult result = this.chatService.getResponse(query);
        return new ChatResponse(result.response(), result.sources(), result.cached());
    }

    @PostMapping(value = "/chat/stream", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(summary = "Answer a question as a Server-Sent-Events token stream")
    public ResponseEntity<Flux<ServerSentEvent<String>>> chatStream(@Valid @RequestBody ChatRequest body, HttpServletRequest request) {
        String query = this.admit(body, request);
        Flux<ServerSentEvent<String>> events = this.chatService.streamResponse(query)
                .map(ChatController::frame)
                .onErrorResume(error -> {
                    log.error("Stream error: {}", error.toString());
                    return Flux.just(frame(ERROR_FRAME_PREFIX + errorCode(error)));
                })
                .concatWith(Flux.just(frame(DONE_FRAME)));
        return ResponseEntity.ok()
                .cacheControl(CacheControl.noCache())
                .header("X-Accel-Buffering", "no")
                .contentType(MediaType.TEXT_EVENT_STREAM)
                .body(events);
    }

    /**
     * Shape check, daily budgets, then size limits. A malformed body is rejected before it
     * consumes budget; an oversized one is rejected after.
     */
    private String admit(ChatRequest body, HttpServletRequest request) {
        String query = QueryNormalizer.normalize(body.query());
        if (InputGuard.characterCount(query) < InputGuard.MIN_QUERY_CHARS) {
            throw new InvalidQueryException("Sorgu temizlendikten sonra çok kısa kaldı.");
        }
        this.budgetLimiter.checkOriginDaily(this.originResolver.resolve(request));
        this.budgetLimiter.checkGlobalDaily();
        this.inputGuard.validateSize(query);
        return query;
    }

    // SSE readers drop one space after "data:"; the pad keeps a fragment's own leading space
    static ServerSentEvent<String> frame(String data) {
        return ServerSentEvent.builder(" " + data).build();
    }

    private static String errorCode(Throwable error) {
        if (error instanceof GatewayException gatewayException) {
            return gatewayException.getCategory().getCode();
        }
        return ErrorCategory.UNCLASSIFIED_INTERNAL.getCode();
    }
}

package com.payerdesk.chatbot.controller;

import com.payerdesk.chatbot.model.ChatAccepted;
import com.payerdesk.chatbot.model.ChatRequest;
import com.payerdesk.chatbot.model.PollResult;
import com.payerdesk.chatbot.service.ChatService;
import com.payerdesk.chatbot.service.planner.Plan;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.security.Principal;

@RestController
@RequestMapping("/chat")
public class ChatController {

    static final String ANONYMOUS = "anonymous";

    private final ChatService chatService;

    public ChatController(ChatService chatService) {
        this.chatService = chatService;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Mono<ChatAccepted> submit(@Valid @RequestBody ChatRequest request, ServerWebExchange exchange) {
        return exchange.getPrincipal()
                .map(Principal::getName)
                .defaultIfEmpty(ANONYMOUS)
                .map(userId -> chatService.submit(request, userId));
    }

    @GetMapping(path = "/response/{correlationId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public PollResult poll(@PathVariable String correlationId) {
        return chatService.poll(correlationId);
    }

    @GetMapping(path = "/stream/{correlationId}", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<String>> stream(@PathVariable String correlationId) {
        return chatService.stream(correlationId);
    }

    @GetMapping(path = "/plan/{correlationId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Plan plan(@PathVariable String correlationId) {
        return chatService.plan(correlationId);
    }
}

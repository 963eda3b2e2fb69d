package com.payerdesk.chatbot.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.payerdesk.chatbot.model.ChatAccepted;
import com.payerdesk.chatbot.model.ChatRequest;
import com.payerdesk.chatbot.model.PollResponse;
import com.payerdesk.chatbot.model.PollResult;
import com.payerdesk.chatbot.model.ProgressEvent;
import com.payerdesk.chatbot.model.QueuedRequest;
import com.payerdesk.chatbot.model.ResponsePayload;
import com.payerdesk.chatbot.model.ResponseStatus;
import com.payerdesk.chatbot.service.planner.Plan;
import com.payerdesk.chatbot.service.planner.PlanStore;
import com.payerdesk.chatbot.service.progress.ProgressBatch;
import com.payerdesk.chatbot.service.progress.ProgressStore;
import com.payerdesk.chatbot.service.queue.ChatQueue;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thin acceptor over the queue contract. Submitting only enqueues; the worker produces the payload.
 */
@Service
public class DefaultChatService implements ChatService {

    private static final Logger log = LoggerFactory.getLogger(DefaultChatService.class);

    static final String EVENT_THINKING = "thinking";
    static final String EVENT_MESSAGE = "message";
    static final String EVENT_MESSAGE_RESET = "message_reset";
    static final String EVENT_COMPLETED = "completed";
    static final String EVENT_ERROR = "error";
    static final String TIMEOUT_MESSAGE = "Stream timed out before the answer was ready. Poll the response endpoint for the result.";

    private final ChatQueue chatQueue;
    private final ProgressStore progressStore;
    private final PlanStore planStore;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final Duration pollInterval;
    private final Duration keepalive;
    private final Duration maxDuration;

    public DefaultChatService(ChatQueue chatQueue,
                              ProgressStore progressStore,
                              PlanStore planStore,
                              ObjectMapper objectMapper,
                              MeterRegistry meterRegistry,
                              @Value("${chat.stream.poll-interval:PT0.5S}") Duration pollInterval,
                              @Value("${chat.stream.keepalive:PT15S}") Duration keepalive,
                              @Value("${chat.stream.max-duration:PT300S}") Duration maxDuration) {
        this.chatQueue = chatQueue;
        this.progressStore = progressStore;
        this.planStore = planStore;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
        this.pollInterval = pollInterval;
        this.keepalive = keepalive;
        this.maxDuration = maxDuration;
    }

    @Override
    public ChatAccepted submit(ChatRequest request, String userId) {
        String correlationId = UUID.randomUUID().toString();
        String threadId = request.threadId() == null || request.threadId().isBlank()
                ? UUID.randomUUID().toString()
                : request.threadId().trim();
        chatQueue.publishRequest(new QueuedRequest(correlationId, request.message().trim(), threadId,
                request.sessionId(), userId, System.currentTimeMillis()));
        meterRegistry.counter("chat.queue.published").increment();
        log.info("Accepted request {} on thread {}", correlationId, threadId);
        return new ChatAccepted(correlationId, threadId);
    }

    @Override
    public PollResult poll(String correlationId) {
        Optional<ResponsePayload> response = chatQueue.getResponse(correlationId);
        if (response.isPresent()) {
            return response.get();
        }
        return progressStore.snapshot(correlationId)
                .<PollResult>map(PollResponse::processing)
                .orElseGet(PollResponse::pending);
    }

    /**
     * Emits new progress events every poll interval, a keepalive comment when nothing was sent for a while,
     * and ends with the terminal payload or with an error frame once the lifetime cap passes.
     */
    @Override
    public Flux<ServerSentEvent<String>> stream(String correlationId) {
        return Flux.defer(() -> {
            AtomicLong offset = new AtomicLong();
            AtomicLong lastSentTick = new AtomicLong();
            AtomicBoolean finished = new AtomicBoolean();
            long keepaliveTicks = Math.max(1, keepalive.toMillis() / Math.max(1, pollInterval.toMillis()));

            Flux<Frame> frames = Flux.interval(Duration.ZERO, pollInterval)
                    .concatMapIterable(tick -> drain(correlationId, offset, tick, lastSentTick, keepaliveTicks))
                    .takeUntil(Frame::terminal)
                    .doOnNext(frame -> {
                        if (frame.terminal()) {
                            finished.set(true);
                        }
                    })
                    .takeUntilOther(Mono.delay(maxDuration));

            return frames.map(Frame::event)
                    .concatWith(Mono.defer(() -> finished.get()
                            ? Mono.empty()
                            : Mono.just(errorFrame(correlationId))));
        });
    }

    @Override
    public Plan plan(String correlationId) {
        return planStore.find(correlationId).orElseThrow(() -> new PlanNotFoundException(correlationId));
    }

    private List<Frame> drain(String correlationId, AtomicLong offset, long tick, AtomicLong lastSentTick, long keepaliveTicks) {
        List<Frame> frames = new ArrayList<>();
        ProgressBatch batch = progressStore.eventsSince(correlationId, offset.get());
        for (ProgressEvent event : batch.events()) {
            String name = switch (event.event()) {
                case THINKING -> EVENT_THINKING;
                case MESSAGE -> EVENT_MESSAGE;
                case MESSAGE_RESET -> EVENT_MESSAGE_RESET;
            };
            frames.add(new Frame(ServerSentEvent.builder(write(event.data())).event(name).build(), false));
        }
        offset.set(batch.nextOffset());

        Optional<ResponsePayload> response = chatQueue.getResponse(correlationId);
        if (response.isPresent()) {
            ResponsePayload payload = response.get();
            String name = payload.status() == ResponseStatus.FAILED ? EVENT_ERROR : EVENT_COMPLETED;
            frames.add(new Frame(ServerSentEvent.builder(write(payload)).event(name).id(correlationId).build(), true));
        }

        if (!frames.isEmpty()) {
            lastSentTick.set(tick);
        } else if (tick - lastSentTick.get() >= keepaliveTicks) {
            lastSentTick.set(tick);
            frames.add(new Frame(ServerSentEvent.<String>builder().comment("keepalive").build(), false));
        }
        return frames;
    }

    private ServerSentEvent<String> errorFrame(String correlationId) {
        log.warn("Stream for {} hit the {}s cap", correlationId, maxDuration.toSeconds());
        return ServerSentEvent.builder(write(Map.of("error", TIMEOUT_MESSAGE))).event(EVENT_ERROR).build();
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize stream frame", e);
        }
    }

    private record Frame(ServerSentEvent<String> event, boolean terminal) {
    }
}

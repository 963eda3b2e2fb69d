package com.payerdesk.chatbot.service.pipeline;

import com.payerdesk.chatbot.config.MissingConfigurationException;
import com.payerdesk.chatbot.model.ProgressEvent;
import com.payerdesk.chatbot.model.QueuedRequest;
import com.payerdesk.chatbot.model.ResponsePayload;
import com.payerdesk.chatbot.model.ResponseStatus;
import com.payerdesk.chatbot.model.SourceReference;
import com.payerdesk.chatbot.service.memory.ConversationMessage;
import com.payerdesk.chatbot.service.memory.ConversationStore;
import com.payerdesk.chatbot.service.memory.TurnRecord;
import com.payerdesk.chatbot.service.progress.ProgressStore;
import com.payerdesk.chatbot.service.queue.ChatQueue;
import com.payerdesk.chatbot.service.state.PatientDataFilter;
import com.payerdesk.chatbot.service.state.ThreadState;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.statemachine.StateMachine;
import org.springframework.statemachine.StateMachineEventResult;
import org.springframework.statemachine.config.StateMachineFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Runs one request through the stage machine and publishes exactly one terminal payload for it.
 */
@Service
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    public static final String FAILED_MESSAGE =
            "Something went wrong while answering your question. Please try again.";

    private final StateMachineFactory<PipelineStage, PipelineEvent> stateMachineFactory;
    private final Map<PipelineStage, StageHandler> handlers = new EnumMap<>(PipelineStage.class);
    private final ConversationStore conversationStore;
    private final ProgressStore progressStore;
    private final ChatQueue chatQueue;
    private final MeterRegistry meterRegistry;

    public PipelineOrchestrator(StateMachineFactory<PipelineStage, PipelineEvent> stateMachineFactory,
                                List<StageHandler> handlers,
                                ConversationStore conversationStore,
                                ProgressStore progressStore,
                                ChatQueue chatQueue,
                                MeterRegistry meterRegistry) {
        this.stateMachineFactory = stateMachineFactory;
        for (StageHandler handler : handlers) {
            this.handlers.put(handler.stage(), handler);
        }
        for (PipelineStage stage : PipelineStage.values()) {
            if (stage != PipelineStage.PUBLISH && !this.handlers.containsKey(stage)) {
                throw new MissingConfigurationException("No handler registered for stage " + stage.wireName());
            }
        }
        this.conversationStore = conversationStore;
        this.progressStore = progressStore;
        this.chatQueue = chatQueue;
        this.meterRegistry = meterRegistry;
    }

    public ResponsePayload run(QueuedRequest request) {
        String correlationId = request.correlationId();
        PipelineContext context = new PipelineContext(request,
                line -> onThinking(correlationId, line),
                chunk -> onMessageChunk(correlationId, chunk),
                () -> onMessageReset(correlationId));

        ResponsePayload payload;
        try {
            progressStore.start(correlationId);
            payload = execute(context);
        } catch (RuntimeException ex) {
            log.error("Pipeline failed for {}", correlationId, ex);
            payload = ResponsePayload.failed(correlationId, request.threadId(), FAILED_MESSAGE);
        }

        try {
            persist(context, payload);
            payload = publish(payload);
        } finally {
            clearProgress(correlationId);
        }
        meterRegistry.counter("chat.pipeline.runs", "status", payload.status().wireName()).increment();
        log.info("Published {} response for {}", payload.status().wireName(), correlationId);
        return payload;
    }

    /**
     * Publishes the payload. When that fails, a plain failed payload is published in its place so the
     * poller still sees a terminal answer.
     */
    private ResponsePayload publish(ResponsePayload payload) {
        try {
            chatQueue.publishResponse(payload);
            return payload;
        } catch (RuntimeException ex) {
            log.error("Could not publish {} response for {}", payload.status().wireName(), payload.correlationId(), ex);
            if (payload.status() == ResponseStatus.FAILED) {
                return payload;
            }
        }
        ResponsePayload failed = ResponsePayload.failed(payload.correlationId(), payload.threadId(), FAILED_MESSAGE);
        try {
            chatQueue.publishResponse(failed);
        } catch (RuntimeException ex) {
            log.error("Could not publish failed response for {}: {}", payload.correlationId(), ex.getMessage());
        }
        return failed;
    }

    private void clearProgress(String correlationId) {
        try {
            progressStore.clear(correlationId);
        } catch (RuntimeException ex) {
            log.warn("Could not clear progress for {}: {}", correlationId, ex.getMessage());
        }
    }

    private ResponsePayload execute(PipelineContext context) {
        StateMachine<PipelineStage, PipelineEvent> machine = stateMachineFactory.getStateMachine(context.correlationId());
        machine.startReactively().block();
        try {
            PipelineStage stage = machine.getState().getId();
            while (stage != PipelineStage.PUBLISH) {
                StageHandler handler = handlers.get(stage);
                Supplier<PipelineEvent> work = () -> handler.handle(context);
                PipelineEvent event;
                try {
                    event = meterRegistry.timer("chat.pipeline.stage", "stage", stage.wireName()).record(work);
                } catch (RuntimeException ex) {
                    send(machine, PipelineEvent.FAIL, stage);
                    throw ex;
                }
                send(machine, event, stage);
                stage = machine.getState().getId();
            }
        } finally {
            machine.stopReactively().block();
        }
        if (context.payload() == null) {
            throw new IllegalStateException("Pipeline reached publish without a payload");
        }
        return context.payload();
    }

    private void send(StateMachine<PipelineStage, PipelineEvent> machine, PipelineEvent event, PipelineStage stage) {
        StateMachineEventResult<PipelineStage, PipelineEvent> result = machine
                .sendEvent(Mono.just(MessageBuilder.withPayload(event).build()))
                .blockLast();
        if (result == null || result.getResultType() != StateMachineEventResult.ResultType.ACCEPTED) {
            throw new IllegalStateException("Event " + event + " not accepted in stage " + stage.wireName());
        }
    }

    private void persist(PipelineContext context, ResponsePayload payload) {
        String threadId = context.threadId();
        try {
            if (payload.status() != ResponseStatus.FAILED) {
                ThreadState state = context.state();
                ThreadState withQuery = new ThreadState(state.active(), state.openSlots(), state.recentEntities(),
                        state.lastUserIntent(), PatientDataFilter.scrub(context.refinedQuery()), state.safety());
                conversationStore.saveState(threadId, withQuery);
            }
            conversationStore.saveTurn(new TurnRecord(threadId, context.correlationId(), context.message(),
                    payload.message(), sourceDocumentIds(payload)));
            conversationStore.appendMessages(threadId, context.correlationId(), List.of(
                    ConversationMessage.user(context.message()),
                    ConversationMessage.assistant(payload.message())));
        } catch (RuntimeException ex) {
            log.warn("Could not persist turn {} on thread {}: {}", context.correlationId(), threadId, ex.getMessage());
        }
    }

    private static List<String> sourceDocumentIds(ResponsePayload payload) {
        if (payload.sources() == null) {
            return List.of();
        }
        return payload.sources().stream()
                .map(SourceReference::documentId)
                .filter(id -> id != null && !id.isBlank())
                .distinct()
                .toList();
    }

    private void onThinking(String correlationId, String line) {
        if (line == null || line.isBlank()) {
            return;
        }
        progressStore.appendThinking(correlationId, line);
        conversationStore.appendProgressEvent(correlationId, ProgressEvent.thinking(line));
    }

    private void onMessageReset(String correlationId) {
        progressStore.resetMessage(correlationId);
        conversationStore.appendProgressEvent(correlationId, ProgressEvent.messageReset());
    }

    private void onMessageChunk(String correlationId, String chunk) {
        if (chunk == null || chunk.isEmpty()) {
            return;
        }
        progressStore.appendMessageChunk(correlationId, chunk);
        conversationStore.appendProgressEvent(correlationId, ProgressEvent.message(chunk));
    }
}

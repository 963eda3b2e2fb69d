package com.payerdesk.chatbot.service.queue;

import com.payerdesk.chatbot.model.QueuedRequest;
import com.payerdesk.chatbot.service.pipeline.PipelineOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Single sequential consumer: pops one request, runs it to a terminal payload, then pops again.
 * Failed runs are not retried.
 */
@Component
public class QueueWorker implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(QueueWorker.class);

    static final String MDC_CORRELATION_ID = "correlationId";
    private static final Duration BACKOFF = Duration.ofSeconds(1);

    private final ChatQueue chatQueue;
    private final PipelineOrchestrator orchestrator;
    private final boolean enabled;
    private final Duration pollTimeout;

    private volatile boolean running;
    private Thread thread;

    public QueueWorker(ChatQueue chatQueue,
                       PipelineOrchestrator orchestrator,
                       @Value("${chat.worker.enabled:true}") boolean enabled,
                       @Value("${chat.worker.poll-timeout:PT5S}") Duration pollTimeout) {
        this.chatQueue = chatQueue;
        this.orchestrator = orchestrator;
        this.enabled = enabled;
        this.pollTimeout = pollTimeout;
    }

    @Override
    public synchronized void start() {
        if (!enabled || running) {
            return;
        }
        running = true;
        thread = new Thread(this::consumeLoop, "chat-queue-worker");
        thread.setDaemon(true);
        thread.start();
        log.info("Queue worker started");
    }

    @Override
    public synchronized void stop() {
        running = false;
        if (thread != null) {
            thread.interrupt();
            thread = null;
        }
        log.info("Queue worker stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return enabled;
    }

    void consumeLoop() {
        while (running) {
            Optional<QueuedRequest> next;
            try {
                next = chatQueue.pollRequest(pollTimeout);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                log.debug("Queue worker interrupted while waiting");
                return;
            } catch (RuntimeException ex) {
                log.warn("Queue poll failed: {}", ex.getMessage());
                if (!backOff()) {
                    return;
                }
                continue;
            }
            next.ifPresent(this::process);
        }
    }

    private boolean backOff() {
        try {
            Thread.sleep(BACKOFF.toMillis());
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.debug("Queue worker interrupted during back-off");
            return false;
        }
    }

    /**
     * Runs one request. Anything that escapes the orchestrator is logged and the loop moves on.
     */
    void process(QueuedRequest request) {
        MDC.put(MDC_CORRELATION_ID, request.correlationId());
        try {
            orchestrator.run(request);
        } catch (RuntimeException ex) {
            log.error("Worker failed to process {}", request.correlationId(), ex);
        } finally {
            MDC.remove(MDC_CORRELATION_ID);
        }
    }
}

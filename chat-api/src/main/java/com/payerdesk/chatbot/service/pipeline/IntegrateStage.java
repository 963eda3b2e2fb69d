package com.payerdesk.chatbot.service.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.payerdesk.chatbot.model.ResponsePayload;
import com.payerdesk.chatbot.model.ResponseStatus;
import com.payerdesk.chatbot.model.SourceReference;
import com.payerdesk.chatbot.model.TokenTotals;
import com.payerdesk.chatbot.model.UsageBreakdownEntry;
import com.payerdesk.chatbot.service.agents.AgentAnswer;
import com.payerdesk.chatbot.service.orchestration.CostModel;
import com.payerdesk.chatbot.service.orchestration.LlmUsage;
import com.payerdesk.chatbot.service.retrieval.RetrievalSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the completed payload: merged message, re-indexed sources, confidence badge and cost rollup.
 */
@Component
public class IntegrateStage implements StageHandler {

    private static final Logger log = LoggerFactory.getLogger(IntegrateStage.class);

    static final String STAGE_PLAN = "plan";
    static final String STAGE_RAG = "rag";
    static final String STAGE_INTEGRATOR = "integrator";

    private static final int SOURCE_TEXT_LIMIT = 200;

    private final IntegrationService integrationService;
    private final CostModel costModel;
    private final ObjectMapper objectMapper;

    public IntegrateStage(IntegrationService integrationService, CostModel costModel, ObjectMapper objectMapper) {
        this.integrationService = integrationService;
        this.costModel = costModel;
        this.objectMapper = objectMapper;
    }

    @Override
    public PipelineStage stage() {
        return PipelineStage.INTEGRATE;
    }

    @Override
    public PipelineEvent handle(PipelineContext context) {
        List<AgentAnswer> answers = context.answers();
        context.thinking().accept(answers.size() > 1 ? "Putting the parts together..." : "Wrapping up...");
        IntegratedMessage integrated = integrationService.integrate(context.plan(), answers, context.contextPack(),
                context.messageSink(), context.messageReset());

        List<SourceReference> sources = reindex(answers);
        Set<RetrievalSignal> signals = signals(answers);
        ConfidenceBadge badge = ConfidenceBadge.of(signals, sources);

        String message = integrated.text();
        List<Integer> cited = List.of();
        JsonNode structured = readStructured(message);
        if (structured != null) {
            message = structured.path("message").asText(message);
            cited = citedIndices(structured.path("cited_source_indices"), sources.size());
            ConfidenceBadge override = badgeOverride(structured.get("source_confidence_override"), badge);
            if (override != badge) {
                log.info("Integrator overrode source confidence {} with {} for {}", badge.wireName(),
                        override.wireName(), context.correlationId());
                badge = override;
            }
        }

        List<UsageBreakdownEntry> breakdown = breakdown(context, answers, integrated.usage());
        int inputTokens = breakdown.stream().mapToInt(UsageBreakdownEntry::inputTokens).sum();
        int outputTokens = breakdown.stream().mapToInt(UsageBreakdownEntry::outputTokens).sum();
        double cost = breakdown.stream().mapToDouble(UsageBreakdownEntry::cost).sum();
        String modelUsed = breakdown.isEmpty() ? null : breakdown.get(0).model();

        context.setPayload(new ResponsePayload(context.correlationId(), ResponseStatus.COMPLETED, message, sources,
                cost, context.threadId(), cited, null, null, null, badge.wireName(),
                signals.stream().map(RetrievalSignal::wireName).toList(),
                new TokenTotals(inputTokens, outputTokens), breakdown, modelUsed, context.refinedQuery()));
        return PipelineEvent.ADVANCE;
    }

    static List<SourceReference> reindex(List<AgentAnswer> answers) {
        List<SourceReference> sources = new ArrayList<>();
        for (AgentAnswer answer : answers) {
            for (SourceReference source : answer.sources()) {
                String text = source.text();
                if (text != null && text.length() > SOURCE_TEXT_LIMIT) {
                    text = text.substring(0, SOURCE_TEXT_LIMIT);
                }
                sources.add(source.withIndex(sources.size() + 1).withText(text));
            }
        }
        return List.copyOf(sources);
    }

    /**
     * Every answer reports its signal, so a part that searched nothing keeps the badge at no sources.
     */
    static Set<RetrievalSignal> signals(List<AgentAnswer> answers) {
        Set<RetrievalSignal> signals = new LinkedHashSet<>();
        for (AgentAnswer answer : answers) {
            signals.add(answer.signal() == null ? RetrievalSignal.NO_SOURCES : answer.signal());
        }
        return signals;
    }

    /**
     * The integrator may replace the computed badge with any known one; unknown values are ignored.
     */
    static ConfidenceBadge badgeOverride(JsonNode node, ConfidenceBadge computed) {
        if (node == null || !node.isTextual()) {
            return computed;
        }
        return ConfidenceBadge.fromWireName(node.asText().trim()).orElse(computed);
    }

    static List<Integer> citedIndices(JsonNode node, int sourceCount) {
        if (!node.isArray()) {
            return List.of();
        }
        Set<Integer> indices = new LinkedHashSet<>();
        for (JsonNode item : node) {
            if (item.canConvertToInt()) {
                int index = item.asInt();
                if (index >= 1 && index <= sourceCount) {
                    indices.add(index);
                }
            }
        }
        return List.copyOf(indices);
    }

    private JsonNode readStructured(String message) {
        if (message == null || !message.trim().startsWith("{")) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(message);
            return node.isObject() && node.has("message") ? node : null;
        } catch (JsonProcessingException ex) {
            log.debug("Final message is not structured JSON: {}", ex.getOriginalMessage());
            return null;
        }
    }

    private List<UsageBreakdownEntry> breakdown(PipelineContext context, List<AgentAnswer> answers, LlmUsage integratorUsage) {
        List<UsageBreakdownEntry> entries = new ArrayList<>();
        if (context.plan() != null && context.plan().llmUsage() != null) {
            entries.add(entry(STAGE_PLAN, context.plan().llmUsage()));
        }
        for (AgentAnswer answer : answers) {
            if (answer.usage() != null) {
                entries.add(entry(STAGE_RAG, answer.usage()));
            }
        }
        if (integratorUsage != null) {
            entries.add(entry(STAGE_INTEGRATOR, integratorUsage));
        }
        return entries;
    }

    private UsageBreakdownEntry entry(String stage, LlmUsage usage) {
        return new UsageBreakdownEntry(stage, usage.provider(), usage.model(), usage.inputTokens(),
                usage.outputTokens(), costModel.cost(usage));
    }
}

package com.payerdesk.chatbot.service.pipeline;

import com.payerdesk.chatbot.model.QueuedRequest;
import com.payerdesk.chatbot.model.ResponsePayload;
import com.payerdesk.chatbot.service.agents.AgentAnswer;
import com.payerdesk.chatbot.service.memory.TurnRecord;
import com.payerdesk.chatbot.service.planner.BlueprintEntry;
import com.payerdesk.chatbot.service.planner.Plan;
import com.payerdesk.chatbot.service.retrieval.SearchFilters;
import com.payerdesk.chatbot.service.state.ContextRoute;
import com.payerdesk.chatbot.service.state.Jurisdiction;
import com.payerdesk.chatbot.service.state.MessageClassification;
import com.payerdesk.chatbot.service.state.ThreadState;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Mutable working set of one pipeline run. Owned by a single worker thread.
 */
public class PipelineContext {

    private final QueuedRequest request;
    private final Consumer<String> thinking;
    private final Consumer<String> messageSink;
    private final Runnable messageReset;

    private ThreadState state = ThreadState.empty();
    private List<TurnRecord> lastTurns = List.of();
    private MessageClassification classification = MessageClassification.NEW_QUESTION;
    private String priorRefinedQuery;
    private ContextRoute route = ContextRoute.LIGHT;
    private String contextPack = "";
    private Jurisdiction jurisdiction = Jurisdiction.empty();
    private SearchFilters filters = SearchFilters.none();
    private Plan plan;
    private List<BlueprintEntry> blueprint = List.of();
    private String refinedQuery;
    private final List<AgentAnswer> answers = new ArrayList<>();
    private ResponsePayload payload;

    public PipelineContext(QueuedRequest request, Consumer<String> thinking, Consumer<String> messageSink) {
        this(request, thinking, messageSink, () -> { });
    }

    public PipelineContext(QueuedRequest request,
                           Consumer<String> thinking,
                           Consumer<String> messageSink,
                           Runnable messageReset) {
        this.request = request;
        this.thinking = thinking;
        this.messageSink = messageSink;
        this.messageReset = messageReset;
    }

    public QueuedRequest request() {
        return request;
    }

    public String correlationId() {
        return request.correlationId();
    }

    public String threadId() {
        return request.threadId();
    }

    public String message() {
        return request.message() == null ? "" : request.message().trim();
    }

    public Consumer<String> thinking() {
        return thinking;
    }

    public Consumer<String> messageSink() {
        return messageSink;
    }

    /**
     * Discards the message streamed so far, before a replacement is pushed.
     */
    public Runnable messageReset() {
        return messageReset;
    }

    public ThreadState state() {
        return state;
    }

    public void setState(ThreadState state) {
        this.state = state;
    }

    public List<TurnRecord> lastTurns() {
        return lastTurns;
    }

    public void setLastTurns(List<TurnRecord> lastTurns) {
        this.lastTurns = List.copyOf(lastTurns);
    }

    /**
     * Document ids cited by the recent turns, newest turn first, without duplicates.
     */
    public List<String> lastTurnDocumentIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (TurnRecord turn : lastTurns) {
            for (String id : turn.sourceDocumentIds()) {
                if (id != null && !id.isBlank()) {
                    ids.add(id);
                }
            }
        }
        return List.copyOf(ids);
    }

    public MessageClassification classification() {
        return classification;
    }

    public void setClassification(MessageClassification classification) {
        this.classification = classification;
    }

    public String priorRefinedQuery() {
        return priorRefinedQuery;
    }

    public void setPriorRefinedQuery(String priorRefinedQuery) {
        this.priorRefinedQuery = priorRefinedQuery;
    }

    public ContextRoute route() {
        return route;
    }

    public void setRoute(ContextRoute route) {
        this.route = route;
    }

    public String contextPack() {
        return contextPack;
    }

    public void setContextPack(String contextPack) {
        this.contextPack = contextPack == null ? "" : contextPack;
    }

    public Jurisdiction jurisdiction() {
        return jurisdiction;
    }

    public void setJurisdiction(Jurisdiction jurisdiction) {
        this.jurisdiction = jurisdiction;
    }

    public SearchFilters filters() {
        return filters;
    }

    public void setFilters(SearchFilters filters) {
        this.filters = filters;
    }

    public Plan plan() {
        return plan;
    }

    public void setPlan(Plan plan) {
        this.plan = plan;
    }

    public List<BlueprintEntry> blueprint() {
        return blueprint;
    }

    public void setBlueprint(List<BlueprintEntry> blueprint) {
        this.blueprint = List.copyOf(blueprint);
    }

    public String refinedQuery() {
        return refinedQuery;
    }

    public void setRefinedQuery(String refinedQuery) {
        this.refinedQuery = refinedQuery;
    }

    public List<AgentAnswer> answers() {
        return List.copyOf(answers);
    }

    public void addAnswer(AgentAnswer answer) {
        answers.add(answer);
    }

    public ResponsePayload payload() {
        return payload;
    }

    public void setPayload(ResponsePayload payload) {
        this.payload = payload;
    }
}

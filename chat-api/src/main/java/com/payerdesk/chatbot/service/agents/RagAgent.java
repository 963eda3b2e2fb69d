package com.payerdesk.chatbot.service.agents;

import com.payerdesk.chatbot.model.SourceReference;
import com.payerdesk.chatbot.service.orchestration.LlmClient;
import com.payerdesk.chatbot.service.orchestration.LlmException;
import com.payerdesk.chatbot.service.orchestration.LlmPrompt;
import com.payerdesk.chatbot.service.orchestration.LlmResult;
import com.payerdesk.chatbot.service.orchestration.LlmUsage;
import com.payerdesk.chatbot.service.planner.AgentType;
import com.payerdesk.chatbot.service.planner.SubQuestion;
import com.payerdesk.chatbot.service.retrieval.AssembledDocuments;
import com.payerdesk.chatbot.service.retrieval.BlendedRetrievalService;
import com.payerdesk.chatbot.service.retrieval.DocumentAssembler;
import com.payerdesk.chatbot.service.retrieval.RetrievalBlend;
import com.payerdesk.chatbot.service.retrieval.RetrievalCalibration;
import com.payerdesk.chatbot.service.retrieval.RetrievalChunk;
import com.payerdesk.chatbot.service.retrieval.RetrievalSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Corpus path: blended retrieval, confidence assembly with external fallback, then an LLM answer over the context.
 */
@Component
public class RagAgent implements AnsweringAgent {

    private static final Logger log = LoggerFactory.getLogger(RagAgent.class);

    static final String NO_CONTEXT = "(No retrieved context.)";
    static final String LLM_FAILURE_TEXT = "I couldn't put together an answer for this part right now.";

    private static final int SOURCE_TEXT_LIMIT = 300;
    private static final int CITATION_PREVIEW = 120;

    private static final String SYSTEM_PROMPT = """
            You answer questions about health plan policies using only the numbered context passages.
            Cite passages by their number, e.g. [1]. Each passage carries guidance on how much to trust it.
            If the context does not answer the question, say so plainly. Do not use patient-specific details.""";

    private final RetrievalCalibration calibration;
    private final BlendedRetrievalService retrievalService;
    private final DocumentAssembler documentAssembler;
    private final LlmClient llmClient;

    public RagAgent(RetrievalCalibration calibration,
                    BlendedRetrievalService retrievalService,
                    DocumentAssembler documentAssembler,
                    LlmClient llmClient) {
        this.calibration = calibration;
        this.retrievalService = retrievalService;
        this.documentAssembler = documentAssembler;
        this.llmClient = llmClient;
    }

    @Override
    public AgentType type() {
        return AgentType.RAG;
    }

    @Override
    public AgentAnswer answer(AgentTask task) {
        SubQuestion subQuestion = task.subQuestion();
        String question = task.questionText();
        RetrievalBlend blend = calibration.blend(subQuestion.intentScore());

        List<RetrievalChunk> chunks = retrievalService.retrieve(question, blend, task.filters(), task.thinking());
        boolean externalOnEmpty = task.entry() != null
                && task.entry().onRagFail().contains(SubQuestion.ON_RAG_FAIL_EXTERNAL_SEARCH);
        AssembledDocuments documents = documentAssembler.assemble(chunks, question, externalOnEmpty, task.thinking());

        List<String> contextLines = new ArrayList<>();
        List<SourceReference> sources = new ArrayList<>();
        for (RetrievalChunk chunk : documents.chunks()) {
            if (chunk.text() == null || chunk.text().isBlank()) {
                continue;
            }
            int index = sources.size() + 1;
            contextLines.add("[" + index + "] " + chunk.text());
            sources.add(toSource(index, chunk));
        }

        task.thinking().accept("Reading what I found and writing an answer...");
        String answer;
        LlmUsage usage = null;
        try {
            LlmResult result = llmClient.generate(LlmPrompt.of(SYSTEM_PROMPT, userPrompt(task, contextLines, sources, question)));
            answer = result.text() == null ? "" : result.text().trim();
            usage = result.usage();
            task.thinking().accept("Done with this part.");
        } catch (LlmException ex) {
            log.warn("RAG answer generation failed for {}: {}", subQuestion.id(), ex.getMessage());
            answer = LLM_FAILURE_TEXT;
            task.thinking().accept("I couldn't answer this part.");
        }

        RetrievalSignal signal = documents.signal();
        if (!documents.chunks().isEmpty() && signal == RetrievalSignal.NO_SOURCES) {
            signal = RetrievalSignal.CORPUS_ONLY;
        }
        return new AgentAnswer(subQuestion.id(), withSourcesSection(answer, sources), usage, sources, signal);
    }

    static SourceReference toSource(int index, RetrievalChunk chunk) {
        String text = chunk.text().length() > SOURCE_TEXT_LIMIT
                ? chunk.text().substring(0, SOURCE_TEXT_LIMIT) + "..."
                : chunk.text();
        String name = chunk.documentName() != null ? chunk.documentName()
                : chunk.documentId() != null ? chunk.documentId() : "document";
        return new SourceReference(index, chunk.documentId(), name, chunk.pageNumber(),
                chunk.sourceType() == null ? "chunk" : chunk.sourceType(), chunk.score(),
                chunk.confidenceLabel() == null ? null : chunk.confidenceLabel().wireName(), chunk.llmGuidance(), text);
    }

    static String withSourcesSection(String answer, List<SourceReference> sources) {
        if (sources.isEmpty()) {
            return answer;
        }
        StringBuilder message = new StringBuilder(answer).append("\n\nSources:");
        for (SourceReference source : sources) {
            message.append("\n  [").append(source.index()).append("] ").append(source.documentName());
            if (source.pageNumber() != null) {
                message.append(" (page ").append(source.pageNumber()).append(')');
            }
            String text = source.text() == null ? "" : source.text();
            message.append(" - ").append(text, 0, Math.min(CITATION_PREVIEW, text.length())).append("...");
        }
        return message.toString();
    }

    private static String userPrompt(AgentTask task,
                                     List<String> contextLines,
                                     List<SourceReference> sources,
                                     String question) {
        StringBuilder prompt = new StringBuilder();
        if (task.contextPack() != null && !task.contextPack().isBlank()) {
            prompt.append(task.contextPack().trim()).append("\n\n");
        }
        prompt.append("Context:\n");
        if (contextLines.isEmpty()) {
            prompt.append(NO_CONTEXT);
        } else {
            for (int i = 0; i < contextLines.size(); i++) {
                prompt.append(contextLines.get(i));
                String guidance = sources.get(i).llmGuidance();
                if (guidance != null) {
                    prompt.append("\n(guidance: ").append(guidance).append(')');
                }
                prompt.append("\n\n");
            }
        }
        prompt.append("\nQuestion: ").append(question);
        return prompt.toString();
    }
}

package com.payerdesk.chatbot.service.retrieval;

import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class ConfidenceAssigner {

    private final double abstainMax;
    private final double confidentMin;

    public ConfidenceAssigner(RetrievalProperties properties) {
        this(properties.getAbstainMax(), properties.getConfidentMin());
    }

    ConfidenceAssigner(double abstainMax, double confidentMin) {
        this.abstainMax = abstainMax;
        this.confidentMin = confidentMin;
    }

    public ConfidenceLabel labelFor(double score) {
        if (score < abstainMax) {
            return ConfidenceLabel.ABSTAIN;
        }
        if (score >= confidentMin) {
            return ConfidenceLabel.PROCESS_CONFIDENT;
        }
        return ConfidenceLabel.PROCESS_WITH_CAUTION;
    }

    /**
     * Labels a corpus chunk from its score. External chunks keep the label they were created with.
     */
    public RetrievalChunk assign(RetrievalChunk chunk) {
        if (chunk.isExternal() && chunk.confidenceLabel() != null) {
            return chunk;
        }
        ConfidenceLabel label = labelFor(chunk.scoreOrZero());
        return chunk.withConfidence(label, label.guidance());
    }

    public List<RetrievalChunk> assignAll(List<RetrievalChunk> chunks) {
        return chunks.stream().map(this::assign).toList();
    }
}

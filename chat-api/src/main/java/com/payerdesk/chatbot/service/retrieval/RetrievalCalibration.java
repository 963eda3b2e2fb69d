package com.payerdesk.chatbot.service.retrieval;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Maps an intent score to the hierarchical/factual retrieval mix. Low scores favour process-level passages.
 * Counts round half to even, so a score of 0.5 yields 2 hierarchical and 5 factual passages.
 */
@Component
@EnableConfigurationProperties(RetrievalProperties.class)
public class RetrievalCalibration {

    private final RetrievalProperties properties;

    public RetrievalCalibration(RetrievalProperties properties) {
        this.properties = properties;
    }

    public RetrievalBlend blend(double intentScore) {
        double score = clamp(intentScore, 0.0, 1.0);
        int max = properties.getMaxPerPath();
        int hierarchical = (int) clamp(Math.rint(properties.getHierarchicalScale() * (1 - score)), 0, max);
        int factual = (int) clamp(Math.rint(properties.getFactualScale() * score), 0, max);
        double confidenceMin = clamp(twoDecimals(properties.getConfidenceBase() + properties.getConfidenceSlope() * score),
                0.0, 1.0);
        return new RetrievalBlend(hierarchical, factual, confidenceMin);
    }

    private static double twoDecimals(double value) {
        return new BigDecimal(value).setScale(2, RoundingMode.HALF_EVEN).doubleValue();
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}

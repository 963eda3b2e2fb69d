package com.payerdesk.chatbot.service.retrieval;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Blend constants, confidence thresholds and assembly switches for corpus retrieval.
 * The numbers are tuned by hand; only their monotonic relation to the intent score matters.
 */
@ConfigurationProperties(prefix = "chat.retrieval")
public class RetrievalProperties {

    private double hierarchicalScale = 5;
    private double factualScale = 10;
    private int maxPerPath = 10;
    private double confidenceBase = 0.5;
    private double confidenceSlope = 0.3;

    private double abstainMax = 0.5;
    private double confidentMin = 0.85;
    private double fallbackLowMatchMin = 0.5;

    private int defaultTopK = 10;
    private int supersetFactor = 2;
    private boolean typeFilterSupported = true;

    private int externalMaxResults = 5;
    private boolean neighborExpansionEnabled = false;
    private int neighborWindow = 2;

    public double getHierarchicalScale() {
        return hierarchicalScale;
    }

    public void setHierarchicalScale(double hierarchicalScale) {
        this.hierarchicalScale = hierarchicalScale;
    }

    public double getFactualScale() {
        return factualScale;
    }

    public void setFactualScale(double factualScale) {
        this.factualScale = factualScale;
    }

    public int getMaxPerPath() {
        return maxPerPath;
    }

    public void setMaxPerPath(int maxPerPath) {
        this.maxPerPath = maxPerPath;
    }

    public double getConfidenceBase() {
        return confidenceBase;
    }

    public void setConfidenceBase(double confidenceBase) {
        this.confidenceBase = confidenceBase;
    }

    public double getConfidenceSlope() {
        return confidenceSlope;
    }

    public void setConfidenceSlope(double confidenceSlope) {
        this.confidenceSlope = confidenceSlope;
    }

    public double getAbstainMax() {
        return abstainMax;
    }

    public void setAbstainMax(double abstainMax) {
        this.abstainMax = abstainMax;
    }

    public double getConfidentMin() {
        return confidentMin;
    }

    public void setConfidentMin(double confidentMin) {
        this.confidentMin = confidentMin;
    }

    public double getFallbackLowMatchMin() {
        return fallbackLowMatchMin;
    }

    public void setFallbackLowMatchMin(double fallbackLowMatchMin) {
        this.fallbackLowMatchMin = fallbackLowMatchMin;
    }

    public int getDefaultTopK() {
        return defaultTopK;
    }

    public void setDefaultTopK(int defaultTopK) {
        this.defaultTopK = defaultTopK;
    }

    public int getSupersetFactor() {
        return supersetFactor;
    }

    public void setSupersetFactor(int supersetFactor) {
        this.supersetFactor = supersetFactor;
    }

    public boolean isTypeFilterSupported() {
        return typeFilterSupported;
    }

    public void setTypeFilterSupported(boolean typeFilterSupported) {
        this.typeFilterSupported = typeFilterSupported;
    }

    public int getExternalMaxResults() {
        return externalMaxResults;
    }

    public void setExternalMaxResults(int externalMaxResults) {
        this.externalMaxResults = externalMaxResults;
    }

    public boolean isNeighborExpansionEnabled() {
        return neighborExpansionEnabled;
    }

    public void setNeighborExpansionEnabled(boolean neighborExpansionEnabled) {
        this.neighborExpansionEnabled = neighborExpansionEnabled;
    }

    public int getNeighborWindow() {
        return neighborWindow;
    }

    public void setNeighborWindow(int neighborWindow) {
        this.neighborWindow = neighborWindow;
    }
}

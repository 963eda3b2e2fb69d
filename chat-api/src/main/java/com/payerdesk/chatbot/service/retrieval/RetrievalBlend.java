package com.payerdesk.chatbot.service.retrieval;

public record RetrievalBlend(int nHierarchical, int nFactual, double confidenceMin) {

    public int total() {
        return nHierarchical + nFactual;
    }
}

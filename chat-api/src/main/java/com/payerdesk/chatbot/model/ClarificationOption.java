package com.payerdesk.chatbot.model;

import java.util.List;

public record ClarificationOption(String slot, String label, List<String> examples) {
}

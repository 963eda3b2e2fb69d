package com.payerdesk.chatbot.service.skills;

import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;

@Component
public class SkillAuditService {

    private static final Logger log = LoggerFactory.getLogger(SkillAuditService.class);

    private final MeterRegistry meterRegistry;

    public SkillAuditService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void record(String skill, String target, boolean success, int resultCount) {
        meterRegistry.counter("chat.skill.invocations", "skill", skill, "outcome", success ? "success" : "failure")
                .increment();
        log.info("SKILL_AUDIT skill={} success={} results={} target={} timestamp={}",
                skill, success, resultCount, abbreviate(target), OffsetDateTime.now());
    }

    public void skipped(String skill, String reason) {
        meterRegistry.counter("chat.skill.invocations", "skill", skill, "outcome", "skipped").increment();
        log.warn("SKILL_SKIPPED skill={} reason={}", skill, reason);
    }

    private static String abbreviate(String value) {
        if (value == null) {
            return "";
        }
        return value.length() > 80 ? value.substring(0, 80) + "..." : value;
    }
}

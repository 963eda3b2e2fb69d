package com.payerdesk.chatbot.service.state;

import java.util.List;

public record ActiveContext(String payer,
                            List<String> payers,
                            String domain,
                            String jurisdiction,
                            String program,
                            String userRole,
                            Jurisdiction jurisdictionObj) {

    public ActiveContext {
        payers = payers == null ? List.of() : List.copyOf(payers);
    }

    public static ActiveContext empty() {
        return new ActiveContext(null, List.of(), null, null, null, null, null);
    }

    @SuppressWarnings("unchecked")
    ActiveContext with(ActiveField field, Object value) {
        return switch (field) {
            case PAYER -> new ActiveContext((String) value, payers, domain, jurisdiction, program, userRole, jurisdictionObj);
            case PAYERS -> new ActiveContext(payer, (List<String>) value, domain, jurisdiction, program, userRole, jurisdictionObj);
            case DOMAIN -> new ActiveContext(payer, payers, (String) value, jurisdiction, program, userRole, jurisdictionObj);
            case JURISDICTION -> new ActiveContext(payer, payers, domain, (String) value, program, userRole, jurisdictionObj);
            case PROGRAM -> new ActiveContext(payer, payers, domain, jurisdiction, (String) value, userRole, jurisdictionObj);
            case USER_ROLE -> new ActiveContext(payer, payers, domain, jurisdiction, program, (String) value, jurisdictionObj);
            case JURISDICTION_OBJ -> new ActiveContext(payer, payers, domain, jurisdiction, program, userRole, (Jurisdiction) value);
        };
    }

    /**
     * Resolves the effective jurisdiction: the structured object first, overridden by the flat fields.
     */
    public Jurisdiction resolveJurisdiction() {
        Jurisdiction base = jurisdictionObj == null ? Jurisdiction.empty() : jurisdictionObj;
        String payor = base.payor();
        if (payer != null && !payer.isBlank()) {
            payor = payer.trim();
        }
        if (payers.size() > 1) {
            payor = String.join(", ", payers);
        }
        String resolvedProgram = program != null && !program.isBlank() ? program.trim() : base.program();
        String state = jurisdiction != null && !jurisdiction.isBlank() ? jurisdiction.trim() : base.state();
        String perspective = base.perspective();
        if ("provider_office".equals(userRole) || "patient".equals(userRole)) {
            perspective = userRole;
        }
        return new Jurisdiction(state, payor, resolvedProgram, perspective, base.regulatoryAgency());
    }
}

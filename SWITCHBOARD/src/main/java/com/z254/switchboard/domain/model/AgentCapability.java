package com.z254.switchboard.domain.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of capability tags an agent can advertise.
 * Routing matches a requested capability against an agent's capability set.
 */
public enum AgentCapability {

    // Ticketing
    TICKET_PURCHASE("ticket_purchase"),
    TICKET_UPGRADE("ticket_upgrade"),
    TICKET_REFUND("ticket_refund"),
    TICKET_INQUIRY("ticket_inquiry"),

    // Sales
    SALES_PROPOSAL("sales_proposal"),
    CRM_MANAGEMENT("crm_management"),
    PIPELINE_TRACKING("pipeline_tracking"),
    LEAD_QUALIFICATION("lead_qualification"),

    // Finance
    EXPENSE_APPROVAL("expense_approval"),
    BUDGET_TRACKING("budget_tracking"),
    INVOICE_GENERATION("invoice_generation"),
    FINANCIAL_REPORTING("financial_reporting"),

    // HR
    CANDIDATE_SCREENING("candidate_screening"),
    INTERVIEW_SCHEDULING("interview_scheduling"),
    ONBOARDING("onboarding"),
    EMPLOYEE_INQUIRY("employee_inquiry"),

    // General
    INTENT_CLASSIFICATION("intent_classification"),
    ESCALATION("escalation"),
    NOTIFICATION("notification");

    private final String value;

    AgentCapability(String value) {
        this.value = value;
    }

    /**
     * Wire name of this capability, e.g. {@code ticket_purchase}.
     */
    public String getValue() {
        return value;
    }

    /**
     * Look up a capability by its wire name or constant name, ignoring case.
     */
    public static Optional<AgentCapability> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(c -> c.value.equals(normalized) || c.name().equalsIgnoreCase(normalized))
                .findFirst();
    }
}

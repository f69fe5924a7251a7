package com.z254.switchboard.registry;

import com.z254.switchboard.domain.model.AgentCapability;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static java.util.Map.entry;

/**
 * Fixed intent to capability lookup table used by {@link AgentRegistry#route(String)}.
 */
public final class IntentCatalog {

    private static final Map<String, AgentCapability> INTENTS = Map.ofEntries(
            // Ticketing
            entry("purchase_tickets", AgentCapability.TICKET_PURCHASE),
            entry("buy_tickets", AgentCapability.TICKET_PURCHASE),
            entry("upgrade_seats", AgentCapability.TICKET_UPGRADE),
            entry("upgrade_tickets", AgentCapability.TICKET_UPGRADE),
            entry("refund_tickets", AgentCapability.TICKET_REFUND),
            entry("cancel_order", AgentCapability.TICKET_REFUND),
            entry("ticket_info", AgentCapability.TICKET_INQUIRY),
            entry("event_info", AgentCapability.TICKET_INQUIRY),

            // Sales
            entry("create_proposal", AgentCapability.SALES_PROPOSAL),
            entry("update_crm", AgentCapability.CRM_MANAGEMENT),
            entry("check_pipeline", AgentCapability.PIPELINE_TRACKING),
            entry("qualify_lead", AgentCapability.LEAD_QUALIFICATION),

            // Finance
            entry("approve_expense", AgentCapability.EXPENSE_APPROVAL),
            entry("check_budget", AgentCapability.BUDGET_TRACKING),
            entry("generate_invoice", AgentCapability.INVOICE_GENERATION),
            entry("financial_report", AgentCapability.FINANCIAL_REPORTING),

            // HR
            entry("screen_candidate", AgentCapability.CANDIDATE_SCREENING),
            entry("schedule_interview", AgentCapability.INTERVIEW_SCHEDULING),
            entry("onboard_employee", AgentCapability.ONBOARDING),
            entry("hr_inquiry", AgentCapability.EMPLOYEE_INQUIRY)
    );

    private IntentCatalog() {
    }

    /**
     * Capability for an intent, matched case-insensitively.
     */
    public static Optional<AgentCapability> capabilityFor(String intent) {
        if (intent == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(INTENTS.get(intent.trim().toLowerCase(Locale.ROOT)));
    }

    public static Map<String, AgentCapability> intents() {
        return INTENTS;
    }
}

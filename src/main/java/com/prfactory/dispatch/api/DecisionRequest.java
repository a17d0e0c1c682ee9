package com.prfactory.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.prfactory.core.messages.AgentMessage;
import com.prfactory.core.messages.AgentMessage.AnswersReceived;
import com.prfactory.core.messages.AgentMessage.PlanApproved;
import com.prfactory.core.messages.AgentMessage.PlanRejected;
import com.prfactory.core.messages.AgentMessage.TicketUpdateApproved;
import com.prfactory.core.messages.AgentMessage.TicketUpdateRejected;

import java.time.Instant;
import java.util.Map;

/**
 * Request body carrying a human decision for a suspended workflow.
 */
public record DecisionRequest(
    @JsonProperty("decision") String decision,
    @JsonProperty("answers") Map<String, String> answers,
    @JsonProperty("approved_by") String approvedBy,
    @JsonProperty("reason") String reason,
    @JsonProperty("refinement_instructions") String refinementInstructions,
    @JsonProperty("regenerate_completely") Boolean regenerateCompletely
) {

    public enum Decision {
        ANSWERS,
        TICKET_UPDATE_APPROVED,
        TICKET_UPDATE_REJECTED,
        PLAN_APPROVED,
        PLAN_REJECTED
    }

    /**
     * @throws IllegalArgumentException if the decision is missing or unknown
     */
    public AgentMessage toMessage(String ticketId) {
        if (decision == null || decision.isBlank()) {
            throw new IllegalArgumentException("Decision is required");
        }
        Decision kind;
        try {
            kind = Decision.valueOf(decision.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid decision: " + decision);
        }
        return switch (kind) {
            case ANSWERS -> new AnswersReceived(ticketId, answers != null ? answers : Map.of());
            case TICKET_UPDATE_APPROVED -> new TicketUpdateApproved(ticketId, approvedBy);
            case TICKET_UPDATE_REJECTED -> new TicketUpdateRejected(ticketId, reason);
            case PLAN_APPROVED -> new PlanApproved(ticketId, approvedBy, Instant.now());
            case PLAN_REJECTED -> new PlanRejected(ticketId, reason, refinementInstructions,
                    Boolean.TRUE.equals(regenerateCompletely));
        };
    }
}

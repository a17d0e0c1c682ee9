package com.prfactory.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.prfactory.core.messages.AgentMessage.TriggerTicket;

/**
 * Request body for starting a workflow, typically sent by an issue-tracker webhook.
 */
public record StartWorkflowRequest(
    @JsonProperty("ticket_id") String ticketId,
    @JsonProperty("ticket_key") String ticketKey,
    @JsonProperty("tenant_id") String tenantId,
    @JsonProperty("repository_id") String repositoryId,
    @JsonProperty("ticket_system") String ticketSystem
) {

    public TriggerTicket toTrigger() {
        return new TriggerTicket(ticketId, ticketKey != null ? ticketKey : ticketId,
                tenantId, repositoryId, ticketSystem);
    }
}

package com.prfactory.dispatch.api;

import com.prfactory.core.audit.AuditEntry;
import com.prfactory.core.audit.AuditTrail;
import com.prfactory.core.engine.InvalidWorkflowStateException;
import com.prfactory.core.engine.WorkflowNotFoundException;
import com.prfactory.core.engine.WorkflowOrchestrator;
import com.prfactory.core.graph.GraphStatus;
import com.prfactory.core.messages.AgentMessage;
import com.prfactory.core.model.WorkflowState;
import com.prfactory.core.persistence.WorkflowConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST controller for workflow lifecycle operations and human decisions.
 * <p>
 * Calls run synchronously until the workflow suspends, fails or completes. Only
 * business preconditions map to 4xx; store and other unexpected failures propagate
 * and surface as 5xx.
 */
@RestController
@RequestMapping("/api/v1/workflows")
public class WorkflowController {

    private static final Logger log = LoggerFactory.getLogger(WorkflowController.class);

    private final WorkflowOrchestrator orchestrator;
    private final AuditTrail auditTrail;

    public WorkflowController(WorkflowOrchestrator orchestrator, AuditTrail auditTrail) {
        this.orchestrator = orchestrator;
        this.auditTrail = auditTrail;
    }

    /**
     * POST /api/v1/workflows: Start a workflow for a ticket.
     */
    @PostMapping
    public ResponseEntity<?> startWorkflow(@RequestBody StartWorkflowRequest request) {
        if (request.ticketId() == null || request.ticketId().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "ticket_id is required"));
        }
        try {
            String workflowId = orchestrator.startWorkflow(request.toTrigger());
            log.info("Started workflow {} for ticket {}", workflowId, request.ticketId());
            return orchestrator.findWorkflow(request.ticketId())
                    .<ResponseEntity<?>>map(state -> ResponseEntity.status(HttpStatus.CREATED)
                            .body(WorkflowResponse.from(state)))
                    .orElseGet(() -> ResponseEntity.status(HttpStatus.CREATED)
                            .body(Map.of("workflow_id", workflowId)));
        } catch (WorkflowConflictException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * POST /api/v1/workflows/{ticketId}/decisions: Deliver answers, an approval or a rejection.
     */
    @PostMapping("/{ticketId}/decisions")
    public ResponseEntity<?> submitDecision(@PathVariable String ticketId, @RequestBody DecisionRequest request) {
        AgentMessage decision;
        try {
            decision = request.toMessage(ticketId);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }

        try {
            WorkflowState state = orchestrator.resumeWorkflow(ticketId, decision);
            return ResponseEntity.ok(WorkflowResponse.from(state));
        } catch (WorkflowNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (InvalidWorkflowStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * GET /api/v1/workflows/{ticketId}: Current workflow state.
     */
    @GetMapping("/{ticketId}")
    public ResponseEntity<WorkflowResponse> getWorkflow(@PathVariable String ticketId) {
        return orchestrator.findWorkflow(ticketId)
                .map(state -> ResponseEntity.ok(WorkflowResponse.from(state)))
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * DELETE /api/v1/workflows/{ticketId}: Cancel a running or suspended workflow.
     */
    @DeleteMapping("/{ticketId}")
    public ResponseEntity<?> cancelWorkflow(@PathVariable String ticketId) {
        try {
            orchestrator.cancelWorkflow(ticketId);
            return ResponseEntity.ok(Map.of("ticket_id", ticketId, "status", "CANCELLED"));
        } catch (WorkflowNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (InvalidWorkflowStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * GET /api/v1/workflows/{ticketId}/graphs: Checkpoint-derived status of each graph.
     */
    @GetMapping("/{ticketId}/graphs")
    public List<GraphStatus> getGraphStatuses(@PathVariable String ticketId) {
        return orchestrator.graphStatuses(ticketId);
    }

    /**
     * GET /api/v1/workflows/{ticketId}/audit: Recorded transitions for the ticket.
     */
    @GetMapping("/{ticketId}/audit")
    public List<AuditEntry> getAuditTrail(@PathVariable String ticketId) {
        return auditTrail.entriesFor(ticketId);
    }
}

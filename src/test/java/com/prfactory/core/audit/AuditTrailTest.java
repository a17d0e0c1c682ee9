package com.prfactory.core.audit;

import com.prfactory.core.events.EventBus;
import com.prfactory.core.events.WorkflowEvent;
import com.prfactory.core.persistence.AuditStore;
import com.prfactory.core.persistence.InMemoryAuditStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class AuditTrailTest {

    private EventBus eventBus;
    private AuditTrail auditTrail;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
        auditTrail = new AuditTrail(eventBus, new InMemoryAuditStore(1));
    }

    @Test
    @DisplayName("records published workflow events")
    void recordsEvents() {
        eventBus.publish(new WorkflowEvent.CheckpointSaved("PROJ-1", "RefinementGraph", "clone_complete",
                Instant.now()));

        List<AuditEntry> entries = auditTrail.entriesFor("PROJ-1");
        assertEquals(1, entries.size());
        AuditEntry entry = entries.get(0);
        assertEquals("event", entry.category());
        assertEquals("checkpoint.saved", entry.action());
        assertEquals("RefinementGraph", entry.graphId());
        assertEquals("Checkpoint clone_complete", entry.detail());
    }

    @Test
    @DisplayName("keeps entries in insertion order per ticket")
    void ordersEntries() {
        auditTrail.record("PROJ-1", "PlanningGraph", "agent", "USER_STORIES", "completed -> PlanArtifactGenerated");
        auditTrail.record("PROJ-2", "PlanningGraph", "agent", "API_DESIGN", "failed: timeout");
        auditTrail.record("PROJ-1", "PlanningGraph", "agent", "API_DESIGN", "completed -> PlanArtifactGenerated");

        List<AuditEntry> entries = auditTrail.entriesFor("PROJ-1");
        assertEquals(List.of("USER_STORIES", "API_DESIGN"), entries.stream().map(AuditEntry::action).toList());
        assertEquals(1, auditTrail.entriesFor("PROJ-2").size());
    }

    @Test
    @DisplayName("returns an empty, unmodifiable list for unknown tickets")
    void unknownTicket() {
        List<AuditEntry> entries = auditTrail.entriesFor("PROJ-404");

        assertTrue(entries.isEmpty());
        assertThrows(UnsupportedOperationException.class,
                () -> entries.add(new AuditEntry("x", null, "event", "x", "x", Instant.now())));
    }

    @Test
    @DisplayName("stores the terminal event before telling the store the workflow ended")
    void terminalEventOrder() {
        AuditStore store = mock(AuditStore.class);
        var bus = new EventBus();
        new AuditTrail(bus, store);

        bus.publish(new WorkflowEvent.WorkflowCompleted("PROJ-1", "wf-1", Duration.ofSeconds(2), Instant.now()));

        InOrder inOrder = inOrder(store);
        ArgumentCaptor<AuditEntry> entry = ArgumentCaptor.forClass(AuditEntry.class);
        inOrder.verify(store).append(entry.capture());
        inOrder.verify(store).workflowEnded("PROJ-1");
        assertEquals("workflow.completed", entry.getValue().action());
    }

    @Test
    @DisplayName("ended workflows beyond the retention limit lose their entries")
    void retentionAcrossWorkflows() {
        eventBus.publish(new WorkflowEvent.WorkflowStarted("PROJ-1", "wf-1", "RefinementGraph", Instant.now()));
        eventBus.publish(new WorkflowEvent.WorkflowCancelled("PROJ-1", "wf-1", Instant.now()));
        eventBus.publish(new WorkflowEvent.WorkflowStarted("PROJ-2", "wf-2", "RefinementGraph", Instant.now()));
        eventBus.publish(new WorkflowEvent.WorkflowFailed("PROJ-2", "RefinementGraph", "clone failed",
                Instant.now()));

        assertTrue(auditTrail.entriesFor("PROJ-1").isEmpty());
        assertEquals(List.of("workflow.started", "workflow.failed"),
                auditTrail.entriesFor("PROJ-2").stream().map(AuditEntry::action).toList());
    }
}

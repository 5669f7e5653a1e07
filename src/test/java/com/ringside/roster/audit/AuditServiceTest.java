package com.ringside.roster.audit;

import com.ringside.roster.core.model.EntityRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AuditServiceTest {

    private AuditService auditService;

    @BeforeEach
    void setUp() {
        auditService = new AuditService();
    }

    private static AuditEntry entry(AuditAction action, String entityId, String correlationId, String date) {
        return AuditEntry.builder()
                .action(action)
                .entityId(entityId)
                .entityType("WRESTLER")
                .actorId("SYSTEM")
                .correlationId(correlationId)
                .timestamp(Instant.parse(date + "T00:00:00Z"))
                .build();
    }

    @Test
    @DisplayName("Should record audit entries")
    void testRecordEntry() {
        AuditEntry recorded = auditService.record(AuditEntry.builder()
                .action(AuditAction.TRANSITION_APPLIED)
                .entityId("w-1")
                .entityType("WRESTLER")
                .actorId("booker")
                .details(Map.of("from", "UNEMPLOYED", "to", "EMPLOYED"))
                .build());

        assertNotNull(recorded.id());
        assertEquals(1, auditService.size());
        assertEquals("EMPLOYED", auditService.getAllEntries().get(0).details().get("to"));
    }

    @Test
    @DisplayName("Should record a batch in order")
    void testRecordAll() {
        auditService.recordAll(List.of(
                entry(AuditAction.TRANSITION_APPLIED, "w-1", "c-1", "2024-01-01"),
                entry(AuditAction.CASCADE_APPLIED, "w-1", "c-1", "2024-01-01")));

        var entries = auditService.getAllEntries();
        assertEquals(2, entries.size());
        assertEquals(AuditAction.TRANSITION_APPLIED, entries.get(0).action());
        assertEquals(AuditAction.CASCADE_APPLIED, entries.get(1).action());
    }

    @Test
    @DisplayName("Should filter by entity, action and correlation")
    void testFilters() {
        auditService.record(entry(AuditAction.TRANSITION_APPLIED, "w-1", "c-1", "2024-01-01"));
        auditService.record(entry(AuditAction.CASCADE_APPLIED, "tt-1", "c-1", "2024-01-01"));
        auditService.record(entry(AuditAction.TRANSITION_APPLIED, "w-2", "c-2", "2024-02-01"));

        assertEquals(1, auditService.getEntriesForEntity(EntityRef.wrestler("w-1")).size());
        assertTrue(auditService.getEntriesForEntity(EntityRef.manager("w-1")).isEmpty());
        assertEquals(2, auditService.getEntriesByAction(AuditAction.TRANSITION_APPLIED).size());
        assertEquals(2, auditService.getEntriesForCorrelation("c-1").size());
    }

    @Test
    @DisplayName("Should find entries between two instants inclusive")
    void testBetween() {
        auditService.record(entry(AuditAction.ENTITY_CREATED, "w-1", "c-1", "2024-01-01"));
        auditService.record(entry(AuditAction.ENTITY_DELETED, "w-1", "c-2", "2024-03-01"));
        auditService.record(entry(AuditAction.ENTITY_RESTORED, "w-1", "c-3", "2024-06-01"));

        var entries = auditService.getEntriesBetween(
                Instant.parse("2024-01-01T00:00:00Z"), Instant.parse("2024-03-01T00:00:00Z"));
        assertEquals(2, entries.size());
    }

    @Test
    @DisplayName("Should find the latest entry of an action for an entity")
    void testLatestEntry() {
        auditService.record(entry(AuditAction.ENTITY_DELETED, "w-1", "c-1", "2024-01-01"));
        auditService.record(entry(AuditAction.ENTITY_RESTORED, "w-1", "c-2", "2024-02-01"));
        auditService.record(entry(AuditAction.ENTITY_DELETED, "w-1", "c-3", "2024-03-01"));
        auditService.record(entry(AuditAction.ENTITY_DELETED, "w-2", "c-4", "2024-04-01"));

        AuditEntry latest = auditService.getLatestEntry(EntityRef.wrestler("w-1"), AuditAction.ENTITY_DELETED)
                .orElseThrow();
        assertEquals("c-3", latest.correlationId());
        assertTrue(auditService.getLatestEntry(EntityRef.wrestler("w-3"), AuditAction.ENTITY_DELETED).isEmpty());
    }

    @Test
    @DisplayName("Should return immutable lists")
    void testImmutableLists() {
        auditService.record(entry(AuditAction.ENTITY_CREATED, "w-1", "c-1", "2024-01-01"));

        var entries = auditService.getAllEntries();
        assertThrows(UnsupportedOperationException.class, () ->
                entries.add(entry(AuditAction.ENTITY_CREATED, "w-2", "c-2", "2024-01-01")));
    }

    @Test
    @DisplayName("Details default to empty and action is required")
    void testDetailsAndRequiredAction() {
        AuditEntry withoutDetails = entry(AuditAction.ENTITY_CREATED, "w-1", "c-1", "2024-01-01");
        assertTrue(withoutDetails.details().isEmpty());
        assertThrows(NullPointerException.class, () -> AuditEntry.builder().entityId("w-1").build());
    }
}

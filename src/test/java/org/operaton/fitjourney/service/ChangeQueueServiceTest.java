package org.operaton.fitjourney.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.operaton.fitjourney.exception.RecordNotFoundException;
import org.operaton.fitjourney.model.entity.ChangeQueueEntry;
import org.operaton.fitjourney.model.entity.ChangeQueueEntry.SyncOperation;
import org.operaton.fitjourney.repository.ChangeQueueRepository;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ChangeQueueService.
 */
@ExtendWith(MockitoExtension.class)
class ChangeQueueServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-15T10:00:00Z");

    @Mock
    private ChangeQueueRepository changeQueueRepository;

    @Mock
    private JdbcTemplate jdbcTemplate;

    private ChangeQueueService changeQueueService;

    @BeforeEach
    void setUp() {
        changeQueueService = new ChangeQueueService(changeQueueRepository, jdbcTemplate, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should upsert on the dedup key with the current time")
    void enqueue_Success() {
        // When
        boolean queued = changeQueueService.enqueue(ChangeQueueService.TABLE_GOAL, 12L, SyncOperation.UPDATE);

        // Then
        assertTrue(queued);
        verify(jdbcTemplate).update(contains("INSERT OR REPLACE INTO sync_queue"),
                eq("goal"), eq("12"), eq("UPDATE"), eq(NOW.toEpochMilli()));
    }

    @Test
    @DisplayName("Should report a failed enqueue instead of throwing")
    void enqueue_StoreFailure() {
        // Given
        when(jdbcTemplate.update(anyString(), any(), any(), any(), any()))
                .thenThrow(new DataAccessResourceFailureException("disk I/O error"));

        // When
        boolean queued = changeQueueService.enqueue(ChangeQueueService.TABLE_WORKOUT, 3L, SyncOperation.INSERT);

        // Then
        assertFalse(queued);
    }

    @Test
    @DisplayName("Should count retries and keep the entry pending")
    void recordFailure_IncrementsRetryCount() {
        // Given
        ChangeQueueEntry entry = ChangeQueueEntry.builder()
                .id(1L).tableName("goal").recordId("12").operation(SyncOperation.UPDATE)
                .timestamp(NOW.toEpochMilli()).retryCount(null).build();
        when(changeQueueRepository.findById(1L)).thenReturn(Optional.of(entry));

        // When
        changeQueueService.recordFailure(1L, "HTTP 503");
        changeQueueService.recordFailure(1L, "HTTP 504");

        // Then
        assertEquals(2, entry.getRetryCount());
        assertEquals("HTTP 504", entry.getLastError());
        assertFalse(entry.isSynced());
        verify(changeQueueRepository, times(2)).save(entry);
    }

    @Test
    @DisplayName("Should fail marking an unknown entry as synced")
    void markSynced_UnknownEntry() {
        when(changeQueueRepository.findById(99L)).thenReturn(Optional.empty());

        assertThrows(RecordNotFoundException.class, () -> changeQueueService.markSynced(99L));
        verify(changeQueueRepository, never()).save(any());
    }
}

package org.operaton.fitjourney.integration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.operaton.fitjourney.config.MutableClock;
import org.operaton.fitjourney.config.StoreTestConfiguration;
import org.operaton.fitjourney.model.entity.ChangeQueueEntry;
import org.operaton.fitjourney.model.entity.ChangeQueueEntry.SyncOperation;
import org.operaton.fitjourney.repository.ChangeQueueRepository;
import org.operaton.fitjourney.service.ChangeQueueService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
@Import(StoreTestConfiguration.class)
class ChangeQueueIntegrationTest {

    @Autowired
    private StoreTestConfiguration.StoreCleaner storeCleaner;

    @Autowired
    private MutableClock clock;

    @Autowired
    private ChangeQueueService changeQueueService;

    @Autowired
    private ChangeQueueRepository changeQueueRepository;

    @BeforeEach
    void setUp() {
        storeCleaner.clean();
    }

    @Test
    @DisplayName("Should keep one pending row per table, record and operation with the latest timestamp")
    void enqueue_ShouldDeduplicate() {
        // Given
        assertTrue(changeQueueService.enqueue(ChangeQueueService.TABLE_GOAL, 7L, SyncOperation.UPDATE));
        long firstTimestamp = clock.millis();
        clock.setToday(StoreTestConfiguration.DEFAULT_TODAY.plusDays(1));

        // When
        assertTrue(changeQueueService.enqueue(ChangeQueueService.TABLE_GOAL, 7L, SyncOperation.UPDATE));

        // Then
        List<ChangeQueueEntry> entries = changeQueueRepository.findByTableNameAndRecordId("goal", "7");
        assertEquals(1, entries.size());
        assertFalse(entries.get(0).isSynced());
        assertTrue(entries.get(0).getTimestamp() > firstTimestamp);
    }

    @Test
    @DisplayName("Should keep separate rows for different operations on the same record")
    void enqueue_DifferentOperations_ShouldNotCollapse() {
        changeQueueService.enqueue(ChangeQueueService.TABLE_WORKOUT, 3L, SyncOperation.INSERT);
        changeQueueService.enqueue(ChangeQueueService.TABLE_WORKOUT, 3L, SyncOperation.DELETE);

        assertThat(changeQueueRepository.findByTableNameAndRecordId("workout", "3"))
                .extracting(ChangeQueueEntry::getOperation)
                .containsExactlyInAnyOrder(SyncOperation.INSERT, SyncOperation.DELETE);
    }

    @Test
    @DisplayName("Should make a synced row pending again when the record changes")
    void enqueue_AfterSync_ShouldResetSyncedFlag() {
        // Given
        changeQueueService.enqueue(ChangeQueueService.TABLE_STREAK, "user-1", SyncOperation.UPDATE);
        ChangeQueueEntry entry = changeQueueService.getPendingEntries(10).get(0);
        changeQueueService.markSynced(entry.getId());
        assertEquals(0, changeQueueService.countPending());

        // When
        changeQueueService.enqueue(ChangeQueueService.TABLE_STREAK, "user-1", SyncOperation.UPDATE);

        // Then
        assertEquals(1, changeQueueService.countPending());
        assertEquals(1, changeQueueRepository.findByTableNameAndRecordId("streak", "user-1").size());
    }

    @Test
    @DisplayName("Should drain pending rows oldest first and purge them once synced")
    void drain_ShouldFollowTransportContract() {
        // Given
        changeQueueService.enqueue(ChangeQueueService.TABLE_WORKOUT, 1L, SyncOperation.INSERT);
        clock.setToday(StoreTestConfiguration.DEFAULT_TODAY.plusDays(1));
        changeQueueService.enqueue(ChangeQueueService.TABLE_GOAL, 2L, SyncOperation.INSERT);
        clock.setToday(StoreTestConfiguration.DEFAULT_TODAY.plusDays(2));
        changeQueueService.enqueue(ChangeQueueService.TABLE_MILESTONE, 3L, SyncOperation.INSERT);

        // When
        List<ChangeQueueEntry> batch = changeQueueService.getPendingEntries(2);
        changeQueueService.markSynced(batch.get(0).getId());
        changeQueueService.recordFailure(batch.get(1).getId(), "timeout");
        changeQueueService.recordFailure(batch.get(1).getId(), "timeout again");

        // Then
        assertThat(batch).extracting(ChangeQueueEntry::getTableName).containsExactly("workout", "goal");
        assertEquals(2, changeQueueService.countPending());

        ChangeQueueEntry failed = changeQueueRepository.findById(batch.get(1).getId()).orElseThrow();
        assertFalse(failed.isSynced());
        assertEquals(2, failed.getRetryCount());
        assertEquals("timeout again", failed.getLastError());

        assertEquals(1, changeQueueService.purgeSynced());
        assertEquals(2, changeQueueRepository.count());
    }
}

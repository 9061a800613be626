package org.operaton.fitjourney.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.fitjourney.exception.RecordNotFoundException;
import org.operaton.fitjourney.model.entity.ChangeQueueEntry;
import org.operaton.fitjourney.model.entity.ChangeQueueEntry.SyncOperation;
import org.operaton.fitjourney.repository.ChangeQueueRepository;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;

/**
 * Local ledger of changes waiting for the remote sync transport.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChangeQueueService {

    public static final String TABLE_USERS = "users";
    public static final String TABLE_USER_METRICS = "user_metrics";
    public static final String TABLE_WORKOUT = "workout";
    public static final String TABLE_GOAL = "goal";
    public static final String TABLE_DAILY_LOG = "daily_log";
    public static final String TABLE_STREAK = "streak";
    public static final String TABLE_MILESTONE = "milestone";
    public static final String TABLE_NOTIFICATION = "notification";

    private final ChangeQueueRepository changeQueueRepository;
    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    /**
     * Mark a record change as pending. An existing entry for the same table, record and
     * operation is replaced with a fresh timestamp and synced=false.
     * Never throws: the write that triggered the change has priority over its sync.
     *
     * @return true if the entry was stored
     */
    public boolean enqueue(String tableName, Object recordId, SyncOperation operation) {
        try {
            jdbcTemplate.update(
                    "INSERT OR REPLACE INTO sync_queue (table_name, record_id, operation, timestamp, synced) " +
                    "VALUES (?, ?, ?, ?, 0)",
                    tableName, String.valueOf(recordId), operation.getLabel(), clock.millis());
            log.debug("Queued {} {} {} for sync", operation, tableName, recordId);
            return true;
        } catch (DataAccessException e) {
            log.warn("Failed to queue {} {} {} for sync", operation, tableName, recordId, e);
            return false;
        }
    }

    /**
     * Pending entries, oldest first.
     */
    @Transactional(readOnly = true)
    public List<ChangeQueueEntry> getPendingEntries(int limit) {
        return changeQueueRepository.findBySynced(false, PageRequest.of(0, limit));
    }

    @Transactional(readOnly = true)
    public long countPending() {
        return changeQueueRepository.countBySynced(false);
    }

    @Transactional
    public void markSynced(Long entryId) {
        ChangeQueueEntry entry = changeQueueRepository.findById(entryId)
                .orElseThrow(() -> new RecordNotFoundException("sync_queue", entryId));
        entry.setSynced(true);
        changeQueueRepository.save(entry);
    }

    /**
     * Record a failed transmission. The entry stays pending.
     */
    @Transactional
    public void recordFailure(Long entryId, String error) {
        ChangeQueueEntry entry = changeQueueRepository.findById(entryId)
                .orElseThrow(() -> new RecordNotFoundException("sync_queue", entryId));
        int retries = entry.getRetryCount() != null ? entry.getRetryCount() : 0;
        entry.setRetryCount(retries + 1);
        entry.setLastError(error);
        changeQueueRepository.save(entry);
        log.info("Sync of {} {} failed (attempt {}): {}",
                entry.getTableName(), entry.getRecordId(), retries + 1, error);
    }

    /**
     * Delete every entry already synced.
     *
     * @return number of entries deleted
     */
    @Transactional
    public int purgeSynced() {
        int purged = changeQueueRepository.deleteBySynced(true);
        log.debug("Purged {} synced queue entries", purged);
        return purged;
    }
}

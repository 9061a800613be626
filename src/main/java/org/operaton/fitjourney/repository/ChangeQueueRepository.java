package org.operaton.fitjourney.repository;

import org.operaton.fitjourney.model.entity.ChangeQueueEntry;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for pending sync rows. Inserts go through {@code ChangeQueueService}
 * so that the dedup key is honoured with an insert-or-replace.
 */
@Repository
public interface ChangeQueueRepository extends JpaRepository<ChangeQueueEntry, Long> {

    /**
     * Oldest pending entries first.
     */
    @Query("SELECT e FROM ChangeQueueEntry e WHERE e.synced = :synced ORDER BY e.timestamp ASC, e.id ASC")
    List<ChangeQueueEntry> findBySynced(@Param("synced") boolean synced, Pageable pageable);

    @Query("SELECT COUNT(e) FROM ChangeQueueEntry e WHERE e.synced = :synced")
    long countBySynced(@Param("synced") boolean synced);

    Optional<ChangeQueueEntry> findByTableNameAndRecordIdAndOperation(
            String tableName,
            String recordId,
            ChangeQueueEntry.SyncOperation operation
    );

    List<ChangeQueueEntry> findByTableNameAndRecordId(String tableName, String recordId);

    @Modifying
    @Query("DELETE FROM ChangeQueueEntry e WHERE e.synced = :synced")
    int deleteBySynced(@Param("synced") boolean synced);
}

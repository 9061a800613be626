package org.operaton.fitjourney.model.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.operaton.fitjourney.model.converter.SyncOperationConverter;
import org.operaton.fitjourney.model.converter.StorageLabel;

/**
 * Pending change awaiting propagation to the remote store.
 * Unique on (table, record, operation): re-marking the same change replaces the row.
 */
@Entity
@Table(name = "sync_queue",
       uniqueConstraints = @UniqueConstraint(columnNames = {"table_name", "record_id", "operation"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChangeQueueEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "table_name", nullable = false)
    private String tableName;

    @Column(name = "record_id", nullable = false)
    private String recordId;

    @Convert(converter = SyncOperationConverter.class)
    @Column(nullable = false)
    private SyncOperation operation;

    /**
     * Enqueue time in epoch milliseconds.
     */
    @Column(nullable = false)
    private long timestamp;

    @Column(nullable = false)
    private boolean synced;

    @Column(name = "retry_count")
    private Integer retryCount;

    @Column(name = "last_error")
    private String lastError;

    public enum SyncOperation implements StorageLabel {
        INSERT,
        UPDATE,
        DELETE;

        @Override
        public String getLabel() {
            return name();
        }
    }
}

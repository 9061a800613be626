package org.operaton.fitjourney.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.operaton.fitjourney.model.converter.ActivityKindConverter;
import org.operaton.fitjourney.model.converter.IsoDateConverter;
import org.operaton.fitjourney.model.converter.StorageLabel;

import java.time.LocalDate;

/**
 * One activity entry per user and day. A workout entry is never downgraded to rest.
 */
@Entity
@Table(name = "daily_log",
       uniqueConstraints = @UniqueConstraint(columnNames = {"user_id", "date"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DailyLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "daily_log_id")
    private Long id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Convert(converter = IsoDateConverter.class)
    @Column(nullable = false)
    private LocalDate date;

    @Convert(converter = ActivityKindConverter.class)
    @Column(name = "activity_type", nullable = false)
    private ActivityKind activityKind;

    private String notes;

    public enum ActivityKind implements StorageLabel {
        WORKOUT("workout"),
        REST("rest");

        private final String label;

        ActivityKind(String label) {
            this.label = label;
        }

        @Override
        public String getLabel() {
            return label;
        }
    }
}

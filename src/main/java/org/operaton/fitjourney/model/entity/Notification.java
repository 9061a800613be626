package org.operaton.fitjourney.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.operaton.fitjourney.model.converter.IsoDateTimeConverter;
import org.operaton.fitjourney.model.converter.NotificationKindConverter;
import org.operaton.fitjourney.model.converter.StorageLabel;

import java.time.LocalDateTime;

/**
 * In-app notification. Delivery (push, quiet hours) happens outside this core.
 */
@Entity
@Table(name = "notification")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Notification {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "notification_id")
    private Long id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Convert(converter = NotificationKindConverter.class)
    @Column(name = "type", nullable = false)
    private NotificationKind kind;

    @Column(nullable = false)
    private String message;

    @Convert(converter = IsoDateTimeConverter.class)
    @Column(nullable = false)
    private LocalDateTime timestamp;

    @Column(name = "is_read", nullable = false)
    @Builder.Default
    private boolean read = false;

    public void markAsRead() {
        this.read = true;
    }

    public enum NotificationKind implements StorageLabel {
        /** Goal reached */
        GOAL_PROGRESS("GoalProgress"),
        /** Streak milestone reached */
        NEW_STREAK("NewStreak"),
        MILESTONE("Milestone");

        private final String label;

        NotificationKind(String label) {
            this.label = label;
        }

        @Override
        public String getLabel() {
            return label;
        }
    }
}

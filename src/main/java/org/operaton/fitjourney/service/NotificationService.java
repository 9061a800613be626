package org.operaton.fitjourney.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.fitjourney.model.entity.ChangeQueueEntry.SyncOperation;
import org.operaton.fitjourney.model.entity.Notification;
import org.operaton.fitjourney.repository.NotificationRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Service for managing in-app notifications.
 * Delivery to the device is done by an external component reading these rows.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationService {

    static final String GOAL_ACHIEVED_MESSAGE = "Congratulations! You've achieved your goal.";
    static final String STREAK_MILESTONE_MESSAGE = "%d-day streak achieved! Keep it up!";

    private final NotificationRepository notificationRepository;
    private final ChangeQueueService changeQueueService;
    private final Clock clock;

    /**
     * Create a notification for a user.
     *
     * @param userId the recipient
     * @param kind the notification kind
     * @param message the text shown to the user
     * @return the stored notification
     */
    @Transactional
    public Notification createNotification(String userId, Notification.NotificationKind kind, String message) {
        Notification notification = Notification.builder()
                .userId(userId)
                .kind(kind)
                .message(message)
                .timestamp(LocalDateTime.now(clock))
                .build();

        Notification saved = notificationRepository.save(notification);
        changeQueueService.enqueue(ChangeQueueService.TABLE_NOTIFICATION, saved.getId(), SyncOperation.INSERT);
        log.debug("Created {} notification for user {}", kind, userId);
        return saved;
    }

    /**
     * Create the notification sent when a goal is achieved.
     */
    @Transactional
    public Notification createGoalAchievedNotification(String userId) {
        return createNotification(userId, Notification.NotificationKind.GOAL_PROGRESS, GOAL_ACHIEVED_MESSAGE);
    }

    /**
     * Create the notification sent when a streak milestone is reached.
     */
    @Transactional
    public Notification createStreakMilestoneNotification(String userId, int streakDays) {
        return createNotification(userId, Notification.NotificationKind.NEW_STREAK,
                String.format(STREAK_MILESTONE_MESSAGE, streakDays));
    }

    /**
     * Get all notifications for a user, newest first.
     *
     * @param userId the user ID
     * @return notifications
     */
    @Transactional(readOnly = true)
    public List<Notification> getNotifications(String userId) {
        return notificationRepository.findByUserId(userId);
    }

    @Transactional(readOnly = true)
    public List<Notification> getUnreadNotifications(String userId) {
        return notificationRepository.findByUserIdAndRead(userId, false);
    }

    /**
     * Count unread notifications for a user.
     *
     * @param userId the user ID
     * @return count of unread notifications
     */
    @Transactional(readOnly = true)
    public long countUnreadNotifications(String userId) {
        return notificationRepository.countByUserIdAndRead(userId, false);
    }

    /**
     * Mark a notification as read.
     *
     * @param notificationId the notification ID
     * @param userId the user ID (for ownership)
     * @return true if marked as read, false if not found or not owned by user
     */
    @Transactional
    public boolean markAsRead(Long notificationId, String userId) {
        return notificationRepository.findById(notificationId)
                .filter(n -> n.getUserId().equals(userId))
                .map(notification -> {
                    notification.markAsRead();
                    notificationRepository.save(notification);
                    changeQueueService.enqueue(ChangeQueueService.TABLE_NOTIFICATION, notificationId, SyncOperation.UPDATE);
                    return true;
                })
                .orElse(false);
    }

    /**
     * Mark all notifications as read for a user.
     *
     * @param userId the user ID
     * @return number of notifications marked as read
     */
    @Transactional
    public int markAllAsRead(String userId) {
        List<Notification> unread = notificationRepository.findByUserIdAndRead(userId, false);
        for (Notification notification : unread) {
            notification.markAsRead();
        }
        notificationRepository.saveAll(unread);
        unread.forEach(notification -> changeQueueService.enqueue(
                ChangeQueueService.TABLE_NOTIFICATION, notification.getId(), SyncOperation.UPDATE));
        log.debug("Marked {} notifications as read for user {}", unread.size(), userId);
        return unread.size();
    }

    /**
     * Delete a notification.
     *
     * @param notificationId the notification ID
     * @param userId the user ID (for ownership)
     * @return true if deleted, false if not found or not owned by user
     */
    @Transactional
    public boolean deleteNotification(Long notificationId, String userId) {
        return notificationRepository.findById(notificationId)
                .filter(n -> n.getUserId().equals(userId))
                .map(notification -> {
                    notificationRepository.delete(notification);
                    changeQueueService.enqueue(ChangeQueueService.TABLE_NOTIFICATION, notificationId, SyncOperation.DELETE);
                    return true;
                })
                .orElse(false);
    }
}

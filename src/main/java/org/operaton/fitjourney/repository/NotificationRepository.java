package org.operaton.fitjourney.repository;

import org.operaton.fitjourney.model.entity.Notification;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for Notification entity.
 */
@Repository
public interface NotificationRepository extends JpaRepository<Notification, Long> {

    /**
     * Find all notifications for a user, newest first.
     *
     * @param userId the user ID
     * @return notifications
     */
    @Query("SELECT n FROM Notification n WHERE n.userId = :userId ORDER BY n.timestamp DESC, n.id DESC")
    List<Notification> findByUserId(@Param("userId") String userId);

    /**
     * Find unread notifications for a user, newest first.
     *
     * @param userId the user ID
     * @param read   always {@code false}; passed as a parameter for the SQLite boolean mapping
     * @return unread notifications
     */
    @Query("SELECT n FROM Notification n WHERE n.userId = :userId AND n.read = :read " +
           "ORDER BY n.timestamp DESC, n.id DESC")
    List<Notification> findByUserIdAndRead(@Param("userId") String userId, @Param("read") boolean read);

    /**
     * Count notifications of a user with the given read flag.
     */
    @Query("SELECT COUNT(n) FROM Notification n WHERE n.userId = :userId AND n.read = :read")
    long countByUserIdAndRead(@Param("userId") String userId, @Param("read") boolean read);

    @Modifying
    @Query("DELETE FROM Notification n WHERE n.userId = :userId")
    int deleteByUserId(@Param("userId") String userId);
}

package org.operaton.fitjourney.repository;

import org.operaton.fitjourney.model.entity.Goal;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for Goal entity.
 */
@Repository
public interface GoalRepository extends JpaRepository<Goal, Long> {

    List<Goal> findByUserIdOrderByEndDateAsc(String userId);

    List<Goal> findByUserIdAndStateOrderByEndDateAsc(String userId, Goal.GoalState state);

    List<Goal> findByUserIdAndStateAndKind(String userId, Goal.GoalState state, Goal.GoalKind kind);

    List<Goal> findByUserIdAndStateAndKindAndExerciseId(
            String userId,
            Goal.GoalState state,
            Goal.GoalKind kind,
            Long exerciseId
    );

    /**
     * Find completed goals, most recently achieved first.
     */
    @Query("SELECT g FROM Goal g WHERE g.userId = :userId AND g.state = :state " +
           "ORDER BY g.achievedDate DESC, g.endDate DESC")
    List<Goal> findCompleted(@Param("userId") String userId, @Param("state") Goal.GoalState state);

    @Modifying
    @Query("DELETE FROM Goal g WHERE g.userId = :userId")
    int deleteByUserId(@Param("userId") String userId);
}

package org.operaton.fitjourney.repository;

import org.operaton.fitjourney.model.entity.Milestone;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for Milestone entity.
 */
@Repository
public interface MilestoneRepository extends JpaRepository<Milestone, Long> {

    /**
     * Find all milestones for a user, newest first.
     */
    List<Milestone> findByUserIdOrderByDateDescIdDesc(String userId);

    List<Milestone> findByUserIdAndKindOrderByDateDescIdDesc(String userId, Milestone.MilestoneKind kind);

    List<Milestone> findByUserIdAndKindAndExerciseIdOrderByIdAsc(
            String userId,
            Milestone.MilestoneKind kind,
            Long exerciseId
    );

    long countByUserIdAndKind(String userId, Milestone.MilestoneKind kind);

    @Modifying
    @Query("DELETE FROM Milestone m WHERE m.userId = :userId")
    int deleteByUserId(@Param("userId") String userId);
}

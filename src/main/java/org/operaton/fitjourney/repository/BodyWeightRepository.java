package org.operaton.fitjourney.repository;

import org.operaton.fitjourney.model.entity.BodyWeightMeasurement;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface BodyWeightRepository extends JpaRepository<BodyWeightMeasurement, Long> {

    /**
     * Most recent measurement; ties on timestamp resolve to the later insert.
     */
    Optional<BodyWeightMeasurement> findFirstByUserIdOrderByMeasuredAtDescIdDesc(String userId);

    List<BodyWeightMeasurement> findByUserIdOrderByMeasuredAtAsc(String userId);

    List<BodyWeightMeasurement> findByUserIdAndMeasuredAtBetweenOrderByMeasuredAtAsc(
            String userId, LocalDateTime from, LocalDateTime to);

    @Modifying
    @Query("DELETE FROM BodyWeightMeasurement m WHERE m.userId = :userId")
    int deleteByUserId(@Param("userId") String userId);
}

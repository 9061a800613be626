package org.operaton.fitjourney.repository;

import org.operaton.fitjourney.model.entity.DailyLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface DailyLogRepository extends JpaRepository<DailyLog, Long> {

    Optional<DailyLog> findByUserIdAndDate(String userId, LocalDate date);

    List<DailyLog> findByUserIdAndDateBetweenOrderByDateDesc(String userId, LocalDate start, LocalDate end);

    List<DailyLog> findByUserIdOrderByDateDesc(String userId);

    @Modifying
    @Query("DELETE FROM DailyLog d WHERE d.userId = :userId")
    int deleteByUserId(@Param("userId") String userId);
}

package org.operaton.fitjourney.repository;

import org.operaton.fitjourney.model.entity.Streak;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface StreakRepository extends JpaRepository<Streak, String> {
}

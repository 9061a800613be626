package org.operaton.fitjourney.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.fitjourney.exception.ValidationException;
import org.operaton.fitjourney.model.entity.BodyWeightMeasurement;
import org.operaton.fitjourney.model.entity.ChangeQueueEntry.SyncOperation;
import org.operaton.fitjourney.repository.BodyWeightRepository;
import org.operaton.fitjourney.security.CurrentUserProvider;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;

/**
 * Body-weight measurements of the signed-in user.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BodyWeightService {

    private final BodyWeightRepository bodyWeightRepository;
    private final GoalService goalService;
    private final ChangeQueueService changeQueueService;
    private final CurrentUserProvider currentUserProvider;
    private final Clock clock;

    /**
     * Log a measurement and move active WeightTarget goals to the latest weight.
     *
     * @param weightKg positive weight in kilograms
     * @param date measurement day, or null for now
     * @return the stored measurement
     */
    @Transactional
    public BodyWeightMeasurement logBodyWeight(double weightKg, LocalDate date) {
        String userId = currentUserProvider.requireUserId();
        if (weightKg <= 0) {
            throw new ValidationException("Weight must be positive");
        }

        LocalDateTime measuredAt = date != null
                ? date.atTime(LocalTime.now(clock))
                : LocalDateTime.now(clock);
        BodyWeightMeasurement saved = bodyWeightRepository.save(BodyWeightMeasurement.builder()
                .userId(userId)
                .weightKg(weightKg)
                .measuredAt(measuredAt)
                .build());
        changeQueueService.enqueue(ChangeQueueService.TABLE_USER_METRICS, saved.getId(), SyncOperation.INSERT);
        log.debug("Logged body weight {} kg for user {} at {}", weightKg, userId, measuredAt);

        goalService.onBodyWeightLogged(userId);
        return saved;
    }

    /**
     * Measurements in chronological order, optionally limited to [start, end].
     */
    @Transactional(readOnly = true)
    public List<BodyWeightMeasurement> getWeightHistory(LocalDate start, LocalDate end) {
        String userId = currentUserProvider.requireUserId();
        if (start == null && end == null) {
            return bodyWeightRepository.findByUserIdOrderByMeasuredAtAsc(userId);
        }
        LocalDateTime from = start != null ? start.atStartOfDay() : LocalDate.of(1970, 1, 1).atStartOfDay();
        LocalDateTime to = end != null ? end.atTime(LocalTime.MAX) : LocalDate.of(9999, 12, 31).atTime(LocalTime.MAX);
        return bodyWeightRepository.findByUserIdAndMeasuredAtBetweenOrderByMeasuredAtAsc(userId, from, to);
    }
}

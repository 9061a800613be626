package org.operaton.fitjourney.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.fitjourney.repository.*;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Removes everything stored locally for a user, e.g. after account deletion.
 * The remote copy is handled by the sync transport, so nothing is queued.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountDataService {

    private final WorkoutSetRepository workoutSetRepository;
    private final WorkoutExerciseRepository workoutExerciseRepository;
    private final WorkoutRepository workoutRepository;
    private final GoalRepository goalRepository;
    private final MilestoneRepository milestoneRepository;
    private final NotificationRepository notificationRepository;
    private final DailyLogRepository dailyLogRepository;
    private final StreakRepository streakRepository;
    private final BodyWeightRepository bodyWeightRepository;
    private final UserRepository userRepository;

    /**
     * Delete all rows owned by the user, children before parents, in one transaction.
     */
    @Transactional
    public void deleteLocalData(String userId) {
        int sets = workoutSetRepository.deleteByUserId(userId);
        int workoutExercises = workoutExerciseRepository.deleteByUserId(userId);
        int workouts = workoutRepository.deleteByUserId(userId);
        int goals = goalRepository.deleteByUserId(userId);
        int milestones = milestoneRepository.deleteByUserId(userId);
        notificationRepository.deleteByUserId(userId);
        dailyLogRepository.deleteByUserId(userId);
        streakRepository.findById(userId).ifPresent(streakRepository::delete);
        bodyWeightRepository.deleteByUserId(userId);
        userRepository.findById(userId).ifPresent(userRepository::delete);

        log.info("Deleted local data of user {}: {} workouts ({} exercises, {} sets), {} goals, {} milestones",
                userId, workouts, workoutExercises, sets, goals, milestones);
    }
}

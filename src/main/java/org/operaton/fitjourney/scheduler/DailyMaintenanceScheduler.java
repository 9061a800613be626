package org.operaton.fitjourney.scheduler;

import lombok.extern.slf4j.Slf4j;
import org.operaton.fitjourney.config.AsyncConfiguration;
import org.operaton.fitjourney.service.GoalService;
import org.operaton.fitjourney.service.StreakService;
import org.operaton.fitjourney.service.UserService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Scheduled task that expires overdue goals, refreshes goal progress and resets broken streaks.
 * Covers days on which the app recorded nothing.
 * Per-user work runs on the store write executor, so it never interleaves with other writes.
 */
@Component
@Slf4j
public class DailyMaintenanceScheduler {

    private final UserService userService;
    private final GoalService goalService;
    private final StreakService streakService;
    private final Executor storeWriteExecutor;

    public DailyMaintenanceScheduler(UserService userService,
                                     GoalService goalService,
                                     StreakService streakService,
                                     @Qualifier(AsyncConfiguration.STORE_WRITE_EXECUTOR) Executor storeWriteExecutor) {
        this.userService = userService;
        this.goalService = goalService;
        this.streakService = streakService;
        this.storeWriteExecutor = storeWriteExecutor;
    }

    /**
     * Run goal and streak maintenance for every local user.
     */
    @Scheduled(cron = "${fitjourney.maintenance.cron}")
    public void runDailyMaintenance() {
        log.info("Starting daily goal and streak maintenance");
        long startTime = System.currentTimeMillis();

        List<String> userIds = userService.getAllUserIds();
        log.info("Found {} users to process", userIds.size());

        int successCount = 0;
        int errorCount = 0;
        int expiredGoals = 0;

        for (String userId : userIds) {
            try {
                expiredGoals += CompletableFuture
                        .supplyAsync(() -> maintainUser(userId), storeWriteExecutor)
                        .join();
                successCount++;
            } catch (CompletionException e) {
                log.error("Daily maintenance failed for user {}", userId, e.getCause());
                errorCount++;
            }
        }

        long duration = System.currentTimeMillis() - startTime;
        log.info("Daily maintenance completed in {}ms. Success: {}, Errors: {}, Goals expired: {}",
                duration, successCount, errorCount, expiredGoals);
    }

    private int maintainUser(String userId) {
        int expired = goalService.performDailyMaintenance(userId);
        streakService.performDailyStreakCheck(userId);
        return expired;
    }
}

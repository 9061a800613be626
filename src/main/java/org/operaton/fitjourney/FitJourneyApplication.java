package org.operaton.fitjourney;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

/**
 * Main Spring Boot application class for FitJourney.
 * FitJourney is the offline-first data core of a personal fitness tracker: it keeps workouts,
 * goals, streaks and milestones in a local SQLite store and queues every change for cloud sync.
 */
@SpringBootApplication
@EnableScheduling
@Slf4j
public class FitJourneyApplication {

    public static void main(String[] args) {
        SpringApplication.run(FitJourneyApplication.class, args);
        log.info("FitJourney store opened successfully!");
    }

    /**
     * Clock used for every "today" and "now" decision (goal expiry, milestone dates, queue timestamps).
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}

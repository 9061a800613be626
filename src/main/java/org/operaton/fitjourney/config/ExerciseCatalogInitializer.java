package org.operaton.fitjourney.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.fitjourney.migration.SchemaManager;
import org.operaton.fitjourney.service.ExerciseService;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Seeds the exercise catalog on first start.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class ExerciseCatalogInitializer {

    private final ExerciseService exerciseService;
    private final SchemaManager schemaManager;

    @Bean
    public CommandLineRunner seedExerciseCatalog() {
        return args -> {
            if (schemaManager.getLastReport() != null && schemaManager.getLastReport().hasFailures()) {
                log.warn("Seeding exercise catalog on a partially migrated store");
            }
            int seeded = exerciseService.seedCatalogIfEmpty();
            if (seeded == 0) {
                log.info("Exercise catalog already present, skipping initialization");
            }
        };
    }
}

package org.operaton.fitjourney;

import org.junit.jupiter.api.Test;
import org.operaton.fitjourney.config.StoreTestConfiguration;
import org.operaton.fitjourney.migration.SchemaManager;
import org.operaton.fitjourney.model.entity.Exercise;
import org.operaton.fitjourney.service.ExerciseService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Import(StoreTestConfiguration.class)
class FitJourneyApplicationTest {

    @Autowired
    private SchemaManager schemaManager;

    @Autowired
    private ExerciseService exerciseService;

    @Test
    void contextLoads() {
        assertThat(schemaManager.getLastReport()).isNotNull();
        assertThat(schemaManager.getLastReport().hasFailures()).isFalse();
    }

    @Test
    void exerciseCatalogIsSeeded() {
        assertThat(exerciseService.getAllExercises()).hasSize(22);
        assertThat(exerciseService.getAllMuscleGroups())
                .containsExactlyInAnyOrder("Abs", "Back", "Biceps", "Chest", "Legs", "Shoulders", "Triceps");
        assertThat(exerciseService.getExercisesByMuscleGroup("Abs"))
                .extracting(Exercise::getName)
                .containsExactly("Crunch", "Leg Raise", "Plank");
    }
}

package org.operaton.fitjourney.integration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.operaton.fitjourney.config.StoreTestConfiguration;
import org.operaton.fitjourney.exception.NotLoggedInException;
import org.operaton.fitjourney.exception.RecordNotFoundException;
import org.operaton.fitjourney.facade.FitJourneyFacade;
import org.operaton.fitjourney.model.dto.ExerciseEntry;
import org.operaton.fitjourney.model.dto.PersonalBestDTO;
import org.operaton.fitjourney.model.dto.SetEntry;
import org.operaton.fitjourney.model.dto.WriteOutcome;
import org.operaton.fitjourney.model.entity.Exercise;
import org.operaton.fitjourney.model.entity.Streak;
import org.operaton.fitjourney.model.entity.User;
import org.operaton.fitjourney.service.UserService;
import org.operaton.fitjourney.service.WorkoutLedgerService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Exercises the asynchronous entry point end to end.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(StoreTestConfiguration.class)
class FitJourneyFacadeIntegrationTest {

    private static final LocalDate DAY = LocalDate.of(2024, 3, 14);

    @Autowired
    private StoreTestConfiguration.StoreCleaner storeCleaner;

    @Autowired
    private FitJourneyFacade facade;

    @Autowired
    private UserService userService;

    @Autowired
    private WorkoutLedgerService workoutLedgerService;

    @BeforeEach
    void setUp() {
        storeCleaner.clean();
    }

    @Test
    @DisplayName("Should fail writes when nobody is signed in")
    void saveWorkout_WithoutSession_ShouldFail() {
        ExecutionException thrown = assertThrows(ExecutionException.class,
                () -> facade.saveCompleteWorkout(DAY, 30, null, List.of()).get(5, TimeUnit.SECONDS));

        assertInstanceOf(NotLoggedInException.class, thrown.getCause());
    }

    @Test
    @DisplayName("Should save and read back workouts of the signed-in user")
    void signInAndSaveWorkout_ShouldRoundTripThroughFacade() throws Exception {
        // Given
        facade.signIn(user("user-a")).get(5, TimeUnit.SECONDS);
        Exercise squat = facade.getExercisesByMuscleGroup("Legs").get(5, TimeUnit.SECONDS).stream()
                .filter(e -> e.getName().equals("Squat"))
                .findFirst()
                .orElseThrow();

        // When
        WriteOutcome<Long> outcome = facade.saveCompleteWorkout(DAY, 40, "Leg day",
                List.of(ExerciseEntry.of(squat.getId(), SetEntry.builder().setNumber(1).reps(5).weight(120.0).build())))
                .get(5, TimeUnit.SECONDS);

        // Then
        assertTrue(outcome.isFullSuccess());
        assertThat(facade.getWorkouts().get(5, TimeUnit.SECONDS)).hasSize(1);
        assertTrue(facade.getWorkoutDetails(outcome.value()).get(5, TimeUnit.SECONDS).isPresent());

        List<PersonalBestDTO> bests = facade.getPersonalBests().get(5, TimeUnit.SECONDS);
        assertEquals(1, bests.size());
        assertEquals("Squat", bests.get(0).getExerciseName());
        assertEquals(120.0, bests.get(0).getMaxWeight());

        Streak streak = facade.getStreak().get(5, TimeUnit.SECONDS);
        assertEquals(1, streak.getCurrentStreak());
    }

    @Test
    @DisplayName("Should not let one user delete or read another user's workout")
    void deleteWorkout_OfOtherUser_ShouldBeRejected() throws Exception {
        // Given
        userService.signIn(user("owner"));
        Long workoutId = workoutLedgerService.saveCompleteWorkout("owner", DAY, null, null, List.of()).value();
        facade.signIn(user("intruder")).get(5, TimeUnit.SECONDS);

        // When
        ExecutionException thrown = assertThrows(ExecutionException.class,
                () -> facade.deleteWorkout(workoutId).get(5, TimeUnit.SECONDS));

        // Then
        assertInstanceOf(RecordNotFoundException.class, thrown.getCause());
        assertTrue(facade.getWorkoutDetails(workoutId).get(5, TimeUnit.SECONDS).isEmpty());
        assertTrue(workoutLedgerService.getWorkout(workoutId).isPresent());
    }

    private static User user(String id) {
        return User.builder().id(id).firstName("Test").lastName("User").build();
    }
}

package org.operaton.fitjourney.model.converter;

/**
 * Implemented by enums whose stored text differs from the Java constant name,
 * e.g. {@code EXERCISE_TARGET} stored as {@code ExerciseTarget}.
 */
public interface StorageLabel {

    String getLabel();
}

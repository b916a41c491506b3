package com.rfidsync.domain.model;

/**
 * Vínculo "este tag está habilitado para esta capacitación".
 */
public record TrainingLink(long tagId, String trainingName) {

    /** Longitud máxima de un nombre de capacitación. */
    public static final int MAX_TRAINING_NAME_LENGTH = 255;
}

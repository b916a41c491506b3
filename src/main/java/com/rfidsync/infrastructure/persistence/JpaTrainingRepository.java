package com.rfidsync.infrastructure.persistence;

import com.rfidsync.infrastructure.persistence.entity.TrainingEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

/**
 * Repositorio JPA para operaciones con trainings.
 */
@Repository
public interface JpaTrainingRepository extends JpaRepository<TrainingEntity, String> {

    /**
     * Elimina las capacitaciones sin vínculos.
     */
    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM TrainingEntity t WHERE NOT EXISTS "
            + "(SELECT l.id FROM MemberTrainingLinkEntity l WHERE l.training = t)")
    int deleteUnreferenced();
}

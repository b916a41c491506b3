package com.rfidsync.infrastructure.persistence;

import com.rfidsync.infrastructure.persistence.entity.MemberTrainingLinkEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repositorio JPA para operaciones con members_trainings_link.
 */
@Repository
public interface JpaMemberTrainingLinkRepository extends JpaRepository<MemberTrainingLinkEntity, Integer> {

    @Query("SELECT l FROM MemberTrainingLinkEntity l JOIN FETCH l.training WHERE l.tagId = :tagId")
    List<MemberTrainingLinkEntity> findByTagId(@Param("tagId") Long tagId);

    /**
     * Todos los vínculos con su capacitación, ordenados por tag.
     */
    @Query("SELECT l FROM MemberTrainingLinkEntity l JOIN FETCH l.training t ORDER BY l.tagId, t.trainingName")
    List<MemberTrainingLinkEntity> findAllOrdered();

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM MemberTrainingLinkEntity l WHERE l.tagId = :tagId")
    int deleteByTagId(@Param("tagId") Long tagId);
}

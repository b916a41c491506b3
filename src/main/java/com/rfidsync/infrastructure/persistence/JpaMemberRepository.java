package com.rfidsync.infrastructure.persistence;

import com.rfidsync.infrastructure.persistence.entity.MemberEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repositorio JPA para operaciones con members.
 */
@Repository
public interface JpaMemberRepository extends JpaRepository<MemberEntity, Long> {

    long countByTagId(Long tagId);

    /**
     * Miembros con tarjeta asignada, ordenados por tag.
     */
    List<MemberEntity> findByTagIdNotOrderByTagIdAsc(Long tagId);
}

package com.rfidsync.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Entidad JPA que mapea a la tabla members_trainings_link.
 * tag_id no es FK real porque members.tag_id no es único.
 */
@Entity
@Table(name = "members_trainings_link",
        uniqueConstraints = @UniqueConstraint(name = "uk_link_tag_training", columnNames = { "tag_id", "training_name" }),
        indexes = @Index(name = "idx_link_tag_id", columnList = "tag_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemberTrainingLinkEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    @Column(name = "tag_id", nullable = false)
    private Long tagId;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "training_name", nullable = false)
    private TrainingEntity training;
}

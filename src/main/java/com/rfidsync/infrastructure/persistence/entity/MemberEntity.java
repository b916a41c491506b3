package com.rfidsync.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Entidad JPA que mapea a la tabla members.
 */
@Entity
@Table(name = "members", indexes = @Index(name = "idx_members_tag_id", columnList = "tag_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemberEntity {

    @Id
    @Column(name = "contact_id")
    private Long contactId;

    @Column(name = "tag_id", nullable = false)
    private Long tagId;

    @Column(name = "membership_level", nullable = false)
    private Integer membershipLevel;
}

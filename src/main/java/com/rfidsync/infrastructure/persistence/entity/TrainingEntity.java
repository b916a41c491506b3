package com.rfidsync.infrastructure.persistence.entity;

import com.rfidsync.domain.model.TrainingLink;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Entidad JPA que mapea a la tabla trainings.
 */
@Entity
@Table(name = "trainings")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TrainingEntity {

    @Id
    @Column(name = "training_name", length = TrainingLink.MAX_TRAINING_NAME_LENGTH)
    private String trainingName;
}

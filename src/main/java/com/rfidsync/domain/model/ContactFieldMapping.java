package com.rfidsync.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Nombres de los campos del directorio que contienen el tag y las capacitaciones.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContactFieldMapping {

    /** Campo con el número del tag RFID (texto) */
    private String tagIdField;

    /** Campo de selección múltiple con las capacitaciones aprobadas */
    private String trainingField;
}

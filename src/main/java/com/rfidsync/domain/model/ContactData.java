package com.rfidsync.domain.model;

import com.rfidsync.domain.exception.ExtractionException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Datos de acceso extraídos de un contacto.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContactData {

    private long contactId;

    /** 0 = sin tarjeta asignada */
    private long tagId;

    private int membershipLevel;

    private List<String> trainingLabels;

    /** Error al leer las capacitaciones; null si se leyeron bien */
    private ExtractionException trainingError;

    public boolean hasTag() {
        return tagId != 0;
    }

    public boolean hasTrainingError() {
        return trainingError != null;
    }
}

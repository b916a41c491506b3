package com.rfidsync.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Resumen de una reconciliación contra el directorio.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconciliationResult {

    private int contactsSeen;
    private int membersUpserted;
    private int skippedWithoutTag;
    private int skippedInvalidTag;
    private int trainingErrors;
    private int linksWritten;
    private int trainingsPruned;
}

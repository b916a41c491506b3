package com.rfidsync.domain.model;

/**
 * Resultado de un intento de ciclo de sincronización.
 */
public enum SyncOutcome {

    /** Ciclo completo: base reconciliada y snapshot publicado */
    SUCCEEDED,

    /** Ciclo abortado; la cache publicada no cambió */
    FAILED,

    /** Había otro ciclo en curso; este intento se descartó */
    SKIPPED
}

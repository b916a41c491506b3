package com.rfidsync.domain.exception;

/**
 * Excepción lanzada cuando falla una escritura en la base local.
 * La transacción del ciclo se revierte completa.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }

    public static PersistenceException reconcileFailed(Throwable cause) {
        return new PersistenceException("Error escribiendo la reconciliación en la base local", cause);
    }
}

package com.rfidsync.application.service;

import com.rfidsync.domain.model.Contact;
import com.rfidsync.domain.model.ReconciliationResult;

import java.util.List;

/**
 * Servicio que lleva la base local al estado actual del directorio.
 */
public interface ReconciliationService {

    /**
     * Reconcilia la lista completa de contactos en una sola transacción.
     * Los contactos con tag inválido se omiten sin abortar el ciclo.
     *
     * @param contacts contactos obtenidos del directorio
     * @return resumen de la reconciliación
     * @throws com.rfidsync.domain.exception.PersistenceException si falla una escritura; no queda nada escrito
     */
    ReconciliationResult reconcile(List<Contact> contacts);
}

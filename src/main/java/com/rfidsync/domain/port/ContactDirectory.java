package com.rfidsync.domain.port;

import com.rfidsync.domain.model.Contact;

import java.util.List;

/**
 * Puerto (interfaz) hacia el directorio de membresías.
 */
public interface ContactDirectory {

    /**
     * Obtiene la lista completa de contactos de una cuenta.
     *
     * @param accountId id de la cuenta en el directorio
     * @return todos los contactos actuales
     * @throws com.rfidsync.domain.exception.FetchException si el directorio no responde o rechaza la petición
     */
    List<Contact> fetchContacts(long accountId);
}

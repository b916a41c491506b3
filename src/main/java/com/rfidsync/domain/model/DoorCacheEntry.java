package com.rfidsync.domain.model;

/**
 * Entrada de la cache de puertas.
 */
public record DoorCacheEntry(long tagId, int membershipLevel) {
}

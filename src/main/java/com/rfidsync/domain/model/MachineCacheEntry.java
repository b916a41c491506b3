package com.rfidsync.domain.model;

import java.util.List;

/**
 * Entrada de la cache de máquinas: capacitaciones ordenadas de un tag.
 */
public record MachineCacheEntry(long tagId, List<String> trainings) {
}

package com.rfidsync.application.service;

import com.rfidsync.domain.model.CacheSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Mantiene el último snapshot publicado.
 * Los lectores nunca bloquean; publicar es un único intercambio de referencia.
 */
@Component
@Slf4j
public class CacheSnapshotHolder {

    private final AtomicReference<CacheSnapshot> current = new AtomicReference<>();

    /**
     * Snapshot vigente, vacío si todavía no hubo un ciclo exitoso.
     */
    public Optional<CacheSnapshot> current() {
        return Optional.ofNullable(current.get());
    }

    public boolean isAvailable() {
        return current.get() != null;
    }

    /**
     * Publica un snapshot completo.
     *
     * @return el snapshot reemplazado, si había uno
     */
    public Optional<CacheSnapshot> publish(CacheSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        CacheSnapshot previous = current.getAndSet(snapshot);
        log.info("Snapshot publicado: generación {} ({} tags)", snapshot.getGeneration(), snapshot.size());
        return Optional.ofNullable(previous);
    }
}

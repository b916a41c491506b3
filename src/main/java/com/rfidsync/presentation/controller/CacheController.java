package com.rfidsync.presentation.controller;

import com.rfidsync.application.service.CacheSnapshotHolder;
import com.rfidsync.domain.model.CacheSnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Controlador REST que sirve las caches a los lectores RFID.
 * Solo lee el snapshot publicado; nunca dispara una reconstrucción.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class CacheController {

    static final String GENERATION_HEADER = "X-Cache-Generation";
    static final String GENERATED_AT_HEADER = "X-Cache-Generated-At";

    private final CacheSnapshotHolder snapshotHolder;

    /**
     * GET /api/doorCache
     * Lista de {tagId, membershipLevel} ordenada por tag.
     */
    @GetMapping("/doorCache")
    public ResponseEntity<?> getDoorCache() {
        Optional<CacheSnapshot> snapshot = snapshotHolder.current();
        if (snapshot.isEmpty()) {
            return notAvailable();
        }
        return withHeaders(snapshot.get()).body(snapshot.get().doorEntries());
    }

    /**
     * GET /api/machineCache
     * Lista de {tagId, trainings} ordenada por tag. Con ?training=X solo los tags habilitados para X.
     */
    @GetMapping("/machineCache")
    public ResponseEntity<?> getMachineCache(@RequestParam(required = false) String training) {
        Optional<CacheSnapshot> snapshot = snapshotHolder.current();
        if (snapshot.isEmpty()) {
            return notAvailable();
        }

        CacheSnapshot current = snapshot.get();
        if (training != null && !training.isBlank()) {
            return withHeaders(current).body(current.machineEntriesFor(training.trim()));
        }
        return withHeaders(current).body(current.machineEntries());
    }

    private ResponseEntity.BodyBuilder withHeaders(CacheSnapshot snapshot) {
        return ResponseEntity.ok()
                .header(GENERATION_HEADER, String.valueOf(snapshot.getGeneration()))
                .header(GENERATED_AT_HEADER, snapshot.getBuiltAt().toString());
    }

    /**
     * Sin sincronización exitosa todavía: nunca se responde con una cache vacía.
     */
    private ResponseEntity<Map<String, Object>> notAvailable() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", false);
        response.put("message", "Cache aún no disponible: no se completó ninguna sincronización");
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(response);
    }
}

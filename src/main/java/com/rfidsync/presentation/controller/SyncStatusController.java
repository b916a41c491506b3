package com.rfidsync.presentation.controller;

import com.rfidsync.application.scheduler.CacheSyncJob;
import com.rfidsync.application.service.CacheSnapshotHolder;
import com.rfidsync.domain.model.CacheSnapshot;
import com.rfidsync.domain.model.ReconciliationResult;
import com.rfidsync.domain.model.SyncOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Controlador REST para consultar y disparar la sincronización con el directorio.
 */
@RestController
@RequestMapping("/api/sync")
@RequiredArgsConstructor
@Slf4j
public class SyncStatusController {

    private final CacheSyncJob cacheSyncJob;
    private final CacheSnapshotHolder snapshotHolder;

    /**
     * GET /api/sync/status
     * Estado de la última sincronización y del snapshot publicado.
     */
    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> getStatus() {
        Map<String, Object> status = new LinkedHashMap<>();

        Map<String, Object> sync = new LinkedHashMap<>();
        sync.put("interval", cacheSyncJob.getInterval() != null ? cacheSyncJob.getInterval().toString() : null);
        sync.put("running", cacheSyncJob.isRunning());
        sync.put("lastRunTime", format(cacheSyncJob.getLastRunTime()));
        sync.put("lastSuccessTime", format(cacheSyncJob.getLastSuccessTime()));
        sync.put("lastRunSuccess", cacheSyncJob.isLastRunSuccess());
        sync.put("lastRunError", cacheSyncJob.getLastRunError());
        sync.put("consecutiveFailures", cacheSyncJob.getConsecutiveFailures());
        sync.put("droppedTicks", cacheSyncJob.getDroppedTicks());
        status.put("sync", sync);

        ReconciliationResult result = cacheSyncJob.getLastResult();
        if (result != null) {
            Map<String, Object> reconcile = new LinkedHashMap<>();
            reconcile.put("contactsSeen", result.getContactsSeen());
            reconcile.put("membersUpserted", result.getMembersUpserted());
            reconcile.put("skippedWithoutTag", result.getSkippedWithoutTag());
            reconcile.put("skippedInvalidTag", result.getSkippedInvalidTag());
            reconcile.put("trainingErrors", result.getTrainingErrors());
            reconcile.put("linksWritten", result.getLinksWritten());
            reconcile.put("trainingsPruned", result.getTrainingsPruned());
            status.put("lastReconciliation", reconcile);
        }

        Optional<CacheSnapshot> snapshot = snapshotHolder.current();
        Map<String, Object> cache = new LinkedHashMap<>();
        cache.put("available", snapshot.isPresent());
        snapshot.ifPresent(s -> {
            cache.put("generation", s.getGeneration());
            cache.put("generatedAt", s.getBuiltAt().toString());
            cache.put("tags", s.size());
        });
        status.put("cache", cache);

        return ResponseEntity.ok(status);
    }

    /**
     * POST /api/sync/run
     * Ejecuta un ciclo de inmediato. Responde 409 si ya hay uno en curso.
     */
    @PostMapping("/run")
    public ResponseEntity<Map<String, Object>> runNow() {
        log.info("Sincronización manual solicitada");
        SyncOutcome outcome = cacheSyncJob.runCycle();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("outcome", outcome.name());
        switch (outcome) {
            case SUCCEEDED -> {
                response.put("success", true);
                response.put("message", "Sincronización completada");
                snapshotHolder.current().ifPresent(s -> response.put("generation", s.getGeneration()));
                return ResponseEntity.ok(response);
            }
            case SKIPPED -> {
                response.put("success", false);
                response.put("message", "Ya hay una sincronización en curso");
                return ResponseEntity.status(HttpStatus.CONFLICT).body(response);
            }
            default -> {
                response.put("success", false);
                response.put("message", "Error: " + cacheSyncJob.getLastRunError());
                return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
            }
        }
    }

    private String format(LocalDateTime time) {
        return time != null ? time.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME) : null;
    }
}

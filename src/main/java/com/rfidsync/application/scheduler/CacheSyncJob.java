package com.rfidsync.application.scheduler;

import com.rfidsync.application.service.CacheBuilder;
import com.rfidsync.application.service.CacheSnapshotHolder;
import com.rfidsync.application.service.ReconciliationService;
import com.rfidsync.domain.exception.CacheBuildException;
import com.rfidsync.domain.exception.FetchException;
import com.rfidsync.domain.exception.PersistenceException;
import com.rfidsync.domain.model.CacheSnapshot;
import com.rfidsync.domain.model.Contact;
import com.rfidsync.domain.model.ReconciliationResult;
import com.rfidsync.domain.model.SyncOutcome;
import com.rfidsync.domain.port.ContactDirectory;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Job periódico: directorio -> reconciliación -> cache -> publicación.
 * Nunca corren dos ciclos a la vez; un disparo que llega con un ciclo en curso se descarta.
 * El scheduler solo dispara: el ciclo corre en {@code syncCycleExecutor}, así los disparos
 * que vencen durante un ciclo lento llegan a la guarda en vez de quedar encolados.
 */
@Component
@Slf4j
public class CacheSyncJob {

    private final ContactDirectory contactDirectory;
    private final ReconciliationService reconciliationService;
    private final CacheBuilder cacheBuilder;
    private final CacheSnapshotHolder snapshotHolder;
    private final TaskScheduler taskScheduler;
    private final TaskExecutor cycleExecutor;
    private final Clock clock;

    @Value("${wildapricot.account-id}")
    private long accountId;

    @Value("${sync.interval:PT6M}")
    @Getter
    private Duration interval;

    @Value("${sync.initial-delay:PT10S}")
    private Duration initialDelay;

    @Value("${sync.run-on-startup:true}")
    private boolean runOnStartup;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong droppedTicks = new AtomicLong();

    private ScheduledFuture<?> scheduledTask;

    // --- Tracking de la última ejecución ---
    @Getter
    private volatile LocalDateTime lastRunTime;
    @Getter
    private volatile boolean lastRunSuccess;
    @Getter
    private volatile String lastRunError;
    @Getter
    private volatile ReconciliationResult lastResult;
    @Getter
    private volatile int consecutiveFailures;
    @Getter
    private volatile LocalDateTime lastSuccessTime;

    public CacheSyncJob(ContactDirectory contactDirectory,
            ReconciliationService reconciliationService,
            CacheBuilder cacheBuilder,
            CacheSnapshotHolder snapshotHolder,
            TaskScheduler taskScheduler,
            @Qualifier("syncCycleExecutor") TaskExecutor cycleExecutor,
            Clock clock) {
        this.contactDirectory = contactDirectory;
        this.reconciliationService = reconciliationService;
        this.cacheBuilder = cacheBuilder;
        this.snapshotHolder = snapshotHolder;
        this.taskScheduler = taskScheduler;
        this.cycleExecutor = cycleExecutor;
        this.clock = clock;
    }

    /**
     * Programa los ciclos al arrancar la aplicación.
     */
    @PostConstruct
    public void init() {
        Duration firstDelay = runOnStartup ? initialDelay : interval;
        scheduledTask = taskScheduler.scheduleAtFixedRate(this::onTick, Instant.now(clock).plus(firstDelay), interval);
        log.info("Sincronización programada cada {} (primer ciclo en {})", interval, firstDelay);
    }

    @PreDestroy
    public void shutdown() {
        if (scheduledTask != null) {
            scheduledTask.cancel(false);
            log.info("Sincronización detenida");
        }
    }

    /**
     * Disparo del scheduler. Entrega el ciclo al executor y retorna de inmediato.
     */
    void onTick() {
        if (!tryStartCycle()) {
            return;
        }

        try {
            cycleExecutor.execute(() -> {
                try {
                    doCycle();
                } finally {
                    running.set(false);
                }
            });
        } catch (TaskRejectedException e) {
            running.set(false);
            markFailure("Executor: " + e.getMessage());
            log.error("No se pudo lanzar el ciclo de sincronización: {}", e.getMessage(), e);
        }
    }

    /**
     * Ejecuta un ciclo completo en el hilo llamador si no hay otro en curso.
     *
     * @return resultado del intento
     */
    public SyncOutcome runCycle() {
        if (!tryStartCycle()) {
            return SyncOutcome.SKIPPED;
        }

        try {
            return doCycle();
        } finally {
            running.set(false);
        }
    }

    private boolean tryStartCycle() {
        if (running.compareAndSet(false, true)) {
            return true;
        }
        long dropped = droppedTicks.incrementAndGet();
        log.info("Ciclo en curso, se descarta este disparo (descartados: {})", dropped);
        return false;
    }

    private SyncOutcome doCycle() {
        log.info("=== INICIANDO SINCRONIZACIÓN CON EL DIRECTORIO ===");
        long start = System.nanoTime();

        try {
            List<Contact> contacts = contactDirectory.fetchContacts(accountId);
            log.info("Contactos obtenidos del directorio: {}", contacts.size());

            ReconciliationResult result = reconciliationService.reconcile(contacts);
            CacheSnapshot snapshot = cacheBuilder.build();
            snapshotHolder.publish(snapshot);

            markSuccess(result);
            log.info("=== SINCRONIZACIÓN COMPLETADA en {} ms ===", Duration.ofNanos(System.nanoTime() - start).toMillis());
            return SyncOutcome.SUCCEEDED;

        } catch (FetchException e) {
            markFailure("Directorio: " + e.getMessage());
            log.error("No se pudieron obtener los contactos, la cache publicada no cambia: {}", e.getMessage(), e);
        } catch (PersistenceException e) {
            markFailure("Base local: " + e.getMessage());
            log.error("Error persistiendo la reconciliación, la cache publicada no cambia: {}", e.getMessage(), e);
        } catch (CacheBuildException e) {
            markFailure("Cache: " + e.getMessage());
            log.error("Error construyendo la cache, se mantiene el snapshot anterior: {}", e.getMessage(), e);
        } catch (RuntimeException e) {
            markFailure("Error inesperado: " + e.getMessage());
            log.error("Error inesperado en la sincronización: {}", e.getMessage(), e);
        }
        return SyncOutcome.FAILED;
    }

    public boolean isRunning() {
        return running.get();
    }

    public long getDroppedTicks() {
        return droppedTicks.get();
    }

    // --- Helpers ---

    private void markSuccess(ReconciliationResult result) {
        LocalDateTime now = LocalDateTime.now(clock);
        this.lastRunTime = now;
        this.lastSuccessTime = now;
        this.lastRunSuccess = true;
        this.lastRunError = null;
        this.lastResult = result;
        this.consecutiveFailures = 0;
    }

    private void markFailure(String error) {
        this.lastRunTime = LocalDateTime.now(clock);
        this.lastRunSuccess = false;
        this.lastRunError = error;
        this.consecutiveFailures++;
    }
}

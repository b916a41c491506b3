package com.rfidsync.application.service;

import com.rfidsync.domain.exception.CacheBuildException;
import com.rfidsync.domain.model.CacheSnapshot;
import com.rfidsync.domain.model.Member;
import com.rfidsync.domain.model.TrainingLink;
import com.rfidsync.domain.port.MemberStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Construye las caches de puertas y máquinas a partir de la base local.
 * Cada llamada produce un snapshot completo en una sola pasada.
 */
@Service
@Slf4j
public class CacheBuilder {

    private final MemberStore memberStore;
    private final TransactionTemplate readOnlyTransaction;
    private final Clock clock;
    private final AtomicLong generations = new AtomicLong();

    public CacheBuilder(MemberStore memberStore, PlatformTransactionManager transactionManager, Clock clock) {
        this.memberStore = memberStore;
        this.clock = clock;
        this.readOnlyTransaction = new TransactionTemplate(transactionManager);
        this.readOnlyTransaction.setReadOnly(true);
    }

    /**
     * Lee miembros y vínculos en una misma transacción y arma el snapshot.
     *
     * @return snapshot nuevo, aún no publicado
     * @throws CacheBuildException si la lectura es inconsistente o falla
     */
    public CacheSnapshot build() {
        StoreView view;
        try {
            view = readOnlyTransaction.execute(status ->
                    new StoreView(memberStore.findAllMembers(), memberStore.findAllLinks()));
        } catch (DataAccessException | TransactionException e) {
            throw CacheBuildException.readFailed(e);
        }

        Map<Long, Integer> door = new HashMap<>();
        Map<Long, Set<String>> machine = new HashMap<>();

        for (Member member : view.members()) {
            if (member.getTagId() == 0) {
                continue;
            }
            Integer previous = door.get(member.getTagId());
            if (previous != null) {
                log.warn("Tag {} asignado a más de un contacto (contacto {}), se usa el nivel más alto",
                        member.getTagId(), member.getContactId());
                door.put(member.getTagId(), Math.max(previous, member.getMembershipLevel()));
            } else {
                door.put(member.getTagId(), member.getMembershipLevel());
            }
            machine.putIfAbsent(member.getTagId(), new TreeSet<>());
        }

        for (TrainingLink link : view.links()) {
            Set<String> trainings = machine.get(link.tagId());
            if (trainings == null) {
                throw CacheBuildException.orphanLink(link.tagId(), link.trainingName());
            }
            trainings.add(link.trainingName());
        }

        CacheSnapshot snapshot = new CacheSnapshot(generations.incrementAndGet(), Instant.now(clock), door, machine);
        log.info("Cache construida: generación {}, {} tags, {} vínculos",
                snapshot.getGeneration(), door.size(), view.links().size());
        return snapshot;
    }

    private record StoreView(List<Member> members, List<TrainingLink> links) {
    }
}

package com.rfidsync.application.service;

import com.rfidsync.domain.exception.ExtractionException;
import com.rfidsync.domain.exception.PersistenceException;
import com.rfidsync.domain.model.Contact;
import com.rfidsync.domain.model.ContactData;
import com.rfidsync.domain.model.ContactFieldMapping;
import com.rfidsync.domain.model.Member;
import com.rfidsync.domain.model.ReconciliationResult;
import com.rfidsync.domain.port.MemberStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Implementación del motor de reconciliación.
 * La clave de reconciliación es contact_id; un contacto puede cambiar de tag.
 */
@Service
@Slf4j
public class ReconciliationServiceImpl implements ReconciliationService {

    private final ContactFieldExtractor extractor;
    private final MemberStore memberStore;
    private final ContactFieldMapping fieldMapping;
    private final TransactionTemplate transactionTemplate;

    @Value("${reconcile.prune-unused-trainings:false}")
    private boolean pruneUnusedTrainings;

    public ReconciliationServiceImpl(ContactFieldExtractor extractor,
            MemberStore memberStore,
            ContactFieldMapping fieldMapping,
            PlatformTransactionManager transactionManager) {
        this.extractor = extractor;
        this.memberStore = memberStore;
        this.fieldMapping = fieldMapping;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    public ReconciliationResult reconcile(List<Contact> contacts) {
        log.info("Reconciliando {} contactos con la base local...", contacts.size());
        ReconciliationResult result;
        try {
            result = transactionTemplate.execute(status -> reconcileAll(contacts));
        } catch (DataAccessException | TransactionException e) {
            log.error("Reconciliación revertida: {}", e.getMessage(), e);
            throw PersistenceException.reconcileFailed(e);
        }

        log.info("Reconciliación completada: {} miembros, {} sin tag, {} tags inválidos, {} errores de capacitación",
                result.getMembersUpserted(), result.getSkippedWithoutTag(),
                result.getSkippedInvalidTag(), result.getTrainingErrors());
        return result;
    }

    private ReconciliationResult reconcileAll(List<Contact> contacts) {
        ReconciliationResult result = new ReconciliationResult();
        result.setContactsSeen(contacts.size());

        for (Contact contact : contacts) {
            ContactData data;
            try {
                data = extractor.extractContactData(contact, fieldMapping);
            } catch (ExtractionException e) {
                result.setSkippedInvalidTag(result.getSkippedInvalidTag() + 1);
                log.warn("Contacto omitido: {}", e.getMessage());
                continue;
            }

            if (!data.hasTag()) {
                result.setSkippedWithoutTag(result.getSkippedWithoutTag() + 1);
                log.debug("Contacto {} sin tag asignado", data.getContactId());
                continue;
            }

            applyContact(data, result);
        }

        if (pruneUnusedTrainings) {
            int pruned = memberStore.deleteUnusedTrainings();
            result.setTrainingsPruned(pruned);
            if (pruned > 0) {
                log.info("Eliminadas {} capacitaciones sin vínculos", pruned);
            }
        }
        return result;
    }

    private void applyContact(ContactData data, ReconciliationResult result) {
        Optional<Member> previous = memberStore.findByContactId(data.getContactId());

        memberStore.upsertMember(Member.builder()
                .contactId(data.getContactId())
                .tagId(data.getTagId())
                .membershipLevel(data.getMembershipLevel())
                .build());
        result.setMembersUpserted(result.getMembersUpserted() + 1);

        // Cambio de tarjeta: el tag anterior pierde sus vínculos si ya nadie lo usa
        if (previous.isPresent() && previous.get().getTagId() != data.getTagId()) {
            long oldTag = previous.get().getTagId();
            log.info("Contacto {} cambió de tag: {} -> {}", data.getContactId(), oldTag, data.getTagId());
            if (oldTag != 0 && memberStore.countMembersWithTag(oldTag) == 0) {
                int removed = memberStore.deleteTrainingLinks(oldTag);
                log.debug("Eliminados {} vínculos del tag {}", removed, oldTag);
            }
        }

        if (data.hasTrainingError()) {
            result.setTrainingErrors(result.getTrainingErrors() + 1);
            log.warn("Capacitaciones del tag {} sin cambios: {}", data.getTagId(), data.getTrainingError().getMessage());
            return;
        }

        int links = memberStore.replaceTrainingLinks(data.getTagId(), new LinkedHashSet<>(data.getTrainingLabels()));
        result.setLinksWritten(result.getLinksWritten() + links);
    }
}

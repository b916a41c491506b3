package com.rfidsync.infrastructure.persistence;

import com.rfidsync.domain.model.Member;
import com.rfidsync.domain.model.TrainingLink;
import com.rfidsync.domain.port.MemberStore;
import com.rfidsync.infrastructure.persistence.entity.MemberEntity;
import com.rfidsync.infrastructure.persistence.entity.MemberTrainingLinkEntity;
import com.rfidsync.infrastructure.persistence.entity.TrainingEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Implementación del puerto MemberStore usando JPA.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MemberStoreImpl implements MemberStore {

    private static final long NO_TAG = 0L;

    private final JpaMemberRepository memberRepository;
    private final JpaTrainingRepository trainingRepository;
    private final JpaMemberTrainingLinkRepository linkRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<Member> findByContactId(long contactId) {
        return memberRepository.findById(contactId).map(this::toDomain);
    }

    @Override
    @Transactional
    public void upsertMember(Member member) {
        MemberEntity entity = memberRepository.findById(member.getContactId())
                .orElseGet(() -> MemberEntity.builder().contactId(member.getContactId()).build());
        entity.setTagId(member.getTagId());
        entity.setMembershipLevel(member.getMembershipLevel());
        memberRepository.save(entity);
    }

    @Override
    @Transactional(readOnly = true)
    public long countMembersWithTag(long tagId) {
        return memberRepository.countByTagId(tagId);
    }

    /**
     * Aplica solo la diferencia: elimina los vínculos sobrantes e inserta los que faltan.
     * Con la misma entrada no modifica ninguna fila.
     */
    @Override
    @Transactional
    public int replaceTrainingLinks(long tagId, Collection<String> labels) {
        Set<String> wanted = new LinkedHashSet<>(labels);
        List<MemberTrainingLinkEntity> existing = linkRepository.findByTagId(tagId);

        List<MemberTrainingLinkEntity> stale = new ArrayList<>();
        Set<String> kept = new LinkedHashSet<>();
        for (MemberTrainingLinkEntity link : existing) {
            String name = link.getTraining().getTrainingName();
            if (wanted.contains(name)) {
                kept.add(name);
            } else {
                stale.add(link);
            }
        }

        if (!stale.isEmpty()) {
            linkRepository.deleteAll(stale);
            linkRepository.flush();
            log.debug("Tag {}: {} vínculos eliminados", tagId, stale.size());
        }

        int inserted = 0;
        for (String name : wanted) {
            if (kept.contains(name)) {
                continue;
            }
            TrainingEntity training = trainingRepository.findById(name)
                    .orElseGet(() -> {
                        log.info("Nueva capacitación registrada: {}", name);
                        return trainingRepository.save(new TrainingEntity(name));
                    });
            linkRepository.save(MemberTrainingLinkEntity.builder()
                    .tagId(tagId)
                    .training(training)
                    .build());
            inserted++;
        }

        if (inserted > 0) {
            log.debug("Tag {}: {} vínculos insertados", tagId, inserted);
        }
        return wanted.size();
    }

    @Override
    @Transactional
    public int deleteTrainingLinks(long tagId) {
        return linkRepository.deleteByTagId(tagId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Member> findAllMembers() {
        return memberRepository.findByTagIdNotOrderByTagIdAsc(NO_TAG).stream()
                .map(this::toDomain)
                .collect(Collectors.toList());
    }

    @Override
    @Transactional(readOnly = true)
    public List<TrainingLink> findAllLinks() {
        return linkRepository.findAllOrdered().stream()
                .map(l -> new TrainingLink(l.getTagId(), l.getTraining().getTrainingName()))
                .collect(Collectors.toList());
    }

    @Override
    @Transactional(readOnly = true)
    public List<String> findAllTrainings() {
        return trainingRepository.findAll().stream()
                .map(TrainingEntity::getTrainingName)
                .sorted()
                .collect(Collectors.toList());
    }

    @Override
    @Transactional
    public int deleteUnusedTrainings() {
        return trainingRepository.deleteUnreferenced();
    }

    /**
     * Convierte una entidad JPA a un Member de dominio.
     */
    private Member toDomain(MemberEntity entity) {
        return Member.builder()
                .contactId(entity.getContactId())
                .tagId(entity.getTagId())
                .membershipLevel(entity.getMembershipLevel())
                .build();
    }
}

package com.rfidsync.application.service;

import com.rfidsync.domain.model.Contact;
import com.rfidsync.domain.model.Member;
import com.rfidsync.domain.model.MembershipLevelRef;
import com.rfidsync.domain.model.ReconciliationResult;
import com.rfidsync.domain.model.TrainingLink;
import com.rfidsync.domain.port.MemberStore;
import com.rfidsync.infrastructure.config.SyncConfig;
import com.rfidsync.infrastructure.persistence.JpaMemberRepository;
import com.rfidsync.infrastructure.persistence.JpaMemberTrainingLinkRepository;
import com.rfidsync.infrastructure.persistence.JpaTrainingRepository;
import com.rfidsync.infrastructure.persistence.MemberStoreImpl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

import static com.rfidsync.support.ContactFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import({ SyncConfig.class, MemberStoreImpl.class, ContactFieldExtractor.class, ReconciliationServiceImpl.class })
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class ReconciliationServiceImplTest {

    @Autowired
    private ReconciliationService reconciliationService;

    @Autowired
    private MemberStore memberStore;

    @Autowired
    private JpaMemberRepository memberRepository;

    @Autowired
    private JpaTrainingRepository trainingRepository;

    @Autowired
    private JpaMemberTrainingLinkRepository linkRepository;

    @BeforeEach
    void cleanDatabase() {
        linkRepository.deleteAll();
        trainingRepository.deleteAll();
        memberRepository.deleteAll();
    }

    @Test
    void reconcile_writesMemberAndLinksForTaggedContact() {
        ReconciliationResult result = reconciliationService.reconcile(List.of(contact(1, "1023", 2, "Laser")));

        assertThat(memberStore.findAllMembers()).containsExactly(new Member(1L, 1023L, 2));
        assertThat(memberStore.findAllLinks()).containsExactly(new TrainingLink(1023L, "Laser"));
        assertThat(result.getMembersUpserted()).isEqualTo(1);
        assertThat(result.getLinksWritten()).isEqualTo(1);
    }

    @Test
    void reconcile_skipsContactWithBlankTag() {
        ReconciliationResult result = reconciliationService.reconcile(List.of(contact(2, "", 1, "Laser")));

        assertThat(memberRepository.count()).isZero();
        assertThat(linkRepository.count()).isZero();
        assertThat(result.getSkippedWithoutTag()).isEqualTo(1);
    }

    @Test
    void reconcile_skipsInvalidTagAndContinuesWithOthers() {
        ReconciliationResult result = reconciliationService.reconcile(List.of(
                contact(3, "-5", 1, "Laser"),
                contact(4, "77", 1, "CNC")));

        assertThat(memberStore.findAllMembers()).containsExactly(new Member(4L, 77L, 1));
        assertThat(memberStore.findAllLinks()).containsExactly(new TrainingLink(77L, "CNC"));
        assertThat(result.getSkippedInvalidTag()).isEqualTo(1);
        assertThat(result.getContactsSeen()).isEqualTo(2);
    }

    @Test
    void reconcile_isIdempotent() {
        List<Contact> contacts = List.of(
                contact(1, "1023", 2, "Laser", "WoodShop"),
                contact(2, "", 1),
                contact(3, "88", 1));

        reconciliationService.reconcile(contacts);
        List<Member> membersAfterFirst = memberStore.findAllMembers();
        List<TrainingLink> linksAfterFirst = memberStore.findAllLinks();
        List<Integer> linkIdsAfterFirst = linkRepository.findAll().stream().map(l -> l.getId()).sorted().toList();

        reconciliationService.reconcile(contacts);

        assertThat(memberStore.findAllMembers()).isEqualTo(membersAfterFirst);
        assertThat(memberStore.findAllLinks()).isEqualTo(linksAfterFirst);
        assertThat(linkRepository.findAll().stream().map(l -> l.getId()).sorted().toList())
                .isEqualTo(linkIdsAfterFirst);
    }

    @Test
    void reconcile_replacesTrainingSetWithoutMerging() {
        reconciliationService.reconcile(List.of(contact(1, "1023", 2, "Laser", "WoodShop")));

        reconciliationService.reconcile(List.of(contact(1, "1023", 2, "Laser")));

        assertThat(memberStore.findAllLinks()).containsExactly(new TrainingLink(1023L, "Laser"));
    }

    @Test
    void reconcile_movesLinksWhenContactChangesTag() {
        reconciliationService.reconcile(List.of(contact(1, "1023", 2, "Laser")));

        reconciliationService.reconcile(List.of(contact(1, "2048", 2, "Laser")));

        assertThat(memberStore.findAllMembers()).containsExactly(new Member(1L, 2048L, 2));
        assertThat(memberStore.findAllLinks()).containsExactly(new TrainingLink(2048L, "Laser"));
    }

    @Test
    void reconcile_keepsPreviousLinksWhenTrainingFieldIsMalformed() {
        reconciliationService.reconcile(List.of(contact(1, "1023", 2, "Laser")));
        Contact malformed = contactWithFields(1,
                field(TAG_FIELD, json("\"1023\"")),
                field(TRAINING_FIELD, json("[{\"Label\":\"Laser\"},{\"Id\":3}]")));
        malformed.setMembershipLevel(new MembershipLevelRef(3, "Level 3"));

        ReconciliationResult result = reconciliationService.reconcile(List.of(malformed));

        assertThat(result.getTrainingErrors()).isEqualTo(1);
        assertThat(memberStore.findAllMembers()).containsExactly(new Member(1L, 1023L, 3));
        assertThat(memberStore.findAllLinks()).containsExactly(new TrainingLink(1023L, "Laser"));
    }

    @Test
    void reconcile_collapsesDuplicateLabels() {
        reconciliationService.reconcile(List.of(contact(1, "1023", 1, "Laser", "Laser")));

        assertThat(memberStore.findAllLinks()).containsExactly(new TrainingLink(1023L, "Laser"));
    }

    @Test
    void reconcile_retainsUnreferencedTrainingsByDefault() {
        reconciliationService.reconcile(List.of(contact(1, "1023", 1, "Laser", "WoodShop")));
        reconciliationService.reconcile(List.of(contact(1, "1023", 1, "Laser")));

        assertThat(memberStore.findAllTrainings()).containsExactly("Laser", "WoodShop");
    }

    @Test
    void reconcile_keepsCycleGoingWhenOneLabelIsTooLong() {
        reconciliationService.reconcile(List.of(contact(1, "1023", 2, "Laser")));

        ReconciliationResult result = reconciliationService.reconcile(List.of(
                contact(1, "1023", 2, "x".repeat(TrainingLink.MAX_TRAINING_NAME_LENGTH + 1)),
                contact(2, "77", 1, "CNC")));

        assertThat(result.getTrainingErrors()).isEqualTo(1);
        assertThat(memberStore.findAllLinks()).containsExactly(
                new TrainingLink(77L, "CNC"),
                new TrainingLink(1023L, "Laser"));
    }
}

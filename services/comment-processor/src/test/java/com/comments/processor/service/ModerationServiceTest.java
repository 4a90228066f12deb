package com.comments.processor.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import com.comments.processor.model.ItemKey;
import com.comments.processor.model.ItemType;
import com.comments.processor.model.ModerationStatus;
import com.comments.processor.model.StoredItem;
import com.comments.processor.repository.StoredItemRepository;
import com.comments.processor.service.ModerationService.TransitionResult;

@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class ModerationServiceTest {

    private static final Instant DECIDED = Instant.parse("2026-03-02T09:30:00Z");

    @Autowired
    private StoredItemRepository repository;

    private ItemStore itemStore;
    private ModerationService moderationService;

    @BeforeEach
    void setUp() {
        itemStore = new ItemStore(repository);
        moderationService = new ModerationService(itemStore, Clock.fixed(DECIDED, ZoneOffset.UTC));
        itemStore.createIfAbsent(StoredItem.builder()
                .itemType(ItemType.COMMENT)
                .itemId("r1")
                .payload(Map.of("body", "hi"))
                .receivedAt(Instant.parse("2026-03-01T12:00:00Z"))
                .build());
    }

    @AfterEach
    void tearDown() {
        repository.deleteAll();
    }

    @Test
    void approvesPendingItem() {
        TransitionResult result = moderationService.transition(ItemType.COMMENT, "r1", ModerationStatus.APPROVED);

        assertThat(result).isEqualTo(TransitionResult.TRANSITIONED);
        StoredItem item = stored("r1");
        assertThat(item.getStatus()).isEqualTo(ModerationStatus.APPROVED);
        assertThat(item.getUpdatedAt()).isEqualTo(DECIDED);
        assertThat(item.getPayload()).containsEntry("body", "hi");
    }

    @Test
    void decidedItemIsNotChangedAgain() {
        moderationService.transition(ItemType.COMMENT, "r1", ModerationStatus.REJECTED);

        TransitionResult result = moderationService.transition(ItemType.COMMENT, "r1", ModerationStatus.APPROVED);

        assertThat(result).isEqualTo(TransitionResult.ALREADY_MODERATED);
        assertThat(stored("r1").getStatus()).isEqualTo(ModerationStatus.REJECTED);
    }

    @Test
    void missingItemIsReported() {
        TransitionResult result = moderationService.transition(ItemType.COMMENT, "nope", ModerationStatus.APPROVED);

        assertThat(result).isEqualTo(TransitionResult.NOT_FOUND);
        assertThat(repository.count()).isEqualTo(1);
    }

    @Test
    void keyIncludesItemType() {
        TransitionResult result = moderationService.transition(ItemType.SUBSCRIPTION, "r1", ModerationStatus.APPROVED);

        assertThat(result).isEqualTo(TransitionResult.NOT_FOUND);
        assertThat(stored("r1").getStatus()).isEqualTo(ModerationStatus.PENDING);
    }

    @Test
    void pendingIsNotATarget() {
        assertThatThrownBy(() -> moderationService.transition(ItemType.COMMENT, "r1", ModerationStatus.PENDING))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> moderationService.transition(ItemType.COMMENT, "r1", null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private StoredItem stored(String itemId) {
        return repository.findById(new ItemKey(ItemType.COMMENT, itemId)).orElseThrow();
    }
}

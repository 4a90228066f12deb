package com.comments.processor.service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.springframework.stereotype.Service;

import com.comments.common.model.Envelope;
import com.comments.common.model.Submission;
import com.comments.processor.model.ItemType;
import com.comments.processor.model.ModerationStatus;
import com.comments.processor.model.StoredItem;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.Builder;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns a raw envelope into the item to store.
 * Pure validation - no store access. The only content rules are the ones needed
 * to derive a key: a non-blank requestId and a known item type.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubmissionValidationService {

    private static final Set<String> RESERVED_FIELDS = Set.of(Submission.REQUEST_ID_PARAM, Submission.TYPE_PARAM);

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ValidationResult validate(String envelopeJson) {
        Envelope envelope;
        try {
            envelope = envelopeJson == null ? null : objectMapper.readValue(envelopeJson, Envelope.class);
        } catch (JsonProcessingException e) {
            return ValidationResult.rejected(null, "Unreadable envelope: " + e.getOriginalMessage());
        }

        if (envelope == null || envelope.getSubmission() == null) {
            return ValidationResult.rejected(null, "Missing submission");
        }

        Submission submission = envelope.getSubmission();
        if (!submission.hasRequestId()) {
            return ValidationResult.rejected(submission.getRequestId(), "Missing requestId");
        }

        String requestId = submission.getRequestId();
        String requestedType = submission.getFields().get(Submission.TYPE_PARAM);
        Optional<ItemType> itemType = ItemType.fromField(requestedType);
        if (itemType.isEmpty()) {
            return ValidationResult.rejected(requestId, "Unknown item type: " + requestedType);
        }

        log.debug("Validated submission: requestId={}, itemType={}", requestId, itemType.get());

        StoredItem item = StoredItem.builder()
                .itemType(itemType.get())
                .itemId(requestId)
                .payload(normalize(submission.getFields()))
                .status(ModerationStatus.PENDING)
                .receivedAt(receivedAt(envelope))
                .build();
        return ValidationResult.validated(item);
    }

    Map<String, String> normalize(Map<String, String> fields) {
        Map<String, String> payload = new LinkedHashMap<>();
        fields.forEach((name, value) -> {
            String key = name == null ? "" : name.trim();
            if (key.isEmpty() || RESERVED_FIELDS.contains(key)) {
                return;
            }
            payload.putIfAbsent(key, value == null ? "" : value.trim());
        });
        return payload;
    }

    private Instant receivedAt(Envelope envelope) {
        if (envelope.getSubmission().getReceivedAt() != null) {
            return envelope.getSubmission().getReceivedAt();
        }
        if (envelope.getPublishedAt() != null) {
            return envelope.getPublishedAt();
        }
        return clock.instant();
    }

    @Data
    @Builder
    public static class ValidationResult {
        private boolean valid;
        private StoredItem item;
        private String requestId;
        private String rejectionReason;

        public static ValidationResult validated(StoredItem item) {
            return ValidationResult.builder()
                    .valid(true)
                    .item(item)
                    .requestId(item.getItemId())
                    .build();
        }

        public static ValidationResult rejected(String requestId, String reason) {
            return ValidationResult.builder()
                    .valid(false)
                    .requestId(requestId)
                    .rejectionReason(reason)
                    .build();
        }
    }
}

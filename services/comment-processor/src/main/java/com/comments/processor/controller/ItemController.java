package com.comments.processor.controller;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.comments.processor.model.ItemType;
import com.comments.processor.model.ModerationStatus;
import com.comments.processor.model.StoredItem;
import com.comments.processor.service.ItemStore;
import com.comments.processor.service.ModerationService;
import com.comments.processor.service.ModerationService.TransitionResult;
import com.comments.processor.service.TransientStoreException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Administrative API over the item store: single-key reads and moderation decisions.
 */
@RestController
@RequestMapping("/api/v1/items")
@RequiredArgsConstructor
@Slf4j
public class ItemController {

    private final ItemStore itemStore;
    private final ModerationService moderationService;

    @GetMapping("/{itemType}/{itemId}")
    public ResponseEntity<?> getItem(@PathVariable String itemType, @PathVariable String itemId) {
        Optional<ItemType> type = ItemType.parse(itemType);
        if (type.isEmpty()) {
            return badRequest("Unknown item type: " + itemType);
        }

        return itemStore.find(type.get(), itemId)
                .<ResponseEntity<?>>map(item -> ResponseEntity.ok(ItemResponse.of(item)))
                .orElse(ResponseEntity.notFound().build());
    }

    @PutMapping("/{itemType}/{itemId}/status")
    public ResponseEntity<?> updateStatus(
            @PathVariable String itemType,
            @PathVariable String itemId,
            @RequestBody StatusChangeRequest request) {
        Optional<ItemType> type = ItemType.parse(itemType);
        if (type.isEmpty()) {
            return badRequest("Unknown item type: " + itemType);
        }

        Optional<ModerationStatus> target = ModerationStatus.parse(request.getStatus());
        if (target.isEmpty() || !target.get().isFinal()) {
            return badRequest("Status must be APPROVED or REJECTED");
        }

        TransitionResult result = moderationService.transition(type.get(), itemId, target.get());
        return switch (result) {
            case TRANSITIONED -> itemStore.find(type.get(), itemId)
                    .<ResponseEntity<?>>map(item -> ResponseEntity.ok(ItemResponse.of(item)))
                    .orElse(ResponseEntity.notFound().build());
            case ALREADY_MODERATED -> ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(message("Item already moderated"));
            case NOT_FOUND -> ResponseEntity.notFound().build();
        };
    }

    @ExceptionHandler(TransientStoreException.class)
    public ResponseEntity<MessageResponse> handleStoreUnavailable(TransientStoreException ex) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(message("Item store unavailable"));
    }

    private ResponseEntity<?> badRequest(String text) {
        log.warn("Invalid item request: {}", text);
        return ResponseEntity.badRequest().body(message(text));
    }

    private static MessageResponse message(String text) {
        return MessageResponse.builder()
                .message(text)
                .timestamp(System.currentTimeMillis())
                .build();
    }

    @lombok.Data
    @lombok.NoArgsConstructor
    @lombok.AllArgsConstructor
    public static class StatusChangeRequest {
        private String status;
    }

    @lombok.Data
    @lombok.Builder
    public static class ItemResponse {
        private String itemType;
        private String itemId;
        private Map<String, String> payload;
        private String status;
        private Instant receivedAt;
        private Instant createdAt;
        private Instant updatedAt;

        static ItemResponse of(StoredItem item) {
            return ItemResponse.builder()
                    .itemType(item.getItemType().name())
                    .itemId(item.getItemId())
                    .payload(item.getPayload())
                    .status(item.getStatus().name())
                    .receivedAt(item.getReceivedAt())
                    .createdAt(item.getCreatedAt())
                    .updatedAt(item.getUpdatedAt())
                    .build();
        }
    }

    @lombok.Data
    @lombok.Builder
    public static class MessageResponse {
        private String message;
        private Long timestamp;
    }
}

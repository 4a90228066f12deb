package com.comments.processor.service;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import com.comments.processor.model.StoredItem;
import com.comments.processor.service.ItemStore.CreateOutcome;
import com.comments.processor.service.SubmissionValidationService.ValidationResult;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Processes one delivered envelope: validate, then create the item if its key is new.
 *
 * <p>Safe under redelivery: a second delivery of the same requestId finds the key
 * and reports {@link ProcessingOutcome#DUPLICATE} without changing anything. The
 * only job on failure is classification: {@link PermanentProcessingException} for
 * envelopes that can never be stored, {@link RetryableProcessingException} when
 * the store was unavailable.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubmissionProcessor {

    private final SubmissionValidationService validationService;
    private final ItemStore itemStore;

    public ProcessingOutcome process(String envelopeJson) {
        ValidationResult result = validationService.validate(envelopeJson);
        if (!result.isValid()) {
            throw new PermanentProcessingException(result.getRequestId(), result.getRejectionReason());
        }

        StoredItem item = result.getItem();
        try {
            CreateOutcome outcome = itemStore.createIfAbsent(item);
            return outcome == CreateOutcome.CREATED ? ProcessingOutcome.CREATED : ProcessingOutcome.DUPLICATE;

        } catch (TransientStoreException e) {
            throw new RetryableProcessingException(item.getItemId(), "Item store unavailable", e);
        } catch (DataIntegrityViolationException e) {
            throw new PermanentProcessingException(item.getItemId(),
                    "Item rejected by store: " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    public enum ProcessingOutcome {
        CREATED,
        DUPLICATE
    }
}

package com.comments.processor.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;

import com.comments.processor.model.ItemKey;
import com.comments.processor.model.ItemType;
import com.comments.processor.model.StoredItem;
import com.comments.processor.service.ItemStore.CreateOutcome;
import com.comments.processor.service.SubmissionProcessor.ProcessingOutcome;
import com.comments.processor.service.SubmissionValidationService.ValidationResult;

@ExtendWith(MockitoExtension.class)
class SubmissionProcessorTest {

    private static final String ENVELOPE = "{\"submission\":{\"requestId\":\"r1\"}}";

    @Mock
    private SubmissionValidationService validationService;

    @Mock
    private ItemStore itemStore;

    private SubmissionProcessor processor;
    private StoredItem item;

    @BeforeEach
    void setUp() {
        processor = new SubmissionProcessor(validationService, itemStore);
        item = StoredItem.builder().itemType(ItemType.COMMENT).itemId("r1").build();
    }

    @Test
    void newKeyIsCreated() {
        when(validationService.validate(ENVELOPE)).thenReturn(ValidationResult.validated(item));
        when(itemStore.createIfAbsent(item)).thenReturn(CreateOutcome.CREATED);

        assertThat(processor.process(ENVELOPE)).isEqualTo(ProcessingOutcome.CREATED);
    }

    @Test
    void existingKeyIsADuplicateNotAFailure() {
        when(validationService.validate(ENVELOPE)).thenReturn(ValidationResult.validated(item));
        when(itemStore.createIfAbsent(item)).thenReturn(CreateOutcome.ALREADY_EXISTS);

        assertThat(processor.process(ENVELOPE)).isEqualTo(ProcessingOutcome.DUPLICATE);
    }

    @Test
    void invalidEnvelopeIsPermanentAndNeverReachesStore() {
        when(validationService.validate(ENVELOPE)).thenReturn(ValidationResult.rejected("", "Missing requestId"));

        assertThatThrownBy(() -> processor.process(ENVELOPE))
                .isInstanceOf(PermanentProcessingException.class)
                .hasMessage("Missing requestId")
                .satisfies(e -> assertThat(((ProcessingException) e).isRetryable()).isFalse());
        verifyNoInteractions(itemStore);
    }

    @Test
    void storeOutageIsRetryable() {
        when(validationService.validate(ENVELOPE)).thenReturn(ValidationResult.validated(item));
        when(itemStore.createIfAbsent(item)).thenThrow(new TransientStoreException(
                new ItemKey(ItemType.COMMENT, "r1"), new DataAccessResourceFailureException("connection refused")));

        assertThatThrownBy(() -> processor.process(ENVELOPE))
                .isInstanceOf(RetryableProcessingException.class)
                .hasCauseInstanceOf(TransientStoreException.class)
                .satisfies(e -> assertThat(((ProcessingException) e).isRetryable()).isTrue())
                .extracting("requestId").isEqualTo("r1");
    }

    @Test
    void itemTheStoreCannotHoldIsPermanent() {
        when(validationService.validate(ENVELOPE)).thenReturn(ValidationResult.validated(item));
        when(itemStore.createIfAbsent(any())).thenThrow(new DataIntegrityViolationException("value too long"));

        assertThatThrownBy(() -> processor.process(ENVELOPE))
                .isInstanceOf(PermanentProcessingException.class)
                .hasMessageContaining("value too long");
        verify(itemStore).createIfAbsent(item);
    }
}

package com.comments.capture.controller;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.comments.capture.service.CaptureException;
import com.comments.capture.service.SubmissionCaptureService;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Edge entry point for comment submissions.
 * Answers every HTTP method; the query string is the only input.
 * 204 means "accepted for processing", never "stored"; any failure is a 500 with a generic body.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class CommentCaptureController {

    static final String GENERIC_ERROR = "Submission could not be accepted";

    private final SubmissionCaptureService captureService;

    @RequestMapping(path = "${comments.capture.path:/comment}")
    public ResponseEntity<CaptureResponse> capture(
            @RequestHeader(value = "X-Request-Id", required = false) String requestId,
            HttpServletRequest request) {
        try {
            captureService.capture(request.getQueryString(), requestId);
            return ResponseEntity.noContent().build();

        } catch (CaptureException e) {
            log.warn("Rejecting submission {}: {}", e.getRequestId(), e.getMessage());
            return serverError();
        } catch (Exception e) {
            log.error("Error capturing submission", e);
            return serverError();
        }
    }

    private ResponseEntity<CaptureResponse> serverError() {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(CaptureResponse.builder()
                        .message(GENERIC_ERROR)
                        .timestamp(System.currentTimeMillis())
                        .build());
    }

    @lombok.Data
    @lombok.Builder
    public static class CaptureResponse {
        private String message;
        private Long timestamp;
    }
}

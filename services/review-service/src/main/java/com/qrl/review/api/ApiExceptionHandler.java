package com.qrl.review.api;

import com.qrl.review.backfill.BackfillInProgressException;
import com.qrl.review.common.AgentNotFoundException;
import com.qrl.review.common.ErrorResponse;
import com.qrl.review.common.InvalidReviewRequestException;
import com.qrl.review.common.ProviderUnavailableException;
import com.qrl.review.common.RequestIds;
import com.qrl.review.common.ReviewNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({HttpMessageNotReadableException.class, HttpMediaTypeNotSupportedException.class})
    public ResponseEntity<ErrorResponse> handleUnreadable(Exception ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "bad_request", "Invalid request body", request);
    }

    @ExceptionHandler(InvalidReviewRequestException.class)
    public ResponseEntity<ErrorResponse> handleInvalid(InvalidReviewRequestException ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage(), request);
    }

    @ExceptionHandler({ReviewNotFoundException.class, AgentNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(RuntimeException ex, HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, "not_found", ex.getMessage(), request);
    }

    @ExceptionHandler(BackfillInProgressException.class)
    public ResponseEntity<ErrorResponse> handleConflict(BackfillInProgressException ex, HttpServletRequest request) {
        return respond(HttpStatus.CONFLICT, "backfill_in_progress", ex.getMessage(), request);
    }

    @ExceptionHandler(ProviderUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleProvider(ProviderUnavailableException ex, HttpServletRequest request) {
        logger.warn("provider_unavailable path={} reason={}", request.getRequestURI(), ex.getReason());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "provider_unavailable", ex.getReason(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        logger.error("unexpected_error path={}", request.getRequestURI(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "Unexpected error", request);
    }

    private ResponseEntity<ErrorResponse> respond(
        HttpStatus status,
        String code,
        String message,
        HttpServletRequest request
    ) {
        return ResponseEntity.status(status).body(ErrorResponse.of(code, message, RequestIds.from(request)));
    }
}

package org.example.storyprep.controller;

import jakarta.servlet.http.HttpServletRequest;
import org.example.storyprep.config.RequestCorrelation;
import org.example.storyprep.service.DuplicateStoryException;
import org.example.storyprep.service.IllegalStoryTransitionException;
import org.example.storyprep.service.StoryNotFoundException;
import org.example.storyprep.service.delivery.ChunkNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;

/**
 * Maps domain exceptions raised by the API to status codes.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({StoryNotFoundException.class, ChunkNotFoundException.class})
    ResponseEntity<ApiError> handleNotFound(RuntimeException ex, HttpServletRequest request) {
        return error(HttpStatus.NOT_FOUND, ex, request);
    }

    @ExceptionHandler(DuplicateStoryException.class)
    ResponseEntity<ApiError> handleDuplicate(DuplicateStoryException ex, HttpServletRequest request) {
        log.info("Duplicate story rejected; existing story {}", ex.getExistingStoryId());
        return error(HttpStatus.CONFLICT, ex, request);
    }

    @ExceptionHandler(IllegalStoryTransitionException.class)
    ResponseEntity<ApiError> handleIllegalTransition(IllegalStoryTransitionException ex, HttpServletRequest request) {
        log.warn("Rejected story transition: {}", ex.getMessage());
        return error(HttpStatus.CONFLICT, ex, request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    ResponseEntity<ApiError> handleBadRequest(IllegalArgumentException ex, HttpServletRequest request) {
        return error(HttpStatus.BAD_REQUEST, ex, request);
    }

    @ExceptionHandler(DataAccessException.class)
    ResponseEntity<ApiError> handlePersistence(DataAccessException ex, HttpServletRequest request) {
        log.error("Persistence failure (requestId={})", RequestCorrelation.resolveRequestId(request), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(new ApiError(
                "PersistenceError",
                "Storage is unavailable",
                RequestCorrelation.resolveRequestId(request),
                LocalDateTime.now()));
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, RuntimeException ex, HttpServletRequest request) {
        return ResponseEntity.status(status).body(new ApiError(
                ex.getClass().getSimpleName(),
                ex.getMessage(),
                RequestCorrelation.resolveRequestId(request),
                LocalDateTime.now()));
    }
}

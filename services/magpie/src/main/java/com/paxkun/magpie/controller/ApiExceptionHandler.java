package com.paxkun.magpie.controller;

import com.paxkun.magpie.exception.ErrorCode;
import com.paxkun.magpie.exception.MagpieException;
import com.paxkun.magpie.service.api.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.Instant;

/**
 * Renders every failure as an {@link ErrorResponse}.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(MagpieException.class)
    public ResponseEntity<ErrorResponse> handleMagpie(MagpieException e, HttpServletRequest request) {
        ErrorCode code = e.getErrorCode();
        if (code.getStatus().is5xxServerError()) {
            log.warn("❌ {} {}: {}", code.getStatus().value(), code, e.getMessage());
        } else {
            log.debug("{} {}: {}", code.getStatus().value(), code, e.getMessage());
        }
        return respond(code, e.getMessage(), e.getKeyword(), request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e, HttpServletRequest request) {
        return respond(ErrorCode.INVALID_REQUEST, "Request body must be a JSON object", null, request);
    }

    @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(Exception e, HttpServletRequest request) {
        return respond(ErrorCode.NOT_FOUND, "Endpoint not found", null, request);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethod(HttpRequestMethodNotSupportedException e, HttpServletRequest request) {
        return respond(ErrorCode.NOT_FOUND, "Endpoint not found", null, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e, HttpServletRequest request) {
        log.error("❌ Unhandled error on {}", request.getRequestURI(), e);
        return respond(ErrorCode.INTERNAL_ERROR, "Internal server error", null, request);
    }

    private ResponseEntity<ErrorResponse> respond(ErrorCode code, String message, String keyword, HttpServletRequest request) {
        ErrorResponse body = new ErrorResponse(false, message, code.name(), keyword,
                elapsedSince(request), Instant.now().toString());
        return ResponseEntity.status(code.getStatus()).body(body);
    }

    private static Long elapsedSince(HttpServletRequest request) {
        Object startedAt = request.getAttribute(ImageSearchController.STARTED_AT_ATTRIBUTE);
        if (startedAt instanceof Long) {
            return System.currentTimeMillis() - (Long) startedAt;
        }
        return null;
    }
}

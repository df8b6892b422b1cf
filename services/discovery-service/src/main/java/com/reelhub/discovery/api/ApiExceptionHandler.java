package com.reelhub.discovery.api;

import com.reelhub.discovery.api.dto.ErrorResponse;
import com.reelhub.discovery.service.InvalidDiscoveryRequestException;
import com.reelhub.discovery.upstream.TmdbClient;
import com.reelhub.discovery.upstream.TmdbConfigurationException;
import com.reelhub.discovery.upstream.TmdbRequestException;
import com.reelhub.discovery.upstream.TmdbUnavailableException;
import jakarta.servlet.http.HttpServletRequest;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidDiscoveryRequestException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRequest(InvalidDiscoveryRequestException ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage(), request);
    }

    @ExceptionHandler({
        HttpMessageNotReadableException.class,
        HttpMediaTypeNotSupportedException.class,
        MethodArgumentTypeMismatchException.class,
        MissingServletRequestParameterException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "bad_request", "Invalid request", request);
    }

    @ExceptionHandler(TmdbUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleUnavailable(TmdbUnavailableException ex, HttpServletRequest request) {
        logger.warn("provider_unavailable path={} reason={}", path(request), ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "provider_unavailable", "Metadata provider is unavailable", request);
    }

    @ExceptionHandler(TmdbRequestException.class)
    public ResponseEntity<ErrorResponse> handleProviderRequest(TmdbRequestException ex, HttpServletRequest request) {
        if (ex.isNotFound()) {
            return respond(HttpStatus.NOT_FOUND, "not_found", "Title not found", request);
        }
        HttpStatus status = HttpStatus.resolve(ex.getStatus());
        if (status == null || !status.is4xxClientError()) {
            status = HttpStatus.BAD_GATEWAY;
        }
        return respond(status, "provider_error", ex.getMessage(), request);
    }

    @ExceptionHandler(TmdbConfigurationException.class)
    public ResponseEntity<ErrorResponse> handleConfiguration(TmdbConfigurationException ex, HttpServletRequest request) {
        logger.error("provider_misconfigured path={} reason={}", path(request), ex.getMessage());
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "configuration_error", "Metadata provider is not configured", request);
    }

    @ExceptionHandler(CompletionException.class)
    public ResponseEntity<ErrorResponse> handleCompletion(CompletionException ex, HttpServletRequest request) {
        Throwable cause = TmdbClient.unwrap(ex);
        if (cause instanceof TmdbUnavailableException) {
            return handleUnavailable((TmdbUnavailableException) cause, request);
        }
        if (cause instanceof TmdbRequestException) {
            return handleProviderRequest((TmdbRequestException) cause, request);
        }
        if (cause instanceof TmdbConfigurationException) {
            return handleConfiguration((TmdbConfigurationException) cause, request);
        }
        if (cause instanceof InvalidDiscoveryRequestException) {
            return handleInvalidRequest((InvalidDiscoveryRequestException) cause, request);
        }
        return handleUnexpected(cause instanceof Exception ? (Exception) cause : ex, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        logger.error(
            "unexpected_exception method={} path={}",
            request == null ? null : request.getMethod(),
            path(request),
            ex
        );
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "Unexpected error", request);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, String message, HttpServletRequest request) {
        String traceId = RequestIdUtil.resolveOrGenerate(request, "x-trace-id");
        String requestId = RequestIdUtil.resolveOrGenerate(request, "x-request-id");
        return ResponseEntity.status(status).body(new ErrorResponse(code, message, traceId, requestId));
    }

    private static String path(HttpServletRequest request) {
        return request == null ? null : request.getRequestURI();
    }
}

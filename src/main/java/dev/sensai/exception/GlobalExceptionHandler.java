package dev.sensai.exception;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import jakarta.validation.ConstraintViolationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.MessageSource;
import org.springframework.context.i18n.LocaleContext;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Renders every failure as an {@link ErrorResponse} carrying a stable {@link ErrorCode}.
 */
@RestControllerAdvice
@Slf4j
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private static final Pattern CAMEL_CASE_BOUNDARY = Pattern.compile("([a-z0-9])([A-Z])");
    private static final int MAX_MESSAGE_LENGTH = 200;

    private final MessageSource messageSource;

    @ExceptionHandler(WebExchangeBindException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleValidationErrors(WebExchangeBindException ex, ServerWebExchange exchange) {
        Locale locale = resolveLocale(exchange);
        Map<String, String> errors = new LinkedHashMap<>();
        for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
            String message = fieldError.getDefaultMessage() != null
                    ? fieldError.getDefaultMessage()
                    : msg(locale, "error.invalid_value");
            errors.putIfAbsent(toSnakeCasePath(fieldError.getField()), message);
        }
        log.warn("Validation failed on {}: {}", exchange.getRequest().getPath().value(), errors);
        return Mono.just(build(HttpStatus.BAD_REQUEST, ErrorCode.VALIDATION_ERROR,
                msg(locale, "error.validation_failed"), msg(locale, "error.invalid_request_data"), exchange)
                .validationErrors(errors)
                .build());
    }

    @ExceptionHandler(InvalidRequestException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleInvalidRequest(InvalidRequestException ex, ServerWebExchange exchange) {
        log.warn("Invalid request parameter {}: {}", ex.getField(), ex.getMessage());
        Locale locale = resolveLocale(exchange);
        return Mono.just(build(HttpStatus.BAD_REQUEST, ErrorCode.VALIDATION_ERROR,
                msg(locale, "error.validation_failed"), msg(locale, "error.invalid_request_params"), exchange)
                .validationErrors(Map.of(ex.getField(), ex.getMessage()))
                .build());
    }

    @ExceptionHandler(ConstraintViolationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleConstraintViolation(ConstraintViolationException ex, ServerWebExchange exchange) {
        Map<String, String> errors = new LinkedHashMap<>();
        ex.getConstraintViolations().forEach(violation -> {
            String path = violation.getPropertyPath().toString();
            String field = path.contains(".") ? path.substring(path.lastIndexOf('.') + 1) : path;
            errors.putIfAbsent(toSnakeCasePath(field), violation.getMessage());
        });
        log.warn("Constraint violations: {}", errors);
        Locale locale = resolveLocale(exchange);
        return Mono.just(build(HttpStatus.BAD_REQUEST, ErrorCode.VALIDATION_ERROR,
                msg(locale, "error.validation_failed"), msg(locale, "error.invalid_request_params"), exchange)
                .validationErrors(errors)
                .build());
    }

    @ExceptionHandler(ServerWebInputException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleServerWebInputException(ServerWebInputException ex, ServerWebExchange exchange) {
        log.warn("Bad request input: {}", ex.getMessage());
        Locale locale = resolveLocale(exchange);
        ErrorResponse.ErrorResponseBuilder response = build(HttpStatus.BAD_REQUEST, ErrorCode.VALIDATION_ERROR,
                msg(locale, "error.bad_request"),
                ex.getReason() != null ? truncate(ex.getReason()) : msg(locale, "error.invalid_request"), exchange);
        MismatchedInputException mismatch = findCause(ex, MismatchedInputException.class);
        if (mismatch != null && !mismatch.getPath().isEmpty()) {
            response.validationErrors(Map.of(toJsonPath(mismatch.getPath()), msg(locale, "error.invalid_value")));
        }
        return Mono.just(response.build());
    }

    @ExceptionHandler(NotConfiguredException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleNotConfigured(NotConfiguredException ex, ServerWebExchange exchange) {
        HttpStatus status = ex.getComponent() == NotConfiguredException.Component.GENERATION_API
                ? HttpStatus.BAD_REQUEST
                : HttpStatus.INTERNAL_SERVER_ERROR;
        if (status.is5xxServerError()) {
            log.error("{} not configured: {}", ex.getComponent(), ex.getMessage());
        } else {
            log.warn("{} not configured: {}", ex.getComponent(), ex.getMessage());
        }
        Locale locale = resolveLocale(exchange);
        return Mono.just(ResponseEntity.status(status).body(build(status, ErrorCode.NOT_CONFIGURED,
                msg(locale, "error.not_configured"), ex.getMessage(), exchange).build()));
    }

    @ExceptionHandler(StorageUnavailableException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public Mono<ErrorResponse> handleStorageUnavailable(StorageUnavailableException ex, ServerWebExchange exchange) {
        log.error("Document store unavailable: {}", ex.getMessage());
        Locale locale = resolveLocale(exchange);
        return Mono.just(build(HttpStatus.SERVICE_UNAVAILABLE, ErrorCode.STORAGE_UNAVAILABLE,
                msg(locale, "error.storage_unavailable"), msg(locale, "error.storage_unavailable_retry"), exchange)
                .build());
    }

    @ExceptionHandler(UpstreamException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Mono<ErrorResponse> handleUpstream(UpstreamException ex, ServerWebExchange exchange) {
        log.error("Generation API call failed: {}", ex.getMessage());
        Locale locale = resolveLocale(exchange);
        return Mono.just(build(HttpStatus.INTERNAL_SERVER_ERROR, ErrorCode.UPSTREAM_ERROR,
                msg(locale, "error.upstream_error"), ex.getMessage(), exchange)
                .build());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleResponseStatusException(
            ResponseStatusException ex, ServerWebExchange exchange) {
        log.warn("Response status exception: {} - {}", ex.getStatusCode(), ex.getReason());
        Locale locale = resolveLocale(exchange);
        HttpStatus status = HttpStatus.resolve(ex.getStatusCode().value());
        if (status == null) {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
        }
        ErrorCode code = status.is4xxClientError() ? ErrorCode.VALIDATION_ERROR : ErrorCode.INTERNAL_ERROR;
        String message = ex.getReason() != null ? truncate(ex.getReason()) : status.getReasonPhrase();
        return Mono.just(ResponseEntity.status(status).body(build(status, code,
                status.is4xxClientError() ? msg(locale, "error.bad_request") : msg(locale, "error.internal_server_error"),
                message, exchange).build()));
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Mono<ErrorResponse> handleGenericException(Exception ex, ServerWebExchange exchange) {
        log.error("Unexpected error: ", ex);
        Locale locale = resolveLocale(exchange);
        return Mono.just(build(HttpStatus.INTERNAL_SERVER_ERROR, ErrorCode.INTERNAL_ERROR,
                msg(locale, "error.internal_server_error"), msg(locale, "error.unexpected_error"), exchange)
                .build());
    }

    private ErrorResponse.ErrorResponseBuilder build(HttpStatus status, ErrorCode code, String error,
                                                     String message, ServerWebExchange exchange) {
        return ErrorResponse.builder()
                .timestamp(Instant.now())
                .status(status.value())
                .code(code)
                .error(error)
                .message(message)
                .path(exchange.getRequest().getPath().value());
    }

    private Locale resolveLocale(ServerWebExchange exchange) {
        LocaleContext localeContext = exchange.getLocaleContext();
        Locale locale = localeContext != null ? localeContext.getLocale() : null;
        return locale != null ? locale : Locale.ENGLISH;
    }

    private String msg(Locale locale, String code, Object... args) {
        return messageSource.getMessage(code, args, code, locale);
    }

    /**
     * Binding reports Java property paths ({@code totalQuestions}); clients send snake_case.
     */
    static String toSnakeCasePath(String field) {
        return CAMEL_CASE_BOUNDARY.matcher(field).replaceAll("$1_$2").toLowerCase(Locale.ROOT);
    }

    /**
     * Body fields are already named as the client sent them, e.g. {@code experiences[0].start}.
     */
    static String toJsonPath(List<JsonMappingException.Reference> path) {
        StringBuilder field = new StringBuilder();
        for (JsonMappingException.Reference reference : path) {
            if (reference.getFieldName() != null) {
                if (!field.isEmpty()) {
                    field.append('.');
                }
                field.append(reference.getFieldName());
            } else if (reference.getIndex() >= 0) {
                field.append('[').append(reference.getIndex()).append(']');
            }
        }
        return field.toString();
    }

    private static <T extends Throwable> T findCause(Throwable ex, Class<T> type) {
        Throwable current = ex;
        while (current != null) {
            if (type.isInstance(current)) {
                return type.cast(current);
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return null;
    }

    private static String truncate(String message) {
        return message.length() > MAX_MESSAGE_LENGTH ? message.substring(0, MAX_MESSAGE_LENGTH) + "..." : message;
    }
}

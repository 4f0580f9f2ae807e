package com.vaultledger.api.controller;

import com.vaultledger.api.dto.ErrorBody;
import com.vaultledger.common.AuthorizationException;
import com.vaultledger.common.ChainSubmissionException;
import com.vaultledger.common.NotFoundException;
import com.vaultledger.common.StateException;
import com.vaultledger.common.VaultLedgerException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.Optional;

/**
 * Maps the service exception taxonomy and bean-validation failures to {@link ErrorBody}.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        String errorCode = Optional.ofNullable(ex.getFieldError())
                .map(FieldError::getDefaultMessage)
                .filter(msg -> msg != null && !msg.isBlank())
                .orElse("VALIDATION_ERROR");
        String message = ex.getFieldErrors().stream()
                .findFirst()
                .map(e -> e.getField() + ": " + userFacingMessage(errorCode))
                .orElse("Validation failed");
        return respond(HttpStatus.BAD_REQUEST, errorCode, message);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorBody> handleUnreadable(ServerWebInputException ex) {
        return respond(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", ex.getReason() != null ? ex.getReason() : "Malformed request");
    }

    @ExceptionHandler(VaultLedgerException.class)
    public ResponseEntity<ErrorBody> handle(VaultLedgerException ex) {
        HttpStatus status = statusOf(ex);
        if (status.is5xxServerError()) {
            log.warn("{} ({}): {}", status.value(), ex.getErrorCode(), ex.getMessage());
        } else {
            log.debug("{} ({}): {}", status.value(), ex.getErrorCode(), ex.getMessage());
        }
        return respond(status, ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorBody> handleUnexpected(Exception ex) {
        log.error("Unhandled error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Internal server error");
    }

    static HttpStatus statusOf(VaultLedgerException ex) {
        if (ex instanceof AuthorizationException auth) {
            return auth.isUnauthenticated() ? HttpStatus.UNAUTHORIZED : HttpStatus.FORBIDDEN;
        }
        if (ex instanceof NotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (ex instanceof StateException state && state.isConflict()) {
            return HttpStatus.CONFLICT;
        }
        if (ex instanceof ChainSubmissionException) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        }
        return HttpStatus.BAD_REQUEST;
    }

    private static String userFacingMessage(String errorCode) {
        return switch (errorCode) {
            case "INVALID_ADDRESS" -> "must be a 0x-prefixed 20-byte hex address";
            case "INVALID_AMOUNT" -> "must be a positive decimal integer string in base units";
            default -> "is invalid";
        };
    }

    private static ResponseEntity<ErrorBody> respond(HttpStatus status, String errorCode, String message) {
        return ResponseEntity.status(status).body(ErrorBody.of(status, errorCode, message));
    }
}

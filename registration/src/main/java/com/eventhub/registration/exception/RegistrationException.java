package com.eventhub.registration.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base class of every failure the registration protocol reports to callers.
 * <ul>
 * <li>{@code errorCode}: stable machine-readable identifier</li>
 * <li>{@code terminal}: true when retrying with the same identity cannot
 * succeed (not qualified, registration closed)</li>
 * <li>{@code status}: HTTP status used by the REST binding</li>
 * </ul>
 * Messages must never contain an email address the caller has not proven to
 * own.
 */
@Getter
public abstract class RegistrationException extends RuntimeException {

    private final String errorCode;
    private final boolean terminal;
    private final HttpStatus status;

    protected RegistrationException(String errorCode, String message, boolean terminal, HttpStatus status) {
        super(message);
        this.errorCode = errorCode;
        this.terminal = terminal;
        this.status = status;
    }

    protected RegistrationException(String errorCode, String message, boolean terminal, HttpStatus status,
            Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.terminal = terminal;
        this.status = status;
    }

    public boolean isRetryable() {
        return !terminal;
    }
}

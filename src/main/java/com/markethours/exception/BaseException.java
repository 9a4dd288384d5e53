package com.markethours.exception;

import java.util.List;
import lombok.Getter;

/**
 * Root of the market-hours error taxonomy. The {@link ErrorCode} decides the HTTP status;
 * {@code violations} lists individual schedule problems when there is more than one.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final List<String> violations;

    protected BaseException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
        this.violations = List.of();
    }

    protected BaseException(ErrorCode errorCode, String message, List<String> violations) {
        super(message);
        this.errorCode = errorCode;
        this.violations = violations != null ? List.copyOf(violations) : List.of();
    }

    protected BaseException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.violations = List.of();
    }
}

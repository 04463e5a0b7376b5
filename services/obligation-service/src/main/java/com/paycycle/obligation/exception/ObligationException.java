package com.paycycle.obligation.exception;

/**
 * Base exception for all obligation service exceptions
 * Carries a stable error code for programmatic handling
 */
public class ObligationException extends RuntimeException {

    private final String errorCode;
    private final Object[] args;

    public ObligationException(String message) {
        super(message);
        this.errorCode = "OBLIGATION_ERROR";
        this.args = null;
    }

    public ObligationException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
        this.args = null;
    }

    public ObligationException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.args = null;
    }

    public ObligationException(String errorCode, String message, Object... args) {
        super(message);
        this.errorCode = errorCode;
        this.args = args;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public Object[] getArgs() {
        return args;
    }
}

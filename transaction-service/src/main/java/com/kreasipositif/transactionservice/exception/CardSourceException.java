package com.kreasipositif.transactionservice.exception;

import lombok.Getter;

/**
 * Raised when the card CSV cannot provide any data. Only thrown during startup, where it
 * aborts context creation.
 */
@Getter
public class CardSourceException extends BankingApiException {

    public enum Kind {
        /** The resource is missing, unreadable or cannot be parsed. */
        SOURCE_UNAVAILABLE,
        /** The resource was read but holds no card rows. */
        SOURCE_EMPTY
    }

    private final Kind kind;

    public CardSourceException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CardSourceException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}

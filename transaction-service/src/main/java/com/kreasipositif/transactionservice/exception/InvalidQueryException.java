package com.kreasipositif.transactionservice.exception;

/**
 * Signals query parameters that are rejected before any data is read, e.g. a page size
 * outside 1..100, a negative amount bound or an unknown sort field. Values are never clamped.
 */
public class InvalidQueryException extends BankingApiException {

    public InvalidQueryException(String message) {
        super(message);
    }
}

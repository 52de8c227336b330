package com.kreasipositif.transactionservice.exception;

/**
 * Base unchecked exception for failures raised by the transaction service itself.
 * The REST layer maps each subclass to a dedicated HTTP status.
 */
public abstract class BankingApiException extends RuntimeException {

    protected BankingApiException(String message) {
        super(message);
    }

    protected BankingApiException(String message, Throwable cause) {
        super(message, cause);
    }
}

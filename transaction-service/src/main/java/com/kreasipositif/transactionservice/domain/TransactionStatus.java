package com.kreasipositif.transactionservice.domain;

public enum TransactionStatus {
    COMPLETED,
    PENDING
}

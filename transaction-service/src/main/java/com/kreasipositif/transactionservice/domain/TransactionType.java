package com.kreasipositif.transactionservice.domain;

import java.util.Locale;

/**
 * Kind of a synthetic transaction, decided by the card type it was derived from.
 */
public enum TransactionType {
    PURCHASE,
    PAYMENT,
    TRANSFER;

    /**
     * Maps a free-text card type to a transaction type: "debit" cards purchase, "credit"
     * cards pay, anything else transfers. Matching is a case-insensitive substring test
     * and "debit" wins when both words appear.
     *
     * @param cardType card type column value, may be {@code null}
     * @return derived transaction type
     */
    public static TransactionType fromCardType(String cardType) {
        String normalized = cardType == null ? "" : cardType.toLowerCase(Locale.ROOT);
        if (normalized.contains("debit")) {
            return PURCHASE;
        }
        if (normalized.contains("credit")) {
            return PAYMENT;
        }
        return TRANSFER;
    }
}

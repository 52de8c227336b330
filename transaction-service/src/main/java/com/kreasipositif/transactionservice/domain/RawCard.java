package com.kreasipositif.transactionservice.domain;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * One row of the card CSV, reduced to the columns transaction derivation needs.
 *
 * <p>CSV columns consumed (by header name):
 * <pre>
 *   id, client_id, credit_limit, card_type, card_brand
 * </pre>
 */
@Getter
@Builder
@ToString
public class RawCard {

    /** Card identifier, unique across the file. */
    private final int id;

    /** Owning client. */
    private final int clientId;

    /** Credit limit parsed from a currency string such as {@code "$24,295"}. */
    private final BigDecimal creditLimit;

    /** Free-text card type, e.g. "Debit", "Credit", "Debit (Prepaid)". */
    private final String cardType;

    /** Card network, e.g. "Visa", "Mastercard". */
    private final String cardBrand;
}

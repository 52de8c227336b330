package com.kreasipositif.transactionservice.domain;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Immutable synthetic transaction derived from a card record.
 * Created once at startup by {@code TransactionGenerator} and never mutated afterwards.
 */
@Getter
@Builder
@ToString
@EqualsAndHashCode
@Schema(description = "Synthetic banking transaction")
public class Transaction {

    @Schema(description = "Transaction ID (card_id * 100 + index)", example = "452400")
    private final int id;

    @Schema(description = "ID of the client making the transaction", example = "825")
    private final int clientId;

    @Schema(description = "ID of the recipient client, never equal to client_id", example = "925")
    private final Integer recipientId;

    @Schema(description = "Transaction amount", example = "242.95")
    private final BigDecimal amount;

    @Schema(description = "Transaction type", example = "PURCHASE")
    private final TransactionType type;

    @Schema(description = "Transaction date (YYYY-MM-DD)", example = "2024-01-15")
    private final LocalDate date;

    @Schema(description = "Transaction timestamp (ISO-8601)", example = "2024-01-15T10:30:00")
    private final LocalDateTime timestamp;

    @Schema(description = "Card the transaction was derived from", example = "4524")
    private final Integer cardId;

    @Schema(description = "Card brand", example = "Visa")
    private final String cardBrand;

    @Schema(description = "Transaction status", example = "COMPLETED")
    private final TransactionStatus status;

    @Schema(description = "Transaction description", example = "Transaction 1 for card 4524")
    private final String description;
}

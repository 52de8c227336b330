package com.kreasipositif.transactionservice.dto;

import com.kreasipositif.transactionservice.domain.Transaction;
import com.kreasipositif.transactionservice.exception.InvalidQueryException;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Immutable set of optional transaction filters. A {@code null} field places no constraint;
 * present fields are combined with AND.
 *
 * <ul>
 *   <li>{@code type}, {@code status}: exact, case-sensitive match on the enum name</li>
 *   <li>{@code clientId}, {@code recipientId}: exact match</li>
 *   <li>{@code minAmount}, {@code maxAmount}: inclusive bounds</li>
 *   <li>{@code startDate}, {@code endDate}: inclusive calendar bounds on the transaction date</li>
 * </ul>
 */
@Getter
@Builder
@ToString
public class TransactionFilter {

    public static final TransactionFilter NONE = TransactionFilter.builder().build();

    private final String type;
    private final Integer clientId;
    private final Integer recipientId;
    private final BigDecimal minAmount;
    private final BigDecimal maxAmount;
    private final LocalDate startDate;
    private final LocalDate endDate;
    private final String status;

    /**
     * @throws InvalidQueryException when an amount bound is negative
     */
    public void validate() {
        if (minAmount != null && minAmount.signum() < 0) {
            throw new InvalidQueryException("min_amount must be greater than or equal to 0");
        }
        if (maxAmount != null && maxAmount.signum() < 0) {
            throw new InvalidQueryException("max_amount must be greater than or equal to 0");
        }
    }

    public boolean matches(Transaction t) {
        if (type != null && !type.equals(t.getType().name())) {
            return false;
        }
        if (clientId != null && clientId != t.getClientId()) {
            return false;
        }
        if (recipientId != null && !recipientId.equals(t.getRecipientId())) {
            return false;
        }
        if (minAmount != null && t.getAmount().compareTo(minAmount) < 0) {
            return false;
        }
        if (maxAmount != null && t.getAmount().compareTo(maxAmount) > 0) {
            return false;
        }
        if (startDate != null && t.getDate().isBefore(startDate)) {
            return false;
        }
        if (endDate != null && t.getDate().isAfter(endDate)) {
            return false;
        }
        return status == null || status.equals(t.getStatus().name());
    }
}

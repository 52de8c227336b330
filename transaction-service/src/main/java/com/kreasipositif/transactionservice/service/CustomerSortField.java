package com.kreasipositif.transactionservice.service;

import com.kreasipositif.transactionservice.dto.Customer;
import com.kreasipositif.transactionservice.exception.InvalidQueryException;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.Collectors;

/**
 * Ranking keys accepted by {@code GET /api/customers/top}.
 */
public enum CustomerSortField {

    TOTAL_AMOUNT("total_amount", Comparator.comparing(Customer::getTotalAmount)),
    TOTAL_TRANSACTIONS("total_transactions", Comparator.comparingLong(Customer::getTotalTransactions));

    private final String parameter;
    private final Comparator<Customer> ascending;

    CustomerSortField(String parameter, Comparator<Customer> ascending) {
        this.parameter = parameter;
        this.ascending = ascending;
    }

    public String getParameter() {
        return parameter;
    }

    Comparator<Customer> descending() {
        return ascending.reversed();
    }

    public static CustomerSortField fromParameter(String value) {
        return Arrays.stream(values())
                .filter(f -> f.parameter.equals(value))
                .findFirst()
                .orElseThrow(() -> new InvalidQueryException("sort_by must be one of "
                        + Arrays.stream(values()).map(f -> f.parameter).collect(Collectors.joining(", "))
                        + " but was " + value));
    }
}

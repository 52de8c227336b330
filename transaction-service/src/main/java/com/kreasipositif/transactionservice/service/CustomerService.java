package com.kreasipositif.transactionservice.service;

import com.kreasipositif.transactionservice.domain.Transaction;
import com.kreasipositif.transactionservice.dto.Customer;
import com.kreasipositif.transactionservice.dto.CustomerSummary;
import com.kreasipositif.transactionservice.exception.InvalidQueryException;
import com.kreasipositif.transactionservice.store.TransactionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Per-customer aggregates over the visible transactions, keyed by sender client id.
 * A client with no visible transactions is not a customer.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CustomerService {

    static final int MAX_LIMIT = 100;

    private final TransactionStore store;

    /**
     * @return every customer, ascending by id
     */
    public List<Customer> getCustomers() {
        return aggregate(store.visibleTransactions());
    }

    public Optional<Customer> getCustomer(int id) {
        List<Transaction> sent = store.visibleTransactions().stream()
                .filter(t -> t.getClientId() == id)
                .toList();
        return aggregate(sent).stream().findFirst();
    }

    public List<CustomerSummary> getTopCustomers(int limit, CustomerSortField sortBy) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new InvalidQueryException("limit must be between 1 and " + MAX_LIMIT + " but was " + limit);
        }
        log.debug("Top {} customers by {}", limit, sortBy.getParameter());
        return aggregate(store.visibleTransactions()).stream()
                .sorted(sortBy.descending())
                .limit(limit)
                .map(CustomerSummary::from)
                .toList();
    }

    private List<Customer> aggregate(List<Transaction> transactions) {
        Map<Integer, StatsService.Accumulator> byClient = new TreeMap<>();
        transactions.forEach(t ->
                byClient.computeIfAbsent(t.getClientId(), k -> new StatsService.Accumulator()).add(t.getAmount()));

        return byClient.entrySet().stream()
                .map(e -> Customer.builder()
                        .id(e.getKey())
                        .totalTransactions(e.getValue().count)
                        .totalAmount(e.getValue().sum)
                        .averageAmount(e.getValue().average())
                        .cardsCount(store.cardsCount(e.getKey()))
                        .build())
                .toList();
    }
}

package com.kreasipositif.transactionservice.service;

import com.kreasipositif.transactionservice.domain.Transaction;
import com.kreasipositif.transactionservice.dto.PageQuery;
import com.kreasipositif.transactionservice.dto.PagedResponse;
import com.kreasipositif.transactionservice.dto.TransactionFilter;
import com.kreasipositif.transactionservice.exception.InvalidQueryException;
import com.kreasipositif.transactionservice.store.TransactionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Listing, search, lookup and soft delete over the visible transactions.
 *
 * <p>Every result list is ordered by date, newest first. The sort is stable, so
 * transactions sharing a date keep their derivation order.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TransactionQueryService {

    static final int MAX_LIMIT = 100;

    private static final Comparator<Transaction> NEWEST_FIRST =
            Comparator.comparing(Transaction::getDate).reversed();

    private final TransactionStore store;

    /**
     * Returns one page of the visible transactions matching {@code filter}.
     *
     * @throws InvalidQueryException when the filter holds a negative amount bound
     */
    public PagedResponse<Transaction> getTransactions(TransactionFilter filter, PageQuery pageQuery) {
        TransactionFilter effective = filter != null ? filter : TransactionFilter.NONE;
        effective.validate();

        List<Transaction> matching = select(effective::matches);
        log.debug("Listing {} with {} -> {} matches", pageQuery, effective, matching.size());
        return PagedResponse.of(matching, pageQuery);
    }

    /**
     * Free-text search: a transaction matches when {@code query} occurs, ignoring case, in its
     * description or its type. Filters are applied first.
     *
     * @param pageQuery {@code null} returns every match as a single page
     * @throws InvalidQueryException when the query is blank or the filter is invalid
     */
    public PagedResponse<Transaction> searchTransactions(String query, TransactionFilter filter, PageQuery pageQuery) {
        if (query == null || query.isBlank()) {
            throw new InvalidQueryException("query must not be blank");
        }
        TransactionFilter effective = filter != null ? filter : TransactionFilter.NONE;
        effective.validate();

        String needle = query.toLowerCase(Locale.ROOT);
        List<Transaction> matching = select(t -> effective.matches(t) && containsText(t, needle));
        log.debug("Search '{}' with {} -> {} matches", query, effective, matching.size());
        return pageQuery != null ? PagedResponse.of(matching, pageQuery) : PagedResponse.unpaged(matching);
    }

    public Optional<Transaction> getTransaction(int id) {
        return store.findVisible(id);
    }

    /** Distinct types of the visible transactions, in ascending lexical order. */
    public List<String> getTransactionTypes() {
        return store.visibleTransactions().stream()
                .map(t -> t.getType().name())
                .distinct()
                .sorted()
                .toList();
    }

    /**
     * @param limit number of transactions, 1..100
     */
    public List<Transaction> getRecentTransactions(int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new InvalidQueryException("limit must be between 1 and " + MAX_LIMIT);
        }
        return select(t -> true).stream().limit(limit).toList();
    }

    /** Transactions sent by {@code customerId}. */
    public List<Transaction> getTransactionsByCustomer(int customerId) {
        return select(t -> t.getClientId() == customerId);
    }

    /** Transactions received by {@code customerId}. */
    public List<Transaction> getTransactionsToCustomer(int customerId) {
        return select(t -> t.getRecipientId() != null && t.getRecipientId() == customerId);
    }

    /**
     * Soft-deletes a transaction that currently resolves.
     *
     * @return {@code true} when the transaction was visible and is now hidden; {@code false}
     *         when it never existed or was already deleted
     */
    public boolean deleteTransaction(int id) {
        if (!store.isVisible(id)) {
            return false;
        }
        return store.markDeleted(id);
    }

    private List<Transaction> select(Predicate<Transaction> predicate) {
        return store.visibleTransactions().stream()
                .filter(predicate)
                .sorted(NEWEST_FIRST)
                .toList();
    }

    private static boolean containsText(Transaction t, String needle) {
        if (t.getDescription() != null && t.getDescription().toLowerCase(Locale.ROOT).contains(needle)) {
            return true;
        }
        return t.getType().name().toLowerCase(Locale.ROOT).contains(needle);
    }
}

package com.kreasipositif.transactionservice.store;

import com.kreasipositif.transactionservice.domain.Transaction;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds the derived transactions for the lifetime of the process, plus the set of ids that
 * have been soft-deleted.
 *
 * <p>The transaction list is immutable once constructed; the only mutable state is the
 * deletion set, a concurrent add-only set. Every read computes visibility against the
 * current deletion set, so nothing can go stale after a delete.
 */
@Slf4j
public class TransactionStore {

    private final List<Transaction> transactions;
    private final Map<Integer, Transaction> byId;
    private final Map<Integer, Long> cardsPerClient;
    private final Set<Integer> deletedIds = ConcurrentHashMap.newKeySet();

    /**
     * @param transactions   derived transactions in derivation order; ids must be unique
     * @param cardsPerClient number of source cards per client id
     * @throws IllegalArgumentException when two transactions share an id
     */
    public TransactionStore(Collection<Transaction> transactions, Map<Integer, Long> cardsPerClient) {
        this.transactions = List.copyOf(transactions);
        Map<Integer, Transaction> index = new LinkedHashMap<>();
        for (Transaction t : this.transactions) {
            if (index.putIfAbsent(t.getId(), t) != null) {
                throw new IllegalArgumentException("Duplicate transaction id " + t.getId());
            }
        }
        this.byId = Map.copyOf(index);
        this.cardsPerClient = Map.copyOf(cardsPerClient);
    }

    /** Every derived transaction, deleted or not, in derivation order. */
    public List<Transaction> allTransactions() {
        return transactions;
    }

    /** Snapshot of the transactions not currently deleted, in derivation order. */
    public List<Transaction> visibleTransactions() {
        if (deletedIds.isEmpty()) {
            return transactions;
        }
        return transactions.stream()
                .filter(t -> !deletedIds.contains(t.getId()))
                .toList();
    }

    public boolean isVisible(int id) {
        return byId.containsKey(id) && !deletedIds.contains(id);
    }

    public Optional<Transaction> findVisible(int id) {
        return isVisible(id) ? Optional.of(byId.get(id)) : Optional.empty();
    }

    /**
     * Marks a transaction as deleted. Deletion only hides the record.
     *
     * @param id transaction id
     * @return {@code true} on the first deletion of an existing id; {@code false} when the id
     *         was already deleted or never existed
     */
    public boolean markDeleted(int id) {
        if (!byId.containsKey(id)) {
            return false;
        }
        boolean added = deletedIds.add(id);
        if (added) {
            log.info("Transaction {} marked as deleted", id);
        }
        return added;
    }

    /** Clears the deletion set. Intended for tests only. */
    public void resetDeletions() {
        deletedIds.clear();
    }

    public int deletedCount() {
        return deletedIds.size();
    }

    /** Number of source cards owned by {@code clientId}, 0 when unknown. */
    public long cardsCount(int clientId) {
        return cardsPerClient.getOrDefault(clientId, 0L);
    }
}

package com.kreasipositif.transactionservice.store;

import com.kreasipositif.transactionservice.domain.Transaction;
import com.kreasipositif.transactionservice.domain.TransactionType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.kreasipositif.transactionservice.TransactionFixtures.tx;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TransactionStoreTest {

    private final TransactionStore store = new TransactionStore(List.of(
            tx(100, 1, 2, "10.00", TransactionType.PURCHASE),
            tx(101, 1, 3, "20.00", TransactionType.PURCHASE),
            tx(200, 2, 1, "30.00", TransactionType.PAYMENT)),
            Map.of(1, 2L, 2, 1L));

    @Test
    void deletedTransactionIsHidden() {
        assertThat(store.markDeleted(101)).isTrue();

        assertThat(store.isVisible(101)).isFalse();
        assertThat(store.findVisible(101)).isEmpty();
        assertThat(store.visibleTransactions()).extracting(Transaction::getId).containsExactly(100, 200);
        assertThat(store.allTransactions()).hasSize(3);
        assertThat(store.deletedCount()).isEqualTo(1);
    }

    @Test
    void deletionIsIdempotent() {
        assertThat(store.markDeleted(100)).isTrue();
        assertThat(store.markDeleted(100)).isFalse();
        assertThat(store.markDeleted(999)).isFalse();
        assertThat(store.deletedCount()).isEqualTo(1);
    }

    @Test
    void resetRestoresVisibility() {
        store.markDeleted(200);
        store.resetDeletions();

        assertThat(store.findVisible(200)).isPresent();
        assertThat(store.visibleTransactions()).hasSize(3);
    }

    @Test
    void cardsCountDefaultsToZero() {
        assertThat(store.cardsCount(1)).isEqualTo(2);
        assertThat(store.cardsCount(42)).isZero();
    }

    @Test
    void duplicateIdsAreRejected() {
        var duplicates = List.of(
                tx(100, 1, 2, "10.00", TransactionType.PURCHASE),
                tx(100, 3, 4, "11.00", TransactionType.PAYMENT));

        assertThatThrownBy(() -> new TransactionStore(duplicates, Map.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("100");
    }
}

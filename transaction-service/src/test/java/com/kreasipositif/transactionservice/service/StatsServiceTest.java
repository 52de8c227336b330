package com.kreasipositif.transactionservice.service;

import com.kreasipositif.transactionservice.domain.TransactionStatus;
import com.kreasipositif.transactionservice.domain.TransactionType;
import com.kreasipositif.transactionservice.dto.AmountDistribution;
import com.kreasipositif.transactionservice.dto.DailyStats;
import com.kreasipositif.transactionservice.dto.PageQuery;
import com.kreasipositif.transactionservice.dto.StatsByType;
import com.kreasipositif.transactionservice.dto.TransactionFilter;
import com.kreasipositif.transactionservice.store.TransactionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static com.kreasipositif.transactionservice.TransactionFixtures.storeOf;
import static com.kreasipositif.transactionservice.TransactionFixtures.tx;
import static org.assertj.core.api.Assertions.assertThat;

class StatsServiceTest {

    private static final LocalDate DAY_1 = LocalDate.of(2024, 5, 1);
    private static final LocalDate DAY_2 = LocalDate.of(2024, 5, 2);

    private TransactionStore store;
    private StatsService service;

    @BeforeEach
    void setUp() {
        store = storeOf(List.of(
                tx(100, 1, 2, "50.00", TransactionType.PURCHASE, DAY_1, TransactionStatus.PENDING),
                tx(101, 1, 3, "100.00", TransactionType.PURCHASE, DAY_1, TransactionStatus.COMPLETED),
                tx(102, 1, 3, "10.00", TransactionType.PURCHASE, DAY_2, TransactionStatus.COMPLETED),
                tx(200, 2, 1, "999.99", TransactionType.PAYMENT, DAY_2, TransactionStatus.PENDING),
                tx(300, 3, 1, "20000.00", TransactionType.TRANSFER, DAY_2, TransactionStatus.COMPLETED)));
        service = new StatsService(store);
    }

    @Test
    void overviewSummarisesVisibleTransactions() {
        var overview = service.getOverview();

        assertThat(overview.getTotalTransactions()).isEqualTo(5);
        assertThat(overview.getTotalAmount()).isEqualByComparingTo("21159.99");
        assertThat(overview.getAverageAmount()).isEqualByComparingTo("4232.00");
        assertThat(overview.getMinAmount()).isEqualByComparingTo("10.00");
        assertThat(overview.getMaxAmount()).isEqualByComparingTo("20000.00");
        assertThat(overview.getUniqueCustomers()).isEqualTo(3);
        assertThat(overview.getTransactionsByStatus()).containsExactly(
                Map.entry("COMPLETED", 3L), Map.entry("PENDING", 2L));
    }

    @Test
    void overviewTotalEqualsUnfilteredQueryTotal() {
        store.markDeleted(300);
        var query = new TransactionQueryService(store);

        assertThat(service.getOverview().getTotalTransactions())
                .isEqualTo(query.getTransactions(TransactionFilter.NONE, new PageQuery(1, 10)).getTotal());
    }

    @Test
    void overviewOfNothingIsAllZero() {
        var empty = new StatsService(storeOf(List.of())).getOverview();

        assertThat(empty.getTotalTransactions()).isZero();
        assertThat(empty.getTotalAmount()).isEqualByComparingTo("0");
        assertThat(empty.getAverageAmount()).isEqualByComparingTo("0");
        assertThat(empty.getUniqueCustomers()).isZero();
        assertThat(empty.getTransactionsByStatus()).isEmpty();
    }

    @Test
    void distributionUsesHalfOpenBuckets() {
        var buckets = service.getAmountDistribution();

        assertThat(buckets).extracting(AmountDistribution::getRange)
                .containsExactly("0-100", "100-500", "500-1000", "1000-5000", "5000-10000", "10000+");
        // 100.00 falls into 100-500, 999.99 into 500-1000
        assertThat(buckets).extracting(AmountDistribution::getCount).containsExactly(2L, 1L, 1L, 0L, 0L, 1L);
        assertThat(buckets.get(0).getPercentage()).isEqualTo(40.0);
        assertThat(buckets.stream().mapToLong(AmountDistribution::getCount).sum()).isEqualTo(5);
    }

    @Test
    void distributionOfNothingIsEmpty() {
        assertThat(new StatsService(storeOf(List.of())).getAmountDistribution()).isEmpty();
    }

    @Test
    void byTypeIsOrderedByCount() {
        var stats = service.getStatsByType();

        assertThat(stats).extracting(StatsByType::getType).startsWith(TransactionType.PURCHASE);
        StatsByType purchase = stats.get(0);
        assertThat(purchase.getCount()).isEqualTo(3);
        assertThat(purchase.getTotalAmount()).isEqualByComparingTo("160.00");
        assertThat(purchase.getAverageAmount()).isEqualByComparingTo("53.33");
        assertThat(purchase.getPercentage()).isEqualTo(60.0);
        assertThat(stats).hasSize(3);
    }

    @Test
    void dailyIsNewestFirst() {
        var daily = service.getDailyStats();

        assertThat(daily).extracting(DailyStats::getDate).containsExactly(DAY_2, DAY_1);
        assertThat(daily.get(0).getCount()).isEqualTo(3);
        assertThat(daily.get(0).getTotalAmount()).isEqualByComparingTo("21009.99");
        assertThat(daily.get(1).getAverageAmount()).isEqualByComparingTo("75.00");
    }

    @Test
    void deletedTransactionsAreExcluded() {
        store.markDeleted(300);

        assertThat(service.getOverview().getMaxAmount()).isEqualByComparingTo("999.99");
        assertThat(service.getStatsByType()).extracting(StatsByType::getType).doesNotContain(TransactionType.TRANSFER);
    }
}

package com.kreasipositif.transactionservice.service;

import com.kreasipositif.transactionservice.domain.Transaction;
import com.kreasipositif.transactionservice.domain.TransactionStatus;
import com.kreasipositif.transactionservice.domain.TransactionType;
import com.kreasipositif.transactionservice.dto.AmountDistribution;
import com.kreasipositif.transactionservice.dto.DailyStats;
import com.kreasipositif.transactionservice.dto.StatsByType;
import com.kreasipositif.transactionservice.dto.StatsOverview;
import com.kreasipositif.transactionservice.store.TransactionStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregate statistics over the visible transactions. Every method is total over an empty
 * visible set.
 */
@Service
@RequiredArgsConstructor
public class StatsService {

    /**
     * Amount ranges, lower bound inclusive, upper bound exclusive; the last range is open.
     */
    private static final List<AmountBucket> BUCKETS = List.of(
            new AmountBucket(0, 100),
            new AmountBucket(100, 500),
            new AmountBucket(500, 1000),
            new AmountBucket(1000, 5000),
            new AmountBucket(5000, 10000),
            new AmountBucket(10000, null));

    private final TransactionStore store;

    public StatsOverview getOverview() {
        List<Transaction> visible = store.visibleTransactions();
        if (visible.isEmpty()) {
            return StatsOverview.builder()
                    .totalTransactions(0)
                    .totalAmount(BigDecimal.ZERO)
                    .averageAmount(BigDecimal.ZERO)
                    .minAmount(BigDecimal.ZERO)
                    .maxAmount(BigDecimal.ZERO)
                    .uniqueCustomers(0)
                    .transactionsByStatus(Map.of())
                    .build();
        }

        BigDecimal total = BigDecimal.ZERO;
        BigDecimal min = null;
        BigDecimal max = null;
        Map<TransactionStatus, Long> byStatus = new EnumMap<>(TransactionStatus.class);
        for (Transaction t : visible) {
            BigDecimal amount = t.getAmount();
            total = total.add(amount);
            min = min == null || amount.compareTo(min) < 0 ? amount : min;
            max = max == null || amount.compareTo(max) > 0 ? amount : max;
            byStatus.merge(t.getStatus(), 1L, Long::sum);
        }
        long uniqueCustomers = visible.stream().mapToInt(Transaction::getClientId).distinct().count();

        Map<String, Long> statusCounts = new LinkedHashMap<>();
        byStatus.entrySet().stream()
                .sorted(Map.Entry.<TransactionStatus, Long>comparingByValue().reversed())
                .forEach(e -> statusCounts.put(e.getKey().name(), e.getValue()));

        return StatsOverview.builder()
                .totalTransactions(visible.size())
                .totalAmount(total)
                .averageAmount(StatsMath.average(total, visible.size()))
                .minAmount(min)
                .maxAmount(max)
                .uniqueCustomers(uniqueCustomers)
                .transactionsByStatus(statusCounts)
                .build();
    }

    /**
     * @return one entry per fixed amount range, or an empty list when nothing is visible
     */
    public List<AmountDistribution> getAmountDistribution() {
        List<Transaction> visible = store.visibleTransactions();
        if (visible.isEmpty()) {
            return List.of();
        }
        List<AmountDistribution> result = new ArrayList<>(BUCKETS.size());
        for (AmountBucket bucket : BUCKETS) {
            long count = visible.stream().filter(t -> bucket.contains(t.getAmount())).count();
            result.add(AmountDistribution.builder()
                    .range(bucket.label())
                    .count(count)
                    .percentage(StatsMath.percentage(count, visible.size()))
                    .build());
        }
        return result;
    }

    /**
     * @return per-type statistics, most frequent type first
     */
    public List<StatsByType> getStatsByType() {
        List<Transaction> visible = store.visibleTransactions();
        Map<TransactionType, Accumulator> groups = new TreeMap<>(Comparator.comparing(TransactionType::name));
        visible.forEach(t -> groups.computeIfAbsent(t.getType(), k -> new Accumulator()).add(t.getAmount()));

        return groups.entrySet().stream()
                .map(e -> StatsByType.builder()
                        .type(e.getKey())
                        .count(e.getValue().count)
                        .totalAmount(e.getValue().sum)
                        .averageAmount(e.getValue().average())
                        .percentage(StatsMath.percentage(e.getValue().count, visible.size()))
                        .build())
                .sorted(Comparator.comparingLong(StatsByType::getCount).reversed())
                .toList();
    }

    /**
     * @return per-day statistics, most recent day first
     */
    public List<DailyStats> getDailyStats() {
        Map<LocalDate, Accumulator> days = new TreeMap<>(Comparator.reverseOrder());
        store.visibleTransactions()
                .forEach(t -> days.computeIfAbsent(t.getDate(), k -> new Accumulator()).add(t.getAmount()));

        return days.entrySet().stream()
                .map(e -> DailyStats.builder()
                        .date(e.getKey())
                        .count(e.getValue().count)
                        .totalAmount(e.getValue().sum)
                        .averageAmount(e.getValue().average())
                        .build())
                .toList();
    }

    private record AmountBucket(int lower, Integer upper) {

        boolean contains(BigDecimal amount) {
            if (amount.compareTo(BigDecimal.valueOf(lower)) < 0) {
                return false;
            }
            return upper == null || amount.compareTo(BigDecimal.valueOf(upper)) < 0;
        }

        String label() {
            return upper == null ? lower + "+" : lower + "-" + upper;
        }
    }

    static final class Accumulator {
        long count;
        BigDecimal sum = BigDecimal.ZERO;

        void add(BigDecimal amount) {
            count++;
            sum = sum.add(amount);
        }

        BigDecimal average() {
            return StatsMath.average(sum, count);
        }
    }
}

package com.kreasipositif.transactionservice.service;

import com.kreasipositif.transactionservice.domain.Transaction;
import com.kreasipositif.transactionservice.domain.TransactionType;
import com.kreasipositif.transactionservice.dto.FraudByType;
import com.kreasipositif.transactionservice.dto.FraudPrediction;
import com.kreasipositif.transactionservice.dto.FraudPredictionRequest;
import com.kreasipositif.transactionservice.dto.FraudSummary;
import com.kreasipositif.transactionservice.store.TransactionStore;
import io.github.resilience4j.bulkhead.Bulkhead;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Heuristic fraud detection.
 *
 * <h3>Heuristics, evaluated against the visible transactions {@code D}</h3>
 * <ol>
 *   <li>amount above the 95th percentile of amounts in {@code D}</li>
 *   <li>more than 50 transactions in {@code D} sent by the same client</li>
 *   <li>a TRANSFER above 10 000</li>
 *   <li>more than 20 transactions in {@code D} from the same client to the same recipient</li>
 * </ol>
 *
 * <p>One reason makes a transaction <em>suspicious</em>; two or more make it <em>flagged</em>,
 * and only flagged amounts count as at risk. Percentiles and counts are rebuilt from the
 * current visible set on every call, so deletions are reflected immediately.
 *
 * <p>Summary and per-type scans run through the {@code fraudScoringBulkhead}; a
 * {@link io.github.resilience4j.bulkhead.BulkheadFullException} propagates to the caller when
 * too many scans are already running.
 */
@Slf4j
@Service
public class FraudDetectionService {

    static final BigDecimal P95 = new BigDecimal("0.95");
    static final BigDecimal P99 = new BigDecimal("0.99");
    static final long CLIENT_FREQUENCY_LIMIT = 50;
    static final long SAME_RECIPIENT_LIMIT = 20;
    static final BigDecimal LARGE_TRANSFER = BigDecimal.valueOf(10_000);
    static final String NO_REASON = "No suspicious patterns detected";

    private final TransactionStore store;
    private final Bulkhead fraudScoringBulkhead;

    public FraudDetectionService(TransactionStore store,
                                 @Qualifier("fraudScoringBulkhead") Bulkhead fraudScoringBulkhead) {
        this.store = store;
        this.fraudScoringBulkhead = fraudScoringBulkhead;
    }

    public FraudSummary getFraudSummary() {
        return fraudScoringBulkhead.executeSupplier(this::computeSummary);
    }

    /**
     * @return fraud counts per type, most flagged type first
     */
    public List<FraudByType> getFraudByType() {
        return fraudScoringBulkhead.executeSupplier(this::computeByType);
    }

    /**
     * Scores a hypothetical transaction. The transaction is not added to {@code D}: client and
     * recipient counts only cover what is already stored and visible.
     */
    public FraudPrediction predict(FraudPredictionRequest request) {
        ScoringContext context = ScoringContext.of(store.visibleTransactions());
        List<String> reasons = context.reasons(
                request.getAmount(), request.getClientId(), request.getRecipientId(),
                TransactionType.TRANSFER.name().equals(request.getTransactionType()));

        double riskScore = reasons.size() * 25.0;
        if (context.p95.map(p -> request.getAmount().compareTo(p) > 0).orElse(false)) {
            riskScore += 20.0;
        }
        if (context.p99.map(p -> request.getAmount().compareTo(p) > 0).orElse(false)) {
            riskScore += 30.0;
        }
        riskScore = Math.min(riskScore, 100.0);
        double confidence = reasons.isEmpty() ? 10.0 : Math.min(reasons.size() * 30.0, 100.0);

        log.debug("Prediction for client {} amount {} -> {} reasons, risk {}",
                request.getClientId(), request.getAmount(), reasons.size(), riskScore);

        return FraudPrediction.builder()
                .suspicious(!reasons.isEmpty())
                .riskScore(StatsMath.round2(riskScore))
                .reasons(reasons.isEmpty() ? List.of(NO_REASON) : reasons)
                .confidence(StatsMath.round2(confidence))
                .build();
    }

    private FraudSummary computeSummary() {
        List<Transaction> visible = store.visibleTransactions();
        ScoringContext context = ScoringContext.of(visible);

        long suspicious = 0;
        long flagged = 0;
        BigDecimal atRisk = BigDecimal.ZERO;
        for (Transaction t : visible) {
            int reasons = context.reasons(t).size();
            if (reasons >= 1) {
                suspicious++;
            }
            if (reasons >= 2) {
                flagged++;
                atRisk = atRisk.add(t.getAmount());
            }
        }
        log.debug("Fraud summary over {} transactions: {} suspicious, {} flagged", visible.size(), suspicious, flagged);

        return FraudSummary.builder()
                .totalSuspicious(suspicious)
                .totalFlagged(flagged)
                .fraudRate(StatsMath.percentage(suspicious, visible.size()))
                .totalAmountAtRisk(atRisk.setScale(2, RoundingMode.HALF_UP))
                .build();
    }

    private List<FraudByType> computeByType() {
        List<Transaction> visible = store.visibleTransactions();
        ScoringContext context = ScoringContext.of(visible);

        Map<TransactionType, long[]> counts = new TreeMap<>(Comparator.comparing(TransactionType::name));
        Map<TransactionType, BigDecimal> totals = new HashMap<>();
        for (Transaction t : visible) {
            int reasons = context.reasons(t).size();
            long[] c = counts.computeIfAbsent(t.getType(), k -> new long[2]);
            if (reasons >= 1) {
                c[0]++;
            }
            if (reasons >= 2) {
                c[1]++;
            }
            totals.merge(t.getType(), t.getAmount(), BigDecimal::add);
        }

        return counts.entrySet().stream()
                .map(e -> FraudByType.builder()
                        .type(e.getKey())
                        .suspiciousCount(e.getValue()[0])
                        .flaggedCount(e.getValue()[1])
                        .totalAmount(totals.get(e.getKey()).setScale(2, RoundingMode.HALF_UP))
                        .build())
                .sorted(Comparator.comparingLong(FraudByType::getFlaggedCount).reversed())
                .toList();
    }

    /**
     * Thresholds and counts derived once from a visible-set snapshot.
     */
    static final class ScoringContext {

        private final Optional<BigDecimal> p95;
        private final Optional<BigDecimal> p99;
        private final Map<Integer, Long> perClient;
        private final Map<ClientRecipient, Long> perPair;

        private ScoringContext(Optional<BigDecimal> p95, Optional<BigDecimal> p99,
                               Map<Integer, Long> perClient, Map<ClientRecipient, Long> perPair) {
            this.p95 = p95;
            this.p99 = p99;
            this.perClient = perClient;
            this.perPair = perPair;
        }

        static ScoringContext of(List<Transaction> visible) {
            List<BigDecimal> amounts = visible.stream().map(Transaction::getAmount).toList();
            Map<Integer, Long> perClient = new HashMap<>();
            Map<ClientRecipient, Long> perPair = new HashMap<>();
            for (Transaction t : visible) {
                perClient.merge(t.getClientId(), 1L, Long::sum);
                if (t.getRecipientId() != null) {
                    perPair.merge(new ClientRecipient(t.getClientId(), t.getRecipientId()), 1L, Long::sum);
                }
            }
            return new ScoringContext(
                    StatsMath.percentile(amounts, P95),
                    StatsMath.percentile(amounts, P99),
                    perClient,
                    perPair);
        }

        List<String> reasons(Transaction t) {
            return reasons(t.getAmount(), t.getClientId(), t.getRecipientId(), t.getType() == TransactionType.TRANSFER);
        }

        List<String> reasons(BigDecimal amount, int clientId, Integer recipientId, boolean transfer) {
            List<String> reasons = new ArrayList<>(4);
            if (p95.isPresent() && amount.compareTo(p95.get()) > 0) {
                reasons.add("Amount %s exceeds threshold %s".formatted(
                        amount.setScale(2, RoundingMode.HALF_UP).toPlainString(),
                        p95.get().setScale(2, RoundingMode.HALF_UP).toPlainString()));
            }
            if (perClient.getOrDefault(clientId, 0L) > CLIENT_FREQUENCY_LIMIT) {
                reasons.add("High transaction frequency for this client");
            }
            if (transfer && amount.compareTo(LARGE_TRANSFER) > 0) {
                reasons.add("Large transfer transaction");
            }
            if (recipientId != null
                    && perPair.getOrDefault(new ClientRecipient(clientId, recipientId), 0L) > SAME_RECIPIENT_LIMIT) {
                reasons.add("Repeated transactions to same recipient");
            }
            return reasons;
        }
    }

    private record ClientRecipient(int clientId, int recipientId) {
    }
}

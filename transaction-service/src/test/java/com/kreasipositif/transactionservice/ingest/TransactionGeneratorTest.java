package com.kreasipositif.transactionservice.ingest;

import com.kreasipositif.transactionservice.domain.RawCard;
import com.kreasipositif.transactionservice.domain.Transaction;
import com.kreasipositif.transactionservice.domain.TransactionStatus;
import com.kreasipositif.transactionservice.domain.TransactionType;
import com.kreasipositif.transactionservice.exception.CardSourceException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TransactionGeneratorTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2024-06-15T12:00:00Z"), ZoneOffset.UTC);

    private final TransactionGenerator generator = new TransactionGenerator(FIXED);

    // ─── Derivation rules ─────────────────────────────────────────────────────

    @Test
    void creditCardTenDerivesFourPayments() {
        var txs = generator.generate(List.of(card(10, 5, "2000.00", "Credit")));

        assertThat(txs).hasSize(4);
        assertThat(txs).extracting(Transaction::getId).containsExactly(1000, 1001, 1002, 1003);
        assertThat(txs).allSatisfy(t -> {
            assertThat(t.getType()).isEqualTo(TransactionType.PAYMENT);
            assertThat(t.getAmount()).isEqualByComparingTo("22.00");
            assertThat(t.getClientId()).isEqualTo(5);
            assertThat(t.getCardId()).isEqualTo(10);
            assertThat(t.getCardBrand()).isEqualTo("Visa");
        });
        assertThat(txs.get(0).getStatus()).isEqualTo(TransactionStatus.PENDING);
        assertThat(txs.subList(1, 4)).extracting(Transaction::getStatus).containsOnly(TransactionStatus.COMPLETED);
        assertThat(txs).extracting(Transaction::getRecipientId).containsExactly(105, 106, 107, 108);
        assertThat(txs.get(0).getDescription()).isEqualTo("Transaction 1 for card 10");
    }

    @Test
    void datesStepBackFromTheClock() {
        var txs = generator.generate(List.of(card(10, 5, "2000.00", "Credit")));
        LocalDate today = LocalDate.of(2024, 6, 15);

        // days_ago = 70, 73, 76, 79
        assertThat(txs).extracting(Transaction::getDate).containsExactly(
                today.minusDays(70), today.minusDays(73), today.minusDays(76), today.minusDays(79));
        assertThat(txs).allSatisfy(t -> assertThat(t.getTimestamp().toLocalDate()).isEqualTo(t.getDate()));
    }

    @Test
    void countDependsOnCardIdModThree() {
        assertThat(generator.generate(List.of(card(9, 1, "100", "Debit")))).hasSize(3);
        assertThat(generator.generate(List.of(card(11, 1, "100", "Debit")))).hasSize(5);
    }

    @Test
    void amountScalesWithCardId() {
        assertThat(TransactionGenerator.amountFor(card(49, 1, "1000", "Debit"))).isEqualByComparingTo("50.00");
        assertThat(TransactionGenerator.amountFor(card(50, 1, "1000", "Debit"))).isEqualByComparingTo("1.00");
        assertThat(TransactionGenerator.amountFor(card(4524, 825, "24295", "Debit"))).isEqualByComparingTo("607.38");
    }

    @Test
    void cardTypeMapsToTransactionType() {
        assertThat(TransactionType.fromCardType("Debit")).isEqualTo(TransactionType.PURCHASE);
        assertThat(TransactionType.fromCardType("Debit (Prepaid)")).isEqualTo(TransactionType.PURCHASE);
        assertThat(TransactionType.fromCardType("credit")).isEqualTo(TransactionType.PAYMENT);
        assertThat(TransactionType.fromCardType("Charge")).isEqualTo(TransactionType.TRANSFER);
        assertThat(TransactionType.fromCardType(null)).isEqualTo(TransactionType.TRANSFER);
    }

    @Test
    void recipientNeverEqualsClient() {
        assertThat(TransactionGenerator.recipientFor(5, 0)).isEqualTo(105);
        assertThat(TransactionGenerator.recipientFor(9950, 0)).isEqualTo(50);
        // 100 + 9900 wraps back onto the client itself
        assertThat(TransactionGenerator.recipientFor(42, 9900)).isEqualTo(43);
        assertThat(TransactionGenerator.recipientFor(9999, 9900)).isEqualTo(0);

        var txs = generator.generate(List.of(card(1, 9900, "500", "Debit"), card(2, 0, "500", "Credit")));
        assertThat(txs).allSatisfy(t -> assertThat(t.getRecipientId()).isNotEqualTo(t.getClientId()));
    }

    // ─── Determinism and failures ─────────────────────────────────────────────

    @Test
    void sameInputYieldsSameTransactions() {
        var cards = List.of(card(10, 5, "2000.00", "Credit"), card(4524, 825, "24295", "Debit"));

        assertThat(generator.generate(cards)).isEqualTo(new TransactionGenerator(FIXED).generate(cards));
    }

    @Test
    void noCardsIsSourceEmpty() {
        assertThatThrownBy(() -> generator.generate(List.of()))
                .isInstanceOf(CardSourceException.class)
                .extracting("kind").isEqualTo(CardSourceException.Kind.SOURCE_EMPTY);
    }

    @Test
    void duplicateCardIdIsRejected() {
        var cards = List.of(card(10, 5, "2000", "Credit"), card(10, 6, "100", "Debit"));

        assertThatThrownBy(() -> generator.generate(cards))
                .isInstanceOf(CardSourceException.class)
                .hasMessageContaining("Duplicate card id 10")
                .extracting("kind").isEqualTo(CardSourceException.Kind.SOURCE_UNAVAILABLE);
    }

    private static RawCard card(int id, int clientId, String limit, String type) {
        return RawCard.builder()
                .id(id)
                .clientId(clientId)
                .creditLimit(new BigDecimal(limit))
                .cardType(type)
                .cardBrand("Visa")
                .build();
    }
}

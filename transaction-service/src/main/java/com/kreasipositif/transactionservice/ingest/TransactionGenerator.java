package com.kreasipositif.transactionservice.ingest;

import com.kreasipositif.transactionservice.domain.RawCard;
import com.kreasipositif.transactionservice.domain.Transaction;
import com.kreasipositif.transactionservice.domain.TransactionStatus;
import com.kreasipositif.transactionservice.domain.TransactionType;
import com.kreasipositif.transactionservice.exception.CardSourceException;
import com.kreasipositif.transactionservice.exception.CardSourceException.Kind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Expands card records into a deterministic set of synthetic transactions.
 *
 * <h3>Per card (index {@code i} = 0-based position inside the card's batch)</h3>
 * <ul>
 *   <li>count = 3 + (card_id mod 3)</li>
 *   <li>days_ago = (card_id * 7 + i * 3) mod 730, subtracted from a single {@code now}</li>
 *   <li>amount = credit_limit * (0.001 + (card_id mod 50) / 1000), rounded half-up to cents</li>
 *   <li>recipient = (client_id + 100 + i) mod 10000, bumped by one when it equals client_id</li>
 *   <li>id = card_id * 100 + i; PENDING when i mod 10 == 0, COMPLETED otherwise</li>
 * </ul>
 *
 * <p>No randomness is involved: the same cards and the same {@link Clock} instant always
 * yield the same transactions.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TransactionGenerator {

    static final int RECIPIENT_SPACE = 10_000;
    static final int HISTORY_DAYS = 730;

    private final Clock clock;

    /**
     * Derives the transactions of every card, in card order.
     *
     * @param cards card records read from the CSV
     * @return derived transactions; ids are unique
     * @throws CardSourceException {@code SOURCE_EMPTY} when there are no cards,
     *                             {@code SOURCE_UNAVAILABLE} when two cards share an id
     */
    public List<Transaction> generate(List<RawCard> cards) {
        if (cards == null || cards.isEmpty()) {
            throw new CardSourceException(Kind.SOURCE_EMPTY, "No card records to derive transactions from");
        }
        LocalDateTime now = LocalDateTime.now(clock);
        Set<Integer> seenCardIds = new HashSet<>();
        List<Transaction> transactions = new ArrayList<>();

        for (RawCard card : cards) {
            if (!seenCardIds.add(card.getId())) {
                throw new CardSourceException(Kind.SOURCE_UNAVAILABLE, "Duplicate card id " + card.getId());
            }
            transactions.addAll(deriveFromCard(card, now));
        }
        log.debug("Derived {} transactions from {} cards", transactions.size(), cards.size());
        return transactions;
    }

    List<Transaction> deriveFromCard(RawCard card, LocalDateTime now) {
        int cardId = card.getId();
        int count = 3 + Math.floorMod(cardId, 3);
        BigDecimal amount = amountFor(card);
        TransactionType type = TransactionType.fromCardType(card.getCardType());

        List<Transaction> result = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int daysAgo = Math.floorMod(cardId * 7 + i * 3, HISTORY_DAYS);
            LocalDateTime timestamp = now.minusDays(daysAgo);

            result.add(Transaction.builder()
                    .id(cardId * 100 + i)
                    .clientId(card.getClientId())
                    .recipientId(recipientFor(card.getClientId(), i))
                    .amount(amount)
                    .type(type)
                    .date(timestamp.toLocalDate())
                    .timestamp(timestamp)
                    .cardId(cardId)
                    .cardBrand(card.getCardBrand())
                    .status(i % 10 == 0 ? TransactionStatus.PENDING : TransactionStatus.COMPLETED)
                    .description("Transaction " + (i + 1) + " for card " + cardId)
                    .build());
        }
        return result;
    }

    static BigDecimal amountFor(RawCard card) {
        // 0.001 + (id mod 50) / 1000 == (1 + id mod 50) / 1000
        BigDecimal multiplier = BigDecimal.valueOf(1 + Math.floorMod(card.getId(), 50)).movePointLeft(3);
        return card.getCreditLimit().multiply(multiplier).setScale(2, RoundingMode.HALF_UP);
    }

    static int recipientFor(int clientId, int index) {
        int recipient = Math.floorMod(clientId + 100 + index, RECIPIENT_SPACE);
        if (recipient == clientId) {
            recipient = Math.floorMod(recipient + 1, RECIPIENT_SPACE);
        }
        return recipient;
    }
}

package com.kreasipositif.transactionservice.config;

import com.kreasipositif.transactionservice.domain.RawCard;
import com.kreasipositif.transactionservice.domain.Transaction;
import com.kreasipositif.transactionservice.ingest.CardCsvReader;
import com.kreasipositif.transactionservice.ingest.TransactionGenerator;
import com.kreasipositif.transactionservice.store.TransactionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds the in-memory {@link TransactionStore} while the application context starts.
 *
 * <pre>
 *  card CSV ─► CardCsvReader ─► List&lt;RawCard&gt; ─► TransactionGenerator ─► TransactionStore
 * </pre>
 *
 * <p>Any {@link com.kreasipositif.transactionservice.exception.CardSourceException} raised here
 * propagates out of bean creation, so the service never starts without data.
 */
@Slf4j
@Configuration
public class TransactionStoreConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public TransactionStore transactionStore(CardCsvReader cardCsvReader,
                                             TransactionGenerator transactionGenerator,
                                             CardDataProperties cardDataProperties) {
        log.info("Loading card data from '{}'", cardDataProperties.getCsvPath());
        List<RawCard> cards = cardCsvReader.readAll(cardDataProperties.getCsvPath());
        List<Transaction> transactions = transactionGenerator.generate(cards);

        Map<Integer, Long> cardsPerClient = cards.stream()
                .collect(Collectors.groupingBy(RawCard::getClientId, Collectors.counting()));

        log.info("Loaded {} transactions from {} cards ({} clients)",
                transactions.size(), cards.size(), cardsPerClient.size());
        return new TransactionStore(transactions, cardsPerClient);
    }
}

package com.kreasipositif.transactionservice.service;

import com.kreasipositif.transactionservice.config.BankingApiProperties;
import com.kreasipositif.transactionservice.config.CardDataProperties;
import com.kreasipositif.transactionservice.domain.TransactionType;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static com.kreasipositif.transactionservice.TransactionFixtures.storeOf;
import static com.kreasipositif.transactionservice.TransactionFixtures.tx;
import static org.assertj.core.api.Assertions.assertThat;

class SystemServiceTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2024-06-15T12:00:00Z"), ZoneOffset.UTC);

    @Test
    void healthAndMetadataCountTheWholeDerivedSet() {
        var store = storeOf(List.of(
                tx(100, 1, 2, "10.00", TransactionType.PURCHASE),
                tx(101, 1, 2, "10.00", TransactionType.PURCHASE),
                tx(200, 2, 1, "10.00", TransactionType.PAYMENT)));
        store.markDeleted(200);
        var properties = new BankingApiProperties();
        properties.setEnvironment("prod");
        var service = new SystemService(store, properties, new CardDataProperties(), FIXED);

        var health = service.getHealth();
        assertThat(health.getStatus()).isEqualTo("OK");
        assertThat(health.isDataLoaded()).isTrue();
        assertThat(health.getTransactionsCount()).isEqualTo(3);
        assertThat(health.getTimestamp()).isEqualTo(LocalDateTime.of(2024, 6, 15, 12, 0));

        var metadata = service.getMetadata();
        assertThat(metadata.getTotalTransactions()).isEqualTo(3);
        assertThat(metadata.getTotalCustomers()).isEqualTo(2);
        assertThat(metadata.getEnvironment()).isEqualTo("prod");
        assertThat(metadata.getVersion()).isEqualTo("1.0.0");
        assertThat(metadata.getDataSource()).isEqualTo("classpath:data/cards_data.csv");

        assertThat(service.getInfo().docs()).isEqualTo("/swagger-ui.html");
    }
}

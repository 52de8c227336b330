package com.kreasipositif.transactionservice.ingest;

import com.kreasipositif.transactionservice.domain.RawCard;
import com.kreasipositif.transactionservice.exception.CardSourceException;
import com.kreasipositif.transactionservice.exception.CardSourceException.Kind;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CardCsvReaderTest {

    private final CardCsvReader reader = new CardCsvReader(new DefaultResourceLoader(), new CardFieldSetMapper());

    @Test
    void readsCardsByColumnName() {
        var cards = reader.readAll("classpath:data/test-cards.csv");

        assertThat(cards).extracting(RawCard::getId).containsExactly(10, 11, 12);
        RawCard first = cards.get(0);
        assertThat(first.getClientId()).isEqualTo(5);
        assertThat(first.getCreditLimit()).isEqualByComparingTo("2000.00");
        assertThat(first.getCardType()).isEqualTo("Credit");
        assertThat(first.getCardBrand()).isEqualTo("Visa");
        assertThat(cards.get(2).getCardType()).isEqualTo("Debit (Prepaid)");
        assertThat(cards.get(2).getCreditLimit()).isEqualByComparingTo("55");
    }

    @Test
    void missingFileIsSourceUnavailable() {
        assertThatThrownBy(() -> reader.readAll("classpath:data/does-not-exist.csv"))
                .isInstanceOf(CardSourceException.class)
                .extracting("kind").isEqualTo(Kind.SOURCE_UNAVAILABLE);
    }

    @Test
    void headerOnlyFileIsSourceEmpty() {
        assertThatThrownBy(() -> reader.readAll("classpath:data/empty-cards.csv"))
                .isInstanceOf(CardSourceException.class)
                .extracting("kind").isEqualTo(Kind.SOURCE_EMPTY);
    }

    @Test
    void zeroByteFileIsSourceEmpty() {
        assertThatThrownBy(() -> reader.readAll("classpath:data/zero-byte-cards.csv"))
                .isInstanceOf(CardSourceException.class)
                .hasMessageContaining("is empty")
                .extracting("kind").isEqualTo(Kind.SOURCE_EMPTY);
    }

    @Test
    void missingRequiredColumnIsSourceUnavailable() {
        assertThatThrownBy(() -> reader.readAll("classpath:data/missing-columns.csv"))
                .isInstanceOf(CardSourceException.class)
                .hasMessageContaining("credit_limit")
                .extracting("kind").isEqualTo(Kind.SOURCE_UNAVAILABLE);
    }

    // ─── Credit limit parsing ─────────────────────────────────────────────────

    @Test
    void currencyFormattedLimitIsParsed() {
        assertThat(CardFieldSetMapper.parseCreditLimit("$24,295")).isEqualByComparingTo("24295");
        assertThat(CardFieldSetMapper.parseCreditLimit(" $2,000.00 ")).isEqualByComparingTo("2000.00");
        assertThat(CardFieldSetMapper.parseCreditLimit("0")).isEqualByComparingTo(BigDecimal.ZERO);
    }

    @Test
    void invalidLimitFallsBackToDefault() {
        assertThat(CardFieldSetMapper.parseCreditLimit("n/a")).isEqualByComparingTo("1000.0");
        assertThat(CardFieldSetMapper.parseCreditLimit("")).isEqualByComparingTo("1000.0");
        assertThat(CardFieldSetMapper.parseCreditLimit("-$50")).isEqualByComparingTo("1000.0");
        assertThat(CardFieldSetMapper.parseCreditLimit(null)).isEqualByComparingTo("1000.0");
    }
}

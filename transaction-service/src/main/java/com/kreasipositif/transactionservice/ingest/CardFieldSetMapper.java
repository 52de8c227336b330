package com.kreasipositif.transactionservice.ingest;

import com.kreasipositif.transactionservice.domain.RawCard;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.item.file.mapping.FieldSetMapper;
import org.springframework.batch.item.file.transform.FieldSet;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Maps a parsed card CSV {@link FieldSet} to a {@link RawCard}.
 *
 * <p>Columns are looked up by header name, so the column order of the source file and any
 * extra columns (card number, expiry, CVV, ...) do not matter.
 */
@Slf4j
@Component
public class CardFieldSetMapper implements FieldSetMapper<RawCard> {

    static final String ID = "id";
    static final String CLIENT_ID = "client_id";
    static final String CREDIT_LIMIT = "credit_limit";
    static final String CARD_TYPE = "card_type";
    static final String CARD_BRAND = "card_brand";

    static final BigDecimal DEFAULT_CREDIT_LIMIT = new BigDecimal("1000.0");

    @Override
    public RawCard mapFieldSet(FieldSet fieldSet) {
        return RawCard.builder()
                .id(fieldSet.readInt(ID))
                .clientId(fieldSet.readInt(CLIENT_ID))
                .creditLimit(parseCreditLimit(fieldSet.readString(CREDIT_LIMIT)))
                .cardType(fieldSet.readString(CARD_TYPE).trim())
                .cardBrand(fieldSet.readString(CARD_BRAND).trim())
                .build();
    }

    /**
     * Parses a currency-formatted credit limit such as {@code "$24,295"}.
     * Anything that is not a non-negative number after stripping {@code $} and {@code ,}
     * falls back to 1000.0.
     *
     * @param raw column value, may be {@code null}
     * @return parsed limit or the default
     */
    public static BigDecimal parseCreditLimit(String raw) {
        if (raw == null) {
            return DEFAULT_CREDIT_LIMIT;
        }
        String cleaned = raw.replace("$", "").replace(",", "").trim();
        try {
            BigDecimal limit = new BigDecimal(cleaned);
            if (limit.signum() < 0) {
                log.warn("Negative credit limit '{}', using default {}", raw, DEFAULT_CREDIT_LIMIT);
                return DEFAULT_CREDIT_LIMIT;
            }
            return limit;
        } catch (NumberFormatException e) {
            log.warn("Unparseable credit limit '{}', using default {}", raw, DEFAULT_CREDIT_LIMIT);
            return DEFAULT_CREDIT_LIMIT;
        }
    }
}

package com.kreasipositif.transactionservice.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Binds the {@code card-data} section from application.yml.
 * Points at the card CSV the transaction set is derived from.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "card-data")
public class CardDataProperties {

    /**
     * Spring resource location of the card CSV, e.g. {@code classpath:data/cards_data.csv}
     * or {@code file:/data/cards_data.csv}.
     */
    private String csvPath = "classpath:data/cards_data.csv";
}

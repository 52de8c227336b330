package com.kreasipositif.transactionservice.service;

import com.kreasipositif.transactionservice.config.BankingApiProperties;
import com.kreasipositif.transactionservice.config.CardDataProperties;
import com.kreasipositif.transactionservice.domain.Transaction;
import com.kreasipositif.transactionservice.dto.ApiInfo;
import com.kreasipositif.transactionservice.dto.SystemHealth;
import com.kreasipositif.transactionservice.dto.SystemMetadata;
import com.kreasipositif.transactionservice.store.TransactionStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Health and metadata. Counts cover the full derived set, deleted transactions included.
 */
@Service
@RequiredArgsConstructor
public class SystemService {

    static final String DOCS_PATH = "/swagger-ui.html";

    private final TransactionStore store;
    private final BankingApiProperties apiProperties;
    private final CardDataProperties cardDataProperties;
    private final Clock clock;

    public SystemHealth getHealth() {
        long count = store.allTransactions().size();
        return SystemHealth.builder()
                .status("OK")
                .timestamp(LocalDateTime.now(clock))
                .dataLoaded(count > 0)
                .transactionsCount(count)
                .build();
    }

    public SystemMetadata getMetadata() {
        List<Transaction> all = store.allTransactions();
        return SystemMetadata.builder()
                .version(apiProperties.getVersion())
                .environment(apiProperties.getEnvironment())
                .totalTransactions(all.size())
                .totalCustomers(all.stream().mapToInt(Transaction::getClientId).distinct().count())
                .dataSource(cardDataProperties.getCsvPath())
                .lastUpdated(LocalDateTime.now(clock))
                .build();
    }

    public ApiInfo getInfo() {
        return new ApiInfo(apiProperties.getTitle(), apiProperties.getVersion(), DOCS_PATH);
    }
}

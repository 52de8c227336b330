package com.kreasipositif.transactionservice;

import com.kreasipositif.transactionservice.domain.Transaction;
import com.kreasipositif.transactionservice.domain.TransactionType;
import com.kreasipositif.transactionservice.dto.PageQuery;
import com.kreasipositif.transactionservice.dto.TransactionFilter;
import com.kreasipositif.transactionservice.service.CustomerService;
import com.kreasipositif.transactionservice.service.StatsService;
import com.kreasipositif.transactionservice.service.TransactionQueryService;
import com.kreasipositif.transactionservice.store.TransactionStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Boots the whole service against a three-card fixture:
 * card 10 (client 5, credit) yields 4 payments of 22.00, card 11 (client 5, debit) 5 purchases
 * of 6.00 and card 12 (client 7, prepaid debit) 3 purchases of 0.72.
 */
@SpringBootTest
@AutoConfigureMockMvc
@TestPropertySource(properties = {
        "card-data.csv-path=classpath:data/test-cards.csv",
        "logging.level.com.kreasipositif.transactionservice=INFO"
})
class TransactionServiceApplicationTests {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private TransactionStore store;

    @Autowired
    private StatsService statsService;

    @Autowired
    private TransactionQueryService queryService;

    @Autowired
    private CustomerService customerService;

    @AfterEach
    void restoreDeletions() {
        store.resetDeletions();
    }

    @Test
    void contextLoadsFixture() {
        assertThat(store.allTransactions()).hasSize(12);
        assertThat(store.allTransactions()).filteredOn(t -> t.getCardId() == 10)
                .extracting(Transaction::getId).containsExactly(1000, 1001, 1002, 1003);
        assertThat(store.allTransactions()).filteredOn(t -> t.getCardId() == 12)
                .allSatisfy(t -> {
                    assertThat(t.getType()).isEqualTo(TransactionType.PURCHASE);
                    assertThat(t.getAmount()).isEqualByComparingTo("0.72");
                });
    }

    @Test
    void customersCarryCardCounts() {
        assertThat(customerService.getCustomer(5)).hasValueSatisfying(c -> {
            assertThat(c.getTotalTransactions()).isEqualTo(9);
            assertThat(c.getTotalAmount()).isEqualByComparingTo("118.00");
            assertThat(c.getCardsCount()).isEqualTo(2);
        });
        assertThat(customerService.getCustomer(7)).hasValueSatisfying(c -> assertThat(c.getCardsCount()).isEqualTo(1));
    }

    @Test
    void transactionEndpointServesDerivedData() throws Exception {
        mockMvc.perform(get("/api/transactions/1000"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.client_id").value(5))
                .andExpect(jsonPath("$.recipient_id").value(105))
                .andExpect(jsonPath("$.type").value("PAYMENT"))
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andExpect(jsonPath("$.card_brand").value("Visa"));
    }

    @Test
    void deletedTransactionDisappears() throws Exception {
        mockMvc.perform(delete("/api/transactions/1101")).andExpect(status().isOk());
        mockMvc.perform(delete("/api/transactions/1101")).andExpect(status().isNotFound());
        mockMvc.perform(get("/api/transactions/1101")).andExpect(status().isNotFound());

        mockMvc.perform(get("/api/transactions").param("client_id", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(8));
        assertThat(statsService.getOverview().getTotalTransactions()).isEqualTo(11);

        // system counts cover the whole derived set
        mockMvc.perform(get("/api/system/health"))
                .andExpect(jsonPath("$.transactions_count").value(12))
                .andExpect(jsonPath("$.data_loaded").value(true));
    }

    @Test
    void overviewCountsWhatTheUnfilteredListReturns() {
        store.markDeleted(1000);
        store.markDeleted(1200);

        long listed = queryService.getTransactions(TransactionFilter.NONE, new PageQuery(1, 100)).getTotal();

        assertThat(statsService.getOverview().getTotalTransactions()).isEqualTo(listed).isEqualTo(10);
    }

    @Test
    void fraudAndStatsEndpointsRespond() throws Exception {
        mockMvc.perform(get("/api/fraud/summary"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_flagged").value(0));
        mockMvc.perform(get("/api/stats/by-type"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].type").value("PURCHASE"))
                .andExpect(jsonPath("$[0].count").value(8));
        mockMvc.perform(get("/api/customers/top").param("sort_by", "total_transactions").param("limit", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(5));
    }

    @Test
    void corsAllowsOnlyTheServedMethods() throws Exception {
        mockMvc.perform(options("/api/transactions/1000")
                        .header(HttpHeaders.ORIGIN, "http://dashboard.local")
                        .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, "DELETE"))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "http://dashboard.local"));
        mockMvc.perform(options("/api/transactions/1000")
                        .header(HttpHeaders.ORIGIN, "http://dashboard.local")
                        .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, "PUT"))
                .andExpect(status().isForbidden());
    }

    @Test
    void rootDescribesTheService() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Banking Transactions API"))
                .andExpect(jsonPath("$.docs").value("/swagger-ui.html"));
    }
}

package com.kreasipositif.transactionservice.controller;

import com.kreasipositif.transactionservice.domain.Transaction;
import com.kreasipositif.transactionservice.dto.DeleteTransactionResponse;
import com.kreasipositif.transactionservice.dto.ErrorResponse;
import com.kreasipositif.transactionservice.dto.PageQuery;
import com.kreasipositif.transactionservice.dto.PagedResponse;
import com.kreasipositif.transactionservice.dto.TransactionFilter;
import com.kreasipositif.transactionservice.dto.TransactionSearchRequest;
import com.kreasipositif.transactionservice.service.TransactionQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * REST controller exposing the transaction query endpoints.
 */
@RestController
@RequestMapping("/api/transactions")
@RequiredArgsConstructor
@Tag(name = "Transactions", description = "Listing, search, lookup and soft delete of derived transactions")
public class TransactionController {

    private final TransactionQueryService transactionQueryService;

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "List transactions",
            description = "Returns one page of visible transactions matching all given filters, newest first."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Page of matching transactions"),
            @ApiResponse(
                    responseCode = "422",
                    description = "Invalid pagination or filter values",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))
            )
    })
    public ResponseEntity<PagedResponse<Transaction>> getTransactions(
            @Parameter(description = "Page number", example = "1")
            @RequestParam(value = "page", required = false) Integer page,
            @Parameter(description = "Items per page (max 100)", example = "10")
            @RequestParam(value = "page_size", required = false) Integer pageSize,
            @Parameter(description = "Transaction type", example = "PURCHASE")
            @RequestParam(value = "type", required = false) String type,
            @Parameter(description = "Sender client ID", example = "825")
            @RequestParam(value = "client_id", required = false) Integer clientId,
            @Parameter(description = "Recipient client ID", example = "925")
            @RequestParam(value = "recipient_id", required = false) Integer recipientId,
            @Parameter(description = "Minimum amount (inclusive)", example = "10")
            @RequestParam(value = "min_amount", required = false) BigDecimal minAmount,
            @Parameter(description = "Maximum amount (inclusive)", example = "500")
            @RequestParam(value = "max_amount", required = false) BigDecimal maxAmount,
            @Parameter(description = "Start date (inclusive)", example = "2024-01-01")
            @RequestParam(value = "start_date", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @Parameter(description = "End date (inclusive)", example = "2024-12-31")
            @RequestParam(value = "end_date", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @Parameter(description = "Transaction status", example = "COMPLETED")
            @RequestParam(value = "status", required = false) String status) {
        TransactionFilter filter = TransactionFilter.builder()
                .type(type)
                .clientId(clientId)
                .recipientId(recipientId)
                .minAmount(minAmount)
                .maxAmount(maxAmount)
                .startDate(startDate)
                .endDate(endDate)
                .status(status)
                .build();
        return ResponseEntity.ok(transactionQueryService.getTransactions(filter, PageQuery.of(page, pageSize)));
    }

    @PostMapping(value = "/search", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Search transactions",
            description = "Case-insensitive text search over description and type, optionally filtered and paginated."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Matching transactions"),
            @ApiResponse(
                    responseCode = "422",
                    description = "Blank query or invalid filters/pagination",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))
            )
    })
    public ResponseEntity<PagedResponse<Transaction>> searchTransactions(
            @Valid @RequestBody TransactionSearchRequest request) {
        TransactionFilter filter = request.getFilters() != null ? request.getFilters().toFilter() : null;
        PageQuery pageQuery = request.getPagination() != null ? request.getPagination().toPageQuery() : null;
        return ResponseEntity.ok(transactionQueryService.searchTransactions(request.getQuery(), filter, pageQuery));
    }

    @GetMapping(value = "/types", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "List transaction types", description = "Distinct types among the visible transactions.")
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Distinct types, ascending",
                    content = @Content(array = @ArraySchema(schema = @Schema(implementation = String.class)))
            )
    })
    public ResponseEntity<List<String>> getTransactionTypes() {
        return ResponseEntity.ok(transactionQueryService.getTransactionTypes());
    }

    @GetMapping(value = "/recent", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Most recent transactions", description = "The newest visible transactions.")
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Newest transactions first",
                    content = @Content(array = @ArraySchema(schema = @Schema(implementation = Transaction.class)))
            ),
            @ApiResponse(
                    responseCode = "422",
                    description = "Limit outside 1..100",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))
            )
    })
    public ResponseEntity<List<Transaction>> getRecentTransactions(
            @Parameter(description = "Number of transactions (1-100)", example = "10")
            @RequestParam(value = "limit", defaultValue = "10") int limit) {
        return ResponseEntity.ok(transactionQueryService.getRecentTransactions(limit));
    }

    @GetMapping(value = "/by-customer/{customerId}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Transactions sent by a customer")
    public ResponseEntity<List<Transaction>> getTransactionsByCustomer(
            @Parameter(description = "Sender client ID", example = "825", required = true)
            @PathVariable("customerId") int customerId) {
        return ResponseEntity.ok(transactionQueryService.getTransactionsByCustomer(customerId));
    }

    @GetMapping(value = "/to-customer/{customerId}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Transactions received by a customer")
    public ResponseEntity<List<Transaction>> getTransactionsToCustomer(
            @Parameter(description = "Recipient client ID", example = "925", required = true)
            @PathVariable("customerId") int customerId) {
        return ResponseEntity.ok(transactionQueryService.getTransactionsToCustomer(customerId));
    }

    @GetMapping(value = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Get a transaction by ID")
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Transaction found",
                    content = @Content(schema = @Schema(implementation = Transaction.class))
            ),
            @ApiResponse(responseCode = "404", description = "Unknown or deleted transaction", content = @Content)
    })
    public ResponseEntity<Transaction> getTransaction(
            @Parameter(description = "Transaction ID", example = "452400", required = true)
            @PathVariable("id") int id) {
        return transactionQueryService.getTransaction(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping(value = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Delete a transaction",
            description = "Soft delete: the transaction disappears from every query until the service restarts."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Transaction deleted"),
            @ApiResponse(responseCode = "404", description = "Unknown or already deleted transaction", content = @Content)
    })
    public ResponseEntity<DeleteTransactionResponse> deleteTransaction(
            @Parameter(description = "Transaction ID", example = "452400", required = true)
            @PathVariable("id") int id) {
        if (!transactionQueryService.deleteTransaction(id)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(new DeleteTransactionResponse("Transaction deleted successfully", id));
    }
}

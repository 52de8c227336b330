package com.kreasipositif.transactionservice.controller;

import com.kreasipositif.transactionservice.dto.Customer;
import com.kreasipositif.transactionservice.dto.CustomerSummary;
import com.kreasipositif.transactionservice.dto.ErrorResponse;
import com.kreasipositif.transactionservice.service.CustomerService;
import com.kreasipositif.transactionservice.service.CustomerSortField;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/customers")
@RequiredArgsConstructor
@Tag(name = "Customers", description = "Per-customer aggregates over sent transactions")
public class CustomerController {

    private final CustomerService customerService;

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "List customers", description = "Every client with at least one visible sent transaction, by id.")
    public ResponseEntity<List<Customer>> getCustomers() {
        return ResponseEntity.ok(customerService.getCustomers());
    }

    @GetMapping(value = "/top", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Top customers", description = "Customers ranked by total amount or transaction count.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Ranked customers"),
            @ApiResponse(
                    responseCode = "422",
                    description = "Limit outside 1..100 or unknown sort_by",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))
            )
    })
    public ResponseEntity<List<CustomerSummary>> getTopCustomers(
            @Parameter(description = "Number of customers (1-100)", example = "10")
            @RequestParam(value = "limit", defaultValue = "10") int limit,
            @Parameter(description = "total_amount or total_transactions", example = "total_amount")
            @RequestParam(value = "sort_by", defaultValue = "total_amount") String sortBy) {
        return ResponseEntity.ok(customerService.getTopCustomers(limit, CustomerSortField.fromParameter(sortBy)));
    }

    @GetMapping(value = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Get a customer by ID")
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Customer found",
                    content = @Content(schema = @Schema(implementation = Customer.class))
            ),
            @ApiResponse(responseCode = "404", description = "No visible transactions sent by this client", content = @Content)
    })
    public ResponseEntity<Customer> getCustomer(
            @Parameter(description = "Client ID", example = "825", required = true)
            @PathVariable("id") int id) {
        return customerService.getCustomer(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}

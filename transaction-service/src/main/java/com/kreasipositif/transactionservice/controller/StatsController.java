package com.kreasipositif.transactionservice.controller;

import com.kreasipositif.transactionservice.dto.AmountDistribution;
import com.kreasipositif.transactionservice.dto.DailyStats;
import com.kreasipositif.transactionservice.dto.StatsByType;
import com.kreasipositif.transactionservice.dto.StatsOverview;
import com.kreasipositif.transactionservice.service.StatsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/stats")
@RequiredArgsConstructor
@Tag(name = "Statistics", description = "Aggregates over the visible transactions")
public class StatsController {

    private final StatsService statsService;

    @GetMapping(value = "/overview", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Overall statistics", description = "Totals, extremes, distinct senders and counts per status.")
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Overview computed",
                    content = @Content(schema = @Schema(implementation = StatsOverview.class))
            )
    })
    public ResponseEntity<StatsOverview> getOverview() {
        return ResponseEntity.ok(statsService.getOverview());
    }

    @GetMapping(value = "/amount-distribution", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Amount distribution", description = "Counts per fixed amount bucket, from 0-100 up to 10000+.")
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Buckets in ascending order",
                    content = @Content(array = @ArraySchema(schema = @Schema(implementation = AmountDistribution.class)))
            )
    })
    public ResponseEntity<List<AmountDistribution>> getAmountDistribution() {
        return ResponseEntity.ok(statsService.getAmountDistribution());
    }

    @GetMapping(value = "/by-type", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Statistics per transaction type", description = "Most frequent type first.")
    public ResponseEntity<List<StatsByType>> getStatsByType() {
        return ResponseEntity.ok(statsService.getStatsByType());
    }

    @GetMapping(value = "/daily", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Daily statistics", description = "One entry per calendar day with activity, newest first.")
    public ResponseEntity<List<DailyStats>> getDailyStats() {
        return ResponseEntity.ok(statsService.getDailyStats());
    }
}

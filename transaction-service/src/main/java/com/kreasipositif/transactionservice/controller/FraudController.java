package com.kreasipositif.transactionservice.controller;

import com.kreasipositif.transactionservice.dto.ErrorResponse;
import com.kreasipositif.transactionservice.dto.FraudByType;
import com.kreasipositif.transactionservice.dto.FraudPrediction;
import com.kreasipositif.transactionservice.dto.FraudPredictionRequest;
import com.kreasipositif.transactionservice.dto.FraudSummary;
import com.kreasipositif.transactionservice.service.FraudDetectionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller exposing heuristic fraud scoring.
 */
@RestController
@RequestMapping("/api/fraud")
@RequiredArgsConstructor
@Tag(name = "Fraud Detection", description = "Heuristic fraud scoring over the visible transactions")
public class FraudController {

    private final FraudDetectionService fraudDetectionService;

    @GetMapping(value = "/summary", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Fraud summary",
            description = "Counts suspicious (one reason) and flagged (two or more reasons) transactions."
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Summary computed",
                    content = @Content(schema = @Schema(implementation = FraudSummary.class))
            ),
            @ApiResponse(
                    responseCode = "503",
                    description = "Too many fraud scans already running",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))
            )
    })
    public ResponseEntity<FraudSummary> getFraudSummary() {
        return ResponseEntity.ok(fraudDetectionService.getFraudSummary());
    }

    @GetMapping(value = "/by-type", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Fraud statistics per transaction type", description = "Most flagged type first.")
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Per-type fraud counts",
                    content = @Content(array = @ArraySchema(schema = @Schema(implementation = FraudByType.class)))
            ),
            @ApiResponse(
                    responseCode = "503",
                    description = "Too many fraud scans already running",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))
            )
    })
    public ResponseEntity<List<FraudByType>> getFraudByType() {
        return ResponseEntity.ok(fraudDetectionService.getFraudByType());
    }

    @PostMapping(value = "/predict", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
            summary = "Score a hypothetical transaction",
            description = "Applies the fraud heuristics to the given transaction without storing it."
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Risk assessment",
                    content = @Content(schema = @Schema(implementation = FraudPrediction.class))
            ),
            @ApiResponse(
                    responseCode = "422",
                    description = "Missing or invalid fields",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))
            )
    })
    public ResponseEntity<FraudPrediction> predict(@Valid @RequestBody FraudPredictionRequest request) {
        return ResponseEntity.ok(fraudDetectionService.predict(request));
    }
}

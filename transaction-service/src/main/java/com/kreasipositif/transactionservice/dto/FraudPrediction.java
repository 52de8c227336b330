package com.kreasipositif.transactionservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
@Schema(description = "Heuristic fraud assessment of one transaction")
public class FraudPrediction {

    @JsonProperty("is_suspicious")
    @Schema(example = "true")
    private final boolean suspicious;

    @Schema(description = "Risk score (0-100)", example = "65.0")
    private final double riskScore;

    @Schema(description = "Reasons for suspicion, or a single placeholder when there are none")
    private final List<String> reasons;

    @Schema(description = "Confidence level (0-100)", example = "30.0")
    private final double confidence;
}

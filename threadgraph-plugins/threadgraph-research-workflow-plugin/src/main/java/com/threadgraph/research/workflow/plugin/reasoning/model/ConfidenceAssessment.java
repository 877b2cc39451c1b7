package com.threadgraph.research.workflow.plugin.reasoning.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConfidenceAssessment {

    @NotNull(message = "confidence_score is required")
    @DecimalMin(value = "0", message = "confidence_score must be at least 0")
    @DecimalMax(value = "10", message = "confidence_score must be at most 10")
    @JsonProperty("confidence_score")
    private Double confidenceScore;

    @JsonProperty("reasoning")
    private String reasoning;
}

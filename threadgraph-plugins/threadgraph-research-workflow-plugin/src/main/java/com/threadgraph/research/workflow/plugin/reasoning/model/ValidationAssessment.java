package com.threadgraph.research.workflow.plugin.reasoning.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Grade of the gathered findings. The critique and suggestions are fed back into the history
 * so the next gather pass can see them.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ValidationAssessment {

    @NotNull(message = "validation_result is required")
    @Pattern(regexp = "sufficient|insufficient", message = "validation_result must be sufficient or insufficient")
    @JsonProperty("validation_result")
    private String validationResult;

    @JsonProperty("critique")
    private String critique;

    @JsonProperty("suggestions")
    private String suggestions;
}

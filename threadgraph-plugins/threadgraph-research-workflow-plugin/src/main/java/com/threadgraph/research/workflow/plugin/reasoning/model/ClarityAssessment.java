package com.threadgraph.research.workflow.plugin.reasoning.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Structured answer of the clarity assessment call.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClarityAssessment {

    @NotNull(message = "clarity_status is required")
    @Pattern(regexp = "clear|needs_clarification", message = "clarity_status must be clear or needs_clarification")
    @JsonProperty("clarity_status")
    private String clarityStatus;

    /**
     * Resolved subject, usually a company name. May be absent even when the status is clear.
     */
    @JsonProperty("company_name")
    private String companyName;

    @JsonProperty("clarification_question")
    private String clarificationQuestion;
}

package com.aegis.rulegov.service.rest;

import com.aegis.rulegov.api.model.Rule;
import com.aegis.rulegov.api.model.SampleFilter;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request bodies of the REST resources.
 */
public final class SuggestionRequests {

    private SuggestionRequests() {
    }

    public record Submit(
            @JsonProperty("instruction") String instruction,
            @JsonProperty("actor") String actor,
            @JsonProperty("sample_size") Integer sampleSize,
            @JsonProperty("filters") SampleFilter filters
    ) {
    }

    public record Approve(
            @JsonProperty("approver") String approver,
            @JsonProperty("notes") String notes,
            @JsonProperty("acknowledge_impact") boolean acknowledgeImpact,
            @JsonProperty("expected_impact") String expectedImpact
    ) {
    }

    public record Reject(
            @JsonProperty("reviewer") String reviewer,
            @JsonProperty("notes") String notes
    ) {
    }

    public record DryRun(
            @JsonProperty("rule") Rule rule,
            @JsonProperty("sample_size") Integer sampleSize,
            @JsonProperty("filters") SampleFilter filters,
            @JsonProperty("actor") String actor
    ) {
    }
}

package com.example.healthintake.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Structured output of one interpreter extraction.
 */
@Value
@Builder
public class ExtractionResult {
    Target target;
    @Builder.Default
    Map<String, Object> fields = Map.of();
    String pendingQuestion;
    /** Raw triage tier, null when the extraction omitted it. */
    Integer riskTier;
    boolean requiresMoreInformation;
    boolean failed;

    public static ExtractionResult failed(Target target) {
        return ExtractionResult.builder()
                .target(target)
                .fields(Map.of())
                .requiresMoreInformation(true)
                .failed(true)
                .build();
    }
}

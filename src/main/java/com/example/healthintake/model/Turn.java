package com.example.healthintake.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * One user message plus its structured extraction. Never mutated once recorded.
 */
@Value
@Builder
@Jacksonized
public class Turn {
    String message;
    Target target;
    @Singular
    Map<String, Object> fields;
    @JsonProperty("pending_question")
    String pendingQuestion;
    @JsonProperty("created_at")
    Instant createdAt;
}

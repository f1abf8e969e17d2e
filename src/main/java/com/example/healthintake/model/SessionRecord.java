package com.example.healthintake.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Persisted shape of a user's session: the recent turns plus the carried risk floor.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SessionRecord {
    @JsonProperty("user_id")
    private String userId;
    @Builder.Default
    private List<Turn> turns = new ArrayList<>();
    @JsonProperty("expires_at")
    private Instant expiresAt;

    // Survive eviction of the triage turns that produced them
    @JsonProperty("risk_high_water_mark")
    private Integer riskHighWaterMark;
    @Builder.Default
    @JsonProperty("danger_reasons")
    private List<String> dangerReasons = new ArrayList<>();

    public boolean hasTurns() {
        return turns != null && !turns.isEmpty();
    }
}

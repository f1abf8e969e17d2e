package com.example.healthintake.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class IntakeRequest {
    @JsonProperty("user_id")
    private String userId;
    private String message;
}

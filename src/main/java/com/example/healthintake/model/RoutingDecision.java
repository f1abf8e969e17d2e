package com.example.healthintake.model;

import lombok.Value;

@Value
public class RoutingDecision {
    Target target;
    double confidence;
    String reasoning;
    boolean fallback;

    public static RoutingDecision explicit(Target target) {
        return new RoutingDecision(target, 1.0, "endpoint solicitado directamente", false);
    }

    public static RoutingDecision fallback(Target target, String reasoning) {
        return new RoutingDecision(target, 0.0, reasoning, true);
    }
}

package com.example.healthintake.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Danger-combination triggers: reason sets that force an emergency tier once all are present in a session.
 *
 * <pre>
 * app:
 *   triage:
 *     danger-combinations:
 *       - [fiebre alta, dolor de cabeza, rigidez de cuello]
 * </pre>
 */
@ConfigurationProperties(prefix = "app.triage")
public class DangerCombinationProperties {

    private List<List<String>> dangerCombinations = new ArrayList<>();

    public List<List<String>> getDangerCombinations() {
        return dangerCombinations;
    }

    public void setDangerCombinations(List<List<String>> dangerCombinations) {
        this.dangerCombinations = dangerCombinations;
    }
}

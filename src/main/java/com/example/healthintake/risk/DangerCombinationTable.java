package com.example.healthintake.risk;

import com.example.healthintake.config.DangerCombinationProperties;
import com.example.healthintake.context.FieldValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Subset lookup of accumulated reasons against the configured danger-combination triggers.
 *
 * <p>A trigger term is satisfied by a reason whose normalized text contains the term as whole words,
 * so "rigidez de cuello" is satisfied by "Rigidez de cuello desde ayer". Order of reasons is irrelevant.
 */
@Component
public class DangerCombinationTable {

    private static final Logger logger = LoggerFactory.getLogger(DangerCombinationTable.class);

    private final List<Set<String>> triggers;

    public DangerCombinationTable(DangerCombinationProperties properties) {
        List<Set<String>> loaded = new ArrayList<>();
        for (List<String> combination : properties.getDangerCombinations()) {
            Set<String> terms = combination.stream()
                    .map(FieldValues::normalize)
                    .filter(term -> !term.isEmpty())
                    .collect(Collectors.toCollection(LinkedHashSet::new));
            if (terms.isEmpty()) {
                logger.warn("Ignoring empty danger combination {}", combination);
                continue;
            }
            loaded.add(Collections.unmodifiableSet(terms));
        }
        this.triggers = List.copyOf(loaded);
        logger.info("Loaded {} danger-combination trigger(s)", triggers.size());
    }

    /**
     * First trigger (in configuration order) fully covered by {@code reasons}.
     */
    public Optional<Set<String>> match(Collection<String> reasons) {
        List<String> normalizedReasons = reasons.stream()
                .map(FieldValues::normalize)
                .collect(Collectors.toList());
        for (Set<String> trigger : triggers) {
            boolean covered = trigger.stream()
                    .allMatch(term -> normalizedReasons.stream().anyMatch(reason -> FieldValues.containsPhrase(reason, term)));
            if (covered) {
                return Optional.of(trigger);
            }
        }
        return Optional.empty();
    }

    public int size() {
        return triggers.size();
    }
}

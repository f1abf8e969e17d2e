package com.example.healthintake.context;

import com.example.healthintake.model.AccumulatedContext;
import com.example.healthintake.model.FieldValue;
import com.example.healthintake.model.Fields;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Merges the prior context with the fields extracted from the current turn.
 *
 * <p>Per field: a present current value that means something different from the prior one is a
 * correction and wins; an absent current value keeps the prior one; a current value with the same
 * meaning keeps the prior value and its provenance. Fields are merged independently and nothing is
 * ever filled in that neither side supplied. Reasons are unioned, never replaced.
 *
 * <p>Pure and deterministic: the result depends only on the two inputs.
 */
@Component
public class CriteriaAccumulator {

    private static final Logger logger = LoggerFactory.getLogger(CriteriaAccumulator.class);

    public AccumulatedContext accumulate(AccumulatedContext prior, Map<String, Object> currentTurnFields) {
        Map<String, FieldValue> merged = new LinkedHashMap<>(prior.getFields());
        List<String> reasons = prior.getReasons();

        // Sorted so the merge never depends on the caller's map iteration order
        Map<String, Object> current = new TreeMap<>(currentTurnFields == null ? Map.of() : currentTurnFields);

        for (Map.Entry<String, Object> entry : current.entrySet()) {
            String field = entry.getKey();
            Object value = entry.getValue();

            if (Fields.RAZONES.equals(field)) {
                reasons = FieldValues.unionReasons(reasons, FieldValues.toStringList(value));
                continue;
            }
            if (FieldValues.isAbsent(value)) {
                continue;
            }

            FieldValue previous = merged.get(field);
            if (previous == null) {
                merged.put(field, FieldValue.fromCurrentTurn(value));
                logger.debug("Field {} set from current turn", field);
            } else if (!FieldValues.sameMeaning(previous.getValue(), value)) {
                merged.put(field, FieldValue.fromCurrentTurn(value));
                logger.debug("Field {} corrected from '{}' to '{}'", field, previous.getValue(), value);
            }
        }

        return new AccumulatedContext(prior.getTarget(), merged, reasons, prior.getPendingQuestion());
    }
}

package com.example.healthintake.dispatch;

import com.example.healthintake.model.AccumulatedContext;
import com.example.healthintake.model.ExtractionRequest;
import com.example.healthintake.model.ExtractionResult;
import com.example.healthintake.model.Target;

import java.util.List;
import java.util.Map;

/**
 * One specialized interpreter: LLM extraction for understanding, structured store for lookup.
 */
public interface Interpreter {

    Target target();

    /**
     * @throws ExtractionFailedException when the extraction errors or its output cannot be parsed
     */
    ExtractionResult extract(ExtractionRequest request);

    /**
     * Criteria still unknown after merging, which the user has to be asked for.
     */
    default List<String> missingCriteria(AccumulatedContext context) {
        return List.of();
    }

    /**
     * Question to ask when the extraction supplied none. Null when nothing needs asking.
     */
    default String questionFor(List<String> missingCriteria) {
        return null;
    }

    /**
     * Structured lookup over the merged criteria, keyed by result kind. Never throws.
     */
    default Map<String, List<Map<String, Object>>> lookup(AccumulatedContext context) {
        return Map.of();
    }
}

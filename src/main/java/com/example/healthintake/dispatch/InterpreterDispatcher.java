package com.example.healthintake.dispatch;

import com.example.healthintake.model.ExtractionRequest;
import com.example.healthintake.model.ExtractionResult;
import com.example.healthintake.model.Target;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Boundary to the interpreters. Extraction failures come back as a failed result, never as an exception;
 * an aborted request still propagates.
 */
@Component
public class InterpreterDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(InterpreterDispatcher.class);

    private final Map<Target, Interpreter> interpreters = new EnumMap<>(Target.class);

    public InterpreterDispatcher(List<Interpreter> interpreters) {
        for (Interpreter interpreter : interpreters) {
            this.interpreters.put(interpreter.target(), interpreter);
        }
        for (Target target : Target.values()) {
            if (!this.interpreters.containsKey(target)) {
                throw new IllegalStateException("No interpreter registered for " + target.getEndpoint());
            }
        }
    }

    public Interpreter interpreterFor(Target target) {
        return interpreters.get(target);
    }

    public ExtractionResult extract(Target target, ExtractionRequest request) {
        try {
            return interpreterFor(target).extract(request);
        } catch (ExtractionFailedException e) {
            logger.warn("Extraction failed for {}: {}", target.getEndpoint(), e.getMessage());
            return ExtractionResult.failed(target);
        }
    }
}

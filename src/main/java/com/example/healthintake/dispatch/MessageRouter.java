package com.example.healthintake.dispatch;

import com.example.healthintake.model.RoutingDecision;
import com.example.healthintake.model.SessionRecord;
import com.example.healthintake.model.Target;
import com.example.healthintake.model.Turn;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Picks the interpreter for a free-form message.
 *
 * <p>If the router call fails, a reply to a pending question stays with the interpreter that asked it;
 * anything else goes to triage.
 */
@Component
public class MessageRouter {

    private static final Logger logger = LoggerFactory.getLogger(MessageRouter.class);

    private final LlmExtractionClient llm;
    private final ExtractionParser parser;
    private final ObjectMapper objectMapper;
    private final String systemPrompt;

    public MessageRouter(LlmExtractionClient llm, ExtractionParser parser, ObjectMapper objectMapper,
                         @Value("classpath:prompts/router.txt") Resource systemPrompt) {
        this.llm = llm;
        this.parser = parser;
        this.objectMapper = objectMapper;
        this.systemPrompt = AbstractLlmInterpreter.loadPrompt(systemPrompt);
    }

    public RoutingDecision route(String message, SessionRecord session) {
        Turn newest = session != null && session.hasTurns()
                ? session.getTurns().get(session.getTurns().size() - 1) : null;

        try {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("mensaje", message);
            if (newest != null) {
                payload.put("ultimo_endpoint", newest.getTarget().getEndpoint());
                if (newest.getPendingQuestion() != null) {
                    payload.put("pregunta_pendiente", newest.getPendingQuestion());
                }
            }
            JsonNode root = parser.readObject(llm.complete(systemPrompt, objectMapper.writeValueAsString(payload)));
            Target target = Target.fromWireName(root.path("endpoint").asText(""));
            double confidence = Math.max(0.0, Math.min(1.0, root.path("confidence").asDouble(0.0)));
            String reasoning = root.hasNonNull("reasoning") ? root.get("reasoning").asText() : null;
            logger.info("Routed to {} (confidence {})", target.getEndpoint(), confidence);
            return new RoutingDecision(target, confidence, reasoning, false);
        } catch (ExtractionFailedException | IllegalArgumentException | JsonProcessingException e) {
            Target fallback = newest != null && newest.getPendingQuestion() != null
                    ? newest.getTarget() : Target.TRIAGE;
            logger.warn("Routing failed ({}), falling back to {}", e.getMessage(), fallback.getEndpoint());
            return RoutingDecision.fallback(fallback, "no se pudo clasificar el mensaje, se usa "
                    + fallback.getEndpoint());
        }
    }
}

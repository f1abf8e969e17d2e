package com.example.healthintake.service;

import com.example.healthintake.context.CriteriaAccumulator;
import com.example.healthintake.context.FieldValues;
import com.example.healthintake.dispatch.IntakeAbortedException;
import com.example.healthintake.dispatch.Interpreter;
import com.example.healthintake.dispatch.InterpreterDispatcher;
import com.example.healthintake.dispatch.MessageRouter;
import com.example.healthintake.dispatch.TriageInterpreter;
import com.example.healthintake.model.*;
import com.example.healthintake.risk.RiskEscalationStateMachine;
import com.example.healthintake.session.ContextSummarizer;
import com.example.healthintake.session.TurnRecorder;
import com.example.healthintake.store.DirectoryClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.*;

/**
 * One intake cycle: read session, route, merge, extract, escalate, look up, record.
 *
 * <p>The turn is written only after extraction has produced a result (successful or failed). An aborted
 * request writes nothing.
 */
@Service
public class IntakeService {

    private static final Logger logger = LoggerFactory.getLogger(IntakeService.class);

    static final String RETRY_QUESTION = "¿Podrías contarme un poco más sobre lo que necesitas?";

    private final TurnRecorder turnRecorder;
    private final ContextSummarizer summarizer;
    private final CriteriaAccumulator accumulator;
    private final RiskEscalationStateMachine riskMachine;
    private final MessageRouter router;
    private final InterpreterDispatcher dispatcher;
    private final DirectoryClient directory;
    private final Clock clock;

    public IntakeService(TurnRecorder turnRecorder, ContextSummarizer summarizer, CriteriaAccumulator accumulator,
                         RiskEscalationStateMachine riskMachine, MessageRouter router,
                         InterpreterDispatcher dispatcher, DirectoryClient directory, Clock clock) {
        this.turnRecorder = turnRecorder;
        this.summarizer = summarizer;
        this.accumulator = accumulator;
        this.riskMachine = riskMachine;
        this.router = router;
        this.dispatcher = dispatcher;
        this.directory = directory;
        this.clock = clock;
    }

    /**
     * Processes one user message.
     *
     * @param target interpreter to use, or null to let the router decide
     * @throws IntakeAbortedException when the request was cancelled before its turn was recorded
     */
    public IntakeResponse handle(String userId, String message, Target target) {
        MDC.put("userId", userId);
        try {
            return process(userId, message, target);
        } finally {
            MDC.remove("userId");
        }
    }

    private IntakeResponse process(String userId, String message, Target requested) {
        SessionRecord session = turnRecorder.currentSession(userId).orElse(null);

        RoutingDecision routing = requested != null
                ? RoutingDecision.explicit(requested)
                : router.route(message, session);
        Target target = routing.getTarget();
        Interpreter interpreter = dispatcher.interpreterFor(target);

        AccumulatedContext prior = summarizer.summarize(session, target);
        RiskState risk = target == Target.TRIAGE ? riskMachine.currentState(session) : null;

        ExtractionResult result = dispatcher.extract(target, buildRequest(message, prior, risk));

        Map<String, Object> turnFields = new LinkedHashMap<>(result.getFields());
        RiskDecision decision = null;
        if (target == Target.TRIAGE) {
            decision = riskMachine.evaluate(risk, result.isFailed() ? null : result.getRiskTier(),
                    FieldValues.toStringList(turnFields.get(Fields.RAZONES)));
            if (!result.isFailed()) {
                applyDecision(turnFields, decision);
            }
        }

        AccumulatedContext merged = accumulator.accumulate(prior, turnFields);
        List<String> missing = interpreter.missingCriteria(merged);
        boolean requiresMore = result.isFailed()
                || result.isRequiresMoreInformation()
                || !missing.isEmpty()
                || (decision != null && decision.isTierMissing());

        String pendingQuestion = result.getPendingQuestion();
        if (pendingQuestion == null && requiresMore) {
            pendingQuestion = Objects.requireNonNullElse(interpreter.questionFor(missing), RETRY_QUESTION);
        }

        Map<String, List<Map<String, Object>>> results = !result.isFailed() && !merged.getFields().isEmpty()
                ? interpreter.lookup(merged)
                : Map.of();

        if (Thread.currentThread().isInterrupted()) {
            throw new IntakeAbortedException("Request cancelled before the turn was recorded", null);
        }

        turnRecorder.recordTurn(userId, session, Turn.builder()
                .message(message)
                .target(target)
                .fields(turnFields)
                .pendingQuestion(pendingQuestion)
                .createdAt(clock.instant())
                .build());

        if (decision != null && decision.getReportedTier() == RiskState.EMERGENCY_TIER && !risk.isEmergency()) {
            auditEscalation(userId, decision);
        }

        logger.info("Processed {} turn: fields={} requiresMore={} results={}",
                target.getEndpoint(), turnFields.keySet(), requiresMore, results.keySet());

        IntakeResponse.IntakeResponseBuilder response = IntakeResponse.builder()
                .userId(userId)
                .endpoint(target.getEndpoint())
                .confidence(routing.getConfidence())
                .reasoning(routing.getReasoning())
                .criterios(merged.asValueMap())
                .requiresMoreInformation(requiresMore)
                .pendingQuestion(pendingQuestion)
                .missingCriteria(missing.isEmpty() ? null : missing)
                .resultados(results.isEmpty() ? null : results);
        if (decision != null) {
            Object action = turnFields.get(Fields.ACCION_RECOMENDADA);
            response.capa(decision.getReportedTier())
                    .rawTier(decision.getRawTier())
                    .escalatedByCombination(decision.isEscalatedByCombination())
                    .razones(decision.getReasons())
                    .accionRecomendada(action != null
                            ? action.toString()
                            : TriageInterpreter.actionFor(decision.getReportedTier()));
        }
        return response.build();
    }

    /**
     * Merged criteria the given interpreter would see for this user right now.
     */
    public Map<String, Object> sessionContext(String userId, Target target) {
        Optional<SessionRecord> session = turnRecorder.currentSession(userId);
        AccumulatedContext context = summarizer.summarize(session.orElse(null), target);

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("user_id", userId);
        out.put("endpoint", target.getEndpoint());
        out.put("turnos", session.map(s -> s.getTurns().size()).orElse(0));
        out.put("criterios", context.asValueMap());
        Map<String, Object> provenance = new LinkedHashMap<>();
        context.getFields().forEach((field, value) -> provenance.put(field, value.getSourceTurn()));
        out.put("origen", provenance);
        if (context.getPendingQuestion() != null) {
            out.put("pregunta_pendiente", context.getPendingQuestion());
        }
        out.put("resumen", summarizer.describe(session.orElse(null)));
        return out;
    }

    public Map<String, Object> riskState(String userId) {
        RiskState state = riskMachine.currentState(turnRecorder.currentSession(userId).orElse(null));
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("user_id", userId);
        out.put("capa", state.getHighWaterMark());
        out.put("razones", state.getReasons());
        out.put("emergencia", state.isEmergency());
        out.put("accion_recomendada", TriageInterpreter.actionFor(state.getHighWaterMark()));
        return out;
    }

    private ExtractionRequest buildRequest(String message, AccumulatedContext prior, RiskState risk) {
        Map<String, Object> known = new LinkedHashMap<>();
        prior.getFields().forEach((field, value) -> known.put(field, value.getValue()));
        return ExtractionRequest.builder()
                .message(message)
                .currentDate(LocalDate.now(clock).toString())
                .accumulatedContext(known)
                .accumulatedReasons(prior.getReasons().isEmpty() ? null : prior.getReasons())
                .pendingQuestion(prior.getPendingQuestion())
                .priorRiskTier(risk != null ? risk.getHighWaterMark() : null)
                .build();
    }

    private static void applyDecision(Map<String, Object> turnFields, RiskDecision decision) {
        int reported = decision.getReportedTier();
        turnFields.put(Fields.CAPA, reported);
        if (decision.overridesExtraction() || FieldValues.isAbsent(turnFields.get(Fields.ACCION_RECOMENDADA))) {
            turnFields.put(Fields.ACCION_RECOMENDADA, TriageInterpreter.actionFor(reported));
        }
    }

    private void auditEscalation(String userId, RiskDecision decision) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("type", "RiskEscalated");
        event.put("reportedTier", decision.getReportedTier());
        event.put("rawTier", decision.getRawTier());
        event.put("matchedTrigger", decision.getMatchedTrigger() != null
                ? new ArrayList<>(decision.getMatchedTrigger()) : null);
        event.put("reasons", decision.getReasons());
        try {
            directory.appendEvent(userId, event);
            logger.info("Session escalated to tier {} (raw {}, trigger {})",
                    decision.getReportedTier(), decision.getRawTier(), decision.getMatchedTrigger());
        } catch (RuntimeException e) {
            logger.warn("Could not append escalation event: {}", e.getMessage());
        }
    }
}

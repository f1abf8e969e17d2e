package com.example.healthintake.session;

import com.example.healthintake.context.FieldValues;
import com.example.healthintake.model.AccumulatedContext;
import com.example.healthintake.model.FieldValue;
import com.example.healthintake.model.Fields;
import com.example.healthintake.model.SessionRecord;
import com.example.healthintake.model.Target;
import com.example.healthintake.model.Turn;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renders stored turns into the "criteria so far" for one target.
 *
 * <p>Each field takes the most recent non-empty mention among the turns relevant to the target.
 * Triage reasons are the ordered union across the session and are never dropped.
 */
@Component
public class ContextSummarizer {

    public AccumulatedContext summarize(SessionRecord session, Target target) {
        if (session == null || !session.hasTurns()) {
            return AccumulatedContext.empty(target);
        }

        Set<Target> sources = target.contextSources();
        List<Turn> turns = session.getTurns();

        Map<String, FieldValue> fields = new LinkedHashMap<>();
        for (String field : fieldNames(target, sources)) {
            for (int i = turns.size() - 1; i >= 0; i--) {
                Turn turn = turns.get(i);
                if (!sources.contains(turn.getTarget())) {
                    continue;
                }
                Object value = turn.getFields().get(field);
                if (!FieldValues.isAbsent(value)) {
                    fields.put(field, FieldValue.fromTurn(value, i));
                    break;
                }
            }
        }

        List<String> reasons = List.of();
        if (target.collectsReasons()) {
            List<String> carried = session.getDangerReasons() != null ? session.getDangerReasons() : List.of();
            reasons = new ArrayList<>(carried);
            for (Turn turn : turns) {
                if (turn.getTarget() == Target.TRIAGE) {
                    reasons = FieldValues.unionReasons(reasons, FieldValues.toStringList(turn.getFields().get(Fields.RAZONES)));
                }
            }
        }

        Turn newest = turns.get(turns.size() - 1);
        String pendingQuestion = null;
        if (sources.contains(newest.getTarget()) && !FieldValues.isAbsent(newest.getPendingQuestion())) {
            pendingQuestion = newest.getPendingQuestion();
        }

        return new AccumulatedContext(target, fields, reasons, pendingQuestion);
    }

    /**
     * Plain-text digest of the recent turns, newest last, for prompts and tooling.
     */
    public String describe(SessionRecord session) {
        if (session == null || !session.hasTurns()) {
            return "";
        }
        StringBuilder out = new StringBuilder();
        List<Turn> turns = session.getTurns();
        for (int i = 0; i < turns.size(); i++) {
            Turn turn = turns.get(i);
            out.append("Turno ").append(i + 1).append(" (").append(turn.getTarget().getEndpoint()).append("):\n");
            out.append("  Usuario dijo: ").append(turn.getMessage()).append('\n');
            turn.getFields().forEach((name, value) -> out.append("  ").append(name).append(": ").append(value).append('\n'));
            if (turn.getPendingQuestion() != null) {
                out.append("  Pregunta pendiente: ").append(turn.getPendingQuestion()).append('\n');
            }
        }
        return out.toString();
    }

    private static Set<String> fieldNames(Target target, Set<Target> sources) {
        Set<String> names = new LinkedHashSet<>(target.getFields());
        for (Target source : Target.values()) {
            if (sources.contains(source)) {
                names.addAll(source.getFields());
            }
        }
        return names;
    }
}

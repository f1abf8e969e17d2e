package com.example.healthintake.mcp;

import com.example.healthintake.model.IntakeResponse;
import com.example.healthintake.model.Target;
import com.example.healthintake.service.IntakeService;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

import java.util.Map;

@Service
public class IntakeTools {

    private final IntakeService intakeService;

    public IntakeTools(IntakeService intakeService) {
        this.intakeService = intakeService;
    }

    @Tool(description = "Process one user message of a health-intake conversation. Routes to triage, doctors or "
            + "workshops unless an endpoint is given, and returns merged criteria, risk tier and lookup results")
    public IntakeResponse intake_message(
            @ToolParam(description = "User id owning the session") String userId,
            @ToolParam(description = "Raw user message") String message,
            @ToolParam(description = "Optional endpoint: triage, doctors or workshops", required = false) String endpoint) {
        Target target = endpoint == null || endpoint.isBlank() ? null : Target.fromWireName(endpoint);
        return intakeService.handle(userId, message, target);
    }

    @Tool(description = "Get the criteria accumulated so far for a user and endpoint, with the turn each value came from")
    public Map<String, Object> session_context(
            @ToolParam(description = "User id owning the session") String userId,
            @ToolParam(description = "Endpoint: triage, doctors or workshops") String endpoint) {
        return intakeService.sessionContext(userId, Target.fromWireName(endpoint));
    }

    @Tool(description = "Get the session's risk high-water mark (1-4) and accumulated danger reasons")
    public Map<String, Object> risk_state(@ToolParam(description = "User id owning the session") String userId) {
        return intakeService.riskState(userId);
    }
}

package com.example.healthintake.dispatch;

import com.example.healthintake.model.RoutingDecision;
import com.example.healthintake.model.SessionRecord;
import com.example.healthintake.model.Target;
import com.example.healthintake.model.Turn;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.io.ByteArrayResource;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MessageRouterTest {

    @Mock
    private LlmExtractionClient llm;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private MessageRouter router;

    @BeforeEach
    void setUp() {
        router = new MessageRouter(llm, new ExtractionParser(objectMapper), objectMapper,
                new ByteArrayResource("router prompt".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void testRoute_UsesClassifiedEndpoint() {
        // Given
        when(llm.complete(eq("router prompt"), anyString()))
                .thenReturn("{\"endpoint\": \"doctors/interpret\", \"confidence\": 0.92, \"reasoning\": \"busca cardiólogo\"}");

        // When
        RoutingDecision decision = router.route("quiero un cardiólogo", null);

        // Then
        assertEquals(Target.DOCTORS, decision.getTarget());
        assertEquals(0.92, decision.getConfidence(), 1e-9);
        assertEquals("busca cardiólogo", decision.getReasoning());
        assertFalse(decision.isFallback());
    }

    @Test
    void testRoute_SendsPendingQuestionOfNewestTurn() throws Exception {
        // Given
        when(llm.complete(anyString(), anyString()))
                .thenReturn("{\"endpoint\": \"doctors/interpret\", \"confidence\": 0.8}");
        SessionRecord session = session(Turn.builder().message("cardiólogo").target(Target.DOCTORS)
                .pendingQuestion("¿Presencial o virtual?").build());

        // When
        router.route("virtual", session);

        // Then
        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        verify(llm).complete(anyString(), payload.capture());
        var json = objectMapper.readTree(payload.getValue());
        assertEquals("virtual", json.get("mensaje").asText());
        assertEquals("¿Presencial o virtual?", json.get("pregunta_pendiente").asText());
        assertEquals("doctors/interpret", json.get("ultimo_endpoint").asText());
    }

    @Test
    void testRoute_FailureWithPendingQuestionStaysOnThatEndpoint() {
        // Given
        when(llm.complete(anyString(), anyString())).thenThrow(new ExtractionFailedException("timeout"));
        SessionRecord session = session(Turn.builder().message("talleres").target(Target.WORKSHOPS)
                .pendingQuestion("¿Qué tema te interesa?").build());

        // When
        RoutingDecision decision = router.route("sueño", session);

        // Then
        assertEquals(Target.WORKSHOPS, decision.getTarget());
        assertTrue(decision.isFallback());
    }

    @Test
    void testRoute_FailureWithoutPendingQuestionGoesToTriage() {
        // Given
        when(llm.complete(anyString(), anyString())).thenReturn("{\"endpoint\": \"billing/interpret\"}");
        SessionRecord session = session(Turn.builder().message("talleres").target(Target.WORKSHOPS).build());

        // When
        RoutingDecision decision = router.route("algo raro", session);

        // Then
        assertEquals(Target.TRIAGE, decision.getTarget());
        assertTrue(decision.isFallback());
    }

    private static SessionRecord session(Turn... turns) {
        return SessionRecord.builder().userId("user-1").turns(List.of(turns)).build();
    }
}

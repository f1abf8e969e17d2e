package com.example.healthintake.controller;

import com.example.healthintake.dispatch.IntakeAbortedException;
import com.example.healthintake.model.IntakeRequest;
import com.example.healthintake.model.Target;
import com.example.healthintake.service.IntakeService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;

@RestController
public class IntakeController {

    private static final Logger logger = LoggerFactory.getLogger(IntakeController.class);

    private final IntakeService intakeService;

    @Value("${app.request.timeout-ms:30000}")
    private long requestTimeoutMs;

    public IntakeController(IntakeService intakeService) {
        this.intakeService = intakeService;
    }

    @PostMapping(value = "/agent/route", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Object>> route(@RequestBody IntakeRequest request) {
        return intake(request, null);
    }

    @PostMapping(value = "/triage/interpret", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Object>> triage(@RequestBody IntakeRequest request) {
        return intake(request, Target.TRIAGE);
    }

    @PostMapping(value = "/doctors/interpret", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Object>> doctors(@RequestBody IntakeRequest request) {
        return intake(request, Target.DOCTORS);
    }

    @PostMapping(value = "/workshops/interpret", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Object>> workshops(@RequestBody IntakeRequest request) {
        return intake(request, Target.WORKSHOPS);
    }

    @GetMapping(value = "/sessions/{userId}/context", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Object>> context(@PathVariable String userId,
                                                @RequestParam(defaultValue = "triage") String target) {
        Target resolved;
        try {
            resolved = Target.fromWireName(target);
        } catch (IllegalArgumentException e) {
            return Mono.just(error(HttpStatus.BAD_REQUEST, e.getMessage()));
        }
        return Mono.fromCallable(() -> ResponseEntity.ok((Object) intakeService.sessionContext(userId, resolved)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping(value = "/sessions/{userId}/risk", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Object>> risk(@PathVariable String userId) {
        return Mono.fromCallable(() -> ResponseEntity.ok((Object) intakeService.riskState(userId)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private Mono<ResponseEntity<Object>> intake(IntakeRequest request, Target target) {
        if (request == null || request.getUserId() == null || request.getUserId().isBlank()) {
            return Mono.just(error(HttpStatus.BAD_REQUEST, "user_id es requerido."));
        }
        if (request.getMessage() == null || request.getMessage().isBlank()) {
            return Mono.just(error(HttpStatus.BAD_REQUEST, "message es requerido."));
        }
        String userId = request.getUserId().trim();
        String message = request.getMessage().trim();

        return Mono.fromCallable(() -> ResponseEntity.ok((Object) intakeService.handle(userId, message, target)))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(Duration.ofMillis(requestTimeoutMs))
                .onErrorResume(TimeoutException.class, e -> {
                    logger.warn("Intake for user {} timed out after {}ms", userId, requestTimeoutMs);
                    return Mono.just(error(HttpStatus.GATEWAY_TIMEOUT, "La solicitud tardó demasiado, intenta nuevamente."));
                })
                .onErrorResume(IntakeAbortedException.class, e -> {
                    logger.warn("Intake for user {} aborted: {}", userId, e.getMessage());
                    return Mono.just(error(HttpStatus.GATEWAY_TIMEOUT, "La solicitud fue cancelada, intenta nuevamente."));
                })
                .onErrorResume(e -> {
                    logger.error("Intake for user {} failed", userId, e);
                    return Mono.just(error(HttpStatus.INTERNAL_SERVER_ERROR, "Error interno: " + e.getMessage()));
                });
    }

    private static ResponseEntity<Object> error(HttpStatus status, String message) {
        Map<String, Object> body = new HashMap<>();
        body.put("error", message);
        body.put("status", status.value());
        return ResponseEntity.status(status).body(body);
    }
}

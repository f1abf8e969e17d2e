package com.example.healthintake.controller;

import com.example.healthintake.kv.KvClient;
import com.example.healthintake.store.DirectoryClient;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final KvClient kvClient;
    private final DirectoryClient directoryClient;

    public HealthController(KvClient kvClient, DirectoryClient directoryClient) {
        this.kvClient = kvClient;
        this.directoryClient = directoryClient;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("service", "health-intake");
        health.put("version", "1.0.0");

        try {
            health.put("redis", kvClient.ping() ? "UP" : "DOWN");
        } catch (Exception e) {
            health.put("redis", "DOWN");
            health.put("redisError", e.getMessage());
        }

        try {
            health.put("mongodb", directoryClient.ping() ? "UP" : "DOWN");
        } catch (Exception e) {
            health.put("mongodb", "DOWN");
            health.put("mongodbError", e.getMessage());
        }

        return ResponseEntity.ok(health);
    }
}

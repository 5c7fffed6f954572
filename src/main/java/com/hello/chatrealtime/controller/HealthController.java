package com.hello.chatrealtime.controller;

import com.hello.chatrealtime.registry.ConnectionRegistry;
import com.hello.chatrealtime.service.CallSessionManager;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final ConnectionRegistry connectionRegistry;
    private final CallSessionManager callSessionManager;

    public HealthController(ConnectionRegistry connectionRegistry, CallSessionManager callSessionManager) {
        this.connectionRegistry = connectionRegistry;
        this.callSessionManager = callSessionManager;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("connections", connectionRegistry.getConnectionCount());
        body.put("activeCalls", callSessionManager.getActiveCallCount());
        return body;
    }
}

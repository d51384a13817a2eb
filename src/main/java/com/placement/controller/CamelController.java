package com.placement.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.camel.CamelContext;
import org.apache.camel.Route;
import org.apache.camel.ServiceStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runtime control of the Camel routes. The Kafka consumer does not start on its own
 * unless {@code camel.route.autostart=true}; start it here once the store is ready.
 */
@RestController
@RequestMapping("/api/camel")
@RequiredArgsConstructor
@Slf4j
public class CamelController {

    private final CamelContext camelContext;

    @GetMapping("/routes")
    public List<Map<String, Object>> getRoutes() {
        return camelContext.getRoutes().stream()
                .map(this::describe)
                .toList();
    }

    @GetMapping("/routes/{routeId}")
    public ResponseEntity<Map<String, Object>> getRoute(@PathVariable String routeId) {
        Route route = camelContext.getRoute(routeId);
        if (route == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(describe(route));
    }

    @PostMapping("/routes/{routeId}/start")
    public ResponseEntity<Map<String, String>> startRoute(@PathVariable String routeId) {
        try {
            camelContext.getRouteController().startRoute(routeId);
            log.info("Started route: {}", routeId);
            return ResponseEntity.ok(Map.of("routeId", routeId, "status", "STARTED"));
        } catch (Exception e) {
            log.error("Failed to start route {}: {}", routeId, e.getMessage());
            return ResponseEntity.internalServerError().body(Map.of("routeId", routeId, "error", String.valueOf(e.getMessage())));
        }
    }

    @PostMapping("/routes/{routeId}/stop")
    public ResponseEntity<Map<String, String>> stopRoute(@PathVariable String routeId) {
        try {
            camelContext.getRouteController().stopRoute(routeId);
            log.info("Stopped route: {}", routeId);
            return ResponseEntity.ok(Map.of("routeId", routeId, "status", "STOPPED"));
        } catch (Exception e) {
            log.error("Failed to stop route {}: {}", routeId, e.getMessage());
            return ResponseEntity.internalServerError().body(Map.of("routeId", routeId, "error", String.valueOf(e.getMessage())));
        }
    }

    private Map<String, Object> describe(Route route) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("routeId", route.getRouteId());
        map.put("endpoint", route.getEndpoint().getEndpointUri());
        ServiceStatus status = camelContext.getRouteController().getRouteStatus(route.getRouteId());
        map.put("status", status != null ? status.name() : "Unknown");
        return map;
    }
}

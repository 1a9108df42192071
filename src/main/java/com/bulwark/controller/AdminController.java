package com.bulwark.controller;

import com.bulwark.cache.RequestFingerprint;
import com.bulwark.model.ProviderKey;
import com.bulwark.model.dto.ProviderStatistics;
import com.bulwark.resilience.breaker.CircuitState;
import com.bulwark.service.AdminService;
import com.bulwark.service.StatisticsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Admin API: per-provider statistics, breaker controls and cache management.
 */
@Slf4j
@RestController
@RequestMapping("/v1/admin")
public class AdminController {

    private final StatisticsService statisticsService;
    private final AdminService adminService;

    public AdminController(StatisticsService statisticsService, AdminService adminService) {
        this.statisticsService = statisticsService;
        this.adminService = adminService;
    }

    @GetMapping("/providers")
    public ResponseEntity<List<ProviderStatistics>> getProviders() {
        return ResponseEntity.ok(statisticsService.all());
    }

    @GetMapping("/providers/{provider}")
    public ResponseEntity<ProviderStatistics> getProvider(@PathVariable("provider") String provider) {
        return ResponseEntity.ok(statisticsService.forProvider(ProviderKey.of(provider)));
    }

    /**
     * Force the breaker open, closed, or reset it.
     *
     * @param action one of {@code open}, {@code close}, {@code reset}
     */
    @PostMapping("/providers/{provider}/circuit/{action}")
    public ResponseEntity<Map<String, Object>> controlCircuit(
            @PathVariable("provider") String provider,
            @PathVariable("action") String action) {
        ProviderKey key = ProviderKey.of(provider);
        log.info("Admin: circuit {} requested for {}", action, key);

        CircuitState state = switch (action) {
            case "open" -> adminService.forceOpen(key);
            case "close" -> adminService.forceClosed(key);
            case "reset" -> adminService.resetBreaker(key);
            default -> throw new IllegalArgumentException("Unknown circuit action: " + action);
        };
        return ResponseEntity.ok(Map.of("provider", key.getName(), "state", state.name()));
    }

    @PostMapping("/providers/{provider}/rate-limiter/reset")
    public ResponseEntity<Map<String, Object>> resetRateLimiter(@PathVariable("provider") String provider) {
        ProviderKey key = ProviderKey.of(provider);
        adminService.resetRateLimiter(key);
        return ResponseEntity.ok(Map.of("provider", key.getName(), "status", "reset"));
    }

    @DeleteMapping("/providers/{provider}/cache")
    public ResponseEntity<Map<String, Object>> clearCache(@PathVariable("provider") String provider) {
        ProviderKey key = ProviderKey.of(provider);
        int removed = adminService.clearCache(key);
        return ResponseEntity.ok(Map.of("provider", key.getName(), "removed", removed));
    }

    @DeleteMapping("/cache")
    public ResponseEntity<Map<String, Object>> clearAllCaches() {
        int removed = adminService.clearAllCaches();
        return ResponseEntity.ok(Map.of("removed", removed));
    }

    @PostMapping("/providers/{provider}/cache/purge")
    public ResponseEntity<Map<String, Object>> purgeExpired(@PathVariable("provider") String provider) {
        ProviderKey key = ProviderKey.of(provider);
        int removed = adminService.purgeExpired(key);
        return ResponseEntity.ok(Map.of("provider", key.getName(), "removed", removed));
    }

    @DeleteMapping("/providers/{provider}/cache/{fingerprint}")
    public ResponseEntity<Void> invalidate(
            @PathVariable("provider") String provider,
            @PathVariable("fingerprint") String fingerprint) {
        boolean removed = adminService.invalidate(ProviderKey.of(provider), RequestFingerprint.of(fingerprint));
        return removed ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }
}

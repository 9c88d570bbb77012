package org.kioskfleet.controller;

import org.kioskfleet.config.JwtFilter;
import org.kioskfleet.dto.AuthenticatedPrincipal;
import org.kioskfleet.dto.FleetSummary;
import org.kioskfleet.service.IAuthenticationService;
import org.kioskfleet.service.imp.DeviceService;
import org.kioskfleet.service.imp.StalenessSweeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/**
 * Health, fleet-wide counters and the manual sweep trigger.
 */
@RestController
@RequestMapping("/api")
public class FleetController {

    private static final Logger log = LoggerFactory.getLogger(FleetController.class);

    private final DeviceService deviceService;
    private final StalenessSweeper sweeper;
    private final IAuthenticationService authenticationService;
    private final Clock clock;

    public FleetController(DeviceService deviceService,
                           StalenessSweeper sweeper,
                           IAuthenticationService authenticationService,
                           Clock clock) {
        this.deviceService = deviceService;
        this.sweeper = sweeper;
        this.authenticationService = authenticationService;
        this.clock = clock;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of("status", "ok", "timestamp", Instant.now(clock)));
    }

    @GetMapping("/fleet/summary")
    public ResponseEntity<FleetSummary> summary() {
        return ResponseEntity.ok(deviceService.summary());
    }

    @PostMapping("/fleet/sweep")
    public ResponseEntity<Map<String, Object>> sweep(
            @RequestAttribute(name = JwtFilter.PRINCIPAL_ATTRIBUTE, required = false) AuthenticatedPrincipal principal) {
        authenticationService.requireRole(principal, AuthenticatedPrincipal.ROLE_ADMIN);
        log.info("Manual sweep triggered by {}", principal.username());
        int demoted = sweeper.sweepNow();
        return ResponseEntity.ok(Map.of("demoted", demoted));
    }
}

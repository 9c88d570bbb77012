package org.kioskfleet.controller;

import jakarta.validation.Valid;
import org.kioskfleet.config.JwtFilter;
import org.kioskfleet.dto.AuthenticatedPrincipal;
import org.kioskfleet.dto.CommandRequest;
import org.kioskfleet.dto.DeviceCreateRequest;
import org.kioskfleet.dto.DeviceDetailResponse;
import org.kioskfleet.dto.DeviceLogView;
import org.kioskfleet.dto.DeviceResponse;
import org.kioskfleet.dto.DeviceStatusView;
import org.kioskfleet.dto.DeviceUpdateRequest;
import org.kioskfleet.dto.HeartbeatRequest;
import org.kioskfleet.dto.HeartbeatResult;
import org.kioskfleet.dto.PagedResponse;
import org.kioskfleet.enums.DeviceStatus;
import org.kioskfleet.exception.InvalidRequestException;
import org.kioskfleet.service.IAuthenticationService;
import org.kioskfleet.service.imp.DeviceCommandService;
import org.kioskfleet.service.imp.DeviceService;
import org.kioskfleet.service.imp.HeartbeatIngestionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import static org.kioskfleet.dto.AuthenticatedPrincipal.ROLE_ADMIN;
import static org.kioskfleet.dto.AuthenticatedPrincipal.ROLE_MANAGER;

/**
 * REST Controller for the device registry, heartbeats and device pushes.
 */
@RestController
@RequestMapping("/api/devices")
public class DeviceController {

    private final DeviceService deviceService;
    private final HeartbeatIngestionService ingestionService;
    private final DeviceCommandService commandService;
    private final IAuthenticationService authenticationService;

    public DeviceController(DeviceService deviceService,
                            HeartbeatIngestionService ingestionService,
                            DeviceCommandService commandService,
                            IAuthenticationService authenticationService) {
        this.deviceService = deviceService;
        this.ingestionService = ingestionService;
        this.commandService = commandService;
        this.authenticationService = authenticationService;
    }

    /**
     * GET /api/devices?page=1&limit=20&status=online&group_id=...&search=lobby
     */
    @GetMapping
    public ResponseEntity<PagedResponse<DeviceResponse>> listDevices(
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int limit,
            @RequestParam(required = false) String status,
            @RequestParam(name = "group_id", required = false) UUID groupId,
            @RequestParam(required = false) String search) {
        return ResponseEntity.ok(deviceService.listDevices(page, limit, parseStatus(status), groupId, search));
    }

    @GetMapping("/{deviceId}")
    public ResponseEntity<DeviceDetailResponse> getDevice(@PathVariable String deviceId) {
        return ResponseEntity.ok(deviceService.getDevice(deviceId));
    }

    @GetMapping("/{deviceId}/status")
    public ResponseEntity<DeviceStatusView> getStatus(@PathVariable String deviceId) {
        return ResponseEntity.ok(deviceService.getStatus(deviceId));
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> registerDevice(
            @RequestAttribute(name = JwtFilter.PRINCIPAL_ATTRIBUTE, required = false) AuthenticatedPrincipal principal,
            @Valid @RequestBody DeviceCreateRequest request) {
        DeviceResponse device = deviceService.registerDevice(request, principal);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Device registered successfully");
        body.put("device", device);
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    @PutMapping("/{deviceId}")
    public ResponseEntity<Map<String, Object>> updateDevice(
            @RequestAttribute(name = JwtFilter.PRINCIPAL_ATTRIBUTE, required = false) AuthenticatedPrincipal principal,
            @PathVariable String deviceId,
            @Valid @RequestBody DeviceUpdateRequest request) {
        DeviceResponse device = deviceService.updateDevice(deviceId, request, principal);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Device updated successfully");
        body.put("device", device);
        return ResponseEntity.ok(body);
    }

    @DeleteMapping("/{deviceId}")
    public ResponseEntity<Map<String, Object>> deleteDevice(
            @RequestAttribute(name = JwtFilter.PRINCIPAL_ATTRIBUTE, required = false) AuthenticatedPrincipal principal,
            @PathVariable String deviceId) {
        authenticationService.requireRole(principal, ROLE_ADMIN);
        deviceService.deleteDevice(deviceId, principal);
        return ResponseEntity.ok(Map.of("message", "Device deleted successfully", "device_id", deviceId));
    }

    @GetMapping("/{deviceId}/logs")
    public ResponseEntity<PagedResponse<DeviceLogView>> getLogs(
            @PathVariable String deviceId,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "100") int limit,
            @RequestParam(required = false) String level,
            @RequestParam(required = false) String category) {
        return ResponseEntity.ok(deviceService.getLogs(deviceId, page, limit, level, category));
    }

    /**
     * POST /api/devices/{deviceId}/heartbeat
     *
     * Called by the device agent every 30-60 seconds. The body may be empty.
     */
    @PostMapping("/{deviceId}/heartbeat")
    public ResponseEntity<Map<String, Object>> heartbeat(@PathVariable String deviceId,
                                                         @RequestBody(required = false) HeartbeatRequest request) {
        HeartbeatResult result = ingestionService.ingest(deviceId, request);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Heartbeat received");
        body.put("device_id", result.deviceId());
        body.put("status", result.status());
        return ResponseEntity.ok(body);
    }

    @PostMapping("/{deviceId}/commands")
    public ResponseEntity<Map<String, Object>> sendCommand(
            @RequestAttribute(name = JwtFilter.PRINCIPAL_ATTRIBUTE, required = false) AuthenticatedPrincipal principal,
            @PathVariable String deviceId,
            @Valid @RequestBody CommandRequest request) {
        authenticationService.requireRole(principal, ROLE_ADMIN, ROLE_MANAGER);
        boolean delivered = commandService.dispatchCommand(deviceId, request.getCommand(),
                request.getParameters(), principal);
        return ResponseEntity.ok(Map.of("device_id", deviceId, "command", request.getCommand(), "delivered", delivered));
    }

    @PostMapping("/{deviceId}/config")
    public ResponseEntity<Map<String, Object>> pushConfig(
            @RequestAttribute(name = JwtFilter.PRINCIPAL_ATTRIBUTE, required = false) AuthenticatedPrincipal principal,
            @PathVariable String deviceId,
            @RequestBody Map<String, Object> config) {
        authenticationService.requireRole(principal, ROLE_ADMIN, ROLE_MANAGER);
        boolean delivered = commandService.pushConfig(deviceId, config);
        return ResponseEntity.ok(Map.of("device_id", deviceId, "delivered", delivered));
    }

    @PostMapping("/{deviceId}/applications/deploy")
    public ResponseEntity<Map<String, Object>> deployApplication(
            @RequestAttribute(name = JwtFilter.PRINCIPAL_ATTRIBUTE, required = false) AuthenticatedPrincipal principal,
            @PathVariable String deviceId,
            @RequestBody Map<String, Object> application) {
        authenticationService.requireRole(principal, ROLE_ADMIN, ROLE_MANAGER);
        boolean delivered = commandService.deployApplication(deviceId, application);
        return ResponseEntity.ok(Map.of("device_id", deviceId, "delivered", delivered));
    }

    private static DeviceStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return DeviceStatus.fromValue(status);
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("Invalid status: " + status);
        }
    }
}

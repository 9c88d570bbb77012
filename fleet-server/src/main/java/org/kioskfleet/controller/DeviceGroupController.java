package org.kioskfleet.controller;

import jakarta.validation.Valid;
import org.kioskfleet.config.JwtFilter;
import org.kioskfleet.dto.AuthenticatedPrincipal;
import org.kioskfleet.dto.DeviceGroupRequest;
import org.kioskfleet.dto.DeviceGroupResponse;
import org.kioskfleet.service.imp.DeviceGroupService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/device-groups")
public class DeviceGroupController {

    private final DeviceGroupService groupService;

    public DeviceGroupController(DeviceGroupService groupService) {
        this.groupService = groupService;
    }

    @GetMapping
    public ResponseEntity<List<DeviceGroupResponse>> listGroups() {
        return ResponseEntity.ok(groupService.listGroups());
    }

    @GetMapping("/{id}")
    public ResponseEntity<DeviceGroupResponse> getGroup(@PathVariable UUID id) {
        return ResponseEntity.ok(groupService.getGroup(id));
    }

    @PostMapping
    public ResponseEntity<DeviceGroupResponse> createGroup(
            @RequestAttribute(name = JwtFilter.PRINCIPAL_ATTRIBUTE, required = false) AuthenticatedPrincipal principal,
            @Valid @RequestBody DeviceGroupRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(groupService.createGroup(request, principal));
    }

    @PutMapping("/{id}")
    public ResponseEntity<DeviceGroupResponse> updateGroup(@PathVariable UUID id,
                                                           @Valid @RequestBody DeviceGroupRequest request) {
        return ResponseEntity.ok(groupService.updateGroup(id, request));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, String>> deleteGroup(@PathVariable UUID id) {
        groupService.deleteGroup(id);
        return ResponseEntity.ok(Map.of("message", "Device group deleted successfully"));
    }
}

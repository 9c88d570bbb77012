package org.kioskfleet.service.imp;

import org.kioskfleet.dto.DeviceLogView;
import org.kioskfleet.dto.DeviceResponse;
import org.kioskfleet.dto.DeviceStateChange;
import org.kioskfleet.dto.DeviceUpdateRequest;
import org.kioskfleet.dto.HeartbeatRequest;
import org.kioskfleet.dto.OperatorUpdateResult;
import org.kioskfleet.enums.LogLevel;
import org.kioskfleet.exception.DeviceNotFoundException;
import org.kioskfleet.exception.InvalidRequestException;
import org.kioskfleet.model.Device;
import org.kioskfleet.model.DeviceGroup;
import org.kioskfleet.model.DeviceLogEntry;
import org.kioskfleet.repository.DeviceGroupRepository;
import org.kioskfleet.repository.DeviceLogRepository;
import org.kioskfleet.repository.DeviceRepository;
import org.kioskfleet.state.DeviceEvent;
import org.kioskfleet.state.DeviceStateMachine;
import org.kioskfleet.state.StateTransition;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * The authoritative write paths for device state. Every method either
 * commits the whole change (status, documents, timestamps, log rows) or
 * nothing. Cache refresh and notifications happen in the callers, after
 * commit.
 */
@Service
public class DeviceStateWriter {

    private final DeviceRepository deviceRepository;
    private final DeviceLogRepository logRepository;
    private final DeviceGroupRepository groupRepository;
    private final DeviceStateMachine stateMachine;
    private final DeviceLogBatchMapper logBatchMapper;

    public DeviceStateWriter(DeviceRepository deviceRepository,
                             DeviceLogRepository logRepository,
                             DeviceGroupRepository groupRepository,
                             DeviceStateMachine stateMachine,
                             DeviceLogBatchMapper logBatchMapper) {
        this.deviceRepository = deviceRepository;
        this.logRepository = logRepository;
        this.groupRepository = groupRepository;
        this.stateMachine = stateMachine;
        this.logBatchMapper = logBatchMapper;
    }

    /**
     * Records one heartbeat under the device's row lock.
     *
     * @throws DeviceNotFoundException if the device is not registered
     */
    @Transactional
    public DeviceStateChange applyHeartbeat(String deviceId, HeartbeatRequest request, Instant now) {
        Device device = deviceRepository.findByDeviceIdWithLock(deviceId)
                .orElseThrow(() -> new DeviceNotFoundException(deviceId));

        StateTransition transition = stateMachine.apply(device.getStatus(), DeviceEvent.heartbeatReceived());
        device.setStatus(transition.next());

        // Documents are replaced whole, never merged
        if (request.getHardwareInfo() != null) {
            device.setHardwareInfo(request.getHardwareInfo());
        }
        if (request.getSoftwareInfo() != null) {
            device.setSoftwareInfo(request.getSoftwareInfo());
        }
        if (request.getNetworkInfo() != null) {
            device.setNetworkInfo(request.getNetworkInfo());
        }

        device.setLastSeen(now);
        device.setLastHeartbeat(now);
        device.setUpdatedAt(now);

        List<DeviceLogEntry> entries = logBatchMapper.toEntries(device, request.getLogs(), now);
        if (!entries.isEmpty()) {
            logRepository.saveAll(entries);
        }
        // flush so the entity carries the version this write commits
        deviceRepository.flush();

        return new DeviceStateChange(device.getId(), deviceId, transition, now, device.getVersion(),
                entries.stream().map(DeviceLogView::from).toList());
    }

    /**
     * Applies an operator edit under the device's row lock. A status in the
     * request is an explicit override through the state machine.
     */
    @Transactional
    public OperatorUpdateResult applyOperatorUpdate(String deviceId, DeviceUpdateRequest request,
                                                    String updatedBy, Instant now) {
        List<String> fields = request.providedFields();
        if (fields.isEmpty()) {
            throw new InvalidRequestException("No valid fields to update");
        }

        Device device = deviceRepository.findByDeviceIdWithLock(deviceId)
                .orElseThrow(() -> new DeviceNotFoundException(deviceId));

        if (request.getName() != null) {
            device.setName(request.getName().trim());
        }
        if (request.getDescription() != null) {
            device.setDescription(request.getDescription());
        }
        if (request.getDeviceType() != null) {
            device.setDeviceType(request.getDeviceType());
        }
        if (request.getGroupId() != null) {
            device.setGroup(resolveGroup(request.getGroupId()));
        }
        if (request.getLocation() != null) {
            device.setLocation(request.getLocation());
        }

        StateTransition transition = request.getStatus() != null
                ? stateMachine.apply(device.getStatus(), DeviceEvent.operatorSetStatus(request.getStatus()))
                : new StateTransition(device.getStatus(), device.getStatus());
        device.setStatus(transition.next());
        device.setUpdatedAt(now);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("updated_by", updatedBy);
        metadata.put("updated_fields", fields);
        logRepository.save(systemEntry(device, "Device updated", metadata, now));
        deviceRepository.flush();

        DeviceStateChange change = new DeviceStateChange(device.getId(), deviceId, transition,
                device.getLastSeen(), device.getVersion(), List.of());
        return new OperatorUpdateResult(DeviceResponse.from(device), change);
    }

    /**
     * Demotes one sweeper candidate if it is still online and still stale.
     * The conditional update re-checks both, so a heartbeat or override that
     * committed after the candidate was read wins. The row is re-read while
     * the update still holds its lock, so the change carries the committed
     * version.
     *
     * @return The change, or empty if the row no longer qualified
     */
    @Transactional
    public Optional<DeviceStateChange> demoteIfStale(Device candidate, Instant cutoff, Instant now) {
        StateTransition transition = stateMachine.apply(candidate.getStatus(), DeviceEvent.stalenessTimeoutExceeded());
        if (!transition.changed()) {
            return Optional.empty();
        }
        int updated = deviceRepository.transitionIfStale(
                candidate.getId(), transition.previous(), transition.next(), cutoff, now);
        if (updated != 1) {
            return Optional.empty();
        }
        Device demoted = deviceRepository.findById(candidate.getId()).orElse(candidate);
        return Optional.of(new DeviceStateChange(candidate.getId(), candidate.getDeviceId(), transition,
                demoted.getLastSeen(), demoted.getVersion(), List.of()));
    }

    static DeviceLogEntry systemEntry(Device device, String message, Map<String, Object> metadata, Instant now) {
        return DeviceLogEntry.builder()
                .device(device)
                .level(LogLevel.INFO)
                .message(message)
                .category(DeviceLogEntry.SYSTEM_CATEGORY)
                .metadata(metadata)
                .loggedAt(now)
                .build();
    }

    // "" removes the device from its group
    private DeviceGroup resolveGroup(String groupId) {
        if (groupId.isBlank()) {
            return null;
        }
        UUID id;
        try {
            id = UUID.fromString(groupId.trim());
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("Invalid group_id: " + groupId);
        }
        return groupRepository.findById(id)
                .orElseThrow(() -> new InvalidRequestException("Device group not found: " + id));
    }
}

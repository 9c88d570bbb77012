package org.kioskfleet.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.kioskfleet.enums.DeviceStatus;
import org.kioskfleet.enums.DeviceType;
import org.kioskfleet.model.Device;
import org.kioskfleet.model.DeviceGroup;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * REST view of a device. Must be built while the persistence context is
 * open because the group is lazily loaded.
 */
public record DeviceResponse(UUID id,
                             @JsonProperty("device_id") String deviceId,
                             String name,
                             String description,
                             @JsonProperty("device_type") DeviceType deviceType,
                             DeviceStatus status,
                             @JsonProperty("group_id") UUID groupId,
                             @JsonProperty("group_name") String groupName,
                             Map<String, Object> location,
                             @JsonProperty("hardware_info") Map<String, Object> hardwareInfo,
                             @JsonProperty("software_info") Map<String, Object> softwareInfo,
                             @JsonProperty("network_info") Map<String, Object> networkInfo,
                             @JsonProperty("last_seen") Instant lastSeen,
                             @JsonProperty("last_heartbeat") Instant lastHeartbeat,
                             @JsonProperty("created_at") Instant createdAt,
                             @JsonProperty("updated_at") Instant updatedAt,
                             @JsonProperty("created_by") String createdBy) {

    public static DeviceResponse from(Device device) {
        DeviceGroup group = device.getGroup();
        return new DeviceResponse(
                device.getId(),
                device.getDeviceId(),
                device.getName(),
                device.getDescription(),
                device.getDeviceType(),
                device.getStatus(),
                group != null ? group.getId() : null,
                group != null ? group.getName() : null,
                device.getLocation(),
                device.getHardwareInfo(),
                device.getSoftwareInfo(),
                device.getNetworkInfo(),
                device.getLastSeen(),
                device.getLastHeartbeat(),
                device.getCreatedAt(),
                device.getUpdatedAt(),
                device.getCreatedBy());
    }
}

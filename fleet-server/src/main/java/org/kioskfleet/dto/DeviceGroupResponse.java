package org.kioskfleet.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.kioskfleet.model.DeviceGroup;

import java.time.Instant;
import java.util.UUID;

public record DeviceGroupResponse(UUID id,
                                  String name,
                                  String description,
                                  @JsonProperty("parent_id") UUID parentId,
                                  @JsonProperty("created_at") Instant createdAt,
                                  @JsonProperty("updated_at") Instant updatedAt) {

    public static DeviceGroupResponse from(DeviceGroup group) {
        return new DeviceGroupResponse(
                group.getId(),
                group.getName(),
                group.getDescription(),
                group.getParent() != null ? group.getParent().getId() : null,
                group.getCreatedAt(),
                group.getUpdatedAt());
    }
}

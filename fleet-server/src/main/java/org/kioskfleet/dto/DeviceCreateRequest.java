package org.kioskfleet.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.kioskfleet.enums.DeviceType;

import java.util.Map;
import java.util.UUID;

/**
 * Manual registration of a device by an operator.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeviceCreateRequest {

    @NotBlank(message = "Device ID is required")
    @Size(max = 100)
    @JsonProperty("device_id")
    @JsonAlias("deviceId")
    private String deviceId;

    @NotBlank(message = "Device name is required")
    @Size(max = 100)
    private String name;

    private String description;

    @JsonProperty("device_type")
    @JsonAlias("deviceType")
    private DeviceType deviceType;

    @JsonProperty("group_id")
    @JsonAlias("groupId")
    private UUID groupId;

    private Map<String, Object> location;
}

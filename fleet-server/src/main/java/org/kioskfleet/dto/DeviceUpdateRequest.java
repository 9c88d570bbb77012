package org.kioskfleet.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.kioskfleet.enums.DeviceStatus;
import org.kioskfleet.enums.DeviceType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Operator update. Only non-null fields are applied. {@code status} is an
 * explicit override and goes through the state machine like any other event.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeviceUpdateRequest {

    @Size(min = 1, max = 100, message = "Device name cannot be empty")
    @Pattern(regexp = ".*\\S.*", message = "Device name cannot be empty")
    private String name;

    private String description;

    @JsonProperty("device_type")
    @JsonAlias("deviceType")
    private DeviceType deviceType;

    /**
     * Group UUID, or an empty string to remove the device from its group.
     */
    @JsonProperty("group_id")
    @JsonAlias("groupId")
    private String groupId;

    private Map<String, Object> location;

    private DeviceStatus status;

    public List<String> providedFields() {
        List<String> fields = new ArrayList<>();
        if (name != null) fields.add("name");
        if (description != null) fields.add("description");
        if (deviceType != null) fields.add("device_type");
        if (groupId != null) fields.add("group_id");
        if (location != null) fields.add("location");
        if (status != null) fields.add("status");
        return fields;
    }
}

package org.kioskfleet.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeviceGroupRequest {

    @Size(max = 100)
    private String name;

    private String description;

    /**
     * Parent group UUID, or an empty string to make the group a root.
     */
    @JsonProperty("parent_id")
    @JsonAlias("parentId")
    private String parentId;
}

package org.kioskfleet.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Command sent from an administrator to one device, e.g. restart or
 * install_app. Delivery is best effort: there is no acknowledgment contract.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommandDispatch {

    @JsonProperty("device_id")
    @JsonAlias("deviceId")
    private String deviceId;

    private String command;

    private Map<String, Object> parameters;
}

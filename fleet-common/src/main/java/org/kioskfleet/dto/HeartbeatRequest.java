package org.kioskfleet.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Periodic report sent by a device. The device id travels in the URL (REST)
 * or is bound by the connection (WebSocket), so it is not part of the body.
 * Every field is optional: an empty body is a pure liveness signal.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HeartbeatRequest {

    /**
     * CPU, memory, disk details. Replaces the stored document when present.
     */
    @JsonProperty("hardware_info")
    @JsonAlias("hardwareInfo")
    private Map<String, Object> hardwareInfo;

    /**
     * OS and agent versions. Replaces the stored document when present.
     */
    @JsonProperty("software_info")
    @JsonAlias("softwareInfo")
    private Map<String, Object> softwareInfo;

    /**
     * Interfaces and addresses. Replaces the stored document when present.
     */
    @JsonProperty("network_info")
    @JsonAlias("networkInfo")
    private Map<String, Object> networkInfo;

    /**
     * Log entries collected since the previous heartbeat.
     */
    private List<DeviceLogPayload> logs;
}

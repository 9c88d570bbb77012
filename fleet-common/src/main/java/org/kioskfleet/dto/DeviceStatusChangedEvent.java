package org.kioskfleet.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.kioskfleet.enums.DeviceStatus;

import java.io.Serializable;
import java.time.Instant;
import java.util.UUID;

/**
 * Pushed to the admin channel (and optionally Kafka) whenever a device's
 * status actually changes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeviceStatusChangedEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String EVENT_NAME = "device:status:changed";

    /**
     * Internal row id of the device
     */
    @JsonProperty("device_id")
    private UUID deviceId;

    /**
     * External, operator-chosen device identifier (e.g. KIOSK-001)
     */
    @JsonProperty("device_id_string")
    private String deviceIdString;

    /**
     * Status after the transition
     */
    private DeviceStatus status;

    /**
     * Status before the transition
     */
    @JsonProperty("previous_status")
    private DeviceStatus previousStatus;

    /**
     * Last time the device was heard from
     */
    @JsonProperty("last_seen")
    private Instant lastSeen;

    /**
     * Row version after the change. Increases with every committed write to
     * the device, so a consumer can drop an event older than one it has applied.
     */
    private Long version;
}

package org.kioskfleet.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Envelope of every frame the server writes to a real-time connection.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class HubMessage {
    private String type;

    private Object data;

    private Instant timestamp;

}

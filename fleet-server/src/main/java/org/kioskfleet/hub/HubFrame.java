package org.kioskfleet.hub;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Inbound frame from a client: {@code {"type": "...", "data": {...}}}.
 */
public record HubFrame(String type, JsonNode data) {
}

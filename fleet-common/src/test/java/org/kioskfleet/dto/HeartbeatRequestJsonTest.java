package org.kioskfleet.dto;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class HeartbeatRequestJsonTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void acceptsSnakeAndCamelCaseTelemetryFields() throws Exception {
        String json = """
                {
                  "hardware_info": {"cpu": "arm64", "memory_mb": 2048},
                  "softwareInfo": {"agent": "1.0"},
                  "logs": [
                    {"level": "info", "message": "booted", "category": "system"},
                    {"level": "warn"}
                  ]
                }
                """;

        HeartbeatRequest request = mapper.readValue(json, HeartbeatRequest.class);

        assertThat(request.getHardwareInfo()).containsEntry("cpu", "arm64");
        assertThat(request.getSoftwareInfo()).containsEntry("agent", "1.0");
        assertThat(request.getNetworkInfo()).isNull();
        assertThat(request.getLogs()).hasSize(2);
        assertThat(request.getLogs().get(1).getMessage()).isNull();
    }

    @Test
    void commandDispatchUsesSnakeCaseDeviceId() throws Exception {
        CommandDispatch dispatch = CommandDispatch.builder()
                .deviceId("KIOSK-002")
                .command("restart")
                .build();

        String json = mapper.writeValueAsString(dispatch);

        assertThat(json).contains("\"device_id\":\"KIOSK-002\"");
        assertThat(mapper.readValue("{\"deviceId\":\"K-1\",\"command\":\"update\"}", CommandDispatch.class)
                .getDeviceId()).isEqualTo("K-1");
    }
}

package org.kioskfleet.service.imp;

import org.apache.kafka.common.KafkaException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.kioskfleet.config.KafkaProducerConfig;
import org.kioskfleet.dto.DeviceStatusChangedEvent;
import org.kioskfleet.enums.DeviceStatus;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DeviceStatusEventProducerTest {

    @Mock
    private KafkaTemplate<String, Object> kafkaTemplate;

    private DeviceStatusEventProducer producer;
    private DeviceStatusChangedEvent event;

    @BeforeEach
    void setUp() {
        producer = new DeviceStatusEventProducer(kafkaTemplate);
        event = DeviceStatusChangedEvent.builder()
                .deviceId(UUID.randomUUID())
                .deviceIdString("KIOSK-001")
                .status(DeviceStatus.OFFLINE)
                .previousStatus(DeviceStatus.ONLINE)
                .lastSeen(Instant.parse("2024-05-01T09:58:00Z"))
                .version(4L)
                .build();
    }

    @Test
    void sendsToStatusTopicKeyedByDeviceId() {
        when(kafkaTemplate.send(KafkaProducerConfig.DEVICE_STATUS_TOPIC, "KIOSK-001", event))
                .thenReturn(new CompletableFuture<>());

        producer.publish(event);

        verify(kafkaTemplate).send(KafkaProducerConfig.DEVICE_STATUS_TOPIC, "KIOSK-001", event);
    }

    @Test
    void failedDeliveryIsOnlyLogged() {
        when(kafkaTemplate.send(KafkaProducerConfig.DEVICE_STATUS_TOPIC, "KIOSK-001", event))
                .thenReturn(CompletableFuture.failedFuture(new KafkaException("Broker unavailable")));

        assertThatCode(() -> producer.publish(event)).doesNotThrowAnyException();
    }

    @Test
    void synchronousSendFailureIsContained() {
        when(kafkaTemplate.send(KafkaProducerConfig.DEVICE_STATUS_TOPIC, "KIOSK-001", event))
                .thenThrow(new KafkaException("Producer closed"));

        assertThatCode(() -> producer.publish(event)).doesNotThrowAnyException();
    }
}

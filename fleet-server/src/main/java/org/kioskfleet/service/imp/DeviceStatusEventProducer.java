package org.kioskfleet.service.imp;

import org.kioskfleet.config.KafkaProducerConfig;
import org.kioskfleet.dto.DeviceStatusChangedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Exports device status changes to Kafka for consumers outside this server.
 * Only enabled when kafka.enabled=true
 */
@Service
@ConditionalOnProperty(name = "kafka.enabled", havingValue = "true", matchIfMissing = false)
public class DeviceStatusEventProducer {

    private static final Logger log = LoggerFactory.getLogger(DeviceStatusEventProducer.class);

    private final KafkaTemplate<String, Object> kafkaTemplate;

    public DeviceStatusEventProducer(KafkaTemplate<String, Object> kafkaTemplate) {
        this.kafkaTemplate = kafkaTemplate;
    }

    /**
     * Send event to Kafka asynchronously, keyed by the external device id so
     * one device's events stay ordered on one partition.
     */
    public void publish(DeviceStatusChangedEvent event) {
        log.debug("Publishing status event: deviceId={}, status={}",
                event.getDeviceIdString(), event.getStatus());

        CompletableFuture<SendResult<String, Object>> future;
        try {
            future = kafkaTemplate.send(KafkaProducerConfig.DEVICE_STATUS_TOPIC, event.getDeviceIdString(), event);
        } catch (RuntimeException e) {
            log.error("Failed to send status event: deviceId={}, error={}", event.getDeviceIdString(), e.getMessage());
            return;
        }

        future.whenComplete((result, ex) -> {
            if (ex == null) {
                log.debug("Status event sent: deviceId={}, partition={}, offset={}",
                        event.getDeviceIdString(),
                        result.getRecordMetadata().partition(),
                        result.getRecordMetadata().offset());
            } else {
                log.error("Failed to send status event: deviceId={}, error={}",
                        event.getDeviceIdString(), ex.getMessage());
            }
        });
    }
}

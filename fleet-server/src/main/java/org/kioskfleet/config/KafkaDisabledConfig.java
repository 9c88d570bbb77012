package org.kioskfleet.config;

import org.springframework.boot.autoconfigure.EnableAutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.kafka.KafkaAutoConfiguration;
import org.springframework.context.annotation.Configuration;

/**
 * Keeps Kafka auto-configuration from connecting when status export is off.
 */
@Configuration
@ConditionalOnProperty(name = "kafka.enabled", havingValue = "false", matchIfMissing = true)
@EnableAutoConfiguration(exclude = KafkaAutoConfiguration.class)
public class KafkaDisabledConfig {
}

package org.kioskfleet.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.kioskfleet.enums.DeviceStatus;
import org.kioskfleet.enums.DeviceType;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Durable record of a managed device. The row is the source of truth for the
 * device's status; the Redis entry is only a copy of it.
 *
 * Status changes go through DeviceStateMachine. Writers hold a row lock
 * (heartbeat, operator update) or use a conditional update (sweeper), and
 * {@code version} is bumped on every change.
 */
@Entity
@Table(name = "devices", indexes = {
        @Index(name = "idx_devices_status", columnList = "status"),
        @Index(name = "idx_devices_group_id", columnList = "group_id"),
        @Index(name = "idx_devices_last_seen", columnList = "last_seen")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Device {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "device_id", nullable = false, unique = true, updatable = false, length = 100)
    private String deviceId; // e.g. KIOSK-001, chosen by the operator

    @Column(nullable = false, length = 100)
    private String name;

    @Column(length = 2000)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "device_type", nullable = false, length = 20)
    @Builder.Default
    private DeviceType deviceType = DeviceType.KIOSK;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private DeviceStatus status = DeviceStatus.OFFLINE;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "group_id")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private DeviceGroup group;

    // --- Opaque documents, stored as JSON ---
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "location")
    private Map<String, Object> location;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "hardware_info")
    private Map<String, Object> hardwareInfo;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "software_info")
    private Map<String, Object> softwareInfo;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "network_info")
    private Map<String, Object> networkInfo;

    @Column(name = "last_seen")
    private Instant lastSeen;

    @Column(name = "last_heartbeat")
    private Instant lastHeartbeat;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "created_by", length = 100)
    private String createdBy;

    @Version
    @Column(name = "version")
    private Long version;
}

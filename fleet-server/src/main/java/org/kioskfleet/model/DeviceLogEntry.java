package org.kioskfleet.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;
import org.hibernate.type.SqlTypes;
import org.kioskfleet.enums.LogLevel;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only log line, either reported by a device inside a heartbeat or
 * written by the server (category "system") on registration and updates.
 */
@Entity
@Table(name = "device_logs", indexes = {
        @Index(name = "idx_device_logs_device_id", columnList = "device_ref"),
        @Index(name = "idx_device_logs_logged_at", columnList = "logged_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeviceLogEntry {

    public static final String DEFAULT_CATEGORY = "device";
    public static final String SYSTEM_CATEGORY = "system";
    public static final int CATEGORY_MAX_LENGTH = 50;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "device_ref", nullable = false, updatable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Device device;

    @Enumerated(EnumType.STRING)
    @Column(name = "log_level", nullable = false, length = 10, updatable = false)
    private LogLevel level;

    @Column(nullable = false, columnDefinition = "TEXT", updatable = false)
    private String message;

    @Column(length = CATEGORY_MAX_LENGTH, updatable = false)
    private String category;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata", updatable = false)
    private Map<String, Object> metadata;

    @Column(name = "logged_at", nullable = false, updatable = false)
    private Instant loggedAt;
}

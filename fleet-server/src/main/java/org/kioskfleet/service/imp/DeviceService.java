package org.kioskfleet.service.imp;

import jakarta.persistence.criteria.Predicate;
import org.hibernate.query.criteria.HibernateCriteriaBuilder;
import org.kioskfleet.dto.AuthenticatedPrincipal;
import org.kioskfleet.dto.CachedStatus;
import org.kioskfleet.dto.DeviceCreateRequest;
import org.kioskfleet.dto.DeviceDetailResponse;
import org.kioskfleet.dto.DeviceLogView;
import org.kioskfleet.dto.DeviceResponse;
import org.kioskfleet.dto.DeviceStatusView;
import org.kioskfleet.dto.DeviceUpdateRequest;
import org.kioskfleet.dto.FleetSummary;
import org.kioskfleet.dto.OperatorUpdateResult;
import org.kioskfleet.dto.PagedResponse;
import org.kioskfleet.enums.DeviceStatus;
import org.kioskfleet.enums.DeviceType;
import org.kioskfleet.enums.LogLevel;
import org.kioskfleet.exception.DeviceAlreadyExistsException;
import org.kioskfleet.exception.DeviceNotFoundException;
import org.kioskfleet.exception.InvalidRequestException;
import org.kioskfleet.hub.ChannelRegistry;
import org.kioskfleet.hub.HubConnection;
import org.kioskfleet.model.Device;
import org.kioskfleet.model.DeviceGroup;
import org.kioskfleet.model.DeviceLogEntry;
import org.kioskfleet.repository.DeviceGroupRepository;
import org.kioskfleet.repository.DeviceLogRepository;
import org.kioskfleet.repository.DeviceRepository;
import org.kioskfleet.service.IDeviceStatusCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Device registry: registration, queries, operator updates and deletion.
 * Heartbeats go through {@link HeartbeatIngestionService}.
 */
@Service
public class DeviceService {

    private static final Logger log = LoggerFactory.getLogger(DeviceService.class);

    static final int MAX_DEVICE_PAGE_SIZE = 100;
    static final int MAX_LOG_PAGE_SIZE = 1000;

    private final DeviceRepository deviceRepository;
    private final DeviceLogRepository logRepository;
    private final DeviceGroupRepository groupRepository;
    private final DeviceStateWriter stateWriter;
    private final IDeviceStatusCache statusCache;
    private final DeviceEventPublisher eventPublisher;
    private final ChannelRegistry channelRegistry;
    private final Clock clock;

    public DeviceService(DeviceRepository deviceRepository,
                         DeviceLogRepository logRepository,
                         DeviceGroupRepository groupRepository,
                         DeviceStateWriter stateWriter,
                         IDeviceStatusCache statusCache,
                         DeviceEventPublisher eventPublisher,
                         ChannelRegistry channelRegistry,
                         Clock clock) {
        this.deviceRepository = deviceRepository;
        this.logRepository = logRepository;
        this.groupRepository = groupRepository;
        this.stateWriter = stateWriter;
        this.statusCache = statusCache;
        this.eventPublisher = eventPublisher;
        this.channelRegistry = channelRegistry;
        this.clock = clock;
    }

    /**
     * Filtered page of devices, most recently seen first; never-seen devices last.
     *
     * @param page   1-based page number
     * @param limit  page size, 1 to 100
     * @param search case-insensitive match on name, device id or description
     */
    @Transactional(readOnly = true)
    public PagedResponse<DeviceResponse> listDevices(int page, int limit, DeviceStatus status,
                                                     UUID groupId, String search) {
        checkPaging(page, limit, MAX_DEVICE_PAGE_SIZE);
        Page<Device> devices = deviceRepository.findAll(
                deviceFilter(status, groupId, search), PageRequest.of(page - 1, limit));
        return PagedResponse.from(devices, DeviceResponse::from);
    }

    @Transactional(readOnly = true)
    public DeviceDetailResponse getDevice(String deviceId) {
        Device device = findDevice(deviceId);
        List<DeviceLogView> recentLogs = logRepository.findTop10ByDeviceOrderByLoggedAtDesc(device)
                .stream().map(DeviceLogView::from).toList();
        return new DeviceDetailResponse(DeviceResponse.from(device), recentLogs);
    }

    /**
     * Status lookup that prefers the cache and repopulates it on a miss.
     */
    public DeviceStatusView getStatus(String deviceId) {
        Optional<CachedStatus> cached = statusCache.get(deviceId);
        if (cached.isPresent()) {
            return new DeviceStatusView(deviceId, cached.get().status(), cached.get().lastSeen(),
                    DeviceStatusView.SOURCE_CACHE);
        }
        Device device = findDevice(deviceId);
        statusCache.put(deviceId, new CachedStatus(device.getStatus(), device.getLastSeen(), device.getVersion()));
        return new DeviceStatusView(deviceId, device.getStatus(), device.getLastSeen(),
                DeviceStatusView.SOURCE_DATABASE);
    }

    @Transactional
    public DeviceResponse registerDevice(DeviceCreateRequest request, AuthenticatedPrincipal principal) {
        String deviceId = request.getDeviceId().trim();
        if (deviceRepository.existsByDeviceId(deviceId)) {
            throw new DeviceAlreadyExistsException(deviceId);
        }

        DeviceGroup group = null;
        if (request.getGroupId() != null) {
            group = groupRepository.findById(request.getGroupId())
                    .orElseThrow(() -> new InvalidRequestException("Device group not found: " + request.getGroupId()));
        }

        Instant now = now();
        String createdBy = principal != null ? principal.username() : null;
        Device device = Device.builder()
                .deviceId(deviceId)
                .name(request.getName().trim())
                .description(request.getDescription())
                .deviceType(request.getDeviceType() != null ? request.getDeviceType() : DeviceType.KIOSK)
                .status(DeviceStatus.OFFLINE)
                .group(group)
                .location(request.getLocation())
                .createdAt(now)
                .updatedAt(now)
                .createdBy(createdBy)
                .build();
        try {
            device = deviceRepository.saveAndFlush(device);
        } catch (DataIntegrityViolationException e) {
            // lost the race against a concurrent registration of the same id
            throw new DeviceAlreadyExistsException(deviceId);
        }

        logRepository.save(DeviceStateWriter.systemEntry(device, "Device registered",
                Map.of("created_by", createdBy != null ? createdBy : "unknown"), now));

        log.info("Device registered: deviceId={}, by={}", deviceId, createdBy);
        return DeviceResponse.from(device);
    }

    public DeviceResponse updateDevice(String deviceId, DeviceUpdateRequest request, AuthenticatedPrincipal principal) {
        String updatedBy = principal != null ? principal.username() : null;
        OperatorUpdateResult result = stateWriter.applyOperatorUpdate(deviceId, request, updatedBy, now());

        if (result.change().transition().changed()) {
            statusCache.put(deviceId, result.change().toCachedStatus());
            eventPublisher.statusChanged(result.change());
        }

        log.info("Device updated: deviceId={}, fields={}, by={}", deviceId, request.providedFields(), updatedBy);
        return result.device();
    }

    /**
     * Deletes the device; its log rows go with it through the foreign key.
     * Live connections of the device are closed and leave every channel.
     */
    public void deleteDevice(String deviceId, AuthenticatedPrincipal principal) {
        Device device = findDevice(deviceId);
        deviceRepository.deleteById(device.getId());
        statusCache.evict(deviceId);
        int closed = disconnect(deviceId);
        eventPublisher.deviceDeleted(device.getId(), deviceId);
        log.info("Device deleted: deviceId={}, by={}, closedConnections={}",
                deviceId, principal != null ? principal.username() : null, closed);
    }

    @Transactional(readOnly = true)
    public PagedResponse<DeviceLogView> getLogs(String deviceId, int page, int limit, String level, String category) {
        checkPaging(page, limit, MAX_LOG_PAGE_SIZE);
        Device device = findDevice(deviceId);

        LogLevel logLevel = null;
        if (level != null && !level.isBlank()) {
            logLevel = LogLevel.parse(level)
                    .orElseThrow(() -> new InvalidRequestException("Invalid level: " + level));
        }

        Page<DeviceLogEntry> entries = logRepository.findAll(
                logFilter(device, logLevel, category),
                PageRequest.of(page - 1, limit, Sort.by(Sort.Direction.DESC, "loggedAt")));
        return PagedResponse.from(entries, DeviceLogView::from);
    }

    private int disconnect(String deviceId) {
        Set<HubConnection> connections = channelRegistry.members(ChannelRegistry.deviceChannel(deviceId));
        for (HubConnection connection : connections) {
            channelRegistry.leaveAll(connection);
            connection.close();
        }
        return connections.size();
    }

    public boolean exists(String deviceId) {
        return deviceRepository.existsByDeviceId(deviceId);
    }

    public FleetSummary summary() {
        Map<DeviceStatus, Long> byStatus = new EnumMap<>(DeviceStatus.class);
        long total = 0;
        for (DeviceStatus status : DeviceStatus.values()) {
            long count = deviceRepository.countByStatus(status);
            byStatus.put(status, count);
            total += count;
        }
        return new FleetSummary(total, byStatus, channelRegistry.connectionCount());
    }

    private Device findDevice(String deviceId) {
        return deviceRepository.findByDeviceId(deviceId)
                .orElseThrow(() -> new DeviceNotFoundException(deviceId));
    }

    private Instant now() {
        return Instant.now(clock).truncatedTo(ChronoUnit.MICROS);
    }

    private static void checkPaging(int page, int limit, int maxLimit) {
        List<String> details = new ArrayList<>();
        if (page < 1) {
            details.add("page must be a positive integer");
        }
        if (limit < 1 || limit > maxLimit) {
            details.add("limit must be between 1 and " + maxLimit);
        }
        if (!details.isEmpty()) {
            throw new InvalidRequestException("Validation failed", details);
        }
    }

    static Specification<Device> deviceFilter(DeviceStatus status, UUID groupId, String search) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (status != null) {
                predicates.add(cb.equal(root.get("status"), status));
            }
            if (groupId != null) {
                predicates.add(cb.equal(root.get("group").get("id"), groupId));
            }
            if (search != null && !search.isBlank()) {
                String pattern = "%" + search.trim().toLowerCase() + "%";
                predicates.add(cb.or(
                        cb.like(cb.lower(root.get("name")), pattern),
                        cb.like(cb.lower(root.get("deviceId")), pattern),
                        cb.like(cb.lower(root.get("description")), pattern)));
            }
            // count queries carry no ordering
            if (query.getResultType() != Long.class && query.getResultType() != long.class
                    && cb instanceof HibernateCriteriaBuilder hcb) {
                query.orderBy(hcb.desc(root.get("lastSeen"), false), hcb.desc(root.get("createdAt")));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }

    static Specification<DeviceLogEntry> logFilter(Device device, LogLevel level, String category) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            predicates.add(cb.equal(root.get("device"), device));
            if (level != null) {
                predicates.add(cb.equal(root.get("level"), level));
            }
            if (category != null && !category.isBlank()) {
                predicates.add(cb.equal(root.get("category"), category));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}

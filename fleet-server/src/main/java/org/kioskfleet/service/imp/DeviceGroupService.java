package org.kioskfleet.service.imp;

import org.kioskfleet.dto.AuthenticatedPrincipal;
import org.kioskfleet.dto.DeviceGroupRequest;
import org.kioskfleet.dto.DeviceGroupResponse;
import org.kioskfleet.exception.DeviceGroupNotFoundException;
import org.kioskfleet.exception.InvalidRequestException;
import org.kioskfleet.model.DeviceGroup;
import org.kioskfleet.repository.DeviceGroupRepository;
import org.kioskfleet.repository.DeviceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Service
public class DeviceGroupService {

    private static final Logger log = LoggerFactory.getLogger(DeviceGroupService.class);

    private final DeviceGroupRepository groupRepository;
    private final DeviceRepository deviceRepository;
    private final Clock clock;

    public DeviceGroupService(DeviceGroupRepository groupRepository, DeviceRepository deviceRepository, Clock clock) {
        this.groupRepository = groupRepository;
        this.deviceRepository = deviceRepository;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<DeviceGroupResponse> listGroups() {
        return groupRepository.findAllByOrderByNameAsc().stream()
                .map(DeviceGroupResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public DeviceGroupResponse getGroup(UUID id) {
        return DeviceGroupResponse.from(findGroup(id));
    }

    @Transactional
    public DeviceGroupResponse createGroup(DeviceGroupRequest request, AuthenticatedPrincipal principal) {
        if (request.getName() == null || request.getName().isBlank()) {
            throw new InvalidRequestException("Group name is required");
        }
        Instant now = now();
        DeviceGroup group = DeviceGroup.builder()
                .name(request.getName().trim())
                .description(request.getDescription())
                .parent(resolveParent(request.getParentId()))
                .createdBy(principal != null ? principal.username() : null)
                .createdAt(now)
                .updatedAt(now)
                .build();
        group = groupRepository.save(group);
        log.info("Device group created: groupId={}, name={}", group.getId(), group.getName());
        return DeviceGroupResponse.from(group);
    }

    @Transactional
    public DeviceGroupResponse updateGroup(UUID id, DeviceGroupRequest request) {
        DeviceGroup group = findGroup(id);
        boolean changed = false;

        if (request.getName() != null) {
            if (request.getName().isBlank()) {
                throw new InvalidRequestException("Group name cannot be empty");
            }
            group.setName(request.getName().trim());
            changed = true;
        }
        if (request.getDescription() != null) {
            group.setDescription(request.getDescription());
            changed = true;
        }
        if (request.getParentId() != null) {
            DeviceGroup parent = resolveParent(request.getParentId());
            checkNoCycle(group, parent);
            group.setParent(parent);
            changed = true;
        }
        if (!changed) {
            throw new InvalidRequestException("No valid fields to update");
        }

        group.setUpdatedAt(now());
        log.info("Device group updated: groupId={}", id);
        return DeviceGroupResponse.from(group);
    }

    /**
     * Deletes the group. Member devices become ungrouped and child groups
     * become roots.
     */
    @Transactional
    public void deleteGroup(UUID id) {
        DeviceGroup group = findGroup(id);
        int devices = deviceRepository.clearGroup(id);
        int children = groupRepository.detachChildren(id);
        groupRepository.delete(group);
        log.info("Device group deleted: groupId={}, ungroupedDevices={}, detachedChildren={}", id, devices, children);
    }

    /**
     * Rejects a parent that is the group itself or one of its descendants.
     */
    void checkNoCycle(DeviceGroup group, DeviceGroup newParent) {
        Set<UUID> visited = new HashSet<>();
        for (DeviceGroup cursor = newParent; cursor != null; cursor = cursor.getParent()) {
            if (cursor.getId().equals(group.getId())) {
                throw new InvalidRequestException("Group hierarchy cannot contain cycles",
                        List.of("parent_id " + newParent.getId() + " is the group itself or one of its descendants"));
            }
            if (!visited.add(cursor.getId())) {
                break; // existing data already loops; stop walking
            }
        }
    }

    // "" makes the group a root
    private DeviceGroup resolveParent(String parentId) {
        if (parentId == null || parentId.isBlank()) {
            return null;
        }
        UUID id;
        try {
            id = UUID.fromString(parentId.trim());
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("Invalid parent_id: " + parentId);
        }
        return groupRepository.findById(id)
                .orElseThrow(() -> new InvalidRequestException("Parent group not found: " + id));
    }

    private DeviceGroup findGroup(UUID id) {
        return groupRepository.findById(id).orElseThrow(() -> new DeviceGroupNotFoundException(id));
    }

    private Instant now() {
        return Instant.now(clock).truncatedTo(ChronoUnit.MICROS);
    }
}

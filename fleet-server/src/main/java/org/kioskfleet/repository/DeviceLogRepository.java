package org.kioskfleet.repository;

import org.kioskfleet.model.Device;
import org.kioskfleet.model.DeviceLogEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Repository for device log entries. Entries are only ever inserted and
 * read; they disappear with their device through ON DELETE CASCADE.
 */
@Repository
public interface DeviceLogRepository extends JpaRepository<DeviceLogEntry, UUID>,
        JpaSpecificationExecutor<DeviceLogEntry> {

    /**
     * Most recent entries for the device detail view.
     *
     * @param device The owning device
     * @return Up to 10 entries, newest first
     */
    List<DeviceLogEntry> findTop10ByDeviceOrderByLoggedAtDesc(Device device);

    long countByDevice(Device device);
}

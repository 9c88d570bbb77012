package org.kioskfleet.repository;

import jakarta.persistence.LockModeType;
import org.kioskfleet.enums.DeviceStatus;
import org.kioskfleet.model.Device;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for Device rows.
 *
 * Two write paths touch the status column and they must never lose each
 * other's update:
 * 1. Heartbeats and operator updates read the row with PESSIMISTIC_WRITE and
 *    modify it inside one transaction.
 * 2. The sweeper issues a single conditional UPDATE that only matches while
 *    the row is still in the expected state and still stale.
 */
@Repository
public interface DeviceRepository extends JpaRepository<Device, UUID>, JpaSpecificationExecutor<Device> {

    /**
     * Plain lookup by the external device id. Used by read paths.
     *
     * @param deviceId The operator-chosen identifier
     * @return Optional containing the device if registered
     */
    Optional<Device> findByDeviceId(String deviceId);

    /**
     * Lookup with a database row lock held until the surrounding transaction
     * ends. Serializes heartbeats, operator updates and the sweeper for the
     * same device while leaving other devices untouched.
     *
     * @param deviceId The operator-chosen identifier
     * @return Optional containing the locked device
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT d FROM Device d WHERE d.deviceId = :deviceId")
    Optional<Device> findByDeviceIdWithLock(@Param("deviceId") String deviceId);

    boolean existsByDeviceId(String deviceId);

    /**
     * Devices in the given status whose last heartbeat is older than the cutoff
     * (or that never heartbeated). Candidates only: the demotion itself is
     * re-checked by {@link #transitionIfStale}.
     */
    @Query("SELECT d FROM Device d WHERE d.status = :status " +
           "AND (d.lastHeartbeat IS NULL OR d.lastHeartbeat < :cutoff)")
    List<Device> findStaleCandidates(@Param("status") DeviceStatus status,
                                     @Param("cutoff") Instant cutoff);

    /**
     * Conditional status change used by the sweeper. Matches only if the row
     * is still in {@code from} and still stale at the moment of the update, so
     * a heartbeat or operator change committed in between wins.
     *
     * @return 1 if the device was transitioned, 0 if it no longer qualified
     */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE Device d SET d.status = :to, d.updatedAt = :now, d.version = d.version + 1 " +
           "WHERE d.id = :id AND d.status = :from " +
           "AND (d.lastHeartbeat IS NULL OR d.lastHeartbeat < :cutoff)")
    int transitionIfStale(@Param("id") UUID id,
                          @Param("from") DeviceStatus from,
                          @Param("to") DeviceStatus to,
                          @Param("cutoff") Instant cutoff,
                          @Param("now") Instant now);

    /**
     * Detach every device from a group that is about to be deleted.
     */
    @Modifying
    @Query("UPDATE Device d SET d.group = null WHERE d.group.id = :groupId")
    int clearGroup(@Param("groupId") UUID groupId);

    long countByStatus(DeviceStatus status);
}

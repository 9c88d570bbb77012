package org.kioskfleet.repository;

import org.kioskfleet.model.DeviceGroup;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface DeviceGroupRepository extends JpaRepository<DeviceGroup, UUID> {

    List<DeviceGroup> findAllByOrderByNameAsc();

    /**
     * Children of a deleted group become roots.
     */
    @Modifying
    @Query("UPDATE DeviceGroup g SET g.parent = null WHERE g.parent.id = :parentId")
    int detachChildren(@Param("parentId") UUID parentId);
}

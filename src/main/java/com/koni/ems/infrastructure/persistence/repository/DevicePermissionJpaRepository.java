package com.koni.ems.infrastructure.persistence.repository;

import com.koni.ems.infrastructure.persistence.entity.DevicePermissionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DevicePermissionJpaRepository extends JpaRepository<DevicePermissionEntity, Long> {

    boolean existsByUserIdAndDeviceId(String userId, String deviceId);

    @Query("select p.deviceId from DevicePermissionEntity p where p.userId = :userId")
    List<String> findDeviceIdsByUserId(@Param("userId") String userId);
}

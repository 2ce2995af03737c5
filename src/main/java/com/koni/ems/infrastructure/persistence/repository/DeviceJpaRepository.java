package com.koni.ems.infrastructure.persistence.repository;

import com.koni.ems.infrastructure.persistence.entity.DeviceEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * JPA repository for the device registry.
 */
@Repository
public interface DeviceJpaRepository extends JpaRepository<DeviceEntity, String> {

    @Query("select d.id from DeviceEntity d")
    List<String> findAllIds();

    @Query("select d.id from DeviceEntity d where d.relationName = :relationName")
    Optional<String> findIdByRelationName(@Param("relationName") String relationName);

    List<DeviceEntity> findAllByOrderByIdAsc();

    List<DeviceEntity> findAllByRelationNameIsNullOrderByIdAsc();

    List<DeviceEntity> findAllByIdInOrderByIdAsc(Collection<String> ids);
}

package com.koni.ems.infrastructure.persistence.entity;

import com.koni.ems.domain.model.RegisterMapping;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * JPA entity for the device registry.
 * The relation name is stored alongside the identifier so that the database itself
 * rejects two devices sharing one relation.
 */
@Entity
@Table(
    name = "devices",
    indexes = {
        @Index(name = "idx_devices_status", columnList = "status")
    }
)
@Getter
@Setter
@NoArgsConstructor
public class DeviceEntity {

    @Id
    @Column(name = "id", length = 255)
    private String id;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "type", nullable = false, length = 100)
    private String type;

    @Column(name = "ip_address", nullable = false, length = 45)
    private String ipAddress;

    @Column(name = "subnet_mask", nullable = false, length = 45)
    private String subnetMask;

    @Column(name = "slave_address", nullable = false)
    private int slaveAddress;

    @Column(name = "status", nullable = false, length = 20)
    private String status;

    @Column(name = "include_in_total_summary")
    private boolean includeInTotalSummary;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "parameter_mappings")
    private List<RegisterMapping> registerMap = new ArrayList<>();

    @Column(name = "relation_name", unique = true, length = 63)
    private String relationName;

    @Column(name = "last_seen")
    private Instant lastSeen;

    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}

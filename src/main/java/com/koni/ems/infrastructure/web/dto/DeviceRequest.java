package com.koni.ems.infrastructure.web.dto;

import com.koni.ems.domain.model.DeviceStatus;
import com.koni.ems.domain.model.RegisterMapping;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Data Transfer Object for registering or updating a device.
 * Unset optional fields take the defaults of the device type.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class DeviceRequest {

    @NotBlank(message = "id is required")
    @Size(max = 255, message = "id must be at most 255 characters")
    private String id;

    @NotBlank(message = "name is required")
    private String name;

    private String type;

    @NotBlank(message = "ipAddress is required")
    private String ipAddress;

    private String subnetMask;

    @Min(value = 0, message = "slaveAddress must be between 0 and 255")
    @Max(value = 255, message = "slaveAddress must be between 0 and 255")
    private Integer slaveAddress;

    private DeviceStatus status;

    private Boolean includeInTotalSummary;

    private List<RegisterMapping> registerMap;
}

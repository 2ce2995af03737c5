package com.koni.ems.infrastructure.web.dto;

import com.koni.ems.domain.model.DeviceStatus;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Body of a device status report: {@code {"status": "online"}}.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class DeviceStatusRequest {

    @NotNull(message = "Invalid status")
    private DeviceStatus status;
}

package com.koni.ems.infrastructure.web.dto;

import com.koni.ems.domain.model.DeviceStoreState;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class StoreStatusResponse {

    private final String deviceId;
    private final String relation;
    private final DeviceStoreState state;
}

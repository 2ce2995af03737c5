package com.koni.ems.application.query;

import com.koni.ems.domain.model.Caller;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Query to retrieve the registered devices visible to the caller.
 */
@Getter
@AllArgsConstructor
public class GetDevicesQuery {

    private final Caller caller;
}

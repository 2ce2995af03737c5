package com.koni.ems.application.query;

import com.koni.ems.domain.model.DataPoint;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * One page of rows of a device relation.
 * {@code count} is the number of rows in this page.
 */
@Getter
@AllArgsConstructor
public class DataPointPage {

    private final String deviceId;
    private final int count;
    private final List<DataPoint> data;
}

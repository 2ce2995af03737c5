package com.koni.ems.domain.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Result of one orphan sweep.
 */
@Getter
@AllArgsConstructor
@ToString
public final class ReclaimReport {

    private final int examined;
    private final List<String> dropped;
    private final List<String> failed;

    public static ReclaimReport empty() {
        return new ReclaimReport(0, List.of(), List.of());
    }
}

package com.koni.ems.domain.repository;

import com.koni.ems.domain.model.DataPoint;
import com.koni.ems.domain.model.DataPointStats;
import com.koni.ems.domain.model.IngestResult;
import com.koni.ems.domain.model.Reading;
import com.koni.ems.domain.model.RelationName;
import com.koni.ems.domain.model.TimeWindow;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for the rows of device relations.
 * This interface is part of the domain layer and defines the contract
 * for time-series access without coupling to the storage engine.
 */
public interface DataPointRepository {

    /**
     * Inserts one row holding only the columns the reading reports.
     * The statement commits on its own; no row is visible before it returns.
     *
     * @param relation  the device relation
     * @param reading   the validated reading
     * @return the generated id and the stored timestamp
     * @throws com.koni.ems.domain.exception.ValidationException if a value overflows its column
     * @throws com.koni.ems.domain.exception.DatabaseUnavailableException if the database is unreachable
     */
    IngestResult insert(RelationName relation, Reading reading);

    /**
     * Rows inside the window, newest first.
     */
    List<DataPoint> findRange(RelationName relation, TimeWindow window, int limit, int offset);

    Optional<DataPoint> findLatest(RelationName relation);

    /**
     * Aggregates over the window in a single statement.
     */
    DataPointStats stats(RelationName relation, TimeWindow window);
}

package com.koni.ems.infrastructure.web.controller;

import com.koni.ems.application.command.IngestDataPointCommand;
import com.koni.ems.application.command.IngestDataPointCommandHandler;
import com.koni.ems.application.command.IngestRegisterFrameCommand;
import com.koni.ems.application.command.IngestRegisterFrameCommandHandler;
import com.koni.ems.application.query.DataPointPage;
import com.koni.ems.application.query.GetDataPointStatsQuery;
import com.koni.ems.application.query.GetDataPointStatsQueryHandler;
import com.koni.ems.application.query.GetDataPointsQuery;
import com.koni.ems.application.query.GetDataPointsQueryHandler;
import com.koni.ems.application.query.GetLatestDataPointQuery;
import com.koni.ems.application.query.GetLatestDataPointQueryHandler;
import com.koni.ems.domain.model.Caller;
import com.koni.ems.domain.model.DataPoint;
import com.koni.ems.domain.model.IngestResult;
import com.koni.ems.infrastructure.web.dto.DataPointStatsResponse;
import com.koni.ems.infrastructure.web.dto.IngestResponse;
import com.koni.ems.infrastructure.web.dto.RegisterFrameRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Map;

/**
 * REST controller for device readings.
 *
 * Endpoints:
 * - POST /api/v1/data/{deviceId}: Store one reading
 * - POST /api/v1/data/{deviceId}/registers: Decode and store a register frame
 * - GET /api/v1/data/{deviceId}: Rows in a time window, newest first
 * - GET /api/v1/data/{deviceId}/latest: Newest row
 * - GET /api/v1/data/{deviceId}/stats: Power, power factor and frequency aggregates
 */
@RestController
@RequestMapping("/api/v1/data")
@RequiredArgsConstructor
@Slf4j
public class DataPointController {

    private final IngestDataPointCommandHandler ingestHandler;
    private final IngestRegisterFrameCommandHandler registerFrameHandler;
    private final GetDataPointsQueryHandler dataPointsHandler;
    private final GetLatestDataPointQueryHandler latestHandler;
    private final GetDataPointStatsQueryHandler statsHandler;

    /**
     * Stores one reading.
     *
     * Example request:
     * POST /api/v1/data/meter-1
     * {
     *   "timestamp": "2025-01-31T13:00:00Z",
     *   "Ptotal": 10.5,
     *   "PFavg": 0.95
     * }
     *
     * @return 201 Created with the generated row id and stored timestamp
     */
    @PostMapping("/{deviceId}")
    public ResponseEntity<IngestResponse> ingest(
            Caller caller,
            @PathVariable String deviceId,
            @RequestBody Map<String, Object> payload) {
        log.debug("Received reading: deviceId={}, fields={}", deviceId, payload.size());

        IngestResult result = ingestHandler.handle(new IngestDataPointCommand(caller, deviceId, payload));
        return ResponseEntity.status(HttpStatus.CREATED).body(IngestResponse.from(result));
    }

    @PostMapping("/{deviceId}/registers")
    public ResponseEntity<IngestResponse> ingestRegisters(
            Caller caller,
            @PathVariable String deviceId,
            @RequestBody @Valid RegisterFrameRequest request) {
        log.debug("Received register frame: deviceId={}, parameters={}", deviceId, request.getRegisters().keySet());

        IngestResult result = registerFrameHandler.handle(new IngestRegisterFrameCommand(
                caller, deviceId, toInstant(request.getTimestamp()), request.getRegisters()));
        return ResponseEntity.status(HttpStatus.CREATED).body(IngestResponse.from(result));
    }

    @GetMapping("/{deviceId}")
    public ResponseEntity<DataPointPage> getDataPoints(
            Caller caller,
            @PathVariable String deviceId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime startTime,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime endTime,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset) {
        DataPointPage page = dataPointsHandler.handle(new GetDataPointsQuery(
                caller, deviceId, toInstant(startTime), toInstant(endTime), limit, offset));
        return ResponseEntity.ok(page);
    }

    @GetMapping("/{deviceId}/latest")
    public ResponseEntity<DataPoint> getLatest(Caller caller, @PathVariable String deviceId) {
        return ResponseEntity.ok(latestHandler.handle(new GetLatestDataPointQuery(caller, deviceId)));
    }

    @GetMapping("/{deviceId}/stats")
    public ResponseEntity<DataPointStatsResponse> getStats(
            Caller caller,
            @PathVariable String deviceId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime startTime,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime endTime) {
        return ResponseEntity.ok(DataPointStatsResponse.from(statsHandler.handle(
                new GetDataPointStatsQuery(caller, deviceId, toInstant(startTime), toInstant(endTime)))));
    }

    private static Instant toInstant(OffsetDateTime value) {
        return value == null ? null : value.toInstant();
    }
}

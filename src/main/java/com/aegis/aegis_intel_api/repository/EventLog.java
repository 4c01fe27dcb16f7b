package com.aegis.aegis_intel_api.repository;

import com.aegis.aegis_intel_api.dto.detection.Detection;
import com.aegis.aegis_intel_api.dto.detection.ThreatReport;
import com.aegis.aegis_intel_api.dto.log.EventLogRow;
import com.aegis.aegis_intel_api.exception.EventLogWriteException;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Append-only record of every detection event. Rows are never updated; the only removal
 * is the explicit {@link #purgeOlderThan(LocalDateTime)} maintenance operation.
 */
public interface EventLog {

    /**
     * Writes one row per detection, or one sentinel row when the list is empty.
     * Either every row of the call is persisted or none is.
     */
    List<EventLogRow> append(String imageFilename, ThreatReport report, List<Detection> detections,
                             double inferenceMs) throws EventLogWriteException;

    /**
     * The last {@code limit} rows in append order (oldest first, most recent last).
     */
    List<EventLogRow> readRecent(int limit);

    /**
     * Every readable row, taken from a single point-in-time read of the store.
     * Rows that cannot be parsed are skipped.
     */
    List<EventLogRow> snapshot();

    /**
     * Raw bytes of the backing store in its boundary format, empty if nothing was logged yet.
     */
    Optional<byte[]> export();

    /**
     * Rewrites the store without rows older than {@code cutoff}.
     *
     * @return number of rows removed
     */
    int purgeOlderThan(LocalDateTime cutoff);
}

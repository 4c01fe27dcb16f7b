package com.aegis.aegis_intel_api.dto.analytics;

import com.aegis.aegis_intel_api.dto.log.EventLogRow;

import java.util.List;
import java.util.Map;

/**
 * Aggregated dashboard view rebuilt from the event log.
 */
public record DashboardSnapshot(
        Summary summary,
        Map<String, Long> threatDistribution,
        List<DailyCount> detectionsOverTime,
        List<ClassCount> topClasses,
        Map<String, Map<Integer, Long>> hourlyHeatmap,
        List<HistogramBin> confidenceHistogram,
        List<EventLogRow> recentRows
) {

    public record Summary(long totalScans, long totalDetections, long criticalToday, String mostDetectedClass) {}

    public record DailyCount(String date, long count) {}

    public record ClassCount(String className, long count, String risk) {}

    public record HistogramBin(String bin, long count) {}
}

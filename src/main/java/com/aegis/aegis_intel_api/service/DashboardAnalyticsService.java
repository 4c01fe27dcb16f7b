package com.aegis.aegis_intel_api.service;

import com.aegis.aegis_intel_api.dto.analytics.DashboardSnapshot;
import com.aegis.aegis_intel_api.dto.analytics.DashboardSnapshot.ClassCount;
import com.aegis.aegis_intel_api.dto.analytics.DashboardSnapshot.DailyCount;
import com.aegis.aegis_intel_api.dto.analytics.DashboardSnapshot.HistogramBin;
import com.aegis.aegis_intel_api.dto.analytics.DashboardSnapshot.Summary;
import com.aegis.aegis_intel_api.dto.detection.ThreatLevel;
import com.aegis.aegis_intel_api.dto.log.EventLogRow;
import com.aegis.aegis_intel_api.repository.EventLog;
import com.aegis.aegis_intel_api.service.risk.RiskClassifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Rebuilds the intelligence dashboard from a single read of the event log.
 * Never fails: an absent or unreadable log yields the zero-valued snapshot.
 */
@Slf4j
@Service
public class DashboardAnalyticsService {

    static final int SERIES_DAYS = 30;
    static final int TOP_CLASS_LIMIT = 10;
    static final int HISTOGRAM_BINS = 10;
    static final int RECENT_ROW_LIMIT = 25;
    static final String NO_CLASS_PLACEHOLDER = "None";

    private final EventLog eventLog;
    private final RiskClassifier riskClassifier;
    private final Clock clock;

    public DashboardAnalyticsService(EventLog eventLog, RiskClassifier riskClassifier, Clock clock) {
        this.eventLog = eventLog;
        this.riskClassifier = riskClassifier;
        this.clock = clock;
    }

    public DashboardSnapshot compute() {
        List<EventLogRow> rows;
        try {
            rows = eventLog.snapshot();
        } catch (RuntimeException e) {
            log.error("Failed to read event log for dashboard, returning empty snapshot: {}", e.getMessage());
            return compute(List.of());
        }
        return compute(rows);
    }

    public DashboardSnapshot compute(List<EventLogRow> rows) {
        LocalDate today = LocalDate.now(clock);

        List<EventLogRow> detections = rows.stream()
                .filter(row -> !row.isSentinel())
                .toList();

        Map<String, Long> classCounts = countClasses(detections);

        return new DashboardSnapshot(
                buildSummary(rows, detections, classCounts, today),
                buildThreatDistribution(rows),
                buildDailySeries(detections, today),
                buildTopClasses(classCounts),
                buildHeatmap(detections),
                buildConfidenceHistogram(detections),
                buildRecentRows(rows));
    }

    private Summary buildSummary(List<EventLogRow> rows, List<EventLogRow> detections,
                                 Map<String, Long> classCounts, LocalDate today) {
        long totalScans = rows.stream().map(EventLogRow::imageFilename).distinct().count();

        long criticalToday = rows.stream()
                .filter(row -> ThreatLevel.CRITICAL.name().equals(row.threatLevel()))
                .filter(row -> row.timestamp().toLocalDate().equals(today))
                .map(EventLogRow::imageFilename)
                .distinct()
                .count();

        String mostDetected = classCounts.isEmpty()
                ? NO_CLASS_PLACEHOLDER
                : classCounts.keySet().iterator().next();

        return new Summary(totalScans, detections.size(), criticalToday, mostDetected);
    }

    /**
     * Class counts, most frequent first; ties keep first-seen order.
     */
    private Map<String, Long> countClasses(List<EventLogRow> detections) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (EventLogRow row : detections) {
            counts.merge(row.className(), 1L, Long::sum);
        }
        List<Map.Entry<String, Long>> entries = new ArrayList<>(counts.entrySet());
        entries.sort(Map.Entry.<String, Long>comparingByValue().reversed());

        Map<String, Long> sorted = new LinkedHashMap<>();
        entries.forEach(e -> sorted.put(e.getKey(), e.getValue()));
        return sorted;
    }

    private Map<String, Long> buildThreatDistribution(List<EventLogRow> rows) {
        Map<String, String> levelByImage = new HashMap<>();
        for (EventLogRow row : rows) {
            levelByImage.putIfAbsent(row.imageFilename(), row.threatLevel());
        }

        Map<String, Long> distribution = new LinkedHashMap<>();
        for (ThreatLevel level : ThreatLevel.values()) {
            distribution.put(level.name(), 0L);
        }
        for (String level : levelByImage.values()) {
            distribution.computeIfPresent(level, (k, v) -> v + 1);
        }
        return distribution;
    }

    private List<DailyCount> buildDailySeries(List<EventLogRow> detections, LocalDate today) {
        Map<LocalDate, Long> perDay = new HashMap<>();
        for (EventLogRow row : detections) {
            perDay.merge(row.timestamp().toLocalDate(), 1L, Long::sum);
        }

        List<DailyCount> series = new ArrayList<>(SERIES_DAYS);
        for (int offset = SERIES_DAYS - 1; offset >= 0; offset--) {
            LocalDate date = today.minusDays(offset);
            series.add(new DailyCount(date.toString(), perDay.getOrDefault(date, 0L)));
        }
        return series;
    }

    private List<ClassCount> buildTopClasses(Map<String, Long> classCounts) {
        return classCounts.entrySet().stream()
                .limit(TOP_CLASS_LIMIT)
                .map(e -> new ClassCount(e.getKey(), e.getValue(),
                        riskClassifier.classify(e.getKey()).getCode()))
                .toList();
    }

    private Map<String, Map<Integer, Long>> buildHeatmap(List<EventLogRow> detections) {
        Map<String, Map<Integer, Long>> heatmap = new LinkedHashMap<>();
        for (DayOfWeek day : DayOfWeek.values()) {
            Map<Integer, Long> hours = new LinkedHashMap<>();
            for (int hour = 0; hour < 24; hour++) {
                hours.put(hour, 0L);
            }
            heatmap.put(dayKey(day), hours);
        }
        for (EventLogRow row : detections) {
            heatmap.get(dayKey(row.timestamp().getDayOfWeek()))
                    .merge(row.timestamp().getHour(), 1L, Long::sum);
        }
        return heatmap;
    }

    private static String dayKey(DayOfWeek day) {
        return day.getDisplayName(TextStyle.SHORT, Locale.ENGLISH);
    }

    /**
     * Ten right-closed bins over [0, 1]; the first bin also includes 0.0.
     * Values outside [0, 1] are ignored.
     */
    private List<HistogramBin> buildConfidenceHistogram(List<EventLogRow> detections) {
        long[] counts = new long[HISTOGRAM_BINS];
        for (EventLogRow row : detections) {
            int bin = binIndex(row.confidence());
            if (bin >= 0) {
                counts[bin]++;
            }
        }

        List<HistogramBin> histogram = new ArrayList<>(HISTOGRAM_BINS);
        for (int i = 0; i < HISTOGRAM_BINS; i++) {
            histogram.add(new HistogramBin(binLabel(i), counts[i]));
        }
        return histogram;
    }

    static int binIndex(double confidence) {
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            return -1;
        }
        int ceiling = BigDecimal.valueOf(confidence)
                .multiply(BigDecimal.TEN)
                .setScale(0, RoundingMode.CEILING)
                .intValue();
        return Math.max(0, ceiling - 1);
    }

    static String binLabel(int index) {
        return String.format(Locale.ROOT, "%.1f-%.1f", index / 10.0, (index + 1) / 10.0);
    }

    private List<EventLogRow> buildRecentRows(List<EventLogRow> rows) {
        List<EventLogRow> tail = new ArrayList<>(rows.subList(Math.max(0, rows.size() - RECENT_ROW_LIMIT), rows.size()));
        Collections.reverse(tail);
        tail.sort(Comparator.comparing(EventLogRow::timestamp).reversed());
        return List.copyOf(tail);
    }
}

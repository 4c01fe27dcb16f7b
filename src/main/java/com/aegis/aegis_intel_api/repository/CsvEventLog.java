package com.aegis.aegis_intel_api.repository;

import com.aegis.aegis_intel_api.config.StorageProperties;
import com.aegis.aegis_intel_api.dto.detection.Detection;
import com.aegis.aegis_intel_api.dto.detection.ThreatReport;
import com.aegis.aegis_intel_api.dto.log.EventLogRow;
import com.aegis.aegis_intel_api.exception.EventLogWriteException;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * CSV-backed event log.
 *
 * All writers go through one in-process lock plus an exclusive file lock, so rows of concurrent
 * appends never interleave. A failed append truncates the file back to its previous length, and a
 * row left torn by a crash is skipped by readers without hiding the rows around it.
 */
@Slf4j
@Repository
public class CsvEventLog implements EventLog {

    public static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Path logPath;
    private final Clock clock;
    // only quote values that contain a separator, quote or line break
    private final CsvMapper csvMapper = CsvMapper.builder()
            .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
            .build();
    private final CsvSchema schema = csvMapper.schemaFor(CsvRecord.class);
    private final ReentrantLock lock = new ReentrantLock();

    @Autowired
    public CsvEventLog(StorageProperties storageProperties, Clock clock) {
        this(Paths.get(storageProperties.getEventLogPath()), clock);
    }

    public CsvEventLog(Path logPath, Clock clock) {
        this.logPath = logPath.toAbsolutePath().normalize();
        this.clock = clock;
    }

    @Override
    public List<EventLogRow> append(String imageFilename, ThreatReport report, List<Detection> detections,
                                    double inferenceMs) {
        LocalDateTime timestamp = LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
        String level = report.threatLevel().name();
        List<EventLogRow> rows = new ArrayList<>();

        if (detections.isEmpty()) {
            rows.add(EventLogRow.sentinel(timestamp, imageFilename, level, inferenceMs));
        } else {
            int total = report.stats().total();
            int highRisk = report.stats().highRisk();
            for (Detection d : detections) {
                rows.add(new EventLogRow(timestamp, imageFilename, level, total, highRisk,
                        d.className(), d.confidence(), d.riskLevel().getCode(),
                        d.box().x1(), d.box().y1(), d.box().x2(), d.box().y2(), inferenceMs));
            }
        }

        byte[] payload;
        try {
            payload = encode(rows, false).getBytes(StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new EventLogWriteException("Could not encode event log rows for " + imageFilename, e);
        }

        lock.lock();
        try {
            appendAtomically(payload);
        } catch (IOException e) {
            throw new EventLogWriteException("Failed to append " + rows.size() + " rows for " + imageFilename, e);
        } finally {
            lock.unlock();
        }

        log.info("Logged {} detection rows for {}", rows.size(), imageFilename);
        return List.copyOf(rows);
    }

    @Override
    public List<EventLogRow> readRecent(int limit) {
        List<EventLogRow> rows = snapshot();
        if (limit <= 0) {
            return List.of();
        }
        return List.copyOf(rows.subList(Math.max(0, rows.size() - limit), rows.size()));
    }

    @Override
    public List<EventLogRow> snapshot() {
        Optional<byte[]> content = export();
        if (content.isEmpty()) {
            return List.of();
        }
        return decode(new String(content.get(), StandardCharsets.UTF_8));
    }

    @Override
    public Optional<byte[]> export() {
        lock.lock();
        try {
            if (!Files.exists(logPath) || Files.size(logPath) == 0) {
                return Optional.empty();
            }
            return Optional.of(Files.readAllBytes(logPath));
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read event log at " + logPath, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int purgeOlderThan(LocalDateTime cutoff) {
        lock.lock();
        try {
            if (!Files.exists(logPath) || Files.size(logPath) == 0) {
                return 0;
            }
            List<EventLogRow> rows = decode(Files.readString(logPath, StandardCharsets.UTF_8));
            List<EventLogRow> kept = rows.stream()
                    .filter(row -> !row.timestamp().isBefore(cutoff))
                    .toList();
            int removed = rows.size() - kept.size();
            if (removed == 0) {
                return 0;
            }

            Path temp = logPath.resolveSibling(logPath.getFileName() + ".compact");
            Files.writeString(temp, encode(kept, true), StandardCharsets.UTF_8);
            Files.move(temp, logPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.info("Compacted event log: removed {} rows older than {}, kept {}", removed, cutoff, kept.size());
            return removed;
        } catch (IOException e) {
            throw new UncheckedIOException("Event log compaction failed", e);
        } finally {
            lock.unlock();
        }
    }

    public Path getLogPath() {
        return logPath;
    }

    private void appendAtomically(byte[] payload) throws IOException {
        Files.createDirectories(logPath.getParent());
        try (FileChannel channel = FileChannel.open(logPath,
                StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE);
             FileLock ignored = channel.lock()) {
            long originalSize = channel.size();
            byte[] prefix;
            if (originalSize == 0) {
                prefix = encodeHeader().getBytes(StandardCharsets.UTF_8);
            } else if (!endsWithNewline(channel, originalSize)) {
                // partial row from an interrupted write
                log.warn("Event log {} ends with a partial row, starting a new line", logPath);
                prefix = new byte[]{'\n'};
            } else {
                prefix = new byte[0];
            }
            ByteBuffer buffer = ByteBuffer.allocate(prefix.length + payload.length).put(prefix).put(payload);
            buffer.flip();

            try {
                long position = originalSize;
                while (buffer.hasRemaining()) {
                    position += channel.write(buffer, position);
                }
                channel.force(false);
            } catch (IOException e) {
                try {
                    channel.truncate(originalSize);
                } catch (IOException rollback) {
                    e.addSuppressed(rollback);
                }
                throw e;
            }
        }
    }

    private static boolean endsWithNewline(FileChannel channel, long size) throws IOException {
        ByteBuffer last = ByteBuffer.allocate(1);
        channel.read(last, size - 1);
        return last.get(0) == '\n';
    }

    private String encodeHeader() {
        return String.join(",", CsvRecord.COLUMNS) + "\n";
    }

    private String encode(List<EventLogRow> rows, boolean withHeader) throws IOException {
        StringWriter out = new StringWriter();
        CsvSchema writeSchema = withHeader ? schema.withHeader() : schema.withoutHeader();
        try (SequenceWriter writer = csvMapper.writer(writeSchema).writeValues(out)) {
            for (EventLogRow row : rows) {
                writer.write(CsvRecord.from(row));
            }
        }
        return out.toString();
    }

    /**
     * Parses one row per line against the file's own header. A row that cannot be read, torn or
     * fused rows included, is skipped on its own.
     */
    private List<EventLogRow> decode(String content) {
        List<EventLogRow> rows = new ArrayList<>();
        String[] lines = content.split("\r?\n");
        if (lines.length == 0 || lines[0].isBlank()) {
            return rows;
        }

        ObjectReader reader = csvMapper.readerFor(CsvRecord.class).with(schemaFromHeader(lines[0]));
        for (int i = 1; i < lines.length; i++) {
            if (lines[i].isBlank()) {
                continue;
            }
            try {
                CsvRecord record = reader.readValue(lines[i]);
                rows.add(record.toRow());
            } catch (IOException | DateTimeParseException | NumberFormatException | NullPointerException e) {
                log.warn("Skipping unparseable event log row at line {}: {}", i + 1, e.getMessage());
            }
        }
        return rows;
    }

    private static CsvSchema schemaFromHeader(String header) {
        CsvSchema.Builder builder = CsvSchema.builder();
        for (String column : header.split(",")) {
            builder.addColumn(column.trim());
        }
        return builder.build().withoutHeader();
    }

    /**
     * Boundary representation of a row; the column order is part of the file format.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonPropertyOrder({"timestamp", "image_filename", "threat_level", "total_detections", "high_risk_count",
            "class_name", "confidence", "risk_level", "box_x1", "box_y1", "box_x2", "box_y2", "inference_ms"})
    static class CsvRecord {

        static final String[] COLUMNS = {"timestamp", "image_filename", "threat_level", "total_detections",
                "high_risk_count", "class_name", "confidence", "risk_level", "box_x1", "box_y1", "box_x2",
                "box_y2", "inference_ms"};

        private String timestamp;
        @JsonProperty("image_filename")
        private String imageFilename;
        @JsonProperty("threat_level")
        private String threatLevel;
        @JsonProperty("total_detections")
        private String totalDetections;
        @JsonProperty("high_risk_count")
        private String highRiskCount;
        @JsonProperty("class_name")
        private String className;
        private String confidence;
        @JsonProperty("risk_level")
        private String riskLevel;
        @JsonProperty("box_x1")
        private String boxX1;
        @JsonProperty("box_y1")
        private String boxY1;
        @JsonProperty("box_x2")
        private String boxX2;
        @JsonProperty("box_y2")
        private String boxY2;
        @JsonProperty("inference_ms")
        private String inferenceMs;

        static CsvRecord from(EventLogRow row) {
            return new CsvRecord(
                    TIMESTAMP_FORMAT.format(row.timestamp()),
                    row.imageFilename(),
                    row.threatLevel(),
                    Integer.toString(row.totalDetections()),
                    Integer.toString(row.highRiskCount()),
                    row.className(),
                    String.format(Locale.ROOT, "%.4f", row.confidence()),
                    row.riskLevel(),
                    Integer.toString(row.boxX1()),
                    Integer.toString(row.boxY1()),
                    Integer.toString(row.boxX2()),
                    Integer.toString(row.boxY2()),
                    Double.toString(row.inferenceMs()));
        }

        EventLogRow toRow() {
            return new EventLogRow(
                    LocalDateTime.parse(timestamp.trim(), TIMESTAMP_FORMAT),
                    imageFilename,
                    threatLevel,
                    Integer.parseInt(totalDetections.trim()),
                    Integer.parseInt(highRiskCount.trim()),
                    className,
                    Double.parseDouble(confidence.trim()),
                    riskLevel,
                    Integer.parseInt(boxX1.trim()),
                    Integer.parseInt(boxY1.trim()),
                    Integer.parseInt(boxX2.trim()),
                    Integer.parseInt(boxY2.trim()),
                    Double.parseDouble(inferenceMs.trim()));
        }
    }
}

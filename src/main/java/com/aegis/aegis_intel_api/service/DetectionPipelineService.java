package com.aegis.aegis_intel_api.service;

import com.aegis.aegis_intel_api.config.DetectionProperties;
import com.aegis.aegis_intel_api.dto.analyst.SitrepResult;
import com.aegis.aegis_intel_api.dto.detection.Detection;
import com.aegis.aegis_intel_api.dto.detection.ImageSize;
import com.aegis.aegis_intel_api.dto.detection.RawDetectorOutput;
import com.aegis.aegis_intel_api.dto.detection.ThreatReport;
import com.aegis.aegis_intel_api.dto.geo.GeoLocation;
import com.aegis.aegis_intel_api.dto.response.ScanResponse;
import com.aegis.aegis_intel_api.exception.DetectorException;
import com.aegis.aegis_intel_api.exception.EventLogWriteException;
import com.aegis.aegis_intel_api.repository.EventLog;
import com.aegis.aegis_intel_api.repository.ScanArtifactStore;
import com.aegis.aegis_intel_api.service.analyst.DetectionContextBuilder;
import com.aegis.aegis_intel_api.service.analyst.TacticalAnalystService;
import com.aegis.aegis_intel_api.service.detection.DetectionNormalizer;
import com.aegis.aegis_intel_api.service.detection.Detector;
import com.aegis.aegis_intel_api.service.detection.ImageAnnotator;
import com.aegis.aegis_intel_api.service.geo.ExifGpsExtractor;
import com.aegis.aegis_intel_api.service.geo.GeocodingService;
import com.aegis.aegis_intel_api.service.storage.UploadStorageService;
import com.aegis.aegis_intel_api.service.storage.UploadStorageService.StoredUpload;
import com.aegis.aegis_intel_api.service.threat.ThreatAssessor;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs one uploaded image through detection, threat assessment, audit logging and the
 * optional analyst enrichment.
 * <p>
 * Only a detector failure aborts a scan, and it does so before anything is logged. Geocoding,
 * SITREP generation and the audit write degrade into flags on the response.
 */
@Slf4j
@Service
public class DetectionPipelineService {

    private final UploadStorageService uploadStorage;
    private final GeocodingService geocodingService;
    private final ExifGpsExtractor exifGpsExtractor;
    private final Detector detector;
    private final DetectionNormalizer normalizer;
    private final ImageAnnotator annotator;
    private final ThreatAssessor threatAssessor;
    private final EventLog eventLog;
    private final DetectionContextBuilder contextBuilder;
    private final TacticalAnalystService analyst;
    private final ScanArtifactStore artifactStore;
    private final DetectionProperties properties;

    private final Timer inferenceTimer;
    private final Counter scanCounter;
    private final Counter failureCounter;
    private final Counter auditFailureCounter;

    public DetectionPipelineService(UploadStorageService uploadStorage,
                                    GeocodingService geocodingService,
                                    ExifGpsExtractor exifGpsExtractor,
                                    Detector detector,
                                    DetectionNormalizer normalizer,
                                    ImageAnnotator annotator,
                                    ThreatAssessor threatAssessor,
                                    EventLog eventLog,
                                    DetectionContextBuilder contextBuilder,
                                    TacticalAnalystService analyst,
                                    ScanArtifactStore artifactStore,
                                    DetectionProperties properties,
                                    MeterRegistry meterRegistry) {
        this.uploadStorage = uploadStorage;
        this.geocodingService = geocodingService;
        this.exifGpsExtractor = exifGpsExtractor;
        this.detector = detector;
        this.normalizer = normalizer;
        this.annotator = annotator;
        this.threatAssessor = threatAssessor;
        this.eventLog = eventLog;
        this.contextBuilder = contextBuilder;
        this.analyst = analyst;
        this.artifactStore = artifactStore;
        this.properties = properties;

        this.inferenceTimer = meterRegistry.timer("aegis.pipeline.latency");
        this.scanCounter = meterRegistry.counter("aegis.pipeline.scans");
        this.failureCounter = meterRegistry.counter("aegis.pipeline.failures");
        this.auditFailureCounter = meterRegistry.counter("aegis.eventlog.write.failures");
    }

    public ScanResponse scan(MultipartFile file, Double latitude, Double longitude) throws IOException {
        StoredUpload upload = uploadStorage.store(file);
        GeoLocation geo = resolveGeo(upload, latitude, longitude);

        long start = System.nanoTime();
        RawDetectorOutput raw;
        try {
            raw = detector.detect(upload.path());
        } catch (DetectorException e) {
            failureCounter.increment();
            log.error("Detection failed for {}", upload.path(), e);
            throw e;
        }
        long elapsedNanos = System.nanoTime() - start;
        inferenceTimer.record(elapsedNanos, TimeUnit.NANOSECONDS);
        double inferenceMs = roundMillis(elapsedNanos);

        List<Detection> detections = normalizer.normalize(raw);
        BufferedImage image = upload.image();
        ImageSize imageSize = new ImageSize(image.getWidth(), image.getHeight());

        Path annotatedPath = uploadStorage.annotatedPathFor(upload);
        annotator.writeJpeg(annotator.annotate(image, detections), annotatedPath,
                properties.getAnnotatedJpegQuality());
        log.info("Detection complete | {} objects found | {} ms | image={}",
                detections.size(), inferenceMs, upload.fileName());

        ThreatReport threat = threatAssessor.assess(detections);

        ScanResponse response = ScanResponse.builder()
                .scanId(upload.scanId())
                .detections(detections)
                .threat(threat)
                .annotatedPath(UploadStorageService.publicPath(annotatedPath.getFileName().toString()))
                .originalPath(UploadStorageService.publicPath(upload.fileName()))
                .inferenceMs(inferenceMs)
                .imageSize(imageSize)
                .analystEnabled(analyst.isEnabled())
                .geo(geo)
                .build();

        try {
            eventLog.append(upload.fileName(), threat, detections, inferenceMs);
        } catch (EventLogWriteException e) {
            auditFailureCounter.increment();
            log.error("Audit gap: scan {} was not written to the event log", upload.scanId(), e);
            response.setAuditLogged(false);
            response.setAuditError(e.getMessage());
        }

        response.setSitrep(enrich(upload.scanId(), detections, threat, imageSize, inferenceMs));
        scanCounter.increment();
        return response;
    }

    private SitrepResult enrich(String scanId, List<Detection> detections, ThreatReport threat,
                                ImageSize imageSize, double inferenceMs) {
        if (!analyst.isEnabled()) {
            return SitrepResult.unavailable("Analyst disabled");
        }

        String context = contextBuilder.build(detections, threat, imageSize, inferenceMs);
        SitrepResult sitrep;
        try {
            sitrep = analyst.generateSitrep(context);
        } catch (RuntimeException e) {
            log.warn("SITREP generation failed for scan {}: {}", scanId, e.getMessage());
            return SitrepResult.unavailable(e.getMessage());
        }

        if (sitrep.success()) {
            try {
                artifactStore.create(scanId, context, sitrep.sitrep(), sitrep.model(), sitrep.tokens());
            } catch (RuntimeException e) {
                log.error("Failed to store SITREP for scan {}", scanId, e);
            }
        }
        return sitrep;
    }

    /**
     * Request coordinates win over the upload's EXIF GPS block; only the EXIF path carries altitude.
     */
    private GeoLocation resolveGeo(StoredUpload upload, Double latitude, Double longitude) {
        if (latitude != null && longitude != null) {
            return geocodingService.reverseGeocode(latitude, longitude).orElse(null);
        }
        return exifGpsExtractor.extract(upload.path())
                .flatMap(fix -> geocodingService.reverseGeocode(fix.latitude(), fix.longitude())
                        .map(location -> location.withAltitude(fix.altitude())))
                .orElse(null);
    }

    static double roundMillis(long nanos) {
        return BigDecimal.valueOf(nanos)
                .divide(BigDecimal.valueOf(1_000_000), 1, RoundingMode.HALF_UP)
                .doubleValue();
    }
}

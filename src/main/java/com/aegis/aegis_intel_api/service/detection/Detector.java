package com.aegis.aegis_intel_api.service.detection;

import com.aegis.aegis_intel_api.dto.detection.RawDetectorOutput;
import com.aegis.aegis_intel_api.exception.DetectorException;

import java.nio.file.Path;

/**
 * External object detector. Implementations may block for the duration of inference.
 */
public interface Detector {

    RawDetectorOutput detect(Path image) throws DetectorException;

    /**
     * Short description of the backing model, used by the health endpoint.
     */
    String describe();
}

package com.aegis.aegis_intel_api.service.detection;

import com.aegis.aegis_intel_api.config.DetectionProperties;
import com.aegis.aegis_intel_api.dto.detection.RawDetectorOutput;
import com.aegis.aegis_intel_api.exception.DetectorException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Client for the inference server that hosts the detection model.
 *
 * Expected response:
 * {
 *   "boxes":   [[x1, y1, x2, y2], ...],
 *   "scores":  [0.91, ...],
 *   "classes": [3, ...],
 *   "names":   {"3": "tank", ...}
 * }
 */
@Slf4j
@Service
public class RemoteDetectorClient implements Detector {

    private final RestTemplate restTemplate;
    private final DetectionProperties properties;

    @Value("${aegis.detector.url:http://localhost:8000/predict}")
    private String detectorUrl;

    @Autowired
    public RemoteDetectorClient(@Qualifier("detectorRestTemplate") RestTemplate restTemplate,
                                DetectionProperties properties) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    RemoteDetectorClient(RestTemplate restTemplate, DetectionProperties properties, String detectorUrl) {
        this(restTemplate, properties);
        this.detectorUrl = detectorUrl;
    }

    @Override
    public RawDetectorOutput detect(Path image) {
        String url = UriComponentsBuilder.fromUriString(detectorUrl)
                .queryParam("conf", properties.getConfidenceThreshold())
                .queryParam("iou", properties.getIouThreshold())
                .queryParam("max_det", properties.getMaxDetections())
                .toUriString();

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.MULTIPART_FORM_DATA);
        MultiValueMap<String, Object> body = new LinkedMultiValueMap<>();
        body.add("image", new FileSystemResource(image));

        JsonNode response;
        try {
            response = restTemplate.postForObject(url, new HttpEntity<>(body, headers), JsonNode.class);
        } catch (RestClientException e) {
            throw new DetectorException("Detector call failed: " + e.getMessage(), e);
        }
        if (response == null) {
            throw new DetectorException("Detector returned an empty response");
        }
        return parse(response);
    }

    @Override
    public String describe() {
        return "remote:" + detectorUrl;
    }

    RawDetectorOutput parse(JsonNode response) {
        JsonNode boxes = response.path("boxes");
        JsonNode scores = response.path("scores");
        JsonNode classes = response.path("classes");

        if (boxes.isMissingNode() || boxes.isNull()) {
            return new RawDetectorOutput(List.of(), parseNames(response.path("names")));
        }
        if (!boxes.isArray() || boxes.size() != scores.size() || boxes.size() != classes.size()) {
            throw new DetectorException("Malformed detector response: boxes, scores and classes differ in length");
        }

        List<RawDetectorOutput.Instance> instances = new ArrayList<>(boxes.size());
        for (int i = 0; i < boxes.size(); i++) {
            JsonNode box = boxes.get(i);
            if (!box.isArray() || box.size() != 4) {
                throw new DetectorException("Malformed detector box at index " + i);
            }
            double score = scores.get(i).asDouble(Double.NaN);
            if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
                throw new DetectorException("Detector score out of range at index " + i + ": " + scores.get(i));
            }
            instances.add(new RawDetectorOutput.Instance(
                    box.get(0).asDouble(), box.get(1).asDouble(),
                    box.get(2).asDouble(), box.get(3).asDouble(),
                    score,
                    classes.get(i).asInt()));
        }
        return new RawDetectorOutput(instances, parseNames(response.path("names")));
    }

    private Map<Integer, String> parseNames(JsonNode names) {
        Map<Integer, String> result = new HashMap<>();
        if (names.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = names.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                try {
                    result.put(Integer.parseInt(entry.getKey()), entry.getValue().asText());
                } catch (NumberFormatException e) {
                    log.warn("Ignoring non-numeric class id '{}' in detector names", entry.getKey());
                }
            }
        } else if (names.isArray()) {
            for (int i = 0; i < names.size(); i++) {
                result.put(i, names.get(i).asText());
            }
        }
        return result;
    }
}

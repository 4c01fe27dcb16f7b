package com.aegis.aegis_intel_api.service.storage;

import com.aegis.aegis_intel_api.config.DetectionProperties;
import com.aegis.aegis_intel_api.exception.InvalidImageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HexFormat;
import java.util.Locale;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Validates and stores uploaded images under collision-free names.
 */
@Slf4j
@Service
public class UploadStorageService {

    static final int MAX_STEM_LENGTH = 40;
    static final String PUBLIC_PREFIX = "/static/uploads/";

    private final DetectionProperties properties;
    private final Path uploadRoot;

    public UploadStorageService(DetectionProperties properties) {
        this.properties = properties;
        this.uploadRoot = Paths.get(properties.getUploadDir()).toAbsolutePath().normalize();
    }

    public StoredUpload store(MultipartFile file) throws IOException {
        if (file == null || file.isEmpty() || !StringUtils.hasText(file.getOriginalFilename())) {
            throw new InvalidImageException("No file selected.");
        }
        if (file.getSize() > properties.getMaxFileSize()) {
            throw new InvalidImageException(
                    "File exceeds the maximum size of " + properties.getMaxFileSize() + " bytes");
        }

        String extension = extensionOf(file.getOriginalFilename());
        if (extension.isEmpty() || !properties.getAllowedExtensions().contains(extension)) {
            throw new InvalidImageException("File type not allowed. Accepted: "
                    + String.join(", ", properties.getAllowedExtensions()), true);
        }

        byte[] bytes = file.getBytes();
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(bytes));
        if (image == null) {
            throw new InvalidImageException("Could not decode image: " + file.getOriginalFilename());
        }

        String scanId = newScanId();
        String fileName = uniqueFileName(scanId, file.getOriginalFilename());
        Files.createDirectories(uploadRoot);
        Path target = uploadRoot.resolve(fileName).normalize();
        if (!target.startsWith(uploadRoot)) {
            throw new InvalidImageException("Invalid upload path");
        }
        Files.write(target, bytes);
        log.info("Image saved: {}", target);

        return new StoredUpload(scanId, fileName, target, image);
    }

    public Path annotatedPathFor(StoredUpload upload) {
        return uploadRoot.resolve(annotatedName(upload.fileName()));
    }

    public static String publicPath(String fileName) {
        return PUBLIC_PREFIX + fileName;
    }

    public Path getUploadRoot() {
        return uploadRoot;
    }

    static String annotatedName(String fileName) {
        return "annotated_" + stemOf(fileName) + ".jpg";
    }

    static String uniqueFileName(String scanId, String originalFilename) {
        String safe = sanitize(originalFilename);
        String stem = stemOf(safe);
        String extension = safe.substring(stem.length());
        if (stem.length() > MAX_STEM_LENGTH) {
            stem = stem.substring(0, MAX_STEM_LENGTH);
        }
        return scanId + "_" + stem + extension;
    }

    /**
     * Keeps ASCII letters, digits, dots, dashes and underscores; path separators and whitespace
     * become underscores and leading dots are dropped.
     */
    static String sanitize(String filename) {
        String name = filename.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);
        name = name.trim().replaceAll("\\s+", "_").replaceAll("[^A-Za-z0-9._-]", "");
        name = name.replaceAll("^[._]+", "");
        return name;
    }

    static String stemOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    static String extensionOf(String filename) {
        int dot = filename.lastIndexOf('.');
        if (dot < 0 || dot == filename.length() - 1) {
            return "";
        }
        return filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    private static String newScanId() {
        byte[] random = new byte[4];
        ThreadLocalRandom.current().nextBytes(random);
        return HexFormat.of().formatHex(random);
    }

    public record StoredUpload(String scanId, String fileName, Path path, BufferedImage image) {}
}

package com.example.videocompare_backend.service;

import com.example.videocompare_backend.exception.StorageException;
import com.example.videocompare_backend.service.Interfaces.StorageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;


public class LocalStorageService implements StorageService {
    private static final Logger LOGGER = LoggerFactory.getLogger(LocalStorageService.class);
    private static final Pattern SAFE_EXTENSION = Pattern.compile("[a-z0-9]{1,10}");
    private static final String FALLBACK_EXTENSION = "bin";

    private final Path baseDir;
    private final Path scratchDir;
    private final Path downloadDir;

    public LocalStorageService(Path baseDir, String scratchPrefix, String downloadPrefix) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
        this.scratchDir = this.baseDir.resolve(scratchPrefix).normalize();
        this.downloadDir = this.baseDir.resolve(downloadPrefix).normalize();

        try {
            Files.createDirectories(scratchDir);
            Files.createDirectories(downloadDir);
            LOGGER.info("LocalStorageService ready. base={}, scratch={}, downloads={}", this.baseDir, this.scratchDir, this.downloadDir);
        } catch (IOException e) {
            throw new StorageException("Cannot create storage directories", e);
        }
    }

    @Override
    public Path newScratchFile(String extension) {
        return scratchDir.resolve(UUID.randomUUID().toString().replace("-", "") + "." + sanitizeExtension(extension));
    }

    @Override
    public Path downloadDir() {
        return downloadDir;
    }

    @Override
    public Path scratchDir() {
        return scratchDir;
    }

    @Override
    public void delete(Path file) {
        if (file == null) {
            return;
        }
        try {
            if (Files.deleteIfExists(file)) {
                LOGGER.debug("Deleted scratch file {}", file);
            }
        } catch (IOException e) {
            throw new StorageException("Delete failed: " + file, e);
        }
    }

    static String sanitizeExtension(String extension) {
        if (extension == null) {
            return FALLBACK_EXTENSION;
        }
        String ext = extension.trim().toLowerCase(Locale.ROOT);
        if (ext.startsWith(".")) {
            ext = ext.substring(1);
        }
        return SAFE_EXTENSION.matcher(ext).matches() ? ext : FALLBACK_EXTENSION;
    }
}

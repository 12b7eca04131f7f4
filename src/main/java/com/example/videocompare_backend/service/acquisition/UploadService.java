package com.example.videocompare_backend.service.acquisition;

import com.example.videocompare_backend.config.PipelineExecutorProperties;
import com.example.videocompare_backend.exception.AcquisitionException;
import com.example.videocompare_backend.exception.InputException;
import com.example.videocompare_backend.model.AcquiredMedia;
import com.example.videocompare_backend.model.MediaSource;
import com.example.videocompare_backend.service.Interfaces.StorageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Streams an uploaded blob into the scratch area under a fresh unique name that keeps the
 * original extension.
 */
@Service
public class UploadService {
    private static final Logger LOGGER = LoggerFactory.getLogger(UploadService.class);

    private final StorageService storageService;
    private final int chunkBytes;

    public UploadService(StorageService storageService, PipelineExecutorProperties properties) {
        this.storageService = storageService;
        this.chunkBytes = Math.max(4096, properties.getUploadChunkBytes());
    }

    public AcquiredMedia save(MediaSource source) {
        String filename = source.displayName();
        if (filename == null || filename.isBlank()) {
            throw new InputException("Uploaded file has no filename");
        }
        if (source.upload() == null) {
            throw new AcquisitionException("No content for upload " + filename);
        }

        Path target = storageService.newScratchFile(extensionOf(filename));
        long written = 0;
        try (InputStream in = source.upload().getInputStream();
             OutputStream out = Files.newOutputStream(target, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
            byte[] buffer = new byte[chunkBytes];
            int read;
            while ((read = in.read(buffer)) != -1) {
                out.write(buffer, 0, read);
                written += read;
            }
        } catch (IOException e) {
            storageService.delete(target);
            throw new AcquisitionException("Failed to save upload " + filename + ": " + e.getMessage(), e);
        }

        LOGGER.info("UPLOAD saved name={} bytes={} path={}", filename, written, target.getFileName());
        return new AcquiredMedia(source, target, filename);
    }

    static String extensionOf(String filename) {
        String name = filename.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        return (dot <= 0 || dot == name.length() - 1) ? null : name.substring(dot + 1);
    }
}

package com.example.videocompare_backend.service.acquisition;

import com.example.videocompare_backend.model.AcquiredMedia;
import com.example.videocompare_backend.model.MediaSource;
import com.example.videocompare_backend.model.StageResult;
import com.example.videocompare_backend.service.acquisition.UrlDownloader.DownloadedMedia;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Acquires every source of a request concurrently. One failed source becomes a
 * {@link StageResult.Failure} in its slot and never cancels its siblings.
 */
@Service
public class MediaAcquisitionService {
    private static final Logger LOGGER = LoggerFactory.getLogger(MediaAcquisitionService.class);
    static final String ERROR_TAG = "AcquisitionError";

    private final UploadService uploadService;
    private final UrlDownloader urlDownloader;
    private final Executor executor;

    public MediaAcquisitionService(UploadService uploadService,
                                   UrlDownloader urlDownloader,
                                   @Qualifier("pipelineTaskExecutor") Executor executor) {
        this.uploadService = uploadService;
        this.urlDownloader = urlDownloader;
        this.executor = executor;
    }

    /**
     * @return one result per source, index-aligned with {@code sources}
     */
    public List<StageResult<AcquiredMedia>> acquireAll(List<MediaSource> sources) {
        List<CompletableFuture<StageResult<AcquiredMedia>>> futures = new ArrayList<>(sources.size());
        for (MediaSource source : sources) {
            futures.add(CompletableFuture.supplyAsync(() -> acquire(source), executor)
                    .exceptionally(ex -> StageResult.failure(ERROR_TAG, rootMessage(ex))));
        }

        // full barrier: every future completes normally because failures are values
        CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();

        List<StageResult<AcquiredMedia>> results = new ArrayList<>(futures.size());
        for (CompletableFuture<StageResult<AcquiredMedia>> future : futures) {
            results.add(future.join());
        }
        long failed = results.stream().filter(r -> !r.isSuccess()).count();
        LOGGER.info("ACQUIRE done sources={} failed={}", sources.size(), failed);
        return results;
    }

    StageResult<AcquiredMedia> acquire(MediaSource source) {
        long t0 = System.nanoTime();
        try {
            AcquiredMedia media = source.isRemote() ? fetchRemote(source) : uploadService.save(source);
            LOGGER.info("ACQUIRE OK index={} name={} in={}ms", source.index(), media.displayName(), (System.nanoTime() - t0) / 1_000_000);
            return StageResult.success(media);
        } catch (RuntimeException e) {
            LOGGER.warn("ACQUIRE FAILED index={} source={} reason={}", source.index(), source.displayName(), e.getMessage());
            return StageResult.failure(ERROR_TAG, e.getMessage());
        }
    }

    private AcquiredMedia fetchRemote(MediaSource source) {
        DownloadedMedia downloaded = urlDownloader.download(source.url());
        String title = downloaded.title();
        String displayName = title == null || title.isBlank() ? source.url() : title;
        return new AcquiredMedia(source, downloaded.file(), displayName);
    }

    private static String rootMessage(Throwable ex) {
        Throwable t = ex;
        while (t.getCause() != null && t.getCause() != t) {
            t = t.getCause();
        }
        return t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage();
    }
}

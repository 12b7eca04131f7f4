package com.example.videocompare_backend.service;

import com.example.videocompare_backend.exception.AggregateFailureException;
import com.example.videocompare_backend.exception.InputException;
import com.example.videocompare_backend.model.AcquiredMedia;
import com.example.videocompare_backend.model.ComparisonReport;
import com.example.videocompare_backend.model.ComparisonScores;
import com.example.videocompare_backend.model.MediaSource;
import com.example.videocompare_backend.model.RankedVideo;
import com.example.videocompare_backend.model.SkipEntry;
import com.example.videocompare_backend.model.StageResult;
import com.example.videocompare_backend.model.SummaryResult;
import com.example.videocompare_backend.model.WorkItem;
import com.example.videocompare_backend.service.acquisition.MediaAcquisitionService;
import com.example.videocompare_backend.service.compare.SummaryComparator;
import com.example.videocompare_backend.service.pipeline.PipelineOrchestrator;
import com.example.videocompare_backend.service.pipeline.PipelineOrchestrator.PipelineOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Entry point for one comparison request: acquire all sources, run the pipeline, score the
 * survivors and assemble the report in submission order.
 */
@Service
public class VideoComparisonService {
    private static final Logger LOGGER = LoggerFactory.getLogger(VideoComparisonService.class);

    private final MediaAcquisitionService acquisitionService;
    private final PipelineOrchestrator orchestrator;
    private final SummaryComparator comparator;

    public VideoComparisonService(MediaAcquisitionService acquisitionService,
                                  PipelineOrchestrator orchestrator,
                                  SummaryComparator comparator) {
        this.acquisitionService = acquisitionService;
        this.orchestrator = orchestrator;
        this.comparator = comparator;
    }

    public ComparisonReport compareUploads(String topic, List<MultipartFile> files) {
        if (files == null || files.isEmpty()) {
            throw new InputException("At least one file is required");
        }
        List<MediaSource> sources = new ArrayList<>(files.size());
        for (int i = 0; i < files.size(); i++) {
            MultipartFile file = files.get(i);
            String filename = file == null ? null : file.getOriginalFilename();
            if (filename == null || filename.isBlank()) {
                throw new InputException("Uploaded file #" + (i + 1) + " has no filename");
            }
            sources.add(MediaSource.ofUpload(i, filename, file));
        }
        LOGGER.info("COMPARE uploads topic='{}' files={}", topic, sources.size());
        return compare(topic, sources, HttpStatus.INTERNAL_SERVER_ERROR, "All uploaded files failed to save");
    }

    public ComparisonReport compareUrls(String topic, List<String> urls) {
        if (urls == null || urls.isEmpty()) {
            throw new InputException("At least one URL is required");
        }
        List<MediaSource> sources = new ArrayList<>(urls.size());
        for (int i = 0; i < urls.size(); i++) {
            // a blank entry fails in acquisition and is reported as a skip, like any bad URL
            String url = urls.get(i);
            sources.add(MediaSource.ofUrl(i, url == null ? "" : url.strip()));
        }
        LOGGER.info("COMPARE urls topic='{}' urls={}", topic, sources.size());
        return compare(topic, sources, HttpStatus.BAD_GATEWAY, "All URLs failed to download");
    }

    private ComparisonReport compare(String topic,
                                     List<MediaSource> sources,
                                     HttpStatus acquisitionFailureStatus,
                                     String acquisitionFailureMessage) {
        String safeTopic = topic == null ? "" : topic.strip();
        List<SkipEntry> skipped = new ArrayList<>();
        List<AcquiredMedia> acquired = new ArrayList<>();

        List<StageResult<AcquiredMedia>> results = acquisitionService.acquireAll(sources);
        for (int i = 0; i < sources.size(); i++) {
            MediaSource source = sources.get(i);
            StageResult<AcquiredMedia> result = results.get(i);
            if (result instanceof StageResult.Success<AcquiredMedia> success) {
                acquired.add(success.value());
            } else {
                String reason = ((StageResult.Failure<AcquiredMedia>) result).describe();
                skipped.add(source.isRemote()
                        ? SkipEntry.forUrl(source.index(), source.url(), reason)
                        : SkipEntry.forName(source.index(), source.displayName(), reason));
            }
        }
        if (acquired.isEmpty()) {
            throw new AggregateFailureException(acquisitionFailureStatus, acquisitionFailureMessage, skipped);
        }

        PipelineOutcome outcome = orchestrator.run(acquired);
        for (WorkItem item : outcome.skipped()) {
            skipped.add(SkipEntry.forName(item.index(), item.displayName(), item.failureDescription()));
        }
        skipped.sort(Comparator.comparingInt(SkipEntry::index));
        if (outcome.succeeded().isEmpty()) {
            throw new AggregateFailureException(HttpStatus.INTERNAL_SERVER_ERROR, "All videos failed processing", skipped);
        }

        List<WorkItem> survivors = outcome.succeeded();
        ComparisonScores scores = comparator.score(survivors.stream().map(WorkItem::summary).toList(), safeTopic);
        List<RankedVideo> videos = new ArrayList<>(survivors.size());
        for (int i = 0; i < survivors.size(); i++) {
            WorkItem item = survivors.get(i);
            videos.add(new RankedVideo(item.index(), item.displayName(),
                    new SummaryResult(item.summary(), scores.details().get(i))));
        }
        String best = videos.get(scores.bestIndex()).name();
        LOGGER.info("COMPARE done topic='{}' videos={} skipped={} best={}", safeTopic, videos.size(), skipped.size(), best);
        return new ComparisonReport(safeTopic, videos, skipped, best);
    }
}

package com.example.videocompare_backend.service;

import com.example.videocompare_backend.exception.TranscriptionException;
import com.example.videocompare_backend.service.ProcessRunner.ProcessResult;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Probes media for an audio stream and extracts it as 16 kHz mono WAV for transcription.
 */
@Component
public class AudioExtractor {
    private static final int LOG_SNIPPET_MAX = 1_000;

    private final ProcessRunner processRunner;
    private final String ffmpegBin;
    private final String ffprobeBin;
    private final Duration timeout;

    public AudioExtractor(ProcessRunner processRunner,
                          @Value("${ffmpeg.binary:ffmpeg}") String ffmpegBin,
                          @Value("${ffprobe.binary:ffprobe}") String ffprobeBin,
                          @Value("${engine.asr.timeoutSeconds:600}") long timeoutSeconds) {
        this.processRunner = processRunner;
        this.ffmpegBin = ffmpegBin;
        this.ffprobeBin = ffprobeBin;
        this.timeout = Duration.ofSeconds(Math.max(1, timeoutSeconds));
    }

    public boolean hasAudioStream(Path media) {
        ProcessResult result = run(List.of(
                ffprobeBin, "-v", "error",
                "-select_streams", "a",
                "-show_entries", "stream=index",
                "-of", "csv=p=0",
                media.toAbsolutePath().toString()
        ), "ffprobe");
        if (!result.succeeded()) {
            throw new TranscriptionException("Cannot decode " + media.getFileName() + ": " + snippet(result.output()));
        }
        return !result.output().isBlank();
    }

    /**
     * @throws TranscriptionException if the media has no audio track or ffmpeg fails
     */
    public void extractWav(Path media, Path wav) {
        if (!hasAudioStream(media)) {
            throw new TranscriptionException("No audio track found in " + media.getFileName());
        }
        ProcessResult result = run(List.of(
                ffmpegBin, "-y",
                "-i", media.toAbsolutePath().toString(),
                "-vn",
                "-ac", "1", "-ar", "16000",
                wav.toAbsolutePath().toString()
        ), "ffmpeg");
        if (!result.succeeded() || !Files.exists(wav)) {
            throw new TranscriptionException("ffmpeg failed to extract audio from " + media.getFileName() + ": " + snippet(result.output()));
        }
    }

    private ProcessResult run(List<String> cmd, String tool) {
        try {
            ProcessResult result = processRunner.run(cmd, timeout);
            if (result.timedOut()) {
                throw new TranscriptionException(tool + " timed out after " + timeout.toSeconds() + "s");
            }
            return result;
        } catch (IOException e) {
            throw new TranscriptionException("Could not start " + tool + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TranscriptionException(tool + " interrupted", e);
        }
    }

    private static String snippet(String output) {
        if (output == null || output.isBlank()) {
            return "<no output>";
        }
        return output.length() <= LOG_SNIPPET_MAX ? output : output.substring(0, LOG_SNIPPET_MAX) + "...";
    }
}

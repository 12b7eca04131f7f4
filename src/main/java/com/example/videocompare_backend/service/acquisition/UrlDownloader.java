package com.example.videocompare_backend.service.acquisition;

import com.example.videocompare_backend.exception.AcquisitionException;
import com.example.videocompare_backend.exception.StorageException;
import com.example.videocompare_backend.service.Interfaces.StorageService;
import com.example.videocompare_backend.service.ProcessRunner;
import com.example.videocompare_backend.service.ProcessRunner.ProcessResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Fetches a remote video with yt-dlp into the download area, waits until the finished file can
 * be renamed, then hands back an independent copy in the scratch area.
 */
@Component
public class UrlDownloader {
    private static final Logger log = LoggerFactory.getLogger(UrlDownloader.class);
    private static final int LOG_SNIPPET_MAX = 4_000;
    private static final String CONTAINER = "mp4";
    // combined audio+video first, then merge best video+audio, then whatever exists
    private static final String FORMAT_SELECTOR = "b/bv*+ba/bv*/ba";
    private static final List<String> INCOMPLETE_SUFFIXES = List.of(".part", ".ytdl", ".temp");

    private final StorageService storage;
    private final ProcessRunner processRunner;
    private final String ytdlp;
    private final int attempts;
    private final int retries;
    private final int socketTimeoutSeconds;
    private final String playerClients;
    private final Duration processTimeout;
    private final int renamePollAttempts;
    private final long renamePollIntervalMs;
    private final String ytdlpCookiesFile;

    public UrlDownloader(StorageService storage,
                         ProcessRunner processRunner,
                         @Value("${downloader.ytdlp.bin:yt-dlp}") String ytdlp,
                         @Value("${downloader.ytdlp.attempts:2}") int attempts,
                         @Value("${downloader.ytdlp.retries:5}") int retries,
                         @Value("${downloader.ytdlp.socketTimeoutSeconds:30}") int socketTimeoutSeconds,
                         @Value("${downloader.ytdlp.playerClients:android,web}") String playerClients,
                         @Value("${downloader.ytdlp.timeoutMinutes:15}") long timeoutMinutes,
                         @Value("${downloader.ytdlp.renamePollAttempts:10}") int renamePollAttempts,
                         @Value("${downloader.ytdlp.renamePollIntervalMs:200}") long renamePollIntervalMs,
                         @Value("${YTDLP_COOKIES_FILE:#{null}}") String ytdlpCookiesFile) {
        this.storage = storage;
        this.processRunner = processRunner;
        this.ytdlp = ytdlp;
        this.attempts = Math.max(1, attempts);
        this.retries = Math.max(0, retries);
        this.socketTimeoutSeconds = Math.max(1, socketTimeoutSeconds);
        this.playerClients = playerClients;
        this.processTimeout = Duration.ofMinutes(Math.max(1, timeoutMinutes));
        this.renamePollAttempts = Math.max(1, renamePollAttempts);
        this.renamePollIntervalMs = Math.max(0, renamePollIntervalMs);
        this.ytdlpCookiesFile = ytdlpCookiesFile;
    }

    /**
     * Downloads {@code url} and returns a scratch copy owned by the caller.
     *
     * @throws AcquisitionException when every attempt fails or the file never becomes available
     */
    public DownloadedMedia download(String url) {
        requireHttpUrl(url);
        String token = UUID.randomUUID().toString().replace("-", "");
        Path dir = storage.downloadDir();

        AcquisitionException last = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            ProcessResult result = runYtdlp(buildCommand(url, dir, token), url);

            if (result.timedOut()) {
                String partialNote = cleanupPartial(dir, token);
                last = new AcquisitionException("yt-dlp timeout after " + processTimeout.toMinutes() + "m for " + url + partialNote);
                log.warn("yt-dlp attempt={}/{} timed out url={}", attempt, attempts, url);
                continue;
            }

            if (result.code() != 0) {
                String output = result.output();
                String partialNote = cleanupPartial(dir, token);
                if (isAuthWall(output)) {
                    throw new AcquisitionException("Download requires authentication/cookies for " + url + partialNote + " log=" + truncateLog(output));
                }
                if (isPermanent(output)) {
                    throw new AcquisitionException("yt-dlp exit=" + result.code() + " for " + url + partialNote + " log=" + truncateLog(output));
                }
                last = new AcquisitionException("yt-dlp exit=" + result.code() + " for " + url + partialNote + " log=" + truncateLog(output));
                log.warn("yt-dlp attempt={}/{} failed exit={} url={}", attempt, attempts, result.code(), url);
                continue;
            }

            Path copy;
            try {
                copy = copyToScratch(awaitDownloadedFile(dir, token, url), url);
            } catch (AcquisitionException e) {
                String partialNote = cleanupPartial(dir, token);
                log.warn("yt-dlp output not claimable url={}{}", url, partialNote);
                throw e;
            }
            String title = parseTitle(result.output());
            log.info("yt-dlp download OK url={} title={} copy={}", url, title, copy.getFileName());
            return new DownloadedMedia(copy, title);
        }
        throw last;
    }

    List<String> buildCommand(String url, Path dir, String token) {
        List<String> cmd = new ArrayList<>(List.of(
                ytdlp,
                "--no-progress", "--newline",
                "--no-playlist",
                "-f", FORMAT_SELECTOR,
                "--merge-output-format", CONTAINER,
                "--remux-video", CONTAINER,
                "--retries", String.valueOf(retries),
                "--fragment-retries", String.valueOf(retries),
                "--socket-timeout", String.valueOf(socketTimeoutSeconds),
                "--extractor-args", "youtube:player_client=" + playerClients,
                "--no-simulate",
                "--print", "after_move:title"
        ));

        maybeAddCookies(cmd);

        cmd.add("-o");
        cmd.add(dir.resolve(token + ".%(ext)s").toString());
        cmd.add(url);
        return cmd;
    }

    private ProcessResult runYtdlp(List<String> cmd, String url) {
        try {
            return processRunner.run(cmd, processTimeout);
        } catch (IOException e) {
            throw new AcquisitionException("Could not start yt-dlp for " + url + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AcquisitionException("Interrupted while downloading " + url, e);
        }
    }

    /**
     * The finished file can stay invisible or locked for a moment after yt-dlp exits. Poll for
     * it and claim it with an atomic rename.
     */
    private Path awaitDownloadedFile(Path dir, String token, String url) {
        IOException lastError = null;
        for (int attempt = 1; attempt <= renamePollAttempts; attempt++) {
            Path candidate = findCompleted(dir, token);
            if (candidate != null) {
                Path staged = dir.resolve(token + ".done." + extension(candidate));
                try {
                    Files.move(candidate, staged, StandardCopyOption.ATOMIC_MOVE);
                    return staged;
                } catch (IOException e) {
                    lastError = e;
                    log.debug("Rename attempt={} failed file={} reason={}", attempt, candidate, e.getMessage());
                }
            }
            sleepBeforePoll(url);
        }
        String reason = lastError == null ? "file never appeared" : lastError.getMessage();
        throw new AcquisitionException("Downloaded file for " + url + " not available after "
                + renamePollAttempts + " attempts: " + reason, lastError);
    }

    private Path findCompleted(Path dir, String token) {
        Path expected = dir.resolve(token + "." + CONTAINER);
        if (Files.isRegularFile(expected)) {
            return expected;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, token + ".*")) {
            for (Path p : stream) {
                String name = p.getFileName().toString();
                if (Files.isRegularFile(p) && INCOMPLETE_SUFFIXES.stream().noneMatch(name::endsWith) && !name.contains(".done.")) {
                    return p;
                }
            }
        } catch (IOException e) {
            log.debug("Listing download dir failed dir={} reason={}", dir, e.getMessage());
        }
        return null;
    }

    private void sleepBeforePoll(String url) {
        if (renamePollIntervalMs == 0) {
            return;
        }
        try {
            Thread.sleep(renamePollIntervalMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AcquisitionException("Interrupted while waiting for download of " + url, e);
        }
    }

    /** Own copy in scratch so the downloader's file lifetime and locks stay out of the pipeline. */
    private Path copyToScratch(Path staged, String url) {
        Path copy = storage.newScratchFile(extension(staged));
        try {
            Files.copy(staged, copy);
            return copy;
        } catch (IOException e) {
            deleteQuietly(copy);
            throw new AcquisitionException("Copy into scratch failed for " + url + ": " + e.getMessage(), e);
        } finally {
            deleteQuietly(staged);
        }
    }

    private void deleteQuietly(Path file) {
        try {
            storage.delete(file);
        } catch (StorageException e) {
            log.warn("Failed to delete download file={} reason={}", file, e.getMessage());
        }
    }

    static String parseTitle(String output) {
        if (output == null || output.isBlank()) {
            return null;
        }
        String[] lines = output.split("\\R");
        for (int i = lines.length - 1; i >= 0; i--) {
            String line = lines[i].strip();
            if (line.isEmpty() || line.startsWith("WARNING") || line.startsWith("ERROR") || line.startsWith("[")) {
                continue;
            }
            return line;
        }
        return null;
    }

    private static String extension(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? CONTAINER : name.substring(dot + 1);
    }

    private static void requireHttpUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new AcquisitionException("URL is blank");
        }
        try {
            URI uri = URI.create(url.trim());
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if (!scheme.equals("http") && !scheme.equals("https") || uri.getHost() == null) {
                throw new AcquisitionException("Unsupported URL: " + url);
            }
        } catch (IllegalArgumentException e) {
            throw new AcquisitionException("Invalid URL: " + url, e);
        }
    }

    private String truncateLog(String output) {
        if (output == null || output.isBlank()) {
            return "<no output>";
        }
        if (output.length() <= LOG_SNIPPET_MAX) {
            return output;
        }
        return output.substring(0, LOG_SNIPPET_MAX) + "...";
    }

    private boolean isAuthWall(String output) {
        if (output == null) {
            return false;
        }
        String normalized = output.toLowerCase(Locale.ROOT)
                .replace('’', '\'');
        return normalized.contains("sign in to confirm you're not a bot")
                || normalized.contains("--cookies-from-browser")
                || normalized.contains("use --cookies");
    }

    private boolean isPermanent(String output) {
        if (output == null) {
            return false;
        }
        String normalized = output.toLowerCase(Locale.ROOT);
        return normalized.contains("unsupported url")
                || normalized.contains("video unavailable")
                || normalized.contains("private video")
                || normalized.contains("http error 404");
    }

    private void maybeAddCookies(List<String> cmd) {
        if (ytdlpCookiesFile == null || ytdlpCookiesFile.isBlank()) {
            return;
        }
        Path cookiesPath = Path.of(ytdlpCookiesFile).toAbsolutePath();
        if (Files.exists(cookiesPath)) {
            cmd.add("--cookies");
            cmd.add(cookiesPath.toString());
        } else {
            log.warn("yt-dlp cookies file configured but missing path={}", cookiesPath);
        }
    }

    private String cleanupPartial(Path dir, String token) {
        List<Path> removed = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, token + ".*")) {
            for (Path p : stream) {
                try {
                    Files.deleteIfExists(p);
                    removed.add(p);
                } catch (IOException e) {
                    log.warn("Failed to delete yt-dlp partial file partial={}", p, e);
                }
            }
        } catch (IOException e) {
            log.warn("Failed to list yt-dlp partial files dir={}", dir, e);
        }
        return removed.isEmpty() ? "" : " partial=" + removed;
    }

    public record DownloadedMedia(Path file, String title) { }
}

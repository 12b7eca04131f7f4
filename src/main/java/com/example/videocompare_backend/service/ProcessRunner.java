package com.example.videocompare_backend.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.time.Duration;
import java.util.List;
import java.util.StringJoiner;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external binary (yt-dlp, ffmpeg, ffprobe), collecting merged stdout/stderr and
 * killing it when the timeout expires.
 */
@Component
public class ProcessRunner {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProcessRunner.class);

    public ProcessResult run(List<String> cmd, Duration timeout) throws IOException, InterruptedException {
        LOGGER.debug("Exec: {}", String.join(" ", cmd));
        Process p = new ProcessBuilder(cmd).redirectErrorStream(true).start();
        StringJoiner joiner = new StringJoiner(System.lineSeparator());
        Thread reader = new Thread(() -> {
            try (var buffered = new BufferedReader(new InputStreamReader(p.getInputStream()))) {
                String line;
                while ((line = buffered.readLine()) != null) {
                    LOGGER.debug("[exec] {}", line);
                    synchronized (joiner) {
                        joiner.add(line);
                    }
                }
            } catch (IOException ignored) {
                // Process failure is handled by exit code/timeout; output collected so far is enough.
            }
        });
        reader.setDaemon(true);
        reader.start();

        boolean finished = p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (!finished) {
            p.destroyForcibly();
            p.waitFor(5, TimeUnit.SECONDS);
        }
        reader.join(TimeUnit.SECONDS.toMillis(5));
        int code = finished ? p.exitValue() : -1;
        String output;
        synchronized (joiner) {
            output = joiner.toString();
        }
        return new ProcessResult(code, output, !finished);
    }

    public record ProcessResult(int code, String output, boolean timedOut) {
        public boolean succeeded() {
            return !timedOut && code == 0;
        }
    }
}

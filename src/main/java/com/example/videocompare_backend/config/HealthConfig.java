package com.example.videocompare_backend.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

@Configuration
public class HealthConfig {

    @Bean
    public HealthIndicator ffmpegHealth(@Value("${ffmpeg.binary:ffmpeg}") String ffmpegBin) {
        return () -> binaryHealth("ffmpeg", ffmpegBin, "-version");
    }

    @Bean
    public HealthIndicator ytdlpHealth(@Value("${downloader.ytdlp.bin:yt-dlp}") String ytdlpBin) {
        return () -> binaryHealth("yt-dlp", ytdlpBin, "--version");
    }

    private static Health binaryHealth(String name, String bin, String versionFlag) {
        try {
            var p = new ProcessBuilder(bin, versionFlag).redirectErrorStream(true).start();
            p.getInputStream().transferTo(java.io.OutputStream.nullOutputStream());
            if (p.waitFor(5, TimeUnit.SECONDS) && p.exitValue() == 0) {
                return Health.up().withDetail(name, "ok").build();
            }
            p.destroyForcibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Health.down(e).withDetail(name, "interrupted").build();
        } catch (Exception e) {
            return Health.down(e).withDetail(name, "missing").build();
        }
        return Health.down().withDetail(name, "missing").build();
    }
}

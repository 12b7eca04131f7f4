package com.example.videocompare_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "storage.local")
public class StorageProperties {
    private String baseDir = "./data";
    private String scratchPrefix = "scratch";
    private String downloadPrefix = "downloads";

    public String getBaseDir() { return baseDir; }
    public void setBaseDir(String baseDir) { this.baseDir = baseDir; }

    public String getScratchPrefix() { return scratchPrefix; }
    public void setScratchPrefix(String scratchPrefix) { this.scratchPrefix = scratchPrefix; }

    public String getDownloadPrefix() { return downloadPrefix; }
    public void setDownloadPrefix(String downloadPrefix) { this.downloadPrefix = downloadPrefix; }
}

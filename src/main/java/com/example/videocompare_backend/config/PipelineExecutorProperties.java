package com.example.videocompare_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configures the worker pool that runs acquisition and per-item pipeline stages.
 */
@ConfigurationProperties(prefix = "pipeline")
public class PipelineExecutorProperties {

    private int executorThreads = 8;
    private int executorQueueCapacity = 100;
    /** Deadline for one item's transcribe+summarize run; 0 disables it. */
    private long itemTimeoutMinutes = 30;
    private int uploadChunkBytes = 1024 * 1024;

    public int getExecutorThreads() {
        return executorThreads;
    }

    public void setExecutorThreads(int executorThreads) {
        this.executorThreads = executorThreads;
    }

    public int getExecutorQueueCapacity() {
        return executorQueueCapacity;
    }

    public void setExecutorQueueCapacity(int executorQueueCapacity) {
        this.executorQueueCapacity = executorQueueCapacity;
    }

    public long getItemTimeoutMinutes() {
        return itemTimeoutMinutes;
    }

    public void setItemTimeoutMinutes(long itemTimeoutMinutes) {
        this.itemTimeoutMinutes = itemTimeoutMinutes;
    }

    public int getUploadChunkBytes() {
        return uploadChunkBytes;
    }

    public void setUploadChunkBytes(int uploadChunkBytes) {
        this.uploadChunkBytes = uploadChunkBytes;
    }
}

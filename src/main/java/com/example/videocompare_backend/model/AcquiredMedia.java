package com.example.videocompare_backend.model;

import java.nio.file.Path;

/**
 * A source that has been normalized into a local, uniquely named scratch file.
 */
public record AcquiredMedia(MediaSource source, Path localPath, String displayName) {
}

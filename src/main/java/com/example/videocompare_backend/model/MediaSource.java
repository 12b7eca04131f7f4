package com.example.videocompare_backend.model;

import org.springframework.core.io.InputStreamSource;

/**
 * One requested video: either an uploaded blob or a remote URL.
 *
 * @param index       position in the original request, used to restore submission order
 * @param kind        upload or remote URL
 * @param displayName user-facing name; the filename for uploads, the URL until a title is resolved
 * @param url         remote location, {@code null} for uploads
 * @param upload      uploaded content, {@code null} for URLs
 */
public record MediaSource(int index,
                          SourceKind kind,
                          String displayName,
                          String url,
                          InputStreamSource upload) {

    public static MediaSource ofUpload(int index, String filename, InputStreamSource upload) {
        return new MediaSource(index, SourceKind.UPLOAD, filename, null, upload);
    }

    public static MediaSource ofUrl(int index, String url) {
        return new MediaSource(index, SourceKind.URL, url, url, null);
    }

    public boolean isRemote() {
        return kind == SourceKind.URL;
    }
}

package com.example.videocompare_backend.model;

/**
 * A source that dropped out of the comparison. Download failures carry the {@code url},
 * processing failures the display {@code name}.
 */
public record SkipEntry(int index, String name, String url, String error) {

    public static SkipEntry forName(int index, String name, String error) {
        return new SkipEntry(index, name, null, error);
    }

    public static SkipEntry forUrl(int index, String url, String error) {
        return new SkipEntry(index, null, url, error);
    }
}

package com.example.videocompare_backend.model;

import com.example.videocompare_backend.util.TokenUtil;

public record Transcript(String text, int tokenCount) {

    public static Transcript of(String text) {
        String safe = text == null ? "" : text.strip();
        return new Transcript(safe, TokenUtil.count(safe));
    }

    public boolean isBlank() {
        return text.isBlank();
    }
}

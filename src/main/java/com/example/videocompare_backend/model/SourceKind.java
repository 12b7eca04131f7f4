package com.example.videocompare_backend.model;

public enum SourceKind {
    UPLOAD,
    URL
}

package com.example.videocompare_backend.dto.web;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

public record UrlComparisonRequest(
        @NotNull @Size(max = 1000) String topic,
        @NotEmpty(message = "urls must not be empty") List<@Size(max = 2048) String> urls
) {
}

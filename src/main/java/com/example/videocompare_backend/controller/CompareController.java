package com.example.videocompare_backend.controller;

import com.example.videocompare_backend.dto.web.ComparisonResponse;
import com.example.videocompare_backend.dto.web.UrlComparisonRequest;
import com.example.videocompare_backend.service.VideoComparisonService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

/**
 * Compares videos against a topic, from uploads or from URLs.
 */
@RestController
public class CompareController {
    private final VideoComparisonService comparisonService;

    public CompareController(VideoComparisonService comparisonService) {
        this.comparisonService = comparisonService;
    }

    @Operation(summary = "Summarize uploaded videos and rank them against a topic")
    @ApiResponse(responseCode = "200", description = "At least one video was summarized and scored")
    @ApiResponse(responseCode = "400", description = "A file has no filename or the request is malformed")
    @ApiResponse(responseCode = "500", description = "Every file failed processing")
    @PostMapping(value = {"/compare_videos", "/compare_videos/"}, consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ComparisonResponse compareUploads(@RequestParam("topic") String topic,
                                             @RequestPart("files") List<MultipartFile> files) {
        return ComparisonResponse.from(comparisonService.compareUploads(topic, files));
    }

    @Operation(summary = "Download videos by URL and rank them against a topic")
    @ApiResponse(responseCode = "200", description = "At least one video was summarized and scored")
    @ApiResponse(responseCode = "400", description = "Empty URL list or malformed request")
    @ApiResponse(responseCode = "502", description = "Every URL failed to download")
    @ApiResponse(responseCode = "500", description = "Every downloaded video failed processing")
    @PostMapping(value = {"/compare_videos_urls", "/compare_videos_urls/"}, consumes = MediaType.APPLICATION_JSON_VALUE)
    public ComparisonResponse compareUrls(@Valid @RequestBody UrlComparisonRequest request) {
        return ComparisonResponse.from(comparisonService.compareUrls(request.topic(), request.urls()));
    }
}

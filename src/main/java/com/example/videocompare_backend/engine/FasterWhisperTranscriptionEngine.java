package com.example.videocompare_backend.engine;

import com.example.videocompare_backend.dto.FwTranscriptionResponse;
import com.example.videocompare_backend.engine.Interfaces.TranscriptionEngine;
import com.example.videocompare_backend.exception.TranscriptionException;
import com.example.videocompare_backend.service.AudioExtractor;
import com.example.videocompare_backend.service.FasterWhisperClient;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.util.Locale;

@Service
public class FasterWhisperTranscriptionEngine implements TranscriptionEngine {
    private final AudioExtractor audioExtractor;
    private final FasterWhisperClient client;

    public FasterWhisperTranscriptionEngine(AudioExtractor audioExtractor, FasterWhisperClient client) {
        this.audioExtractor = audioExtractor;
        this.client = client;
    }

    @Override
    public Result transcribe(Request req) {
        if (!Files.exists(req.mediaFile())) {
            throw new TranscriptionException("input not found: " + req.mediaFile());
        }

        audioExtractor.extractWav(req.mediaFile(), req.audioFile());
        FwTranscriptionResponse resp = client.transcribeFile(req.audioFile());

        String text = resp == null ? "" : resp.plainText();
        String lang = resp != null && resp.language() != null && !resp.language().isBlank()
                ? resp.language().toLowerCase(Locale.ROOT) : "auto";

        return new Result(text, lang);
    }
}

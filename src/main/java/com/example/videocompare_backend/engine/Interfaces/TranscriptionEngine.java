package com.example.videocompare_backend.engine.Interfaces;

import java.nio.file.Path;

public interface TranscriptionEngine {
    /**
     * @param mediaFile local media to transcribe
     * @param audioFile scratch path the engine may write its audio extract to; the caller owns and deletes it
     */
    record Request(String itemId, Path mediaFile, Path audioFile) {}
    /**
     * @param lang detected language code, {@code "auto"} when the server reports none
     */
    record Result(String text, String lang) {}

    Result transcribe(Request req) throws Exception;
}

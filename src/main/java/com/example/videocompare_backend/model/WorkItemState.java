package com.example.videocompare_backend.model;

public enum WorkItemState {
    PENDING,
    ACQUIRED,
    TRANSCRIBING,
    TRANSCRIBED,
    SUMMARIZING,
    SUMMARIZED,
    FAILED;

    public boolean isTerminal() {
        return this == SUMMARIZED || this == FAILED;
    }
}

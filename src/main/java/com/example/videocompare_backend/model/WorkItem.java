package com.example.videocompare_backend.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Pipeline state for one acquired source within one request.
 * Transitions after a terminal state are ignored, so an item ends in exactly one of
 * {@link WorkItemState#SUMMARIZED} or {@link WorkItemState#FAILED}.
 */
public class WorkItem {

    private final AcquiredMedia media;
    private final List<Path> tempFiles = new ArrayList<>();

    private WorkItemState state;
    private Transcript transcript;
    private String summary;
    private String failureTag;
    private String failureMessage;

    public WorkItem(AcquiredMedia media) {
        this.media = media;
        this.state = WorkItemState.ACQUIRED;
        this.tempFiles.add(media.localPath());
    }

    public int index() {
        return media.source().index();
    }

    public String displayName() {
        return media.displayName();
    }

    public Path localPath() {
        return media.localPath();
    }

    public AcquiredMedia media() {
        return media;
    }

    public synchronized WorkItemState state() {
        return state;
    }

    public synchronized Transcript transcript() {
        return transcript;
    }

    public synchronized String summary() {
        return summary;
    }

    public synchronized String failureTag() {
        return failureTag;
    }

    public synchronized String failureMessage() {
        return failureMessage;
    }

    public synchronized void trackTempFile(Path file) {
        tempFiles.add(file);
    }

    public synchronized List<Path> tempFiles() {
        return List.copyOf(tempFiles);
    }

    /**
     * Moves to a non-terminal stage state.
     *
     * @return false if the item already reached a terminal state
     */
    public synchronized boolean advance(WorkItemState next) {
        if (state.isTerminal()) {
            return false;
        }
        if (next.isTerminal()) {
            throw new IllegalArgumentException("Use markSummarized/markFailed for terminal state " + next);
        }
        state = next;
        return true;
    }

    public synchronized boolean markTranscribed(Transcript transcript) {
        if (!advance(WorkItemState.TRANSCRIBED)) {
            return false;
        }
        this.transcript = transcript;
        return true;
    }

    public synchronized boolean markSummarized(String summary) {
        if (state.isTerminal()) {
            return false;
        }
        this.summary = summary;
        this.state = WorkItemState.SUMMARIZED;
        return true;
    }

    public synchronized boolean markFailed(String tag, String message) {
        if (state.isTerminal()) {
            return false;
        }
        this.failureTag = tag;
        this.failureMessage = message;
        this.state = WorkItemState.FAILED;
        return true;
    }

    public synchronized String failureDescription() {
        if (failureTag == null) {
            return null;
        }
        return failureMessage == null || failureMessage.isBlank() ? failureTag : failureTag + ": " + failureMessage;
    }
}

package com.github.stormino.medialib.model;

public enum JobState {
    QUEUED,
    RUNNING,
    COMPLETE,
    FAILED
}

package com.repotimeline.collector.orchestrator;

import com.repotimeline.collector.client.ErrorKind;

/**
 * Run-level failure: repository discovery failed, or no repository yielded data.
 */
public class TimelineException extends Exception {

    private final ErrorKind kind;

    public TimelineException(ErrorKind kind, String message) {
        this(kind, message, null);
    }

    public TimelineException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}

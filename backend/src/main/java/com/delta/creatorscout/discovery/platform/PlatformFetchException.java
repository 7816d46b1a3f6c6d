package com.delta.creatorscout.discovery.platform;

import com.delta.creatorscout.discovery.model.FailureKind;

public class PlatformFetchException extends RuntimeException {
    private final FailureKind kind;
    private final boolean cursorIndependent;
    private final String nextCursor;

    public PlatformFetchException(FailureKind kind, String message) {
        this(kind, message, false, null, null);
    }

    public PlatformFetchException(FailureKind kind, String message, Throwable cause) {
        this(kind, message, false, null, cause);
    }

    private PlatformFetchException(
        FailureKind kind,
        String message,
        boolean cursorIndependent,
        String nextCursor,
        Throwable cause
    ) {
        super(message, cause);
        this.kind = kind == null ? FailureKind.FATAL : kind;
        this.cursorIndependent = cursorIndependent;
        this.nextCursor = nextCursor;
    }

    public static PlatformFetchException malformed(String message, String independentNextCursor, Throwable cause) {
        return new PlatformFetchException(FailureKind.MALFORMED_RESPONSE, message, true, independentNextCursor, cause);
    }

    public FailureKind getKind() {
        return kind;
    }

    /**
     * True when the adapter can move past the failed page without reading its payload.
     * {@link #getNextCursor()} is then the cursor to resume from, or null when the search is exhausted.
     */
    public boolean isCursorIndependent() {
        return cursorIndependent;
    }

    public String getNextCursor() {
        return nextCursor;
    }
}

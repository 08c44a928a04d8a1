package com.xammer.fleet.domain;

import lombok.Value;

/**
 * Result of a "start rolling refresh" call. A refresh that is already running is reported as accepted.
 */
@Value
public class RefreshOutcome {

    public enum Kind {
        ACCEPTED,
        REJECTED
    }

    Kind kind;
    String refreshId;
    boolean alreadyInProgress;
    String reason;
    String errorCode;

    public static RefreshOutcome accepted(String refreshId) {
        return new RefreshOutcome(Kind.ACCEPTED, refreshId, false, null, null);
    }

    public static RefreshOutcome alreadyInProgress(String refreshId) {
        return new RefreshOutcome(Kind.ACCEPTED, refreshId, true, "refresh already in progress", null);
    }

    public static RefreshOutcome rejected(String reason, String errorCode) {
        return new RefreshOutcome(Kind.REJECTED, null, false, reason, errorCode);
    }

    public boolean isAccepted() {
        return kind == Kind.ACCEPTED;
    }
}

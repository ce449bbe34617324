package com.rendezvous.protocol;

/**
 * A protocol violation by the client. Always recoverable: the session answers with an
 * {@code error} frame and keeps the connection open.
 */
public class RendezvousException extends RuntimeException {

    public enum Kind {
        MALFORMED,
        MISSING_TYPE,
        UNKNOWN_TYPE,
        MISSING_FIELD,
        ALREADY_BOUND,
        NOT_BOUND,
        ALREADY_ALLOCATED,
        NOT_CLAIMED
    }

    private final Kind kind;

    public RendezvousException(Kind kind, String explain) {
        super(explain);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    public String explain() {
        return getMessage();
    }

    public static RendezvousException missingField(String explain) {
        return new RendezvousException(Kind.MISSING_FIELD, explain);
    }

    public static RendezvousException notClaimed(String verb) {
        return new RendezvousException(Kind.NOT_CLAIMED, "must claim channel before " + verb);
    }
}

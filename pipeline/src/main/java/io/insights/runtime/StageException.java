package io.insights.runtime;

/**
 * A pipeline stage failed on a record. The run stops at the first such failure.
 */
public class StageException extends RuntimeException {
    private final String stage;
    private final long seq;
    private final String origin;

    public StageException(String stage, long seq, String origin, Throwable cause) {
        super(stage + " failed on record " + seq + (origin.isEmpty() ? "" : " (" + origin + ")") + ": " + cause.getMessage(), cause);
        this.stage = stage;
        this.seq = seq;
        this.origin = origin;
    }

    public String stage() { return stage; }
    public long seq() { return seq; }
    public String origin() { return origin; }
}

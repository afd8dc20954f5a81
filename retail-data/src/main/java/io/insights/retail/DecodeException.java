package io.insights.retail;

/**
 * The input could not be read as tabular text at all. Nothing of the dataset is usable.
 */
public class DecodeException extends Exception {
    private final String source;

    public DecodeException(String source, String message, Throwable cause) {
        super(source + ": " + message, cause);
        this.source = source;
    }

    public DecodeException(String source, String message) {
        this(source, message, null);
    }

    public String source() { return source; }
}

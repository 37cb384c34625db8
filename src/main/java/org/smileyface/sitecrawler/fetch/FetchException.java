package org.smileyface.sitecrawler.fetch;

/**
 * A fetch that produced no usable response: every attempt failed with an I/O error, or the last
 * attempt still returned a retryable status.
 */
public class FetchException extends Exception {

    private final String url;
    private final int attempts;
    private final Integer lastStatus;

    public FetchException(String url, int attempts, Integer lastStatus, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
        this.attempts = attempts;
        this.lastStatus = lastStatus;
    }

    public String getUrl() {
        return url;
    }

    public int getAttempts() {
        return attempts;
    }

    /**
     * @return status of the last response, or null when no response was received
     */
    public Integer getLastStatus() {
        return lastStatus;
    }
}

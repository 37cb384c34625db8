package org.smileyface.sitecrawler.model;

/**
 * Terminal outcome of a dequeued URL. Every dequeued URL ends in exactly one of these.
 */
public enum CrawlStatus {
    /** Fetched and persisted; the report shows the HTTP status code. */
    OK(null),

    /** Skipped due to robots.txt disallow rules. No request was issued. */
    SKIPPED_ROBOTS("disallowed_by_robots"),

    /** Failed to fetch (network error, timeout, retries exhausted). */
    ERROR_FETCH("error"),

    /** Failed to parse/extract content from the fetched payload. */
    ERROR_PARSE("error"),

    /** Fetched, but writing an artifact to disk failed. */
    ERROR_PERSIST("error");

    private final String reportTag;

    CrawlStatus(String reportTag) {
        this.reportTag = reportTag;
    }

    /**
     * @return the string written to the report's {@code status} field, or null when the
     *         HTTP status code is written instead
     */
    public String getReportTag() {
        return reportTag;
    }

    public boolean isError() {
        return this == ERROR_FETCH || this == ERROR_PARSE || this == ERROR_PERSIST;
    }
}

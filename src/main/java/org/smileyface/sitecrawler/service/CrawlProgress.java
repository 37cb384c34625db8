package org.smileyface.sitecrawler.service;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable snapshot of a crawl's progress.
 */
public final class CrawlProgress {
    private final CrawlState state;
    private final long processedCount;
    private final long skippedCount;
    private final long errorCount;
    private final int frontierSize;
    private final String lastUrl;
    private final String lastError;
    private final Instant startedAt;
    private final Instant finishedAt;

    public CrawlProgress(CrawlState state, long processedCount, long skippedCount, long errorCount,
                         int frontierSize, String lastUrl, String lastError,
                         Instant startedAt, Instant finishedAt) {
        this.state = state;
        this.processedCount = processedCount;
        this.skippedCount = skippedCount;
        this.errorCount = errorCount;
        this.frontierSize = frontierSize;
        this.lastUrl = lastUrl;
        this.lastError = lastError;
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
    }

    public CrawlState getState() { return state; }
    public long getProcessedCount() { return processedCount; }
    public long getSkippedCount() { return skippedCount; }
    public long getErrorCount() { return errorCount; }
    public int getFrontierSize() { return frontierSize; }
    public String getLastUrl() { return lastUrl; }
    public String getLastError() { return lastError; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getFinishedAt() { return finishedAt; }

    /**
     * Total report records written: processed, skipped and errored URLs.
     */
    public long getRecordCount() {
        return processedCount + skippedCount + errorCount;
    }

    public Duration getElapsed() {
        if (startedAt == null) return Duration.ZERO;
        Instant end = finishedAt != null ? finishedAt : Instant.now();
        return Duration.between(startedAt, end);
    }

    @Override
    public String toString() {
        return "CrawlProgress{" +
                "state=" + state +
                ", processed=" + processedCount +
                ", skipped=" + skippedCount +
                ", errors=" + errorCount +
                ", frontier=" + frontierSize +
                ", lastUrl='" + lastUrl + '\'' +
                (lastError != null ? ", lastError='" + lastError + '\'' : "") +
                '}';
    }
}

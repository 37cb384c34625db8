package org.smileyface.sitecrawler.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * One line of the crawl report. Exactly one record is written per dequeued URL that reaches a
 * terminal state.
 *
 * <p>The {@code status} field is the HTTP status code for fetched pages and a string tag
 * ({@code disallowed_by_robots} or {@code error}) otherwise. {@code error} is only serialized
 * on error records.</p>
 */
@JsonPropertyOrder({"url", "status", "content_type", "saved_raw", "saved_text", "title", "depth", "error"})
public final class CrawlRecord {

    private final String url;
    private final CrawlStatus crawlStatus;
    private final Integer httpStatus;
    private final String contentType;
    private final String savedRaw;
    private final String savedText;
    private final String title;
    private final int depth;
    private final String error;

    private CrawlRecord(String url, CrawlStatus crawlStatus, Integer httpStatus, String contentType,
                        String savedRaw, String savedText, String title, int depth, String error) {
        this.url = Objects.requireNonNull(url, "url");
        this.crawlStatus = Objects.requireNonNull(crawlStatus, "crawlStatus");
        this.httpStatus = httpStatus;
        this.contentType = contentType;
        this.savedRaw = savedRaw;
        this.savedText = savedText;
        this.title = title;
        this.depth = depth;
        this.error = error;
    }

    public static CrawlRecord fetched(String url, int depth, int httpStatus, String contentType,
                                      String savedRaw, String savedText, String title) {
        return new CrawlRecord(url, CrawlStatus.OK, httpStatus, contentType, savedRaw, savedText, title, depth, null);
    }

    public static CrawlRecord disallowed(String url, int depth) {
        return new CrawlRecord(url, CrawlStatus.SKIPPED_ROBOTS, null, null, null, null, null, depth, null);
    }

    /**
     * Builds an error record. Fields known before the failure (content type, raw path) are kept so
     * the record still says how far processing got.
     */
    public static CrawlRecord failed(String url, int depth, CrawlStatus status, Integer httpStatus,
                                     String contentType, String savedRaw, String error) {
        if (!status.isError()) {
            throw new IllegalArgumentException("Not an error status: " + status);
        }
        return new CrawlRecord(url, status, httpStatus, contentType, savedRaw, null, null, depth,
                error == null ? status.name().toLowerCase() : error);
    }

    @JsonProperty("url")
    public String getUrl() { return url; }

    @JsonProperty("status")
    public Object getStatus() {
        return crawlStatus == CrawlStatus.OK ? httpStatus : crawlStatus.getReportTag();
    }

    @JsonIgnore
    public CrawlStatus getCrawlStatus() { return crawlStatus; }

    @JsonIgnore
    public Integer getHttpStatus() { return httpStatus; }

    @JsonProperty("content_type")
    public String getContentType() { return contentType; }

    @JsonProperty("saved_raw")
    public String getSavedRaw() { return savedRaw; }

    @JsonProperty("saved_text")
    public String getSavedText() { return savedText; }

    @JsonProperty("title")
    public String getTitle() { return title; }

    @JsonProperty("depth")
    public int getDepth() { return depth; }

    @JsonProperty("error")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public String getError() { return error; }

    @Override
    public String toString() {
        return "CrawlRecord{" +
                "url='" + url + '\'' +
                ", status=" + getStatus() +
                ", contentType='" + contentType + '\'' +
                ", savedRaw='" + savedRaw + '\'' +
                ", savedText='" + savedText + '\'' +
                ", title='" + title + '\'' +
                ", depth=" + depth +
                (error != null ? ", error='" + error + '\'' : "") +
                '}';
    }
}

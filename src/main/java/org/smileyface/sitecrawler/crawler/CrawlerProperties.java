package org.smileyface.sitecrawler.crawler;

import org.smileyface.sitecrawler.model.ExtractMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration for a single-domain crawl. One instance is bound by Spring and handed to every
 * component at construction; tests build one directly.
 */
@ConfigurationProperties(prefix = "crawler")
public class CrawlerProperties {

    public static final String DEFAULT_USER_AGENT = "DataCollectorBot/1.0 (+mailto:crawler@example.com)";
    public static final String DEFAULT_REPORT_FILE_NAME = "crawl_report.jsonl";

    /** Start page (http/https). Validated when the crawl starts. */
    private String seedUrl;

    /** Directory receiving {@code raw/}, {@code text/} and the report. */
    private String outputDir = "data/crawl";

    private String reportFileName = DEFAULT_REPORT_FILE_NAME;

    /** Maximum number of pages fetched successfully (skips and errors do not count). */
    private int maxPages = 50;

    /**
     * Maximum crawl depth starting from the seed URL. depth=0 means only the seed page.
     */
    private int maxDepth = 3;

    private String userAgent = DEFAULT_USER_AGENT;

    /** Accept subdomains of the seed's registrable domain, not only the seed host itself. */
    private boolean includeSubdomains = false;

    private ExtractMode extract = ExtractMode.NONE;

    /** Do not load or consult robots.txt. Meant for testing against own sites. */
    private boolean ignoreRobots = false;

    /** Politeness delay used when robots.txt declares no crawl-delay. */
    private Duration delay = Duration.ofMillis(500);

    /** Connect/read timeout of a single fetch attempt. */
    private Duration requestTimeout = Duration.ofSeconds(15);

    private Duration robotsTimeout = Duration.ofSeconds(5);

    /** Retries after the first attempt, for 429/5xx responses and I/O failures. */
    private int retryCount = 3;

    /** Backoff factor in seconds: retry n waits {@code backoffFactor * 2^(n-1)}. */
    private double backoffFactor = 0.5;

    /** Upper bound applied to a server-sent Retry-After. */
    private Duration maxRetryAfter = Duration.ofSeconds(60);

    /** Maximum body bytes read per response; 0 means unlimited. */
    private int maxBodySize = 0;

    private boolean runOnStartup = true;

    /** How long a context shutdown waits for the crawl loop to reach a safe stopping point. */
    private Duration shutdownTimeout = Duration.ofSeconds(30);

    public String getSeedUrl() {
        return seedUrl;
    }

    public void setSeedUrl(String seedUrl) {
        this.seedUrl = seedUrl;
    }

    public String getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(String outputDir) {
        this.outputDir = (outputDir == null || outputDir.isBlank()) ? "data/crawl" : outputDir;
    }

    public String getReportFileName() {
        return reportFileName;
    }

    public void setReportFileName(String reportFileName) {
        this.reportFileName = (reportFileName == null || reportFileName.isBlank())
                ? DEFAULT_REPORT_FILE_NAME : reportFileName;
    }

    public int getMaxPages() {
        return maxPages;
    }

    public void setMaxPages(int maxPages) {
        this.maxPages = Math.max(0, maxPages);
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public void setMaxDepth(int maxDepth) {
        this.maxDepth = Math.max(0, maxDepth);
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = (userAgent == null || userAgent.isBlank()) ? DEFAULT_USER_AGENT : userAgent;
    }

    /**
     * The product token of the user agent, used to select robots.txt groups:
     * {@code "DataCollectorBot/1.0 (+mailto:..)"} becomes {@code "datacollectorbot"}.
     */
    public String getRobotsAgentName() {
        String ua = userAgent.trim();
        int end = ua.length();
        for (int i = 0; i < ua.length(); i++) {
            char c = ua.charAt(i);
            if (c == '/' || Character.isWhitespace(c)) {
                end = i;
                break;
            }
        }
        String token = ua.substring(0, end).toLowerCase();
        return token.isEmpty() ? "*" : token;
    }

    public boolean isIncludeSubdomains() {
        return includeSubdomains;
    }

    public void setIncludeSubdomains(boolean includeSubdomains) {
        this.includeSubdomains = includeSubdomains;
    }

    public ExtractMode getExtract() {
        return extract;
    }

    public void setExtract(ExtractMode extract) {
        this.extract = extract == null ? ExtractMode.NONE : extract;
    }

    public boolean isIgnoreRobots() {
        return ignoreRobots;
    }

    public void setIgnoreRobots(boolean ignoreRobots) {
        this.ignoreRobots = ignoreRobots;
    }

    public Duration getDelay() {
        return delay;
    }

    public void setDelay(Duration delay) {
        this.delay = (delay == null || delay.isNegative()) ? Duration.ZERO : delay;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = positiveOr(requestTimeout, Duration.ofSeconds(15));
    }

    public Duration getRobotsTimeout() {
        return robotsTimeout;
    }

    public void setRobotsTimeout(Duration robotsTimeout) {
        this.robotsTimeout = positiveOr(robotsTimeout, Duration.ofSeconds(5));
    }

    public int getRetryCount() {
        return retryCount;
    }

    public void setRetryCount(int retryCount) {
        this.retryCount = Math.max(0, retryCount);
    }

    public double getBackoffFactor() {
        return backoffFactor;
    }

    public void setBackoffFactor(double backoffFactor) {
        this.backoffFactor = Math.max(0.0, backoffFactor);
    }

    public Duration getMaxRetryAfter() {
        return maxRetryAfter;
    }

    public void setMaxRetryAfter(Duration maxRetryAfter) {
        this.maxRetryAfter = (maxRetryAfter == null || maxRetryAfter.isNegative()) ? Duration.ZERO : maxRetryAfter;
    }

    public int getMaxBodySize() {
        return maxBodySize;
    }

    public void setMaxBodySize(int maxBodySize) {
        this.maxBodySize = Math.max(0, maxBodySize);
    }

    public boolean isRunOnStartup() {
        return runOnStartup;
    }

    public void setRunOnStartup(boolean runOnStartup) {
        this.runOnStartup = runOnStartup;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = positiveOr(shutdownTimeout, Duration.ofSeconds(30));
    }

    private static Duration positiveOr(Duration value, Duration fallback) {
        return (value == null || value.isNegative() || value.isZero()) ? fallback : value;
    }

    @Override
    public String toString() {
        return "CrawlerProperties{" +
                "seedUrl='" + seedUrl + '\'' +
                ", outputDir='" + outputDir + '\'' +
                ", reportFileName='" + reportFileName + '\'' +
                ", maxPages=" + maxPages +
                ", maxDepth=" + maxDepth +
                ", userAgent='" + userAgent + '\'' +
                ", includeSubdomains=" + includeSubdomains +
                ", extract=" + extract +
                ", ignoreRobots=" + ignoreRobots +
                ", delay=" + delay +
                ", requestTimeout=" + requestTimeout +
                ", robotsTimeout=" + robotsTimeout +
                ", retryCount=" + retryCount +
                ", backoffFactor=" + backoffFactor +
                ", maxRetryAfter=" + maxRetryAfter +
                ", maxBodySize=" + maxBodySize +
                '}';
    }
}

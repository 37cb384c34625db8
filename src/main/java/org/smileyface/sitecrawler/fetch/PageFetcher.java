package org.smileyface.sitecrawler.fetch;

import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.sitecrawler.crawler.CrawlerProperties;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Performs HTTP GETs through Jsoup with a bounded retry policy.
 *
 * <p>Statuses 429, 500, 502, 503 and 504 and I/O failures, including a body that stops arriving, are
 * retried up to {@link CrawlerProperties#getRetryCount()} times with exponential backoff
 * ({@code backoffFactor * 2^(n-1)} seconds before retry n). A {@code Retry-After} header overrides the
 * computed wait, capped by {@link CrawlerProperties#getMaxRetryAfter()}. Any other response, including
 * other 4xx, is returned as-is on the first attempt.</p>
 */
public class PageFetcher {

    private static final Logger log = LoggerFactory.getLogger(PageFetcher.class);

    static final Set<Integer> RETRYABLE_STATUSES = Set.of(429, 500, 502, 503, 504);

    private final CrawlerProperties properties;

    public PageFetcher(CrawlerProperties properties) {
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    /**
     * Fetch with the configured per-request timeout.
     */
    public FetchResult fetch(String url) throws FetchException {
        return fetch(url, properties.getRequestTimeout());
    }

    /**
     * Fetch with an explicit per-attempt timeout.
     *
     * @throws FetchException if no attempt produced a non-retryable response
     */
    public FetchResult fetch(String url, Duration timeout) throws FetchException {
        int maxAttempts = properties.getRetryCount() + 1;
        IOException lastError = null;
        Integer lastStatus = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Connection.Response res;
            byte[] body = null;
            try {
                res = connect(url, timeout).execute();
                if (!RETRYABLE_STATUSES.contains(res.statusCode())) {
                    // jsoup reads the body lazily; a stall or reset surfaces here
                    body = res.bodyAsBytes();
                }
            } catch (IOException | UncheckedIOException e) {
                lastError = e instanceof UncheckedIOException u ? u.getCause() : (IOException) e;
                lastStatus = null;
                if (attempt == maxAttempts) break;
                Duration wait = backoff(attempt);
                log.warn("GET {} failed on attempt {}/{} ({}), retrying in {} ms",
                        url, attempt, maxAttempts, lastError.toString(), wait.toMillis());
                pause(url, attempt, wait);
                continue;
            } catch (IllegalArgumentException e) {
                // malformed URL or unsupported protocol; retrying cannot help
                throw new FetchException(url, attempt, null, "invalid request: " + e.getMessage(), e);
            }

            int status = res.statusCode();
            if (body != null) {
                return toResult(url, res, body, attempt);
            }
            lastStatus = status;
            lastError = null;
            if (attempt == maxAttempts) break;
            Duration wait = retryAfter(res.header("Retry-After")).orElse(backoff(attempt));
            log.warn("GET {} returned {} on attempt {}/{}, retrying in {} ms",
                    url, status, attempt, maxAttempts, wait.toMillis());
            pause(url, attempt, wait);
        }

        String message = lastStatus != null
                ? "retries exhausted after " + maxAttempts + " attempts (last status " + lastStatus + ")"
                : "request failed after " + maxAttempts + " attempts: " + lastError;
        throw new FetchException(url, maxAttempts, lastStatus, message, lastError);
    }

    private Connection connect(String url, Duration timeout) {
        return Jsoup.connect(url)
                .userAgent(properties.getUserAgent())
                .timeout((int) Math.min(Integer.MAX_VALUE, timeout.toMillis()))
                .maxBodySize(properties.getMaxBodySize())
                .followRedirects(true)
                .ignoreHttpErrors(true)
                .ignoreContentType(true);
    }

    private static FetchResult toResult(String url, Connection.Response res, byte[] body, int attempts) {
        return new FetchResult(
                url,
                res.url() != null ? res.url().toString() : url,
                res.statusCode(),
                res.contentType(),
                res.headers(),
                body,
                res.charset(),
                attempts);
    }

    /**
     * Wait before retry number {@code retry} (1-based).
     */
    Duration backoff(int retry) {
        double seconds = properties.getBackoffFactor() * Math.pow(2, retry - 1);
        return Duration.ofMillis(Math.round(seconds * 1000));
    }

    /**
     * Parses a {@code Retry-After} value given as delta-seconds or an HTTP date.
     */
    Optional<Duration> retryAfter(String header) {
        if (header == null || header.isBlank()) return Optional.empty();
        Duration wait;
        try {
            wait = Duration.ofSeconds(Long.parseLong(header.trim()));
        } catch (NumberFormatException e) {
            try {
                ZonedDateTime at = ZonedDateTime.parse(header.trim(), DateTimeFormatter.RFC_1123_DATE_TIME);
                wait = Duration.between(ZonedDateTime.now(at.getZone()), at);
            } catch (DateTimeParseException ex) {
                log.debug("Ignoring unparseable Retry-After: {}", header);
                return Optional.empty();
            }
        }
        if (wait.isNegative()) wait = Duration.ZERO;
        Duration cap = properties.getMaxRetryAfter();
        return Optional.of(wait.compareTo(cap) > 0 ? cap : wait);
    }

    private static void pause(String url, int attempt, Duration wait) throws FetchException {
        if (wait.isZero()) return;
        try {
            Thread.sleep(wait.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(url, attempt, null, "interrupted while waiting to retry", e);
        }
    }
}

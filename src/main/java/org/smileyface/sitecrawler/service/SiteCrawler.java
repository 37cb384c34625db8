package org.smileyface.sitecrawler.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.sitecrawler.crawler.CrawlerProperties;
import org.smileyface.sitecrawler.crawler.DomainScope;
import org.smileyface.sitecrawler.crawler.Frontier;
import org.smileyface.sitecrawler.crawler.FrontierEntry;
import org.smileyface.sitecrawler.extractor.ContentExtractor;
import org.smileyface.sitecrawler.extractor.LinkExtractor;
import org.smileyface.sitecrawler.fetch.FetchException;
import org.smileyface.sitecrawler.fetch.FetchResult;
import org.smileyface.sitecrawler.fetch.PageFetcher;
import org.smileyface.sitecrawler.model.CrawlRecord;
import org.smileyface.sitecrawler.model.CrawlStatus;
import org.smileyface.sitecrawler.persist.ContentPersister;
import org.smileyface.sitecrawler.report.CrawlReporter;
import org.smileyface.sitecrawler.robots.RobotsDirectives;
import org.smileyface.sitecrawler.robots.RobotsPolicy;
import org.smileyface.sitecrawler.util.CrawlerUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Breadth-first crawl of a single domain, driven by one thread.
 *
 * <p>Each dequeued URL is resolved to exactly one report record: skipped by robots, fetched, or
 * failed. Failures are isolated to the page they happened on. The loop ends when the frontier is
 * empty, when {@code max-pages} fetched pages have been recorded, or when {@link #stop()} is
 * called (or the crawling thread is interrupted), in which case it ends after the current record.</p>
 *
 * <p>An instance runs at most one crawl.</p>
 */
public class SiteCrawler {

    private static final Logger log = LoggerFactory.getLogger(SiteCrawler.class);

    private final CrawlerProperties properties;
    private final PageFetcher fetcher;
    private final RobotsPolicy robotsPolicy;
    private final ContentExtractor contentExtractor;
    private final ObjectMapper objectMapper;

    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final CountDownLatch terminated = new CountDownLatch(1);
    private final AtomicLong processedCount = new AtomicLong(0);
    private final AtomicLong skippedCount = new AtomicLong(0);
    private final AtomicLong errorCount = new AtomicLong(0);

    private volatile CrawlState state = CrawlState.NEW;
    private volatile boolean started;
    private volatile int frontierSize;
    private volatile String lastUrl;
    private volatile String lastError;
    private volatile Instant startedAt;
    private volatile Instant finishedAt;

    public SiteCrawler(CrawlerProperties properties,
                       PageFetcher fetcher,
                       RobotsPolicy robotsPolicy,
                       ContentExtractor contentExtractor) {
        this(properties, fetcher, robotsPolicy, contentExtractor, new ObjectMapper());
    }

    public SiteCrawler(CrawlerProperties properties,
                       PageFetcher fetcher,
                       RobotsPolicy robotsPolicy,
                       ContentExtractor contentExtractor,
                       ObjectMapper objectMapper) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.robotsPolicy = Objects.requireNonNull(robotsPolicy, "robotsPolicy");
        this.contentExtractor = Objects.requireNonNull(contentExtractor, "contentExtractor");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    /**
     * Runs the crawl on the calling thread and returns when it has ended.
     *
     * @return the final progress snapshot
     * @throws InvalidSeedUrlException if the configured seed is not a crawlable URL
     * @throws UncheckedIOException    if the output directories or the report cannot be written
     * @throws IllegalStateException   if this crawler has already run
     */
    public CrawlProgress crawl() {
        String seed = CrawlerUtils.canonicalize(properties.getSeedUrl());
        if (seed == null) {
            throw new InvalidSeedUrlException(properties.getSeedUrl());
        }
        synchronized (this) {
            if (state == CrawlState.STOPPED) {
                log.info("Crawler stopped before it started; nothing to do");
                return getStatus();
            }
            if (state != CrawlState.NEW) {
                throw new IllegalStateException("Crawl already started (state=" + state + ")");
            }
            started = true;
            transitionTo(CrawlState.RUNNING, null);
        }
        try {
            boolean stopped = run(seed);
            transitionTo(stopped ? CrawlState.STOPPED : CrawlState.COMPLETED, null);
            return getStatus();
        } catch (IOException e) {
            lastError = e.getMessage();
            transitionTo(CrawlState.ERROR, e);
            throw new UncheckedIOException(e);
        } catch (RuntimeException e) {
            lastError = e.getMessage();
            transitionTo(CrawlState.ERROR, e);
            throw e;
        } finally {
            terminated.countDown();
        }
    }

    /**
     * Requests the loop to end after the record it is working on. Wakes up a pending politeness wait.
     */
    public void stop() {
        stopRequested.set(true);
        stopSignal.countDown();
        synchronized (this) {
            if (state == CrawlState.NEW) {
                transitionTo(CrawlState.STOPPED, null);
            }
        }
    }

    /**
     * Waits for a running crawl to end.
     *
     * @return true when no crawl is running anymore, false on timeout
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        if (!started) return true;
        return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Destroy callback: stops a running crawl and waits up to {@code crawler.shutdown-timeout} so the
     * report is closed after its last complete record.
     */
    public void shutdown() {
        if (state != CrawlState.RUNNING) {
            stop();
            return;
        }
        log.info("Shutdown requested; stopping crawl after the current page");
        stop();
        try {
            if (!awaitTermination(properties.getShutdownTimeout())) {
                log.warn("Crawl did not stop within {} ms", properties.getShutdownTimeout().toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the crawl to stop");
        }
    }

    public CrawlProgress getStatus() {
        return new CrawlProgress(state, processedCount.get(), skippedCount.get(), errorCount.get(),
                frontierSize, lastUrl, lastError, startedAt, finishedAt);
    }

    /**
     * @return true when the loop ended because a stop was requested
     */
    private boolean run(String seed) throws IOException {
        int maxPages = properties.getMaxPages();
        int maxDepth = properties.getMaxDepth();

        ContentPersister persister = new ContentPersister(properties, contentExtractor);
        persister.init();
        DomainScope scope = new DomainScope(seed, properties.isIncludeSubdomains());

        RobotsDirectives directives;
        Duration delay;
        if (properties.isIgnoreRobots()) {
            log.info("Ignoring robots.txt");
            directives = RobotsDirectives.absent();
            delay = properties.getDelay();
        } else {
            directives = robotsPolicy.load(seed);
            delay = robotsPolicy.effectiveDelay(directives);
        }

        Frontier frontier = new Frontier();
        frontier.enqueue(new FrontierEntry(seed, 0));
        Session session = new Session(persister, new LinkExtractor(scope), directives, frontier, maxDepth);

        Path reportPath = Paths.get(properties.getOutputDir()).resolve(properties.getReportFileName());
        log.info("Starting crawl: seed={}, scope={}, maxPages={}, maxDepth={}, delay={} ms, report={}",
                seed, scope, maxPages, maxDepth, delay.toMillis(), reportPath);

        try (CrawlReporter reporter = new CrawlReporter(reportPath, objectMapper)) {
            log.debug("Raw bodies go to {}, extracted content to {}, records to {}",
                    persister.getRawDir(), persister.getTextDir(), reporter.getPath());
            while (!frontier.isEmpty() && processedCount.get() < maxPages) {
                if (isStopRequested()) {
                    return true;
                }
                FrontierEntry entry = frontier.poll();
                frontierSize = frontier.size();
                if (entry.depth() > maxDepth || frontier.isVisited(entry.url())) {
                    continue;
                }
                lastUrl = entry.url();

                CrawlRecord record = visit(entry, session);
                append(reporter, record);
                frontier.markVisited(entry.url());
                frontierSize = frontier.size();
                count(record, maxPages);

                boolean fetched = record.getCrawlStatus() != CrawlStatus.SKIPPED_ROBOTS;
                boolean more = !frontier.isEmpty() && processedCount.get() < maxPages;
                if (fetched && more && !pause(delay)) {
                    return true;
                }
            }
            return isStopRequested();
        }
    }

    private CrawlRecord visit(FrontierEntry entry, Session session) {
        String url = entry.url();
        if (!robotsPolicy.canFetch(session.directives(), url)) {
            log.info("[robots] Skipping (disallowed): {}", url);
            return CrawlRecord.disallowed(url, entry.depth());
        }

        FetchResult res;
        try {
            res = fetcher.fetch(url);
        } catch (FetchException e) {
            log.warn("Failed to GET {}: {}", url, e.getMessage());
            return CrawlRecord.failed(url, entry.depth(), CrawlStatus.ERROR_FETCH, e.getLastStatus(),
                    null, null, "fetch: " + e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Unexpected failure while fetching {}", url, e);
            return CrawlRecord.failed(url, entry.depth(), CrawlStatus.ERROR_FETCH, null,
                    null, null, "fetch: " + e);
        }
        if (res.attempts() > 1) {
            log.debug("GET {} succeeded after {} attempts", url, res.attempts());
        }

        try {
            return handleResponse(entry, res, session);
        } catch (RuntimeException e) {
            log.warn("Unexpected failure while handling {}", url, e);
            return CrawlRecord.failed(url, entry.depth(), CrawlStatus.ERROR_PARSE, res.statusCode(),
                    res.contentType(), null, "parse: " + e);
        }
    }

    private CrawlRecord handleResponse(FrontierEntry entry, FetchResult res, Session session) {
        String url = entry.url();
        String contentType = res.contentType();

        Path raw;
        try {
            raw = session.persister().saveRaw(url, contentType, res.body());
        } catch (IOException e) {
            log.warn("Can't write raw body of {}: {}", url, e.toString());
            return CrawlRecord.failed(url, entry.depth(), CrawlStatus.ERROR_PERSIST, res.statusCode(),
                    contentType, null, "persist: " + e);
        }

        try {
            return describe(entry, res, session, raw);
        } catch (RuntimeException e) {
            log.warn("Unexpected failure while handling {}", url, e);
            return CrawlRecord.failed(url, entry.depth(), CrawlStatus.ERROR_PARSE, res.statusCode(),
                    contentType, raw.toString(), "parse: " + e);
        }
    }

    /**
     * Title, companion artifact and child links of a response whose raw body is already on disk.
     */
    private CrawlRecord describe(FrontierEntry entry, FetchResult res, Session session, Path raw) {
        String url = entry.url();
        String contentType = res.contentType();
        String title = null;
        Path text = null;
        if (res.isHtml()) {
            Document doc;
            try {
                doc = Jsoup.parse(res.bodyAsString(), res.finalUrl());
            } catch (RuntimeException e) {
                log.warn("HTML parse failed for {}: {}", url, e.toString());
                return CrawlRecord.failed(url, entry.depth(), CrawlStatus.ERROR_PARSE, res.statusCode(),
                        contentType, raw.toString(), "parse: " + e);
            }
            title = titleOf(doc);
            try {
                text = session.persister().extractAndSaveText(url, contentType, doc, properties.getExtract())
                        .orElse(null);
            } catch (IOException e) {
                log.warn("Can't write extracted text of {}: {}", url, e.toString());
                return CrawlRecord.failed(url, entry.depth(), CrawlStatus.ERROR_PERSIST, res.statusCode(),
                        contentType, raw.toString(), "persist: " + e);
            }
            if (entry.depth() < session.maxDepth()) {
                enqueueChildren(entry, doc, session);
            }
        }

        return CrawlRecord.fetched(url, entry.depth(), res.statusCode(), contentType, raw.toString(),
                text == null ? null : text.toString(), title);
    }

    private void enqueueChildren(FrontierEntry parent, Document doc, Session session) {
        Frontier frontier = session.frontier();
        Set<String> links = session.links().extractLinks(doc,
                url -> !frontier.isKnown(url) && robotsPolicy.canFetch(session.directives(), url));
        int added = 0;
        for (String link : links) {
            if (frontier.enqueue(parent.child(link))) {
                added++;
            }
        }
        log.debug("Enqueued {} of {} links from {} at depth {}", added, links.size(), parent.url(), parent.depth() + 1);
    }

    private static String titleOf(Document doc) {
        String title = doc.title();
        return title == null || title.isBlank() ? null : title.trim();
    }

    private void append(CrawlReporter reporter, CrawlRecord record) {
        try {
            reporter.append(record);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append report record for " + record.getUrl(), e);
        }
    }

    private void count(CrawlRecord record, int maxPages) {
        switch (record.getCrawlStatus()) {
            case OK -> {
                long n = processedCount.incrementAndGet();
                log.info("[{}/{}] Fetched {} (status={}, type={})",
                        n, maxPages, record.getUrl(), record.getHttpStatus(), record.getContentType());
            }
            case SKIPPED_ROBOTS -> skippedCount.incrementAndGet();
            default -> {
                errorCount.incrementAndGet();
                lastError = record.getError();
            }
        }
    }

    private boolean isStopRequested() {
        return stopRequested.get() || Thread.currentThread().isInterrupted();
    }

    /**
     * Politeness wait. Returns false when a stop was requested before or during the wait.
     */
    private boolean pause(Duration delay) {
        if (isStopRequested()) return false;
        if (delay.isZero() || delay.isNegative()) return true;
        try {
            return !stopSignal.await(delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void transitionTo(CrawlState newState, Throwable error) {
        CrawlState old = this.state;
        if (newState == CrawlState.RUNNING) {
            this.startedAt = Instant.now();
            this.state = newState;
            log.info("Crawler state {} -> {} (startedAt={})", old, newState, startedAt);
            return;
        }
        this.finishedAt = Instant.now();
        this.state = newState;
        long dur = startedAt != null ? Duration.between(startedAt, finishedAt).toMillis() : 0L;
        switch (newState) {
            case STOPPED, COMPLETED -> log.info(
                    "Crawler state {} -> {} after {} ms (processed={}, skipped={}, errors={}, lastUrl={})",
                    old, newState, dur, processedCount.get(), skippedCount.get(), errorCount.get(), lastUrl);
            case ERROR -> log.error("Crawler state {} -> ERROR after {} ms (processed={}, lastUrl={}, error={})",
                    old, dur, processedCount.get(), lastUrl, lastError, error);
            default -> log.info("Crawler state {} -> {}", old, newState);
        }
    }

    private record Session(ContentPersister persister,
                           LinkExtractor links,
                           RobotsDirectives directives,
                           Frontier frontier,
                           int maxDepth) {
    }
}

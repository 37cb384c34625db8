package org.smileyface.sitecrawler.fetch;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.smileyface.sitecrawler.crawler.CrawlerProperties;
import org.smileyface.sitecrawler.testutil.TestSite;
import org.smileyface.sitecrawler.testutil.TestSite.Reply;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PageFetcherTest {

    private TestSite site;
    private CrawlerProperties props;
    private PageFetcher fetcher;

    @BeforeEach
    void setUp() throws IOException {
        site = TestSite.start();
        props = new CrawlerProperties();
        props.setBackoffFactor(0.0);
        props.setRequestTimeout(Duration.ofSeconds(5));
        fetcher = new PageFetcher(props);
    }

    @AfterEach
    void tearDown() {
        if (site != null) site.close();
    }

    @Test
    void fetch_ok_returnsBodyTypeAndSingleAttempt() throws Exception {
        site.page("/", "<p>hello</p>");

        FetchResult res = fetcher.fetch(site.url("/"));

        assertThat(res.statusCode()).isEqualTo(200);
        assertThat(res.isHtml()).isTrue();
        assertThat(res.attempts()).isEqualTo(1);
        assertThat(res.bodyAsString()).contains("<p>hello</p>");
        assertThat(site.count("/")).isEqualTo(1);
    }

    @Test
    void fetch_503Twice_thenOk_retriesTransparently() throws Exception {
        site.sequence("/flaky", Reply.status(503), Reply.status(503), Reply.html(TestSite.html("ok")));

        FetchResult res = fetcher.fetch(site.url("/flaky"));

        assertThat(res.statusCode()).isEqualTo(200);
        assertThat(res.attempts()).isEqualTo(3);
        assertThat(site.count("/flaky")).isEqualTo(3);
    }

    @Test
    void fetch_bodyStallsOnce_isRetriedLikeAnyIoFailure() throws Exception {
        props.setRequestTimeout(Duration.ofMillis(500));
        props.setRetryCount(1);
        String page = TestSite.html("<p>" + "x".repeat(2000) + "</p>");
        site.sequence("/stall", Reply.stalled(page, 3000), Reply.html(page));

        FetchResult res = fetcher.fetch(site.url("/stall"));

        assertThat(res.statusCode()).isEqualTo(200);
        assertThat(res.attempts()).isEqualTo(2);
        assertThat(res.bodyAsString()).isEqualTo(page);
    }

    @Test
    void fetch_bodyAlwaysStalls_throwsFetchException() {
        props.setRequestTimeout(Duration.ofMillis(500));
        props.setRetryCount(0);
        site.route("/stall", Reply.stalled(TestSite.html("<p>" + "x".repeat(2000) + "</p>"), 3000));

        assertThatThrownBy(() -> fetcher.fetch(site.url("/stall")))
                .isInstanceOf(FetchException.class)
                .hasMessageContaining("request failed after 1 attempts")
                .satisfies(e -> assertThat(((FetchException) e).getLastStatus()).isNull());
    }

    @Test
    void fetch_404_isReturnedWithoutRetry() throws Exception {
        FetchResult res = fetcher.fetch(site.url("/missing"));

        assertThat(res.statusCode()).isEqualTo(404);
        assertThat(site.count("/missing")).isEqualTo(1);
    }

    @Test
    void fetch_retryableUntilTheEnd_throwsRetriesExhausted() {
        props.setRetryCount(2);
        site.route("/down", Reply.status(502));

        assertThatThrownBy(() -> fetcher.fetch(site.url("/down")))
                .isInstanceOfSatisfying(FetchException.class, e -> {
                    assertThat(e.getMessage()).contains("retries exhausted");
                    assertThat(e.getLastStatus()).isEqualTo(502);
                    assertThat(e.getAttempts()).isEqualTo(3);
                });
        assertThat(site.count("/down")).isEqualTo(3);
    }

    @Test
    void fetch_retryCountZero_meansSingleAttempt() {
        props.setRetryCount(0);
        site.route("/busy", Reply.status(429));

        assertThatThrownBy(() -> fetcher.fetch(site.url("/busy"))).isInstanceOf(FetchException.class);
        assertThat(site.count("/busy")).isEqualTo(1);
    }

    @Test
    void fetch_connectionRefused_throwsAfterRetries() throws Exception {
        props.setRetryCount(1);
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }

        assertThatThrownBy(() -> fetcher.fetch("http://localhost:" + port + "/"))
                .isInstanceOfSatisfying(FetchException.class, e -> {
                    assertThat(e.getLastStatus()).isNull();
                    assertThat(e.getAttempts()).isEqualTo(2);
                });
    }

    @Test
    void fetch_followsRedirects_andReportsFinalUrl() throws Exception {
        site.route("/old", Reply.redirect("/new"));
        site.page("/new", "<p>moved</p>");

        FetchResult res = fetcher.fetch(site.url("/old"));

        assertThat(res.statusCode()).isEqualTo(200);
        assertThat(res.requestUrl()).isEqualTo(site.url("/old"));
        assertThat(res.finalUrl()).isEqualTo(site.url("/new"));
    }

    @Test
    void fetch_binaryBody_keepsBytes() throws Exception {
        byte[] png = {(byte) 0x89, 'P', 'N', 'G', 0, 1, 2};
        site.route("/logo.png", Reply.bytes("image/png", png));

        FetchResult res = fetcher.fetch(site.url("/logo.png"));

        assertThat(res.kind()).isEqualTo(ContentKind.IMAGE);
        assertThat(res.body()).containsExactly(png);
    }

    @Test
    void fetch_sendsConfiguredUserAgent() throws Exception {
        props.setUserAgent("TestBot/9.9");
        site.page("/", "x");

        fetcher.fetch(site.url("/"));

        assertThat(site.requests()).extracting(TestSite.Request::userAgent).containsExactly("TestBot/9.9");
    }

    @Test
    void backoff_isExponential() {
        props.setBackoffFactor(0.5);

        assertThat(fetcher.backoff(1)).isEqualTo(Duration.ofMillis(500));
        assertThat(fetcher.backoff(2)).isEqualTo(Duration.ofMillis(1000));
        assertThat(fetcher.backoff(3)).isEqualTo(Duration.ofMillis(2000));
    }

    @Test
    void retryAfter_parsesSecondsAndDates_andIsCapped() {
        props.setMaxRetryAfter(Duration.ofSeconds(10));

        assertThat(fetcher.retryAfter("3")).contains(Duration.ofSeconds(3));
        assertThat(fetcher.retryAfter("3600")).contains(Duration.ofSeconds(10));
        assertThat(fetcher.retryAfter("soon")).isEmpty();
        assertThat(fetcher.retryAfter(null)).isEmpty();

        String past = DateTimeFormatter.RFC_1123_DATE_TIME.format(ZonedDateTime.now().minusHours(1));
        assertThat(fetcher.retryAfter(past)).contains(Duration.ZERO);
    }

    @Test
    void retryAfter_headerOverridesBackoff() throws Exception {
        props.setBackoffFactor(30.0);
        site.sequence("/limited",
                Reply.status(429).withHeader("Retry-After", "0"),
                Reply.of(200, "text/plain", "done"));

        long start = System.nanoTime();
        FetchResult res = fetcher.fetch(site.url("/limited"));
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertThat(res.statusCode()).isEqualTo(200);
        assertThat(new String(res.body(), StandardCharsets.UTF_8)).isEqualTo("done");
        assertThat(elapsedMs).isLessThan(10_000);
    }
}

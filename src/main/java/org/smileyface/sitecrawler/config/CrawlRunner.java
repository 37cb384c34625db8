package org.smileyface.sitecrawler.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.sitecrawler.crawler.CrawlerProperties;
import org.smileyface.sitecrawler.service.CrawlProgress;
import org.smileyface.sitecrawler.service.SiteCrawler;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Starts one crawl when the application is ready, unless {@code crawler.run-on-startup} is false.
 *
 * <p>A first non-option argument is taken as the seed URL, so
 * {@code java -jar sitecrawler.jar https://example.com/} works without {@code --crawler.seed-url}.</p>
 */
@Component
public class CrawlRunner implements ApplicationRunner {

    private static final Logger log = LogManager.getLogger();

    private final CrawlerProperties properties;
    private final SiteCrawler siteCrawler;

    public CrawlRunner(CrawlerProperties properties, SiteCrawler siteCrawler) {
        this.properties = properties;
        this.siteCrawler = siteCrawler;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.isRunOnStartup()) {
            log.info("crawler.run-on-startup=false; not crawling");
            return;
        }
        List<String> positional = args.getNonOptionArgs();
        if (!positional.isEmpty()) {
            properties.setSeedUrl(positional.get(0));
        }
        log.info("Crawling with {}", properties);
        CrawlProgress result = siteCrawler.crawl();
        log.info("Crawl summary: state={}, records={} (processed={}, skipped={}, errors={}), elapsed={} ms",
                result.getState(), result.getRecordCount(), result.getProcessedCount(),
                result.getSkippedCount(), result.getErrorCount(), result.getElapsed().toMillis());
    }
}

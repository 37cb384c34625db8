package org.smileyface.sitecrawler.robots;

import crawlercommons.robots.BaseRobotRules;
import crawlercommons.robots.SimpleRobotRulesParser;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.sitecrawler.crawler.CrawlerProperties;
import org.smileyface.sitecrawler.fetch.FetchException;
import org.smileyface.sitecrawler.fetch.FetchResult;
import org.smileyface.sitecrawler.fetch.PageFetcher;
import org.smileyface.sitecrawler.util.CrawlerUtils;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Loads robots.txt for the crawl's domain once and answers allow/deny and crawl-delay questions.
 *
 * <p>Rule evaluation is delegated to crawler-commons ({@link SimpleRobotRulesParser}), which implements
 * RFC 9309 matching: wildcards, {@code $} anchors, longest match wins, allow wins a tie, no matching
 * rule means allowed. Loading and evaluation fail open: a missing, unreachable or non-200 robots.txt
 * yields {@link RobotsDirectives#absent()}, and an error while evaluating a URL allows it.</p>
 */
public class RobotsPolicy {

    private static final Logger log = LogManager.getLogger();

    static final String WILDCARD_AGENT = "*";

    private final CrawlerProperties properties;
    private final PageFetcher fetcher;

    public RobotsPolicy(CrawlerProperties properties, PageFetcher fetcher) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
    }

    /**
     * Fetches and parses {@code /robots.txt} of the given origin.
     *
     * @param domainRoot canonical URL on the target domain; only scheme, host and port are used
     * @return parsed directives, or absent when robots.txt is unavailable
     */
    public RobotsDirectives load(String domainRoot) {
        String robotsUrl = CrawlerUtils.originOf(domainRoot) + "/robots.txt";
        FetchResult res;
        try {
            res = fetcher.fetch(robotsUrl, properties.getRobotsTimeout());
        } catch (FetchException e) {
            log.info("No robots.txt parsed at {} ({}); proceeding permissively", robotsUrl, e.getMessage());
            return RobotsDirectives.absent();
        }
        if (res.statusCode() != 200) {
            log.info("No robots.txt parsed at {} (status={}); proceeding permissively", robotsUrl, res.statusCode());
            return RobotsDirectives.absent();
        }
        return parse(robotsUrl, res.body(), res.contentType());
    }

    /**
     * Parses robots.txt content for the configured agent. Content that cannot be parsed at all is
     * treated as absent.
     */
    public RobotsDirectives parse(String robotsUrl, byte[] content, String contentType) {
        try {
            SimpleRobotRulesParser parser = new SimpleRobotRulesParser();
            String type = contentType == null ? "text/plain" : contentType;
            BaseRobotRules rules = parser.parseContent(robotsUrl, content, type,
                    List.of(properties.getRobotsAgentName()));
            // the agent's own group hides the * group, whose crawl-delay still applies as a fallback
            BaseRobotRules wildcardRules = parser.parseContent(robotsUrl, content, type, List.of(WILDCARD_AGENT));
            RobotsDirectives directives = RobotsDirectives.of(robotsUrl, rules, wildcardRules);
            log.info("Loaded robots.txt: {} (agent={}, crawlDelay={})",
                    robotsUrl, properties.getRobotsAgentName(), directives.crawlDelay().orElse(null));
            return directives;
        } catch (RuntimeException e) {
            log.warn("Failed to parse robots.txt at {}; proceeding permissively", robotsUrl, e);
            return RobotsDirectives.absent();
        }
    }

    /**
     * @return true when the directives allow fetching {@code url}; absent directives and evaluation
     *         errors allow
     */
    public boolean canFetch(RobotsDirectives directives, String url) {
        if (directives == null || directives.isAbsent()) return true;
        try {
            return directives.rules().isAllowed(url);
        } catch (RuntimeException e) {
            log.warn("robots.txt evaluation failed for {}; allowing", url, e);
            return true;
        }
    }

    /**
     * @return the robots-declared crawl delay for the configured agent, if any
     */
    public Optional<Duration> crawlDelay(RobotsDirectives directives) {
        if (directives == null) return Optional.empty();
        try {
            return directives.crawlDelay();
        } catch (RuntimeException e) {
            log.warn("Could not read crawl-delay from {}", directives.getRobotsUrl(), e);
            return Optional.empty();
        }
    }

    /**
     * Effective politeness delay: robots crawl-delay when declared, else the configured default.
     */
    public Duration effectiveDelay(RobotsDirectives directives) {
        return crawlDelay(directives).orElse(properties.getDelay());
    }
}

package org.smileyface.sitecrawler.robots;

import crawlercommons.robots.BaseRobotRules;

import java.time.Duration;
import java.util.Optional;

/**
 * Parsed robots.txt rules for the crawl's domain, or the explicit absent value meaning
 * "no usable robots.txt, allow everything".
 */
public final class RobotsDirectives {

    private static final RobotsDirectives ABSENT = new RobotsDirectives(null, null, null);

    private final String robotsUrl;
    private final BaseRobotRules rules;
    private final BaseRobotRules wildcardRules;

    private RobotsDirectives(String robotsUrl, BaseRobotRules rules, BaseRobotRules wildcardRules) {
        this.robotsUrl = robotsUrl;
        this.rules = rules;
        this.wildcardRules = wildcardRules;
    }

    public static RobotsDirectives absent() {
        return ABSENT;
    }

    public static RobotsDirectives of(String robotsUrl, BaseRobotRules rules) {
        return of(robotsUrl, rules, null);
    }

    /**
     * @param rules         rules parsed for the crawler's agent
     * @param wildcardRules rules of the {@code *} group, consulted only for the crawl delay; may be null
     */
    public static RobotsDirectives of(String robotsUrl, BaseRobotRules rules, BaseRobotRules wildcardRules) {
        if (rules == null) {
            throw new IllegalArgumentException("rules must not be null");
        }
        return new RobotsDirectives(robotsUrl, rules, wildcardRules);
    }

    public boolean isAbsent() {
        return rules == null;
    }

    public String getRobotsUrl() {
        return robotsUrl;
    }

    /**
     * @return the parsed rules; only valid when not absent
     */
    BaseRobotRules rules() {
        return rules;
    }

    /**
     * Crawl delay of the agent's own group; when that group declares none, the {@code *} group's.
     */
    public Optional<Duration> crawlDelay() {
        if (rules == null) return Optional.empty();
        return delayOf(rules).or(() -> wildcardRules == null ? Optional.empty() : delayOf(wildcardRules));
    }

    private static Optional<Duration> delayOf(BaseRobotRules r) {
        long ms = r.getCrawlDelay();
        if (ms == BaseRobotRules.UNSET_CRAWL_DELAY || ms <= 0) return Optional.empty();
        return Optional.of(Duration.ofMillis(ms));
    }

    @Override
    public String toString() {
        return isAbsent() ? "RobotsDirectives{absent}" : "RobotsDirectives{url='" + robotsUrl + "', rules=" + rules + '}';
    }
}

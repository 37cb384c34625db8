package org.smileyface.sitecrawler.service;

/**
 * Lifecycle state of a {@link SiteCrawler}.
 */
public enum CrawlState {
    NEW,
    RUNNING,
    STOPPED,
    COMPLETED,
    ERROR
}

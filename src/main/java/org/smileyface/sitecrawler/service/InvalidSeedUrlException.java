package org.smileyface.sitecrawler.service;

/**
 * The configured seed is missing, not http(s), or has no host. Raised before any request is made.
 */
public class InvalidSeedUrlException extends IllegalArgumentException {

    private final String seedUrl;

    public InvalidSeedUrlException(String seedUrl) {
        super("Invalid seed URL (http/https with a host required): " + seedUrl);
        this.seedUrl = seedUrl;
    }

    public String getSeedUrl() {
        return seedUrl;
    }
}

package org.smileyface.sitecrawler.crawler;

import crawlercommons.domains.EffectiveTldFinder;
import org.smileyface.sitecrawler.util.CrawlerUtils;

import java.util.regex.Pattern;

/**
 * Decides whether a candidate URL belongs to the crawl's domain.
 *
 * <p>Without subdomains only the seed host matches. With subdomains, a host matches when it equals
 * the seed's registrable domain (public-suffix aware) or is a dot-separated subdomain of it, so
 * {@code notexample.com} never matches a seed on {@code example.com}.</p>
 */
public final class DomainScope {

    private static final Pattern IPV4 = Pattern.compile("^\\d{1,3}(\\.\\d{1,3}){3}$");

    private final String seedHost;
    private final String registrableDomain;
    private final boolean includeSubdomains;

    public DomainScope(String seedUrl, boolean includeSubdomains) {
        String host = CrawlerUtils.hostOf(seedUrl);
        if (host == null) {
            throw new IllegalArgumentException("seed URL has no host: " + seedUrl);
        }
        this.seedHost = host;
        this.includeSubdomains = includeSubdomains;
        this.registrableDomain = includeSubdomains ? registrableDomainOf(host) : host;
    }

    public boolean isInScope(String url) {
        String host = CrawlerUtils.hostOf(url);
        if (host == null) return false;
        if (host.equals(seedHost)) return true;
        if (!includeSubdomains) return false;
        return host.equals(registrableDomain) || host.endsWith("." + registrableDomain);
    }

    public String getRegistrableDomain() {
        return registrableDomain;
    }

    static String registrableDomainOf(String host) {
        // IP literals and single-label hosts (localhost) have no public suffix
        if (host.startsWith("[") || IPV4.matcher(host).matches() || host.indexOf('.') < 0) {
            return host;
        }
        String assigned = EffectiveTldFinder.getAssignedDomain(host, true, false);
        return (assigned == null || assigned.isBlank()) ? host : assigned.toLowerCase();
    }

    @Override
    public String toString() {
        return "DomainScope{" +
                "seedHost='" + seedHost + '\'' +
                ", registrableDomain='" + registrableDomain + '\'' +
                ", includeSubdomains=" + includeSubdomains +
                '}';
    }
}

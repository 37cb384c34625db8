package org.smileyface.sitecrawler.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.smileyface.sitecrawler.crawler.CrawlerProperties;
import org.smileyface.sitecrawler.extractor.ContentExtractor;
import org.smileyface.sitecrawler.fetch.PageFetcher;
import org.smileyface.sitecrawler.robots.RobotsPolicy;
import org.smileyface.sitecrawler.service.SiteCrawler;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the crawl components from the bound {@link CrawlerProperties}. Every component receives the
 * same properties instance through its constructor.
 */
@Configuration
public class BeanConfig {

    @Bean
    public PageFetcher pageFetcher(CrawlerProperties properties) {
        return new PageFetcher(properties);
    }

    @Bean
    public RobotsPolicy robotsPolicy(CrawlerProperties properties, PageFetcher pageFetcher) {
        return new RobotsPolicy(properties, pageFetcher);
    }

    @Bean
    public ContentExtractor contentExtractor() {
        return new ContentExtractor();
    }

    /**
     * The crawler is stopped and drained when the context closes (SIGINT/SIGTERM included).
     */
    @Bean(destroyMethod = "shutdown")
    public SiteCrawler siteCrawler(CrawlerProperties properties,
                                   PageFetcher pageFetcher,
                                   RobotsPolicy robotsPolicy,
                                   ContentExtractor contentExtractor,
                                   ObjectProvider<ObjectMapper> objectMapper) {
        return new SiteCrawler(properties, pageFetcher, robotsPolicy, contentExtractor,
                objectMapper.getIfAvailable(ObjectMapper::new));
    }
}

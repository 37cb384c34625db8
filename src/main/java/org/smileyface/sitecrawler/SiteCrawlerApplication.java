package org.smileyface.sitecrawler;

import org.smileyface.sitecrawler.crawler.CrawlerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(CrawlerProperties.class)
public class SiteCrawlerApplication {

	public static void main(String[] args) {
		SpringApplication.run(SiteCrawlerApplication.class, args);
	}
}

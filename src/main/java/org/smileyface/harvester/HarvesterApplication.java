package org.smileyface.harvester;

import org.smileyface.harvester.crawler.CrawlerProperties;
import org.smileyface.harvester.pipeline.PipelineProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({CrawlerProperties.class, PipelineProperties.class})
public class HarvesterApplication {

	public static void main(String[] args) {
		System.exit(SpringApplication.exit(SpringApplication.run(HarvesterApplication.class, args)));
	}
}

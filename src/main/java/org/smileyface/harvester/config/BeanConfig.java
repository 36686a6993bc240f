package org.smileyface.harvester.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.harvester.crawler.CrawlerProperties;
import org.smileyface.harvester.crawler.TextFetcher;
import org.smileyface.harvester.render.JsoupPageRenderer;
import org.smileyface.harvester.render.PageRendererFactory;
import org.smileyface.harvester.render.RetryingPageRenderer;
import org.smileyface.harvester.store.DocumentStore;
import org.smileyface.harvester.store.InMemoryDocumentStore;
import org.smileyface.harvester.store.MongoDocumentStore;
import org.smileyface.harvester.store.StoreUnavailableException;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;

/**
 * Wires the document store, the clock, and the page fetching collaborators.
 */
@Configuration
public class BeanConfig {

    private static final Logger log = LogManager.getLogger();

    @Value("${harvester.store.type:in-memory}")
    private String storeType;

    /**
     * Selects the DocumentStore implementation based on the configuration property
     * {@code harvester.store.type}. Supported values:
     * - "in-memory" (default): uses {@link InMemoryDocumentStore}, for single-process runs
     * - "mongo": uses {@link MongoDocumentStore}; required for distributed runs
     */
    @Bean
    public DocumentStore documentStore(ObjectProvider<MongoTemplate> mongoProvider) {
        String kind = storeType == null ? "in-memory" : storeType.trim().toLowerCase();
        if ("mongo".equals(kind)) {
            MongoTemplate template = mongoProvider.getIfAvailable();
            if (template == null) {
                throw new StoreUnavailableException("harvester.store.type=mongo but MongoDB is not configured", null);
            }
            log.info("Using MongoDB document store (database={})", template.getDb().getName());
            return new MongoDocumentStore(template);
        }
        if (!"in-memory".equals(kind)) {
            log.warn("Unknown harvester.store.type '{}', using in-memory store", storeType);
        }
        return new InMemoryDocumentStore();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TextFetcher textFetcher(CrawlerProperties properties) {
        return TextFetcher.jsoup(properties.getUserAgent(), properties.getRequestTimeoutMs());
    }

    /**
     * One jsoup session per worker, retried with the crawler's retry budget.
     */
    @Bean
    public PageRendererFactory pageRendererFactory(CrawlerProperties properties) {
        return () -> new RetryingPageRenderer(
                new JsoupPageRenderer(properties.getUserAgent(), properties.getRequestTimeoutMs()),
                properties.getMaxRetries(), properties.getRetryBackoffMs());
    }
}

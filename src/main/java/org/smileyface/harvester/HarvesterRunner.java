package org.smileyface.harvester;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.harvester.crawler.CrawlerProperties;
import org.smileyface.harvester.pipeline.PipelineRequest;
import org.smileyface.harvester.pipeline.PipelineService;
import org.smileyface.harvester.pipeline.StageReport;
import org.smileyface.harvester.service.CrawlMode;
import org.smileyface.harvester.service.CrawlReport;
import org.smileyface.harvester.service.CrawlerService;
import org.smileyface.harvester.store.DocumentStore;
import org.smileyface.harvester.store.StoreException;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Command-line entry: runs one crawl or pipeline job and reports the outcome as the process exit code.
 */
@Component
@ConditionalOnProperty(name = "harvester.runner.enabled", havingValue = "true", matchIfMissing = true)
public class HarvesterRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LogManager.getLogger();

    public static final int EXIT_OK = 0;
    public static final int EXIT_INVALID_ARGUMENTS = 1;
    public static final int EXIT_STORE_UNAVAILABLE = 2;
    public static final int EXIT_FAILED = 3;

    private final DocumentStore store;
    private final CrawlerProperties crawlerProperties;
    private final CrawlerService crawlerService;
    private final PipelineService pipelineService;

    private volatile int exitCode = EXIT_OK;

    public HarvesterRunner(DocumentStore store, CrawlerProperties crawlerProperties, CrawlerService crawlerService,
                           PipelineService pipelineService) {
        this.store = store;
        this.crawlerProperties = crawlerProperties;
        this.crawlerService = crawlerService;
        this.pipelineService = pipelineService;
    }

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(args.getSourceArgs());
    }

    int execute(String... args) {
        RunOptions options;
        try {
            options = RunOptions.parse(args);
        } catch (IllegalArgumentException e) {
            log.error("Invalid arguments: {}", e.getMessage());
            return EXIT_INVALID_ARGUMENTS;
        }
        log.info("Starting {}", options);

        try {
            store.ping();
        } catch (StoreException e) {
            log.error("Document store unavailable: {}", e.getMessage());
            return EXIT_STORE_UNAVAILABLE;
        }

        try {
            if (RunOptions.JOB_PIPELINE.equals(options.getJob())) {
                runPipeline(options);
            } else {
                runCrawl(options);
            }
            return EXIT_OK;
        } catch (IllegalArgumentException e) {
            log.error("Invalid arguments: {}", e.getMessage());
            return EXIT_INVALID_ARGUMENTS;
        } catch (RuntimeException e) {
            log.error("Run failed: {}", e.getMessage(), e);
            return EXIT_FAILED;
        }
    }

    private void runCrawl(RunOptions options) {
        if (!options.getUrls().isEmpty()) crawlerProperties.setStartUrls(options.getUrls());
        if (options.getMaxDepth() != null) crawlerProperties.setMaxDepth(options.getMaxDepth());
        if (options.getLimit() != null) crawlerProperties.setMaxPages(options.getLimit());
        if (options.getInstanceId() != null) crawlerProperties.setInstanceId(options.getInstanceId());
        crawlerProperties.setWorkerCount(options.workers(crawlerProperties.getWorkerCount()));

        CrawlReport report = crawlerService.crawl(options.getMode(), options.isReset());
        log.info("Crawl report: mode={}, counters={}, siteGraphs={}, durationMs={}",
                report.mode(), report.counters(), report.siteGraphs().size(), report.durationMs());
    }

    private void runPipeline(RunOptions options) {
        PipelineRequest request = new PipelineRequest(
                options.getStage(),
                options.getLimit() != null ? options.getLimit() : 0,
                options.getMode() == CrawlMode.SINGLE ? 1 : (options.getThreads() != null ? options.getThreads() : 0),
                options.isResume(),
                options.getMode() == CrawlMode.DISTRIBUTED,
                options.getInstanceId());
        List<StageReport> reports = pipelineService.run(request);
        for (StageReport r : reports) {
            log.info("Stage {} {}: selected={}, counters={}, durationMs={}",
                    r.index(), r.name(), r.selected(), r.counters(), r.durationMs());
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}

package org.smileyface.harvester.pipeline;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.harvester.lease.InstanceHeartbeat;
import org.smileyface.harvester.lease.LeaseKeeper;
import org.smileyface.harvester.lease.LeaseManager;
import org.smileyface.harvester.merge.MergePolicy;
import org.smileyface.harvester.merge.RecordMerger;
import org.smileyface.harvester.processor.WorkerPool;
import org.smileyface.harvester.render.PageRendererFactory;
import org.smileyface.harvester.store.DocumentStore;
import org.smileyface.harvester.store.StoreCollections;
import org.smileyface.harvester.util.CrawlerUtils;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * The directory pipeline: sources list locations, locations list organizations, organizations are enriched and
 * list their members, and members are enriched as persons. Each stage picks up whatever entities have not yet
 * reached its exit stage, so an interrupted run continues where it stopped.
 */
@Service
public class PipelineService {

    private static final Logger log = LogManager.getLogger();

    private static final String JOB = "pipeline";

    private final DocumentStore store;
    private final PipelineProperties properties;
    private final PageRendererFactory rendererFactory;
    private final Clock clock;
    private final EntityRepository repository;
    private final List<StageDefinition> stages;

    public PipelineService(DocumentStore store, PipelineProperties properties, PageRendererFactory rendererFactory,
                           Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.rendererFactory = Objects.requireNonNull(rendererFactory, "rendererFactory");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.repository = new EntityRepository(store, new RecordMerger(), MergePolicy.defaults(), clock);
        this.stages = buildStages();
    }

    private List<StageDefinition> buildStages() {
        Duration wait = Duration.ofMillis(properties.getWaitTimeoutMs());
        String waitFor = properties.getWaitSelector();
        List<StageDefinition> out = new ArrayList<>();
        out.add(new StageDefinition(0, "discover-locations", EntityType.SOURCE, EntityStage.SCRAPED,
                new ListingDriver(EntityType.SOURCE, properties.getSources(), waitFor, wait, properties.getMaxListingPages())));
        out.add(new StageDefinition(1, "collect-organizations", EntityType.LOCATION, EntityStage.SCRAPED,
                new ListingDriver(EntityType.LOCATION, properties.getLocations(), waitFor, wait, properties.getMaxListingPages())));
        out.add(new StageDefinition(2, "enrich-organizations", EntityType.ORGANIZATION, EntityStage.ENRICHED,
                new DetailDriver(EntityType.ORGANIZATION, properties.getOrganizations(), waitFor, wait)));
        out.add(new StageDefinition(3, "collect-members", EntityType.ORGANIZATION, EntityStage.MEMBERS_COLLECTED,
                new MemberCollectionDriver(properties.getMembers(), waitFor, wait,
                        properties.getLoadMoreSelector(), properties.getMaxLoadMoreClicks())));
        out.add(new StageDefinition(4, "enrich-persons", EntityType.PERSON, EntityStage.PROCESSED,
                new PersonProfileDriver(properties.getPersons(), waitFor, wait, properties.getBackReferenceFields())));
        return List.copyOf(out);
    }

    public List<StageDefinition> stages() {
        return stages;
    }

    public EntityRepository getRepository() {
        return repository;
    }

    /**
     * Inserts the given listing URLs as sources unless already present.
     *
     * @return number of new sources
     */
    public int seed(List<String> urls) {
        int added = 0;
        for (String raw : urls) {
            String url = CrawlerUtils.normalizeUrl(raw);
            if (url == null) {
                log.warn("Ignoring invalid seed URL: {}", raw);
                continue;
            }
            if (repository.insertIfAbsent(EntityType.SOURCE, url, Map.of("url", url))) added++;
        }
        log.info("Seeded {} new sources ({} given)", added, urls.size());
        return added;
    }

    /**
     * Runs one stage or all of them in order.
     *
     * @throws IllegalArgumentException when the stage index does not exist
     */
    public List<StageReport> run(PipelineRequest request) {
        List<StageDefinition> selected = select(request.stage());
        StoreCollections.ensureIndexes(store);
        if (!request.resume()) {
            seed(properties.getSeedUrls());
        }
        int limit = request.limit() > 0 ? request.limit() : properties.getBatchLimit();
        int workers = request.workers() > 0 ? request.workers() : properties.getWorkerCount();
        StageRunner runner = new StageRunner(repository, rendererFactory, new WorkerPool.Settings(
                Duration.ofSeconds(1), Duration.ofMillis(500), Duration.ofMillis(properties.getDelayBetweenRequestsMs())),
                properties.getMaxRetries(), properties.getMaxRedeliveries(), clock);

        if (!(request.leased() || properties.isUseLeases())) {
            return runStages(selected, runner, limit, workers, null);
        }
        String instanceId = request.instanceId() != null ? request.instanceId()
                : "harvester-" + UUID.randomUUID().toString().substring(0, 8);
        LeaseManager leases = new LeaseManager(store, instanceId, LeaseManager.DEFAULT_LEASE, clock);
        InstanceHeartbeat heartbeat = new InstanceHeartbeat(store, instanceId, JOB, clock);
        try (LeaseKeeper keeper = new LeaseKeeper(leases, heartbeat, Duration.ofSeconds(30), List.of())) {
            keeper.start();
            return runStages(selected, runner, limit, workers, leases);
        }
    }

    private List<StageReport> runStages(List<StageDefinition> selected, StageRunner runner, int limit, int workers,
                                        LeaseManager leases) {
        List<StageReport> reports = new ArrayList<>();
        for (StageDefinition stage : selected) {
            if (Thread.currentThread().isInterrupted()) {
                log.info("Pipeline interrupted before stage {}", stage.name());
                break;
            }
            reports.add(runner.run(stage, limit, workers, leases));
        }
        for (EntityType type : EntityType.values()) {
            log.info("{}: {} (failed={})", type, repository.countByStage(type), repository.countFailed(type));
        }
        return reports;
    }

    private List<StageDefinition> select(Integer index) {
        if (index == null) return stages;
        if (index < 0 || index >= stages.size()) {
            throw new IllegalArgumentException("Unknown stage " + index + " (0-" + (stages.size() - 1) + ")");
        }
        return List.of(stages.get(index));
    }
}

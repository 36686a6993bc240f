package org.smileyface.harvester.pipeline;

import org.smileyface.harvester.extractor.ExtractorRules;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration of the directory pipeline: seeds, bounds, and the selector rules of each stage.
 */
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    /** Source listing URLs inserted as SOURCE entities when a run does not resume. */
    private List<String> seedUrls = new ArrayList<>();

    /** Failed attempts after which an entity is no longer selected. */
    private int maxRetries = 3;

    /** Entities taken per stage run; 0 means all pending ones. */
    private int batchLimit = 0;

    private int workerCount = 2;

    /** Lease each entity per stage, for runs where several instances share the store. */
    private boolean useLeases = false;

    private int maxRedeliveries = 3;

    private int maxListingPages = 20;

    private String loadMoreSelector;

    private int maxLoadMoreClicks = 10;

    /** Selector to wait for after each page load; none when blank. */
    private String waitSelector;

    private long waitTimeoutMs = 10_000;

    private long delayBetweenRequestsMs = 500;

    /** Profile fields copied onto the organization's member entry. */
    private List<String> backReferenceFields = new ArrayList<>(List.of("name", "title"));

    private ExtractorRules sources = new ExtractorRules();
    private ExtractorRules locations = new ExtractorRules();
    private ExtractorRules organizations = new ExtractorRules();
    private ExtractorRules members = new ExtractorRules();
    private ExtractorRules persons = new ExtractorRules();

    public List<String> getSeedUrls() { return seedUrls; }
    public void setSeedUrls(List<String> seedUrls) { this.seedUrls = seedUrls != null ? seedUrls : new ArrayList<>(); }

    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

    public int getBatchLimit() { return batchLimit; }
    public void setBatchLimit(int batchLimit) { this.batchLimit = batchLimit; }

    public int getWorkerCount() { return workerCount; }
    public void setWorkerCount(int workerCount) { this.workerCount = workerCount; }

    public boolean isUseLeases() { return useLeases; }
    public void setUseLeases(boolean useLeases) { this.useLeases = useLeases; }

    public int getMaxRedeliveries() { return maxRedeliveries; }
    public void setMaxRedeliveries(int maxRedeliveries) { this.maxRedeliveries = maxRedeliveries; }

    public int getMaxListingPages() { return maxListingPages; }
    public void setMaxListingPages(int maxListingPages) { this.maxListingPages = maxListingPages; }

    public String getLoadMoreSelector() { return loadMoreSelector; }
    public void setLoadMoreSelector(String loadMoreSelector) { this.loadMoreSelector = loadMoreSelector; }

    public int getMaxLoadMoreClicks() { return maxLoadMoreClicks; }
    public void setMaxLoadMoreClicks(int maxLoadMoreClicks) { this.maxLoadMoreClicks = maxLoadMoreClicks; }

    public String getWaitSelector() { return waitSelector; }
    public void setWaitSelector(String waitSelector) { this.waitSelector = waitSelector; }

    public long getWaitTimeoutMs() { return waitTimeoutMs; }
    public void setWaitTimeoutMs(long waitTimeoutMs) { this.waitTimeoutMs = waitTimeoutMs; }

    public long getDelayBetweenRequestsMs() { return delayBetweenRequestsMs; }
    public void setDelayBetweenRequestsMs(long delayBetweenRequestsMs) { this.delayBetweenRequestsMs = delayBetweenRequestsMs; }

    public List<String> getBackReferenceFields() { return backReferenceFields; }
    public void setBackReferenceFields(List<String> backReferenceFields) { this.backReferenceFields = backReferenceFields != null ? backReferenceFields : new ArrayList<>(); }

    public ExtractorRules getSources() { return sources; }
    public void setSources(ExtractorRules sources) { this.sources = sources != null ? sources : new ExtractorRules(); }

    public ExtractorRules getLocations() { return locations; }
    public void setLocations(ExtractorRules locations) { this.locations = locations != null ? locations : new ExtractorRules(); }

    public ExtractorRules getOrganizations() { return organizations; }
    public void setOrganizations(ExtractorRules organizations) { this.organizations = organizations != null ? organizations : new ExtractorRules(); }

    public ExtractorRules getMembers() { return members; }
    public void setMembers(ExtractorRules members) { this.members = members != null ? members : new ExtractorRules(); }

    public ExtractorRules getPersons() { return persons; }
    public void setPersons(ExtractorRules persons) { this.persons = persons != null ? persons : new ExtractorRules(); }
}

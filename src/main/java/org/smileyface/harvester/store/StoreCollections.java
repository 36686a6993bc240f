package org.smileyface.harvester.store;

/**
 * Collection names and the unique keys each one is indexed on.
 * {@link #WORK_QUEUE} and {@link #LOCKS} hold ephemeral coordination state and may be truncated between runs.
 */
public final class StoreCollections {

    public static final String WORK_QUEUE = "work_queue";
    public static final String LOCKS = "locks";
    public static final String PAGES = "pages";
    public static final String ASSETS = "page_assets";
    public static final String SITE_MAPS = "site_maps";
    public static final String CRAWL_JOBS = "crawl_jobs";

    public static final String SOURCES = "sources";
    public static final String LOCATIONS = "locations";
    public static final String ORGANIZATIONS = "organizations";
    public static final String PERSONS = "persons";

    private StoreCollections() {
        // No instantiation
    }

    public static void ensureIndexes(DocumentStore store) {
        store.ensureUniqueIndex(WORK_QUEUE, "key");
        store.ensureUniqueIndex(LOCKS, "resourceKey");
        store.ensureUniqueIndex(PAGES, "url");
        store.ensureUniqueIndex(ASSETS, "url");
        store.ensureUniqueIndex(SITE_MAPS, "domain");
        store.ensureUniqueIndex(CRAWL_JOBS, "instanceId");
        for (String entities : new String[]{SOURCES, LOCATIONS, ORGANIZATIONS, PERSONS}) {
            store.ensureUniqueIndex(entities, "key");
        }
    }

    /**
     * Clears the ephemeral coordination collections.
     */
    public static void truncateCoordination(DocumentStore store) {
        store.drop(WORK_QUEUE);
        store.drop(LOCKS);
        store.ensureUniqueIndex(WORK_QUEUE, "key");
        store.ensureUniqueIndex(LOCKS, "resourceKey");
    }
}

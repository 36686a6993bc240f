package org.smileyface.harvester.pipeline;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.smileyface.harvester.merge.MergePolicy;
import org.smileyface.harvester.merge.RecordMerger;
import org.smileyface.harvester.store.InMemoryDocumentStore;
import org.smileyface.harvester.store.StoreCollections;
import org.smileyface.harvester.store.UpsertResult;
import org.smileyface.harvester.testutil.MutableClock;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EntityRepositoryTest {

    private static final String ORG = "https://dir.example.com/orgs/heart-clinic";

    private MutableClock clock;
    private EntityRepository repository;

    @BeforeEach
    void setUp() {
        InMemoryDocumentStore store = new InMemoryDocumentStore();
        StoreCollections.ensureIndexes(store);
        clock = new MutableClock();
        repository = new EntityRepository(store, new RecordMerger(), MergePolicy.defaults(), clock);
    }

    @Test
    void insertIfAbsent_createsAtInitialStageOnce() {
        assertThat(repository.insertIfAbsent(EntityType.ORGANIZATION, ORG, Map.of("name", "Heart Clinic"))).isTrue();
        assertThat(repository.insertIfAbsent(EntityType.ORGANIZATION, ORG, Map.of("name", "Other"))).isFalse();

        EntityRecord record = repository.find(EntityType.ORGANIZATION, ORG).orElseThrow();
        assertThat(record.getStage()).isEqualTo(EntityStage.PENDING);
        assertThat(record.getPayload()).containsEntry("name", "Heart Clinic");
        assertThat(record.getRetryCount()).isZero();
        assertThat(record.isFailed()).isFalse();
        assertThat(record.getVersion()).isZero();
        assertThat(record.getCreatedAt()).isEqualTo(clock.millis());
    }

    @Test
    void mergeInto_addsValuesWithoutTouchingStage() {
        repository.insertIfAbsent(EntityType.ORGANIZATION, ORG, Map.of("name", "Heart Clinic"));
        repository.advance(EntityType.ORGANIZATION, ORG, EntityStage.ENRICHED, Map.of());

        assertThat(repository.mergeInto(EntityType.ORGANIZATION, ORG, Map.of("city", "Los Angeles")))
                .isEqualTo(UpsertResult.MODIFIED);
        assertThat(repository.mergeInto(EntityType.ORGANIZATION, ORG, Map.of("city", "Los Angeles", "name", "")))
                .isEqualTo(UpsertResult.UNCHANGED);
        assertThat(repository.mergeInto(EntityType.ORGANIZATION, ORG + "/missing", Map.of("city", "Austin")))
                .isEqualTo(UpsertResult.UNCHANGED);

        EntityRecord record = repository.find(EntityType.ORGANIZATION, ORG).orElseThrow();
        assertThat(record.getStage()).isEqualTo(EntityStage.ENRICHED);
        assertThat(record.getPayload()).containsEntry("name", "Heart Clinic").containsEntry("city", "Los Angeles");
    }

    @Test
    void advance_movesForwardAndNeverBack() {
        repository.insertIfAbsent(EntityType.ORGANIZATION, ORG, Map.of());
        repository.recordFailure(EntityType.ORGANIZATION, ORG, "timeout", 3);

        assertThat(repository.advance(EntityType.ORGANIZATION, ORG, EntityStage.MEMBERS_COLLECTED, Map.of("memberCount", 2)))
                .isEqualTo(UpsertResult.MODIFIED);
        EntityRecord moved = repository.find(EntityType.ORGANIZATION, ORG).orElseThrow();
        assertThat(moved.getStage()).isEqualTo(EntityStage.MEMBERS_COLLECTED);
        assertThat(moved.getLastError()).isNull();
        assertThat(moved.getVersion()).isEqualTo(1);

        assertThat(repository.advance(EntityType.ORGANIZATION, ORG, EntityStage.ENRICHED, Map.of("phone", "555-0100")))
                .isEqualTo(UpsertResult.MODIFIED);
        assertThat(repository.advance(EntityType.ORGANIZATION, ORG, EntityStage.ENRICHED, Map.of("phone", "555-0100")))
                .isEqualTo(UpsertResult.UNCHANGED);

        EntityRecord after = repository.find(EntityType.ORGANIZATION, ORG).orElseThrow();
        assertThat(after.getStage()).as("stage never regresses").isEqualTo(EntityStage.MEMBERS_COLLECTED);
        assertThat(after.getPayload()).containsEntry("phone", "555-0100");
        assertThat(((Number) after.getPayload().get("memberCount")).intValue()).isEqualTo(2);
    }

    @Test
    void advance_rejectsStagesOutsideTheLifecycle() {
        repository.insertIfAbsent(EntityType.PERSON, "https://dir.example.com/people/ann", Map.of());

        assertThatThrownBy(() -> repository.advance(EntityType.PERSON, "https://dir.example.com/people/ann",
                EntityStage.ENRICHED, Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void advance_ofMissingRecordIsUnchanged() {
        assertThat(repository.advance(EntityType.ORGANIZATION, "https://nowhere.example.com/", EntityStage.ENRICHED, Map.of("a", 1)))
                .isEqualTo(UpsertResult.UNCHANGED);
    }

    @Test
    void selectForStage_takesOldestRecordsNotYetAtTheExit() {
        for (int i = 0; i < 4; i++) {
            repository.insertIfAbsent(EntityType.ORGANIZATION, ORG + "/" + i, Map.of());
            clock.advance(Duration.ofSeconds(1));
        }
        repository.advance(EntityType.ORGANIZATION, ORG + "/0", EntityStage.MEMBERS_COLLECTED, Map.of());
        repository.advance(EntityType.ORGANIZATION, ORG + "/1", EntityStage.ENRICHED, Map.of());

        assertThat(repository.selectForStage(EntityType.ORGANIZATION, EntityStage.ENRICHED, 3, 0))
                .extracting(EntityRecord::getKey).containsExactly(ORG + "/2", ORG + "/3");
        assertThat(repository.selectForStage(EntityType.ORGANIZATION, EntityStage.MEMBERS_COLLECTED, 3, 0))
                .extracting(EntityRecord::getKey).containsExactly(ORG + "/1", ORG + "/2", ORG + "/3");
        assertThat(repository.selectForStage(EntityType.ORGANIZATION, EntityStage.MEMBERS_COLLECTED, 3, 2))
                .extracting(EntityRecord::getKey).containsExactly(ORG + "/1", ORG + "/2");
    }

    @Test
    void recordFailure_stopsSelectionAtTheRetryBound() {
        repository.insertIfAbsent(EntityType.LOCATION, "https://dir.example.com/states/ny", Map.of());

        assertThat(repository.recordFailure(EntityType.LOCATION, "https://dir.example.com/states/ny", "HTTP 404", 2)).isEqualTo(1);
        assertThat(repository.selectForStage(EntityType.LOCATION, EntityStage.SCRAPED, 2, 0)).hasSize(1);
        assertThat(repository.countFailed(EntityType.LOCATION)).isZero();

        assertThat(repository.recordFailure(EntityType.LOCATION, "https://dir.example.com/states/ny", "HTTP 404", 2)).isEqualTo(2);
        assertThat(repository.selectForStage(EntityType.LOCATION, EntityStage.SCRAPED, 2, 0)).isEmpty();
        assertThat(repository.countFailed(EntityType.LOCATION)).isEqualTo(1);

        EntityRecord record = repository.find(EntityType.LOCATION, "https://dir.example.com/states/ny").orElseThrow();
        assertThat(record.getStage()).isEqualTo(EntityStage.PENDING);
        assertThat(record.getLastError()).isEqualTo("HTTP 404");

        assertThat(repository.recordFailure(EntityType.LOCATION, "https://dir.example.com/states/zz", "x", 2)).isEqualTo(-1);
    }

    @Test
    void countByStage_coversTheWholeLifecycle() {
        repository.insertIfAbsent(EntityType.PERSON, "https://dir.example.com/people/ann", Map.of());
        repository.insertIfAbsent(EntityType.PERSON, "https://dir.example.com/people/bob", Map.of());
        repository.advance(EntityType.PERSON, "https://dir.example.com/people/bob", EntityStage.PROCESSED, Map.of());

        assertThat(repository.countByStage(EntityType.PERSON))
                .hasSize(2)
                .containsEntry(EntityStage.PENDING, 1L)
                .containsEntry(EntityStage.PROCESSED, 1L);
        assertThat(EntityType.PERSON.stagesBefore(EntityStage.PROCESSED)).isEqualTo(List.of(EntityStage.PENDING));
    }
}

package org.smileyface.harvester.pipeline;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.smileyface.harvester.extractor.ExtractorRules;
import org.smileyface.harvester.processor.WorkerStats;
import org.smileyface.harvester.store.Documents;
import org.smileyface.harvester.store.InMemoryDocumentStore;
import org.smileyface.harvester.store.StoreCollections;
import org.smileyface.harvester.store.StoreFilter;
import org.smileyface.harvester.testutil.MutableClock;
import org.smileyface.harvester.testutil.StaticPageRenderer;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs the five stages over a small static directory site:
 * one source listing three states (two pages), one state listing an organization, the organization listing
 * two members (one behind a "load more" link), and two person profiles. One state page is missing.
 */
class PipelineServiceTest {

    private static final String BASE = "https://dir.example.com";
    private static final String SOURCE = BASE + "/states";
    private static final String CA = BASE + "/states/ca";
    private static final String NY = BASE + "/states/ny";
    private static final String TX = BASE + "/states/tx";
    private static final String ORG = BASE + "/orgs/heart-clinic";
    private static final String ANN = BASE + "/people/ann";
    private static final String BOB = BASE + "/people/bob";
    private static final String OTHER = BASE + "/orgs/other-practice";
    private static final String CITY = BASE + "/orgs/city-hospital";

    private InMemoryDocumentStore store;
    private List<String> opened;
    private PipelineService service;

    static Map<String, String> site() {
        Map<String, String> pages = new HashMap<>();
        pages.put(SOURCE, html("<h1>States</h1>"
                + "<a class='location' href='/states/ca'>California</a>"
                + "<a class='location' href='/states/ny'>New York</a>"
                + "<a class='next' href='/states?page=2'>Next</a>"));
        pages.put(SOURCE + "?page=2", html("<a class='location' href='/states/tx'>Texas</a>"
                + "<a class='location' href='/states/ca'>California</a>"));
        pages.put(CA, html("<h1>California</h1>"
                + "<div class='org-card'><a href='/orgs/heart-clinic'>Heart Clinic</a><span class='city'>Los Angeles</span></div>"));
        pages.put(TX, html("<h1>Texas</h1><p>No organizations yet.</p>"));
        pages.put(ORG, html("<h1>Heart Clinic</h1><span class='phone'>555-0100</span>"
                + "<ul><li class='service'>Cardiology</li><li class='service'>Imaging</li></ul>"
                + "<ul class='members'><li class='member'><a href='/people/ann'>Ann Lee</a></li></ul>"
                + "<a class='load-more' href='/orgs/heart-clinic?members=2'>Load more</a>"));
        pages.put(ORG + "?members=2", html("<ul class='members'>"
                + "<li class='member'><a href='/people/ann'>Ann Lee</a></li>"
                + "<li class='member'><a href='/people/bob'>Bob Stone</a></li></ul>"));
        pages.put(ANN, html("<h1>Dr. Ann Lee</h1><span class='title'>Cardiologist</span>"
                + "<table><tr class='qualification'><td class='degree'>MD</td><td class='institute'>State University</td></tr></table>"));
        pages.put(BOB, html("<h1>Bob Stone</h1><span class='title'>Nurse</span>"));
        return pages;
    }

    static String html(String body) {
        return "<html><head><title>t</title></head><body>" + body + "</body></html>";
    }

    static PipelineProperties properties() {
        PipelineProperties props = new PipelineProperties();
        props.setSeedUrls(List.of(SOURCE));
        props.setMaxRetries(3);
        props.setWorkerCount(2);
        props.setDelayBetweenRequestsMs(0);
        props.setWaitTimeoutMs(100);
        props.setLoadMoreSelector("a.load-more");

        ExtractorRules sources = new ExtractorRules();
        sources.setFields(new LinkedHashMap<>(Map.of("heading", "h1")));
        sources.setEntities(List.of(new ExtractorRules.EntityRule("location", "a.location", null, null)));
        sources.setNextPage("a.next");
        props.setSources(sources);

        ExtractorRules locations = new ExtractorRules();
        ExtractorRules.EntityRule orgCard = new ExtractorRules.EntityRule("organization", "div.org-card", null, null);
        orgCard.setFields(new LinkedHashMap<>(Map.of("city", "span.city")));
        locations.setEntities(List.of(orgCard));
        props.setLocations(locations);

        ExtractorRules organizations = new ExtractorRules();
        organizations.setFields(new LinkedHashMap<>(Map.of("name", "h1", "phone", "span.phone")));
        organizations.setListFields(new LinkedHashMap<>(Map.of("services", "li.service")));
        organizations.setRequired(List.of("name"));
        props.setOrganizations(organizations);

        ExtractorRules members = new ExtractorRules();
        members.setEntities(List.of(new ExtractorRules.EntityRule("person", "li.member", null, null)));
        props.setMembers(members);

        ExtractorRules persons = new ExtractorRules();
        persons.setFields(new LinkedHashMap<>(Map.of("name", "h1", "title", "span.title")));
        persons.setGroups(new LinkedHashMap<>(Map.of("qualifications", new ExtractorRules.GroupRule("tr.qualification",
                new LinkedHashMap<>(Map.of("degree", "td.degree", "institute", "td.institute"))))));
        props.setPersons(persons);
        return props;
    }

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore();
        opened = StaticPageRenderer.openedList();
        service = new PipelineService(store, properties(), StaticPageRenderer.factory(site(), opened), new MutableClock());
    }

    private EntityRecord get(EntityType type, String key) {
        return service.getRepository().find(type, key).orElseThrow(() -> new AssertionError(type + " " + key + " missing"));
    }

    @Test
    void fullRun_walksEveryStage() {
        List<StageReport> reports = service.run(PipelineRequest.all());

        assertThat(reports).extracting(StageReport::name).containsExactly(
                "discover-locations", "collect-organizations", "enrich-organizations", "collect-members", "enrich-persons");

        EntityRecord source = get(EntityType.SOURCE, SOURCE);
        assertThat(source.getStage()).isEqualTo(EntityStage.SCRAPED);
        assertThat(((Number) source.getPayload().get("listingPages")).intValue()).isEqualTo(2);
        assertThat(reports.get(0).count(WorkerStats.INSERTED)).isEqualTo(3);

        assertThat(get(EntityType.LOCATION, CA).getStage()).isEqualTo(EntityStage.SCRAPED);
        assertThat(get(EntityType.LOCATION, TX).getStage()).isEqualTo(EntityStage.SCRAPED);
        EntityRecord ny = get(EntityType.LOCATION, NY);
        assertThat(ny.getStage()).isEqualTo(EntityStage.PENDING);
        assertThat(ny.getRetryCount()).isEqualTo(1);
        assertThat(ny.getLastError()).contains("404");
        assertThat(ny.getPayload()).containsEntry("name", "New York").containsEntry("source", SOURCE);
        assertThat(reports.get(1).count(WorkerStats.ERRORS)).isEqualTo(1);

        EntityRecord org = get(EntityType.ORGANIZATION, ORG);
        assertThat(org.getStage()).isEqualTo(EntityStage.MEMBERS_COLLECTED);
        assertThat(org.getPayload())
                .containsEntry("name", "Heart Clinic")
                .containsEntry("phone", "555-0100")
                .containsEntry("city", "Los Angeles")
                .containsEntry("location", CA)
                .containsEntry("services", List.of("Cardiology", "Imaging"));
        assertThat(((Number) org.getPayload().get("memberCount")).intValue()).isEqualTo(2);

        List<?> members = list(org, "members");
        assertThat(members).hasSize(2);
        assertThat(entry(members, 0)).containsEntry("url", ANN).containsEntry("name", "Dr. Ann Lee")
                .containsEntry("title", "Cardiologist");
        assertThat(entry(members, 1)).containsEntry("url", BOB).containsEntry("title", "Nurse");

        EntityRecord ann = get(EntityType.PERSON, ANN);
        assertThat(ann.getStage()).isEqualTo(EntityStage.PROCESSED);
        assertThat(ann.getPayload()).containsEntry("organization", ORG).containsEntry("title", "Cardiologist");
        assertThat(ann.getPayload().get("qualifications"))
                .isEqualTo(List.of(Map.of("degree", "MD", "institute", "State University")));
        assertThat(entry(list(ann, "affiliations"), 0)).containsEntry("url", ORG).containsEntry("name", "Heart Clinic");
        assertThat(get(EntityType.PERSON, BOB).getStage()).isEqualTo(EntityStage.PROCESSED);
    }

    @Test
    void memberSeenOnAnotherOrganization_keepsItsRicherRecord() {
        service.run(PipelineRequest.all());
        Map<String, String> pages = site();
        pages.put(OTHER, html("<h1>Other Practice</h1>"
                + "<ul class='members'><li class='member'><a href='/people/ann'>Ann</a></li></ul>"));
        PipelineService next = new PipelineService(store, properties(), StaticPageRenderer.factory(pages, opened), new MutableClock());
        next.getRepository().insertIfAbsent(EntityType.ORGANIZATION, OTHER, Map.of("name", "Other Practice"));
        next.getRepository().advance(EntityType.ORGANIZATION, OTHER, EntityStage.ENRICHED, Map.of());

        StageReport report = next.run(new PipelineRequest(3, 0, 1, true, false, null)).get(0);

        assertThat(report.selected()).isEqualTo(1);
        assertThat(report.count(WorkerStats.INSERTED)).isZero();
        assertThat(report.count(WorkerStats.SKIPPED)).isEqualTo(1);
        EntityRecord ann = get(EntityType.PERSON, ANN);
        assertThat(ann.getStage()).isEqualTo(EntityStage.PROCESSED);
        assertThat(ann.getPayload()).containsEntry("name", "Dr. Ann Lee").containsEntry("organization", ORG);
        List<?> affiliations = list(ann, "affiliations");
        assertThat(affiliations).hasSize(2);
        assertThat(entry(affiliations, 0)).containsEntry("url", ORG);
        assertThat(entry(affiliations, 1)).containsEntry("url", OTHER).containsEntry("name", "Other Practice");
    }

    @Test
    void profileAffiliations_createAndLinkEveryOrganization() {
        Map<String, String> pages = site();
        pages.put(ANN, html("<h1>Dr. Ann Lee</h1><span class='title'>Cardiologist</span>"
                + "<ul class='affiliations'><li><a href='/orgs/heart-clinic'>Heart Clinic</a></li>"
                + "<li><a href='/orgs/city-hospital'>City Hospital</a></li></ul>"));
        PipelineProperties props = properties();
        props.getPersons().setEntities(List.of(new ExtractorRules.EntityRule("organization", "ul.affiliations li", null, null)));
        service = new PipelineService(store, props, StaticPageRenderer.factory(pages, opened), new MutableClock());

        List<StageReport> reports = service.run(PipelineRequest.all());

        assertThat(reports.get(4).count(WorkerStats.INSERTED)).isEqualTo(1);
        EntityRecord city = get(EntityType.ORGANIZATION, CITY);
        assertThat(city.getStage()).isEqualTo(EntityStage.PENDING);
        assertThat(city.getPayload()).containsEntry("name", "City Hospital");
        assertThat(list(city, "members")).hasSize(1);
        assertThat(entry(list(city, "members"), 0)).containsEntry("url", ANN).containsEntry("name", "Dr. Ann Lee")
                .containsEntry("title", "Cardiologist");

        List<?> heartClinicMembers = list(get(EntityType.ORGANIZATION, ORG), "members");
        assertThat(heartClinicMembers).hasSize(2);
        assertThat(entry(heartClinicMembers, 0)).containsEntry("url", ANN).containsEntry("name", "Dr. Ann Lee");

        List<?> affiliations = list(get(EntityType.PERSON, ANN), "affiliations");
        assertThat(affiliations).hasSize(2);
        assertThat(entry(affiliations, 0)).containsEntry("url", ORG);
        assertThat(entry(affiliations, 1)).containsEntry("url", CITY).containsEntry("name", "City Hospital");
    }

    @Test
    void resumedRun_onlyRetriesUnfinishedEntities() {
        service.run(PipelineRequest.all());
        opened.clear();

        List<StageReport> again = service.run(new PipelineRequest(null, 0, 0, true, false, null));

        assertThat(again).extracting(StageReport::selected).containsExactly(0, 1, 0, 0, 0);
        assertThat(opened).containsExactly(NY);
        assertThat(get(EntityType.LOCATION, NY).getRetryCount()).isEqualTo(2);
        assertThat(get(EntityType.ORGANIZATION, ORG).getStage()).isEqualTo(EntityStage.MEMBERS_COLLECTED);
    }

    @Test
    void singleStageRun_leavesLaterStagesAlone() {
        List<StageReport> reports = service.run(new PipelineRequest(0, 0, 1, false, false, null));

        assertThat(reports).hasSize(1);
        assertThat(store.count(EntityType.LOCATION.collection(), StoreFilter.all())).isEqualTo(3);
        assertThat(service.getRepository().countByStage(EntityType.LOCATION)).containsEntry(EntityStage.PENDING, 3L);
        assertThat(store.count(StoreCollections.ORGANIZATIONS, StoreFilter.all())).isZero();
    }

    @Test
    void failingEntity_isNotSelectedOnceRetriesAreUsedUp() {
        service.run(PipelineRequest.all());
        PipelineRequest stage1 = new PipelineRequest(1, 0, 1, true, false, null);
        service.run(stage1);
        service.run(stage1);

        EntityRecord ny = get(EntityType.LOCATION, NY);
        assertThat(ny.getRetryCount()).isEqualTo(3);
        assertThat(ny.isFailed()).isTrue();
        assertThat(service.run(stage1).get(0).selected()).isZero();
    }

    @Test
    void leasedRun_releasesEveryLease() {
        service.run(new PipelineRequest(null, 0, 2, false, true, "instance-test"));

        assertThat(get(EntityType.PERSON, ANN).getStage()).isEqualTo(EntityStage.PROCESSED);
        assertThat(store.count(StoreCollections.LOCKS, StoreFilter.all())).isZero();
    }

    @Test
    void seed_ignoresInvalidAndDuplicateUrls() {
        assertThat(service.seed(List.of(SOURCE, SOURCE + "/", "not a url"))).isEqualTo(1);
    }

    @Test
    void unknownStage_isRejected() {
        assertThatThrownBy(() -> service.run(new PipelineRequest(7, 0, 0, false, false, null)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown stage 7");
    }

    private static List<?> list(EntityRecord record, String field) {
        Object value = record.getPayload().get(field);
        assertThat(value).as(field).isInstanceOf(List.class);
        return (List<?>) value;
    }

    private static Map<String, Object> entry(List<?> list, int index) {
        return Documents.deepCopy((Map<?, ?>) list.get(index));
    }
}

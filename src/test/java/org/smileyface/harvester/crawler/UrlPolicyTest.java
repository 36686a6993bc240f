package org.smileyface.harvester.crawler;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class UrlPolicyTest {

    private CrawlerProperties properties;

    @BeforeEach
    void setUp() {
        properties = new CrawlerProperties();
        properties.setStartUrls(List.of("https://www.example.com/"));
    }

    @Test
    void allowedDomainsDefaultToStartUrlDomainsAndTheirSubdomains() {
        UrlPolicy policy = new UrlPolicy(properties);

        assertThat(policy.getAllowedDomains()).containsExactly("example.com");
        assertThat(policy.accepts("https://example.com/about")).isTrue();
        assertThat(policy.accepts("https://docs.example.com/guide")).isTrue();
        assertThat(policy.accepts("https://other.org/")).isFalse();
    }

    @Test
    void explicitAllowedDomainsReplaceStartUrlDomains() {
        properties.setAllowedDomains(List.of("other.org"));
        UrlPolicy policy = new UrlPolicy(properties);

        assertThat(policy.accepts("https://other.org/x")).isTrue();
        assertThat(policy.accepts("https://example.com/x")).isFalse();
    }

    @Test
    void rejectsExcludedExtensionsAndPaths() {
        UrlPolicy policy = new UrlPolicy(properties);

        assertThat(policy.accepts("https://example.com/report.PDF")).isFalse();
        assertThat(policy.accepts("https://example.com/img/logo.png")).isFalse();
        assertThat(policy.accepts("https://example.com/feed")).isFalse();
        assertThat(policy.accepts("https://example.com/api/v1/items")).isFalse();
        assertThat(policy.accepts("https://example.com/blog/post-1")).isTrue();
    }

    @Test
    void excludePatternsWinOverIncludePatterns() {
        properties.setIncludeUrlPatterns(List.of("/doctors/"));
        properties.setExcludeUrlPatterns(List.of("/doctors/archive", "[invalid"));
        UrlPolicy policy = new UrlPolicy(properties);

        assertThat(policy.accepts("https://example.com/doctors/ann")).isTrue();
        assertThat(policy.accepts("https://example.com/doctors/archive/old")).isFalse();
        assertThat(policy.accepts("https://example.com/clinics")).isFalse();
    }

    @Test
    void rejectsNullAndHostlessUrls() {
        UrlPolicy policy = new UrlPolicy(properties);

        assertThat(policy.accepts(null)).isFalse();
        assertThat(policy.accepts("relative/path")).isFalse();
    }
}
